package com.gdin.inspection.erpvector.support;

import com.gdin.inspection.erpvector.codec.PointAddressCodec;
import com.gdin.inspection.erpvector.codec.PointNamespace;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.store.PointPayload;
import com.gdin.inspection.erpvector.store.StorePoint;
import com.gdin.inspection.erpvector.sync.PointBuilder;

import java.util.*;

public final class TestPoints {
    public static final String TS = "2024-06-01T00:00:00Z";

    private TestPoints() {
    }

    /**
     * 凭证行记录，ERP 返回格式
     */
    public static Map<String, Object> moveLine(long id, double debit, Long accountId, List<Long> taxIds) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", id);
        record.put("name", "line " + id);
        record.put("debit", debit);
        record.put("credit", 0.0);
        record.put("parent_state", id % 2 == 0 ? "posted" : "draft");
        record.put("date", "2024-0" + (1 + id % 9) + "-15");
        record.put("account_id", accountId == null ? false : List.of(accountId, "Account " + accountId));
        record.put("partner_id", false);
        record.put("tax_ids", taxIds == null ? List.of() : taxIds);
        return record;
    }

    public static StorePoint moveLinePoint(SchemaCatalog catalog, long id, double debit, Long accountId, List<Long> taxIds) {
        return new PointBuilder(catalog).buildDataPoint(catalog.getModel("account.move.line").orElseThrow(),
                moveLine(id, debit, accountId, taxIds), TS);
    }

    /** 只有 id 和名称的目标记录点位 */
    public static StorePoint simplePoint(String model, int modelId, long recordId) {
        PointPayload payload = PointPayload.builder()
                .pointType(PointNamespace.DATA_RECORD.getPointType())
                .modelName(model)
                .modelId(modelId)
                .recordId(recordId)
                .syncTimestamp(TS)
                .vectorText(model + " #" + recordId)
                .build();
        payload.putExtra("name", model + " " + recordId);
        return StorePoint.builder().id(PointAddressCodec.encodeData(modelId, recordId)).payload(payload).build();
    }
}
