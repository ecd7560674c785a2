package com.gdin.inspection.erpvector.integrity;

import com.gdin.inspection.erpvector.codec.PointAddressCodec;
import com.gdin.inspection.erpvector.config.properties.IntegrityProperties;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.store.InMemoryVectorStore;
import com.gdin.inspection.erpvector.support.TestPoints;
import com.gdin.inspection.erpvector.support.TestSchemas;
import com.gdin.inspection.erpvector.util.RetryUtil;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OrphanRepairServiceTest {
    private final SchemaCatalog catalog = TestSchemas.catalog();
    private final InMemoryVectorStore store = new InMemoryVectorStore();

    @Test
    void fetchesMissingTargetsGroupedByModel() {
        store.upsert(List.of(
                TestPoints.moveLinePoint(catalog, 1, 10, 7L, List.of(1L)),
                TestPoints.moveLinePoint(catalog, 2, 20, 8L, null),
                TestPoints.moveLinePoint(catalog, 3, 30, 9L, List.of(1L, 2L))), 10);

        List<String> calls = new ArrayList<>();
        TargetRepairer repairer = (model, ids, control) -> {
            calls.add(model + ids);
            int modelId = catalog.resolveModelId(model).orElseThrow();
            for (Long id : ids) store.upsert(List.of(TestPoints.simplePoint(model, modelId, id)), 1);
            return ids.size();
        };
        RepairCoordinator coordinator = new RepairCoordinator(repairer, store, 100, RetryUtil.Policy.none());
        FkGraphIntegrityEngine engine = new FkGraphIntegrityEngine(catalog, store, coordinator, null,
                new IntegrityProperties(), RetryUtil.Policy.none());
        OrphanRepairService service = new OrphanRepairService(engine, coordinator, 2);

        FixOrphansResult result = service.fixOrphans(List.of("account.move.line"), null);

        assertEquals(6, result.getOrphansBefore());
        assertEquals(List.of("account.account[7, 8]", "account.tax[1, 2]"), calls);
        FixOrphansResult.TargetSummary account = result.getTargets().get(0);
        assertEquals("account.account", account.getTargetModel());
        assertEquals(3, account.getMissing());
        assertEquals(2, account.getSynced());
        assertEquals(1, account.getDeferred());
        // 账户 9 超出单模型上限，留到下一轮
        assertEquals(1, result.getOrphansAfter());
        assertEquals(PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 9),
                result.getAfter().model("account.move.line").getOrphans().get(0).getTargetId());
        assertFalse(result.isIncomplete());
    }
}
