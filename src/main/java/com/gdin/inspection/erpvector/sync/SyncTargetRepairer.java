package com.gdin.inspection.erpvector.sync;

import com.gdin.inspection.erpvector.integrity.TargetRepairer;
import com.gdin.inspection.erpvector.query.OperationControl;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 用同步服务按记录号补拉缺失目标。
 */
@Slf4j
public class SyncTargetRepairer implements TargetRepairer {
    private final DataSyncService syncService;

    public SyncTargetRepairer(DataSyncService syncService) {
        this.syncService = syncService;
    }

    @Override
    public long fetchAndUpsert(String targetModel, List<Long> recordIds, OperationControl control) {
        SyncResult result = syncService.syncModel(targetModel,
                SyncOptions.builder().specificIds(recordIds).updateGraph(true).build(), control);
        log.debug("repair sync {}: requested={}, uploaded={}, failed={}, incomplete={}",
                targetModel, recordIds.size(), result.getUploaded(), result.getFailed(), result.isIncomplete());
        return result.getUploaded();
    }
}
