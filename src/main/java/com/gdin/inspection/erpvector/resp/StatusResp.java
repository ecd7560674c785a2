package com.gdin.inspection.erpvector.resp;

import com.gdin.inspection.erpvector.integrity.ValidationHistoryEntry;
import com.gdin.inspection.erpvector.store.CollectionInfo;
import com.gdin.inspection.erpvector.sync.SyncMetadataStore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@Schema(description = "系统状态")
public class StatusResp {
    private CollectionInfo collection;
    @Schema(description = "各命名空间点位数：schema / data / graph")
    private Map<String, Long> pointCounts;
    private int schemaModels;
    private Map<String, SyncMetadataStore.ModelSyncState> lastSync;
    private long deadLetters;
    private ValidationHistoryEntry lastValidation;
}
