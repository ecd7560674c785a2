package com.gdin.inspection.erpvector.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.sync")
@Component
public class SyncProperties implements Serializable {
    private Integer batchSize = 200;
    private Integer workers = 3;
    /** 抓取与处理之间允许积压的批次数 */
    private Integer maxInFlightBatches = 4;
    private Integer maxAttempts = 3;
    private Long backoffMillis = 500L;
    private Integer upsertChunkSize = 100;
    /** fix-orphans 每个目标模型最多同步的记录数 */
    private Integer repairSyncLimit = 5000;
    private String metadataFile = "data/sync_metadata.json";
    private String deadLetterFile = "data/dlq.jsonl";
}
