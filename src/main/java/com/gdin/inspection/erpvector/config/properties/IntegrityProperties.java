package com.gdin.inspection.erpvector.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.integrity")
@Component
public class IntegrityProperties implements Serializable {
    private Integer workers = 4;
    private Integer orphanLimit = 100;
    private Integer existenceBatchSize = 500;
    private Integer scanPageSize = 1000;
    /** 自动修复时每次补拉的目标数 */
    private Integer repairBatchSize = 500;
    private String historyFile = "data/validation_history.jsonl";
    /** 每个模型保留的趋势条数 */
    private Integer historyKeep = 10;
    private String fkConfigFile = "data/json_fk_config.json";
}
