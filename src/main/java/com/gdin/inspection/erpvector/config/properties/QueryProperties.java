package com.gdin.inspection.erpvector.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.query")
@Component
public class QueryProperties implements Serializable {
    private Integer maxRecords = 100_000;
    private Integer pageSize = 1000;
    private Integer defaultScrollLimit = 50;
    private Long timeoutMillis = 60_000L;
    private Integer logQueueCapacity = 1000;
    /** 为空时只写日志不落盘 */
    private String logFile = "data/query_log.jsonl";
}
