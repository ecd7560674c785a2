package com.gdin.inspection.erpvector.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.milvus")
@Component
public class MilvusProperties implements Serializable {
    private String uri;
    private String token;
    /** 所有模型共用一个 collection */
    private String collectionName = "erp_points";
    private Integer dimension = 1024;
    private Integer insertBatchSize = 1000;
    private Integer queryBatchSize = 1000;
    private Integer connectTimeoutSeconds = 10;
}
