package com.gdin.inspection.erpvector.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.embedding")
@Component
public class EmbeddingProperties implements Serializable {
    private String baseUrl = "http://localhost:11434/";
    private String modelName = "quentinz/bge-large-zh-v1.5:latest";
    private Integer timeoutSeconds = 120;
    /** 文档/查询两种模式的前缀，模型不区分时留空 */
    private String documentPrefix = "";
    private String queryPrefix = "";
    private Integer batchSize = 32;
}
