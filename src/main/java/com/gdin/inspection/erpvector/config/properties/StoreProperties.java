package com.gdin.inspection.erpvector.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "gdin.ai.store")
@Component
public class StoreProperties implements Serializable {
    /** milvus | memory */
    private String type = "milvus";
    /** 业务 payload 索引：字段名 -> keyword/integer/float/datetime/text/bool */
    private Map<String, String> indexedFields = new LinkedHashMap<>();
    /** schema 文件位置（schema-source=file 时使用） */
    private String schemaLocation = "classpath:schema/erp-schema.json";
    /** file | odoo */
    private String schemaSource = "file";
}
