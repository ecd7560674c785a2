package com.gdin.inspection.erpvector.integrity.json;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON 字段的键 -> 目标模型记录号 映射配置，例如 analytic_distribution {"5029": 100}。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JsonFkMapping {
    private String sourceModel;
    private String fieldName;
    private JsonFieldClass mappingType;
    private String keyTargetModel;
    private Integer keyTargetModelId;
    /** record_id / code / string */
    private String keyType;
    /** percentage / amount / count / mixed */
    private String valueType;
    private String description;

    public String key() {
        return sourceModel + ":" + fieldName;
    }
}
