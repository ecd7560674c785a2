package com.gdin.inspection.erpvector.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FieldDescriptor {
    /** ir.model.fields 的 id，用作 schema 点位的记录号 */
    @JsonProperty("field_id")
    Long fieldId;
    @JsonProperty("field_name")
    String fieldName;
    @JsonProperty("field_label")
    String fieldLabel;
    @JsonProperty("field_type")
    FieldType fieldType;
    @Builder.Default
    boolean stored = true;
    /** 外键目标模型名，非关系字段为空 */
    @JsonProperty("fk_target_model")
    String fkTargetModel;
    @JsonProperty("fk_target_model_id")
    Integer fkTargetModelId;

    @JsonIgnore
    public boolean isForeignKey() {
        return fieldType != null && fieldType.isRelational() && fkTargetModel != null;
    }

    /** 指针在 payload 中的键名 */
    @JsonIgnore
    public String pointerKey() {
        return fieldName + "_ptr";
    }
}
