package com.gdin.inspection.erpvector.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
@Jacksonized
public class ModelSchema {
    @JsonProperty("model_id")
    int modelId;
    @JsonProperty("model_name")
    String modelName;
    @JsonProperty("primary_key_field_id")
    Long primaryKeyFieldId;
    @Builder.Default
    List<FieldDescriptor> fields = List.of();

    @JsonIgnore
    public List<FieldDescriptor> getFkFields() {
        return fields.stream().filter(FieldDescriptor::isForeignKey).collect(Collectors.toList());
    }
}
