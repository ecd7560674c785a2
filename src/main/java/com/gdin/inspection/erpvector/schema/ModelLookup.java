package com.gdin.inspection.erpvector.schema;

import lombok.Value;

import java.util.List;

/**
 * 模型查找结果。未找到时携带相近模型名，不抛异常。
 */
@Value
public class ModelLookup {
    String requested;
    ModelSchema schema;
    List<String> suggestions;

    public boolean isFound() {
        return schema != null;
    }

    public static ModelLookup found(String requested, ModelSchema schema) {
        return new ModelLookup(requested, schema, List.of());
    }

    public static ModelLookup notFound(String requested, List<String> suggestions) {
        return new ModelLookup(requested, null, suggestions);
    }

    public String message() {
        if (isFound()) return null;
        String msg = "model '" + requested + "' not found";
        return suggestions.isEmpty() ? msg : msg + ", did you mean: " + String.join(", ", suggestions);
    }
}
