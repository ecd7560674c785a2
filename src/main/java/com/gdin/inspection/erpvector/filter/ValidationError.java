package com.gdin.inspection.erpvector.filter;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationError {
    String field;
    String op;
    String message;
    /** 可直接采纳的建议，例如相近字段名 */
    String suggestion;

    public static ValidationError of(String field, FilterOperator op, String message) {
        return new ValidationError(field, op == null ? null : op.code(), message, null);
    }

    public static ValidationError withSuggestions(String field, FilterOperator op, String message, List<String> candidates) {
        String suggestion = candidates == null || candidates.isEmpty() ? null : String.join(", ", candidates);
        return new ValidationError(field, op == null ? null : op.code(), message, suggestion);
    }

    @Override
    public String toString() {
        return suggestion == null ? message : message + " (did you mean: " + suggestion + ")";
    }
}
