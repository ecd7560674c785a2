package com.gdin.inspection.erpvector.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AggregationOp {
    SUM, COUNT, AVG, MIN, MAX;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AggregationOp parse(String raw) {
        if (raw == null) return null;
        for (AggregationOp op : values()) {
            if (op.code().equalsIgnoreCase(raw.trim())) return op;
        }
        return null;
    }
}
