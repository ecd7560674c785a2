package com.gdin.inspection.erpvector.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FilterOperator {
    EQ, NEQ, GT, GTE, LT, LTE, IN, CONTAINS;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FilterOperator parse(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "=":
            case "==": return EQ;
            case "!=": return NEQ;
            case ">": return GT;
            case ">=": return GTE;
            case "<": return LT;
            case "<=": return LTE;
            case "ilike":
            case "like": return CONTAINS;
            default:
                for (FilterOperator op : values()) {
                    if (op.code().equals(v)) return op;
                }
                return null;
        }
    }

    public boolean isRange() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }
}
