package com.gdin.inspection.erpvector.filter;

import lombok.Value;

import java.util.Map;

/**
 * 下推到存储层的单个过滤子句，field 为实际的 payload 键。
 */
@Value
public class FilterClause {
    String field;
    FilterOperator op;
    Object value;
    /** payload 值为列表（to-many 关系） */
    boolean multiValued;

    public FilterClause(String field, FilterOperator op, Object value) {
        this(field, op, value, false);
    }

    public FilterClause(String field, FilterOperator op, Object value, boolean multiValued) {
        this.field = field;
        this.op = op;
        this.value = value;
        this.multiValued = multiValued;
    }

    public static FilterClause eq(String field, Object value) {
        return new FilterClause(field, FilterOperator.EQ, value);
    }

    public boolean matches(Map<String, Object> payload) {
        return ValueMatcher.matches(payload.get(field), op, value);
    }

    @Override
    public String toString() {
        return field + " " + op.code() + " " + value;
    }
}
