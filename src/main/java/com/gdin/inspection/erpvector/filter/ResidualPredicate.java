package com.gdin.inspection.erpvector.filter;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 需要在应用层内存中执行的过滤条件。
 */
@Value
public class ResidualPredicate {
    /** 请求中的字段名 */
    String field;
    /** 实际读取的 payload 键 */
    String payloadKey;
    FilterOperator op;
    Object value;

    public boolean test(Map<String, Object> payload) {
        return ValueMatcher.matches(payload.get(payloadKey), op, value);
    }

    public static boolean testAll(List<ResidualPredicate> predicates, Map<String, Object> payload) {
        if (predicates == null) return true;
        for (ResidualPredicate p : predicates) {
            if (!p.test(payload)) return false;
        }
        return true;
    }
}
