package com.gdin.inspection.erpvector.store;

import com.gdin.inspection.erpvector.filter.FilterClause;
import com.gdin.inspection.erpvector.filter.NativeFilter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * NativeFilter -> Milvus 布尔表达式。
 * 业务字段写在动态字段里，表达式中可以直接用键名引用。
 */
public class MilvusFilterRenderer {
    /** 空过滤时使用的恒真表达式 */
    public static final String MATCH_ALL = "point_id != \"\"";

    public static String render(NativeFilter filter) {
        if (filter == null || filter.isEmpty()) return MATCH_ALL;
        List<String> parts = new ArrayList<>();
        for (FilterClause clause : filter.getClauses()) parts.add(renderClause(clause));
        return parts.size() == 1 ? parts.get(0) : parts.stream().map(p -> "(" + p + ")").collect(Collectors.joining(" and "));
    }

    public static String renderAfter(NativeFilter filter, String cursor) {
        String expr = render(filter);
        if (cursor == null) return expr;
        return "(" + expr + ") and " + StorePoint.POINT_ID + " > " + literal(cursor);
    }

    static String renderClause(FilterClause clause) {
        String field = clause.getField();
        Object value = clause.getValue();
        if (clause.isMultiValued()) {
            switch (clause.getOp()) {
                case EQ:
                    return "json_contains(" + field + ", " + literal(value) + ")";
                case IN:
                    return "json_contains_any(" + field + ", " + literal(value) + ")";
                default:
                    break;
            }
        }
        switch (clause.getOp()) {
            case EQ: return field + " == " + literal(value);
            case NEQ: return field + " != " + literal(value);
            case GT: return field + " > " + literal(value);
            case GTE: return field + " >= " + literal(value);
            case LT: return field + " < " + literal(value);
            case LTE: return field + " <= " + literal(value);
            case IN: return field + " in " + literal(value);
            case CONTAINS: return field + " like \"%" + escape(escapeLike(String.valueOf(value))) + "%\"";
            default: throw new IllegalArgumentException("unsupported operator " + clause.getOp());
        }
    }

    static String literal(Object value) {
        if (value == null) return "\"\"";
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().map(MilvusFilterRenderer::literal)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return "\"" + escape(value.toString()) + "\"";
    }

    /**
     * like 模式里 % 和 _ 是通配符，按字面匹配需要转义
     */
    static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
