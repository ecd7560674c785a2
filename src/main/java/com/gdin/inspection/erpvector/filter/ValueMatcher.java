package com.gdin.inspection.erpvector.filter;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Locale;

/**
 * payload 值比较规则，原生过滤的内存实现与残余过滤共用。
 * <ul>
 *     <li>值缺失一律不匹配</li>
 *     <li>两边都能转成数字时按数值比较，否则按字符串字典序</li>
 *     <li>布尔值统一成 true/false 再比较</li>
 *     <li>payload 值为列表时，eq/in/contains 任一元素命中即可，neq 要求所有元素都不相等</li>
 * </ul>
 */
public final class ValueMatcher {

    private ValueMatcher() {
    }

    public static boolean matches(Object actual, FilterOperator op, Object expected) {
        if (actual == null || op == null) return false;

        if (actual instanceof Collection) {
            Collection<?> values = (Collection<?>) actual;
            if (op == FilterOperator.NEQ) {
                for (Object v : values) {
                    if (looseEquals(v, expected)) return false;
                }
                return true;
            }
            for (Object v : values) {
                if (v != null && matchScalar(v, op, expected)) return true;
            }
            return false;
        }
        return matchScalar(actual, op, expected);
    }

    private static boolean matchScalar(Object actual, FilterOperator op, Object expected) {
        switch (op) {
            case EQ:
                return looseEquals(actual, expected);
            case NEQ:
                return !looseEquals(actual, expected);
            case IN:
                if (!(expected instanceof Collection)) return false;
                for (Object candidate : (Collection<?>) expected) {
                    if (looseEquals(actual, candidate)) return true;
                }
                return false;
            case CONTAINS:
                if (expected == null) return false;
                return String.valueOf(actual).toLowerCase(Locale.ROOT)
                        .contains(String.valueOf(expected).toLowerCase(Locale.ROOT));
            case GT:
                return compare(actual, expected) > 0;
            case GTE:
                return compare(actual, expected) >= 0;
            case LT:
                return compare(actual, expected) < 0;
            case LTE:
                return compare(actual, expected) <= 0;
            default:
                return false;
        }
    }

    public static boolean looseEquals(Object a, Object b) {
        if (a == null || b == null) return a == b;
        BigDecimal na = toNumber(a);
        BigDecimal nb = toNumber(b);
        if (na != null && nb != null) return na.compareTo(nb) == 0;
        return normalize(a).equals(normalize(b));
    }

    public static int compare(Object a, Object b) {
        if (b == null) return 1;
        BigDecimal na = toNumber(a);
        BigDecimal nb = toNumber(b);
        if (na != null && nb != null) return na.compareTo(nb);
        return normalize(a).compareTo(normalize(b));
    }

    /**
     * 转换为数值，无法转换返回 null。布尔值不视为数字。
     */
    public static BigDecimal toNumber(Object v) {
        if (v instanceof BigDecimal) return (BigDecimal) v;
        if (v instanceof Number) {
            double d = ((Number) v).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return v instanceof Double || v instanceof Float ? BigDecimal.valueOf(d) : new BigDecimal(v.toString());
        }
        if (v instanceof String) {
            String s = ((String) v).trim();
            if (s.isEmpty()) return null;
            char first = s.charAt(0);
            if (!(Character.isDigit(first) || first == '-' || first == '+' || first == '.')) return null;
            try {
                return new BigDecimal(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String normalize(Object v) {
        if (v instanceof Boolean) return ((Boolean) v) ? "true" : "false";
        String s = String.valueOf(v);
        if ("True".equals(s) || "TRUE".equals(s)) return "true";
        if ("False".equals(s) || "FALSE".equals(s)) return "false";
        return s;
    }
}
