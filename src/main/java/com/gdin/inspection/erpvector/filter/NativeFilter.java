package com.gdin.inspection.erpvector.filter;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 存储层可以直接执行的过滤条件，子句之间为 AND。不可变。
 */
@EqualsAndHashCode
public class NativeFilter {
    private static final NativeFilter EMPTY = new NativeFilter(List.of());

    private final List<FilterClause> clauses;

    private NativeFilter(List<FilterClause> clauses) {
        this.clauses = Collections.unmodifiableList(clauses);
    }

    public static NativeFilter empty() {
        return EMPTY;
    }

    public static NativeFilter of(FilterClause... clauses) {
        return new NativeFilter(List.of(clauses));
    }

    public static NativeFilter of(List<FilterClause> clauses) {
        return new NativeFilter(new ArrayList<>(clauses));
    }

    public NativeFilter with(FilterClause clause) {
        List<FilterClause> next = new ArrayList<>(clauses);
        next.add(clause);
        return new NativeFilter(next);
    }

    public List<FilterClause> getClauses() {
        return clauses;
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public boolean hasClauseOn(String field) {
        return clauses.stream().anyMatch(c -> c.getField().equals(field));
    }

    public boolean matches(Map<String, Object> payload) {
        for (FilterClause clause : clauses) {
            if (!clause.matches(payload)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return clauses.toString();
    }
}
