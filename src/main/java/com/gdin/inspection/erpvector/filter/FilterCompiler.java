package com.gdin.inspection.erpvector.filter;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.erpvector.schema.FieldType;
import com.gdin.inspection.erpvector.schema.ModelLookup;
import com.gdin.inspection.erpvector.schema.ResolvedField;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.schema.SystemField;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 把结构化过滤条件编译成 {原生过滤, 残余谓词}。
 *
 * 同一个 collection 里混存所有模型，因此总是先加上 model_name == model。
 * 字段已建索引且类型支持该操作符时下推给存储，否则留在内存里过滤。
 */
@Slf4j
public class FilterCompiler {
    private final SchemaCatalog catalog;
    /** 存储层已建 payload 索引的字段（系统字段默认都有索引） */
    private final Set<String> indexedFields;

    public FilterCompiler(SchemaCatalog catalog, Collection<String> indexedFields) {
        this.catalog = catalog;
        this.indexedFields = indexedFields == null ? Set.of() : Set.copyOf(indexedFields);
    }

    public List<ValidationError> validateFilters(String model, List<FilterCondition> conditions) {
        List<ValidationError> errors = new ArrayList<>();
        ModelLookup lookup = catalog.lookupModel(model);
        if (!lookup.isFound()) {
            errors.add(ValidationError.withSuggestions(null, null,
                    "model '" + model + "' not found", lookup.getSuggestions()));
            return errors;
        }
        if (CollectionUtil.isEmpty(conditions)) return errors;

        for (FilterCondition condition : conditions) {
            ValidationError error = validateOne(model, condition);
            if (error != null) errors.add(error);
        }
        return errors;
    }

    public CompiledFilter compile(String model, List<FilterCondition> conditions) {
        List<ValidationError> errors = validateFilters(model, conditions);
        if (!errors.isEmpty()) throw new FilterValidationException(errors);

        List<FilterClause> clauses = new ArrayList<>();
        clauses.add(FilterClause.eq(SystemField.MODEL_NAME.getFieldName(), model));
        List<ResidualPredicate> residual = new ArrayList<>();

        if (conditions != null) {
            for (FilterCondition condition : conditions) {
                // 校验已通过，这里一定能解析
                ResolvedField field = catalog.resolveField(model, condition.getField()).orElseThrow();
                Object value = normalizeValue(condition.getValue());
                if (isNative(field, condition.getOp())) {
                    clauses.add(new FilterClause(field.getPayloadKey(), condition.getOp(), value,
                            field.getEffectiveType().isToMany()));
                } else {
                    residual.add(new ResidualPredicate(condition.getField(), field.getPayloadKey(), condition.getOp(), value));
                }
            }
        }
        if (!residual.isEmpty()) {
            log.debug("model {}: {} native clause(s), residual on {}", model, clauses.size(),
                    residual.stream().map(ResidualPredicate::getField).collect(Collectors.toList()));
        }
        return new CompiledFilter(model, NativeFilter.of(clauses), Collections.unmodifiableList(residual));
    }

    public boolean isIndexed(String payloadKey) {
        return SystemField.of(payloadKey) != null || indexedFields.contains(payloadKey);
    }

    private ValidationError validateOne(String model, FilterCondition condition) {
        if (condition == null || StrUtil.isBlank(condition.getField())) {
            return ValidationError.of(null, condition == null ? null : condition.getOp(), "field is required");
        }
        String name = condition.getField();
        FilterOperator op = condition.getOp();
        if (op == null) {
            return ValidationError.of(name, null, "operator is missing or unknown for field '" + name + "'");
        }

        Optional<ResolvedField> resolved = catalog.resolveField(model, name);
        if (resolved.isEmpty()) {
            return ValidationError.withSuggestions(name, op,
                    "field '" + name + "' not found on model '" + model + "'",
                    catalog.suggestSimilar(model, name));
        }

        Set<FilterOperator> legal = resolved.get().legalOperators();
        if (!legal.contains(op)) {
            String allowed = legal.stream().map(FilterOperator::code).sorted().collect(Collectors.joining(", "));
            return ValidationError.of(name, op, "operator '" + op.code() + "' is not allowed on field '" + name
                    + "' (allowed: " + (allowed.isEmpty() ? "none" : allowed) + ")");
        }

        Object value = condition.getValue();
        if (op == FilterOperator.IN && !isArray(value)) {
            return ValidationError.of(name, op, "operator 'in' requires an array value for field '" + name + "'");
        }
        if (op == FilterOperator.CONTAINS && !(value instanceof String)) {
            return ValidationError.of(name, op, "operator 'contains' requires a string value for field '" + name + "'");
        }
        if (op != FilterOperator.IN && isArray(value)) {
            return ValidationError.of(name, op, "operator '" + op.code() + "' does not accept an array value");
        }
        return null;
    }

    private boolean isNative(ResolvedField field, FilterOperator op) {
        // Milvus like 区分大小写，contains 统一走内存匹配
        if (op == FilterOperator.CONTAINS) return false;
        if (!isIndexed(field.getPayloadKey())) return false;
        FieldType type = field.getEffectiveType();
        if (type == FieldType.JSON || type == FieldType.BINARY || type == FieldType.UNKNOWN || type == FieldType.HTML) {
            return false;
        }
        if (op.isRange()) return type.isOrderable();
        return true;
    }

    private static boolean isArray(Object value) {
        return value instanceof Collection || (value != null && value.getClass().isArray());
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Object[]) return Arrays.asList((Object[]) value);
        return value;
    }
}
