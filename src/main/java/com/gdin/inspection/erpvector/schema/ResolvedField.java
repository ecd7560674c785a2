package com.gdin.inspection.erpvector.schema;

import com.gdin.inspection.erpvector.filter.FilterOperator;
import lombok.Value;

import java.util.Set;

/**
 * 过滤条件中的字段名解析后的结果：实际的 payload 键、生效类型以及来源。
 * 例如 account_id_id 解析为 many2one 字段 account_id 的整数 id。
 */
@Value
public class ResolvedField {
    String requestedName;
    String payloadKey;
    FieldType effectiveType;
    /** 业务字段来源，系统字段时为空 */
    FieldDescriptor source;
    SystemField systemField;

    public boolean isSystem() {
        return systemField != null;
    }

    public Set<FilterOperator> legalOperators() {
        return isSystem() ? systemField.getAllowedOperators() : effectiveType.legalOperators();
    }

    public static ResolvedField system(SystemField field) {
        return new ResolvedField(field.getFieldName(), field.getFieldName(), field.getType(), null, field);
    }

    public static ResolvedField business(String requested, String payloadKey, FieldType type, FieldDescriptor source) {
        return new ResolvedField(requested, payloadKey, type, source, null);
    }
}
