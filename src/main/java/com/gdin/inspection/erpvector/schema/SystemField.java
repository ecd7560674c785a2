package com.gdin.inspection.erpvector.schema;

import com.gdin.inspection.erpvector.filter.FilterOperator;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.gdin.inspection.erpvector.filter.FilterOperator.*;

/**
 * 存储层字段，与业务模型无关，各自有固定的操作符约束。
 */
@Getter
public enum SystemField {
    POINT_ID("point_id", FieldType.KEYWORD, EnumSet.of(EQ, NEQ, CONTAINS, IN)),
    POINT_TYPE("point_type", FieldType.KEYWORD, EnumSet.of(EQ, NEQ, IN)),
    SYNC_TIMESTAMP("sync_timestamp", FieldType.DATETIME, EnumSet.of(EQ, GT, GTE, LT, LTE)),
    RECORD_ID("record_id", FieldType.INTEGER, EnumSet.of(EQ, NEQ, GT, GTE, LT, LTE, IN)),
    MODEL_ID("model_id", FieldType.INTEGER, EnumSet.of(EQ, NEQ, IN)),
    MODEL_NAME("model_name", FieldType.KEYWORD, EnumSet.of(EQ, NEQ, CONTAINS, IN)),
    VECTOR_TEXT("vector_text", FieldType.TEXT, EnumSet.of(CONTAINS));

    private final String fieldName;
    private final FieldType type;
    private final Set<FilterOperator> allowedOperators;

    SystemField(String fieldName, FieldType type, Set<FilterOperator> allowedOperators) {
        this.fieldName = fieldName;
        this.type = type;
        this.allowedOperators = Collections.unmodifiableSet(allowedOperators);
    }

    public static SystemField of(String name) {
        for (SystemField f : values()) {
            if (f.fieldName.equals(name)) return f;
        }
        return null;
    }
}
