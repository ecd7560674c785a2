package com.gdin.inspection.erpvector.filter;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "过滤条件")
public class FilterCondition implements Serializable {
    @Schema(description = "字段名，可为业务字段、系统字段或外键派生字段", example = "account_id_id")
    private String field;
    @Schema(description = "操作符: eq, neq, gt, gte, lt, lte, in, contains", example = "eq")
    private FilterOperator op;
    @Schema(description = "比较值，in 时必须为数组")
    private Object value;

    public static FilterCondition of(String field, FilterOperator op, Object value) {
        return new FilterCondition(field, op, value);
    }

    @Override
    public String toString() {
        return field + " " + (op == null ? "?" : op.code()) + " " + value;
    }
}
