package com.gdin.inspection.erpvector.query;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "聚合定义")
public class Aggregation implements Serializable {
    @Schema(description = "聚合字段，count 时可为 id", example = "debit")
    private String field;
    @Schema(description = "sum, count, avg, min, max", example = "sum")
    private AggregationOp op;
    @Schema(description = "结果别名", example = "total_debit")
    private String alias;

    public static Aggregation of(String field, AggregationOp op, String alias) {
        return new Aggregation(field, op, alias);
    }

    public String resolvedAlias() {
        return alias != null ? alias : (op == null ? "?" : op.code()) + "_" + field;
    }
}
