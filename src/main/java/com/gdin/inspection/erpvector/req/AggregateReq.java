package com.gdin.inspection.erpvector.req;

import com.gdin.inspection.erpvector.query.Aggregation;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

@NoArgsConstructor
@SuperBuilder
@Data
@EqualsAndHashCode(callSuper = true)
@Schema(description = "聚合请求")
public class AggregateReq extends ValidateFiltersReq {

    @NotEmpty
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "聚合定义")
    private List<Aggregation> aggregations;

    @Schema(description = "分组字段", example = "[\"account_id\"]")
    private List<String> groupBy;

    @Schema(description = "最多参与聚合的记录数，超出时结果标记 truncated", example = "100000")
    private Integer maxRecords;

    @Schema(description = "超时毫秒数，超时返回部分结果", example = "60000")
    private Long timeoutMillis;
}
