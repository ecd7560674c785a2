package com.gdin.inspection.erpvector.req;

import com.gdin.inspection.erpvector.filter.FilterCondition;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

@NoArgsConstructor
@SuperBuilder
@Data
@Schema(description = "过滤条件校验请求")
public class ValidateFiltersReq {

    @NotBlank
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "ERP 模型名", example = "account.move.line")
    private String model;

    @Builder.Default
    @Schema(description = "过滤条件，条件之间为 AND")
    private List<FilterCondition> filters = new ArrayList<>();
}
