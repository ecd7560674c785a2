package com.gdin.inspection.erpvector.req;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

@NoArgsConstructor
@SuperBuilder
@Data
@Schema(description = "模型同步请求")
public class SyncModelReq {

    @NotBlank
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "ERP 模型名", example = "account.move.line")
    private String model;

    @Schema(description = "每批记录数", example = "200")
    private Integer batchSize;

    @Schema(description = "只同步上次之后修改过的记录")
    private boolean incremental;

    @Schema(description = "同时刷新 graph edge 点位", example = "true")
    private Boolean updateGraph;

    @Schema(description = "只同步这些记录号")
    private List<Long> specificIds;

    @Schema(description = "最多同步条数")
    private Integer maxRecords;

    @Schema(description = "重试死信队列中的记录")
    private boolean retryFailed;

    @Schema(description = "超时毫秒数")
    private Long timeoutMillis;
}
