package com.gdin.inspection.erpvector.req;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@NoArgsConstructor
@SuperBuilder
@Data
@Schema(description = "JSON 外键字段识别请求")
public class DetectJsonFkReq {

    @Schema(description = "只看该模型")
    private String model;

    @Schema(description = "最低置信度", example = "0.0")
    private double minConfidence;

    @Schema(description = "每个字段抽样条数", example = "5")
    private Integer sampleSize;

    @Schema(description = "把达到 saveThreshold 的候选写入配置")
    private boolean save;

    @Schema(description = "写入配置的置信度阈值", example = "0.85")
    private Double saveThreshold;

    @Schema(description = "包括已配置的字段")
    private boolean includeExisting;
}
