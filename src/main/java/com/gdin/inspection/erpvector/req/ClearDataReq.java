package com.gdin.inspection.erpvector.req;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@NoArgsConstructor
@SuperBuilder
@Data
@Schema(description = "清理数据请求，dryRun 与 confirm 至少一个为 true")
public class ClearDataReq {

    @Schema(description = "只清理该模型，为空清理全部数据与 graph 点位")
    private String model;

    @Schema(description = "只统计不删除")
    private boolean dryRun;

    @Schema(description = "确认删除")
    private boolean confirm;
}
