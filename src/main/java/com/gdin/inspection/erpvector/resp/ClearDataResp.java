package com.gdin.inspection.erpvector.resp;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@Schema(description = "清理结果")
public class ClearDataResp {
    private String model;
    private boolean dryRun;
    private long dataPoints;
    private long graphPoints;
    @Schema(description = "实际删除数，dryRun 时为 0，存储无法给出时为 -1")
    private long deleted;
}
