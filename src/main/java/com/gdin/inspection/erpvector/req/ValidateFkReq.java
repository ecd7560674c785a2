package com.gdin.inspection.erpvector.req;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

@NoArgsConstructor
@SuperBuilder
@Data
@Schema(description = "外键完整性校验请求")
public class ValidateFkReq {

    @Schema(description = "只校验这些模型，为空校验全部")
    private List<String> models;

    @Schema(description = "按当前指针重建 graph edge 点位")
    private boolean fix;

    @Schema(description = "比对数据指针与 graph edge")
    private boolean bidirectional;

    @Schema(description = "统计外键基数")
    private boolean extractPatterns;

    @Schema(description = "写入校验历史")
    private boolean trackHistory;

    @Schema(description = "从 ERP 补拉缺失目标")
    private boolean autoSync;

    @Schema(description = "每个模型最多返回的孤儿明细", example = "100")
    private Integer orphanLimit;

    @Schema(description = "超时毫秒数")
    private Long timeoutMillis;
}
