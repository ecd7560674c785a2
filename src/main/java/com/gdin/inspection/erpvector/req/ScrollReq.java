package com.gdin.inspection.erpvector.req;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@NoArgsConstructor
@SuperBuilder
@Data
@EqualsAndHashCode(callSuper = true)
@Schema(description = "分页读取记录请求")
public class ScrollReq extends ValidateFiltersReq {

    @Schema(description = "每页条数", example = "50")
    private Integer limit;

    @Schema(description = "上一页返回的 nextCursor")
    private String cursor;

    @Schema(description = "是否返回向量", example = "false")
    private boolean withVector;

    @Schema(description = "超时毫秒数", example = "60000")
    private Long timeoutMillis;
}
