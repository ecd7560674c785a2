package com.gdin.inspection.erpvector.req;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

@NoArgsConstructor
@SuperBuilder
@Data
@Schema(description = "孤儿修复请求")
public class FixOrphansReq {

    @Schema(description = "只处理这些模型，为空处理全部")
    private List<String> models;

    @Schema(description = "超时毫秒数", example = "600000")
    private Long timeoutMillis;
}
