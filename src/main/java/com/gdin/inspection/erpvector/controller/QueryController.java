package com.gdin.inspection.erpvector.controller;

import com.gdin.inspection.erpvector.filter.ValidationError;
import com.gdin.inspection.erpvector.query.AggregationResult;
import com.gdin.inspection.erpvector.query.ScrollResult;
import com.gdin.inspection.erpvector.req.AggregateReq;
import com.gdin.inspection.erpvector.req.ScrollReq;
import com.gdin.inspection.erpvector.req.ValidateFiltersReq;
import com.gdin.inspection.erpvector.resp.ResultData;
import com.gdin.inspection.erpvector.service.QueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Resource;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "精确查询")
@RestController
@RequestMapping("/api/query")
public class QueryController {
    @Resource
    private QueryService queryService;

    @Operation(summary = "校验过滤条件，不执行查询")
    @PostMapping("/validate")
    public ResultData<List<ValidationError>> validate(@Valid @RequestBody ValidateFiltersReq req) {
        return ResultData.success(queryService.validate(req));
    }

    @Operation(summary = "按过滤条件精确聚合")
    @PostMapping("/aggregate")
    public ResultData<AggregationResult> aggregate(@Valid @RequestBody AggregateReq req) {
        return ResultData.success(queryService.aggregate(req));
    }

    @Operation(summary = "按过滤条件分页读取记录")
    @PostMapping("/scroll")
    public ResultData<ScrollResult> scroll(@Valid @RequestBody ScrollReq req) {
        return ResultData.success(queryService.scroll(req));
    }
}
