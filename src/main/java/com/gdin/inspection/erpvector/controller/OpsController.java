package com.gdin.inspection.erpvector.controller;

import com.gdin.inspection.erpvector.integrity.FixOrphansResult;
import com.gdin.inspection.erpvector.integrity.ValidationHistoryEntry;
import com.gdin.inspection.erpvector.integrity.ValidationRunReport;
import com.gdin.inspection.erpvector.req.ClearDataReq;
import com.gdin.inspection.erpvector.req.DetectJsonFkReq;
import com.gdin.inspection.erpvector.req.FixOrphansReq;
import com.gdin.inspection.erpvector.req.SyncModelReq;
import com.gdin.inspection.erpvector.req.ValidateFkReq;
import com.gdin.inspection.erpvector.resp.ClearDataResp;
import com.gdin.inspection.erpvector.resp.ResultData;
import com.gdin.inspection.erpvector.resp.StatusResp;
import com.gdin.inspection.erpvector.service.OpsService;
import com.gdin.inspection.erpvector.sync.SyncResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Resource;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Tag(name = "运维")
@RestController
@RequestMapping("/api/ops")
public class OpsController {
    @Resource
    private OpsService opsService;

    @Operation(summary = "同步单个模型")
    @PostMapping("/sync-model")
    public ResultData<SyncResult> syncModel(@Valid @RequestBody SyncModelReq req) {
        return ResultData.success(opsService.syncModel(req));
    }

    @Operation(summary = "同步 schema 点位")
    @PostMapping("/sync-schema")
    public ResultData<Long> syncSchema() {
        return ResultData.success(opsService.syncSchema());
    }

    @Operation(summary = "外键图完整性校验")
    @PostMapping("/validate-fk")
    public ResultData<ValidationRunReport> validateFk(@Valid @RequestBody ValidateFkReq req) {
        return ResultData.success(opsService.validateFk(req));
    }

    @Operation(summary = "拉取孤儿外键指向的缺失记录")
    @PostMapping("/fix-orphans")
    public ResultData<FixOrphansResult> fixOrphans(@RequestBody(required = false) FixOrphansReq req) {
        return ResultData.success(opsService.fixOrphans(req == null ? new FixOrphansReq() : req));
    }

    @Operation(summary = "集合状态")
    @GetMapping("/status")
    public ResultData<StatusResp> status() {
        return ResultData.success(opsService.status());
    }

    @Operation(summary = "清理数据与 graph 点位，保留 schema")
    @PostMapping("/clear-data")
    public ResultData<ClearDataResp> clearData(@Valid @RequestBody ClearDataReq req) {
        return ResultData.success(opsService.clearData(req));
    }

    @Operation(summary = "检测 JSON 外键字段")
    @PostMapping("/json-fk/detect")
    public ResultData<Map<String, Object>> detectJsonFk(@Valid @RequestBody DetectJsonFkReq req) {
        return ResultData.success(opsService.detectJsonFk(req));
    }

    @Operation(summary = "模型完整性趋势")
    @GetMapping("/history/{model}")
    public ResultData<List<ValidationHistoryEntry.ModelHistory>> history(@PathVariable("model") String model,
                                                                       @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return ResultData.success(opsService.trend(model, limit));
    }
}
