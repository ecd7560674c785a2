package com.gdin.inspection.erpvector.service;

import com.gdin.inspection.erpvector.codec.PointNamespace;
import com.gdin.inspection.erpvector.exception.ClearDataRefusedException;
import com.gdin.inspection.erpvector.filter.FilterClause;
import com.gdin.inspection.erpvector.filter.NativeFilter;
import com.gdin.inspection.erpvector.integrity.*;
import com.gdin.inspection.erpvector.integrity.json.JsonFkCandidate;
import com.gdin.inspection.erpvector.integrity.json.JsonFkConfigStore;
import com.gdin.inspection.erpvector.integrity.json.JsonFkDetector;
import com.gdin.inspection.erpvector.integrity.json.JsonFkMapping;
import com.gdin.inspection.erpvector.query.OperationControl;
import com.gdin.inspection.erpvector.req.ClearDataReq;
import com.gdin.inspection.erpvector.req.DetectJsonFkReq;
import com.gdin.inspection.erpvector.req.FixOrphansReq;
import com.gdin.inspection.erpvector.req.SyncModelReq;
import com.gdin.inspection.erpvector.req.ValidateFkReq;
import com.gdin.inspection.erpvector.resp.ClearDataResp;
import com.gdin.inspection.erpvector.resp.StatusResp;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.store.PointPayload;
import com.gdin.inspection.erpvector.store.VectorStore;
import com.gdin.inspection.erpvector.sync.DataSyncService;
import com.gdin.inspection.erpvector.sync.SyncOptions;
import com.gdin.inspection.erpvector.sync.SyncResult;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * 运维操作：sync-model、validate-fk、fix-orphans、status、clear-data。
 */
@Slf4j
@Service
public class OpsService {

    @Resource
    private DataSyncService dataSyncService;
    @Resource
    private FkGraphIntegrityEngine fkGraphIntegrityEngine;
    @Resource
    private OrphanRepairService orphanRepairService;
    @Resource
    private ValidationHistorySink validationHistorySink;
    @Resource
    private JsonFkDetector jsonFkDetector;
    @Resource
    private JsonFkConfigStore jsonFkConfigStore;
    @Resource
    private VectorStore vectorStore;
    @Resource
    private SchemaCatalog schemaCatalog;

    public SyncResult syncModel(SyncModelReq req) {
        OperationControl control = OperationControl.withTimeoutMillis(req.getTimeoutMillis());
        if (req.isRetryFailed()) {
            return dataSyncService.retryDeadLetters(req.getModel(), control);
        }
        SyncOptions options = SyncOptions.builder()
                .batchSize(req.getBatchSize())
                .incremental(req.isIncremental())
                .updateGraph(req.getUpdateGraph() == null || req.getUpdateGraph())
                .specificIds(req.getSpecificIds())
                .maxRecords(req.getMaxRecords())
                .build();
        return dataSyncService.syncModel(req.getModel(), options, control);
    }

    public long syncSchema() {
        return dataSyncService.syncSchema();
    }

    public ValidationRunReport validateFk(ValidateFkReq req) {
        ValidationOptions options = ValidationOptions.builder()
                .models(req.getModels())
                .fix(req.isFix())
                .bidirectional(req.isBidirectional())
                .extractPatterns(req.isExtractPatterns())
                .trackHistory(req.isTrackHistory())
                .autoRepair(req.isAutoSync())
                .orphanLimit(req.getOrphanLimit())
                .build();
        return fkGraphIntegrityEngine.validate(options, OperationControl.withTimeoutMillis(req.getTimeoutMillis()));
    }

    public FixOrphansResult fixOrphans(FixOrphansReq req) {
        return orphanRepairService.fixOrphans(req.getModels(), OperationControl.withTimeoutMillis(req.getTimeoutMillis()));
    }

    public List<ValidationHistoryEntry.ModelHistory> trend(String model, int limit) {
        return validationHistorySink.trend(model, limit);
    }

    public StatusResp status() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (PointNamespace ns : PointNamespace.values()) {
            counts.put(ns.getPointType(), vectorStore.count(
                    NativeFilter.of(FilterClause.eq(PointPayload.POINT_TYPE, ns.getPointType())), true));
        }
        return StatusResp.builder()
                .collection(vectorStore.getCollectionInfo())
                .pointCounts(counts)
                .schemaModels(schemaCatalog.getModelNames().size())
                .lastSync(dataSyncService.getMetadataStore().all())
                .deadLetters(dataSyncService.getDeadLetterQueue().getTotal())
                .lastValidation(validationHistorySink.lastRun().orElse(null))
                .build();
    }

    /**
     * 删除数据和 graph 点位，schema 点位保留。没有 dryRun 或 confirm 时拒绝执行。
     */
    public ClearDataResp clearData(ClearDataReq req) {
        if (!req.isDryRun() && !req.isConfirm()) {
            throw new ClearDataRefusedException("clear-data is destructive: pass dryRun=true to preview or confirm=true to delete");
        }
        NativeFilter data = namespaceFilter(PointNamespace.DATA_RECORD, req.getModel());
        NativeFilter graph = namespaceFilter(PointNamespace.GRAPH_EDGE, req.getModel());
        ClearDataResp.ClearDataRespBuilder resp = ClearDataResp.builder()
                .model(req.getModel())
                .dryRun(req.isDryRun())
                .dataPoints(vectorStore.count(data, true))
                .graphPoints(vectorStore.count(graph, true));
        if (req.isDryRun()) {
            return resp.deleted(0).build();
        }
        long deletedData = vectorStore.deleteByFilter(data);
        long deletedGraph = vectorStore.deleteByFilter(graph);
        long deleted = deletedData < 0 || deletedGraph < 0 ? -1 : deletedData + deletedGraph;
        log.warn("clear-data model={} deleted={}", req.getModel() == null ? "*" : req.getModel(), deleted);
        return resp.deleted(deleted).build();
    }

    public Map<String, Object> detectJsonFk(DetectJsonFkReq req) {
        Set<String> skip = req.isIncludeExisting() ? Set.of() : jsonFkConfigStore.configuredKeys();
        int sampleSize = req.getSampleSize() != null ? req.getSampleSize() : JsonFkDetector.DEFAULT_SAMPLE_SIZE;
        List<JsonFkCandidate> candidates = jsonFkDetector.detect(req.getModel(), req.getMinConfidence(), sampleSize, skip);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("candidates", candidates);
        if (req.isSave()) {
            double threshold = req.getSaveThreshold() != null ? req.getSaveThreshold() : 0.85;
            List<JsonFkMapping> mappings = jsonFkDetector.toMappings(candidates, threshold);
            result.put("saved", jsonFkConfigStore.addAll(mappings));
        }
        return result;
    }

    private static NativeFilter namespaceFilter(PointNamespace namespace, String model) {
        NativeFilter filter = NativeFilter.of(FilterClause.eq(PointPayload.POINT_TYPE, namespace.getPointType()));
        return model == null ? filter : filter.with(FilterClause.eq(PointPayload.MODEL_NAME, model));
    }
}
