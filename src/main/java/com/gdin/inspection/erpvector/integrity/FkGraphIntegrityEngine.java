package com.gdin.inspection.erpvector.integrity;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.erpvector.codec.DecodingException;
import com.gdin.inspection.erpvector.codec.PointAddress;
import com.gdin.inspection.erpvector.codec.PointAddressCodec;
import com.gdin.inspection.erpvector.codec.PointNamespace;
import com.gdin.inspection.erpvector.config.properties.IntegrityProperties;
import com.gdin.inspection.erpvector.filter.FilterClause;
import com.gdin.inspection.erpvector.filter.FilterOperator;
import com.gdin.inspection.erpvector.filter.NativeFilter;
import com.gdin.inspection.erpvector.integrity.json.JsonFkConfigStore;
import com.gdin.inspection.erpvector.integrity.json.JsonFkMapping;
import com.gdin.inspection.erpvector.integrity.pipeline.*;
import com.gdin.inspection.erpvector.query.OperationControl;
import com.gdin.inspection.erpvector.schema.FieldDescriptor;
import com.gdin.inspection.erpvector.schema.ModelLookup;
import com.gdin.inspection.erpvector.schema.ModelSchema;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.store.*;
import com.gdin.inspection.erpvector.sync.PointBuilder;
import com.gdin.inspection.erpvector.util.IOUtil;
import com.gdin.inspection.erpvector.util.RetryUtil;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 外键图完整性校验。
 *
 * 每个模型走一条独立流水线：scanning -> resolving -> reconciling -> repairing -> reporting。
 * 模型之间并发（固定大小线程池），某个模型失败只记录在它自己的报告里。
 */
@Slf4j
public class FkGraphIntegrityEngine {
    static final String SCANNING = "scanning";
    static final String RESOLVING = "resolving";
    static final String RECONCILING = "reconciling";
    static final String REPAIRING = "repairing";
    static final String REPORTING = "reporting";

    private static final String K_SOURCES = "sources";
    private static final String K_REFERENCES = "references";
    private static final String K_MISSING = "missing";
    private static final String K_HINTS = "hints";

    private final SchemaCatalog catalog;
    private final VectorStore store;
    private final RepairCoordinator repairCoordinator;
    private final ValidationHistorySink historySink;
    private final IntegrityProperties properties;
    private final RetryUtil.Policy retryPolicy;
    private final PointBuilder pointBuilder;
    private final JsonFkConfigStore jsonFkConfig;
    private final Pipeline<ModelTask> pipeline;

    private volatile ValidationRunReport lastReport;

    public FkGraphIntegrityEngine(SchemaCatalog catalog, VectorStore store, RepairCoordinator repairCoordinator,
                                  ValidationHistorySink historySink, IntegrityProperties properties,
                                  RetryUtil.Policy retryPolicy) {
        this(catalog, store, repairCoordinator, historySink, properties, retryPolicy, null);
    }

    /**
     * @param jsonFkConfig 配置为外键的 JSON 字段与普通外键一起校验，为空时只校验 schema 外键
     */
    public FkGraphIntegrityEngine(SchemaCatalog catalog, VectorStore store, RepairCoordinator repairCoordinator,
                                  ValidationHistorySink historySink, IntegrityProperties properties,
                                  RetryUtil.Policy retryPolicy, JsonFkConfigStore jsonFkConfig) {
        this.catalog = catalog;
        this.store = store;
        this.repairCoordinator = repairCoordinator;
        this.historySink = historySink;
        this.properties = properties;
        this.retryPolicy = retryPolicy;
        this.jsonFkConfig = jsonFkConfig;
        this.pointBuilder = new PointBuilder(catalog, jsonFkConfig);
        this.pipeline = new Pipeline<ModelTask>()
                .add(SCANNING, this::scan)
                .add(RESOLVING, this::resolve)
                .add(RECONCILING, this::reconcile)
                .add(REPAIRING, this::repair)
                .addFinally(REPORTING, this::report);
    }

    public ValidationRunReport validate(ValidationOptions options, OperationControl control) {
        ValidationOptions opts = options == null ? ValidationOptions.builder().build() : options;
        OperationControl ctl = control == null ? OperationControl.unbounded() : control;
        long started = System.currentTimeMillis();
        String timestamp = Instant.now().toString();

        List<String> modelNames = opts.getModels() == null || opts.getModels().isEmpty()
                ? modelsWithForeignKeys() : opts.getModels();
        log.info("validate fk: {} model(s), fix={}, bidirectional={}, patterns={}, autoRepair={}",
                modelNames.size(), opts.isFix(), opts.isBidirectional(), opts.isExtractPatterns(), opts.isAutoRepair());

        int threads = Math.max(1, Math.min(properties.getWorkers(), modelNames.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<ModelIntegrityReport> reports = new ArrayList<>();
        try {
            List<CompletableFuture<ModelIntegrityReport>> futures = new ArrayList<>();
            for (String name : modelNames) {
                futures.add(CompletableFuture.supplyAsync(() -> validateModelSafely(name, opts, ctl), pool));
            }
            for (CompletableFuture<ModelIntegrityReport> future : futures) {
                reports.add(future.join());
            }
        } finally {
            pool.shutdown();
        }

        ValidationRunReport run = ValidationRunReport.builder()
                .runId(UUID.randomUUID().toString())
                .timestamp(timestamp)
                .options(opts)
                .models(reports)
                .durationMillis(System.currentTimeMillis() - started)
                .build();
        run.summarize();
        if (opts.isTrackHistory() && historySink != null) {
            historySink.append(run);
        }
        lastReport = run;
        log.info("validate fk done: models={}, orphans={}, repaired={}, structural={}, drift={}, failed={}",
                reports.size(), run.getTotalOrphans(), run.getTotalRepaired(), run.getTotalStructuralErrors(),
                run.getTotalDriftFlags(), run.getFailedModels());
        return run;
    }

    public ValidationRunReport getLastReport() {
        return lastReport;
    }

    private List<String> modelsWithForeignKeys() {
        List<String> names = new ArrayList<>();
        for (ModelSchema model : catalog.getModels()) {
            if (!model.getFkFields().isEmpty() || !jsonFks(model).isEmpty()) names.add(model.getModelName());
        }
        return names;
    }

    private Map<String, JsonFkMapping> jsonFks(ModelSchema model) {
        return jsonFkConfig == null ? Map.of() : jsonFkConfig.fkMappings(model.getModelName());
    }

    private ModelIntegrityReport validateModelSafely(String modelName, ValidationOptions options, OperationControl control) {
        long started = System.currentTimeMillis();
        try {
            ModelLookup lookup = catalog.lookupModel(modelName);
            if (!lookup.isFound()) {
                return ModelIntegrityReport.builder().model(modelName).error(lookup.message()).build();
            }
            return validateModel(lookup.getSchema(), options, control);
        } catch (RuntimeException e) {
            log.error("validate fk {} failed", modelName, e);
            return ModelIntegrityReport.builder()
                    .model(modelName)
                    .error(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .durationMillis(System.currentTimeMillis() - started)
                    .build();
        }
    }

    ModelIntegrityReport validateModel(ModelSchema model, ValidationOptions options, OperationControl control) {
        int orphanLimit = options.getOrphanLimit() != null ? options.getOrphanLimit() : properties.getOrphanLimit();
        ModelTask task = new ModelTask(model, options, Math.max(0, orphanLimit),
                ModelIntegrityReport.builder().model(model.getModelName()).build(), System.currentTimeMillis());
        PipelineRunContext context = new PipelineRunContext(control);
        List<PipelineRunResult> results = new RunPipeline<ModelTask>().run(pipeline, task, context);

        for (PipelineRunResult r : results) {
            if (r.hasErrors()) {
                Exception e = r.getErrors().get(0);
                task.report.setError(r.getStep() + ": " + e.getMessage());
                break;
            }
        }
        if (results.size() < pipeline.stepNames().size() && task.report.getError() == null) {
            task.report.setIncomplete(true);
        }
        log.debug("validate fk {} steps: {}", model.getModelName(), context.getStats().getStepSeconds());
        return task.report;
    }

    // ---------------------------------------------------------------- scanning

    private WorkflowFunctionOutput scan(ModelTask task, PipelineRunContext ctx) {
        ModelSchema model = task.model;
        Set<String> fkFields = new LinkedHashSet<>();
        for (FieldDescriptor f : model.getFkFields()) fkFields.add(f.getFieldName());
        fkFields.addAll(jsonFks(model).keySet());

        List<StorePoint> sources = new ArrayList<>();
        boolean bidirectional = task.options.isBidirectional();
        boolean finished = scanAll(filterFor(model, PointNamespace.DATA_RECORD), ctx.getControl(), page -> {
            List<StorePoint> compactPage = new ArrayList<>(page.size());
            for (StorePoint point : page) {
                PointPayload payload = point.getPayload();
                PointPayload compact = PointPayload.builder()
                        .modelName(model.getModelName())
                        .modelId(model.getModelId())
                        .recordId(payload.getRecordId())
                        .build();
                for (String field : fkFields) {
                    FkPointer pointer = payload.getPointer(field);
                    if (pointer != null) {
                        compact.putPointer(field, pointer);
                    } else if (payload.getExtras().get(field + PointPayload.POINTER_SUFFIX) != null) {
                        // 无法识别的指针值，留给 resolving 记为结构错误
                        compact.putExtra(field, payload.getExtras().get(field + PointPayload.POINTER_SUFFIX));
                    }
                }
                compactPage.add(StorePoint.builder().id(point.getId()).payload(compact).build());
            }
            // graph 点位按编址规则与数据点位一一对应，逐页取回比对，不整体驻留内存
            if (bidirectional) detectDrift(task, compactPage, fkFields);
            sources.addAll(compactPage);
        });
        ctx.put(K_SOURCES, sources);
        task.report.setRecordsScanned(sources.size());

        if (!finished) {
            task.report.setIncomplete(true);
            return WorkflowFunctionOutput.halt(sources.size());
        }
        log.debug("scanned {}: {} data points", model.getModelName(), sources.size());
        return WorkflowFunctionOutput.of(sources.size());
    }

    private interface PageVisitor {
        void visit(List<StorePoint> page);
    }

    /**
     * @return false 表示被取消或超时打断
     */
    private boolean scanAll(NativeFilter filter, OperationControl control, PageVisitor visitor) {
        String cursor = null;
        while (true) {
            if (control.shouldStop()) return false;
            String from = cursor;
            ScrollPage page = RetryUtil.call("integrity scan", retryPolicy, () -> store.scroll(ScrollRequest.builder()
                    .filter(filter)
                    .limit(properties.getScanPageSize())
                    .cursor(from)
                    .build()));
            if (!page.getPoints().isEmpty()) visitor.visit(page.getPoints());
            if (!page.hasMore()) return true;
            cursor = page.getNextCursor();
        }
    }

    private static NativeFilter filterFor(ModelSchema model, PointNamespace namespace) {
        return NativeFilter.of(
                FilterClause.eq(PointPayload.MODEL_NAME, model.getModelName()),
                FilterClause.eq(PointPayload.POINT_TYPE, namespace.getPointType()));
    }

    // ---------------------------------------------------------------- resolving

    private WorkflowFunctionOutput resolve(ModelTask task, PipelineRunContext ctx) {
        List<StorePoint> sources = ctx.get(K_SOURCES);
        List<Reference> references = new ArrayList<>();
        Map<String, FieldStats> stats = task.fieldStats;
        for (FieldDescriptor f : task.model.getFkFields()) {
            stats.put(f.getFieldName(), new FieldStats(f.getFieldName(), f.getFkTargetModel()));
        }
        for (JsonFkMapping m : jsonFks(task.model).values()) {
            stats.putIfAbsent(m.getFieldName(), new FieldStats(m.getFieldName(), m.getKeyTargetModel()));
        }

        for (StorePoint source : sources) {
            PointPayload payload = source.getPayload();
            for (Map.Entry<String, Object> raw : payload.getExtras().entrySet()) {
                task.structural(new StructuralError(source.getId(), raw.getKey(), String.valueOf(raw.getValue()),
                        "unrecognised pointer value"));
            }
            for (Map.Entry<String, FkPointer> e : payload.getPointers().entrySet()) {
                String field = e.getKey();
                Integer expectedModelId = expectedTargetModelId(task.model, field);
                for (String rawTarget : e.getValue().getTargetIds()) {
                    PointAddress address;
                    try {
                        address = PointAddressCodec.decode(rawTarget);
                    } catch (DecodingException ex) {
                        task.structural(new StructuralError(source.getId(), field, rawTarget, ex.getMessage()));
                        continue;
                    }
                    if (address.getNamespace() != PointNamespace.DATA_RECORD) {
                        task.structural(new StructuralError(source.getId(), field, rawTarget,
                                "pointer targets namespace " + address.getNamespace().getPointType()));
                        continue;
                    }
                    if (expectedModelId != null && address.getModelId() != expectedModelId) {
                        task.structural(new StructuralError(source.getId(), field, rawTarget,
                                "pointer targets model " + address.getModelId() + ", expected " + expectedModelId));
                        continue;
                    }
                    references.add(new Reference(source.getId(), payload.getRecordId(), field,
                            PointAddressCodec.encode(address), rawTarget, address));
                    stats.get(field).setEdges(stats.get(field).getEdges() + 1);
                }
            }
        }
        ctx.put(K_REFERENCES, references);
        return WorkflowFunctionOutput.of(references.size());
    }

    private Integer expectedTargetModelId(ModelSchema model, String field) {
        for (FieldDescriptor f : model.getFkFields()) {
            if (!f.getFieldName().equals(field)) continue;
            if (f.getFkTargetModelId() != null) return f.getFkTargetModelId();
            return f.getFkTargetModel() == null ? null : catalog.resolveModelId(f.getFkTargetModel()).orElse(null);
        }
        JsonFkMapping mapping = jsonFks(model).get(field);
        if (mapping == null) return null;
        if (mapping.getKeyTargetModelId() != null) return mapping.getKeyTargetModelId();
        return mapping.getKeyTargetModel() == null ? null : catalog.resolveModelId(mapping.getKeyTargetModel()).orElse(null);
    }

    // ---------------------------------------------------------------- reconciling

    private WorkflowFunctionOutput reconcile(ModelTask task, PipelineRunContext ctx) {
        List<Reference> references = ctx.get(K_REFERENCES);
        Set<String> targets = new LinkedHashSet<>();
        for (Reference r : references) targets.add(r.targetId);

        Set<String> present = new HashSet<>();
        for (List<String> chunk : CollectionUtil.split(targets, properties.getExistenceBatchSize())) {
            if (ctx.getControl().shouldStop()) {
                task.report.setIncomplete(true);
                return WorkflowFunctionOutput.halt(null);
            }
            for (StorePoint p : RetryUtil.call("check targets", retryPolicy, () -> store.retrieve(chunk, false))) {
                present.add(p.getId());
            }
        }

        Map<String, Set<String>> uniquePerField = new HashMap<>();
        Set<String> missing = new LinkedHashSet<>();
        for (Reference r : references) {
            uniquePerField.computeIfAbsent(r.field, k -> new HashSet<>()).add(r.targetId);
            if (present.contains(r.targetId)) continue;
            missing.add(r.targetId);
            task.fieldStats.get(r.field).setOrphans(task.fieldStats.get(r.field).getOrphans() + 1);
            task.orphanReferences.add(r);
        }
        for (Map.Entry<String, Set<String>> e : uniquePerField.entrySet()) {
            task.fieldStats.get(e.getKey()).setUniqueTargets(e.getValue().size());
        }
        ctx.put(K_MISSING, missing);

        if (task.options.isExtractPatterns()) {
            Map<String, CardinalityHint> hints = cardinality(references, task.fieldStats);
            task.report.getCardinalityHints().addAll(hints.values());
            ctx.put(K_HINTS, hints);
        }
        return WorkflowFunctionOutput.of(missing.size());
    }

    private void detectDrift(ModelTask task, List<StorePoint> sources, Set<String> fkFields) {
        Map<String, String> graphIdToSource = new LinkedHashMap<>();
        for (StorePoint source : sources) {
            graphIdToSource.put(PointAddressCodec.encodeGraphEdge(task.model.getModelId(), source.getPayload().getRecordId()),
                    source.getId());
        }
        Map<String, StorePoint> graph = new HashMap<>();
        for (StorePoint p : RetryUtil.call("fetch graph points", retryPolicy, () -> store.retrieve(graphIdToSource.keySet(), true))) {
            graph.put(graphIdToSource.get(p.getId()), p);
        }

        for (StorePoint source : sources) {
            Map<String, List<String>> edgeTargets = new LinkedHashMap<>();
            StorePoint graphPoint = graph.get(source.getId());
            if (graphPoint != null) {
                for (GraphEdge edge : graphPoint.getPayload().getEdges()) {
                    if (!source.getId().equals(edge.getSourceId())) continue;
                    edgeTargets.computeIfAbsent(edge.getFkField(), k -> new ArrayList<>()).add(edge.getTargetId());
                }
            }
            for (String field : fkFields) {
                FkPointer pointer = source.getPayload().getPointer(field);
                List<String> fromPointer = pointer == null ? List.of() : pointer.getTargetIds();
                List<String> fromEdges = edgeTargets.getOrDefault(field, List.of());
                Set<String> pointerSet = canonical(fromPointer);
                Set<String> edgeSet = canonical(fromEdges);
                boolean stale = !pointerSet.containsAll(edgeSet);
                boolean orphanFks = !edgeSet.containsAll(pointerSet);
                DriftType type = DriftType.of(stale, orphanFks);
                if (type != null) {
                    task.drift(new DriftFlag(source.getId(), field, type, fromPointer, fromEdges));
                }
            }
        }
    }

    /**
     * 旧格式与新格式指向同一记录时视为相同，无法解码的按原值比较
     */
    private static Set<String> canonical(List<String> ids) {
        Set<String> out = new HashSet<>(ids.size());
        for (String id : ids) {
            try {
                out.add(PointAddressCodec.encode(PointAddressCodec.decode(id)));
            } catch (DecodingException e) {
                out.add(id);
            }
        }
        return out;
    }

    static Map<String, CardinalityHint> cardinality(List<Reference> references, Map<String, FieldStats> stats) {
        Map<String, Map<String, Integer>> perSource = new LinkedHashMap<>();
        for (Reference r : references) {
            perSource.computeIfAbsent(r.field, k -> new HashMap<>()).merge(r.sourceId, 1, Integer::sum);
        }
        Map<String, CardinalityHint> hints = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Integer>> e : perSource.entrySet()) {
            FieldStats s = stats.get(e.getKey());
            long edges = s.getEdges();
            long unique = s.getUniqueTargets();
            double ratio = edges == 0 ? 0.0 : (double) unique / edges;
            int max = 0;
            for (int n : e.getValue().values()) max = Math.max(max, n);
            hints.put(e.getKey(), CardinalityHint.builder()
                    .fkField(e.getKey())
                    .edges(edges)
                    .uniqueTargets(unique)
                    .ratio(Math.round(ratio * 1000.0) / 1000.0)
                    .cardinality(Cardinality.classify(ratio))
                    .maxTargetsPerSource(max)
                    .avgTargetsPerSource(Math.round((double) edges / e.getValue().size() * 100.0) / 100.0)
                    .build());
        }
        return hints;
    }

    // ---------------------------------------------------------------- repairing

    private WorkflowFunctionOutput repair(ModelTask task, PipelineRunContext ctx) {
        Set<String> missing = ctx.getOrDefault(K_MISSING, Set.of());
        Set<String> repaired = new HashSet<>();

        if (task.options.isAutoRepair() && !missing.isEmpty()) {
            Map<String, List<String>> byTargetModel = new LinkedHashMap<>();
            for (String targetId : missing) {
                PointAddress address = PointAddressCodec.decode(targetId);
                Optional<String> targetModel = catalog.resolveModelById(address.getModelId());
                if (targetModel.isEmpty()) {
                    task.report.getUnrepairable().add(targetId);
                    continue;
                }
                byTargetModel.computeIfAbsent(targetModel.get(), k -> new ArrayList<>()).add(targetId);
            }
            long deferred = 0;
            for (Map.Entry<String, List<String>> e : byTargetModel.entrySet()) {
                if (repairCoordinator == null) {
                    task.report.getUnrepairable().addAll(e.getValue());
                    continue;
                }
                for (List<String> chunk : CollectionUtil.split(e.getValue(), Math.max(1, properties.getRepairBatchSize()))) {
                    if (ctx.getControl().shouldStop()) {
                        deferred += chunk.size();
                        continue;
                    }
                    RepairOutcome outcome = repairCoordinator.repair(e.getKey(), chunk, ctx.getControl());
                    repaired.addAll(outcome.getRepaired());
                    task.report.getUnrepairable().addAll(outcome.getUnrepairable());
                    deferred += outcome.getDeferred().size();
                }
            }
            if (deferred > 0) {
                task.report.setRepairDeferred(deferred);
                task.report.setIncomplete(true);
            }
            task.report.setRepaired(repaired.size());
        }
        task.repairedTargets.addAll(repaired);

        Map<String, CardinalityHint> hints = ctx.getOrDefault(K_HINTS, Map.of());
        if (task.options.isFix()) {
            task.report.setGraphPointsRefreshed(refreshGraph(task.model, ctx.get(K_SOURCES), hints));
        } else if (!hints.isEmpty()) {
            task.report.setGraphPointsRefreshed(annotateGraph(task.model, hints, ctx.getControl()));
        }
        return WorkflowFunctionOutput.of(repaired.size());
    }

    /**
     * 按数据点位当前的指针重建 graph 点位；指针已清空的数据点位删除其 graph 点位
     */
    private long refreshGraph(ModelSchema model, List<StorePoint> sources, Map<String, CardinalityHint> hints) {
        String now = Instant.now().toString();
        List<StorePoint> rebuilt = new ArrayList<>();
        List<Object> obsolete = new ArrayList<>();
        for (StorePoint source : sources) {
            StorePoint edgePoint = pointBuilder.buildEdgePoint(source, now);
            if (edgePoint == null) {
                obsolete.add(PointAddressCodec.encodeGraphEdge(model.getModelId(), source.getPayload().getRecordId()));
                continue;
            }
            applyHints(edgePoint.getPayload(), hints);
            rebuilt.add(edgePoint);
        }
        long written = 0;
        for (List<StorePoint> chunk : CollectionUtil.split(rebuilt, properties.getScanPageSize())) {
            written += RetryUtil.call("refresh graph", retryPolicy, () -> store.upsert(chunk, chunk.size()));
        }
        for (List<Object> chunk : CollectionUtil.split(obsolete, properties.getExistenceBatchSize())) {
            RetryUtil.call("delete stale graph", retryPolicy, () -> store.deleteByFilter(
                    NativeFilter.of(new FilterClause(StorePoint.POINT_ID, FilterOperator.IN, chunk))));
        }
        return written;
    }

    /**
     * 逐页读取 graph 点位，只更新基数提示有变化的
     */
    private long annotateGraph(ModelSchema model, Map<String, CardinalityHint> hints, OperationControl control) {
        long[] updated = {0};
        scanAll(filterFor(model, PointNamespace.GRAPH_EDGE), control, page -> {
            for (StorePoint point : page) {
                PointPayload payload = point.getPayload();
                List<GraphEdge> before = payload.getEdges();
                applyHints(payload, hints);
                if (before.equals(payload.getEdges())) continue;
                List<Map<String, Object>> raw = new ArrayList<>();
                for (GraphEdge edge : payload.getEdges()) raw.add(IOUtil.toMap(edge));
                boolean ok = RetryUtil.call("annotate graph", retryPolicy,
                        () -> store.setPayload(point.getId(), Map.of(PointPayload.EDGES, raw)));
                if (ok) updated[0]++;
            }
        });
        return updated[0];
    }

    private static void applyHints(PointPayload payload, Map<String, CardinalityHint> hints) {
        if (hints.isEmpty()) return;
        List<GraphEdge> edges = new ArrayList<>(payload.getEdges().size());
        for (GraphEdge edge : payload.getEdges()) {
            CardinalityHint hint = hints.get(edge.getFkField());
            edges.add(hint == null ? edge : edge.withCardinalityHint(hint.edgeHint()));
        }
        payload.setEdges(edges);
    }

    // ---------------------------------------------------------------- reporting

    private WorkflowFunctionOutput report(ModelTask task, PipelineRunContext ctx) {
        ModelIntegrityReport report = task.report;
        long edges = 0;
        for (FieldStats s : task.fieldStats.values()) edges += s.getEdges();

        long remaining = 0;
        for (Reference r : task.orphanReferences) {
            if (task.repairedTargets.contains(r.targetId)) continue;
            remaining++;
            if (report.getOrphans().size() < task.orphanLimit) {
                report.getOrphans().add(OrphanRecord.builder()
                        .sourceModel(task.model.getModelName())
                        .sourceId(r.sourceId)
                        .sourceRecordId(r.sourceRecordId)
                        .fkField(r.field)
                        .targetId(r.targetId)
                        .targetModel(catalog.resolveModelById(r.address.getModelId()).orElse(null))
                        .targetRecordId(r.address.getRecordId())
                        .build());
            }
        }
        for (FieldStats s : task.fieldStats.values()) {
            s.setTargetModelMissing(s.getTargetModel() == null || catalog.getModel(s.getTargetModel()).isEmpty());
        }

        report.setFields(new ArrayList<>(task.fieldStats.values()));
        report.setTotalEdges(edges);
        report.setTotalOrphans(task.orphanReferences.size());
        report.setStructuralErrorCount(task.structuralCount);
        report.setDriftCount(task.driftCount);
        report.setIntegrityScore(ModelIntegrityReport.score(edges, remaining));
        report.setDurationMillis(System.currentTimeMillis() - task.startedAt);
        log.info("validate fk {}: records={}, edges={}, orphans={}, repaired={}, structural={}, drift={}, score={}",
                task.model.getModelName(), report.getRecordsScanned(), edges, report.getTotalOrphans(),
                report.getRepaired(), task.structuralCount, task.driftCount, report.getIntegrityScore());
        return WorkflowFunctionOutput.of(report);
    }

    // ---------------------------------------------------------------- state

    @Value
    static class Reference {
        String sourceId;
        Long sourceRecordId;
        String field;
        /** 规范化后的目标 ID（旧格式已转换） */
        String targetId;
        String rawTarget;
        PointAddress address;
    }

    static class ModelTask {
        final ModelSchema model;
        final ValidationOptions options;
        final int orphanLimit;
        final ModelIntegrityReport report;
        final long startedAt;
        final Map<String, FieldStats> fieldStats = new LinkedHashMap<>();
        final List<Reference> orphanReferences = new ArrayList<>();
        final Set<String> repairedTargets = new HashSet<>();
        long structuralCount;
        long driftCount;

        ModelTask(ModelSchema model, ValidationOptions options, int orphanLimit, ModelIntegrityReport report, long startedAt) {
            this.model = model;
            this.options = options;
            this.orphanLimit = orphanLimit;
            this.report = report;
            this.startedAt = startedAt;
        }

        void structural(StructuralError error) {
            structuralCount++;
            if (report.getStructuralErrors().size() < orphanLimit) report.getStructuralErrors().add(error);
        }

        void drift(DriftFlag flag) {
            driftCount++;
            if (report.getDriftFlags().size() < orphanLimit) report.getDriftFlags().add(flag);
        }
    }
}
