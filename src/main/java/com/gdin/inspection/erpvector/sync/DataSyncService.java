package com.gdin.inspection.erpvector.sync;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.erpvector.codec.EncodingException;
import com.gdin.inspection.erpvector.config.properties.SyncProperties;
import com.gdin.inspection.erpvector.embedding.EmbeddingMode;
import com.gdin.inspection.erpvector.embedding.EmbeddingService;
import com.gdin.inspection.erpvector.exception.TransientIoException;
import com.gdin.inspection.erpvector.integrity.json.JsonFkConfigStore;
import com.gdin.inspection.erpvector.query.OperationControl;
import com.gdin.inspection.erpvector.schema.FieldDescriptor;
import com.gdin.inspection.erpvector.schema.FieldType;
import com.gdin.inspection.erpvector.schema.ModelSchema;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.source.ErpSourceClient;
import com.gdin.inspection.erpvector.source.ErpSourceException;
import com.gdin.inspection.erpvector.source.ReadOptions;
import com.gdin.inspection.erpvector.store.StorePoint;
import com.gdin.inspection.erpvector.store.VectorStore;
import com.gdin.inspection.erpvector.util.RetryUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ERP -> 向量库同步。
 *
 * 调用线程按 id 升序分页拉取，每页交给固定大小的线程池做 转换 -> 向量化 -> 写入；
 * 拉取与处理之间最多积压 maxInFlightBatches 个批次，超过时拉取方阻塞。
 * 单条记录编码失败或整批写入失败都进入死信队列，不影响其他批次。
 */
@Slf4j
public class DataSyncService {
    private static final int MAX_ERRORS_KEPT = 20;

    private final ErpSourceClient source;
    private final SchemaCatalog catalog;
    private final VectorStore store;
    private final EmbeddingService embeddingService;
    private final SyncProperties properties;
    private final DeadLetterQueue deadLetterQueue;
    private final SyncMetadataStore metadataStore;
    private final PointBuilder pointBuilder;

    public DataSyncService(ErpSourceClient source, SchemaCatalog catalog, VectorStore store,
                           EmbeddingService embeddingService, SyncProperties properties,
                           DeadLetterQueue deadLetterQueue, SyncMetadataStore metadataStore) {
        this(source, catalog, store, embeddingService, properties, deadLetterQueue, metadataStore, null);
    }

    /**
     * @param jsonFkConfig JSON 外键字段配置，为空时 JSON 字段不生成指针
     */
    public DataSyncService(ErpSourceClient source, SchemaCatalog catalog, VectorStore store,
                           EmbeddingService embeddingService, SyncProperties properties,
                           DeadLetterQueue deadLetterQueue, SyncMetadataStore metadataStore,
                           JsonFkConfigStore jsonFkConfig) {
        this.source = source;
        this.catalog = catalog;
        this.store = store;
        this.embeddingService = embeddingService;
        this.properties = properties;
        this.deadLetterQueue = deadLetterQueue;
        this.metadataStore = metadataStore;
        this.pointBuilder = new PointBuilder(catalog, jsonFkConfig);
    }

    public SyncResult syncModel(String modelName, SyncOptions options, OperationControl control) {
        ModelSchema model = catalog.getModel(modelName)
                .orElseThrow(() -> new IllegalArgumentException(catalog.lookupModel(modelName).message()));
        SyncOptions opts = options == null ? SyncOptions.builder().build() : options;
        OperationControl ctl = control == null ? OperationControl.unbounded() : control;
        int batchSize = opts.getBatchSize() != null ? opts.getBatchSize() : properties.getBatchSize();
        long started = System.currentTimeMillis();
        String syncTimestamp = Instant.now().toString();

        List<Object> domain = buildDomain(modelName, opts);
        List<String> fields = readableFields(model, opts.isIncremental());
        RetryUtil.Policy policy = RetryUtil.Policy.of(properties.getMaxAttempts(), properties.getBackoffMillis());

        BatchTally tally = new BatchTally();
        int threads = Math.max(1, properties.getWorkers());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        Semaphore inFlight = new Semaphore(Math.max(1, properties.getMaxInFlightBatches()));
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        boolean incomplete = false;
        String maxWriteDate = null;
        try {
            int offset = 0;
            while (true) {
                if (ctl.shouldStop()) {
                    log.warn("sync {} stopped ({}) after {} records", modelName, ctl.stopReason(), tally.fetched.get());
                    incomplete = true;
                    break;
                }
                int limit = batchSize;
                if (opts.getMaxRecords() != null) {
                    limit = (int) Math.min(limit, opts.getMaxRecords() - tally.fetched.get());
                    if (limit <= 0) break;
                }
                final int pageOffset = offset;
                final int pageLimit = limit;
                List<Map<String, Object>> page = RetryUtil.call("fetch " + modelName + "@" + offset, policy,
                        () -> source.searchRead(modelName, domain, fields,
                                ReadOptions.builder().limit(pageLimit).offset(pageOffset).build()));
                if (page.isEmpty()) break;
                tally.fetched.addAndGet(page.size());
                maxWriteDate = maxWriteDate(maxWriteDate, page);

                inFlight.acquire();
                int batchNo = tally.batches.incrementAndGet();
                futures.add(CompletableFuture
                        .runAsync(() -> processBatch(model, page, batchNo, syncTimestamp, opts.isUpdateGraph(), policy, tally), pool)
                        .whenComplete((v, e) -> inFlight.release()));

                if (page.size() < pageLimit) break;
                offset += page.size();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            incomplete = true;
        } catch (TransientIoException | ErpSourceException e) {
            log.error("sync {} aborted while fetching: {}", modelName, e.getMessage());
            tally.error("fetch: " + e.getMessage());
            incomplete = true;
        } finally {
            for (CompletableFuture<Void> future : futures) {
                try {
                    future.join();
                } catch (CompletionException e) {
                    // processBatch 自行兜底，这里只会是意料外的运行时错误
                    log.error("sync {} batch crashed", modelName, e.getCause());
                    tally.failedBatches.incrementAndGet();
                    tally.error("batch: " + e.getCause());
                }
            }
            pool.shutdown();
        }

        if (!incomplete && tally.failedBatches.get() == 0 && opts.getSpecificIds() == null) {
            SyncMetadataStore.ModelSyncState previous = metadataStore.get(modelName).orElse(null);
            String watermark = maxWriteDate != null ? maxWriteDate : previous == null ? null : previous.getLastWriteDate();
            metadataStore.put(modelName, new SyncMetadataStore.ModelSyncState(watermark, syncTimestamp, tally.uploaded.get()));
        }

        SyncResult result = SyncResult.builder()
                .model(modelName)
                .fetched(tally.fetched.get())
                .uploaded(tally.uploaded.get())
                .failed(tally.failed.get())
                .edgePoints(tally.edgePoints.get())
                .failedEdgePoints(tally.failedEdgePoints.get())
                .batches(tally.batches.get())
                .failedBatches(tally.failedBatches.get())
                .incomplete(incomplete)
                .durationMillis(System.currentTimeMillis() - started)
                .errors(tally.errors())
                .build();
        log.info("sync {} done: fetched={}, uploaded={}, failed={}, edges={}, failedEdges={}, batches={}, incomplete={}",
                modelName, result.getFetched(), result.getUploaded(), result.getFailed(),
                result.getEdgePoints(), result.getFailedEdgePoints(), result.getBatches(), incomplete);
        return result;
    }

    /**
     * 重新同步死信队列中该模型的记录
     */
    public SyncResult retryDeadLetters(String modelName, OperationControl control) {
        List<Long> ids = deadLetterQueue.failedRecordIds(modelName);
        if (ids.isEmpty()) {
            return SyncResult.builder().model(modelName).errors(List.of()).build();
        }
        log.info("retrying {} dead-lettered records of {}", ids.size(), modelName);
        return syncModel(modelName, SyncOptions.builder().specificIds(ids).build(), control);
    }

    /**
     * 写入 schema 点位（每个字段一个）
     * @return 写入条数
     */
    public long syncSchema() {
        RetryUtil.Policy policy = RetryUtil.Policy.of(properties.getMaxAttempts(), properties.getBackoffMillis());
        List<StorePoint> points = new ArrayList<>();
        for (ModelSchema model : catalog.getModels()) {
            for (FieldDescriptor field : model.getFields()) {
                if (field.getFieldId() == null) continue;
                points.add(pointBuilder.buildSchemaPoint(model, field));
            }
        }
        long written = 0;
        for (List<StorePoint> chunk : CollectionUtil.split(points, properties.getBatchSize())) {
            embed(chunk, policy);
            written += RetryUtil.call("upsert schema points", policy,
                    () -> store.upsert(chunk, properties.getUpsertChunkSize()));
        }
        log.info("schema points written: {}", written);
        return written;
    }

    public SyncMetadataStore getMetadataStore() {
        return metadataStore;
    }

    public DeadLetterQueue getDeadLetterQueue() {
        return deadLetterQueue;
    }

    private void processBatch(ModelSchema model, List<Map<String, Object>> records, int batchNo,
                              String syncTimestamp, boolean updateGraph, RetryUtil.Policy policy, BatchTally tally) {
        String modelName = model.getModelName();
        List<StorePoint> points = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            if (!(record.get("id") instanceof Number)) {
                log.warn("skip {} record without id: {}", modelName, record.keySet());
                deadLetterQueue.add(modelName, null, "encode", "record has no numeric id");
                tally.failed.incrementAndGet();
                continue;
            }
            try {
                points.add(pointBuilder.buildDataPoint(model, record, syncTimestamp));
            } catch (EncodingException e) {
                long recordId = ((Number) record.get("id")).longValue();
                log.warn("skip {} #{}: {}", modelName, recordId, e.getMessage());
                deadLetterQueue.add(modelName, recordId, "encode", e.getMessage());
                tally.failed.incrementAndGet();
            }
        }
        if (points.isEmpty()) return;

        try {
            embed(points, policy);
            long written = RetryUtil.call("upsert " + modelName + " batch " + batchNo, policy,
                    () -> store.upsert(points, properties.getUpsertChunkSize()));
            tally.uploaded.addAndGet(written);
        } catch (TransientIoException e) {
            log.error("sync {} batch {} failed: {}", modelName, batchNo, e.getMessage());
            tally.failedBatches.incrementAndGet();
            tally.failed.addAndGet(points.size());
            tally.error("batch " + batchNo + ": " + e.getMessage());
            for (StorePoint point : points) {
                deadLetterQueue.add(modelName, point.getPayload().getRecordId(), "upsert", e.getMessage());
            }
            return;
        }

        if (!updateGraph) return;
        List<StorePoint> edges = new ArrayList<>();
        for (StorePoint point : points) {
            StorePoint edge = pointBuilder.buildEdgePoint(point, syncTimestamp);
            if (edge != null) edges.add(edge);
        }
        if (edges.isEmpty()) return;
        try {
            tally.edgePoints.addAndGet(RetryUtil.call("upsert " + modelName + " edges " + batchNo, policy,
                    () -> store.upsert(edges, properties.getUpsertChunkSize())));
        } catch (TransientIoException e) {
            // 数据点位已写入，graph 点位可由 validate-fk --fix 重建
            log.error("sync {} batch {} edges failed: {}", modelName, batchNo, e.getMessage());
            tally.failedEdgePoints.addAndGet(edges.size());
            tally.error("edges " + batchNo + ": " + e.getMessage());
        }
    }

    private void embed(List<StorePoint> points, RetryUtil.Policy policy) {
        if (embeddingService == null) return;
        List<String> texts = new ArrayList<>(points.size());
        for (StorePoint point : points) texts.add(point.getPayload().getVectorText());
        List<List<Float>> vectors = RetryUtil.call("embed " + points.size() + " texts", policy,
                () -> embeddingService.embedBatch(texts, EmbeddingMode.DOCUMENT));
        for (int i = 0; i < points.size(); i++) {
            points.get(i).setVector(vectors.get(i));
        }
    }

    private List<Object> buildDomain(String modelName, SyncOptions opts) {
        List<Object> domain = new ArrayList<>();
        if (opts.getSpecificIds() != null) {
            domain.add(List.of("id", "in", opts.getSpecificIds()));
        }
        if (opts.isIncremental()) {
            metadataStore.get(modelName)
                    .map(SyncMetadataStore.ModelSyncState::getLastWriteDate)
                    .ifPresent(w -> domain.add(List.of("write_date", ">", w)));
        }
        return domain;
    }

    private static List<String> readableFields(ModelSchema model, boolean withWriteDate) {
        List<String> fields = new ArrayList<>();
        fields.add("id");
        for (FieldDescriptor field : model.getFields()) {
            if (!field.isStored() || field.getFieldType() == FieldType.BINARY || "id".equals(field.getFieldName())) continue;
            fields.add(field.getFieldName());
        }
        if (withWriteDate && !fields.contains("write_date")) fields.add("write_date");
        return fields;
    }

    private static String maxWriteDate(String current, List<Map<String, Object>> page) {
        String max = current;
        for (Map<String, Object> record : page) {
            Object w = record.get("write_date");
            // ERP 时间格式 yyyy-MM-dd HH:mm:ss，字符串序即时间序
            if (w instanceof String && (max == null || ((String) w).compareTo(max) > 0)) max = (String) w;
        }
        return max;
    }

    private static class BatchTally {
        final AtomicLong fetched = new AtomicLong();
        final AtomicLong uploaded = new AtomicLong();
        final AtomicLong failed = new AtomicLong();
        final AtomicLong edgePoints = new AtomicLong();
        final AtomicLong failedEdgePoints = new AtomicLong();
        final AtomicInteger batches = new AtomicInteger();
        final AtomicInteger failedBatches = new AtomicInteger();
        private final List<String> errors = Collections.synchronizedList(new ArrayList<>());

        void error(String message) {
            if (errors.size() < MAX_ERRORS_KEPT) errors.add(message);
        }

        List<String> errors() {
            synchronized (errors) {
                return new ArrayList<>(errors);
            }
        }
    }
}
