package com.gdin.inspection.erpvector.integrity;

import com.gdin.inspection.erpvector.codec.PointAddressCodec;
import com.gdin.inspection.erpvector.codec.PointNamespace;
import com.gdin.inspection.erpvector.config.properties.IntegrityProperties;
import com.gdin.inspection.erpvector.filter.FilterClause;
import com.gdin.inspection.erpvector.filter.FilterOperator;
import com.gdin.inspection.erpvector.filter.NativeFilter;
import com.gdin.inspection.erpvector.integrity.json.JsonFieldClass;
import com.gdin.inspection.erpvector.integrity.json.JsonFkConfigStore;
import com.gdin.inspection.erpvector.integrity.json.JsonFkMapping;
import com.gdin.inspection.erpvector.query.OperationControl;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.store.*;
import com.gdin.inspection.erpvector.support.TestPoints;
import com.gdin.inspection.erpvector.support.TestSchemas;
import com.gdin.inspection.erpvector.sync.PointBuilder;
import com.gdin.inspection.erpvector.util.RetryUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class FkGraphIntegrityEngineTest {
    private static final String LINE = "account.move.line";

    private final SchemaCatalog catalog = TestSchemas.catalog();
    private final PointBuilder pointBuilder = new PointBuilder(catalog);
    private InMemoryVectorStore store;
    private IntegrityProperties properties;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        properties = new IntegrityProperties();
        properties.setScanPageSize(2);
        properties.setExistenceBatchSize(2);
    }

    private void syncLine(long id, Long accountId, List<Long> taxIds) {
        StorePoint data = TestPoints.moveLinePoint(catalog, id, id * 10, accountId, taxIds);
        store.upsert(List.of(data), 1);
        StorePoint edge = pointBuilder.buildEdgePoint(data, TestPoints.TS);
        if (edge != null) store.upsert(List.of(edge), 1);
    }

    private void syncTargets() {
        store.upsert(List.of(
                TestPoints.simplePoint("account.account", TestSchemas.ACCOUNT_ID, 7),
                TestPoints.simplePoint("account.account", TestSchemas.ACCOUNT_ID, 8),
                TestPoints.simplePoint("account.tax", TestSchemas.TAX_ID, 1),
                TestPoints.simplePoint("account.tax", TestSchemas.TAX_ID, 2)), 10);
    }

    private FkGraphIntegrityEngine engine(RepairCoordinator coordinator, ValidationHistorySink sink) {
        return new FkGraphIntegrityEngine(catalog, store, coordinator, sink, properties, RetryUtil.Policy.none());
    }

    private static ValidationOptions.ValidationOptionsBuilder lines() {
        return ValidationOptions.builder().models(List.of(LINE));
    }

    @Test
    void fullySyncedGraphIsClean() {
        syncLine(1, 7L, List.of(1L, 2L));
        syncLine(2, 8L, null);
        syncLine(3, 7L, List.of(2L));
        syncTargets();

        ValidationRunReport run = engine(null, null).validate(lines().bidirectional(true).build(), null);
        ModelIntegrityReport report = run.model(LINE);
        assertNull(report.getError());
        assertEquals(3, report.getRecordsScanned());
        assertEquals(6, report.getTotalEdges());
        assertEquals(0, report.getTotalOrphans());
        assertEquals(0, report.getDriftCount());
        assertEquals(0, report.getStructuralErrorCount());
        assertEquals(100.0, report.getIntegrityScore());
        assertFalse(run.isIncomplete());
    }

    @Test
    void missingTargetIsReportedThenRepaired() {
        syncLine(1, 7L, List.of(1L, 2L));
        syncLine(2, 8L, null);
        syncTargets();
        store.deleteByFilter(NativeFilter.of(new FilterClause(
                StorePoint.POINT_ID, FilterOperator.EQ, PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 8))));

        FkGraphIntegrityEngine engine = engine(null, null);
        ModelIntegrityReport before = engine.validate(lines().build(), null).model(LINE);
        assertEquals(1, before.getTotalOrphans());
        assertEquals(75.0, before.getIntegrityScore());
        OrphanRecord orphan = before.getOrphans().get(0);
        assertEquals("account_id", orphan.getFkField());
        assertEquals("account.account", orphan.getTargetModel());
        assertEquals(8L, orphan.getTargetRecordId());
        assertEquals(2L, orphan.getSourceRecordId());

        List<String> fetched = new ArrayList<>();
        TargetRepairer repairer = (model, ids, control) -> {
            for (Long id : ids) {
                fetched.add(model + "#" + id);
                store.upsert(List.of(TestPoints.simplePoint(model, catalog.resolveModelId(model).orElseThrow(), id)), 1);
            }
            return ids.size();
        };
        RepairCoordinator coordinator = new RepairCoordinator(repairer, store, 10, RetryUtil.Policy.none());
        ModelIntegrityReport repaired = engine(coordinator, null).validate(lines().autoRepair(true).build(), null).model(LINE);
        assertEquals(List.of("account.account#8"), fetched);
        assertEquals(1, repaired.getRepaired());
        assertTrue(repaired.getOrphans().isEmpty());
        assertEquals(100.0, repaired.getIntegrityScore());

        ModelIntegrityReport after = engine.validate(lines().build(), null).model(LINE);
        assertEquals(0, after.getTotalOrphans());
    }

    @Test
    void unrepairableTargetsAreListed() {
        syncLine(1, 9L, null);
        RepairCoordinator coordinator = new RepairCoordinator((model, ids, control) -> 0, store, 10, RetryUtil.Policy.none());
        ModelIntegrityReport report = engine(coordinator, null).validate(lines().autoRepair(true).build(), null).model(LINE);
        assertEquals(0, report.getRepaired());
        assertEquals(List.of(PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 9)), report.getUnrepairable());
        assertEquals(1, report.getOrphans().size());
    }

    @Test
    void mappedJsonFieldsAreValidatedLikeForeignKeys(@TempDir Path dir) {
        JsonFkConfigStore jsonFk = new JsonFkConfigStore(dir.resolve("json_fk_config.json").toString());
        jsonFk.addAll(List.of(JsonFkMapping.builder()
                .sourceModel(LINE)
                .fieldName("analytic_distribution")
                .mappingType(JsonFieldClass.FK)
                .keyTargetModelId(TestSchemas.ACCOUNT_ID)
                .build()));
        Map<String, Object> record = TestPoints.moveLine(1, 10, 7L, null);
        record.put("analytic_distribution", Map.of("7", 50.0, "55", 50.0));
        store.upsert(List.of(new PointBuilder(catalog, jsonFk)
                .buildDataPoint(catalog.getModel(LINE).orElseThrow(), record, TestPoints.TS)), 1);
        syncTargets();

        FkGraphIntegrityEngine engine = new FkGraphIntegrityEngine(catalog, store, null, null, properties,
                RetryUtil.Policy.none(), jsonFk);
        ModelIntegrityReport report = engine.validate(lines().build(), null).model(LINE);
        FieldStats analytic = report.getFields().stream()
                .filter(f -> f.getFkField().equals("analytic_distribution")).findFirst().orElseThrow();
        assertEquals(2, analytic.getEdges());
        assertEquals(1, analytic.getOrphans());
        assertEquals(3, report.getTotalEdges());
        assertEquals(PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 55), report.getOrphans().get(0).getTargetId());

        ModelIntegrityReport without = engine(null, null).validate(lines().build(), null).model(LINE);
        assertEquals(1, without.getTotalEdges());
    }

    @Test
    void malformedPointersAreStructuralErrors() {
        StorePoint bad = TestPoints.moveLinePoint(catalog, 1, 10, null, null);
        bad.getPayload().putPointer("account_id", FkPointer.toOne("not-a-point-id"));
        bad.getPayload().putPointer("partner_id", FkPointer.toOne(PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 1)));
        bad.getPayload().putPointer("tax_ids", FkPointer.toMany(List.of(PointAddressCodec.encodeGraphEdge(TestSchemas.TAX_ID, 1))));
        store.upsert(List.of(bad), 1);

        ModelIntegrityReport report = engine(null, null).validate(lines().build(), null).model(LINE);
        assertEquals(3, report.getStructuralErrorCount());
        assertEquals(0, report.getTotalEdges());
        assertEquals(0, report.getTotalOrphans());
        assertTrue(report.getStructuralErrors().stream().anyMatch(e -> e.getMessage().contains("expected " + TestSchemas.PARTNER_ID)));
    }

    @Test
    void legacyPointersAreCanonicalised() {
        StorePoint line = TestPoints.moveLinePoint(catalog, 1, 10, null, null);
        line.getPayload().putPointer("account_id", FkPointer.toOne("0301-000000000007"));
        store.upsert(List.of(line), 1);
        syncTargets();

        ModelIntegrityReport report = engine(null, null).validate(lines().build(), null).model(LINE);
        assertEquals(0, report.getStructuralErrorCount());
        assertEquals(1, report.getTotalEdges());
        assertEquals(0, report.getTotalOrphans());
    }

    @Test
    void legacyPointerMatchingCanonicalEdgeIsNotDrift() {
        StorePoint canonical = TestPoints.moveLinePoint(catalog, 1, 10, 7L, null);
        StorePoint legacy = TestPoints.moveLinePoint(catalog, 1, 10, null, null);
        legacy.getPayload().putPointer("account_id", FkPointer.toOne("0301-000000000007"));
        store.upsert(List.of(legacy, pointBuilder.buildEdgePoint(canonical, TestPoints.TS)), 2);
        syncTargets();

        ModelIntegrityReport report = engine(null, null).validate(lines().bidirectional(true).build(), null).model(LINE);
        assertEquals(0, report.getDriftCount());
        assertEquals(1, report.getTotalEdges());
    }

    @Test
    void driftBetweenPointersAndGraph() {
        StorePoint current = TestPoints.moveLinePoint(catalog, 1, 10, 7L, null);
        StorePoint stale = TestPoints.moveLinePoint(catalog, 1, 10, 8L, null);
        store.upsert(List.of(current, pointBuilder.buildEdgePoint(stale, TestPoints.TS)), 2);
        // 行 2 没有 graph 点位
        store.upsert(List.of(TestPoints.moveLinePoint(catalog, 2, 20, 7L, null)), 1);
        syncTargets();

        FkGraphIntegrityEngine engine = engine(null, null);
        ModelIntegrityReport report = engine.validate(lines().bidirectional(true).build(), null).model(LINE);
        assertEquals(2, report.getDriftCount());
        DriftFlag first = report.getDriftFlags().get(0);
        assertEquals(DriftType.BOTH, first.getType());
        assertEquals(DriftType.ORPHAN_FKS, report.getDriftFlags().get(1).getType());

        ModelIntegrityReport fixed = engine.validate(lines().bidirectional(true).fix(true).build(), null).model(LINE);
        assertEquals(2, fixed.getGraphPointsRefreshed());
        ModelIntegrityReport clean = engine.validate(lines().bidirectional(true).build(), null).model(LINE);
        assertEquals(0, clean.getDriftCount());
    }

    @Test
    void driftIsReconciledPageByPage() {
        for (long i = 1; i <= 5; i++) syncLine(i, 7L, null);
        // 行 4 的 graph 点位仍指向旧科目
        StorePoint stale = TestPoints.moveLinePoint(catalog, 4, 40, 8L, null);
        store.upsert(List.of(pointBuilder.buildEdgePoint(stale, TestPoints.TS)), 1);
        syncTargets();

        List<ScrollRequest> scrolls = new ArrayList<>();
        List<Integer> retrieved = new ArrayList<>();
        VectorStore recording = new InMemoryVectorStore() {
            @Override
            public ScrollPage scroll(ScrollRequest request) {
                scrolls.add(request);
                return store.scroll(request);
            }

            @Override
            public List<StorePoint> retrieve(java.util.Collection<String> ids, boolean withPayload) {
                if (withPayload) retrieved.add(ids.size());
                return store.retrieve(ids, withPayload);
            }
        };
        FkGraphIntegrityEngine engine = new FkGraphIntegrityEngine(catalog, recording, null, null, properties,
                RetryUtil.Policy.none());
        ModelIntegrityReport report = engine.validate(lines().bidirectional(true).build(), null).model(LINE);

        assertEquals(1, report.getDriftCount());
        assertEquals(PointAddressCodec.encodeData(TestSchemas.MOVE_LINE_ID, 4),
                report.getDriftFlags().get(0).getSourceId());
        // graph 点位按数据页逐页取回，不单独全量扫描
        assertTrue(scrolls.stream().noneMatch(r -> r.getFilter().getClauses().stream()
                .anyMatch(c -> PointNamespace.GRAPH_EDGE.getPointType().equals(c.getValue()))));
        assertEquals(List.of(2, 2, 1), retrieved);
    }

    @Test
    void cardinalityHintsAreWrittenToEdges() {
        for (long i = 1; i <= 10; i++) syncLine(i, 7L, List.of(i));
        ModelIntegrityReport report = engine(null, null).validate(lines().extractPatterns(true).build(), null).model(LINE);

        CardinalityHint account = report.getCardinalityHints().stream()
                .filter(h -> h.getFkField().equals("account_id")).findFirst().orElseThrow();
        assertEquals(10, account.getEdges());
        assertEquals(1, account.getUniqueTargets());
        assertEquals(Cardinality.ONE_TO_MANY, account.getCardinality());
        CardinalityHint tax = report.getCardinalityHints().stream()
                .filter(h -> h.getFkField().equals("tax_ids")).findFirst().orElseThrow();
        assertEquals(Cardinality.ONE_TO_ONE, tax.getCardinality());
        assertEquals(10, report.getGraphPointsRefreshed());

        StorePoint edgePoint = store.retrieve(List.of(PointAddressCodec.encodeGraphEdge(TestSchemas.MOVE_LINE_ID, 1)), true).get(0);
        GraphEdge edge = edgePoint.getPayload().getEdges().stream()
                .filter(e -> e.getFkField().equals("account_id")).findFirst().orElseThrow();
        assertEquals("to_one:one_to_many", edge.getCardinalityHint());
    }

    @Test
    void cardinalityThresholds() {
        assertEquals(Cardinality.ONE_TO_ONE, Cardinality.classify(0.95));
        assertEquals(Cardinality.ONE_TO_FEW, Cardinality.classify(0.949));
        assertEquals(Cardinality.ONE_TO_FEW, Cardinality.classify(0.2));
        assertEquals(Cardinality.ONE_TO_MANY, Cardinality.classify(0.199));
    }

    @Test
    void orphanDetailsAreCappedButCounted() {
        for (long i = 1; i <= 5; i++) syncLine(i, 100 + i, null);
        ModelIntegrityReport report = engine(null, null).validate(lines().orphanLimit(2).build(), null).model(LINE);
        assertEquals(5, report.getTotalOrphans());
        assertEquals(2, report.getOrphans().size());
        assertEquals(0.0, report.getIntegrityScore());
    }

    @Test
    void unknownModelFailsOnlyItsOwnReport() {
        syncLine(1, 7L, null);
        syncTargets();
        ValidationRunReport run = engine(null, null).validate(ValidationOptions.builder()
                .models(List.of(LINE, "account.move.lines")).build(), null);
        assertEquals(1, run.getFailedModels());
        assertTrue(run.model("account.move.lines").getError().contains("did you mean"));
        assertNull(run.model(LINE).getError());
    }

    @Test
    void defaultsToModelsWithForeignKeys() {
        ValidationRunReport run = engine(null, null).validate(ValidationOptions.builder().build(), null);
        assertEquals(List.of(LINE), run.getModels().stream().map(ModelIntegrityReport::getModel)
                .collect(Collectors.toList()));
    }

    @Test
    void cancelledRunIsIncomplete() {
        syncLine(1, 7L, null);
        OperationControl control = OperationControl.unbounded();
        control.cancel();
        ValidationRunReport run = engine(null, null).validate(lines().build(), control);
        assertTrue(run.isIncomplete());
        assertTrue(run.model(LINE).isIncomplete());
    }

    @Test
    void expiredDeadlineReturnsPartialReport() {
        syncLine(1, 7L, null);
        ValidationRunReport run = engine(null, null).validate(lines().build(), OperationControl.withTimeoutMillis(0L));
        assertTrue(run.isIncomplete());
        assertTrue(run.model(LINE).isIncomplete());
        assertNull(run.model(LINE).getError());
    }

    @Test
    void autoRepairStopsAtTheDeadline() {
        for (long i = 1; i <= 3; i++) syncLine(i, 100 + i, null);
        properties.setRepairBatchSize(1);
        List<Long> fetched = new ArrayList<>();
        TargetRepairer slow = (model, ids, control) -> {
            fetched.addAll(ids);
            for (Long id : ids) {
                store.upsert(List.of(TestPoints.simplePoint(model, TestSchemas.ACCOUNT_ID, id)), 1);
            }
            try {
                // 第一批补拉时用完全部时间
                Thread.sleep(control.remainingMillis() + 50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ids.size();
        };
        RepairCoordinator coordinator = new RepairCoordinator(slow, store, 10, RetryUtil.Policy.none());

        ValidationRunReport run = engine(coordinator, null).validate(lines().autoRepair(true).build(),
                OperationControl.withTimeoutMillis(2000L));
        ModelIntegrityReport report = run.model(LINE);
        assertEquals(List.of(101L), fetched);
        assertEquals(1, report.getRepaired());
        assertEquals(2, report.getRepairDeferred());
        assertTrue(report.getUnrepairable().isEmpty());
        assertEquals(3, report.getTotalOrphans());
        assertEquals(2, report.getOrphans().size());
        assertTrue(run.isIncomplete());
    }

    @Test
    void historyIsAppendedWhenTracked() {
        syncLine(1, 7L, null);
        syncTargets();
        List<ValidationRunReport> appended = new ArrayList<>();
        ValidationHistorySink sink = new ValidationHistorySink() {
            @Override
            public ValidationHistoryEntry append(ValidationRunReport report) {
                appended.add(report);
                return null;
            }

            @Override
            public List<ValidationHistoryEntry.ModelHistory> trend(String model, int limit) {
                return List.of();
            }

            @Override
            public Optional<ValidationHistoryEntry> lastRun() {
                return Optional.empty();
            }
        };
        FkGraphIntegrityEngine engine = engine(null, sink);
        engine.validate(lines().build(), null);
        assertTrue(appended.isEmpty());
        ValidationRunReport run = engine.validate(lines().trackHistory(true).build(), null);
        assertEquals(1, appended.size());
        assertSame(run, engine.getLastReport());
    }
}
