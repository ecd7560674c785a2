package com.gdin.inspection.erpvector.query;

import com.gdin.inspection.erpvector.filter.*;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.store.InMemoryVectorStore;
import com.gdin.inspection.erpvector.store.ScrollPage;
import com.gdin.inspection.erpvector.store.ScrollRequest;
import com.gdin.inspection.erpvector.store.StorePoint;
import com.gdin.inspection.erpvector.support.TestPoints;
import com.gdin.inspection.erpvector.support.TestSchemas;
import com.gdin.inspection.erpvector.util.RetryUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AggregationEngineTest {
    private final SchemaCatalog catalog = TestSchemas.catalog();
    private final FilterCompiler compiler = new FilterCompiler(catalog, List.of("account_id_id"));
    private InMemoryVectorStore store;
    private AggregationEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        List<StorePoint> points = new ArrayList<>();
        // debit: 10, 20, 30, 40, 50；account 7 为奇数行
        for (long i = 1; i <= 5; i++) {
            points.add(TestPoints.moveLinePoint(catalog, i, i * 10, i % 2 == 1 ? 7L : 8L, null));
        }
        store.upsert(points, 10);
        engine = new AggregationEngine(store, 2, RetryUtil.Policy.none());
    }

    @Test
    void sumsCountsAndAveragesAcrossPages() {
        CompiledFilter f = compiler.compile("account.move.line", List.of());
        AggregationResult r = engine.aggregate(f.getNativeFilter(), List.of(
                Aggregation.of("debit", AggregationOp.SUM, "total"),
                Aggregation.of("record_id", AggregationOp.COUNT, "n"),
                Aggregation.of("debit", AggregationOp.AVG, "avg"),
                Aggregation.of("debit", AggregationOp.MIN, "min"),
                Aggregation.of("debit", AggregationOp.MAX, "max")), null, 1000, f.getResidual(), null);
        assertEquals(150.0, r.getResults().get("total"));
        assertEquals(5.0, r.getResults().get("n"));
        assertEquals(30.0, r.getResults().get("avg"));
        assertEquals(10.0, r.getResults().get("min"));
        assertEquals(50.0, r.getResults().get("max"));
        assertEquals(5, r.getTotalRecords());
        assertFalse(r.isTruncated());
    }

    @Test
    void truncatesAtMaxRecords() {
        CompiledFilter f = compiler.compile("account.move.line", List.of());
        AggregationResult r = engine.aggregate(f.getNativeFilter(),
                List.of(Aggregation.of("debit", AggregationOp.SUM, "total")), null, 2, f.getResidual(), null);
        assertTrue(r.isTruncated());
        assertEquals(2, r.getTotalRecords());
        assertEquals(30.0, r.getResults().get("total"));
    }

    @Test
    void residualFilterAppliesBeforeFolding() {
        CompiledFilter f = compiler.compile("account.move.line", List.of(
                FilterCondition.of("account_id_id", FilterOperator.EQ, 7),
                FilterCondition.of("debit", FilterOperator.GT, 15)));
        assertEquals(1, f.getResidual().size());
        AggregationResult r = engine.aggregate(f.getNativeFilter(),
                List.of(Aggregation.of("debit", AggregationOp.SUM, null)), null, 1000, f.getResidual(), null);
        // 行 3、5
        assertEquals(80.0, r.getResults().get("sum_debit"));
        assertEquals(2, r.getTotalRecords());
        assertEquals(3, r.getTotalScanned());
    }

    @Test
    void groupsAreSortedByKey() {
        CompiledFilter f = compiler.compile("account.move.line", List.of());
        AggregationResult r = engine.aggregate(f.getNativeFilter(),
                List.of(Aggregation.of("debit", AggregationOp.SUM, "total")),
                List.of("account_id_id"), 1000, f.getResidual(), null);
        assertNull(r.getResults());
        assertEquals(2, r.getGroups().size());
        assertEquals(7L, ((Number) r.getGroups().get(0).getKey().get("account_id_id")).longValue());
        assertEquals(90.0, r.getGroups().get(0).getValues().get("total"));
        assertEquals(3, r.getGroups().get(0).getCount());
        assertEquals(60.0, r.getGroups().get(1).getValues().get("total"));
    }

    @Test
    void repeatedRunsGiveTheSameResult() {
        CompiledFilter f = compiler.compile("account.move.line", List.of());
        List<Aggregation> aggs = List.of(Aggregation.of("debit", AggregationOp.SUM, "total"));
        AggregationResult a = engine.aggregate(f.getNativeFilter(), aggs, List.of("parent_state"), 1000, f.getResidual(), null);
        AggregationResult b = engine.aggregate(f.getNativeFilter(), aggs, List.of("parent_state"), 1000, f.getResidual(), null);
        assertEquals(a, b);
    }

    @Test
    void cancelledRunIsIncomplete() {
        OperationControl control = OperationControl.unbounded();
        control.cancel();
        CompiledFilter f = compiler.compile("account.move.line", List.of());
        AggregationResult r = engine.aggregate(f.getNativeFilter(),
                List.of(Aggregation.of("debit", AggregationOp.SUM, "total")), null, 1000, f.getResidual(), control);
        assertTrue(r.isIncomplete());
        assertEquals("cancelled", r.getStopReason());
        assertEquals(0, r.getTotalRecords());
    }

    @Test
    void expiredDeadlineKeepsThePagesAlreadyFolded() {
        OperationControl control = OperationControl.withTimeoutMillis(200L);
        AggregationEngine slow = new AggregationEngine(new InMemoryVectorStore() {
            private boolean first = true;

            @Override
            public ScrollPage scroll(ScrollRequest request) {
                if (!first) throw new AssertionError("scrolled past the deadline");
                first = false;
                ScrollPage page = store.scroll(request);
                awaitExpiry(control);
                return page;
            }
        }, 2, RetryUtil.Policy.none());
        CompiledFilter f = compiler.compile("account.move.line", List.of());
        AggregationResult r = slow.aggregate(f.getNativeFilter(),
                List.of(Aggregation.of("debit", AggregationOp.SUM, "total")), null, 1000, f.getResidual(), control);
        assertTrue(r.isIncomplete());
        assertEquals("timeout", r.getStopReason());
        assertEquals(2, r.getTotalRecords());
        assertEquals(2, r.getTotalScanned());
    }

    static void awaitExpiry(OperationControl control) {
        try {
            while (!control.isExpired()) Thread.sleep(5);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    void requiresAnAggregation() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.aggregate(NativeFilter.empty(), List.of(), null, 10, List.of(), null));
    }
}
