package com.gdin.inspection.erpvector.query;

import com.gdin.inspection.erpvector.filter.CompiledFilter;
import com.gdin.inspection.erpvector.filter.FilterCompiler;
import com.gdin.inspection.erpvector.filter.FilterCondition;
import com.gdin.inspection.erpvector.filter.FilterOperator;
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

public class ScrollEngineTest {
    private final SchemaCatalog catalog = TestSchemas.catalog();
    private final FilterCompiler compiler = new FilterCompiler(catalog, List.of());
    private InMemoryVectorStore store;
    private ScrollEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        List<StorePoint> points = new ArrayList<>();
        for (long i = 1; i <= 23; i++) points.add(TestPoints.moveLinePoint(catalog, i, i, 7L, null));
        points.add(TestPoints.simplePoint("account.account", 301, 7));
        store.upsert(points, 100);
        engine = new ScrollEngine(store, 4, RetryUtil.Policy.none());
    }

    @Test
    void pagesCoverEveryMatchOnceWithResidualFilter() {
        // debit 为偶数的行：2..22 共 11 条，debit 不在索引里走残余过滤
        CompiledFilter f = compiler.compile("account.move.line", List.of(
                FilterCondition.of("parent_state", FilterOperator.EQ, "posted")));
        assertTrue(f.hasResidual());

        List<Long> seen = new ArrayList<>();
        String cursor = null;
        int calls = 0;
        while (true) {
            ScrollResult r = engine.scroll(f.getNativeFilter(), ScrollOptions.builder()
                    .limit(3).residual(f.getResidual()).cursor(cursor).build(), null);
            r.getRecords().forEach(p -> seen.add(p.getPayload().getRecordId()));
            calls++;
            if (!r.isHasMore()) {
                assertNull(r.getNextCursor());
                break;
            }
            cursor = r.getNextCursor();
        }
        assertEquals(List.of(2L, 4L, 6L, 8L, 10L, 12L, 14L, 16L, 18L, 20L, 22L), seen);
        assertEquals(4, calls);
    }

    @Test
    void scanBudgetReturnsEarlyWithCursor() {
        CompiledFilter f = compiler.compile("account.move.line", List.of(
                FilterCondition.of("debit", FilterOperator.GT, 20)));
        ScrollResult r = engine.scroll(f.getNativeFilter(), ScrollOptions.builder()
                .limit(5).residual(f.getResidual()).maxScan(10).build(), null);
        assertTrue(r.getRecords().isEmpty());
        assertTrue(r.isHasMore());
        assertEquals(10, r.getTotalScanned());

        ScrollResult next = engine.scroll(f.getNativeFilter(), ScrollOptions.builder()
                .limit(5).residual(f.getResidual()).cursor(r.getNextCursor()).build(), null);
        assertEquals(21L, next.getRecords().get(0).getPayload().getRecordId());
        assertEquals(3, next.getRecords().size());
        assertFalse(next.isHasMore());
    }

    @Test
    void exactLastPageHasNoMore() {
        CompiledFilter f = compiler.compile("account.move.line", List.of());
        ScrollResult r = engine.scroll(f.getNativeFilter(), ScrollOptions.builder().limit(23).build(), null);
        assertEquals(23, r.getRecords().size());
        assertFalse(r.isHasMore());
    }

    @Test
    void cancelledScrollIsIncomplete() {
        OperationControl control = OperationControl.unbounded();
        control.cancel();
        CompiledFilter f = compiler.compile("account.move.line", List.of());
        ScrollResult r = engine.scroll(f.getNativeFilter(), ScrollOptions.builder().limit(5).build(), control);
        assertTrue(r.isIncomplete());
        assertTrue(r.isHasMore());
    }

    @Test
    void expiredDeadlineReturnsACursorToResumeFrom() {
        OperationControl control = OperationControl.withTimeoutMillis(200L);
        ScrollEngine slow = new ScrollEngine(new InMemoryVectorStore() {
            @Override
            public ScrollPage scroll(ScrollRequest request) {
                ScrollPage page = store.scroll(request);
                AggregationEngineTest.awaitExpiry(control);
                return page;
            }
        }, 4, RetryUtil.Policy.none());
        CompiledFilter f = compiler.compile("account.move.line", List.of(
                FilterCondition.of("debit", FilterOperator.GT, 20)));
        ScrollResult r = slow.scroll(f.getNativeFilter(), ScrollOptions.builder()
                .limit(5).residual(f.getResidual()).build(), control);
        assertTrue(r.isIncomplete());
        assertTrue(r.isHasMore());
        assertTrue(r.getRecords().isEmpty());
        assertEquals(5, r.getTotalScanned());

        ScrollResult rest = engine.scroll(f.getNativeFilter(), ScrollOptions.builder()
                .limit(5).residual(f.getResidual()).cursor(r.getNextCursor()).build(), null);
        assertEquals(3, rest.getRecords().size());
        assertEquals(21L, rest.getRecords().get(0).getPayload().getRecordId());
    }
}
