package com.gdin.inspection.erpvector.store;

import com.gdin.inspection.erpvector.filter.FilterClause;
import com.gdin.inspection.erpvector.filter.FilterOperator;
import com.gdin.inspection.erpvector.filter.NativeFilter;
import com.gdin.inspection.erpvector.schema.SchemaCatalog;
import com.gdin.inspection.erpvector.support.TestPoints;
import com.gdin.inspection.erpvector.support.TestSchemas;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryVectorStoreTest {
    private final SchemaCatalog catalog = TestSchemas.catalog();

    @Test
    void upsertOverwritesSameId() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.upsert(List.of(TestPoints.moveLinePoint(catalog, 1, 10, 7L, null)), 10);
        store.upsert(List.of(TestPoints.moveLinePoint(catalog, 1, 20, 7L, null)), 10);
        assertEquals(1, store.size());
        StorePoint p = store.retrieve(List.of("00000002-0312-0000-0000-000000000001"), true).get(0);
        assertEquals(20.0, p.getPayload().getExtras().get("debit"));
        assertEquals("00000002-0301-0000-0000-000000000007", p.getPayload().getPointer("account_id").getTargetIds().get(0));
    }

    @Test
    void scrollPagesInIdOrder() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        List<StorePoint> points = new ArrayList<>();
        for (long i = 5; i >= 1; i--) points.add(TestPoints.moveLinePoint(catalog, i, i, 7L, null));
        store.upsert(points, 2);

        List<Long> seen = new ArrayList<>();
        String cursor = null;
        do {
            ScrollPage page = store.scroll(ScrollRequest.builder().limit(2).cursor(cursor).build());
            page.getPoints().forEach(p -> seen.add(p.getPayload().getRecordId()));
            cursor = page.getNextCursor();
        } while (cursor != null);
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), seen);
    }

    @Test
    void filtersCountsAndDeletes() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.upsert(List.of(
                TestPoints.moveLinePoint(catalog, 1, 10, 7L, List.of(1L, 2L)),
                TestPoints.moveLinePoint(catalog, 2, 20, 8L, List.of(3L)),
                TestPoints.simplePoint("account.account", 301, 7)), 10);

        NativeFilter lines = NativeFilter.of(FilterClause.eq(PointPayload.MODEL_NAME, "account.move.line"));
        assertEquals(2, store.count(lines, true));
        assertEquals(1, store.count(lines.with(new FilterClause("tax_ids", FilterOperator.IN, List.of(2L), true)), true));
        assertEquals(1, store.count(NativeFilter.of(new FilterClause(StorePoint.POINT_ID, FilterOperator.EQ,
                "00000002-0301-0000-0000-000000000007")), true));

        assertEquals(2, store.deleteByFilter(lines));
        assertEquals(1, store.size());
    }

    @Test
    void setPayloadMergesWithoutTouchingOtherKeys() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        StorePoint p = TestPoints.simplePoint("res.partner", 85, 3);
        store.upsert(List.of(p), 1);
        assertTrue(store.setPayload(p.getId(), Map.of("name", "renamed")));
        assertFalse(store.setPayload("00000002-0085-0000-0000-000000000999", Map.of("name", "x")));
        StorePoint back = store.retrieve(List.of(p.getId()), true).get(0);
        assertEquals("renamed", back.getPayload().getExtras().get("name"));
        assertEquals(3L, back.getPayload().getRecordId());
    }

    @Test
    void retrieveSkipsMissingIds() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        StorePoint p = TestPoints.simplePoint("res.partner", 85, 3);
        store.upsert(List.of(p), 1);
        List<StorePoint> found = store.retrieve(List.of(p.getId(), "00000002-0085-0000-0000-000000000004"), false);
        assertEquals(1, found.size());
        assertNull(found.get(0).getPayload());
    }
}
