package com.gdin.inspection.erpvector.store;

import com.gdin.inspection.erpvector.filter.NativeFilter;
import com.gdin.inspection.erpvector.filter.ValueMatcher;

import java.util.*;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 简单的内存实现，线程安全。仅用于测试/本地开发。
 * 点位按 ID 有序保存，scroll 的游标语义与 Milvus 实现一致。
 */
public class InMemoryVectorStore implements VectorStore {

    private final String name;
    // id -> 点位（payload 以扁平 Map 保存，写入时复制）
    private final ConcurrentSkipListMap<String, Entry> points = new ConcurrentSkipListMap<>();
    private final Set<String> indexedFields = Collections.synchronizedSet(new TreeSet<>());

    public InMemoryVectorStore() {
        this("memory");
    }

    public InMemoryVectorStore(String name) {
        this.name = name;
    }

    @Override
    public long upsert(List<StorePoint> batch, int chunkSize) {
        for (StorePoint p : batch) {
            Map<String, Object> payload = p.getPayload() == null ? Map.of() : p.getPayload().toMap();
            points.put(p.getId(), new Entry(p.getVector(), new LinkedHashMap<>(payload)));
        }
        return batch.size();
    }

    @Override
    public ScrollPage scroll(ScrollRequest request) {
        ConcurrentNavigableMap<String, Entry> view = request.getCursor() == null
                ? points
                : points.tailMap(request.getCursor(), false);
        List<StorePoint> page = new ArrayList<>();
        String last = null;
        boolean more = false;
        for (Map.Entry<String, Entry> e : view.entrySet()) {
            if (!matches(e.getKey(), e.getValue(), request.getFilter())) continue;
            if (page.size() == request.getLimit()) {
                more = true;
                break;
            }
            page.add(toPoint(e.getKey(), e.getValue(), request.isWithPayload(), request.isWithVector()));
            last = e.getKey();
        }
        return new ScrollPage(page, more ? last : null);
    }

    @Override
    public long count(NativeFilter filter, boolean exact) {
        return points.entrySet().stream().filter(e -> matches(e.getKey(), e.getValue(), filter)).count();
    }

    @Override
    public long deleteByFilter(NativeFilter filter) {
        long removed = 0;
        for (Map.Entry<String, Entry> e : points.entrySet()) {
            if (matches(e.getKey(), e.getValue(), filter) && points.remove(e.getKey(), e.getValue())) removed++;
        }
        return removed;
    }

    @Override
    public void createPayloadIndex(String field, PayloadIndexType type) {
        indexedFields.add(field);
    }

    @Override
    public CollectionInfo getCollectionInfo() {
        Integer dim = points.values().stream()
                .filter(e -> e.vector != null)
                .map(e -> e.vector.size())
                .findFirst().orElse(null);
        return CollectionInfo.builder()
                .name(name)
                .pointCount(points.size())
                .vectorDimension(dim)
                .indexedFields(new ArrayList<>(indexedFields))
                .dynamicFieldEnabled(true)
                .build();
    }

    @Override
    public List<StorePoint> retrieve(Collection<String> ids, boolean withPayload) {
        List<StorePoint> found = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            Entry e = points.get(id);
            if (e != null) found.add(toPoint(id, e, withPayload, false));
        }
        return found;
    }

    @Override
    public boolean setPayload(String id, Map<String, Object> values) {
        Entry updated = points.computeIfPresent(id, (k, old) -> {
            Map<String, Object> merged = new LinkedHashMap<>(old.payload);
            merged.putAll(values);
            return new Entry(old.vector, merged);
        });
        return updated != null;
    }

    public int size() {
        return points.size();
    }

    private boolean matches(String id, Entry e, NativeFilter filter) {
        if (filter == null || filter.isEmpty()) return true;
        Map<String, Object> view = new HashMap<>(e.payload);
        view.put(StorePoint.POINT_ID, id);
        return filter.getClauses().stream()
                .allMatch(c -> ValueMatcher.matches(view.get(c.getField()), c.getOp(), c.getValue()));
    }

    private StorePoint toPoint(String id, Entry e, boolean withPayload, boolean withVector) {
        return StorePoint.builder()
                .id(id)
                .vector(withVector ? e.vector : null)
                .payload(withPayload ? PointPayload.fromMap(new LinkedHashMap<>(e.payload)) : null)
                .build();
    }

    private static class Entry {
        final List<Float> vector;
        final Map<String, Object> payload;

        Entry(List<Float> vector, Map<String, Object> payload) {
            this.vector = vector;
            this.payload = Collections.unmodifiableMap(payload);
        }
    }
}
