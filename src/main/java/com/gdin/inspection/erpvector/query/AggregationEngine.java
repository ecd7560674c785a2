package com.gdin.inspection.erpvector.query;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.erpvector.filter.NativeFilter;
import com.gdin.inspection.erpvector.filter.ResidualPredicate;
import com.gdin.inspection.erpvector.filter.ValueMatcher;
import com.gdin.inspection.erpvector.store.ScrollPage;
import com.gdin.inspection.erpvector.store.ScrollRequest;
import com.gdin.inspection.erpvector.store.StorePoint;
import com.gdin.inspection.erpvector.store.VectorStore;
import com.gdin.inspection.erpvector.util.RetryUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.*;

/**
 * 存储层不能做聚合，这里用游标全量扫描匹配点位，在内存中累加。
 *
 * 每个 alias 维护累加和、计数、最小/最大值，avg 在最后用 sum/count 计算。
 * 计入聚合的记录数达到 maxRecords 后停止扫描并标记 truncated。
 */
@Slf4j
public class AggregationEngine {
    private final VectorStore store;
    private final int pageSize;
    private final RetryUtil.Policy retryPolicy;

    public AggregationEngine(VectorStore store, int pageSize, RetryUtil.Policy retryPolicy) {
        this.store = store;
        this.pageSize = pageSize;
        this.retryPolicy = retryPolicy;
    }

    public AggregationResult aggregate(NativeFilter filter, List<Aggregation> aggregations, List<String> groupBy,
                                       int maxRecords, List<ResidualPredicate> residual, OperationControl control) {
        if (CollectionUtil.isEmpty(aggregations)) throw new IllegalArgumentException("at least one aggregation is required");
        OperationControl ctl = control == null ? OperationControl.unbounded() : control;
        List<String> groupFields = groupBy == null ? List.of() : groupBy;

        Map<List<Object>, GroupState> groups = new HashMap<>();
        long totalRecords = 0;
        long totalScanned = 0;
        boolean truncated = false;
        boolean incomplete = false;
        String cursor = null;

        scan:
        while (true) {
            if (ctl.shouldStop()) {
                incomplete = true;
                break;
            }
            String from = cursor;
            ScrollPage page = RetryUtil.call("aggregate scroll", retryPolicy, () -> store.scroll(ScrollRequest.builder()
                    .filter(filter)
                    .limit(pageSize)
                    .cursor(from)
                    .build()));
            for (StorePoint point : page.getPoints()) {
                totalScanned++;
                Map<String, Object> payload = point.payloadView();
                if (!ResidualPredicate.testAll(residual, payload)) continue;
                if (totalRecords >= maxRecords) {
                    truncated = true;
                    break scan;
                }
                List<Object> key = new ArrayList<>(groupFields.size());
                for (String g : groupFields) key.add(payload.get(g));
                groups.computeIfAbsent(key, k -> new GroupState(aggregations)).fold(payload);
                totalRecords++;
            }
            if (!page.hasMore()) break;
            cursor = page.getNextCursor();
        }

        if (truncated) {
            log.warn("aggregation truncated at {} records ({} scanned)", maxRecords, totalScanned);
        }
        AggregationResult.AggregationResultBuilder result = AggregationResult.builder()
                .totalRecords(totalRecords)
                .totalScanned(totalScanned)
                .truncated(truncated)
                .incomplete(incomplete)
                .stopReason(incomplete ? ctl.stopReason() : null);

        if (groupFields.isEmpty()) {
            GroupState only = groups.getOrDefault(List.of(), new GroupState(aggregations));
            result.results(only.finish());
        } else {
            List<List<Object>> keys = new ArrayList<>(groups.keySet());
            keys.sort(AggregationEngine::compareKeys);
            List<AggregationResult.GroupResult> out = new ArrayList<>();
            for (List<Object> key : keys) {
                Map<String, Object> keyMap = new LinkedHashMap<>();
                for (int i = 0; i < groupFields.size(); i++) keyMap.put(groupFields.get(i), key.get(i));
                GroupState state = groups.get(key);
                out.add(new AggregationResult.GroupResult(keyMap, state.finish(), state.records));
            }
            result.groups(out);
        }
        return result.build();
    }

    private static int compareKeys(List<Object> a, List<Object> b) {
        for (int i = 0; i < a.size(); i++) {
            Object x = a.get(i);
            Object y = b.get(i);
            if (x == null && y == null) continue;
            if (x == null) return -1;
            if (y == null) return 1;
            int c = ValueMatcher.compare(x, y);
            if (c != 0) return c;
        }
        return 0;
    }

    /**
     * 单个分组的累加状态
     */
    private static class GroupState {
        final List<Aggregation> aggregations;
        final Map<String, BigDecimal> sums = new HashMap<>();
        final Map<String, Long> counts = new HashMap<>();
        final Map<String, BigDecimal> mins = new HashMap<>();
        final Map<String, BigDecimal> maxs = new HashMap<>();
        long records;

        GroupState(List<Aggregation> aggregations) {
            this.aggregations = aggregations;
        }

        void fold(Map<String, Object> payload) {
            records++;
            for (Aggregation agg : aggregations) {
                String alias = agg.resolvedAlias();
                if (agg.getOp() == AggregationOp.COUNT) {
                    counts.merge(alias, 1L, Long::sum);
                    continue;
                }
                // 非数值跳过，数值字符串会被解析
                BigDecimal v = ValueMatcher.toNumber(payload.get(agg.getField()));
                if (v == null) continue;
                sums.merge(alias, v, BigDecimal::add);
                counts.merge(alias, 1L, Long::sum);
                mins.merge(alias, v, BigDecimal::min);
                maxs.merge(alias, v, BigDecimal::max);
            }
        }

        Map<String, Double> finish() {
            Map<String, Double> out = new LinkedHashMap<>();
            for (Aggregation agg : aggregations) {
                String alias = agg.resolvedAlias();
                long count = counts.getOrDefault(alias, 0L);
                BigDecimal sum = sums.getOrDefault(alias, BigDecimal.ZERO);
                switch (agg.getOp()) {
                    case COUNT:
                        out.put(alias, (double) count);
                        break;
                    case SUM:
                        out.put(alias, sum.doubleValue());
                        break;
                    case AVG:
                        out.put(alias, count == 0 ? 0d : sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64).doubleValue());
                        break;
                    case MIN:
                        out.put(alias, mins.containsKey(alias) ? mins.get(alias).doubleValue() : null);
                        break;
                    case MAX:
                        out.put(alias, maxs.containsKey(alias) ? maxs.get(alias).doubleValue() : null);
                        break;
                    default:
                        break;
                }
            }
            return out;
        }
    }
}
