package com.gdin.inspection.erpvector.query;

import com.gdin.inspection.erpvector.filter.NativeFilter;
import com.gdin.inspection.erpvector.filter.ResidualPredicate;
import com.gdin.inspection.erpvector.store.ScrollPage;
import com.gdin.inspection.erpvector.store.ScrollRequest;
import com.gdin.inspection.erpvector.store.StorePoint;
import com.gdin.inspection.erpvector.store.VectorStore;
import com.gdin.inspection.erpvector.util.RetryUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 分页读取匹配记录。
 *
 * 存储按点位 ID 升序返回，游标是本次最后消费的 ID，下次严格从它之后开始，
 * 因此同一游标、同一过滤条件的连续调用不会跳过或重复记录（不保证快照）。
 */
@Slf4j
public class ScrollEngine {
    private final VectorStore store;
    private final int pageSize;
    private final RetryUtil.Policy retryPolicy;

    public ScrollEngine(VectorStore store, int pageSize, RetryUtil.Policy retryPolicy) {
        this.store = store;
        this.pageSize = pageSize;
        this.retryPolicy = retryPolicy;
    }

    public ScrollResult scroll(NativeFilter filter, ScrollOptions options, OperationControl control) {
        OperationControl ctl = control == null ? OperationControl.unbounded() : control;
        int limit = Math.max(1, options.getLimit());
        List<ResidualPredicate> residual = options.getResidual();
        // 没有残余过滤时存储分页大小就是 limit
        int fetchSize = residual == null || residual.isEmpty() ? limit : Math.max(limit, pageSize);

        List<StorePoint> records = new ArrayList<>();
        String cursor = options.getCursor();
        long scanned = 0;

        while (true) {
            if (ctl.shouldStop()) {
                return result(records, true, cursor, scanned, true);
            }
            String from = cursor;
            ScrollPage page = RetryUtil.call("scroll", retryPolicy, () -> store.scroll(ScrollRequest.builder()
                    .filter(filter)
                    .limit(fetchSize)
                    .cursor(from)
                    .withVector(options.isWithVector())
                    .build()));

            List<StorePoint> points = page.getPoints();
            for (int i = 0; i < points.size(); i++) {
                StorePoint point = points.get(i);
                scanned++;
                cursor = point.getId();
                if (ResidualPredicate.testAll(residual, point.payloadView())) {
                    records.add(point);
                    if (records.size() == limit) {
                        boolean more = i < points.size() - 1 || page.hasMore();
                        return result(records, more, more ? cursor : null, scanned, false);
                    }
                }
                if (scanned >= options.getMaxScan()) {
                    boolean more = i < points.size() - 1 || page.hasMore();
                    if (more) log.debug("scroll scan budget {} reached at {}", options.getMaxScan(), cursor);
                    return result(records, more, more ? cursor : null, scanned, false);
                }
            }
            if (!page.hasMore()) return result(records, false, null, scanned, false);
            cursor = page.getNextCursor();
        }
    }

    private static ScrollResult result(List<StorePoint> records, boolean hasMore, String next, long scanned, boolean incomplete) {
        return ScrollResult.builder()
                .records(records)
                .hasMore(hasMore)
                .nextCursor(next)
                .totalScanned(scanned)
                .incomplete(incomplete)
                .build();
    }
}
