package com.gdin.inspection.erpvector.integrity;

import com.gdin.inspection.erpvector.codec.PointAddress;
import com.gdin.inspection.erpvector.codec.PointAddressCodec;
import com.gdin.inspection.erpvector.query.OperationControl;
import com.gdin.inspection.erpvector.store.StorePoint;
import com.gdin.inspection.erpvector.store.VectorStore;
import com.gdin.inspection.erpvector.util.RetryUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 孤儿目标修复。同一个目标点位同一时间最多一个修复在进行，
 * 后来的调用方等待并复用前一个的结果；不同目标之间可以并发。
 * 只在登记/注销时访问共享 map，网络调用不在任何锁内。
 */
@Slf4j
public class RepairCoordinator {
    private final TargetRepairer repairer;
    private final VectorStore store;
    private final int existenceBatchSize;
    private final RetryUtil.Policy retryPolicy;
    private final ConcurrentHashMap<String, CompletableFuture<Boolean>> inFlight = new ConcurrentHashMap<>();

    public RepairCoordinator(TargetRepairer repairer, VectorStore store, int existenceBatchSize, RetryUtil.Policy retryPolicy) {
        this.repairer = repairer;
        this.store = store;
        this.existenceBatchSize = Math.max(1, existenceBatchSize);
        this.retryPolicy = retryPolicy;
    }

    public RepairOutcome repair(String targetModel, Collection<String> targetIds) {
        return repair(targetModel, targetIds, OperationControl.unbounded());
    }

    /**
     * 修复同一目标模型下的一组缺失目标。拉取后仍不存在的目标不会重试，记入 unrepairable；
     * 取消或超时导致没有处理完的目标记入 deferred。
     */
    public RepairOutcome repair(String targetModel, Collection<String> targetIds, OperationControl control) {
        OperationControl ctl = control == null ? OperationControl.unbounded() : control;
        // 值为 null 表示被推迟
        Map<String, CompletableFuture<Boolean>> owned = new LinkedHashMap<>();
        Map<String, CompletableFuture<Boolean>> awaited = new LinkedHashMap<>();
        for (String targetId : new LinkedHashSet<>(targetIds)) {
            CompletableFuture<Boolean> mine = new CompletableFuture<>();
            CompletableFuture<Boolean> existing = inFlight.putIfAbsent(targetId, mine);
            if (existing == null) owned.put(targetId, mine);
            else awaited.put(targetId, existing);
        }

        Map<String, Boolean> resolved = new LinkedHashMap<>();
        try {
            if (!owned.isEmpty()) {
                Set<String> present = ctl.shouldStop() ? Set.of() : fetchAndCheck(targetModel, owned.keySet(), ctl);
                boolean stopped = ctl.shouldStop();
                for (Map.Entry<String, CompletableFuture<Boolean>> e : owned.entrySet()) {
                    Boolean ok = present.contains(e.getKey()) ? Boolean.TRUE : stopped ? null : Boolean.FALSE;
                    resolved.put(e.getKey(), ok);
                    e.getValue().complete(ok);
                }
            }
        } catch (RuntimeException e) {
            for (CompletableFuture<Boolean> f : owned.values()) f.completeExceptionally(e);
            throw e;
        } finally {
            for (Map.Entry<String, CompletableFuture<Boolean>> e : owned.entrySet()) {
                inFlight.remove(e.getKey(), e.getValue());
            }
        }

        for (Map.Entry<String, CompletableFuture<Boolean>> e : awaited.entrySet()) {
            resolved.put(e.getKey(), await(e.getKey(), e.getValue()));
        }

        List<String> repaired = new ArrayList<>();
        List<String> unrepairable = new ArrayList<>();
        List<String> deferred = new ArrayList<>();
        for (Map.Entry<String, Boolean> e : resolved.entrySet()) {
            if (e.getValue() == null) deferred.add(e.getKey());
            else if (e.getValue()) repaired.add(e.getKey());
            else unrepairable.add(e.getKey());
        }
        log.info("repair {}: requested={}, repaired={}, unrepairable={}, deferred={}, shared={}",
                targetModel, resolved.size(), repaired.size(), unrepairable.size(), deferred.size(), awaited.size());
        return new RepairOutcome(targetModel, resolved.size(), repaired, unrepairable, deferred);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private Set<String> fetchAndCheck(String targetModel, Set<String> targetIds, OperationControl control) {
        List<Long> recordIds = new ArrayList<>(targetIds.size());
        for (String id : targetIds) {
            PointAddress address = PointAddressCodec.decode(id);
            recordIds.add(address.getRecordId());
        }
        long written = repairer.fetchAndUpsert(targetModel, recordIds, control);
        if (written < recordIds.size()) {
            log.warn("repair {}: only {} of {} record(s) fetched", targetModel, written, recordIds.size());
        }
        return existing(targetIds);
    }

    Set<String> existing(Collection<String> ids) {
        Set<String> present = new HashSet<>();
        List<String> all = new ArrayList<>(ids);
        for (int i = 0; i < all.size(); i += existenceBatchSize) {
            List<String> chunk = all.subList(i, Math.min(all.size(), i + existenceBatchSize));
            for (StorePoint p : RetryUtil.call("retrieve repaired targets", retryPolicy, () -> store.retrieve(chunk, false))) {
                present.add(p.getId());
            }
        }
        return present;
    }

    private static Boolean await(String targetId, CompletableFuture<Boolean> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            log.warn("concurrent repair of {} failed: {}", targetId, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return false;
        }
    }
}
