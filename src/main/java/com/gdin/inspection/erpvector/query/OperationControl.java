package com.gdin.inspection.erpvector.query;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 长任务的协作式取消与超时。任务在每个分页/批次边界检查 {@link #shouldStop()}，
 * 命中后返回已完成的部分结果并标记 incomplete。
 */
public class OperationControl {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    /** System.nanoTime() 基准，0 表示不限时 */
    private final long deadlineNanos;

    private OperationControl(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static OperationControl unbounded() {
        return new OperationControl(0L);
    }

    public static OperationControl withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) return unbounded();
        return new OperationControl(System.nanoTime() + timeout.toNanos());
    }

    public static OperationControl withTimeoutMillis(Long millis) {
        return millis == null ? unbounded() : withTimeout(Duration.ofMillis(millis));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return deadlineNanos != 0L && System.nanoTime() - deadlineNanos >= 0;
    }

    public boolean shouldStop() {
        return isCancelled() || isExpired() || Thread.currentThread().isInterrupted();
    }

    /** 剩余毫秒数，不限时返回 Long.MAX_VALUE */
    public long remainingMillis() {
        if (deadlineNanos == 0L) return Long.MAX_VALUE;
        return Math.max(0L, (deadlineNanos - System.nanoTime()) / 1_000_000L);
    }

    public String stopReason() {
        if (isCancelled()) return "cancelled";
        if (isExpired()) return "timeout";
        if (Thread.currentThread().isInterrupted()) return "interrupted";
        return null;
    }
}
