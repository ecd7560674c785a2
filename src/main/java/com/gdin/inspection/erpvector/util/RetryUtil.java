package com.gdin.inspection.erpvector.util;

import com.gdin.inspection.erpvector.exception.TransientIoException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * 调用点重试：只重试 {@link TransientIoException}，指数退避，次数用尽后原样抛出。
 */
@Slf4j
public class RetryUtil {

    @Value
    public static class Policy {
        int maxAttempts;
        long backoffMillis;

        public static Policy of(int maxAttempts, long backoffMillis) {
            return new Policy(Math.max(1, maxAttempts), Math.max(0L, backoffMillis));
        }

        public static Policy none() {
            return new Policy(1, 0L);
        }
    }

    public static <T> T call(String what, Policy policy, Supplier<T> action) {
        Policy p = policy == null ? Policy.none() : policy;
        long backoff = p.getBackoffMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (TransientIoException e) {
                if (attempt >= p.getMaxAttempts()) {
                    log.error("{} failed after {} attempt(s): {}", what, attempt, e.getMessage());
                    throw e;
                }
                log.warn("{} failed (attempt {}/{}), retry in {}ms: {}", what, attempt, p.getMaxAttempts(), backoff, e.getMessage());
                sleep(backoff, e);
                backoff = backoff * 2;
            }
        }
    }

    public static void run(String what, Policy policy, Runnable action) {
        call(what, policy, () -> {
            action.run();
            return null;
        });
    }

    private static void sleep(long millis, TransientIoException cause) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientIoException("interrupted while waiting to retry", cause);
        }
    }
}
