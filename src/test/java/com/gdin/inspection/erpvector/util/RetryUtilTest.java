package com.gdin.inspection.erpvector.util;

import com.gdin.inspection.erpvector.exception.TransientIoException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryUtilTest {

    @Test
    void retriesTransientFailures() {
        AtomicInteger attempts = new AtomicInteger();
        String value = RetryUtil.call("flaky", RetryUtil.Policy.of(3, 1), () -> {
            if (attempts.incrementAndGet() < 3) throw new TransientIoException("timeout");
            return "ok";
        });
        assertEquals("ok", value);
        assertEquals(3, attempts.get());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        TransientIoException e = assertThrows(TransientIoException.class, () -> RetryUtil.run("down", RetryUtil.Policy.of(2, 0), () -> {
            attempts.incrementAndGet();
            throw new TransientIoException("connection refused");
        }));
        assertEquals("connection refused", e.getMessage());
        assertEquals(2, attempts.get());
    }

    @Test
    void otherErrorsAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(IllegalArgumentException.class, () -> RetryUtil.call("bad", RetryUtil.Policy.of(5, 0), () -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("bad request");
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    void policyBounds() {
        assertEquals(1, RetryUtil.Policy.of(0, -5).getMaxAttempts());
        assertEquals(0L, RetryUtil.Policy.of(0, -5).getBackoffMillis());
        assertEquals(1, RetryUtil.Policy.none().getMaxAttempts());
    }
}
