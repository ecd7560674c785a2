package com.gdin.inspection.erpvector.integrity;

import com.gdin.inspection.erpvector.codec.PointAddressCodec;
import com.gdin.inspection.erpvector.query.OperationControl;
import com.gdin.inspection.erpvector.store.InMemoryVectorStore;
import com.gdin.inspection.erpvector.support.TestPoints;
import com.gdin.inspection.erpvector.support.TestSchemas;
import com.gdin.inspection.erpvector.util.RetryUtil;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class RepairCoordinatorTest {
    private static final String ACCOUNT = "account.account";
    private final InMemoryVectorStore store = new InMemoryVectorStore();

    private TargetRepairer writing(AtomicInteger calls) {
        return (model, ids, control) -> {
            calls.incrementAndGet();
            for (Long id : ids) store.upsert(List.of(TestPoints.simplePoint(model, TestSchemas.ACCOUNT_ID, id)), 1);
            return ids.size();
        };
    }

    @Test
    void repairedTargetsAreConfirmedInStore() {
        AtomicInteger calls = new AtomicInteger();
        RepairCoordinator coordinator = new RepairCoordinator(writing(calls), store, 1, RetryUtil.Policy.none());
        String a = PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 7);
        String b = PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 8);

        RepairOutcome outcome = coordinator.repair(ACCOUNT, List.of(a, b, a));
        assertEquals(2, outcome.getRequested());
        assertEquals(List.of(a, b), outcome.getRepaired());
        assertTrue(outcome.getUnrepairable().isEmpty());
        assertEquals(1, calls.get());
        assertEquals(0, coordinator.inFlightCount());
    }

    @Test
    void deletedSourceRecordsAreUnrepairable() {
        RepairCoordinator coordinator = new RepairCoordinator((model, ids, control) -> 0, store, 10, RetryUtil.Policy.none());
        String id = PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 9);
        RepairOutcome outcome = coordinator.repair(ACCOUNT, List.of(id));
        assertTrue(outcome.getRepaired().isEmpty());
        assertEquals(List.of(id), outcome.getUnrepairable());
    }

    @Test
    void targetsLeftWhenStoppedAreDeferred() {
        AtomicInteger calls = new AtomicInteger();
        RepairCoordinator coordinator = new RepairCoordinator((model, ids, control) -> {
            calls.incrementAndGet();
            // 写完第一条后超时
            store.upsert(List.of(TestPoints.simplePoint(model, TestSchemas.ACCOUNT_ID, ids.get(0))), 1);
            control.cancel();
            return 1;
        }, store, 10, RetryUtil.Policy.none());
        String a = PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 7);
        String b = PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 8);

        RepairOutcome outcome = coordinator.repair(ACCOUNT, List.of(a, b), OperationControl.unbounded());
        assertEquals(List.of(a), outcome.getRepaired());
        assertEquals(List.of(b), outcome.getDeferred());
        assertTrue(outcome.getUnrepairable().isEmpty());
        assertEquals(1, calls.get());

        OperationControl stopped = OperationControl.unbounded();
        stopped.cancel();
        String c = PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 9);
        RepairOutcome skipped = coordinator.repair(ACCOUNT, List.of(c), stopped);
        assertEquals(List.of(c), skipped.getDeferred());
        assertEquals(1, calls.get());
        assertEquals(0, coordinator.inFlightCount());
    }

    @Test
    void concurrentRepairOfSameTargetFetchesOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TargetRepairer delegate = writing(calls);
        TargetRepairer blocking = (model, ids, control) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return delegate.fetchAndUpsert(model, ids, control);
        };
        RepairCoordinator coordinator = new RepairCoordinator(blocking, store, 10, RetryUtil.Policy.none());
        String id = PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 7);

        AtomicReference<RepairOutcome> first = new AtomicReference<>();
        AtomicReference<RepairOutcome> second = new AtomicReference<>();
        Thread owner = new Thread(() -> first.set(coordinator.repair(ACCOUNT, List.of(id))));
        owner.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertEquals(1, coordinator.inFlightCount());

        Thread waiter = new Thread(() -> second.set(coordinator.repair(ACCOUNT, List.of(id))));
        waiter.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (waiter.getState() != Thread.State.WAITING && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        release.countDown();
        owner.join(5000);
        waiter.join(5000);

        assertEquals(1, calls.get());
        assertEquals(List.of(id), first.get().getRepaired());
        assertEquals(List.of(id), second.get().getRepaired());
        assertEquals(0, coordinator.inFlightCount());
    }

    @Test
    void repairerFailurePropagatesAndReleasesTargets() {
        RepairCoordinator coordinator = new RepairCoordinator((model, ids, control) -> {
            throw new IllegalStateException("erp down");
        }, store, 10, RetryUtil.Policy.none());
        String id = PointAddressCodec.encodeData(TestSchemas.ACCOUNT_ID, 7);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> coordinator.repair(ACCOUNT, List.of(id)));
        assertEquals("erp down", e.getMessage());
        assertEquals(0, coordinator.inFlightCount());
    }
}
