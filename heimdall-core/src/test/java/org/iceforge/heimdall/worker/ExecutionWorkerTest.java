package org.iceforge.heimdall.worker;

import org.iceforge.heimdall.execution.ExecutionRouter;
import org.iceforge.heimdall.lock.ChannelLockService;
import org.iceforge.heimdall.lock.LocalChannelLockService;
import org.iceforge.heimdall.model.BackendKind;
import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.ExecutionRequest;
import org.iceforge.heimdall.model.FailureCategory;
import org.iceforge.heimdall.model.RequestStatus;
import org.iceforge.heimdall.model.SubmissionKind;
import org.iceforge.heimdall.queue.JobQueue;
import org.iceforge.heimdall.queue.QueueJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExecutionWorkerTest {

    private static final String CHANNEL = "postgresql:pg-1:orders";

    private JobQueue queue;
    private ChannelLockService locks;
    private ExecutionRequestStore store;
    private ExecutionRouter router;
    private ExecutionNotifier notifier;
    private ExecutionWorker worker;

    @BeforeEach
    void setup() {
        queue = mock(JobQueue.class);
        locks = mock(ChannelLockService.class);
        store = mock(ExecutionRequestStore.class);
        router = mock(ExecutionRouter.class);
        notifier = mock(ExecutionNotifier.class);
        when(locks.tryAcquire(CHANNEL)).thenReturn(true);
        worker = new ExecutionWorker(queue, locks, store, router, notifier, Duration.ofSeconds(2));
    }

    @AfterEach
    void teardown() {
        worker.stop();
    }

    private static QueueJob job(String requestId) {
        return new QueueJob("job_1_abcdefg", CHANNEL, requestId, "approver@example.com", 0);
    }

    private static ExecutionRequest request(String id, RequestStatus status) {
        return new ExecutionRequest(id, BackendKind.RELATIONAL, "pg-1", "orders-primary", "orders", SubmissionKind.QUERY,
                "UPDATE orders SET flagged = true WHERE id = 7", null, "dev@example.com", status, null, null, false, null);
    }

    @Test
    void processJob_executesPersistsAndNotifies_insideLock() throws Exception {
        ExecutionRequest req = request("req-1", RequestStatus.APPROVED);
        ExecutionOutcome outcome = ExecutionOutcome.success("1 row(s) affected", 1L);
        when(store.findById("req-1")).thenReturn(Optional.of(req));
        when(router.executeRequest(req)).thenReturn(outcome);
        when(store.setExecutionOutcome("req-1", outcome)).thenReturn(Optional.of(req.withOutcome(outcome)));

        worker.processJob(job("req-1"));

        InOrder order = inOrder(locks, store, router, notifier);
        order.verify(locks).tryAcquire(CHANNEL);
        order.verify(store).findById("req-1");
        order.verify(router).executeRequest(req);
        order.verify(store).setExecutionOutcome("req-1", outcome);
        order.verify(notifier).notify(eq(NotificationKind.REQUEST_RESULT), any(), eq("approver@example.com"), eq(outcome), isNull());
        order.verify(notifier).notify(eq(NotificationKind.EXECUTION_SUCCESS), any(), eq("approver@example.com"), eq(outcome), isNull());
        order.verify(locks).release(CHANNEL);
        assertEquals(0, worker.status().activeJobs());
    }

    @Test
    void processJob_broadcastsFailure_forFailedOutcome() throws Exception {
        ExecutionRequest req = request("req-1", RequestStatus.APPROVED);
        ExecutionOutcome outcome = ExecutionOutcome.failure(FailureCategory.TIMEOUT, "Query exceeded 60 second timeout.");
        when(store.findById("req-1")).thenReturn(Optional.of(req));
        when(router.executeRequest(req)).thenReturn(outcome);
        when(store.setExecutionOutcome("req-1", outcome)).thenReturn(Optional.of(req.withOutcome(outcome)));

        worker.processJob(job("req-1"));

        verify(notifier).notify(eq(NotificationKind.EXECUTION_FAILED), any(), any(), eq(outcome), isNull());
        verify(notifier, never()).notify(eq(NotificationKind.EXECUTION_SUCCESS), any(), any(), any(), any());
    }

    @Test
    void processJob_throwsRetryableSignal_whenLockUnavailable() {
        when(locks.tryAcquire(CHANNEL)).thenReturn(false);

        LockUnavailableException ex = assertThrows(LockUnavailableException.class, () -> worker.processJob(job("req-1")));

        assertEquals(CHANNEL, ex.channelKey());
        verifyNoInteractions(store, router, notifier);
        verify(locks, never()).release(anyString());
        assertEquals(0, worker.status().activeJobs());
    }

    @Test
    void processJob_skipsRequestWithRecordedOutcome() throws Exception {
        when(store.findById("req-1")).thenReturn(Optional.of(request("req-1", RequestStatus.EXECUTED)));

        worker.processJob(job("req-1"));

        verifyNoInteractions(router, notifier);
        verify(store, never()).setExecutionOutcome(anyString(), any());
        verify(locks).release(CHANNEL);
    }

    @Test
    void processJob_finishesQuietly_whenRequestIsGone() throws Exception {
        when(store.findById("req-1")).thenReturn(Optional.empty());

        assertDoesNotThrow(() -> worker.processJob(job("req-1")));

        verifyNoInteractions(router);
        verify(locks).release(CHANNEL);
    }

    @Test
    void processJob_ignoresNotifierFailures() throws Exception {
        ExecutionRequest req = request("req-1", RequestStatus.APPROVED);
        ExecutionOutcome outcome = ExecutionOutcome.success("[]", 0L);
        when(store.findById("req-1")).thenReturn(Optional.of(req));
        when(router.executeRequest(req)).thenReturn(outcome);
        when(store.setExecutionOutcome("req-1", outcome)).thenReturn(Optional.of(req.withOutcome(outcome)));
        doThrow(new IllegalStateException("webhook down")).when(notifier).notify(any(), any(), any(), any(), any());

        assertDoesNotThrow(() -> worker.processJob(job("req-1")));

        verify(notifier, times(2)).notify(any(), any(), any(), any(), any());
        verify(locks).release(CHANNEL);
    }

    @Test
    void processJob_recordsFailureAndRethrows_whenPersistenceFails() {
        ExecutionRequest req = request("req-1", RequestStatus.APPROVED);
        ExecutionOutcome outcome = ExecutionOutcome.success("[]", 0L);
        when(store.findById("req-1")).thenReturn(Optional.of(req));
        when(router.executeRequest(req)).thenReturn(outcome);
        when(store.setExecutionOutcome(eq("req-1"), any()))
                .thenThrow(new IllegalStateException("metadata store unavailable"))
                .thenReturn(Optional.empty());

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> worker.processJob(job("req-1")));

        assertEquals("metadata store unavailable", ex.getMessage());
        verify(store, times(2)).setExecutionOutcome(eq("req-1"), any());
        verify(notifier).notify(eq(NotificationKind.EXECUTION_FAILED), any(), any(), any(), eq("metadata store unavailable"));
        verify(locks).release(CHANNEL);
        assertEquals(0, worker.status().activeJobs());
    }

    @Test
    void processJob_keepsExecutedOutcome_whenReReadAfterWriteFails() {
        ExecutionRequest req = request("req-1", RequestStatus.APPROVED);
        ExecutionOutcome outcome = ExecutionOutcome.success("[]", 0L);
        when(store.findById("req-1"))
                .thenReturn(Optional.of(req))
                .thenReturn(Optional.of(req.withOutcome(outcome)));
        when(router.executeRequest(req)).thenReturn(outcome);
        when(store.setExecutionOutcome(eq("req-1"), any()))
                .thenThrow(new IllegalStateException("Failed to load request req-1"))
                .thenReturn(Optional.empty());

        assertThrows(IllegalStateException.class, () -> worker.processJob(job("req-1")));

        verify(notifier, never()).notify(eq(NotificationKind.EXECUTION_FAILED), any(), any(), any(), any());
        verify(notifier, never()).notify(eq(NotificationKind.REQUEST_RESULT), any(), any(), any(), any());
        verify(locks).release(CHANNEL);
    }

    @Test
    void processJob_runsOneJobPerChannel_acrossConcurrentCallers() throws Exception {
        LocalChannelLockService realLocks = new LocalChannelLockService();
        ExecutionWorker shared = new ExecutionWorker(queue, realLocks, store, router, notifier, Duration.ofSeconds(1));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch refusal = new CountDownLatch(1);
        when(store.findById(anyString())).thenAnswer(inv -> Optional.of(request(inv.getArgument(0), RequestStatus.APPROVED)));
        when(router.executeRequest(any())).thenAnswer(inv -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            refusal.await(5, TimeUnit.SECONDS);
            inFlight.decrementAndGet();
            return ExecutionOutcome.success("[]", 0L);
        });
        when(store.setExecutionOutcome(anyString(), any())).thenReturn(Optional.empty());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger refused = new AtomicInteger();
        try {
            List<Future<?>> calls = new ArrayList<>();
            for (String id : new String[] {"req-1", "req-2"}) {
                calls.add(pool.submit(() -> {
                    go.await();
                    try {
                        shared.processJob(new QueueJob("job_" + id, CHANNEL, id, "a", 0));
                    } catch (LockUnavailableException e) {
                        refused.incrementAndGet();
                        refusal.countDown();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> call : calls) {
                call.get(5, TimeUnit.SECONDS);
            }

            assertEquals(1, maxInFlight.get());
            assertEquals(1, refused.get());
            assertFalse(realLocks.isHeld(CHANNEL));
        } finally {
            pool.shutdownNow();
            realLocks.releaseAll();
        }
    }

    @Test
    void processJob_serializesJobsOfOneChannel() throws Exception {
        LocalChannelLockService realLocks = new LocalChannelLockService();
        ExecutionWorker serial = new ExecutionWorker(queue, realLocks, store, router, notifier, Duration.ofSeconds(1));
        ExecutionRequest first = request("req-1", RequestStatus.APPROVED);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        when(store.findById("req-1")).thenReturn(Optional.of(first));
        when(router.executeRequest(first)).thenAnswer(inv -> {
            entered.countDown();
            assertTrue(proceed.await(5, TimeUnit.SECONDS));
            return ExecutionOutcome.success("[]", 0L);
        });
        when(store.setExecutionOutcome(eq("req-1"), any())).thenReturn(Optional.empty());

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> running = pool.submit(() -> {
                serial.processJob(job("req-1"));
                return null;
            });
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertThrows(LockUnavailableException.class,
                    () -> serial.processJob(new QueueJob("job_2_bbbbbbb", CHANNEL, "req-2", "a", 0)));

            proceed.countDown();
            running.get(5, TimeUnit.SECONDS);
            assertFalse(realLocks.isHeld(CHANNEL));
        } finally {
            proceed.countDown();
            pool.shutdownNow();
            realLocks.releaseAll();
        }
    }

    @Test
    void start_registersWithQueue_andStopDrainsActiveJobs() throws Exception {
        ExecutionRequest req = request("req-1", RequestStatus.APPROVED);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        when(store.findById("req-1")).thenReturn(Optional.of(req));
        when(router.executeRequest(req)).thenAnswer(inv -> {
            entered.countDown();
            proceed.await(5, TimeUnit.SECONDS);
            return ExecutionOutcome.success("[]", 0L);
        });
        when(store.setExecutionOutcome(eq("req-1"), any())).thenReturn(Optional.empty());

        worker.start();
        verify(queue).work(worker);
        assertTrue(worker.status().running());

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> {
                worker.processJob(job("req-1"));
                return null;
            });
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertEquals(1, worker.status().activeJobs());

            // pool is busy inside processJob, the release has to come from elsewhere
            ExecutorService releaser = Executors.newSingleThreadExecutor();
            ExecutorService stopper = Executors.newSingleThreadExecutor();
            try {
                releaser.submit(() -> {
                    Thread.sleep(200);
                    proceed.countDown();
                    return null;
                });
                stopper.submit(() -> worker.stop()).get(5, TimeUnit.SECONDS);
            } finally {
                releaser.shutdownNow();
                stopper.shutdownNow();
            }

            verify(queue).stopWork();
            assertFalse(worker.status().running());
            assertEquals(0, worker.status().activeJobs());
        } finally {
            proceed.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void stop_givesUp_afterDrainTimeout() throws Exception {
        ExecutionWorker impatient = new ExecutionWorker(queue, locks, store, router, notifier, Duration.ofMillis(300));
        ExecutionRequest req = request("req-1", RequestStatus.APPROVED);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        when(store.findById("req-1")).thenReturn(Optional.of(req));
        when(router.executeRequest(req)).thenAnswer(inv -> {
            entered.countDown();
            proceed.await(5, TimeUnit.SECONDS);
            return ExecutionOutcome.success("[]", 0L);
        });

        impatient.start();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> {
                impatient.processJob(job("req-1"));
                return null;
            });
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            long start = System.nanoTime();
            impatient.stop();
            long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertFalse(impatient.status().running());
            assertEquals(1, impatient.status().activeJobs());
            assertTrue(waitedMs >= 250, "waited " + waitedMs + "ms");
        } finally {
            proceed.countDown();
            pool.shutdownNow();
        }
    }
}
