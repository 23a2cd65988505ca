package org.iceforge.heimdall.service;

import org.iceforge.heimdall.execution.ExecutionRouter;
import org.iceforge.heimdall.lock.ChannelLockService;
import org.iceforge.heimdall.queue.JdbcJobQueue;
import org.iceforge.heimdall.service.config.HeimdallProperties;
import org.iceforge.heimdall.worker.ExecutionWorker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkerLifecycleTest {

    private HeimdallProperties props;
    private JdbcJobQueue queue;
    private ExecutionWorker worker;
    private ChannelLockService locks;
    private ExecutionRouter router;
    private WorkerLifecycle lifecycle;

    @BeforeEach
    void setup() {
        props = new HeimdallProperties();
        queue = mock(JdbcJobQueue.class);
        worker = mock(ExecutionWorker.class);
        locks = mock(ChannelLockService.class);
        router = mock(ExecutionRouter.class);
        lifecycle = new WorkerLifecycle(props, queue, worker, locks, router);
    }

    @Test
    void start_initializesQueueThenStartsWorker() {
        lifecycle.start();

        InOrder order = inOrder(queue, worker);
        order.verify(queue).init();
        order.verify(worker).start();
        assertTrue(lifecycle.isRunning());
    }

    @Test
    void start_skipsWorker_whenDisabled() {
        props.getWorker().setEnabled(false);
        props.getQueue().setInitSchema(false);

        lifecycle.start();

        verify(queue, never()).init();
        verify(worker, never()).start();
    }

    @Test
    void stop_drainsWorkerBeforeReleasingLocksAndClosing() {
        lifecycle.start();
        lifecycle.stop();

        InOrder order = inOrder(worker, locks, queue, router);
        order.verify(worker).stop();
        order.verify(locks).releaseAll();
        order.verify(queue).close();
        order.verify(router).close();
        assertFalse(lifecycle.isRunning());
    }

    @Test
    void stop_keepsGoing_whenAStepFails() {
        doThrow(new IllegalStateException("metadata store down")).when(locks).releaseAll();

        lifecycle.stop();

        verify(queue).close();
        verify(router).close();
    }
}
