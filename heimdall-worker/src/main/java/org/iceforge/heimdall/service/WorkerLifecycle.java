package org.iceforge.heimdall.service;

import org.iceforge.heimdall.execution.ExecutionRouter;
import org.iceforge.heimdall.lock.ChannelLockService;
import org.iceforge.heimdall.queue.JdbcJobQueue;
import org.iceforge.heimdall.service.config.HeimdallProperties;
import org.iceforge.heimdall.worker.ExecutionWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Starts the queue and worker with the context. Shutdown order: stop intake and drain the worker,
 * release held locks, close the queue, then close target connections.
 */
@Component
public class WorkerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerLifecycle.class);

    private final HeimdallProperties props;
    private final JdbcJobQueue queue;
    private final ExecutionWorker worker;
    private final ChannelLockService locks;
    private final ExecutionRouter router;
    private volatile boolean running;

    public WorkerLifecycle(HeimdallProperties props,
                           JdbcJobQueue queue,
                           ExecutionWorker worker,
                           ChannelLockService locks,
                           ExecutionRouter router) {
        this.props = Objects.requireNonNull(props, "props");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.router = Objects.requireNonNull(router, "router");
    }

    @Override
    public void start() {
        if (props.getQueue().isInitSchema()) {
            queue.init();
        }
        if (!props.getWorker().isEnabled()) {
            log.info("Execution worker disabled");
            this.running = true;
            return;
        }
        worker.start();
        this.running = true;
        log.info("Execution worker ready queueName={} concurrency={}",
                props.getQueue().getName(), props.getQueue().getConcurrency());
    }

    @Override
    public void stop() {
        this.running = false;
        log.info("Shutting down execution worker");
        try {
            worker.stop();
        } catch (RuntimeException e) {
            log.error("Worker stop failed: {}", e.toString());
        }
        try {
            locks.releaseAll();
        } catch (RuntimeException e) {
            log.error("Lock release failed: {}", e.toString());
        }
        try {
            queue.close();
        } catch (RuntimeException e) {
            log.error("Queue close failed: {}", e.toString());
        }
        router.close();
        log.info("Execution worker shut down");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
