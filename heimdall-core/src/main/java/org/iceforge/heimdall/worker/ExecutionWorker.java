package org.iceforge.heimdall.worker;

import org.iceforge.heimdall.execution.ExecutionRouter;
import org.iceforge.heimdall.lock.ChannelLockService;
import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.ExecutionRequest;
import org.iceforge.heimdall.model.FailureCategory;
import org.iceforge.heimdall.model.RequestStatus;
import org.iceforge.heimdall.queue.JobHandler;
import org.iceforge.heimdall.queue.JobQueue;
import org.iceforge.heimdall.queue.QueueJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes execution jobs. Each job runs under its channel lock, so for one channel the sequence
 * execute, persist, notify of a job completes before the next job's sequence starts.
 *
 * <p>Delivery is at-least-once; a request that already carries an outcome is never executed again.
 */
public class ExecutionWorker implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionWorker.class);
    private static final Logger audit = LoggerFactory.getLogger("heimdall.audit");

    static final Duration DRAIN_POLL_INTERVAL = Duration.ofMillis(100);

    private final JobQueue queue;
    private final ChannelLockService locks;
    private final ExecutionRequestStore store;
    private final ExecutionRouter router;
    private final ExecutionNotifier notifier;
    private final Duration drainTimeout;

    private final AtomicInteger activeJobs = new AtomicInteger();
    private volatile boolean running;

    public ExecutionWorker(JobQueue queue,
                           ChannelLockService locks,
                           ExecutionRequestStore store,
                           ExecutionRouter router,
                           ExecutionNotifier notifier,
                           Duration drainTimeout) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.store = Objects.requireNonNull(store, "store");
        this.router = Objects.requireNonNull(router, "router");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.drainTimeout = drainTimeout == null ? Duration.ofSeconds(30) : drainTimeout;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Worker already running");
            return;
        }
        queue.work(this);
        running = true;
        log.info("Worker started");
    }

    /**
     * Stops intake and waits for in-flight jobs, up to the drain timeout. Reports stopped either way.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        queue.stopWork();
        log.info("Stopping worker, waiting for active jobs activeJobs={}", activeJobs.get());

        long deadline = System.nanoTime() + drainTimeout.toNanos();
        while (activeJobs.get() > 0 && System.nanoTime() < deadline) {
            try {
                Thread.sleep(DRAIN_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        running = false;
        if (activeJobs.get() > 0) {
            log.warn("Worker stopped with jobs still active activeJobs={}", activeJobs.get());
        } else {
            log.info("Worker stopped");
        }
    }

    public WorkerStatus status() {
        return new WorkerStatus(running, activeJobs.get());
    }

    @Override
    public void handle(QueueJob job) throws Exception {
        processJob(job);
    }

    public void processJob(QueueJob job) throws Exception {
        activeJobs.incrementAndGet();
        log.info("Processing job jobId={} channel={} requestId={} attempt={}",
                job.jobId(), job.channelKey(), job.requestId(), job.attempt());

        boolean locked;
        try {
            locked = locks.tryAcquire(job.channelKey());
        } catch (RuntimeException e) {
            activeJobs.decrementAndGet();
            throw e;
        }
        if (!locked) {
            activeJobs.decrementAndGet();
            log.info("Lock unavailable, job will retry jobId={} channel={}", job.jobId(), job.channelKey());
            throw new LockUnavailableException(job.channelKey());
        }
        audit.info("lock acquired channel={} jobId={}", job.channelKey(), job.jobId());

        boolean persisted = false;
        try {
            Optional<ExecutionRequest> found = store.findById(job.requestId());
            if (found.isEmpty()) {
                log.error("Request not found jobId={} requestId={}", job.jobId(), job.requestId());
                return;
            }
            ExecutionRequest request = found.get();
            if (request.status().isTerminalOutcome()) {
                log.info("Request already processed, skipping jobId={} requestId={} status={}",
                        job.jobId(), request.id(), request.status().wireName());
                return;
            }

            log.info("Executing jobId={} requestId={} backend={} submission={}", job.jobId(), request.id(),
                    request.backendKind().wireName(), request.submissionKind().wireName());
            ExecutionOutcome outcome = router.executeRequest(request);

            ExecutionRequest updated = store.setExecutionOutcome(request.id(), outcome)
                    .orElseGet(() -> request.withOutcome(outcome));
            persisted = true;

            if (outcome.success()) {
                audit.info("execution succeeded requestId={} jobId={} channel={} approver={} rowCount={}",
                        request.id(), job.jobId(), job.channelKey(), job.approverId(), outcome.rowCount());
            } else {
                audit.info("execution failed requestId={} jobId={} channel={} approver={} category={} error={}",
                        request.id(), job.jobId(), job.channelKey(), job.approverId(), outcome.category(), outcome.error());
            }

            sendNotifications(updated, outcome, job.approverId(), null);
            log.info("Job completed jobId={} requestId={} success={} rowCount={}",
                    job.jobId(), request.id(), outcome.success(), outcome.rowCount());
        } catch (Exception e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Job execution failed jobId={} requestId={} channel={}: {}",
                    job.jobId(), job.requestId(), job.channelKey(), message, e);
            if (persisted) {
                log.warn("Outcome already recorded, keeping it requestId={}", job.requestId());
            } else {
                recordFailure(job, message);
            }
            throw e;
        } finally {
            locks.release(job.channelKey());
            audit.info("lock released channel={} jobId={}", job.channelKey(), job.jobId());
            activeJobs.decrementAndGet();
        }
    }

    private void recordFailure(QueueJob job, String message) {
        ExecutionOutcome failure = ExecutionOutcome.failure(FailureCategory.EXECUTION, message);
        Optional<ExecutionRequest> request;
        try {
            store.setExecutionOutcome(job.requestId(), failure);
            request = store.findById(job.requestId());
        } catch (RuntimeException e) {
            log.error("Failed to record failure outcome requestId={}: {}", job.requestId(), e.toString());
            return;
        }
        if (request.isPresent() && request.get().status() == RequestStatus.EXECUTED) {
            log.warn("Request already executed, failure not reported requestId={}", job.requestId());
            return;
        }
        request.ifPresent(r -> sendNotifications(r, failure, job.approverId(), message));
    }

    private void sendNotifications(ExecutionRequest request, ExecutionOutcome outcome, String approverId, String reason) {
        NotificationKind broadcast = outcome.success() ? NotificationKind.EXECUTION_SUCCESS : NotificationKind.EXECUTION_FAILED;
        for (NotificationKind kind : new NotificationKind[] {NotificationKind.REQUEST_RESULT, broadcast}) {
            try {
                notifier.notify(kind, request, approverId, outcome, reason);
            } catch (RuntimeException e) {
                log.error("Failed to send notification kind={} requestId={}: {}", kind, request.id(), e.toString());
            }
        }
    }
}
