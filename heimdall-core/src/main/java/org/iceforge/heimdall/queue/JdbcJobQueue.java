package org.iceforge.heimdall.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Durable job queue stored in a table of the metadata store.
 *
 * <p>States: {@code CREATED -> ACTIVE -> COMPLETED}, or {@code ACTIVE -> RETRY -> ACTIVE ...} on
 * handler failure, ending in {@code FAILED} once the retry limit is used up. Jobs are claimed with a
 * compare-and-set update so several worker processes can poll the same table.
 *
 * <p>Only one job per channel key may be CREATED, RETRY or ACTIVE at a time. An outstanding job carries
 * its channel key in {@code singleton_key}, which is unique per queue and cleared once the job is
 * COMPLETED or FAILED, so concurrent enqueues for one channel admit exactly one job.
 */
public class JdbcJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobQueue.class);

    static final String TABLE = "heimdall_job";
    private static final int MAX_ERROR_CHARS = 2000;
    private static final String UNIQUE_VIOLATION = "23505";
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    enum State { CREATED, RETRY, ACTIVE, COMPLETED, FAILED }

    private final DataSource dataSource;
    private final QueueSettings settings;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final ExecutorService jobPool;
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private volatile ScheduledExecutorService poller;

    public JdbcJobQueue(DataSource dataSource, QueueSettings settings) {
        this(dataSource, settings, Clock.systemUTC());
    }

    public JdbcJobQueue(DataSource dataSource, QueueSettings settings, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.jobPool = Executors.newFixedThreadPool(settings.batchSize(), r -> {
            Thread t = new Thread(r, "heimdall-job");
            t.setDaemon(true);
            return t;
        });
    }

    /** Create the job table if it does not exist yet. */
    public void init() {
        try (Connection c = dataSource.getConnection(); Statement st = c.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS heimdall_job (
                        job_id VARCHAR(64) PRIMARY KEY,
                        queue_name VARCHAR(128) NOT NULL,
                        channel_key VARCHAR(512) NOT NULL,
                        singleton_key VARCHAR(512),
                        request_id VARCHAR(128) NOT NULL,
                        approver_id VARCHAR(255),
                        state VARCHAR(16) NOT NULL,
                        retry_count INTEGER NOT NULL,
                        retry_limit INTEGER NOT NULL,
                        start_after_ms BIGINT NOT NULL,
                        started_at_ms BIGINT,
                        completed_at_ms BIGINT,
                        last_error VARCHAR(2000),
                        created_at_ms BIGINT NOT NULL,
                        updated_at_ms BIGINT NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_heimdall_job_due ON heimdall_job(queue_name, state, start_after_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_heimdall_job_channel ON heimdall_job(queue_name, channel_key, state)");
            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS idx_heimdall_job_singleton ON heimdall_job(queue_name, singleton_key)");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize job table", e);
        }
        log.info("Job queue initialized queueName={} batchSize={}", settings.queueName(), settings.batchSize());
    }

    @Override
    public Optional<String> enqueue(String channelKey, String requestId, String approverId) {
        Objects.requireNonNull(channelKey, "channelKey");
        Objects.requireNonNull(requestId, "requestId");

        long now = clock.millis();
        String jobId = newJobId(now);
        String outstanding = "SELECT COUNT(*) FROM heimdall_job WHERE queue_name=? AND channel_key=? AND state IN (?,?,?)";
        String insert = "INSERT INTO heimdall_job(job_id,queue_name,channel_key,singleton_key,request_id,approver_id,state,"
                + "retry_count,retry_limit,start_after_ms,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?,?,?)";

        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement check = c.prepareStatement(outstanding); PreparedStatement ins = c.prepareStatement(insert)) {
                check.setString(1, settings.queueName());
                check.setString(2, channelKey);
                check.setString(3, State.CREATED.name());
                check.setString(4, State.RETRY.name());
                check.setString(5, State.ACTIVE.name());
                try (ResultSet rs = check.executeQuery()) {
                    if (rs.next() && rs.getLong(1) > 0) {
                        c.rollback();
                        log.warn("Job not admitted, channel already has an outstanding job channelKey={} requestId={}",
                                channelKey, requestId);
                        return Optional.empty();
                    }
                }

                ins.setString(1, jobId);
                ins.setString(2, settings.queueName());
                ins.setString(3, channelKey);
                ins.setString(4, channelKey);
                ins.setString(5, requestId);
                ins.setString(6, approverId);
                ins.setString(7, State.CREATED.name());
                ins.setInt(8, 0);
                ins.setInt(9, settings.retryLimit());
                ins.setLong(10, now);
                ins.setLong(11, now);
                ins.setLong(12, now);
                ins.executeUpdate();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    log.warn("Job not admitted, concurrent enqueue won the channel channelKey={} requestId={}",
                            channelKey, requestId);
                    return Optional.empty();
                }
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to enqueue job for requestId=" + requestId, e);
        }

        log.info("Job enqueued jobId={} channelKey={} requestId={}", jobId, channelKey, requestId);
        return Optional.of(jobId);
    }

    @Override
    public void work(JobHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (!polling.compareAndSet(false, true)) {
            log.warn("Job queue already polling queueName={}", settings.queueName());
            return;
        }
        ScheduledExecutorService s = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heimdall-queue-poller");
            t.setDaemon(true);
            return t;
        });
        this.poller = s;
        s.scheduleWithFixedDelay(() -> {
            if (!polling.get()) return;
            try {
                expireStaleJobs();
                processBatch(handler);
            } catch (RuntimeException e) {
                log.error("Job queue poll failed queueName={}: {}", settings.queueName(), e.toString());
            }
        }, 0L, settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("Job queue polling started queueName={} pollIntervalMs={}", settings.queueName(), settings.pollInterval().toMillis());
    }

    /**
     * Claim one batch of due jobs and run it on the job pool, waiting until every job of the batch has
     * finished. Returns the number of jobs claimed.
     */
    public int processBatch(JobHandler handler) {
        List<QueueJob> batch = claimDue(settings.batchSize());
        if (batch.isEmpty()) {
            return 0;
        }

        List<Future<?>> running = new ArrayList<>(batch.size());
        for (QueueJob job : batch) {
            running.add(jobPool.submit(() -> runOne(handler, job)));
        }
        for (Future<?> f : running) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                log.error("Unexpected job pool failure: {}", e.getCause() == null ? e.toString() : e.getCause().toString());
            }
        }
        return batch.size();
    }

    private void runOne(JobHandler handler, QueueJob job) {
        try {
            handler.handle(job);
            complete(job.jobId());
        } catch (Exception e) {
            fail(job.jobId(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    List<QueueJob> claimDue(int limit) {
        long now = clock.millis();
        String select = "SELECT job_id,channel_key,request_id,approver_id,retry_count FROM heimdall_job "
                + "WHERE queue_name=? AND state IN (?,?) AND start_after_ms<=? ORDER BY created_at_ms ASC LIMIT ?";
        String claim = "UPDATE heimdall_job SET state=?,started_at_ms=?,updated_at_ms=? WHERE job_id=? AND state IN (?,?)";

        List<QueueJob> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement s = c.prepareStatement(select); PreparedStatement up = c.prepareStatement(claim)) {
                s.setString(1, settings.queueName());
                s.setString(2, State.CREATED.name());
                s.setString(3, State.RETRY.name());
                s.setLong(4, now);
                s.setInt(5, limit);
                List<QueueJob> candidates = new ArrayList<>();
                try (ResultSet rs = s.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(new QueueJob(rs.getString("job_id"), rs.getString("channel_key"),
                                rs.getString("request_id"), rs.getString("approver_id"), rs.getInt("retry_count")));
                    }
                }
                for (QueueJob job : candidates) {
                    up.setString(1, State.ACTIVE.name());
                    up.setLong(2, now);
                    up.setLong(3, now);
                    up.setString(4, job.jobId());
                    up.setString(5, State.CREATED.name());
                    up.setString(6, State.RETRY.name());
                    if (up.executeUpdate() == 1) out.add(job);
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to claim jobs for queue " + settings.queueName(), e);
        }
        return out;
    }

    void complete(String jobId) {
        long now = clock.millis();
        String sql = "UPDATE heimdall_job SET state=?,singleton_key=NULL,completed_at_ms=?,updated_at_ms=? WHERE job_id=? AND state=?";
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, State.COMPLETED.name());
            ps.setLong(2, now);
            ps.setLong(3, now);
            ps.setString(4, jobId);
            ps.setString(5, State.ACTIVE.name());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to complete job " + jobId, e);
        }
    }

    /**
     * Hand a failed ACTIVE job back to the retry schedule, or abandon it once the retry limit is used up.
     */
    void fail(String jobId, String error) {
        long now = clock.millis();
        String select = "SELECT retry_count,retry_limit FROM heimdall_job WHERE job_id=? AND state=?";
        String retry = "UPDATE heimdall_job SET state=?,retry_count=?,start_after_ms=?,last_error=?,updated_at_ms=? WHERE job_id=? AND state=?";
        String abandon = "UPDATE heimdall_job SET state=?,singleton_key=NULL,completed_at_ms=?,last_error=?,updated_at_ms=? "
                + "WHERE job_id=? AND state=?";

        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement s = c.prepareStatement(select)) {
                s.setString(1, jobId);
                s.setString(2, State.ACTIVE.name());
                int retryCount;
                int retryLimit;
                try (ResultSet rs = s.executeQuery()) {
                    if (!rs.next()) {
                        c.rollback();
                        return;
                    }
                    retryCount = rs.getInt(1);
                    retryLimit = rs.getInt(2);
                }

                String message = truncate(error);
                if (retryCount < retryLimit) {
                    long delay = retryDelayMillis(retryCount);
                    try (PreparedStatement up = c.prepareStatement(retry)) {
                        up.setString(1, State.RETRY.name());
                        up.setInt(2, retryCount + 1);
                        up.setLong(3, now + delay);
                        up.setString(4, message);
                        up.setLong(5, now);
                        up.setString(6, jobId);
                        up.setString(7, State.ACTIVE.name());
                        up.executeUpdate();
                    }
                    log.info("Job scheduled for retry jobId={} retry={}/{} delayMs={} error={}",
                            jobId, retryCount + 1, retryLimit, delay, message);
                } else {
                    try (PreparedStatement up = c.prepareStatement(abandon)) {
                        up.setString(1, State.FAILED.name());
                        up.setLong(2, now);
                        up.setString(3, message);
                        up.setLong(4, now);
                        up.setString(5, jobId);
                        up.setString(6, State.ACTIVE.name());
                        up.executeUpdate();
                    }
                    log.warn("Job abandoned after {} retries jobId={} error={}", retryLimit, jobId, message);
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to record failure for job " + jobId, e);
        }
    }

    /**
     * Fail every ACTIVE job that has been running longer than {@link QueueSettings#expireAfter()}.
     * Returns the number of expired jobs.
     */
    public int expireStaleJobs() {
        long cutoff = clock.millis() - settings.expireAfter().toMillis();
        String sql = "SELECT job_id FROM heimdall_job WHERE queue_name=? AND state=? AND started_at_ms<?";
        List<String> stale = new ArrayList<>();
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, settings.queueName());
            ps.setString(2, State.ACTIVE.name());
            ps.setLong(3, cutoff);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) stale.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to scan expired jobs", e);
        }
        for (String jobId : stale) {
            fail(jobId, "job expired after " + settings.expireAfter().toSeconds() + "s");
        }
        return stale.size();
    }

    /** Current state of a job, mainly for diagnostics. */
    public Optional<String> state(String jobId) {
        String sql = "SELECT state FROM heimdall_job WHERE job_id=?";
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read job " + jobId, e);
        }
    }

    @Override
    public void stopWork() {
        if (polling.compareAndSet(true, false)) {
            ScheduledExecutorService s = poller;
            if (s != null) {
                s.shutdown();
            }
            log.info("Job queue polling stopped queueName={}", settings.queueName());
        }
    }

    @Override
    public void close() {
        stopWork();
        jobPool.shutdown();
        try {
            if (!jobPool.awaitTermination(5, TimeUnit.SECONDS)) {
                jobPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            jobPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Job queue shut down queueName={}", settings.queueName());
    }

    long retryDelayMillis(int retryCount) {
        long base = Math.max(1L, settings.retryDelay().toMillis());
        int shift = Math.min(retryCount, 20);
        return base << shift;
    }

    private String newJobId(long nowMs) {
        StringBuilder sb = new StringBuilder("job_").append(nowMs).append('_');
        for (int i = 0; i < 7; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    private static String truncate(String raw) {
        if (raw == null) return null;
        return raw.length() <= MAX_ERROR_CHARS ? raw : raw.substring(0, MAX_ERROR_CHARS - 3) + "...";
    }
}
