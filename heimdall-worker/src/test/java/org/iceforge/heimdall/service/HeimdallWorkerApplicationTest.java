package org.iceforge.heimdall.service;

import org.iceforge.heimdall.execution.ExecutionLimits;
import org.iceforge.heimdall.lock.ChannelLockService;
import org.iceforge.heimdall.lock.LocalChannelLockService;
import org.iceforge.heimdall.model.BackendKind;
import org.iceforge.heimdall.model.ExecutionRequest;
import org.iceforge.heimdall.model.RequestStatus;
import org.iceforge.heimdall.model.SubmissionKind;
import org.iceforge.heimdall.worker.ExecutionRequestStore;
import org.iceforge.heimdall.worker.ExecutionWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:heimdall_worker;DB_CLOSE_DELAY=-1",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "heimdall.lock.store=local",
        "heimdall.queue.poll-interval=100ms",
        "heimdall.execution.max-result-rows=500",
        "heimdall.credentials.pg-1.username=heimdall_exec",
        "heimdall.credentials.pg-1.password=s3cret"
})
class HeimdallWorkerApplicationTest {

    private static final String REQUEST_ID = "6f1c2a9e-3b7d-4c1a-9e52-0d8f4a7b1c0e";
    private static final String GHOST_INSTANCE = "a3d5e7f9-1b2c-4d6e-8f0a-1c3e5a7b9dff";

    @Autowired
    private ChannelLockService locks;

    @Autowired
    private ExecutionLimits limits;

    @Autowired
    private ExecutionWorker worker;

    @Autowired
    private ApprovalDispatcher dispatcher;

    @Autowired
    private ExecutionRequestStore store;

    @Autowired
    private DataSource dataSource;

    @Test
    void context_wiresLocalLocksAndConfiguredLimits() {
        assertInstanceOf(LocalChannelLockService.class, locks);
        assertEquals(500, limits.maxResultRows());
        assertEquals(Duration.ofSeconds(60), limits.statementTimeout());
        assertTrue(worker.status().running());
    }

    @Test
    void onApproved_runsRequestThroughWorker_andRecordsOutcome() throws Exception {
        insertRequest(REQUEST_ID, GHOST_INSTANCE);
        ExecutionRequest request = store.findById(REQUEST_ID).orElseThrow();

        Optional<String> jobId = dispatcher.onApproved(request, "approver@example.com");
        assertTrue(jobId.isPresent());

        ExecutionRequest done = awaitOutcome(REQUEST_ID, Duration.ofSeconds(10));
        assertEquals(RequestStatus.FAILED, done.status());
        assertEquals("Database instance not found: " + GHOST_INSTANCE, done.executionError());
        assertNotNull(done.executedAt());
        assertFalse(locks.isHeld(request.channelKey()));
    }

    @Test
    void onApproved_rejectsRequestThatIsNotApproved() {
        ExecutionRequest pending = new ExecutionRequest("6f1c2a9e-3b7d-4c1a-9e52-0d8f4a7b1c0f", BackendKind.RELATIONAL,
                GHOST_INSTANCE, null, "orders", SubmissionKind.QUERY, "SELECT 1", null,
                "dev@example.com", RequestStatus.PENDING, null, null, false, null);

        assertThrows(IllegalArgumentException.class, () -> dispatcher.onApproved(pending, "a"));
    }

    private void insertRequest(String id, String instanceId) throws Exception {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("""
                     INSERT INTO query_requests (id, database_type, instance_id, database_name, submission_type,
                         query, user_email, status)
                     VALUES (?, 'postgresql', ?, 'orders', 'query', 'SELECT 1', 'dev@example.com', 'approved')
                     """)) {
            ps.setString(1, id);
            ps.setString(2, instanceId);
            ps.executeUpdate();
        }
    }

    private ExecutionRequest awaitOutcome(String id, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            ExecutionRequest r = store.findById(id).orElseThrow();
            if (r.status().isTerminalOutcome()) {
                return r;
            }
            Thread.sleep(50);
        }
        fail("request " + id + " was not executed within " + timeout);
        return null;
    }
}
