package org.iceforge.heimdall.service.store;

import org.h2.jdbcx.JdbcDataSource;
import org.iceforge.heimdall.model.BackendKind;
import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.ExecutionRequest;
import org.iceforge.heimdall.model.FailureCategory;
import org.iceforge.heimdall.model.RequestStatus;
import org.iceforge.heimdall.model.SubmissionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdbcExecutionRequestStoreTest {

    private static final String REQ_1 = "6f1c2a9e-3b7d-4c1a-9e52-0d8f4a7b1c01";
    private static final String REQ_2 = "6f1c2a9e-3b7d-4c1a-9e52-0d8f4a7b1c02";
    private static final String PG_1 = "a3d5e7f9-1b2c-4d6e-8f0a-1c3e5a7b9d01";
    private static final String MG_1 = "a3d5e7f9-1b2c-4d6e-8f0a-1c3e5a7b9d02";
    private static final String UNKNOWN = "00000000-0000-4000-8000-000000000000";

    private JdbcDataSource ds;
    private JdbcExecutionRequestStore store;

    @BeforeEach
    void setup() throws Exception {
        ds = MetadataSchema.newDataSource();
        MetadataSchema.execute(ds, """
                INSERT INTO query_requests (id, database_type, instance_id, instance_name, database_name,
                    submission_type, query, user_email, status)
                VALUES ('%s', 'postgresql', '%s', 'orders-primary', 'orders', 'query',
                    'SELECT * FROM orders', 'dev@example.com', 'approved')
                """.formatted(REQ_1, PG_1));
        MetadataSchema.execute(ds, """
                INSERT INTO query_requests (id, database_type, instance_id, database_name,
                    submission_type, script_content, user_email, status)
                VALUES ('%s', 'mongodb', '%s', 'events', 'script',
                    'console.log(connections.length)', 'ops@example.com', 'approved')
                """.formatted(REQ_2, MG_1));
        store = new JdbcExecutionRequestStore(ds);
    }

    @Test
    void findById_mapsRow() {
        ExecutionRequest req = store.findById(REQ_1).orElseThrow();

        assertEquals(BackendKind.RELATIONAL, req.backendKind());
        assertEquals(SubmissionKind.QUERY, req.submissionKind());
        assertEquals(RequestStatus.APPROVED, req.status());
        assertEquals("orders-primary", req.instanceName());
        assertEquals("SELECT * FROM orders", req.query());
        assertEquals("postgresql:" + PG_1 + ":orders", req.channelKey());
        assertNull(req.executedAt());
        assertFalse(req.compressed());
    }

    @Test
    void findById_mapsScriptRequest() {
        ExecutionRequest req = store.findById(REQ_2).orElseThrow();

        assertEquals(BackendKind.DOCUMENT, req.backendKind());
        assertEquals(SubmissionKind.SCRIPT, req.submissionKind());
        assertEquals("console.log(connections.length)", req.scriptContent());
        assertNull(req.query());
    }

    @Test
    void findById_returnsEmpty_forUnknownId() {
        assertTrue(store.findById(UNKNOWN).isEmpty());
    }

    @Test
    void setExecutionOutcome_marksExecuted() {
        ExecutionOutcome outcome = ExecutionOutcome.success("[ ]", 0L).withPayload("[ ]", false, 3);

        Optional<ExecutionRequest> updated = store.setExecutionOutcome(REQ_1, outcome);

        assertThat(updated).isPresent();
        assertEquals(RequestStatus.EXECUTED, updated.get().status());
        assertEquals("[ ]", updated.get().executionResult());
        assertNull(updated.get().executionError());
        assertNotNull(updated.get().executedAt());
        assertTrue(updated.get().status().isTerminalOutcome());
    }

    @Test
    void setExecutionOutcome_marksFailed_withErrorAndCompressionFlag() {
        ExecutionOutcome outcome = ExecutionOutcome.failure(FailureCategory.TIMEOUT, "Query exceeded 60 second timeout.")
                .withPayload("H4sIAAAAAAAA", true, 2_000_000);

        ExecutionRequest updated = store.setExecutionOutcome(REQ_1, outcome).orElseThrow();

        assertEquals(RequestStatus.FAILED, updated.status());
        assertEquals("Query exceeded 60 second timeout.", updated.executionError());
        assertEquals("H4sIAAAAAAAA", updated.executionResult());
        assertTrue(updated.compressed());
    }

    @Test
    void setExecutionOutcome_returnsEmpty_whenRequestIsGone() {
        assertTrue(store.setExecutionOutcome(UNKNOWN, ExecutionOutcome.success("x", 1L)).isEmpty());
    }

    @Test
    void setExecutionOutcome_persistsOriginalSize() throws Exception {
        ExecutionOutcome outcome = ExecutionOutcome.success("H4sIAAAAAAAA", 120L).withPayload("H4sIAAAAAAAA", true, 2_000_000);

        store.setExecutionOutcome(REQ_1, outcome);

        assertEquals("2000000", column(REQ_1, "original_size"));
    }

    @Test
    void setExecutionOutcome_ignoresSecondOutcome_onceExecuted() throws Exception {
        store.setExecutionOutcome(REQ_1, ExecutionOutcome.success("[{\"id\":1}]", 1L));

        Optional<ExecutionRequest> second = store.setExecutionOutcome(REQ_1,
                ExecutionOutcome.failure(FailureCategory.EXECUTION, "late failure"));

        assertTrue(second.isEmpty());
        ExecutionRequest kept = store.findById(REQ_1).orElseThrow();
        assertEquals(RequestStatus.EXECUTED, kept.status());
        assertEquals("[{\"id\":1}]", kept.executionResult());
        assertNull(kept.executionError());
    }

    @Test
    void setExecutionOutcome_keepsExecuted_whenReReadFailsAndFailureIsReportedAfter() throws Exception {
        JdbcDataSource flaky = spy(ds);
        doCallRealMethod().doThrow(new SQLException("connection reset")).when(flaky).getConnection();
        JdbcExecutionRequestStore flakyStore = new JdbcExecutionRequestStore(flaky);

        assertThrows(IllegalStateException.class,
                () -> flakyStore.setExecutionOutcome(REQ_1, ExecutionOutcome.success("[ ]", 0L)));
        assertEquals("executed", column(REQ_1, "status"));

        Optional<ExecutionRequest> failure = store.setExecutionOutcome(REQ_1,
                ExecutionOutcome.failure(FailureCategory.EXECUTION, "Failed to load request " + REQ_1));

        assertTrue(failure.isEmpty());
        assertEquals("executed", column(REQ_1, "status"));
        assertEquals("[ ]", column(REQ_1, "execution_result"));
        assertNull(column(REQ_1, "execution_error"));
    }

    private String column(String requestId, String name) throws SQLException {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT " + name + " FROM query_requests WHERE id = '" + requestId + "'")) {
            assertTrue(rs.next());
            return rs.getString(1);
        }
    }
}
