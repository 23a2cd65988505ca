package org.iceforge.heimdall.service.store;

import org.iceforge.heimdall.model.BackendKind;
import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.ExecutionRequest;
import org.iceforge.heimdall.model.RequestStatus;
import org.iceforge.heimdall.model.SubmissionKind;
import org.iceforge.heimdall.worker.ExecutionRequestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads requests from and writes outcomes to the {@code query_requests} table of the metadata store.
 * The table belongs to the request workflow; only the outcome columns are ever written here. Request
 * ids are UUIDs passed around in their string form.
 *
 * <p>An outcome is written at most once: the update only matches rows that are not yet
 * {@code executed} or {@code failed}, so a late failure report can never replace a recorded result.
 */
public class JdbcExecutionRequestStore implements ExecutionRequestStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRequestStore.class);

    static final String SELECT_SQL = """
            SELECT id, database_type, instance_id, instance_name, database_name, submission_type, query,
                   script_content, user_email, status, execution_result, execution_error, is_compressed, executed_at
              FROM query_requests
             WHERE id = CAST(? AS UUID)
            """;

    static final String UPDATE_OUTCOME_SQL = """
            UPDATE query_requests
               SET status = ?, execution_result = ?, execution_error = ?, is_compressed = ?, original_size = ?,
                   executed_at = ?
             WHERE id = CAST(? AS UUID)
               AND status NOT IN ('executed', 'failed')
            """;

    private final DataSource dataSource;

    public JdbcExecutionRequestStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Optional<ExecutionRequest> findById(String requestId) {
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(SELECT_SQL)) {
            ps.setString(1, requestId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load request " + requestId, e);
        }
    }

    @Override
    public Optional<ExecutionRequest> setExecutionOutcome(String requestId, ExecutionOutcome outcome) {
        RequestStatus status = outcome.success() ? RequestStatus.EXECUTED : RequestStatus.FAILED;
        int updated;
        try (Connection c = dataSource.getConnection(); PreparedStatement ps = c.prepareStatement(UPDATE_OUTCOME_SQL)) {
            ps.setString(1, status.wireName());
            ps.setString(2, outcome.output());
            ps.setString(3, outcome.error());
            ps.setBoolean(4, outcome.compressed());
            ps.setLong(5, outcome.originalSize());
            ps.setTimestamp(6, Timestamp.from(outcome.executedAt()));
            ps.setString(7, requestId);
            updated = ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to record outcome for request " + requestId, e);
        }
        if (updated == 0) {
            log.warn("Outcome not recorded, request is gone or already has one requestId={}", requestId);
            return Optional.empty();
        }
        log.debug("Outcome recorded requestId={} status={}", requestId, status.wireName());
        return findById(requestId);
    }

    private static ExecutionRequest map(ResultSet rs) throws SQLException {
        Timestamp executedAt = rs.getTimestamp("executed_at");
        return new ExecutionRequest(
                rs.getString("id"),
                BackendKind.fromWireName(rs.getString("database_type")),
                rs.getString("instance_id"),
                rs.getString("instance_name"),
                rs.getString("database_name"),
                SubmissionKind.fromWireName(rs.getString("submission_type")),
                rs.getString("query"),
                rs.getString("script_content"),
                rs.getString("user_email"),
                RequestStatus.fromWireName(rs.getString("status")),
                rs.getString("execution_result"),
                rs.getString("execution_error"),
                rs.getBoolean("is_compressed"),
                executedAt == null ? null : executedAt.toInstant());
    }
}
