package org.iceforge.heimdall.execution.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.iceforge.heimdall.execution.ExecutionLimits;
import org.iceforge.heimdall.execution.QueryExecutor;
import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.FailureCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Executes raw SQL against one relational database. The text runs verbatim: review and warnings
 * happen upstream, before approval.
 *
 * <p>Read statements are first wrapped in a {@code COUNT(*)} so an oversized result is refused before
 * the real statement runs.
 */
public class RelationalQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RelationalQueryExecutor.class);

    private static final String QUERY_CANCELED_SQLSTATE = "57014";
    private static final Pattern LEADING_NOISE = Pattern.compile("^(\\s+|--[^\\n]*\\n|/\\*.*?\\*/|\\()+", Pattern.DOTALL);
    private static final Pattern TRAILING_SEMICOLONS = Pattern.compile("[;\\s]+$");

    private final DataSource dataSource;
    private final ExecutionLimits limits;
    private final boolean ownsDataSource;
    private final ObjectMapper mapper;

    public RelationalQueryExecutor(DataSource dataSource, ExecutionLimits limits, boolean ownsDataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.ownsDataSource = ownsDataSource;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public ExecutionOutcome execute(String sql) {
        long start = System.nanoTime();
        try (Connection conn = dataSource.getConnection()) {
            if (limits.relationalSchema() != null) {
                conn.setSchema(limits.relationalSchema());
            }

            if (limits.maxResultRows() > 0 && isReadStatement(sql)) {
                Optional<Long> estimate = estimateRows(conn, sql);
                if (estimate.isPresent() && estimate.get() > limits.maxResultRows()) {
                    log.info("Query rejected by row estimate rows={} limit={}", estimate.get(), limits.maxResultRows());
                    return ExecutionOutcome.failure(FailureCategory.VALIDATION, String.format(Locale.ROOT,
                            "Query would return %d rows, which exceeds the limit of %d rows. Add a LIMIT clause or filters to reduce the result size.",
                            estimate.get(), limits.maxResultRows()));
                }
            }

            try (Statement st = conn.createStatement()) {
                st.setQueryTimeout(timeoutSeconds(limits.statementTimeout()));
                boolean hasResultSet = st.execute(sql);
                ExecutionOutcome outcome;
                if (hasResultSet) {
                    List<Map<String, Object>> rows;
                    try (ResultSet rs = st.getResultSet()) {
                        rows = readRows(rs);
                    }
                    outcome = ExecutionOutcome.success(mapper.writeValueAsString(rows), (long) rows.size());
                } else {
                    long affected = Math.max(0, st.getUpdateCount());
                    outcome = ExecutionOutcome.success(affected + " row(s) affected", affected);
                }
                log.info("Relational query executed rowCount={} durationMs={}", outcome.rowCount(), elapsedMs(start));
                return outcome;
            }
        } catch (SQLException e) {
            if (isTimeout(e)) {
                log.warn("Relational query timed out durationMs={} timeoutMs={}", elapsedMs(start), limits.statementTimeout().toMillis());
                return timeoutOutcome();
            }
            log.error("Relational query failed durationMs={}: {}", elapsedMs(start), e.getMessage());
            return ExecutionOutcome.failure(FailureCategory.EXECUTION, e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("Relational result could not be rendered: {}", e.getOriginalMessage());
            return ExecutionOutcome.failure(FailureCategory.EXECUTION, "Failed to render result: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("Relational query failed durationMs={}: {}", elapsedMs(start), e.toString());
            return ExecutionOutcome.failure(FailureCategory.EXECUTION, e.getMessage() == null ? e.toString() : e.getMessage());
        }
    }

    /**
     * Row count the statement would produce, or empty when it cannot be wrapped (for example a
     * data-modifying CTE). Timeouts propagate.
     */
    Optional<Long> estimateRows(Connection conn, String sql) throws SQLException {
        String inner = TRAILING_SEMICOLONS.matcher(sql.trim()).replaceAll("");
        String countSql = "SELECT COUNT(*) FROM (" + inner + ") heimdall_row_estimate";
        try (Statement st = conn.createStatement()) {
            st.setQueryTimeout(timeoutSeconds(limits.statementTimeout()));
            try (ResultSet rs = st.executeQuery(countSql)) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            if (isTimeout(e)) throw e;
            log.debug("Row estimate skipped: {}", e.getMessage());
            if (!conn.getAutoCommit()) {
                conn.rollback();
            }
            return Optional.empty();
        }
    }

    static boolean isReadStatement(String sql) {
        if (sql == null) return false;
        String head = LEADING_NOISE.matcher(sql).replaceFirst("");
        int end = 0;
        while (end < head.length() && Character.isLetter(head.charAt(end))) end++;
        String keyword = head.substring(0, end).toUpperCase(Locale.ROOT);
        return switch (keyword) {
            case "SELECT", "WITH", "VALUES", "TABLE" -> true;
            default -> false;
        };
    }

    static boolean isTimeout(SQLException e) {
        if (e instanceof SQLTimeoutException) return true;
        if (QUERY_CANCELED_SQLSTATE.equals(e.getSQLState())) return true;
        String msg = e.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase(Locale.ROOT);
        return lower.contains("statement timeout") || lower.contains("canceling statement");
    }

    private ExecutionOutcome timeoutOutcome() {
        return ExecutionOutcome.failure(FailureCategory.TIMEOUT, ExecutionLimits.timeoutMessage(limits.statementTimeout()));
    }

    // JDBC takes whole seconds; round up so a short limit is never widened to "no timeout"
    static int timeoutSeconds(Duration timeout) {
        long seconds = timeout.toSeconds() + (timeout.toNanosPart() > 0 ? 1 : 0);
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int cols = md.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= cols; i++) {
                row.put(md.getColumnLabel(i), toJsonValue(rs.getObject(i)));
            }
            rows.add(row);
        }
        return rows;
    }

    private static Object toJsonValue(Object v) throws SQLException {
        if (v == null || v instanceof String || v instanceof Boolean || v instanceof byte[]) return v;
        if (v instanceof BigDecimal bd) return bd;
        if (v instanceof Number) return v;
        if (v instanceof Timestamp ts) return ts.toInstant();
        if (v instanceof java.sql.Date d) return d.toLocalDate();
        if (v instanceof java.sql.Time t) return t.toLocalTime();
        if (v instanceof Temporal) return v;
        if (v instanceof java.util.UUID) return v.toString();
        if (v instanceof Clob clob) return clob.getSubString(1, (int) Math.min(Integer.MAX_VALUE, clob.length()));
        if (v instanceof Array arr) {
            Object raw = arr.getArray();
            if (raw instanceof Object[] items) {
                List<Object> out = new ArrayList<>(items.length);
                for (Object item : items) out.add(toJsonValue(item));
                return out;
            }
            return String.valueOf(raw);
        }
        if (v instanceof Object[] items) return Arrays.asList(items);
        // json/jsonb, intervals, geometric types: driver-specific objects render through toString
        return v.toString();
    }

    @Override
    public boolean ping() {
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            st.setQueryTimeout(5);
            st.execute("SELECT 1");
            return true;
        } catch (SQLException e) {
            log.debug("Relational ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (ownsDataSource && dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close relational data source: {}", e.toString());
            }
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
