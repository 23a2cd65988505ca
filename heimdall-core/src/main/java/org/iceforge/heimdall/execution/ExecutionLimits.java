package org.iceforge.heimdall.execution;

import java.time.Duration;
import java.util.Locale;

/**
 * Numeric bounds applied to every execution.
 *
 * @param statementTimeout    relational statement timeout
 * @param operationTimeout    document-store read/aggregate timeout
 * @param maxResultRows       rows a relational read may return, checked before the statement runs;
 *                            0 disables the check
 * @param compressionThreshold output larger than this many UTF-8 bytes is stored compressed
 * @param relationalSchema    schema made active before each relational statement, or null
 */
public record ExecutionLimits(
        Duration statementTimeout,
        Duration operationTimeout,
        int maxResultRows,
        long compressionThreshold,
        String relationalSchema
) {
    public ExecutionLimits {
        statementTimeout = statementTimeout == null ? Duration.ofSeconds(60) : statementTimeout;
        operationTimeout = operationTimeout == null ? Duration.ofSeconds(60) : operationTimeout;
        maxResultRows = Math.max(0, maxResultRows);
        compressionThreshold = compressionThreshold <= 0 ? 1024L * 1024L : compressionThreshold;
        relationalSchema = relationalSchema == null || relationalSchema.isBlank() ? null : relationalSchema.trim();
    }

    public static ExecutionLimits defaults() {
        return new ExecutionLimits(Duration.ofSeconds(60), Duration.ofSeconds(60), 10_000, 1024L * 1024L, null);
    }

    /**
     * User-facing timeout failure text. Whole-second timeouts read in seconds, anything else in
     * milliseconds, so a sub-second limit never shows up as {@code 0 second}.
     */
    public static String timeoutMessage(Duration timeout) {
        String amount = timeout.toMillisPart() == 0 && timeout.toSeconds() > 0
                ? timeout.toSeconds() + " second"
                : timeout.toMillis() + " ms";
        return String.format(Locale.ROOT,
                "Query exceeded %s timeout. Please optimize your query or add filters to reduce execution time.", amount);
    }
}
