package org.iceforge.heimdall.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal result of one execution attempt. Written once onto the request, never mutated afterwards.
 *
 * @param output       result text (JSON rows, affected-row message or captured script output);
 *                     base64 gzip when {@code compressed}
 * @param rowCount     rows returned or affected, when the backend reports one
 * @param category     failure category, null on success
 * @param originalSize UTF-8 byte size of the output before compression
 */
public record ExecutionOutcome(
        boolean success,
        String output,
        Long rowCount,
        String error,
        FailureCategory category,
        boolean compressed,
        long originalSize,
        Instant executedAt
) {
    public ExecutionOutcome {
        Objects.requireNonNull(executedAt, "executedAt");
        if (success && category != null) {
            throw new IllegalArgumentException("successful outcome cannot carry a failure category");
        }
    }

    public static ExecutionOutcome success(String output, Long rowCount) {
        return new ExecutionOutcome(true, output, rowCount, null, null, false, 0L, Instant.now());
    }

    public static ExecutionOutcome failure(FailureCategory category, String error) {
        return failure(category, error, null);
    }

    public static ExecutionOutcome failure(FailureCategory category, String error, String partialOutput) {
        return new ExecutionOutcome(false, partialOutput, null, error,
                category == null ? FailureCategory.EXECUTION : category, false, 0L, Instant.now());
    }

    public ExecutionOutcome withPayload(String newOutput, boolean isCompressed, long sizeBytes) {
        return new ExecutionOutcome(success, newOutput, rowCount, error, category, isCompressed, sizeBytes, executedAt);
    }
}
