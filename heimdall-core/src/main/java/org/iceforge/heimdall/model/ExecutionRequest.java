package org.iceforge.heimdall.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An approved unit of work, owned by the request-workflow subsystem. The engine reads it and writes
 * back the outcome fields only.
 */
public record ExecutionRequest(
        String id,
        BackendKind backendKind,
        String instanceId,
        String instanceName,
        String databaseName,
        SubmissionKind submissionKind,
        String query,
        String scriptContent,
        String requesterEmail,
        RequestStatus status,
        String executionResult,
        String executionError,
        boolean compressed,
        Instant executedAt
) {
    public ExecutionRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(backendKind, "backendKind");
        Objects.requireNonNull(submissionKind, "submissionKind");
        Objects.requireNonNull(status, "status");
    }

    /** Serialization domain for this request, see {@link ChannelKeys}. */
    public String channelKey() {
        return ChannelKeys.of(backendKind, instanceId, databaseName);
    }

    public ExecutionRequest withOutcome(ExecutionOutcome outcome) {
        return new ExecutionRequest(id, backendKind, instanceId, instanceName, databaseName, submissionKind,
                query, scriptContent, requesterEmail,
                outcome.success() ? RequestStatus.EXECUTED : RequestStatus.FAILED,
                outcome.output(), outcome.error(), outcome.compressed(), outcome.executedAt());
    }
}
