package org.iceforge.heimdall.worker;

import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.ExecutionRequest;

import java.util.Optional;

/**
 * Persistence of execution requests, owned by the request workflow. The worker only reads requests and
 * writes outcomes back.
 */
public interface ExecutionRequestStore {

    Optional<ExecutionRequest> findById(String requestId);

    /**
     * Record the outcome and move the request to executed/failed. A request that already carries an
     * outcome is left untouched. Returns the updated request, or empty when it no longer exists or
     * already had an outcome.
     */
    Optional<ExecutionRequest> setExecutionOutcome(String requestId, ExecutionOutcome outcome);
}
