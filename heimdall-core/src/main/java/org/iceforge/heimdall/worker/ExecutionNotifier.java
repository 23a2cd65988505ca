package org.iceforge.heimdall.worker;

import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.ExecutionRequest;

/**
 * Outbound notifications about executions. Called while the channel lock is held, so delivery order per
 * channel follows execution order. Failures are logged by the caller and never fail the job.
 */
public interface ExecutionNotifier {

    /**
     * @param executorId the approver who released the request for execution
     * @param reason     failure text when the outcome was produced by the worker itself, otherwise null
     */
    void notify(NotificationKind kind, ExecutionRequest request, String executorId, ExecutionOutcome outcome, String reason);
}
