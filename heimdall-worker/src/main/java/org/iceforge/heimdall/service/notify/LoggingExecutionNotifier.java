package org.iceforge.heimdall.service.notify;

import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.ExecutionRequest;
import org.iceforge.heimdall.worker.ExecutionNotifier;
import org.iceforge.heimdall.worker.NotificationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every notification to the audit log. Deployments with a chat or mail channel replace this bean.
 */
public class LoggingExecutionNotifier implements ExecutionNotifier {

    private static final Logger audit = LoggerFactory.getLogger("heimdall.audit");

    @Override
    public void notify(NotificationKind kind, ExecutionRequest request, String executorId, ExecutionOutcome outcome, String reason) {
        switch (kind) {
            case REQUEST_RESULT -> audit.info("notify requester={} requestId={} success={} rowCount={} error={}",
                    request.requesterEmail(), request.id(), outcome.success(), outcome.rowCount(), outcome.error());
            case EXECUTION_SUCCESS -> audit.info("notify channel={} requestId={} executor={} executed",
                    request.channelKey(), request.id(), executorId);
            case EXECUTION_FAILED -> audit.info("notify channel={} requestId={} executor={} failed error={}",
                    request.channelKey(), request.id(), executorId, reason != null ? reason : outcome.error());
        }
    }
}
