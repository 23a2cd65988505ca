package org.iceforge.heimdall.service;

import org.iceforge.heimdall.model.ExecutionRequest;
import org.iceforge.heimdall.model.RequestStatus;
import org.iceforge.heimdall.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for the request workflow: called once a request has been approved.
 */
@Component
public class ApprovalDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ApprovalDispatcher.class);

    private final JobQueue queue;

    public ApprovalDispatcher(JobQueue queue) {
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    /**
     * Enqueue execution of an approved request. Returns the job id, or empty when the queue refused the
     * job because the channel already has one outstanding.
     */
    public Optional<String> onApproved(ExecutionRequest request, String approverId) {
        if (request.status() != RequestStatus.APPROVED) {
            throw new IllegalArgumentException("Request " + request.id() + " is " + request.status().wireName() + ", not approved");
        }
        String channelKey = request.channelKey();
        Optional<String> jobId = queue.enqueue(channelKey, request.id(), approverId);
        if (jobId.isPresent()) {
            log.info("Execution enqueued requestId={} channel={} jobId={} approver={}",
                    request.id(), channelKey, jobId.get(), approverId);
        } else {
            log.warn("Execution not enqueued, channel busy requestId={} channel={}", request.id(), channelKey);
        }
        return jobId;
    }
}
