package org.iceforge.heimdall.queue;

import java.util.Objects;

/**
 * Durable envelope created when a request is approved. Immutable once enqueued.
 *
 * @param attempt 0 for the first delivery, incremented on every redelivery
 */
public record QueueJob(String jobId, String channelKey, String requestId, String approverId, int attempt) {
    public QueueJob {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(channelKey, "channelKey");
        Objects.requireNonNull(requestId, "requestId");
    }
}
