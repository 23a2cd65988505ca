package org.iceforge.heimdall.queue;

import java.time.Duration;
import java.util.Objects;

/**
 * @param batchSize   jobs fetched per poll, which is also how many run concurrently
 * @param retryLimit  redeliveries before a job is abandoned
 * @param retryDelay  base delay, doubled on every retry
 * @param expireAfter an ACTIVE job older than this is considered lost and retried
 */
public record QueueSettings(
        String queueName,
        int batchSize,
        Duration pollInterval,
        int retryLimit,
        Duration retryDelay,
        Duration expireAfter
) {
    public QueueSettings {
        Objects.requireNonNull(queueName, "queueName");
        batchSize = Math.max(1, batchSize);
        pollInterval = pollInterval == null ? Duration.ofSeconds(1) : pollInterval;
        retryLimit = Math.max(0, retryLimit);
        retryDelay = retryDelay == null ? Duration.ofSeconds(1) : retryDelay;
        expireAfter = expireAfter == null ? Duration.ofMinutes(1) : expireAfter;
    }

    public static QueueSettings defaults() {
        return new QueueSettings("query_execution", 4, Duration.ofSeconds(1), 3, Duration.ofSeconds(1), Duration.ofMinutes(1));
    }
}
