package org.iceforge.heimdall.queue;

import java.util.Optional;

/**
 * Durable, at-least-once job queue with one outstanding job per channel key.
 */
public interface JobQueue extends AutoCloseable {

    /**
     * Enqueue a job for the given channel. Returns empty when the queue refuses it because another job
     * for the same channel is still outstanding.
     */
    Optional<String> enqueue(String channelKey, String requestId, String approverId);

    /** Start delivering batches to {@code handler}. */
    void work(JobHandler handler);

    /** Stop fetching new batches. Jobs already handed out keep running. */
    void stopWork();

    @Override
    void close();
}
