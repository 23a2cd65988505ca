package org.iceforge.heimdall.queue;

/**
 * Consumes one delivered job. Returning normally completes the job; throwing hands it back to the
 * queue's retry policy.
 */
@FunctionalInterface
public interface JobHandler {
    void handle(QueueJob job) throws Exception;
}
