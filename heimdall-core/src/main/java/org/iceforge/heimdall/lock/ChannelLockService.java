package org.iceforge.heimdall.lock;

/**
 * Non-blocking mutual exclusion keyed by a channel key. Used by the worker to make sure only one job
 * per channel executes at a time, across every worker process sharing the metadata store.
 */
public interface ChannelLockService {

    /**
     * Try once to take the lock for the calling thread. Returns false when another holder has it,
     * including another thread of this process; callers treat that as "try again later", never as a
     * failure. Returns true without a second attempt when the calling thread already holds it.
     */
    boolean tryAcquire(String channelKey);

    /** Release the lock if the calling thread holds it. Safe to call more than once. */
    void release(String channelKey);

    boolean isHeld(String channelKey);

    int activeLockCount();

    /** Release every lock held by this process (shutdown path). */
    void releaseAll();
}
