package org.iceforge.heimdall.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channel locks shared by every instance in this JVM. Only valid when a single worker process runs,
 * e.g. against an H2 metadata store that has no advisory locks.
 *
 * <p>A lock belongs to the thread that acquired it: only that thread re-acquires or releases it.
 */
public class LocalChannelLockService implements ChannelLockService {

    private static final Logger log = LoggerFactory.getLogger(LocalChannelLockService.class);

    private static final Set<String> JVM_LOCKS = ConcurrentHashMap.newKeySet();

    private final ConcurrentHashMap<String, Thread> held = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String channelKey) {
        Objects.requireNonNull(channelKey, "channelKey");
        Thread owner = held.get(channelKey);
        if (owner != null) {
            if (owner == Thread.currentThread()) {
                return true;
            }
            log.debug("Local lock held by another thread channelKey={} owner={}", channelKey, owner.getName());
            return false;
        }
        if (JVM_LOCKS.add(channelKey)) {
            held.put(channelKey, Thread.currentThread());
            return true;
        }
        log.debug("Local lock contention for {}", channelKey);
        return false;
    }

    @Override
    public void release(String channelKey) {
        Thread owner = held.get(channelKey);
        if (owner == null) {
            return;
        }
        if (owner != Thread.currentThread()) {
            log.warn("Ignoring release from non-owner thread channelKey={} owner={}", channelKey, owner.getName());
            return;
        }
        forceRelease(channelKey);
    }

    private void forceRelease(String channelKey) {
        if (held.remove(channelKey) != null) {
            JVM_LOCKS.remove(channelKey);
        }
    }

    @Override
    public boolean isHeld(String channelKey) {
        return held.containsKey(channelKey);
    }

    @Override
    public int activeLockCount() {
        return held.size();
    }

    @Override
    public void releaseAll() {
        for (String key : Set.copyOf(held.keySet())) {
            forceRelease(key);
        }
    }
}
