package org.iceforge.heimdall.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cross-process lock backed by PostgreSQL session-level advisory locks on the metadata store.
 *
 * <p>Each held lock pins one dedicated connection: advisory locks belong to the session, so the
 * connection must stay open until release. Session locks are reentrant per connection, not per
 * thread, so every handle records the thread that acquired it: a second acquire from that thread is a
 * no-op, any other thread of this process is refused. Shutdown releases everything.
 */
public class AdvisoryChannelLockService implements ChannelLockService {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryChannelLockService.class);

    static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_lock(?)";
    static final String UNLOCK_SQL = "SELECT pg_advisory_unlock(?)";

    private record LockHandle(long lockId, Connection connection, Thread owner) {}

    private final DataSource metadataStore;
    private final ConcurrentHashMap<String, LockHandle> held = new ConcurrentHashMap<>();

    public AdvisoryChannelLockService(DataSource metadataStore) {
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore");
    }

    @Override
    public boolean tryAcquire(String channelKey) {
        Objects.requireNonNull(channelKey, "channelKey");
        long lockId = LockIds.fromChannelKey(channelKey);

        LockHandle existing = held.get(channelKey);
        if (existing != null) {
            if (existing.owner() == Thread.currentThread()) {
                log.warn("Already holding lock channelKey={} lockId={}", channelKey, lockId);
                return true;
            }
            log.info("Lock held by another job of this process channelKey={} lockId={} owner={}",
                    channelKey, lockId, existing.owner().getName());
            return false;
        }

        Connection conn;
        try {
            conn = metadataStore.getConnection();
        } catch (SQLException e) {
            log.error("Failed to acquire lock channelKey={} lockId={}: {}", channelKey, lockId, e.getMessage());
            return false;
        }

        try {
            boolean acquired;
            try (PreparedStatement ps = conn.prepareStatement(TRY_LOCK_SQL)) {
                ps.setLong(1, lockId);
                try (ResultSet rs = ps.executeQuery()) {
                    acquired = rs.next() && rs.getBoolean(1);
                }
            }

            if (acquired) {
                held.put(channelKey, new LockHandle(lockId, conn, Thread.currentThread()));
                log.info("Lock acquired channelKey={} lockId={}", channelKey, lockId);
            } else {
                closeQuietly(conn, channelKey);
                log.info("Lock unavailable channelKey={} lockId={}", channelKey, lockId);
            }
            return acquired;
        } catch (SQLException | RuntimeException e) {
            closeQuietly(conn, channelKey);
            log.error("Failed to acquire lock channelKey={} lockId={}: {}", channelKey, lockId, e.getMessage());
            return false;
        }
    }

    @Override
    public void release(String channelKey) {
        LockHandle handle = held.get(channelKey);
        if (handle == null) {
            log.warn("No active lock to release channelKey={}", channelKey);
            return;
        }
        if (handle.owner() != Thread.currentThread()) {
            log.warn("Ignoring release from non-owner thread channelKey={} lockId={} owner={}",
                    channelKey, handle.lockId(), handle.owner().getName());
            return;
        }
        unlock(channelKey, handle);
    }

    private void unlock(String channelKey, LockHandle handle) {
        if (!held.remove(channelKey, handle)) {
            return;
        }

        try (PreparedStatement ps = handle.connection().prepareStatement(UNLOCK_SQL)) {
            ps.setLong(1, handle.lockId());
            ps.execute();
            log.info("Lock released channelKey={} lockId={}", channelKey, handle.lockId());
        } catch (SQLException | RuntimeException e) {
            log.error("Failed to release lock channelKey={} lockId={}: {}", channelKey, handle.lockId(), e.getMessage());
        } finally {
            closeQuietly(handle.connection(), channelKey);
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
        List<String> keys = new ArrayList<>(held.keySet());
        for (String key : keys) {
            LockHandle handle = held.get(key);
            if (handle != null) {
                unlock(key, handle);
            }
        }
        log.info("All locks released count={}", keys.size());
    }

    private static void closeQuietly(Connection conn, String channelKey) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.debug("Ignoring connection close failure channelKey={}: {}", channelKey, e.toString());
        }
    }
}
