package org.iceforge.heimdall.execution;

import org.iceforge.heimdall.model.BackendKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Executors for target databases, one per {backend kind, instance, database}, created on first use and
 * kept until {@link #close()}. Owned by a single {@link ExecutionRouter}.
 */
public class BackendHandlePool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendHandlePool.class);

    private final ConcurrentHashMap<String, QueryExecutor> handles = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public QueryExecutor acquire(BackendKind kind, String instanceId, String databaseName, Supplier<QueryExecutor> factory) {
        if (closed) {
            throw new IllegalStateException("backend handle pool is closed");
        }
        String key = key(kind, instanceId, databaseName);
        return handles.computeIfAbsent(key, k -> {
            log.info("Creating backend handle key={}", k);
            return factory.get();
        });
    }

    public int size() {
        return handles.size();
    }

    public boolean contains(BackendKind kind, String instanceId, String databaseName) {
        return handles.containsKey(key(kind, instanceId, databaseName));
    }

    @Override
    public void close() {
        closed = true;
        List<String> keys = new ArrayList<>(handles.keySet());
        for (String key : keys) {
            QueryExecutor executor = handles.remove(key);
            if (executor == null) continue;
            try {
                executor.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close backend handle key={}: {}", key, e.toString());
            }
        }
        log.info("Backend handles closed count={}", keys.size());
    }

    static String key(BackendKind kind, String instanceId, String databaseName) {
        return kind.wireName() + ":" + instanceId + ":" + databaseName;
    }
}
