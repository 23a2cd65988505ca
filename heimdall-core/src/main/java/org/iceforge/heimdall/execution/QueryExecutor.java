package org.iceforge.heimdall.execution;

import org.iceforge.heimdall.model.ExecutionOutcome;

/**
 * Runs one command against one target database. Implementations never throw from
 * {@link #execute(String)}; every failure is returned as a structured outcome.
 */
public interface QueryExecutor extends AutoCloseable {

    ExecutionOutcome execute(String queryText);

    /** Cheap round trip to check the target is reachable. */
    boolean ping();

    @Override
    void close();
}
