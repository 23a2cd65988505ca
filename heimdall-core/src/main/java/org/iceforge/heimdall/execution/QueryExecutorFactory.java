package org.iceforge.heimdall.execution;

import org.iceforge.heimdall.model.BackendInstance;

/**
 * Creates executors for the {@link BackendHandlePool}. Called at most once per pool key.
 */
public interface QueryExecutorFactory {

    QueryExecutor relational(BackendInstance instance, String databaseName, BackendCredentials credentials);

    QueryExecutor document(BackendInstance instance, String databaseName, BackendCredentials credentials);
}
