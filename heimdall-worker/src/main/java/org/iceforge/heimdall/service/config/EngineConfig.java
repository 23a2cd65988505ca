package org.iceforge.heimdall.service.config;

import org.iceforge.heimdall.execution.BackendCredentials;
import org.iceforge.heimdall.execution.BackendDirectory;
import org.iceforge.heimdall.execution.BackendHandlePool;
import org.iceforge.heimdall.execution.DefaultQueryExecutorFactory;
import org.iceforge.heimdall.execution.ExecutionLimits;
import org.iceforge.heimdall.execution.ExecutionRouter;
import org.iceforge.heimdall.execution.QueryExecutorFactory;
import org.iceforge.heimdall.lock.ChannelLockService;
import org.iceforge.heimdall.queue.JdbcJobQueue;
import org.iceforge.heimdall.queue.QueueSettings;
import org.iceforge.heimdall.sandbox.ProcessScriptSandbox;
import org.iceforge.heimdall.sandbox.SandboxLimits;
import org.iceforge.heimdall.sandbox.ScriptSandbox;
import org.iceforge.heimdall.service.notify.LoggingExecutionNotifier;
import org.iceforge.heimdall.service.store.JdbcBackendDirectory;
import org.iceforge.heimdall.service.store.JdbcExecutionRequestStore;
import org.iceforge.heimdall.worker.ExecutionNotifier;
import org.iceforge.heimdall.worker.ExecutionRequestStore;
import org.iceforge.heimdall.worker.ExecutionWorker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine beans. Queue and router are closed by {@link org.iceforge.heimdall.service.WorkerLifecycle}
 * in shutdown order, so their inferred destroy methods are switched off.
 */
@Configuration
public class EngineConfig {

    static final String CREDENTIALS_PREFIX = "heimdall.credentials.";

    @Bean
    public ExecutionLimits executionLimits(HeimdallProperties props) {
        HeimdallProperties.Execution e = props.getExecution();
        return new ExecutionLimits(e.getStatementTimeout(), e.getOperationTimeout(), e.getMaxResultRows(),
                e.getCompressionThresholdBytes(), e.getRelationalSchema());
    }

    @Bean
    public QueueSettings queueSettings(HeimdallProperties props) {
        HeimdallProperties.Queue q = props.getQueue();
        return new QueueSettings(q.getName(), q.getConcurrency(), q.getPollInterval(), q.getRetryLimit(),
                q.getRetryDelay(), q.getExpireAfter());
    }

    @Bean(destroyMethod = "")
    public JdbcJobQueue jobQueue(DataSource dataSource, QueueSettings queueSettings) {
        return new JdbcJobQueue(dataSource, queueSettings);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionRequestStore executionRequestStore(DataSource dataSource) {
        return new JdbcExecutionRequestStore(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackendDirectory backendDirectory(DataSource dataSource, HeimdallProperties props) {
        Map<String, BackendCredentials> credentials = new LinkedHashMap<>();
        props.getCredentials().forEach((instanceId, c) -> credentials.put(instanceId,
                new BackendCredentials(CREDENTIALS_PREFIX + instanceId, c.getUsername(), c.getPassword())));
        return new JdbcBackendDirectory(dataSource, credentials);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryExecutorFactory queryExecutorFactory(ExecutionLimits limits, HeimdallProperties props) {
        return new DefaultQueryExecutorFactory(limits, props.getExecution().getJdbcUrlOptions());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScriptSandbox scriptSandbox(HeimdallProperties props) {
        HeimdallProperties.Sandbox s = props.getSandbox();
        return new ProcessScriptSandbox(new SandboxLimits(s.getMemoryMb(), s.getTimeout(), s.getClasspath(), s.getJavaHome()));
    }

    @Bean(destroyMethod = "")
    public ExecutionRouter executionRouter(BackendDirectory directory,
                                           QueryExecutorFactory executorFactory,
                                           ScriptSandbox sandbox,
                                           ExecutionLimits limits) {
        return new ExecutionRouter(directory, executorFactory, new BackendHandlePool(), sandbox, limits);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionNotifier executionNotifier() {
        return new LoggingExecutionNotifier();
    }

    @Bean
    public ExecutionWorker executionWorker(JdbcJobQueue jobQueue,
                                           ChannelLockService locks,
                                           ExecutionRequestStore store,
                                           ExecutionRouter router,
                                           ExecutionNotifier notifier,
                                           HeimdallProperties props) {
        return new ExecutionWorker(jobQueue, locks, store, router, notifier, props.getWorker().getDrainTimeout());
    }
}
