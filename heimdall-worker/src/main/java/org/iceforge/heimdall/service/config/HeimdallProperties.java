package org.iceforge.heimdall.service.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of the execution worker. Defaults match a single worker against a PostgreSQL metadata store.
 */
@ConfigurationProperties(prefix = "heimdall")
public class HeimdallProperties {

    private final Queue queue = new Queue();
    private final Worker worker = new Worker();
    private final Lock lock = new Lock();
    private final Execution execution = new Execution();
    private final Sandbox sandbox = new Sandbox();

    /**
     * Target credentials keyed by backend instance id. Instances without an entry connect without a login.
     */
    private Map<String, Credential> credentials = new LinkedHashMap<>();

    public Queue getQueue() {
        return queue;
    }

    public Worker getWorker() {
        return worker;
    }

    public Lock getLock() {
        return lock;
    }

    public Execution getExecution() {
        return execution;
    }

    public Sandbox getSandbox() {
        return sandbox;
    }

    public Map<String, Credential> getCredentials() {
        return credentials;
    }

    public void setCredentials(Map<String, Credential> credentials) {
        this.credentials = credentials;
    }

    public static class Queue {
        private String name = "query_execution";

        /** Jobs fetched per poll; also the number of jobs running at once. */
        private int concurrency = 4;
        private Duration pollInterval = Duration.ofSeconds(1);
        private int retryLimit = 3;

        /** Base retry delay, doubled on every redelivery. */
        private Duration retryDelay = Duration.ofSeconds(1);

        /** ACTIVE jobs older than this are treated as lost. */
        private Duration expireAfter = Duration.ofSeconds(60);

        /** Create the job table on start-up. */
        private boolean initSchema = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getRetryLimit() {
            return retryLimit;
        }

        public void setRetryLimit(int retryLimit) {
            this.retryLimit = retryLimit;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public Duration getExpireAfter() {
            return expireAfter;
        }

        public void setExpireAfter(Duration expireAfter) {
            this.expireAfter = expireAfter;
        }

        public boolean isInitSchema() {
            return initSchema;
        }

        public void setInitSchema(boolean initSchema) {
            this.initSchema = initSchema;
        }
    }

    public static class Worker {
        /** Start consuming jobs with the application context. */
        private boolean enabled = true;
        private Duration drainTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Lock {
        /**
         * - "advisory" (default): PostgreSQL advisory locks on the metadata store, safe across processes
         * - "local": JVM-only locks for a single worker (H2 and tests)
         */
        private String store = "advisory";

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }
    }

    public static class Execution {
        private Duration statementTimeout = Duration.ofSeconds(60);

        /** Server-side limit for document-store reads and aggregations. */
        private Duration operationTimeout = Duration.ofSeconds(60);
        private int maxResultRows = 10_000;
        private long compressionThresholdBytes = 1024L * 1024L;

        /** Schema made active before relational statements; empty keeps the login's search path. */
        private String relationalSchema;

        /** Appended to target JDBC URLs, e.g. {@code sslmode=require}. */
        private String jdbcUrlOptions = "";

        public Duration getStatementTimeout() {
            return statementTimeout;
        }

        public void setStatementTimeout(Duration statementTimeout) {
            this.statementTimeout = statementTimeout;
        }

        public Duration getOperationTimeout() {
            return operationTimeout;
        }

        public void setOperationTimeout(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
        }

        public int getMaxResultRows() {
            return maxResultRows;
        }

        public void setMaxResultRows(int maxResultRows) {
            this.maxResultRows = maxResultRows;
        }

        public long getCompressionThresholdBytes() {
            return compressionThresholdBytes;
        }

        public void setCompressionThresholdBytes(long compressionThresholdBytes) {
            this.compressionThresholdBytes = compressionThresholdBytes;
        }

        public String getRelationalSchema() {
            return relationalSchema;
        }

        public void setRelationalSchema(String relationalSchema) {
            this.relationalSchema = relationalSchema;
        }

        public String getJdbcUrlOptions() {
            return jdbcUrlOptions;
        }

        public void setJdbcUrlOptions(String jdbcUrlOptions) {
            this.jdbcUrlOptions = jdbcUrlOptions;
        }
    }

    public static class Sandbox {
        private int memoryMb = 256;
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Classpath of the sandbox child JVM. Must be set when running from a repackaged jar, e.g.
         * {@code /opt/heimdall/lib/*} for an exploded layout.
         */
        private String classpath;
        private String javaHome;

        public int getMemoryMb() {
            return memoryMb;
        }

        public void setMemoryMb(int memoryMb) {
            this.memoryMb = memoryMb;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getClasspath() {
            return classpath;
        }

        public void setClasspath(String classpath) {
            this.classpath = classpath;
        }

        public String getJavaHome() {
            return javaHome;
        }

        public void setJavaHome(String javaHome) {
            this.javaHome = javaHome;
        }
    }

    public static class Credential {
        private String username;
        private String password;

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }
}
