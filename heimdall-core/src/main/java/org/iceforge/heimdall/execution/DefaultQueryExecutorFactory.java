package org.iceforge.heimdall.execution;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.iceforge.heimdall.execution.jdbc.RelationalQueryExecutor;
import org.iceforge.heimdall.execution.mongo.DocumentQueryExecutor;
import org.iceforge.heimdall.model.BackendInstance;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Production executors: a small HikariCP pool per relational database and one MongoDB client per
 * document database.
 */
public class DefaultQueryExecutorFactory implements QueryExecutorFactory {

    private static final int RELATIONAL_POOL_SIZE = 10;
    private static final int DOCUMENT_POOL_SIZE = 5;

    private final ExecutionLimits limits;
    private final String jdbcUrlOptions;

    /**
     * @param jdbcUrlOptions query string appended to relational JDBC URLs (for example
     *                       {@code sslmode=require}); may be blank
     */
    public DefaultQueryExecutorFactory(ExecutionLimits limits, String jdbcUrlOptions) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.jdbcUrlOptions = jdbcUrlOptions == null ? "" : jdbcUrlOptions.trim();
    }

    @Override
    public QueryExecutor relational(BackendInstance instance, String databaseName, BackendCredentials credentials) {
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("heimdall-" + instance.id() + "-" + databaseName);
        cfg.setJdbcUrl(jdbcUrl(instance, databaseName));
        cfg.setMaximumPoolSize(RELATIONAL_POOL_SIZE);
        cfg.setMinimumIdle(0);
        cfg.setIdleTimeout(TimeUnit.SECONDS.toMillis(30));
        cfg.setConnectionTimeout(TimeUnit.SECONDS.toMillis(10));
        cfg.setInitializationFailTimeout(-1);
        cfg.setConnectionInitSql("SET statement_timeout = " + limits.statementTimeout().toMillis());
        if (credentials.username() != null) {
            cfg.setUsername(credentials.username());
            cfg.setPassword(credentials.password());
        }
        return new RelationalQueryExecutor(new HikariDataSource(cfg), limits, true);
    }

    @Override
    public QueryExecutor document(BackendInstance instance, String databaseName, BackendCredentials credentials) {
        MongoClientSettings.Builder settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString("mongodb://" + instance.host() + ":" + instance.port()))
                .applyToConnectionPoolSettings(b -> b.maxSize(DOCUMENT_POOL_SIZE))
                .applyToClusterSettings(b -> b.serverSelectionTimeout(10, TimeUnit.SECONDS));
        if (credentials.username() != null) {
            String password = credentials.password() == null ? "" : credentials.password();
            settings.credential(MongoCredential.createCredential(credentials.username(), "admin", password.toCharArray()));
        }
        MongoClient client = MongoClients.create(settings.build());
        return new DocumentQueryExecutor(client, databaseName, limits.operationTimeout(), true);
    }

    String jdbcUrl(BackendInstance instance, String databaseName) {
        String url = "jdbc:postgresql://" + instance.host() + ":" + instance.port() + "/" + databaseName;
        return jdbcUrlOptions.isEmpty() ? url : url + "?" + jdbcUrlOptions;
    }
}
