package org.iceforge.heimdall.service.config;

import org.iceforge.heimdall.execution.BackendCredentials;
import org.iceforge.heimdall.execution.BackendDirectory;
import org.iceforge.heimdall.execution.ExecutionLimits;
import org.iceforge.heimdall.model.BackendInstance;
import org.iceforge.heimdall.model.BackendKind;
import org.iceforge.heimdall.queue.QueueSettings;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EngineConfigTest {

    private final EngineConfig config = new EngineConfig();

    @Test
    void executionLimits_followProperties_andBlankSchemaMeansNone() {
        HeimdallProperties props = new HeimdallProperties();
        props.getExecution().setStatementTimeout(Duration.ofSeconds(15));
        props.getExecution().setMaxResultRows(250);
        props.getExecution().setRelationalSchema("  ");

        ExecutionLimits limits = config.executionLimits(props);

        assertEquals(Duration.ofSeconds(15), limits.statementTimeout());
        assertEquals(Duration.ofSeconds(60), limits.operationTimeout());
        assertEquals(250, limits.maxResultRows());
        assertEquals(1024L * 1024L, limits.compressionThreshold());
        assertNull(limits.relationalSchema());
    }

    @Test
    void queueSettings_defaultsMatchProperties() {
        QueueSettings settings = config.queueSettings(new HeimdallProperties());

        assertEquals("query_execution", settings.queueName());
        assertEquals(4, settings.batchSize());
        assertEquals(3, settings.retryLimit());
        assertEquals(Duration.ofSeconds(60), settings.expireAfter());
    }

    @Test
    void backendDirectory_referencesCredentialsByPropertyPath() {
        HeimdallProperties props = new HeimdallProperties();
        HeimdallProperties.Credential c = new HeimdallProperties.Credential();
        c.setUsername("heimdall_exec");
        c.setPassword("s3cret");
        props.getCredentials().put("pg-1", c);

        BackendDirectory directory = config.backendDirectory(mock(DataSource.class), props);
        BackendCredentials creds = directory.credentialsFor(
                new BackendInstance("pg-1", "orders", BackendKind.RELATIONAL, "db.internal", 5432));

        assertEquals("heimdall.credentials.pg-1", creds.reference());
        assertEquals("heimdall_exec", creds.username());
        assertEquals("s3cret", creds.password());
    }
}
