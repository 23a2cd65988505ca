package org.iceforge.heimdall.execution;

import org.iceforge.heimdall.model.BackendInstance;
import org.iceforge.heimdall.model.BackendKind;
import org.iceforge.heimdall.model.ConnectionDescriptor;
import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.ExecutionRequest;
import org.iceforge.heimdall.model.FailureCategory;
import org.iceforge.heimdall.sandbox.ScriptSandbox;
import org.iceforge.heimdall.sandbox.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Decides how an approved request runs (query or script, which backend) and shapes the outcome for
 * storage. {@link #executeRequest(ExecutionRequest)} never throws.
 */
public class ExecutionRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRouter.class);

    private final BackendDirectory directory;
    private final QueryExecutorFactory executorFactory;
    private final BackendHandlePool handles;
    private final ScriptSandbox sandbox;
    private final ExecutionLimits limits;

    public ExecutionRouter(BackendDirectory directory,
                           QueryExecutorFactory executorFactory,
                           BackendHandlePool handles,
                           ScriptSandbox sandbox,
                           ExecutionLimits limits) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
        this.handles = Objects.requireNonNull(handles, "handles");
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public ExecutionOutcome executeRequest(ExecutionRequest request) {
        ExecutionOutcome outcome;
        try {
            outcome = switch (request.submissionKind()) {
                case QUERY -> executeQuery(request);
                case SCRIPT -> executeScript(request);
            };
        } catch (SubmissionValidationException e) {
            log.info("Request rejected requestId={}: {}", request.id(), e.getMessage());
            outcome = ExecutionOutcome.failure(FailureCategory.VALIDATION, e.getMessage());
        } catch (BackendConfigurationException e) {
            log.warn("Backend configuration problem requestId={}: {}", request.id(), e.getMessage());
            outcome = ExecutionOutcome.failure(FailureCategory.CONFIGURATION, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Execution failed requestId={}", request.id(), e);
            outcome = ExecutionOutcome.failure(FailureCategory.EXECUTION,
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        return postProcess(request, outcome);
    }

    private ExecutionOutcome executeQuery(ExecutionRequest request) {
        if (isBlank(request.query())) {
            throw new SubmissionValidationException("No query provided");
        }
        BackendInstance instance = resolveInstance(request);
        String databaseName = requireDatabase(request);
        BackendCredentials credentials = directory.credentialsFor(instance);

        QueryExecutor executor = handles.acquire(instance.kind(), instance.id(), databaseName,
                () -> createExecutor(instance, databaseName, credentials));
        log.info("Executing query requestId={} backend={} instance={} database={}",
                request.id(), instance.kind().wireName(), instance.id(), databaseName);
        return executor.execute(request.query());
    }

    private QueryExecutor createExecutor(BackendInstance instance, String databaseName, BackendCredentials credentials) {
        try {
            return instance.kind() == BackendKind.RELATIONAL
                    ? executorFactory.relational(instance, databaseName, credentials)
                    : executorFactory.document(instance, databaseName, credentials);
        } catch (RuntimeException e) {
            throw new BackendConfigurationException("Could not create connection to " + instance.kind().wireName()
                    + " instance " + instance.id() + ": " + e.getMessage(), e);
        }
    }

    private ExecutionOutcome executeScript(ExecutionRequest request) {
        if (isBlank(request.scriptContent())) {
            throw new SubmissionValidationException("No script content provided");
        }
        ValidationResult validation = sandbox.validate(request.scriptContent());
        if (!validation.valid()) {
            throw new SubmissionValidationException("Script validation failed: " + validation.joinedErrors());
        }
        BackendInstance instance = resolveInstance(request);
        String databaseName = requireDatabase(request);
        BackendCredentials credentials = directory.credentialsFor(instance);
        List<ConnectionDescriptor> connections = List.of(
                ConnectionDescriptor.of(instance, databaseName, credentials.reference()));

        log.info("Executing script requestId={} backend={} instance={} database={}",
                request.id(), instance.kind().wireName(), instance.id(), databaseName);
        return sandbox.execute(request.scriptContent(), connections);
    }

    private BackendInstance resolveInstance(ExecutionRequest request) {
        if (isBlank(request.instanceId())) {
            throw new BackendConfigurationException("Database instance not specified");
        }
        BackendInstance instance = directory.findInstance(request.instanceId())
                .orElseThrow(() -> new BackendConfigurationException("Database instance not found: " + request.instanceId()));
        if (instance.kind() != request.backendKind()) {
            throw new BackendConfigurationException("Database instance " + instance.id() + " is "
                    + instance.kind().wireName() + ", request targets " + request.backendKind().wireName());
        }
        return instance;
    }

    private static String requireDatabase(ExecutionRequest request) {
        if (isBlank(request.databaseName())) {
            throw new SubmissionValidationException("No database name provided");
        }
        return request.databaseName();
    }

    ExecutionOutcome postProcess(ExecutionRequest request, ExecutionOutcome outcome) {
        String output = outcome.output();
        long size = ResultCompressor.byteSize(output);
        if (output != null && ResultCompressor.shouldCompress(output, limits.compressionThreshold())) {
            String compressed = ResultCompressor.compress(output);
            log.info("Result compressed requestId={} originalSize={} compressedSize={}", request.id(),
                    ResultCompressor.formatBytes(size), ResultCompressor.formatBytes(ResultCompressor.byteSize(compressed)));
            return outcome.withPayload(compressed, true, size);
        }
        return outcome.withPayload(output, false, size);
    }

    @Override
    public void close() {
        handles.close();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
