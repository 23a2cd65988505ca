package org.iceforge.heimdall.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.heimdall.model.ConnectionDescriptor;
import org.iceforge.heimdall.model.ExecutionOutcome;
import org.iceforge.heimdall.model.FailureCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every script in its own short-lived JVM ({@link SandboxRunner}). The heap ceiling is the child's
 * {@code -Xmx}; the wall-clock limit is enforced here by killing the child. The child never outlives a
 * call to {@link #execute}.
 */
public class ProcessScriptSandbox implements ScriptSandbox {

    private static final Logger log = LoggerFactory.getLogger(ProcessScriptSandbox.class);

    /** Exit status of a HotSpot JVM started with {@code -XX:+ExitOnOutOfMemoryError}. */
    static final int OOM_EXIT_CODE = 3;
    static final String ERROR_DELIMITER = "\n--- errors ---\n";
    private static final int MAX_DIAGNOSTIC_CHARS = 512;

    private final SandboxLimits limits;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService drainers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "heimdall-sandbox-io");
        t.setDaemon(true);
        return t;
    });

    public ProcessScriptSandbox(SandboxLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    @Override
    public ExecutionOutcome execute(String script, List<ConnectionDescriptor> connections) {
        long start = System.nanoTime();
        Process process = null;
        try {
            process = new ProcessBuilder(command()).start();
            CompletableFuture<String> stdout = drain(process.getInputStream());
            CompletableFuture<String> stderr = drain(process.getErrorStream());

            byte[] request = mapper.writeValueAsBytes(new SandboxMessages.Request(script,
                    connections == null ? List.of() : connections));
            try (OutputStream in = process.getOutputStream()) {
                in.write(request);
            }

            long remainingMs = limits.timeout().toMillis() - elapsedMs(start);
            boolean finished = remainingMs > 0 && process.waitFor(remainingMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Script timed out timeoutMs={}", limits.timeout().toMillis());
                return ExecutionOutcome.failure(FailureCategory.TIMEOUT,
                        "Script execution timed out after " + limits.timeout().toMillis() + "ms");
            }

            int exit = process.exitValue();
            String out = await(stdout);
            if (exit == OOM_EXIT_CODE) {
                log.warn("Script exceeded memory limit memoryMb={}", limits.memoryMb());
                return memoryLimitOutcome();
            }
            SandboxMessages.Result result = parseResult(out);
            if (result == null) {
                String diag = truncate(await(stderr));
                log.error("Sandbox child produced no result exit={} stderr={}", exit, diag);
                return ExecutionOutcome.failure(FailureCategory.EXECUTION, "Script process exited with code " + exit);
            }
            return toOutcome(result, start);
        } catch (IOException e) {
            log.error("Sandbox child could not be run: {}", e.getMessage());
            return ExecutionOutcome.failure(FailureCategory.EXECUTION, "Script sandbox unavailable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionOutcome.failure(FailureCategory.EXECUTION, "Script execution interrupted");
        } finally {
            if (process != null) {
                destroy(process);
            }
        }
    }

    private ExecutionOutcome toOutcome(SandboxMessages.Result result, long start) {
        String combined = combine(result.logs(), result.errors());
        if (result.success()) {
            log.info("Script executed durationMs={}", elapsedMs(start));
            return ExecutionOutcome.success(combined, null);
        }
        if (result.category() == FailureCategory.MEMORY_LIMIT) {
            return memoryLimitOutcome();
        }
        log.info("Script failed durationMs={}: {}", elapsedMs(start), result.error());
        return ExecutionOutcome.failure(FailureCategory.EXECUTION, result.error(), combined.isEmpty() ? null : combined);
    }

    private ExecutionOutcome memoryLimitOutcome() {
        return ExecutionOutcome.failure(FailureCategory.MEMORY_LIMIT,
                "Script exceeded memory limit of " + limits.memoryMb() + " MB");
    }

    static String combine(String logs, String errors) {
        String l = logs == null ? "" : logs;
        if (errors == null || errors.isEmpty()) {
            return l;
        }
        return l + ERROR_DELIMITER + errors;
    }

    List<String> command() {
        String javaHome = limits.javaHome() != null ? limits.javaHome() : System.getProperty("java.home");
        String classpath = limits.classpath() != null ? limits.classpath() : System.getProperty("java.class.path");
        List<String> cmd = new ArrayList<>();
        cmd.add(Path.of(javaHome, "bin", "java").toString());
        cmd.add("-Xmx" + limits.memoryMb() + "m");
        cmd.add("-XX:+ExitOnOutOfMemoryError");
        cmd.add("-Xss2m");
        cmd.add("-Dfile.encoding=UTF-8");
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add(SandboxRunner.class.getName());
        return cmd;
    }

    private SandboxMessages.Result parseResult(String stdout) {
        if (stdout == null) return null;
        String[] lines = stdout.strip().split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].strip();
            if (line.startsWith("{")) {
                try {
                    return mapper.readValue(line, SandboxMessages.Result.class);
                } catch (JsonProcessingException e) {
                    log.debug("Ignoring unparseable sandbox line: {}", e.getOriginalMessage());
                }
            }
        }
        return null;
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream s = stream) {
                return new String(s.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, drainers);
    }

    private static String await(CompletableFuture<String> future) throws InterruptedException {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Sandbox stream not drained: {}", e.toString());
            return "";
        }
    }

    private static void destroy(Process process) {
        if (!process.isAlive()) return;
        process.destroyForcibly();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                log.warn("Sandbox child pid={} did not exit after kill", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String truncate(String raw) {
        if (raw == null) return "";
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        return normalized.length() <= MAX_DIAGNOSTIC_CHARS ? normalized : normalized.substring(0, MAX_DIAGNOSTIC_CHARS) + "...";
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
