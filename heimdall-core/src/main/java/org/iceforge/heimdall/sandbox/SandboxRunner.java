package org.iceforge.heimdall.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.io.IOAccess;
import org.iceforge.heimdall.model.FailureCategory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Entry point of the sandbox child JVM. Reads one request from stdin, evaluates the script in a locked
 * down GraalJS context and prints one result line on stdout. Nothing else may write to stdout.
 */
public final class SandboxRunner {

    static final String LANGUAGE = "js";
    static final String CONNECTIONS_BINDING = "__heimdallConnections";

    private SandboxRunner() {}

    public static void main(String[] args) throws IOException {
        PrintStream protocolOut = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.setOut(System.err);

        ObjectMapper mapper = new ObjectMapper();
        SandboxMessages.Request request = mapper.readValue(System.in.readAllBytes(), SandboxMessages.Request.class);
        String connectionsJson = mapper.writeValueAsString(request.connections() == null ? List.of() : request.connections());

        SandboxMessages.Result result = run(request.script(), connectionsJson);
        protocolOut.println(mapper.writeValueAsString(result));
        protocolOut.flush();
        System.exit(0);
    }

    static SandboxMessages.Result run(String script, String connectionsJson) {
        ByteArrayOutputStream logs = new ByteArrayOutputStream();
        ByteArrayOutputStream errors = new ByteArrayOutputStream();
        try (Context context = newContext(logs, errors)) {
            try {
                context.getBindings(LANGUAGE).putMember(CONNECTIONS_BINDING, connectionsJson);
                context.eval(Source.newBuilder(LANGUAGE, wrap(script), "script.js").buildLiteral());
                return new SandboxMessages.Result(true, text(logs), text(errors), null, null);
            } catch (PolyglotException e) {
                if (e.isResourceExhausted()) {
                    return new SandboxMessages.Result(false, text(logs), text(errors), "resource exhausted", FailureCategory.MEMORY_LIMIT);
                }
                String message = e.getMessage() == null ? "Script failed" : e.getMessage();
                return new SandboxMessages.Result(false, text(logs), text(errors), message, FailureCategory.EXECUTION);
            }
        }
    }

    private static Context newContext(ByteArrayOutputStream logs, ByteArrayOutputStream errors) {
        return Context.newBuilder(LANGUAGE)
                .allowAllAccess(false)
                .allowHostAccess(HostAccess.NONE)
                .allowHostClassLookup(className -> false)
                .allowIO(IOAccess.NONE)
                .allowCreateProcess(false)
                .allowCreateThread(false)
                .allowNativeAccess(false)
                .allowPolyglotAccess(PolyglotAccess.NONE)
                .allowEnvironmentAccess(EnvironmentAccess.NONE)
                .option("engine.WarnInterpreterOnly", "false")
                .out(logs)
                .err(errors)
                .build();
    }

    /**
     * Freezes the connection descriptors into a global {@code connections} array, then runs the
     * script in a function scope that reports an uncaught error on the error channel before rethrowing.
     */
    static String wrap(String script) {
        return "(function () {\n"
                + "  const raw = globalThis['" + CONNECTIONS_BINDING + "'];\n"
                + "  delete globalThis['" + CONNECTIONS_BINDING + "'];\n"
                + "  const list = JSON.parse(raw).map(c => Object.freeze(c));\n"
                + "  Object.defineProperty(globalThis, 'connections', {value: Object.freeze(list), writable: false, configurable: false});\n"
                + "})();\n"
                + "(function () {\n"
                + "  try {\n"
                + script + "\n"
                + "  } catch (e) {\n"
                + "    console.error(e && e.stack ? e.stack : String(e));\n"
                + "    throw e;\n"
                + "  }\n"
                + "})();\n";
    }

    private static String text(ByteArrayOutputStream buffer) {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
