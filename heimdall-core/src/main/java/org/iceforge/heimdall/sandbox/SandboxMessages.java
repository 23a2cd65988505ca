package org.iceforge.heimdall.sandbox;

import org.iceforge.heimdall.model.ConnectionDescriptor;
import org.iceforge.heimdall.model.FailureCategory;

import java.util.List;

/**
 * Wire records between {@link ProcessScriptSandbox} and {@link SandboxRunner}: one JSON request on the
 * child's stdin, one JSON result line on its stdout.
 */
final class SandboxMessages {
    private SandboxMessages() {}

    record Request(String script, List<ConnectionDescriptor> connections) {}

    record Result(boolean success, String logs, String errors, String error, FailureCategory category) {}
}
