package org.iceforge.heimdall.sandbox;

import org.iceforge.heimdall.model.ConnectionDescriptor;
import org.iceforge.heimdall.model.ExecutionOutcome;

import java.util.List;

/**
 * Runs one untrusted script in an isolated context bounded by a memory ceiling and a wall-clock
 * timeout. Never throws from {@link #execute}.
 */
public interface ScriptSandbox {

    ExecutionOutcome execute(String script, List<ConnectionDescriptor> connections);

    /** Fast pre-flight check for patterns the isolated context would refuse anyway. */
    default ValidationResult validate(String script) {
        return ScriptValidator.validate(script);
    }
}
