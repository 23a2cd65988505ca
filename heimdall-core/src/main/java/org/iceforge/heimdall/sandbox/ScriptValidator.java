package org.iceforge.heimdall.sandbox;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Static screen for scripts. Only produces early, readable errors: the sandbox context itself has no
 * module loader, file system or process access.
 */
public final class ScriptValidator {

    private record Rule(Pattern pattern, String message) {}

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("child_process", Pattern.CASE_INSENSITIVE), "child_process module is not allowed"),
            new Rule(Pattern.compile("\\bcluster\\b", Pattern.CASE_INSENSITIVE), "cluster module is not allowed"),
            new Rule(Pattern.compile("\\beval\\s*\\(", Pattern.CASE_INSENSITIVE), "eval() is not allowed"),
            new Rule(Pattern.compile("\\bFunction\\s*\\("), "Function constructor is not allowed"),
            new Rule(Pattern.compile("process\\.exit", Pattern.CASE_INSENSITIVE), "process.exit() is not allowed"),
            new Rule(Pattern.compile("\\bprocess\\s*\\.\\s*(?!exit)\\w+"), "process access is not allowed"),
            new Rule(Pattern.compile("require\\s*\\(\\s*['\"](node:)?fs(/promises)?['\"]\\s*\\)", Pattern.CASE_INSENSITIVE),
                    "Direct fs module usage is restricted"),
            new Rule(Pattern.compile("\\brequire\\s*\\("), "require() is not available in the sandbox"),
            new Rule(Pattern.compile("(^|[;\\s])import(\\s+[\\w{*'\"]|\\s*\\()", Pattern.MULTILINE), "import is not available in the sandbox")
    );

    private ScriptValidator() {}

    public static ValidationResult validate(String script) {
        if (script == null || script.isBlank()) {
            return new ValidationResult(false, List.of("Script content is required"));
        }
        List<String> errors = new ArrayList<>();
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(script).find()) {
                errors.add(rule.message());
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : new ValidationResult(false, errors);
    }
}
