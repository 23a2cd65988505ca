package org.iceforge.heimdall.model;

/**
 * Why an execution attempt failed. Surfaced to requesters through the outcome's error text.
 */
public enum FailureCategory {
    /** Missing payload, malformed mini-language, disallowed script pattern. */
    VALIDATION,
    /** Statement, operation or sandbox wall-clock timeout. */
    TIMEOUT,
    /** Sandbox memory ceiling reached. */
    MEMORY_LIMIT,
    /** Backend instance unknown or not configured. */
    CONFIGURATION,
    /** Anything raised by the target system or the engine itself. */
    EXECUTION
}
