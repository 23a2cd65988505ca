package org.iceforge.heimdall.model;

import java.util.Locale;

/**
 * Request lifecycle: pending -> approved -> executed | failed, with rejected/withdrawn off-path.
 */
public enum RequestStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXECUTED,
    FAILED,
    WITHDRAWN;

    /** True once an execution outcome has been recorded; such a request must never run again. */
    public boolean isTerminalOutcome() {
        return this == EXECUTED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RequestStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is null");
        }
        return RequestStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
