package org.iceforge.heimdall.model;

import java.util.Locale;

/**
 * Kind of target system a request runs against.
 */
public enum BackendKind {
    RELATIONAL("postgresql"),
    DOCUMENT("mongodb");

    private final String wireName;

    BackendKind(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in persisted rows and channel keys. */
    public String wireName() {
        return wireName;
    }

    public static BackendKind fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("backend kind is null");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (BackendKind k : values()) {
            if (k.wireName.equals(v) || k.name().equalsIgnoreCase(v)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown backend kind: " + value);
    }
}
