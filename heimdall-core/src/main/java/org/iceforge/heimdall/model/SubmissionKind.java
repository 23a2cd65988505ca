package org.iceforge.heimdall.model;

import java.util.Locale;

public enum SubmissionKind {
    QUERY,
    SCRIPT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SubmissionKind fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("submission kind is null");
        }
        return SubmissionKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
