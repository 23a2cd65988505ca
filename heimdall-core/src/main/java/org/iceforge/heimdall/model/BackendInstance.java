package org.iceforge.heimdall.model;

import java.util.Objects;

/**
 * A registered target system (one server that hosts one or more databases).
 */
public record BackendInstance(String id, String name, BackendKind kind, String host, int port) {
    public BackendInstance {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(host, "host");
    }
}
