package org.iceforge.heimdall.execution.mongo;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * A parsed {@code db.<collection>.<method>(<args>)} command.
 */
public record MongoQuery(String collection, MongoMethod method, List<JsonNode> args) {
    public MongoQuery {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(method, "method");
        args = args == null ? List.of() : List.copyOf(args);
    }

    /** Argument at {@code index}, or null when absent or JSON null. */
    public JsonNode arg(int index) {
        if (index >= args.size()) return null;
        JsonNode node = args.get(index);
        return node == null || node.isNull() ? null : node;
    }
}
