package org.iceforge.heimdall.model;

/**
 * Plain connection data handed to sandboxed scripts. Never a live handle.
 *
 * <p>{@code uri} is a driver-neutral URI ({@code postgresql://host:port/db} or
 * {@code mongodb://host:port/db}); credentials travel by reference only.
 */
public record ConnectionDescriptor(
        String kind,
        String host,
        int port,
        String database,
        String uri,
        String credentialsRef
) {
    public static ConnectionDescriptor of(BackendInstance instance, String database, String credentialsRef) {
        String scheme = instance.kind().wireName();
        String uri = scheme + "://" + instance.host() + ":" + instance.port() + "/" + (database == null ? "" : database);
        return new ConnectionDescriptor(scheme, instance.host(), instance.port(), database, uri, credentialsRef);
    }
}
