package org.iceforge.heimdall.execution;

/**
 * Login for a backend instance. {@code reference} names where the secret came from and is the only
 * part that ever leaves the router (for example into sandbox connection descriptors).
 */
public record BackendCredentials(String reference, String username, String password) {

    public static BackendCredentials none() {
        return new BackendCredentials("none", null, null);
    }

    @Override
    public String toString() {
        return "BackendCredentials[reference=" + reference + ", username=" + username + "]";
    }
}
