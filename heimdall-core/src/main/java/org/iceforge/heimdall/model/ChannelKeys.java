package org.iceforge.heimdall.model;

/**
 * Channel keys identify one target database inside one backend instance. All jobs sharing a key run
 * one at a time.
 *
 * <p>Format: {@code <kind>:<instanceId>:<databaseName>}. Tables/collections are deliberately not part
 * of the key since scripts may touch several of them.
 */
public final class ChannelKeys {
    private ChannelKeys() {}

    public static String of(BackendKind kind, String instanceId, String databaseName) {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        return kind.wireName() + ":" + nullToEmpty(instanceId) + ":" + nullToEmpty(databaseName);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
