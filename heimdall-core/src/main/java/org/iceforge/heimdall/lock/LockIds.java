package org.iceforge.heimdall.lock;

/**
 * Maps channel keys onto the positive 63-bit id space of advisory locks.
 *
 * <p>Rolling polynomial hash ({@code h * 31 + c}, written as {@code (h << 5) - h + c}) masked to stay
 * positive after every character. Distinct keys can collide; a collision only serializes two
 * unrelated channels against each other.
 */
public final class LockIds {
    private static final long POSITIVE_MASK = 0x7FFF_FFFF_FFFF_FFFFL;

    private LockIds() {}

    public static long fromChannelKey(String channelKey) {
        if (channelKey == null) {
            throw new IllegalArgumentException("channelKey is null");
        }
        long hash = 0L;
        for (int i = 0; i < channelKey.length(); i++) {
            hash = ((hash << 5) - hash) + channelKey.charAt(i);
            hash = hash & POSITIVE_MASK;
        }
        return hash;
    }
}
