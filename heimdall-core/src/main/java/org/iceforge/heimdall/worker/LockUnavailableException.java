package org.iceforge.heimdall.worker;

/**
 * Another job holds the channel. Thrown before any side effect so the queue simply redelivers later.
 */
public class LockUnavailableException extends Exception {
    private final String channelKey;

    public LockUnavailableException(String channelKey) {
        super("Lock unavailable for channel key: " + channelKey);
        this.channelKey = channelKey;
    }

    public String channelKey() {
        return channelKey;
    }
}
