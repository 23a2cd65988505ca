package org.iceforge.heimdall.execution;

/**
 * The target backend is unknown or not usable with the current configuration.
 */
public class BackendConfigurationException extends RuntimeException {
    public BackendConfigurationException(String message) {
        super(message);
    }

    public BackendConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
