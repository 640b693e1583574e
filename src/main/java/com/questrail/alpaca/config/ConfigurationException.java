package com.questrail.alpaca.config;

/**
 * Startup-time configuration error. The reflector refuses to start when one is
 * raised.
 */
public final class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
