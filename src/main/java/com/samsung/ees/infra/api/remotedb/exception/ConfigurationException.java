package com.samsung.ees.infra.api.remotedb.exception;

/**
 * The field extraction configuration is missing or unreadable. A local failure, not a remote one.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
