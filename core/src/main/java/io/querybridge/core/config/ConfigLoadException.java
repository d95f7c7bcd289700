package io.querybridge.core.config;

/**
 * Thrown when a data-source configuration file cannot be read, does not satisfy
 * the configuration schema, or references an unset environment variable.
 */
public final class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
