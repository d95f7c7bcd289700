package io.querybridge.core.error;

import java.util.Locale;

/** Taxonomy of failures that can cross the adapter boundary. */
public enum ErrorCategory {
    CONNECTION,
    SECURITY,
    VALIDATION,
    NETWORK,
    AUTHENTICATION,
    AUTHORIZATION,
    TIMEOUT,
    DATA,
    CONFIGURATION,
    TRANSFORMATION,
    UNKNOWN;

    /** Lower-case identifier used in logs and JSON payloads (e.g. {@code "network"}). */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
