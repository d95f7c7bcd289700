package io.querybridge.core.error;

import java.util.Map;

/** Cross-origin access was refused and no fallback strategy could serve the request. */
public final class CorsFallbackException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "CORS_NO_FALLBACK";

    public CorsFallbackException(String message) {
        super(message, ErrorCategory.NETWORK, CODE);
    }

    public CorsFallbackException(String message, Throwable cause) {
        super(message, cause, ErrorCategory.NETWORK, CODE, Map.of());
    }
}
