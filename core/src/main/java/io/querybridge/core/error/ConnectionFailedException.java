package io.querybridge.core.error;

import java.util.Map;

/** A backend connection could not be established, validated or used. */
public final class ConnectionFailedException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public ConnectionFailedException(String message, String code, Throwable cause) {
        this(message, code, cause, Map.of());
    }

    public ConnectionFailedException(String message, String code, Throwable cause, Map<String, Object> context) {
        super(message, cause, ErrorCategory.CONNECTION, code, context);
    }
}
