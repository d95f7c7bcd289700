package io.querybridge.core.error;

import java.util.Map;

/**
 * An HTTP call to a remote API failed, either in transport
 * ({@code status() == 0}) or with an error response from the server.
 */
public final class RemoteRequestException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public RemoteRequestException(String message, String code, int status, Throwable cause) {
        this(message, code, status, cause, Map.of());
    }

    public RemoteRequestException(
            String message, String code, int status, Throwable cause, Map<String, Object> context) {
        super(message, cause, categoryFor(status), code, context);
        this.status = status;
    }

    /** HTTP status returned by the server, or {@code 0} when no response was received. */
    public int status() {
        return status;
    }

    @Override
    public boolean retryable() {
        return status == 0 || status == 429 || status >= 500;
    }

    private static ErrorCategory categoryFor(int status) {
        if (status == 401) {
            return ErrorCategory.AUTHENTICATION;
        }
        if (status == 403) {
            return ErrorCategory.AUTHORIZATION;
        }
        if (status == 408 || status == 504) {
            return ErrorCategory.TIMEOUT;
        }
        return ErrorCategory.NETWORK;
    }
}
