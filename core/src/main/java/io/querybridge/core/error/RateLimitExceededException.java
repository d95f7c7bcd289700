package io.querybridge.core.error;

import java.util.Map;

/** Thrown when a caller exceeds its admission quota. Classified as a security violation. */
public final class RateLimitExceededException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "RATE_LIMITED";

    private final long retryAfterMs;

    public RateLimitExceededException(String message, long retryAfterMs) {
        this(message, retryAfterMs, Map.of());
    }

    public RateLimitExceededException(String message, long retryAfterMs, Map<String, Object> context) {
        super(message, null, ErrorCategory.SECURITY, CODE, context);
        this.retryAfterMs = retryAfterMs;
    }

    /** Milliseconds until the caller may try again; {@code 0} if unknown. */
    public long retryAfterMs() {
        return retryAfterMs;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
