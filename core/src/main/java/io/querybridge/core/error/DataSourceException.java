package io.querybridge.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Abstract base for all querybridge exceptions. Never thrown directly; use the
 * concrete subclasses. Every instance carries the taxonomy
 * {@link ErrorCategory} and a stable code so that {@link ErrorMapper} can
 * classify it without pattern matching on the message.
 */
public abstract class DataSourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCategory category;
    private final String code;
    private final transient Map<String, Object> context;

    protected DataSourceException(String message, ErrorCategory category, String code) {
        this(message, null, category, code, Map.of());
    }

    protected DataSourceException(
            String message, Throwable cause, ErrorCategory category, String code, Map<String, Object> context) {
        super(message, cause);
        this.category = category;
        this.code = code;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /** Taxonomy bucket of this failure. */
    public ErrorCategory category() {
        return category;
    }

    /** Stable machine-readable code, e.g. {@code SQL_CONNECTION_FAILED}. */
    public String code() {
        return code;
    }

    /** Diagnostic key/value pairs describing where the failure happened. Never contains secrets. */
    public Map<String, Object> context() {
        return context;
    }

    /** Whether a retry of the same operation may succeed. */
    public boolean retryable() {
        return category == ErrorCategory.CONNECTION
                || category == ErrorCategory.NETWORK
                || category == ErrorCategory.TIMEOUT;
    }
}
