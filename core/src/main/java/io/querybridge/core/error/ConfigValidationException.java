package io.querybridge.core.error;

import java.util.Map;

/**
 * Thrown by {@code validateConfig} when a data-source configuration is
 * structurally invalid. Raised before any I/O takes place.
 */
public final class ConfigValidationException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "INVALID_CONFIG";

    private final String field;

    public ConfigValidationException(String message) {
        this(message, null);
    }

    public ConfigValidationException(String message, String field) {
        super(message, null, ErrorCategory.VALIDATION, CODE, field == null ? Map.of() : Map.of("field", field));
        this.field = field;
    }

    /** The offending configuration field, or {@code null} if not attributable to one field. */
    public String field() {
        return field;
    }
}
