package io.querybridge.core.error;

import java.util.List;
import java.util.Map;

/**
 * Thrown when a query, parameter or connection string fails security
 * validation. Security violations abort the call; they are never silently
 * sanitized.
 */
public final class SecurityViolationException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public SecurityViolationException(String message, String code, List<String> violations) {
        this(message, code, violations, Map.of());
    }

    public SecurityViolationException(
            String message, String code, List<String> violations, Map<String, Object> context) {
        super(message, null, ErrorCategory.SECURITY, code, context);
        this.violations = List.copyOf(violations);
    }

    /** Individual validation findings that caused the rejection. */
    public List<String> violations() {
        return violations;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
