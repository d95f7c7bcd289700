package io.querybridge.core.error;

import io.querybridge.core.model.RawResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The normalized error shape handed to consumers of the connector. Raw
 * exceptions are classified into this form by {@link ErrorMapper}; nothing else
 * crosses the public boundary.
 *
 * <p>
 * Immutable. {@code retryInfo} is {@code null} for non-retryable errors and
 * {@code partialResults} is empty unless a recovery strategy salvaged
 * something.
 *
 * @param message        user-facing message
 * @param severity       how serious the failure is
 * @param category       taxonomy bucket
 * @param code           stable machine-readable code (e.g. {@code NETWORK_ERROR})
 * @param technical      the underlying technical message, for logs
 * @param suggestions    user-facing remediation hints
 * @param recoverable    whether retrying or degrading may succeed
 * @param retryInfo      retry policy, or {@code null}
 * @param partialResults results salvaged by recovery
 */
public record TransformedError(
        String message,
        ErrorSeverity severity,
        ErrorCategory category,
        String code,
        String technical,
        List<String> suggestions,
        boolean recoverable,
        RetryInfo retryInfo,
        List<RawResult> partialResults) {

    public TransformedError {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(code, "code must not be null");
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        partialResults = partialResults == null ? List.of() : List.copyOf(partialResults);
    }

    /** Returns {@code true} if the error is recoverable and carries a retry policy that allows retrying. */
    public boolean isRetryable() {
        return recoverable && retryInfo != null && retryInfo.canRetry();
    }

    /** Returns a copy with the given technical message. */
    public TransformedError withTechnical(String newTechnical) {
        return new TransformedError(
                message, severity, category, code, newTechnical, suggestions, recoverable, retryInfo, partialResults);
    }

    /** Returns a copy carrying the given partial results. */
    public TransformedError withPartialResults(List<RawResult> results) {
        return new TransformedError(
                message, severity, category, code, technical, suggestions, recoverable, retryInfo, results);
    }

    public static Builder builder(ErrorCategory category, String code) {
        return new Builder(category, code);
    }

    /** Fluent builder used by classification rules. */
    public static final class Builder {

        private final ErrorCategory category;
        private final String code;
        private String message = "An unexpected error occurred";
        private ErrorSeverity severity = ErrorSeverity.ERROR;
        private String technical;
        private final List<String> suggestions = new ArrayList<>();
        private boolean recoverable;
        private RetryInfo retryInfo;

        private Builder(ErrorCategory category, String code) {
            this.category = category;
            this.code = code;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder severity(ErrorSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder technical(String technical) {
            this.technical = technical;
            return this;
        }

        public Builder suggestions(String... values) {
            this.suggestions.addAll(List.of(values));
            return this;
        }

        public Builder suggestions(List<String> values) {
            this.suggestions.addAll(values);
            return this;
        }

        public Builder recoverable(boolean recoverable) {
            this.recoverable = recoverable;
            return this;
        }

        /** Marks the error recoverable with the given retry policy. */
        public Builder retry(int maxAttempts, long backoffMs) {
            this.recoverable = true;
            this.retryInfo = RetryInfo.of(maxAttempts, backoffMs);
            return this;
        }

        public TransformedError build() {
            return new TransformedError(
                    message, severity, category, code, technical, suggestions, recoverable, retryInfo, List.of());
        }
    }
}
