package io.querybridge.core.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Helpers for lists of {@link TransformedError}s. */
public final class TransformedErrors {

    private TransformedErrors() {
        // utility class
    }

    /** True when the error is recoverable and its retry policy allows retrying. */
    public static boolean isRetryable(TransformedError error) {
        return error.isRetryable();
    }

    /**
     * One-line summary: {@code "No errors"}, the single message, or e.g.
     * {@code "Multiple errors occurred: 2 network errors, 1 timeout error"} in
     * first-seen category order.
     */
    public static String summarize(List<TransformedError> errors) {
        if (errors.isEmpty()) {
            return "No errors";
        }
        if (errors.size() == 1) {
            return errors.get(0).message();
        }
        Map<ErrorCategory, Long> counts = errors.stream()
                .collect(Collectors.groupingBy(TransformedError::category, LinkedHashMap::new, Collectors.counting()));
        String parts = counts.entrySet().stream()
                .map(e -> e.getValue() + " " + e.getKey().id() + " error" + (e.getValue() > 1 ? "s" : ""))
                .collect(Collectors.joining(", "));
        return "Multiple errors occurred: " + parts;
    }

    /** Most severe level present, {@link ErrorSeverity#INFO} for an empty list. */
    public static ErrorSeverity highestSeverity(List<TransformedError> errors) {
        ErrorSeverity highest = ErrorSeverity.INFO;
        for (TransformedError error : errors) {
            if (error.severity().isMoreSevereThan(highest)) {
                highest = error.severity();
            }
        }
        return highest;
    }
}
