package io.querybridge.core.error;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of {@link ErrorMapper} counters.
 *
 * @param recoveryAttempts     errors handed to recovery strategies
 * @param successfulRecoveries attempts that a strategy recovered
 */
public record ErrorStats(
        long totalErrors,
        Map<ErrorCategory, Long> byCategory,
        Map<ErrorSeverity, Long> bySeverity,
        long recoveryAttempts,
        long successfulRecoveries) {

    public ErrorStats {
        byCategory = Map.copyOf(byCategory);
        bySeverity = Map.copyOf(bySeverity);
    }

    /** Share of recovery attempts that succeeded, {@code 0} when nothing was attempted. */
    public double recoveryRate() {
        return recoveryAttempts == 0 ? 0 : (double) successfulRecoveries / recoveryAttempts;
    }

    public Optional<ErrorCategory> mostCommonCategory() {
        // ties go to the category declared first
        Comparator<Map.Entry<ErrorCategory, Long>> byCount = Map.Entry.comparingByValue();
        return byCategory.entrySet().stream()
                .max(byCount.thenComparing(e -> e.getKey(), Comparator.reverseOrder()))
                .map(Map.Entry::getKey);
    }
}
