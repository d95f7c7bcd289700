package io.querybridge.core.ratelimit;

import io.querybridge.core.error.ConfigValidationException;
import java.util.Locale;

/** How the delay after a reported rate-limit violation grows. */
public enum BackoffStrategy {
    /** {@code initial × multiplier}, where the multiplier doubles per violation. */
    EXPONENTIAL,
    /** {@code initial × violations}. */
    LINEAR,
    /** Always {@code initial}. */
    FIXED;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Delay for the current violation state, capped at {@code maxMs}.
     *
     * @param initialMs  base delay
     * @param multiplier current exponential multiplier
     * @param violations violations since the last decay
     * @param maxMs      upper bound
     */
    public long delay(long initialMs, int multiplier, int violations, long maxMs) {
        long raw = switch (this) {
            case EXPONENTIAL -> initialMs * multiplier;
            case LINEAR -> initialMs * Math.max(1, violations);
            case FIXED -> initialMs;
        };
        return Math.min(raw, maxMs);
    }

    public static BackoffStrategy fromId(String id) {
        if (id == null || id.isBlank()) {
            return EXPONENTIAL;
        }
        for (BackoffStrategy strategy : values()) {
            if (strategy.id().equalsIgnoreCase(id.trim())) {
                return strategy;
            }
        }
        throw new ConfigValidationException("Unknown backoff strategy: " + id, "rateLimit.backoffStrategy");
    }
}
