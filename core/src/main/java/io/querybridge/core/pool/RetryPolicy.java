package io.querybridge.core.pool;

/**
 * Exponential retry schedule for {@link ConnectionPool#executeWithRetry}.
 *
 * @param attempts     total tries including the first, at least 1
 * @param backoffMs    delay before the second try
 * @param maxBackoffMs upper bound for any single delay
 */
public record RetryPolicy(int attempts, long backoffMs, long maxBackoffMs) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, 1_000, 10_000);

    /** Single attempt, no retries. */
    public static final RetryPolicy NONE = new RetryPolicy(1, 0, 0);

    public RetryPolicy {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1, got: " + attempts);
        }
        if (backoffMs < 0 || maxBackoffMs < 0) {
            throw new IllegalArgumentException("backoff values must not be negative");
        }
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the first retry, 2 for the second, ...
     */
    public long delayBeforeRetry(int retry) {
        long delay = backoffMs;
        for (int i = 1; i < retry && delay < maxBackoffMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxBackoffMs);
    }
}
