package io.querybridge.core.error;

/**
 * Retry policy attached to a recoverable {@link TransformedError}.
 *
 * @param canRetry    whether the caller may retry the failed operation
 * @param maxAttempts maximum attempts the caller should make
 * @param backoffMs   suggested initial delay between attempts
 */
public record RetryInfo(boolean canRetry, int maxAttempts, long backoffMs) {

    public RetryInfo {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative, got: " + maxAttempts);
        }
        if (backoffMs < 0) {
            throw new IllegalArgumentException("backoffMs must not be negative, got: " + backoffMs);
        }
    }

    public static RetryInfo of(int maxAttempts, long backoffMs) {
        return new RetryInfo(true, maxAttempts, backoffMs);
    }
}
