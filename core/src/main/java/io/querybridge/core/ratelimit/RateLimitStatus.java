package io.querybridge.core.ratelimit;

/**
 * Snapshot of a {@link TokenBucketRateLimiter}.
 *
 * @param remaining         whole tokens available now
 * @param limit             bucket capacity
 * @param resetAtMs         epoch millis at which the bucket will be full again
 * @param windowStartMs     epoch millis of the last refill
 * @param queueLength       callers waiting for a token
 * @param queueWaitMs       estimated wait for the last queued caller, {@code 0} with an empty queue
 * @param backoffMultiplier current exponential multiplier, {@code 1} without recent violations
 */
public record RateLimitStatus(
        int remaining,
        int limit,
        long resetAtMs,
        long windowStartMs,
        int queueLength,
        long queueWaitMs,
        int backoffMultiplier) {

    /** Whether a new caller would have to queue. */
    public boolean shouldQueue() {
        return remaining < 1;
    }
}
