package io.querybridge.core.ratelimit;

import java.util.Objects;

/**
 * Token-bucket settings for remote APIs.
 *
 * <p>
 * A non-positive {@code requestsPerSecond} is derived as
 * {@code requestsPerMinute / 60}; a non-positive {@code burstLimit} as
 * {@code max(1, requestsPerSecond)}.
 *
 * @param requestsPerMinute sustained quota
 * @param requestsPerSecond bucket refill rate
 * @param burstLimit        bucket capacity
 * @param queueSize         callers that may wait for a token; {@code 0} disables queueing
 * @param backoffStrategy   delay growth after reported violations
 * @param initialBackoffMs  base backoff delay
 * @param maxBackoffMs      backoff cap
 */
public record RateLimitConfig(
        int requestsPerMinute,
        double requestsPerSecond,
        int burstLimit,
        int queueSize,
        BackoffStrategy backoffStrategy,
        long initialBackoffMs,
        long maxBackoffMs) {

    public static final int DEFAULT_QUEUE_SIZE = 10;

    public static final RateLimitConfig DEFAULT = perMinute(60);

    public RateLimitConfig {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive, got: " + requestsPerMinute);
        }
        if (requestsPerSecond <= 0) {
            requestsPerSecond = requestsPerMinute / 60.0;
        }
        if (burstLimit <= 0) {
            burstLimit = (int) Math.max(1, Math.floor(requestsPerSecond));
        }
        if (queueSize < 0) {
            throw new IllegalArgumentException("queueSize must not be negative, got: " + queueSize);
        }
        backoffStrategy = Objects.requireNonNullElse(backoffStrategy, BackoffStrategy.EXPONENTIAL);
        if (initialBackoffMs <= 0) {
            initialBackoffMs = 1_000;
        }
        if (maxBackoffMs < initialBackoffMs) {
            maxBackoffMs = Math.max(initialBackoffMs, 30_000);
        }
    }

    /** Derived defaults for a per-minute quota. */
    public static RateLimitConfig perMinute(int requestsPerMinute) {
        return new RateLimitConfig(
                requestsPerMinute, 0, 0, DEFAULT_QUEUE_SIZE, BackoffStrategy.EXPONENTIAL, 1_000, 30_000);
    }

    public RateLimitConfig withBurstLimit(int burst) {
        return new RateLimitConfig(
                requestsPerMinute, requestsPerSecond, burst, queueSize, backoffStrategy, initialBackoffMs, maxBackoffMs);
    }

    public RateLimitConfig withRequestsPerSecond(double rps) {
        return new RateLimitConfig(
                requestsPerMinute, rps, burstLimit, queueSize, backoffStrategy, initialBackoffMs, maxBackoffMs);
    }

    public RateLimitConfig withQueueSize(int size) {
        return new RateLimitConfig(
                requestsPerMinute, requestsPerSecond, burstLimit, size, backoffStrategy, initialBackoffMs, maxBackoffMs);
    }

    public RateLimitConfig withBackoff(BackoffStrategy strategy, long initialMs, long maxMs) {
        return new RateLimitConfig(requestsPerMinute, requestsPerSecond, burstLimit, queueSize, strategy, initialMs, maxMs);
    }
}
