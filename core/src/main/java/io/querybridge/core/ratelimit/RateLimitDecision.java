package io.querybridge.core.ratelimit;

/**
 * Result of one admission check.
 *
 * @param allowed      whether the request was admitted (and counted)
 * @param remaining    requests left in the current window after this one
 * @param resetAtMs    epoch millis at which the oldest counted request leaves the window
 * @param windowStartMs epoch millis of the current window start
 * @param retryAfterMs wait before retrying; {@code 0} when allowed
 * @param appliedLimit human-readable description of the limit that applied
 */
public record RateLimitDecision(
        boolean allowed, int remaining, long resetAtMs, long windowStartMs, long retryAfterMs, String appliedLimit) {}
