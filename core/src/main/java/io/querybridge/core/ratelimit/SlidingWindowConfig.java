package io.querybridge.core.ratelimit;

import java.util.Objects;

/**
 * Settings for {@link SlidingWindowRateLimiter}.
 *
 * @param windowSizeMs      length of the sliding window
 * @param maxRequests       requests allowed per window per client
 * @param burstAllowance    extra requests tolerated above {@code maxRequests}, at most this many
 *                          within any one second
 * @param crossInstanceSync whether state is mirrored through a {@link RateLimitSyncChannel}
 * @param syncKey           channel topic shared by cooperating instances
 */
public record SlidingWindowConfig(
        long windowSizeMs, int maxRequests, int burstAllowance, boolean crossInstanceSync, String syncKey) {

    private static final String DEFAULT_SYNC_KEY = "rate-limiter-state";

    public static final SlidingWindowConfig DEFAULT =
            new SlidingWindowConfig(60_000, 100, 20, true, DEFAULT_SYNC_KEY);

    public SlidingWindowConfig {
        if (windowSizeMs <= 0) {
            throw new IllegalArgumentException("windowSizeMs must be positive, got: " + windowSizeMs);
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive, got: " + maxRequests);
        }
        if (burstAllowance < 0) {
            throw new IllegalArgumentException("burstAllowance must not be negative, got: " + burstAllowance);
        }
        syncKey = Objects.requireNonNullElse(syncKey, DEFAULT_SYNC_KEY);
    }

    /** A window without burst allowance or sync. */
    public static SlidingWindowConfig of(long windowSizeMs, int maxRequests) {
        return new SlidingWindowConfig(windowSizeMs, maxRequests, 0, false, DEFAULT_SYNC_KEY);
    }

    public SlidingWindowConfig withBurstAllowance(int burst) {
        return new SlidingWindowConfig(windowSizeMs, maxRequests, burst, crossInstanceSync, syncKey);
    }

    public SlidingWindowConfig withSync(boolean enabled, String key) {
        return new SlidingWindowConfig(windowSizeMs, maxRequests, burstAllowance, enabled, key);
    }
}
