package io.querybridge.core.ratelimit;

/** Point-in-time counters of a {@link SlidingWindowRateLimiter}. */
public record RateLimiterStats(int activeClients, long totalRequests, long blockedRequests) {}
