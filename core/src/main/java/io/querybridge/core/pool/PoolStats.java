package io.querybridge.core.pool;

/** Point-in-time counters of a {@link ConnectionPool}. */
public record PoolStats(
        int total,
        int idle,
        int active,
        int waiting,
        long created,
        long destroyed,
        long acquired,
        long timedOut) {}
