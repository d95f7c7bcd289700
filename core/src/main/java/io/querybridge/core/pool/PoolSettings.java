package io.querybridge.core.pool;

import java.util.Objects;

/**
 * Sizing and timing of a {@link ConnectionPool}.
 *
 * @param maxConnections      upper bound on live resources
 * @param idleTimeoutMs       idle resources older than this are evicted by the sweep
 * @param connectionTimeoutMs bound on a single {@link PooledResourceFactory#create()} call
 * @param acquireTimeoutMs    how long {@link ConnectionPool#acquire()} waits for capacity
 * @param validateOnAcquire   validate idle resources before handing them out
 * @param validateOnRelease   validate resources when they come back
 * @param retry               schedule used by {@link ConnectionPool#executeWithRetry}
 */
public record PoolSettings(
        int maxConnections,
        long idleTimeoutMs,
        long connectionTimeoutMs,
        long acquireTimeoutMs,
        boolean validateOnAcquire,
        boolean validateOnRelease,
        RetryPolicy retry) {

    public static final PoolSettings DEFAULT =
            new PoolSettings(10, 30_000, 10_000, 5_000, true, false, RetryPolicy.DEFAULT);

    public PoolSettings {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be at least 1, got: " + maxConnections);
        }
        if (idleTimeoutMs <= 0 || connectionTimeoutMs <= 0 || acquireTimeoutMs <= 0) {
            throw new IllegalArgumentException("pool timeouts must be positive");
        }
        retry = Objects.requireNonNullElse(retry, RetryPolicy.DEFAULT);
    }

    public PoolSettings withMaxConnections(int max) {
        return new PoolSettings(
                max, idleTimeoutMs, connectionTimeoutMs, acquireTimeoutMs, validateOnAcquire, validateOnRelease, retry);
    }

    public PoolSettings withIdleTimeout(long ms) {
        return new PoolSettings(
                maxConnections, ms, connectionTimeoutMs, acquireTimeoutMs, validateOnAcquire, validateOnRelease, retry);
    }

    public PoolSettings withTimeouts(long connectionMs, long acquireMs) {
        return new PoolSettings(
                maxConnections, idleTimeoutMs, connectionMs, acquireMs, validateOnAcquire, validateOnRelease, retry);
    }

    public PoolSettings withValidation(boolean onAcquire, boolean onRelease) {
        return new PoolSettings(
                maxConnections, idleTimeoutMs, connectionTimeoutMs, acquireTimeoutMs, onAcquire, onRelease, retry);
    }

    public PoolSettings withRetry(RetryPolicy policy) {
        return new PoolSettings(
                maxConnections, idleTimeoutMs, connectionTimeoutMs, acquireTimeoutMs, validateOnAcquire, validateOnRelease,
                policy);
    }
}
