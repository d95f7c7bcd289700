package io.querybridge.core.connector;

/**
 * Connector-wide limits.
 *
 * @param metricsHistory    connect/query metrics kept, oldest dropped first
 * @param rateLimitWindowMs length of the fixed window for the per-type rate limit
 */
public record ConnectorSettings(int metricsHistory, long rateLimitWindowMs) {

    public static final ConnectorSettings DEFAULT = new ConnectorSettings(1_000, 60_000);

    public ConnectorSettings {
        if (metricsHistory <= 0) {
            throw new IllegalArgumentException("metricsHistory must be positive, got: " + metricsHistory);
        }
        if (rateLimitWindowMs <= 0) {
            throw new IllegalArgumentException("rateLimitWindowMs must be positive, got: " + rateLimitWindowMs);
        }
    }
}
