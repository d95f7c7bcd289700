package io.querybridge.core.config;

import io.querybridge.core.pool.PoolSettings;
import io.querybridge.core.pool.RetryPolicy;
import java.util.Objects;

/**
 * Options shared by every data-source variant.
 *
 * @param timeoutMs overall operation timeout
 * @param retry     retry schedule for pooled execution
 * @param pooling   whether and how connections are pooled
 * @param security  connector-level input screening and rate limit
 */
public record ConnectionOptions(long timeoutMs, Retry retry, Pooling pooling, Security security) {

    public static final ConnectionOptions DEFAULT =
            new ConnectionOptions(30_000, Retry.DEFAULT, Pooling.DEFAULT, Security.DEFAULT);

    public ConnectionOptions {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got: " + timeoutMs);
        }
        retry = Objects.requireNonNullElse(retry, Retry.DEFAULT);
        pooling = Objects.requireNonNullElse(pooling, Pooling.DEFAULT);
        security = Objects.requireNonNullElse(security, Security.DEFAULT);
    }

    public ConnectionOptions withPooling(Pooling newPooling) {
        return new ConnectionOptions(timeoutMs, retry, newPooling, security);
    }

    public ConnectionOptions withSecurity(Security newSecurity) {
        return new ConnectionOptions(timeoutMs, retry, pooling, newSecurity);
    }

    public ConnectionOptions withRetry(Retry newRetry) {
        return new ConnectionOptions(timeoutMs, newRetry, pooling, security);
    }

    /** Pool settings derived from these options. */
    public PoolSettings toPoolSettings() {
        return PoolSettings.DEFAULT
                .withMaxConnections(pooling.maxConnections())
                .withIdleTimeout(pooling.idleTimeoutMs())
                .withRetry(retry.toPolicy());
    }

    /** Retry schedule: {@code attempts} tries with exponential backoff capped at {@code maxBackoffMs}. */
    public record Retry(int attempts, long backoffMs, long maxBackoffMs) {

        public static final Retry DEFAULT = new Retry(3, 1_000, 10_000);

        public RetryPolicy toPolicy() {
            return new RetryPolicy(Math.max(1, attempts), backoffMs, Math.max(backoffMs, maxBackoffMs));
        }
    }

    /** Connection pooling switch and limits. */
    public record Pooling(boolean enabled, int maxConnections, long idleTimeoutMs) {

        public static final Pooling DEFAULT = new Pooling(false, 10, 30_000);

        public static Pooling enabled(int maxConnections) {
            return new Pooling(true, maxConnections, DEFAULT.idleTimeoutMs);
        }
    }

    /**
     * Connector-level screening.
     *
     * @param validateInput   required for sql and api sources
     * @param sanitizeQueries screen query text for script and SQL injection markers
     * @param rateLimitRpm    connector-level requests per minute per adapter type
     */
    public record Security(boolean validateInput, boolean sanitizeQueries, int rateLimitRpm) {

        public static final Security DEFAULT = new Security(true, true, 1_000);
    }
}
