package io.querybridge.core.ratelimit;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** One {@link TokenBucketRateLimiter} per endpoint key. Thread-safe. */
public final class RateLimiterRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimiterRegistry.class);

    private final Map<String, TokenBucketRateLimiter> limiters = new ConcurrentHashMap<>();

    /**
     * Returns the limiter for {@code endpoint}, creating it from {@code config}
     * on first use. Later calls return the existing limiter regardless of the
     * config passed.
     */
    public TokenBucketRateLimiter limiterFor(String endpoint, RateLimitConfig config) {
        return limiters.computeIfAbsent(endpoint, key -> {
            LOG.debug("Created rate limiter for endpoint {} ({} rpm)", key, config.requestsPerMinute());
            return new TokenBucketRateLimiter(config);
        });
    }

    public Optional<TokenBucketRateLimiter> find(String endpoint) {
        return Optional.ofNullable(limiters.get(endpoint));
    }

    /** Removes the endpoint's limiter and fails its queued callers. */
    public void remove(String endpoint) {
        TokenBucketRateLimiter limiter = limiters.remove(endpoint);
        if (limiter != null) {
            limiter.clearQueue();
        }
    }

    public void clear() {
        limiters.values().forEach(TokenBucketRateLimiter::clearQueue);
        limiters.clear();
    }

    public Set<String> endpoints() {
        return Set.copyOf(limiters.keySet());
    }
}
