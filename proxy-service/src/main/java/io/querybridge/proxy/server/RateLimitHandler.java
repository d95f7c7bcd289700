package io.querybridge.proxy.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.querybridge.core.ratelimit.RateLimitDecision;
import io.querybridge.core.ratelimit.SlidingWindowRateLimiter;
import java.util.Set;

/**
 * Before-handler applying a per-client sliding window keyed by the caller's IP
 * address.
 *
 * <p>
 * Admitted responses carry {@code X-RateLimit-Limit} and
 * {@code X-RateLimit-Remaining}; denied requests get {@code 429} with
 * {@code Retry-After} in seconds.
 */
public final class RateLimitHandler implements Handler {

    private final SlidingWindowRateLimiter limiter;
    private final Set<String> openPaths;

    public RateLimitHandler(SlidingWindowRateLimiter limiter, Set<String> openPaths) {
        this.limiter = limiter;
        this.openPaths = Set.copyOf(openPaths);
    }

    @Override
    public void handle(Context ctx) {
        if (openPaths.contains(ctx.path())) {
            return;
        }
        RateLimitDecision decision = limiter.checkLimit(ctx.ip(), ctx.method() + " " + ctx.path());
        ctx.header("X-RateLimit-Limit", String.valueOf(limiter.config().maxRequests()));
        ctx.header("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
        if (decision.allowed()) {
            return;
        }
        long retryAfterSeconds = Math.max(1, (decision.retryAfterMs() + 999) / 1000);
        ctx.header("Retry-After", String.valueOf(retryAfterSeconds));
        ProblemDetail.respond(ctx, ProblemDetail.rateLimitExceeded(retryAfterSeconds, ctx.path()));
        ctx.skipRemainingHandlers();
    }
}
