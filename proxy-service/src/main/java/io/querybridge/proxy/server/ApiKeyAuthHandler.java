package io.querybridge.proxy.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.querybridge.proxy.config.ServiceConfig;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Before-handler that rejects unauthenticated calls with {@code 401}.
 *
 * <p>
 * A request is authenticated by an {@code X-API-Key} header naming a configured
 * key, or by an {@code Authorization: Bearer} token longer than ten characters.
 * Probe paths are always open.
 */
public final class ApiKeyAuthHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ApiKeyAuthHandler.class);

    static final String API_KEY_HEADER = "X-API-Key";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final int MIN_TOKEN_LENGTH = 11;

    private final ServiceConfig.Auth auth;
    private final Set<String> openPaths;

    public ApiKeyAuthHandler(ServiceConfig.Auth auth, Set<String> openPaths) {
        this.auth = auth;
        this.openPaths = Set.copyOf(openPaths);
    }

    @Override
    public void handle(Context ctx) {
        if (!auth.enabled() || openPaths.contains(ctx.path())) {
            return;
        }
        if (isAuthenticated(ctx.header(API_KEY_HEADER), ctx.header("Authorization"))) {
            return;
        }
        LOG.warn("Rejected unauthenticated {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        ProblemDetail.respond(ctx, ProblemDetail.unauthorized("Missing or invalid API key", ctx.path()));
        ctx.skipRemainingHandlers();
    }

    boolean isAuthenticated(String apiKey, String authorization) {
        if (apiKey != null && auth.apiKeys().contains(apiKey)) {
            return true;
        }
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim().length() >= MIN_TOKEN_LENGTH;
        }
        return false;
    }
}
