package io.querybridge.proxy.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.querybridge.core.adapter.sql.SqlAdapter;
import io.querybridge.core.error.ErrorMapper;
import io.querybridge.core.http.HttpTransport;
import io.querybridge.core.ratelimit.SlidingWindowConfig;
import io.querybridge.core.ratelimit.SlidingWindowRateLimiter;
import io.querybridge.proxy.config.ServiceConfig;
import io.querybridge.proxy.config.ServiceConfigLoader;
import io.querybridge.proxy.search.SearchService;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the search proxy.
 *
 * <ol>
 * <li>Load configuration from YAML plus environment overlay</li>
 * <li>Configure logging</li>
 * <li>Create the SQL adapter, its connection pool and the search service</li>
 * <li>Start Javalin with auth and rate-limit before-handlers and the routes below</li>
 * </ol>
 *
 * <p>
 * Routes: {@code GET /health}, {@code GET /ready}, {@code GET /metrics},
 * {@code POST /search} and, when relaying is enabled, {@code POST /proxy}.
 */
public final class SearchProxyApp {

    private static final Logger LOG = LoggerFactory.getLogger(SearchProxyApp.class);

    static final String HEALTH_PATH = "/health";
    static final String READY_PATH = "/ready";
    static final String METRICS_PATH = "/metrics";
    static final String SEARCH_PATH = "/search";
    static final String RELAY_PATH = "/proxy";

    private static final long RATE_WINDOW_MS = 60_000;

    private final Javalin app;
    private final SearchService service;
    private final SlidingWindowRateLimiter limiter;
    private final ServiceConfig config;

    private SearchProxyApp(Javalin app, SearchService service, SlidingWindowRateLimiter limiter, ServiceConfig config) {
        this.app = app;
        this.service = service;
        this.limiter = limiter;
        this.config = config;
    }

    /**
     * Loads the configuration named by {@code --config} (or the default file)
     * and starts the proxy.
     *
     * @throws Exception if loading or startup fails
     */
    public static SearchProxyApp start(String[] args) throws Exception {
        Path configPath = ServiceConfigLoader.resolveConfigPath(args);
        ServiceConfig config = ServiceConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config);
    }

    /** Starts the proxy with an already loaded configuration; port {@code 0} picks a free port. */
    public static SearchProxyApp start(ServiceConfig config) {
        long startTime = System.nanoTime();
        ObjectMapper mapper = new ObjectMapper();

        SearchService service = new SearchService(new SqlAdapter(), config);
        SlidingWindowRateLimiter limiter =
                new SlidingWindowRateLimiter(SlidingWindowConfig.of(RATE_WINDOW_MS, config.rateLimitPerMinute()));
        Set<String> openPaths = Set.of(HEALTH_PATH, READY_PATH);

        Javalin app = Javalin.create();
        app.before(new ApiKeyAuthHandler(config.auth(), openPaths));
        app.before(new RateLimitHandler(limiter, openPaths));

        app.get(HEALTH_PATH, new HealthHandler());
        app.get(READY_PATH, new ReadinessHandler(service::isHealthy));
        app.get(METRICS_PATH, new MetricsHandler(service, limiter, mapper));
        app.post(SEARCH_PATH, new SearchHandler(service, new ErrorMapper(), mapper, Clock.systemUTC()));
        if (config.relay().enabled()) {
            HttpTransport transport = new HttpTransport(
                    Duration.ofMillis(config.relay().timeoutMs()), Duration.ofMillis(config.relay().timeoutMs()));
            app.post(RELAY_PATH, new RelayHandler(transport, config.relay(), mapper));
        }

        app.error(404, ctx -> ProblemDetail.respond(
                ctx, ProblemDetail.notFound("No route for " + ctx.method() + " " + ctx.path(), ctx.path())));
        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error on {} {}: {}", ctx.method(), ctx.path(), e.getMessage(), e);
            ProblemDetail.respond(ctx, ProblemDetail.searchError("Internal server error", "INTERNAL_ERROR", ctx.path()));
        });

        try {
            app.start(config.host(), config.port());
        } catch (RuntimeException e) {
            limiter.destroy();
            service.close();
            throw e;
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "querybridge-proxy started: port={}, database={}, tables={}, auth={}, rateLimitPerMinute={}, relay={}, startupMs={}",
                app.port(),
                config.database().type().id(),
                config.tables().keySet(),
                config.auth().enabled(),
                config.rateLimitPerMinute(),
                config.relay().enabled(),
                elapsedMs);
        return new SearchProxyApp(app, service, limiter, config);
    }

    public int port() {
        return app.port();
    }

    public ServiceConfig config() {
        return config;
    }

    /** Stops the HTTP server, then releases the rate limiter and the database pool. */
    public void stop() {
        app.stop();
        limiter.destroy();
        service.close();
        LOG.info("querybridge-proxy stopped");
    }
}
