package io.querybridge.core.adapter.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.querybridge.core.adapter.AbstractDataSourceAdapter;
import io.querybridge.core.adapter.JsonPaths;
import io.querybridge.core.config.ApiAuth;
import io.querybridge.core.config.ApiDataSourceConfig;
import io.querybridge.core.config.DataSourceType;
import io.querybridge.core.cors.CorsDecision;
import io.querybridge.core.cors.CorsHandler;
import io.querybridge.core.error.ConfigValidationException;
import io.querybridge.core.error.DataSourceException;
import io.querybridge.core.error.DataSourceFailureException;
import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.error.RemoteRequestException;
import io.querybridge.core.http.ApiRequest;
import io.querybridge.core.http.ApiResponse;
import io.querybridge.core.http.HttpTransport;
import io.querybridge.core.model.AdapterCapabilities;
import io.querybridge.core.model.Connection;
import io.querybridge.core.model.ConnectionStatus;
import io.querybridge.core.model.ProcessedQuery;
import io.querybridge.core.model.RawResult;
import io.querybridge.core.ratelimit.RateLimiterRegistry;
import io.querybridge.core.ratelimit.TokenBucketRateLimiter;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches a remote HTTP API.
 *
 * <p>
 * A query goes through the response cache, the per-endpoint token bucket, the
 * request transform and credentials, then CORS routing (direct, JSONP or proxy)
 * with automatic fallback on CORS failures. The reply is transformed (JSLT),
 * checked against the configured schema and mapped into results.
 */
public final class ApiAdapter extends AbstractDataSourceAdapter<ApiDataSourceConfig> {

    private static final Logger LOG = LoggerFactory.getLogger(ApiAdapter.class);

    static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE");
    private static final List<String> ID_FIELDS = List.of("id", "_id", "uuid", "key");
    private static final List<String> ERROR_MESSAGE_FIELDS = List.of("error", "message", "errorMessage", "error_description");

    private static final AdapterCapabilities CAPABILITIES = new AdapterCapabilities(
            false, false, true, false, true, true, 10, List.of("text", "partial", "exact", "graphql"));

    private final HttpTransport transport;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final CorsHandler cors;
    private final RateLimiterRegistry limiters;
    private final AuthHeaderProvider auth;
    private final RequestTransformer requests;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, ResponseCache> caches = new ConcurrentHashMap<>();

    public ApiAdapter() {
        this(HttpTransport.defaults(), new ObjectMapper(), Clock.systemUTC());
    }

    public ApiAdapter(HttpTransport transport, ObjectMapper mapper, Clock clock) {
        this(transport, mapper, clock, new CorsHandler(transport, mapper), new RateLimiterRegistry());
    }

    public ApiAdapter(
            HttpTransport transport, ObjectMapper mapper, Clock clock, CorsHandler cors, RateLimiterRegistry limiters) {
        super(DataSourceType.API, ApiDataSourceConfig.class);
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.cors = Objects.requireNonNull(cors, "cors must not be null");
        this.limiters = Objects.requireNonNull(limiters, "limiters must not be null");
        this.auth = new AuthHeaderProvider(transport, mapper, clock);
        this.requests = new RequestTransformer(mapper);
    }

    @Override
    protected void validate(ApiDataSourceConfig config) {
        if (config.url() == null || config.url().isBlank()) {
            throw new ConfigValidationException("API URL is required and must be a string", "url");
        }
        try {
            URI uri = URI.create(config.url());
            if (uri.getScheme() == null
                    || !(uri.getScheme().equals("http") || uri.getScheme().equals("https"))
                    || uri.getHost() == null) {
                throw new ConfigValidationException("Invalid API URL format", "url");
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException("Invalid API URL format", "url");
        }
        if (!METHODS.contains(config.method())) {
            throw new ConfigValidationException("Invalid HTTP method: " + config.method(), "method");
        }
        validateAuth(config.auth());
        if (config.cors().enabled()) {
            List<String> problems = CorsHandler.validateCorsConfig(config.cors());
            if (!problems.isEmpty()) {
                throw new ConfigValidationException(String.join("; ", problems), "cors");
            }
        }
        new ResponseMapper(config.response());
    }

    @Override
    protected Connection open(ApiDataSourceConfig config) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("endpoint", config.url());
        metadata.put("method", config.method());
        metadata.put("authType", authType(config.auth()));
        Connection connection = newConnection(metadata);
        if (config.auth() instanceof ApiAuth.OAuth2) {
            try {
                auth.apply(ApiRequest.get(config.url()), config.auth());
            } catch (RuntimeException e) {
                discard(connection);
                throw createError("Authentication failed: " + e.getMessage(), ErrorCategory.SECURITY, "AUTH_FAILED", e);
            }
        }
        TokenBucketRateLimiter limiter =
                config.rateLimit() == null ? null : limiters.limiterFor(config.url(), config.rateLimit());
        sessions.put(connection.id(), new Session(config, new ResponseMapper(config.response()), limiter));
        connection.updateStatus(ConnectionStatus.CONNECTED);
        LOG.debug("Connected {} to {} {}", connection.id(), config.method(), config.url());
        return connection;
    }

    @Override
    public List<RawResult> query(Connection connection, ProcessedQuery query) {
        requireActive(connection);
        Session session = sessions.get(connection.id());
        ApiDataSourceConfig config = session.config();
        return executeWithMetrics(connection, () -> {
            String cacheKey = ResponseCache.key(config.url(), query.normalized(), config.headers());
            ResponseCache cache = cacheFor(config);
            if (cache != null) {
                Optional<List<RawResult>> cached = cache.get(cacheKey);
                if (cached.isPresent()) {
                    LOG.debug("Cache hit for {}", config.url());
                    return cached.get();
                }
            }
            if (session.limiter() != null) {
                session.limiter().waitForPermission();
            }

            ApiRequest request = prepare(config, query);
            ApiResponse response = send(request, config, query);
            if (session.limiter() != null) {
                session.limiter().updateFromHeaders(response.headers());
                if (response.status() == 429) {
                    session.limiter().reportViolation(resetHint(response));
                }
            }

            JsonNode body = parse(response);
            if (response.status() >= 400 || (body.isObject() && body.has("error"))) {
                String message = errorMessage(body, response.status());
                throw createError(
                        "API error: " + message,
                        categoryFor(response.status()),
                        "API_ERROR",
                        new RemoteRequestException(message, "API_ERROR", response.status(), null));
            }

            List<RawResult> results = toResults(session.mapper(), body, connection);
            if (cache != null) {
                cache.put(cacheKey, results);
            }
            return results;
        });
    }

    @Override
    public boolean healthCheck(Connection connection) {
        if (!super.healthCheck(connection)) {
            return false;
        }
        Session session = sessions.get(connection.id());
        if (session == null) {
            return false;
        }
        try {
            ApiRequest probe = auth.apply(
                    new ApiRequest("HEAD", session.config().url(), session.config().headers(), null),
                    session.config().auth());
            return transport.send(probe).status() < 500;
        } catch (RuntimeException e) {
            LOG.debug("Health check failed for {}: {}", connection.id(), e.getMessage());
            return false;
        }
    }

    @Override
    protected void close(Connection connection) {
        Session session = sessions.remove(connection.id());
        if (session == null) {
            return;
        }
        if (session.config().auth() instanceof ApiAuth.OAuth2) {
            auth.clear();
        }
        boolean endpointInUse = sessions.values().stream()
                .anyMatch(s -> s.config().url().equals(session.config().url()));
        if (session.limiter() != null && !endpointInUse) {
            limiters.remove(session.config().url());
        }
    }

    @Override
    public AdapterCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    /** Empties every response cache and every cached preflight result. */
    public void clearCache() {
        caches.values().forEach(ResponseCache::clear);
        cors.clearCache();
    }

    int cacheSize(String url) {
        ResponseCache cache = caches.get(url);
        return cache == null ? 0 : cache.size();
    }

    // --- internals ---

    private ApiRequest prepare(ApiDataSourceConfig config, ProcessedQuery query) {
        ApiRequest request = requests.build(config, query.normalized());
        try {
            return auth.apply(request, config.auth());
        } catch (RuntimeException e) {
            throw createError("Authentication failed: " + e.getMessage(), ErrorCategory.SECURITY, "AUTH_FAILED", e);
        }
    }

    private ApiResponse send(ApiRequest request, ApiDataSourceConfig config, ProcessedQuery query) {
        try {
            CorsDecision decision = cors.determineRequestMethod(request, config.cors());
            LOG.debug("Sending {} {} via {}", request.method(), config.url(), decision.mode());
            return cors.execute(decision, config.cors());
        } catch (RuntimeException e) {
            if (config.cors().enabled() && config.cors().autoFallback() && CorsHandler.isCorsError(e)) {
                try {
                    return cors.handleCorsError(request, config.cors(), e);
                } catch (RuntimeException fallbackError) {
                    throw requestFailed(fallbackError, query);
                }
            }
            throw requestFailed(e, query);
        }
    }

    private DataSourceFailureException requestFailed(RuntimeException e, ProcessedQuery query) {
        if (e instanceof DataSourceFailureException failure) {
            return failure;
        }
        ErrorCategory category = e instanceof DataSourceException dse && dse.category() == ErrorCategory.TIMEOUT
                ? ErrorCategory.TIMEOUT
                : ErrorCategory.NETWORK;
        LOG.warn("API request failed for query '{}': {}", query.original(), e.getMessage());
        return createError("API request failed: " + e.getMessage(), category, "REQUEST_FAILED", e);
    }

    private JsonNode parse(ApiResponse response) {
        if (response.body().isBlank()) {
            return mapper.nullNode();
        }
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            if (response.status() >= 400) {
                return mapper.getNodeFactory().textNode(response.body());
            }
            throw createError("API response is not valid JSON", ErrorCategory.DATA, "INVALID_RESPONSE", e);
        }
    }

    private List<RawResult> toResults(ResponseMapper responseMapper, JsonNode body, Connection connection) {
        JsonNode transformed;
        try {
            transformed = responseMapper.transform(body);
        } catch (ResponseMapper.ResponseMappingException e) {
            throw e.schemaViolation()
                    ? createError(e.getMessage(), ErrorCategory.VALIDATION, "RESPONSE_SCHEMA_VIOLATION", e)
                    : createError(e.getMessage(), ErrorCategory.TRANSFORMATION, "RESPONSE_TRANSFORM_FAILED", e);
        }
        List<JsonNode> items = responseMapper.items(transformed);
        List<RawResult> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = responseMapper.mapFields(items.get(i));
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("source", "api");
            metadata.put("connectionId", connection.id());
            metadata.put("originalIndex", i);
            results.add(new RawResult(resultId(item, i), item, 1.0, List.of(), metadata));
        }
        return results;
    }

    private ResponseCache cacheFor(ApiDataSourceConfig config) {
        if (!config.response().cache().enabled()) {
            return null;
        }
        return caches.computeIfAbsent(config.url(), url -> new ResponseCache(config.response().cache(), clock));
    }

    static String resultId(JsonNode item, int index) {
        for (String field : ID_FIELDS) {
            JsonNode id = item.get(field);
            if (!JsonPaths.isAbsent(id) && !id.isContainerNode() && !id.asText().isEmpty()) {
                return id.asText();
            }
        }
        return "api-result-" + index;
    }

    static String errorMessage(JsonNode body, int status) {
        if (body.isTextual() && !body.asText().isBlank()) {
            return body.asText();
        }
        if (body.isObject()) {
            for (String field : ERROR_MESSAGE_FIELDS) {
                JsonNode value = body.get(field);
                if (value == null || value.isNull()) {
                    continue;
                }
                if (value.isTextual() && !value.asText().isBlank()) {
                    return value.asText();
                }
                if (value.isObject() && value.hasNonNull("message")) {
                    return value.get("message").asText();
                }
            }
        }
        return "HTTP " + status;
    }

    private static ErrorCategory categoryFor(int status) {
        if (status == 401) {
            return ErrorCategory.AUTHENTICATION;
        }
        if (status == 403) {
            return ErrorCategory.AUTHORIZATION;
        }
        if (status == 408 || status == 504) {
            return ErrorCategory.TIMEOUT;
        }
        return ErrorCategory.NETWORK;
    }

    private static Long resetHint(ApiResponse response) {
        String hint = response.header("x-ratelimit-reset");
        if (hint == null) {
            hint = response.header("retry-after");
        }
        if (hint == null) {
            return null;
        }
        try {
            return Long.parseLong(hint.trim());
        } catch (NumberFormatException e) {
            LOG.debug("Ignoring malformed rate-limit reset header: {}", hint);
            return null;
        }
    }

    private static void validateAuth(ApiAuth auth) {
        if (auth instanceof ApiAuth.ApiKey key && blank(key.key())) {
            throw new ConfigValidationException("API key is required for apikey authentication", "auth.apiKey.key");
        }
        if (auth instanceof ApiAuth.Bearer bearer && blank(bearer.token())) {
            throw new ConfigValidationException("Token is required for bearer authentication", "auth.bearer.token");
        }
        if (auth instanceof ApiAuth.Basic basic && (blank(basic.username()) || basic.password() == null)) {
            throw new ConfigValidationException(
                    "Username and password are required for basic authentication", "auth.basic");
        }
        if (auth instanceof ApiAuth.OAuth2 oauth && (blank(oauth.clientId()) || blank(oauth.tokenUrl()))) {
            throw new ConfigValidationException(
                    "clientId and tokenUrl are required for oauth2 authentication", "auth.oauth2");
        }
    }

    private static String authType(ApiAuth auth) {
        if (auth instanceof ApiAuth.ApiKey) {
            return "apikey";
        }
        if (auth instanceof ApiAuth.Bearer) {
            return "bearer";
        }
        if (auth instanceof ApiAuth.Basic) {
            return "basic";
        }
        if (auth instanceof ApiAuth.OAuth2) {
            return "oauth2";
        }
        return "none";
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }

    private record Session(ApiDataSourceConfig config, ResponseMapper mapper, TokenBucketRateLimiter limiter) {}
}
