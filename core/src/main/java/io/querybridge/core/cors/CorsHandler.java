package io.querybridge.core.cors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.querybridge.core.error.CorsFallbackException;
import io.querybridge.core.error.RemoteRequestException;
import io.querybridge.core.http.ApiRequest;
import io.querybridge.core.http.ApiResponse;
import io.querybridge.core.http.HttpTransport;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses and executes the transport for a remote API call: direct when the
 * remote allows cross-origin requests, otherwise JSONP for reads, otherwise a
 * relay through the proxy endpoint.
 *
 * <p>
 * Preflight results are cached per target origin. When a direct call later
 * fails with a CORS error, {@link #handleCorsError} demotes the cached flag and
 * retries through a fallback. Thread-safe.
 */
public final class CorsHandler {

    private static final Logger LOG = LoggerFactory.getLogger(CorsHandler.class);

    private static final Pattern CORS_ERROR = Pattern.compile("cors|cross-origin|access-control", Pattern.CASE_INSENSITIVE);
    private static final Pattern CALLBACK_NAME = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");
    private static final Set<String> KNOWN_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");

    private final HttpTransport transport;
    private final ObjectMapper mapper;
    private final Map<String, Boolean> corsSupport = new ConcurrentHashMap<>();
    private final AtomicLong callbackCounter = new AtomicLong();

    public CorsHandler(HttpTransport transport, ObjectMapper mapper) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /** Decides how {@code request} should be sent under {@code config}. May run a preflight probe. */
    public CorsDecision determineRequestMethod(ApiRequest request, CorsConfig config) {
        if (!config.enabled()) {
            return new CorsDecision(RequestMode.DIRECT, request, "CORS handling disabled");
        }
        if (supportsCors(request, config)) {
            return new CorsDecision(RequestMode.DIRECT, request.withHeader("Origin", config.origin()), "preflight allowed");
        }
        return fallback(request, config);
    }

    /** Decides and executes in one step. */
    public ApiResponse execute(ApiRequest request, CorsConfig config) {
        return execute(determineRequestMethod(request, config), config);
    }

    /** Executes a previously made decision. */
    public ApiResponse execute(CorsDecision decision, CorsConfig config) {
        return switch (decision.mode()) {
            case DIRECT -> transport.send(decision.request());
            case JSONP -> executeJsonp(decision.request(), config);
            case PROXY -> executeViaProxy(decision.request(), config);
        };
    }

    /**
     * Recovers from a CORS failure of a direct call: marks the origin as not
     * CORS-capable and retries through JSONP or the proxy.
     *
     * @throws CorsFallbackException if no fallback is configured or the fallback fails too
     */
    public ApiResponse handleCorsError(ApiRequest request, CorsConfig config, RuntimeException error) {
        String origin = originOf(request.url());
        corsSupport.put(origin, Boolean.FALSE);
        LOG.warn("CORS error for {}, falling back: {}", origin, error.getMessage());
        try {
            CorsDecision decision = fallback(request, config);
            return execute(decision, config);
        } catch (RuntimeException fallbackError) {
            throw new CorsFallbackException(
                    "CORS error and fallback failed: " + fallbackError.getMessage(), fallbackError);
        }
    }

    /** Whether the message of {@code error} (or one of its causes) names a CORS failure. */
    public static boolean isCorsError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t.getMessage() != null && CORS_ERROR.matcher(t.getMessage()).find()) {
                return true;
            }
        }
        return false;
    }

    /** Returns a list of problems with {@code config}; empty when it is usable. */
    public static List<String> validateCorsConfig(CorsConfig config) {
        List<String> errors = new ArrayList<>();
        if (config.jsonpCallback() != null
                && (config.jsonpCallback().isBlank() || !CALLBACK_NAME.matcher(config.jsonpCallback()).matches())) {
            errors.add("JSONP callback name must be a valid identifier");
        }
        if (config.proxyUrl() != null) {
            try {
                URI uri = URI.create(config.proxyUrl());
                if (uri.getScheme() == null
                        || !(uri.getScheme().equals("http") || uri.getScheme().equals("https"))
                        || uri.getHost() == null) {
                    errors.add("Invalid proxy URL: " + config.proxyUrl());
                }
            } catch (IllegalArgumentException e) {
                errors.add("Invalid proxy URL: " + config.proxyUrl());
            }
        }
        for (String method : config.allowedMethods()) {
            if (!KNOWN_METHODS.contains(method)) {
                errors.add("Unknown HTTP method in allowedMethods: " + method);
            }
        }
        return errors;
    }

    /** Drops all cached preflight results. */
    public void clearCache() {
        corsSupport.clear();
    }

    /** Cached preflight result for the origin of {@code url}, or {@code null} if never probed. */
    public Boolean cachedSupport(String url) {
        return corsSupport.get(originOf(url));
    }

    private CorsDecision fallback(ApiRequest request, CorsConfig config) {
        if (config.hasJsonp() && "GET".equals(request.method())) {
            String callback = "jsonp_callback_" + System.currentTimeMillis() + "_" + callbackCounter.incrementAndGet();
            String separator = request.url().contains("?") ? "&" : "?";
            ApiRequest jsonp = request.withUrl(request.url() + separator + config.jsonpCallback() + "=" + callback);
            return new CorsDecision(RequestMode.JSONP, jsonp, "CORS not supported, using JSONP");
        }
        if (config.hasProxy()) {
            return new CorsDecision(RequestMode.PROXY, request, "CORS not supported, using proxy");
        }
        throw new CorsFallbackException("CORS not supported by " + originOf(request.url()) + " and no fallback configured");
    }

    private boolean supportsCors(ApiRequest request, CorsConfig config) {
        String origin = originOf(request.url());
        Boolean cached = corsSupport.get(origin);
        if (cached != null) {
            return cached;
        }
        // probe outside the map lock; concurrent probes of one origin are harmless
        boolean supported = probe(request, config);
        Boolean raced = corsSupport.putIfAbsent(origin, supported);
        return raced != null ? raced : supported;
    }

    private boolean probe(ApiRequest request, CorsConfig config) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Origin", config.origin());
        headers.put("Access-Control-Request-Method", request.method());
        if (!config.allowedHeaders().isEmpty()) {
            headers.put("Access-Control-Request-Headers", String.join(", ", config.allowedHeaders()));
        }
        try {
            ApiResponse response = transport.send(new ApiRequest("OPTIONS", request.url(), headers, null));
            String allowOrigin = response.header("access-control-allow-origin");
            boolean allowed = response.isSuccess()
                    && allowOrigin != null
                    && ("*".equals(allowOrigin.trim()) || allowOrigin.trim().equalsIgnoreCase(config.origin()));
            LOG.debug("Preflight {} -> status {}, allowed={}", request.url(), response.status(), allowed);
            return allowed;
        } catch (RemoteRequestException e) {
            LOG.debug("Preflight probe failed for {}, treating as unsupported: {}", request.url(), e.getMessage());
            return false;
        }
    }

    private ApiResponse executeJsonp(ApiRequest request, CorsConfig config) {
        String callback = queryParameter(request.url(), config.jsonpCallback());
        if (callback == null) {
            throw new CorsFallbackException("JSONP request has no " + config.jsonpCallback() + " parameter");
        }
        ApiResponse response = transport.send(request);
        Pattern wrapper = Pattern.compile("^\\s*" + Pattern.quote(callback) + "\\s*\\((.*)\\)\\s*;?\\s*$", Pattern.DOTALL);
        Matcher matcher = wrapper.matcher(response.body());
        if (!matcher.matches()) {
            throw new CorsFallbackException("JSONP response is not wrapped in callback " + callback);
        }
        Map<String, String> headers = new LinkedHashMap<>(response.headers());
        headers.put("content-type", "application/json");
        return new ApiResponse(response.status(), headers, matcher.group(1).trim());
    }

    private ApiResponse executeViaProxy(ApiRequest original, CorsConfig config) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("url", original.url());
        payload.put("method", original.method());
        ObjectNode headers = payload.putObject("headers");
        original.headers().forEach(headers::put);
        if (original.body() != null) {
            payload.put("body", original.body());
        }
        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CorsFallbackException("Failed to encode proxy request", e);
        }
        ApiResponse relayed = transport.send(new ApiRequest(
                "POST", config.proxyUrl(), Map.of("Content-Type", "application/json", "Accept", "application/json"), body));
        if (!relayed.isSuccess()) {
            throw new RemoteRequestException(
                    "Proxy request failed with status " + relayed.status(), "PROXY_ERROR", relayed.status(), null);
        }
        return unwrapProxyResponse(relayed);
    }

    // The relay answers {status, headers, body|data}; anything else is taken as the target's body.
    private ApiResponse unwrapProxyResponse(ApiResponse relayed) {
        JsonNode envelope;
        try {
            envelope = mapper.readTree(relayed.body());
        } catch (JsonProcessingException e) {
            return relayed;
        }
        if (envelope == null || !envelope.isObject() || !envelope.path("status").isInt()) {
            return relayed;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        envelope.path("headers").fields().forEachRemaining(f -> headers.put(f.getKey(), f.getValue().asText()));
        JsonNode payload = envelope.has("body") ? envelope.get("body") : envelope.path("data");
        String text = payload.isMissingNode() || payload.isNull()
                ? ""
                : payload.isTextual() ? payload.asText() : payload.toString();
        return new ApiResponse(envelope.get("status").asInt(), headers, text);
    }

    private static String originOf(String url) {
        try {
            URI uri = URI.create(url);
            int port = uri.getPort();
            return (uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT)) + "://"
                    + (uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT))
                    + (port > 0 ? ":" + port : "");
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    private static String queryParameter(String url, String name) {
        int q = url.indexOf('?');
        if (q < 0) {
            return null;
        }
        for (String pair : url.substring(q + 1).split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (URLDecoder.decode(key, StandardCharsets.UTF_8).equals(name)) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
