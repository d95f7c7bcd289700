package io.querybridge.proxy.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.querybridge.core.error.RemoteRequestException;
import io.querybridge.core.http.ApiRequest;
import io.querybridge.core.http.ApiResponse;
import io.querybridge.core.http.HttpTransport;
import io.querybridge.proxy.config.ServiceConfig;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /proxy}: relays {@code {"url", "method", "headers", "body"}} to
 * an allow-listed host for browser clients blocked by CORS, and replies
 * {@code {"status", "headers", "body"}}.
 *
 * <p>
 * Hosts outside {@code relay.allowed-hosts} get {@code 403}; connect failures
 * {@code 502}; timeouts {@code 504}.
 */
public final class RelayHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(RelayHandler.class);

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD");

    private final HttpTransport transport;
    private final Set<String> allowedHosts;
    private final Duration timeout;
    private final ObjectMapper mapper;

    public RelayHandler(HttpTransport transport, ServiceConfig.Relay relay, ObjectMapper mapper) {
        this.transport = transport;
        this.allowedHosts = relay.allowedHosts().stream()
                .map(host -> host.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.timeout = Duration.ofMillis(relay.timeoutMs());
        this.mapper = mapper;
    }

    @Override
    public void handle(Context ctx) {
        JsonNode body;
        try {
            body = mapper.readTree(ctx.body());
        } catch (JsonProcessingException e) {
            reject(ctx, "Request body is not valid JSON");
            return;
        }
        if (body == null || !body.isObject()) {
            reject(ctx, "Request body must be a JSON object");
            return;
        }
        String url = body.path("url").asText("");
        String method = body.path("method").asText("GET").toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            reject(ctx, "Unsupported method: " + method);
            return;
        }
        String host = hostOf(url);
        if (host == null) {
            reject(ctx, "url must be an absolute http(s) URL");
            return;
        }
        if (!allowedHosts.contains(host)) {
            LOG.warn("Relay to disallowed host '{}' rejected", host);
            ProblemDetail.respond(ctx, ProblemDetail.forbidden("Host is not allowed: " + host, ctx.path()));
            return;
        }

        Map<String, String> headers = new LinkedHashMap<>();
        body.path("headers").fields().forEachRemaining(e -> headers.put(e.getKey(), e.getValue().asText()));
        JsonNode payload = body.get("body");
        String forwarded = payload == null || payload.isNull() ? null : payload.isTextual() ? payload.asText() : payload.toString();

        ApiResponse response;
        try {
            response = transport.send(new ApiRequest(method, url, headers, forwarded), timeout);
        } catch (RemoteRequestException e) {
            LOG.warn("Relay {} {} failed: {}", method, url, e.getMessage());
            ProblemDetail.respond(
                    ctx,
                    "REQUEST_TIMEOUT".equals(e.code())
                            ? ProblemDetail.gatewayTimeout(e.getMessage(), ctx.path())
                            : ProblemDetail.badGateway(e.getMessage(), ctx.path()));
            return;
        }

        ObjectNode reply = mapper.createObjectNode();
        reply.put("status", response.status());
        ObjectNode replyHeaders = reply.putObject("headers");
        response.headers().forEach(replyHeaders::put);
        reply.put("body", response.body());
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(reply.toString());
    }

    private static void reject(Context ctx, String error) {
        ProblemDetail.respond(ctx, ProblemDetail.validationError("Validation failed: " + error, List.of(error), ctx.path()));
    }

    static String hostOf(String url) {
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                return null;
            }
            return uri.getHost().toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
