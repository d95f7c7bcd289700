package io.querybridge.proxy.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import java.util.List;

/**
 * Builds RFC 9457 Problem Details bodies for every error the search proxy
 * returns.
 *
 * <pre>{@code
 * {
 *   "type": "urn:querybridge:proxy:validation-error",
 *   "title": "Validation Error",
 *   "status": 400,
 *   "detail": "Validation failed: searchTerm is required",
 *   "instance": "/search"
 * }
 * }</pre>
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String CONTENT_TYPE = "application/problem+json";

    static final String URN_VALIDATION_ERROR = "urn:querybridge:proxy:validation-error";
    static final String URN_UNAUTHORIZED = "urn:querybridge:proxy:unauthorized";
    static final String URN_FORBIDDEN = "urn:querybridge:proxy:relay-forbidden";
    static final String URN_NOT_FOUND = "urn:querybridge:proxy:not-found";
    static final String URN_RATE_LIMIT_EXCEEDED = "urn:querybridge:proxy:rate-limit-exceeded";
    static final String URN_SEARCH_ERROR = "urn:querybridge:proxy:search-error";
    static final String URN_BAD_GATEWAY = "urn:querybridge:proxy:bad-gateway";
    static final String URN_GATEWAY_TIMEOUT = "urn:querybridge:proxy:gateway-timeout";

    private ProblemDetail() {
        // utility class
    }

    /** Malformed request body; {@code errors} lists every violation found. */
    public static JsonNode validationError(String detail, List<String> errors, String instancePath) {
        ObjectNode node = build(URN_VALIDATION_ERROR, "Validation Error", 400, detail, instancePath);
        ArrayNode list = node.putArray("errors");
        errors.forEach(list::add);
        return node;
    }

    public static JsonNode unauthorized(String detail, String instancePath) {
        return build(URN_UNAUTHORIZED, "Unauthorized", 401, detail, instancePath);
    }

    public static JsonNode forbidden(String detail, String instancePath) {
        return build(URN_FORBIDDEN, "Forbidden", 403, detail, instancePath);
    }

    public static JsonNode notFound(String detail, String instancePath) {
        return build(URN_NOT_FOUND, "Not Found", 404, detail, instancePath);
    }

    /**
     * Caller exceeded the per-client request budget.
     *
     * @param retryAfterSeconds seconds until a request will be admitted again
     */
    public static JsonNode rateLimitExceeded(long retryAfterSeconds, String instancePath) {
        ObjectNode node = build(
                URN_RATE_LIMIT_EXCEEDED,
                "Too Many Requests",
                429,
                "Rate limit exceeded. Try again in " + retryAfterSeconds + " seconds",
                instancePath);
        node.put("retryAfter", retryAfterSeconds);
        return node;
    }

    /** Search failed inside the service; {@code code} is the classified error code. */
    public static JsonNode searchError(String detail, String code, String instancePath) {
        ObjectNode node = build(URN_SEARCH_ERROR, "Search Error", 500, detail, instancePath);
        node.put("code", code);
        return node;
    }

    public static JsonNode badGateway(String detail, String instancePath) {
        return build(URN_BAD_GATEWAY, "Bad Gateway", 502, detail, instancePath);
    }

    public static JsonNode gatewayTimeout(String detail, String instancePath) {
        return build(URN_GATEWAY_TIMEOUT, "Gateway Timeout", 504, detail, instancePath);
    }

    /** Writes {@code problem} to the response with its status and the problem content type. */
    static void respond(Context ctx, JsonNode problem) {
        ctx.status(problem.path("status").asInt(500));
        ctx.contentType(CONTENT_TYPE);
        ctx.result(problem.toString());
    }

    static ObjectNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
