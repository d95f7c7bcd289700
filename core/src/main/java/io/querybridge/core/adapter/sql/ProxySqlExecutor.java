package io.querybridge.core.adapter.sql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.querybridge.core.error.ConnectionFailedException;
import io.querybridge.core.error.QueryExecutionException;
import io.querybridge.core.error.RemoteRequestException;
import io.querybridge.core.http.ApiRequest;
import io.querybridge.core.http.ApiResponse;
import io.querybridge.core.http.HttpTransport;
import io.querybridge.core.sql.ParameterizedQuery;
import io.querybridge.core.sql.SqlQueryConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SqlExecutor} that delegates searches to a proxy-service
 * {@code /search} endpoint.
 *
 * <p>
 * Only the structured search request
 * {@code {searchTerm, tableName, searchFields, limit, offset, orderBy}} is
 * sent; SQL text never leaves the process, so raw {@link #query} and
 * {@link #update} are unavailable. The health probe calls {@code /health} next
 * to the search endpoint.
 */
public final class ProxySqlExecutor implements SqlExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ProxySqlExecutor.class);

    static final int DEFAULT_LIMIT = 20;

    private final HttpTransport transport;
    private final ObjectMapper mapper;
    private final String endpoint;

    public ProxySqlExecutor(HttpTransport transport, ObjectMapper mapper, String endpoint) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
    }

    @Override
    public void open() {
        LOG.debug("Using SQL proxy endpoint {}", endpoint);
    }

    @Override
    public SqlRows search(SearchCommand command) {
        String body;
        try {
            body = mapper.writeValueAsString(requestBody(command));
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException("Failed to encode proxy search request", "PROXY_ENCODE_FAILED", e);
        }
        ApiResponse response = transport.send(new ApiRequest(
                "POST", endpoint, Map.of("Content-Type", "application/json", "Accept", "application/json"), body));
        JsonNode reply = parse(response);
        if (!response.isSuccess() || !reply.path("success").asBoolean(false)) {
            String detail = reply.path("detail").asText(reply.path("error").asText("HTTP " + response.status()));
            throw new RemoteRequestException(
                    "Proxy search failed: " + detail, "PROXY_SEARCH_FAILED", response.status(), null);
        }
        List<ObjectNode> rows = new ArrayList<>();
        for (JsonNode row : reply.path("data")) {
            if (row.isObject()) {
                rows.add((ObjectNode) row);
            }
        }
        JsonNode total = reply.path("metadata").path("total");
        return new SqlRows(rows, total.isNumber() ? total.asLong() : null);
    }

    @Override
    public List<ObjectNode> query(ParameterizedQuery query) {
        throw unsupported();
    }

    @Override
    public int update(ParameterizedQuery query) {
        throw unsupported();
    }

    @Override
    public boolean supportsRawSql() {
        return false;
    }

    @Override
    public void ping() {
        String healthUrl = healthUrl(endpoint);
        ApiResponse response = transport.send(ApiRequest.get(healthUrl));
        if (!response.isSuccess()) {
            throw new ConnectionFailedException(
                    "SQL proxy health check failed with status " + response.status(),
                    "PROXY_UNAVAILABLE",
                    null,
                    Map.of("endpoint", healthUrl));
        }
    }

    @Override
    public void close() {
        // stateless
    }

    ObjectNode requestBody(SearchCommand command) {
        SqlQueryConfig config = command.config();
        ObjectNode payload = mapper.createObjectNode();
        payload.put("searchTerm", command.searchTerm());
        payload.put("tableName", config.tableName());
        ArrayNode fields = payload.putArray("searchFields");
        config.searchColumns().forEach(fields::add);
        payload.put("limit", command.page() != null ? command.page().limit() : DEFAULT_LIMIT);
        payload.put("offset", command.page() != null ? command.page().offset() : 0);
        if (!config.orderBy().isEmpty()) {
            SqlQueryConfig.Order order = config.orderBy().get(0);
            String direction = order.direction() == null ? "" : " " + order.direction().trim().toUpperCase(Locale.ROOT);
            payload.put("orderBy", order.column() + direction);
        }
        return payload;
    }

    static String healthUrl(String searchEndpoint) {
        String base = searchEndpoint.endsWith("/") ? searchEndpoint.substring(0, searchEndpoint.length() - 1) : searchEndpoint;
        if (base.endsWith("/search")) {
            base = base.substring(0, base.length() - "/search".length());
        }
        return base + "/health";
    }

    private JsonNode parse(ApiResponse response) {
        try {
            JsonNode node = mapper.readTree(response.body());
            return node == null ? mapper.createObjectNode() : node;
        } catch (JsonProcessingException e) {
            throw new RemoteRequestException(
                    "SQL proxy returned a non-JSON response", "PROXY_INVALID_RESPONSE", response.status(), e);
        }
    }

    private static QueryExecutionException unsupported() {
        return new QueryExecutionException(
                "Raw SQL statements are not sent through the SQL proxy", "PROXY_UNSUPPORTED_OPERATION", null);
    }
}
