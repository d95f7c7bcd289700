package io.querybridge.core.adapter.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.querybridge.core.config.ApiDataSourceConfig;
import io.querybridge.core.config.RequestTransform;
import io.querybridge.core.error.ConfigValidationException;
import io.querybridge.core.http.ApiRequest;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a query into the HTTP request for an API data source.
 *
 * <p>
 * GET and DELETE carry the query and the additional parameters in the query
 * string; POST and PUT carry them as a JSON body. A GraphQL template always
 * produces a POST body of the form {@code {query, variables, operationName}}.
 */
final class RequestTransformer {

    private final ObjectMapper mapper;

    RequestTransformer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    ApiRequest build(ApiDataSourceConfig config, String query) {
        RequestTransform transform = config.requestTransform();
        RequestTransform.QueryMapping mapping = transform.queryMapping();
        String field = mapping != null && mapping.field() != null && !mapping.field().isBlank()
                ? mapping.field()
                : config.queryParam();
        String text = apply(mapping == null ? RequestTransform.QueryTextTransform.NONE : mapping.transform(), query);

        Map<String, String> headers = new LinkedHashMap<>(config.headers());
        headers.putAll(transform.dynamicHeaders());

        if (transform.graphql() != null) {
            headers.putIfAbsent("Content-Type", "application/json");
            return new ApiRequest("POST", config.url(), headers, graphqlBody(transform.graphql(), text));
        }

        String method = config.method();
        if ("POST".equals(method) || "PUT".equals(method)) {
            ObjectNode body = mapper.createObjectNode();
            body.put(field, text);
            transform.additionalParams().forEach((k, v) -> body.set(k, mapper.valueToTree(v)));
            headers.putIfAbsent("Content-Type", "application/json");
            return new ApiRequest(method, config.url(), headers, write(body));
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put(field, text);
        transform.additionalParams().forEach((k, v) -> params.put(k, v == null ? "" : String.valueOf(v)));
        return new ApiRequest(method, withQueryString(config.url(), params), headers, null);
    }

    static String apply(RequestTransform.QueryTextTransform transform, String query) {
        return switch (transform) {
            case LOWERCASE -> query.toLowerCase(Locale.ROOT);
            case UPPERCASE -> query.toUpperCase(Locale.ROOT);
            case TRIM -> query.trim();
            case ENCODE -> URLEncoder.encode(query, StandardCharsets.UTF_8).replace("+", "%20");
            case NONE -> query;
        };
    }

    static String withQueryString(String url, Map<String, String> params) {
        StringBuilder sb = new StringBuilder(url);
        char separator = url.contains("?") ? '&' : '?';
        for (Map.Entry<String, String> param : params.entrySet()) {
            sb.append(separator)
                    .append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }
        return sb.toString();
    }

    private String graphqlBody(RequestTransform.GraphQl graphql, String query) {
        ObjectNode body = mapper.createObjectNode();
        body.put("query", graphql.query());
        ObjectNode variables = mapper.valueToTree(graphql.variables());
        variables.put("query", query);
        body.set("variables", variables);
        if (graphql.operationName() != null) {
            body.put("operationName", graphql.operationName());
        }
        return write(body);
    }

    private String write(ObjectNode body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ConfigValidationException("Request body is not serializable: " + e.getOriginalMessage(),
                    "requestTransform.additionalParams");
        }
    }
}
