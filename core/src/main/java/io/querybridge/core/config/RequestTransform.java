package io.querybridge.core.config;

import io.querybridge.core.error.ConfigValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * How a query is turned into an API request.
 *
 * @param queryMapping     field carrying the query and the text transform applied to it
 * @param additionalParams fixed parameters added to every request
 * @param dynamicHeaders   extra headers added to every request
 * @param graphql          GraphQL body template, or {@code null} for plain requests
 */
public record RequestTransform(
        QueryMapping queryMapping, Map<String, Object> additionalParams, Map<String, String> dynamicHeaders, GraphQl graphql) {

    public static final RequestTransform NONE = new RequestTransform(null, Map.of(), Map.of(), null);

    public RequestTransform {
        additionalParams = additionalParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(additionalParams));
        dynamicHeaders = dynamicHeaders == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dynamicHeaders));
    }

    /** Text transform applied to the query before it is sent. */
    public enum QueryTextTransform {
        NONE,
        LOWERCASE,
        UPPERCASE,
        TRIM,
        ENCODE;

        public static QueryTextTransform fromId(String id) {
            if (id == null || id.isBlank()) {
                return NONE;
            }
            try {
                return valueOf(id.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException(
                        "Unknown query transform: " + id, "requestTransform.queryMapping.transform");
            }
        }
    }

    /** @param field request field (or query parameter) that receives the query text */
    public record QueryMapping(String field, QueryTextTransform transform) {
        public QueryMapping {
            transform = transform == null ? QueryTextTransform.NONE : transform;
        }
    }

    /**
     * GraphQL request body {@code {query, variables, operationName}}. The
     * user's query is added to the variables as {@code query}.
     */
    public record GraphQl(String query, Map<String, Object> variables, String operationName) {
        public GraphQl {
            variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        }
    }
}
