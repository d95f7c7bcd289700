package io.querybridge.core.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text plus positional bound values. The SQL never contains user data:
 * every value is a dialect placeholder bound to the parameter at the same
 * index.
 *
 * @param sql            statement text with placeholders
 * @param parameters     bound values in placeholder order; may contain {@code null}
 * @param parameterTypes inferred type tag per parameter
 * @param queryType      statement kind
 * @param estimatedRows  expected row count, or {@code null} if unknown
 */
public record ParameterizedQuery(
        String sql,
        List<Object> parameters,
        List<ParameterType> parameterTypes,
        QueryType queryType,
        Integer estimatedRows) {

    public ParameterizedQuery {
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(queryType, "queryType must not be null");
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        parameterTypes = List.copyOf(parameterTypes);
        if (parameters.size() != parameterTypes.size()) {
            throw new IllegalArgumentException("parameters and parameterTypes must have the same size");
        }
    }
}
