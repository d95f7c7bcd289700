package io.querybridge.core.sql;

/** Kind of statement a {@link ParameterizedQuery} represents. */
public enum QueryType {
    SELECT,
    COUNT,
    CURSOR,
    INSERT,
    UPDATE,
    DELETE
}
