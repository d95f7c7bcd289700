package io.querybridge.core.sql;

/**
 * Optional SQL features available in a dialect/version combination.
 *
 * @param limitOffset     {@code LIMIT n OFFSET m}
 * @param windowFunctions {@code OVER (...)}
 * @param cte             {@code WITH ...}
 * @param json            JSON column functions
 * @param fullText        native full-text search predicates
 */
public record DialectFeatures(
        boolean limitOffset, boolean windowFunctions, boolean cte, boolean json, boolean fullText) {}
