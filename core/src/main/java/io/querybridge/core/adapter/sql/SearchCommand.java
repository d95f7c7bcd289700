package io.querybridge.core.adapter.sql;

import io.querybridge.core.sql.PageRequest;
import io.querybridge.core.sql.ParameterizedQuery;
import io.querybridge.core.sql.SqlQueryConfig;

/**
 * A search in both compiled and structured form.
 *
 * @param query      generated, validated SQL
 * @param searchTerm normalized user text
 * @param config     query configuration the SQL was generated from
 * @param page       window applied, or {@code null} for none
 */
public record SearchCommand(ParameterizedQuery query, String searchTerm, SqlQueryConfig config, PageRequest page) {}
