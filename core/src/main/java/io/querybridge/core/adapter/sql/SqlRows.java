package io.querybridge.core.adapter.sql;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Rows returned by a search.
 *
 * @param rows       result rows in database order
 * @param totalCount total matches ignoring the page window, or {@code null} if not reported
 */
public record SqlRows(List<ObjectNode> rows, Long totalCount) {

    public SqlRows {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static SqlRows of(List<ObjectNode> rows) {
        return new SqlRows(rows, null);
    }
}
