package io.querybridge.proxy.search;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * One page of search results.
 *
 * @param data            matching rows
 * @param total           matches across all pages
 * @param executionTimeMs time spent in the database
 */
public record SearchResult(List<JsonNode> data, long total, long executionTimeMs) {

    public SearchResult {
        data = List.copyOf(data);
    }
}
