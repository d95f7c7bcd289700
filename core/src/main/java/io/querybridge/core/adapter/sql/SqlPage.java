package io.querybridge.core.adapter.sql;

import io.querybridge.core.model.RawResult;
import java.util.List;

/**
 * One offset page of search results.
 *
 * @param results    rows of this page
 * @param totalCount matches across all pages
 * @param page       one-based page number
 * @param pageSize   requested page size
 */
public record SqlPage(List<RawResult> results, long totalCount, int page, int pageSize) {

    public SqlPage {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public int totalPages() {
        return pageSize <= 0 ? 0 : (int) ((totalCount + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return (long) page * pageSize < totalCount;
    }

    public boolean hasPrevious() {
        return page > 1;
    }
}
