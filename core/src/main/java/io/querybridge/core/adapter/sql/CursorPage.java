package io.querybridge.core.adapter.sql;

import com.fasterxml.jackson.databind.JsonNode;
import io.querybridge.core.model.RawResult;
import java.util.List;

/**
 * One keyset page.
 *
 * @param results    rows ordered by the cursor column
 * @param nextCursor cursor column value of the last row, or {@code null} when the page is empty
 * @param hasMore    whether the page was full, so another may follow
 */
public record CursorPage(List<RawResult> results, JsonNode nextCursor, boolean hasMore) {

    public CursorPage {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
