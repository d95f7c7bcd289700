package io.querybridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One scored search hit. Result lists are ordered by descending score; equal
 * scores keep their input order.
 *
 * @param id            stable identifier within one result set
 * @param data          the matched item
 * @param score         relevance score, higher is better
 * @param matchedFields fields that contributed to the score
 * @param metadata      source-specific metadata (source, connection id, ...)
 */
public record RawResult(
        String id, JsonNode data, double score, List<String> matchedFields, Map<String, Object> metadata) {

    /** Descending-score order. Use with a stable sort to keep ties in input order. */
    public static final Comparator<RawResult> BY_SCORE_DESC =
            Comparator.comparingDouble(RawResult::score).reversed();

    public RawResult {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(data, "data must not be null");
        matchedFields = matchedFields == null ? List.of() : List.copyOf(matchedFields);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
