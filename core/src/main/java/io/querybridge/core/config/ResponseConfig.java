package io.querybridge.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How an API response becomes results.
 *
 * @param dataPath      dot path to the result array, or {@code null} for the body root
 * @param fieldMappings target field to source field (dot path) renames applied to each item
 * @param transform     JSLT expression applied to the whole body first, or {@code null}
 * @param schema        JSON Schema (2020-12) the transformed body must satisfy, or {@code null}
 * @param cache         response cache settings
 */
public record ResponseConfig(
        String dataPath, Map<String, String> fieldMappings, String transform, JsonNode schema, Cache cache) {

    public static final ResponseConfig DEFAULT = new ResponseConfig(null, Map.of(), null, null, Cache.DEFAULT);

    public ResponseConfig {
        fieldMappings = fieldMappings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldMappings));
        cache = cache == null ? Cache.DEFAULT : cache;
    }

    public static ResponseConfig atPath(String dataPath) {
        return new ResponseConfig(dataPath, Map.of(), null, null, Cache.DEFAULT);
    }

    /**
     * @param enabled cache successful, non-empty results
     * @param ttlMs   entry lifetime
     * @param maxSize entries kept; the oldest is evicted first
     */
    public record Cache(boolean enabled, long ttlMs, int maxSize) {

        public static final Cache DEFAULT = new Cache(false, 300_000, 100);

        public Cache {
            if (maxSize <= 0) {
                maxSize = 100;
            }
            if (ttlMs <= 0) {
                ttlMs = 300_000;
            }
        }
    }
}
