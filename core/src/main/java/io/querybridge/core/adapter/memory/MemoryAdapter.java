package io.querybridge.core.adapter.memory;

import com.fasterxml.jackson.databind.JsonNode;
import io.querybridge.core.adapter.AbstractDataSourceAdapter;
import io.querybridge.core.adapter.JsonPaths;
import io.querybridge.core.config.DataSourceType;
import io.querybridge.core.config.MemoryDataSourceConfig;
import io.querybridge.core.error.ConfigValidationException;
import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.model.AdapterCapabilities;
import io.querybridge.core.model.Connection;
import io.querybridge.core.model.ConnectionStatus;
import io.querybridge.core.model.ProcessedQuery;
import io.querybridge.core.model.RawResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches an in-process list of JSON objects.
 *
 * <p>
 * Each search field scores 10 for an exact match, 5 for a prefix match and 1
 * for any other substring match; field scores are summed and results are
 * returned highest first, ties in data order.
 */
public final class MemoryAdapter extends AbstractDataSourceAdapter<MemoryDataSourceConfig> {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryAdapter.class);

    static final int EXACT_SCORE = 10;
    static final int PREFIX_SCORE = 5;
    static final int CONTAINS_SCORE = 1;
    private static final int SAMPLE_SIZE = 3;

    private static final AdapterCapabilities CAPABILITIES =
            new AdapterCapabilities(false, true, false, true, true, false, 100, List.of("text"));

    private final Map<String, MemoryDataSourceConfig> configs = new ConcurrentHashMap<>();

    public MemoryAdapter() {
        super(DataSourceType.MEMORY, MemoryDataSourceConfig.class);
    }

    @Override
    protected void validate(MemoryDataSourceConfig config) {
        if (config.searchFields().isEmpty()) {
            throw new ConfigValidationException("searchFields must be a non-empty list", "searchFields");
        }
        for (String field : config.searchFields()) {
            if (field == null || field.isBlank()) {
                throw new ConfigValidationException("All searchFields must be non-empty strings", "searchFields");
            }
        }
        List<JsonNode> data = resolve(config);
        for (int i = 0; i < Math.min(SAMPLE_SIZE, data.size()); i++) {
            JsonNode item = data.get(i);
            if (item == null || !item.isObject()) {
                throw new ConfigValidationException("Data item at index " + i + " must be an object", "data");
            }
            for (String field : config.searchFields()) {
                JsonNode value = JsonPaths.at(item, field);
                if (!JsonPaths.isAbsent(value) && !value.isTextual() && !value.isNumber()) {
                    throw new ConfigValidationException(
                            "Field \"" + field + "\" must be string or number type in data items", "searchFields");
                }
            }
        }
    }

    @Override
    protected Connection open(MemoryDataSourceConfig config) {
        Connection connection = newConnection(Map.of(
                "searchFields", config.searchFields(), "caseSensitive", config.caseSensitive()));
        configs.put(connection.id(), config);
        connection.updateStatus(ConnectionStatus.CONNECTED);
        return connection;
    }

    @Override
    public List<RawResult> query(Connection connection, ProcessedQuery query) {
        requireActive(connection);
        MemoryDataSourceConfig config = configs.get(connection.id());
        return executeWithMetrics(connection, () -> search(config, query.normalized(), connection.id()));
    }

    @Override
    protected void close(Connection connection) {
        configs.remove(connection.id());
    }

    @Override
    public boolean healthCheck(Connection connection) {
        if (!super.healthCheck(connection)) {
            return false;
        }
        MemoryDataSourceConfig config = configs.get(connection.id());
        try {
            return config != null && config.data().get() != null;
        } catch (RuntimeException e) {
            LOG.warn("Memory data supplier failed during health check: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public AdapterCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    private List<RawResult> search(MemoryDataSourceConfig config, String text, String connectionId) {
        String needle = normalize(text, config.caseSensitive());
        if (needle.isEmpty()) {
            return List.of();
        }
        List<JsonNode> data = resolve(config);
        long now = System.currentTimeMillis();
        List<RawResult> results = new ArrayList<>();
        for (JsonNode item : data) {
            if (item == null || !item.isObject()) {
                continue;
            }
            int score = 0;
            List<String> matched = new ArrayList<>();
            for (String field : config.searchFields()) {
                JsonNode value = JsonPaths.at(item, field);
                if (JsonPaths.isAbsent(value) || value.isContainerNode()) {
                    continue;
                }
                int fieldScore = score(normalize(value.asText(), config.caseSensitive()), needle);
                if (fieldScore > 0) {
                    score += fieldScore;
                    matched.add(field);
                }
            }
            if (score > 0) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("source", "memory");
                metadata.put("connectionId", connectionId);
                metadata.put("searchQuery", text);
                results.add(new RawResult("pending", item, score, matched, metadata));
            }
        }
        results.sort(RawResult.BY_SCORE_DESC);
        List<RawResult> ranked = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            RawResult r = results.get(i);
            ranked.add(new RawResult("memory_" + i + "_" + now, r.data(), r.score(), r.matchedFields(), r.metadata()));
        }
        LOG.debug("Memory search '{}' matched {} of {} items", text, ranked.size(), data.size());
        return ranked;
    }

    static int score(String value, String needle) {
        if (value.equals(needle)) {
            return EXACT_SCORE;
        }
        if (value.startsWith(needle)) {
            return PREFIX_SCORE;
        }
        return value.contains(needle) ? CONTAINS_SCORE : 0;
    }

    private static String normalize(String text, boolean caseSensitive) {
        String trimmed = text == null ? "" : text.trim();
        return caseSensitive ? trimmed : trimmed.toLowerCase(Locale.ROOT);
    }

    private List<JsonNode> resolve(MemoryDataSourceConfig config) {
        List<JsonNode> data;
        try {
            data = config.data().get();
        } catch (RuntimeException e) {
            throw createError("Failed to load in-memory data", ErrorCategory.DATA, "MEMORY_DATA_UNAVAILABLE", e);
        }
        if (data == null) {
            throw new ConfigValidationException("Data must be a list or a supplier returning a list", "data");
        }
        return data;
    }
}
