package io.querybridge.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * In-memory data source.
 *
 * @param data          supplies the records to search; called on every query so it may be live
 * @param searchFields  fields to match, dotted paths allowed
 * @param caseSensitive match case exactly
 * @param options       shared options
 */
public record MemoryDataSourceConfig(
        Supplier<List<JsonNode>> data, List<String> searchFields, boolean caseSensitive, ConnectionOptions options)
        implements DataSourceConfig {

    public MemoryDataSourceConfig {
        Objects.requireNonNull(data, "data must not be null");
        searchFields = searchFields == null ? List.of() : List.copyOf(searchFields);
        options = Objects.requireNonNullElse(options, ConnectionOptions.DEFAULT);
    }

    /** Static records searched case-insensitively. */
    public static MemoryDataSourceConfig of(List<JsonNode> records, String... searchFields) {
        List<JsonNode> copy = List.copyOf(records);
        return new MemoryDataSourceConfig(() -> copy, List.of(searchFields), false, ConnectionOptions.DEFAULT);
    }

    public MemoryDataSourceConfig withCaseSensitive(boolean value) {
        return new MemoryDataSourceConfig(data, searchFields, value, options);
    }

    public MemoryDataSourceConfig withOptions(ConnectionOptions newOptions) {
        return new MemoryDataSourceConfig(data, searchFields, caseSensitive, newOptions);
    }

    @Override
    public DataSourceType type() {
        return DataSourceType.MEMORY;
    }
}
