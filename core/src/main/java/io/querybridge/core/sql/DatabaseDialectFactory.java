package io.querybridge.core.sql;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates dialects keyed on {@code (databaseType, version)} and caches one
 * instance per key. Thread-safe; share one factory per application context.
 */
public final class DatabaseDialectFactory {

    private final Map<String, DatabaseDialect> cache = new ConcurrentHashMap<>();

    /** Dialect for the default (latest) server version. */
    public DatabaseDialect dialect(DatabaseType type) {
        return dialect(type, null);
    }

    /**
     * Returns the cached dialect for the key, creating it on first use.
     *
     * @param type    database product
     * @param version server version, or {@code null} for the default
     */
    public DatabaseDialect dialect(DatabaseType type, String version) {
        Objects.requireNonNull(type, "type must not be null");
        String key = type.id() + "-" + (version == null || version.isBlank() ? "default" : version.trim());
        return cache.computeIfAbsent(key, k -> create(type, version));
    }

    /** Number of cached dialect instances. */
    public int size() {
        return cache.size();
    }

    private static DatabaseDialect create(DatabaseType type, String version) {
        return switch (type) {
            case POSTGRESQL -> new PostgreSqlDialect(version);
            case MYSQL -> new MySqlDialect(version);
            case SQLITE -> new SqliteDialect(version);
        };
    }
}
