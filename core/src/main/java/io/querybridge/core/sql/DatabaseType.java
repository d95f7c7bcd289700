package io.querybridge.core.sql;

import io.querybridge.core.error.ConfigValidationException;
import java.util.Locale;

/** Relational databases with a supported SQL dialect. */
public enum DatabaseType {
    POSTGRESQL("postgresql"),
    MYSQL("mysql"),
    SQLITE("sqlite");

    private final String id;

    DatabaseType(String id) {
        this.id = id;
    }

    /** Configuration identifier, e.g. {@code "postgresql"}. */
    public String id() {
        return id;
    }

    /**
     * Parses a configuration identifier. {@code "postgres"} is accepted as an
     * alias.
     *
     * @throws ConfigValidationException if the identifier is unknown
     */
    public static DatabaseType fromId(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if ("postgres".equals(normalized)) {
                return POSTGRESQL;
            }
            for (DatabaseType type : values()) {
                if (type.id.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ConfigValidationException("Unsupported database type: " + value, "connection.databaseType");
    }
}
