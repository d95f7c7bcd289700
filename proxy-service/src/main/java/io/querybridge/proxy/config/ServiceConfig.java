package io.querybridge.proxy.config;

import io.querybridge.core.sql.DatabaseType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Root configuration of the search proxy service.
 *
 * <p>
 * Clients never supply connection details: the database is fixed here and
 * requests may only search the tables and columns listed in {@code tables}.
 *
 * @param host                bind address
 * @param port                listen port; {@code 0} picks a free port
 * @param database            the database searched by {@code POST /search}
 * @param tables              searchable table name to its searchable columns
 * @param auth                API-key and bearer authentication
 * @param rateLimitPerMinute  requests per minute per client IP
 * @param relay               CORS relay ({@code POST /proxy}) settings
 * @param loggingFormat       {@code json} or {@code text}
 * @param loggingLevel        root log level
 */
public record ServiceConfig(
        String host,
        int port,
        Database database,
        Map<String, List<String>> tables,
        Auth auth,
        int rateLimitPerMinute,
        Relay relay,
        String loggingFormat,
        String loggingLevel) {

    public ServiceConfig {
        Objects.requireNonNull(database, "database must not be null");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (tables != null) {
            tables.forEach((table, columns) -> copy.put(table, List.copyOf(columns)));
        }
        tables = Collections.unmodifiableMap(copy);
        auth = Objects.requireNonNullElse(auth, Auth.DISABLED);
        relay = Objects.requireNonNullElse(relay, Relay.DISABLED);
        if (rateLimitPerMinute <= 0) {
            throw new IllegalArgumentException("rateLimitPerMinute must be positive, got: " + rateLimitPerMinute);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param connectionString         driver connection string or JDBC URL; never logged unredacted
     * @param type                     database flavour
     * @param ssl                      require TLS to the database
     * @param validationTimeoutMs      timeout of the connectivity probe
     * @param maxConnections           pooled connections
     * @param validateConnectionString run the connection-string security check at startup
     */
    public record Database(
            String connectionString,
            DatabaseType type,
            boolean ssl,
            long validationTimeoutMs,
            int maxConnections,
            boolean validateConnectionString) {

        public Database {
            Objects.requireNonNull(type, "type must not be null");
            if (maxConnections <= 0) {
                throw new IllegalArgumentException("maxConnections must be positive, got: " + maxConnections);
            }
        }
    }

    /** @param apiKeys accepted {@code X-API-Key} values */
    public record Auth(boolean enabled, Set<String> apiKeys) {

        public static final Auth DISABLED = new Auth(false, Set.of());

        public Auth {
            apiKeys = apiKeys == null ? Set.of() : Set.copyOf(apiKeys);
        }
    }

    /** @param allowedHosts hosts the relay may contact; empty means none */
    public record Relay(boolean enabled, Set<String> allowedHosts, long timeoutMs) {

        public static final Relay DISABLED = new Relay(false, Set.of(), 10_000);

        public Relay {
            allowedHosts = allowedHosts == null ? Set.of() : Set.copyOf(allowedHosts);
            if (timeoutMs <= 0) {
                timeoutMs = 10_000;
            }
        }
    }

    /** Builder with the documented defaults; only the database connection string is required. */
    public static final class Builder {

        private String host = "0.0.0.0";
        private int port = 8080;
        private String connectionString;
        private DatabaseType databaseType = DatabaseType.POSTGRESQL;
        private boolean ssl;
        private long validationTimeoutMs = 5_000;
        private int maxConnections = 10;
        private boolean validateConnectionString = true;
        private final Map<String, List<String>> tables = new LinkedHashMap<>();
        private boolean authEnabled = true;
        private Set<String> apiKeys = Set.of();
        private int rateLimitPerMinute = 30;
        private boolean relayEnabled;
        private Set<String> relayAllowedHosts = Set.of();
        private long relayTimeoutMs = 10_000;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder host(String value) {
            this.host = value;
            return this;
        }

        public Builder port(int value) {
            this.port = value;
            return this;
        }

        public Builder connectionString(String value) {
            this.connectionString = value;
            return this;
        }

        public Builder databaseType(DatabaseType value) {
            this.databaseType = value;
            return this;
        }

        public Builder ssl(boolean value) {
            this.ssl = value;
            return this;
        }

        public Builder validationTimeoutMs(long value) {
            this.validationTimeoutMs = value;
            return this;
        }

        public Builder maxConnections(int value) {
            this.maxConnections = value;
            return this;
        }

        public Builder validateConnectionString(boolean value) {
            this.validateConnectionString = value;
            return this;
        }

        public Builder table(String name, List<String> columns) {
            this.tables.put(name, columns);
            return this;
        }

        public Builder clearTables() {
            this.tables.clear();
            return this;
        }

        public Builder authEnabled(boolean value) {
            this.authEnabled = value;
            return this;
        }

        public Builder apiKeys(Set<String> value) {
            this.apiKeys = value;
            return this;
        }

        public Builder rateLimitPerMinute(int value) {
            this.rateLimitPerMinute = value;
            return this;
        }

        public Builder relayEnabled(boolean value) {
            this.relayEnabled = value;
            return this;
        }

        public Builder relayAllowedHosts(Set<String> value) {
            this.relayAllowedHosts = value;
            return this;
        }

        public Builder relayTimeoutMs(long value) {
            this.relayTimeoutMs = value;
            return this;
        }

        public Builder loggingFormat(String value) {
            this.loggingFormat = value;
            return this;
        }

        public Builder loggingLevel(String value) {
            this.loggingLevel = value;
            return this;
        }

        public ServiceConfig build() {
            if (connectionString == null || connectionString.isBlank()) {
                throw new IllegalArgumentException("database.connection-string is required");
            }
            if (tables.isEmpty()) {
                throw new IllegalArgumentException("search.tables must list at least one table");
            }
            tables.forEach((table, columns) -> {
                if (columns == null || columns.isEmpty()) {
                    throw new IllegalArgumentException("search.tables." + table + " must list at least one column");
                }
            });
            return new ServiceConfig(
                    host,
                    port,
                    new Database(connectionString, databaseType, ssl, validationTimeoutMs, maxConnections,
                            validateConnectionString),
                    tables,
                    new Auth(authEnabled, apiKeys),
                    rateLimitPerMinute,
                    new Relay(relayEnabled, relayAllowedHosts, relayTimeoutMs),
                    loggingFormat,
                    loggingLevel);
        }
    }
}
