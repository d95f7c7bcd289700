package io.querybridge.core.config;

import io.querybridge.core.sql.DatabaseType;
import io.querybridge.core.sql.SqlQueryConfig;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SQL data source: a database reached directly through a connection string or
 * indirectly through a proxy-service endpoint.
 */
public record SqlDataSourceConfig(
        SqlConnection connection,
        SqlQueryConfig query,
        Pagination pagination,
        SqlSecurity security,
        ConnectionOptions options) implements DataSourceConfig {

    public SqlDataSourceConfig {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(query, "query must not be null");
        pagination = Objects.requireNonNullElse(pagination, Pagination.DEFAULT);
        security = Objects.requireNonNullElse(security, SqlSecurity.DEFAULT);
        options = Objects.requireNonNullElse(options, ConnectionOptions.DEFAULT);
    }

    @Override
    public DataSourceType type() {
        return DataSourceType.SQL;
    }

    public static SqlDataSourceConfig of(SqlConnection connection, SqlQueryConfig query) {
        return new SqlDataSourceConfig(connection, query, null, null, null);
    }

    public SqlDataSourceConfig withPagination(Pagination value) {
        return new SqlDataSourceConfig(connection, query, value, security, options);
    }

    public SqlDataSourceConfig withSecurity(SqlSecurity value) {
        return new SqlDataSourceConfig(connection, query, pagination, value, options);
    }

    public SqlDataSourceConfig withOptions(ConnectionOptions value) {
        return new SqlDataSourceConfig(connection, query, pagination, security, value);
    }

    /**
     * Where the database is.
     *
     * @param connectionString    database URL; never logged unredacted
     * @param proxyEndpoint       proxy-service {@code /search} URL used when no connection string is set
     * @param databaseType        product, selects the dialect
     * @param databaseVersion     server version for feature detection, may be {@code null}
     * @param validationTimeoutMs bound on the connect-time {@code SELECT 1} check
     * @param ssl                 request TLS from the driver
     */
    public record SqlConnection(
            String connectionString,
            String proxyEndpoint,
            DatabaseType databaseType,
            String databaseVersion,
            long validationTimeoutMs,
            boolean ssl) {

        public SqlConnection {
            Objects.requireNonNull(databaseType, "databaseType must not be null");
            if (validationTimeoutMs <= 0) {
                validationTimeoutMs = 5_000;
            }
        }

        public static SqlConnection direct(DatabaseType type, String connectionString) {
            return new SqlConnection(connectionString, null, type, null, 5_000, false);
        }

        public static SqlConnection viaProxy(DatabaseType type, String proxyEndpoint) {
            return new SqlConnection(null, proxyEndpoint, type, null, 5_000, false);
        }

        public boolean usesProxy() {
            return (connectionString == null || connectionString.isBlank())
                    && proxyEndpoint != null
                    && !proxyEndpoint.isBlank();
        }

        /** This connection with a different connection string, e.g. after placeholder resolution. */
        public SqlConnection withConnectionString(String value) {
            return new SqlConnection(value, proxyEndpoint, databaseType, databaseVersion, validationTimeoutMs, ssl);
        }
    }

    /** How results are paged. */
    public enum PaginationType {
        OFFSET,
        CURSOR;

        public static PaginationType fromId(String id) {
            return id == null ? OFFSET : valueOf(id.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * @param maxResults       cap applied to the first page of a search
     * @param pageSize         default page size
     * @param enablePagination whether searches are limited at all
     * @param type             offset or cursor paging
     * @param cursorColumn     column used for cursor paging
     */
    public record Pagination(
            int maxResults, int pageSize, boolean enablePagination, PaginationType type, String cursorColumn) {

        public static final Pagination DEFAULT = new Pagination(100, 20, true, PaginationType.OFFSET, null);

        public Pagination {
            if (maxResults <= 0 || pageSize <= 0) {
                throw new IllegalArgumentException("maxResults and pageSize must be positive");
            }
            type = Objects.requireNonNullElse(type, PaginationType.OFFSET);
        }
    }

    /**
     * @param preventSqlInjection      run the security validator on every generated query
     * @param validateConnectionString screen the connection string at connect time
     * @param allowedOperations        leading SQL keywords permitted
     * @param logQueries               log generated SQL at DEBUG (parameters are never logged)
     */
    public record SqlSecurity(
            boolean preventSqlInjection, boolean validateConnectionString, Set<String> allowedOperations, boolean logQueries) {

        public static final SqlSecurity DEFAULT = new SqlSecurity(true, true, Set.of("SELECT"), false);

        public SqlSecurity {
            allowedOperations = allowedOperations == null || allowedOperations.isEmpty()
                    ? Set.of("SELECT")
                    : allowedOperations.stream()
                            .map(op -> op.trim().toUpperCase(Locale.ROOT))
                            .collect(Collectors.toUnmodifiableSet());
        }

        public SqlSecurity allowing(String... operations) {
            return new SqlSecurity(preventSqlInjection, validateConnectionString, Set.of(operations), logQueries);
        }
    }
}
