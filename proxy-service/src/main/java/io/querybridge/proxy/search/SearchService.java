package io.querybridge.proxy.search;

import com.fasterxml.jackson.databind.JsonNode;
import io.querybridge.core.adapter.sql.SqlAdapter;
import io.querybridge.core.config.SqlDataSourceConfig;
import io.querybridge.core.model.Connection;
import io.querybridge.core.model.ConnectionMetrics;
import io.querybridge.core.model.ProcessedQuery;
import io.querybridge.core.model.RawResult;
import io.querybridge.core.pool.ConnectionPool;
import io.querybridge.core.pool.PoolSettings;
import io.querybridge.core.pool.PoolStats;
import io.querybridge.core.pool.PooledResourceFactory;
import io.querybridge.core.sql.PageRequest;
import io.querybridge.core.sql.SqlQueryConfig;
import io.querybridge.proxy.config.ServiceConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs structured searches against the configured database through the core
 * {@link SqlAdapter}, on a small pool of adapter connections.
 *
 * <p>
 * Only tables and columns listed in the service configuration are searchable,
 * and rows come back with exactly those columns.
 */
public final class SearchService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SearchService.class);

    private final SqlAdapter adapter;
    private final SqlDataSourceConfig dataSource;
    private final Map<String, List<String>> tables;
    private final ConnectionPool<Connection> pool;

    public SearchService(SqlAdapter adapter, ServiceConfig config) {
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
        this.tables = config.tables();
        this.dataSource = dataSourceConfig(config);
        adapter.validateConfig(dataSource);
        this.pool = new ConnectionPool<>(
                "search", new AdapterConnections(), PoolSettings.DEFAULT.withMaxConnections(config.database().maxConnections()));
    }

    /** The data source searches run against; its connection string is the configured one. */
    static SqlDataSourceConfig dataSourceConfig(ServiceConfig config) {
        ServiceConfig.Database db = config.database();
        Map.Entry<String, List<String>> first = config.tables().entrySet().iterator().next();
        SqlQueryConfig query = SqlQueryConfig.builder(first.getKey())
                .searchColumns(first.getValue().toArray(String[]::new))
                .build();
        SqlDataSourceConfig.SqlConnection connection = new SqlDataSourceConfig.SqlConnection(
                db.connectionString(), null, db.type(), null, db.validationTimeoutMs(), db.ssl());
        return SqlDataSourceConfig.of(connection, query)
                .withSecurity(new SqlDataSourceConfig.SqlSecurity(
                        true, db.validateConnectionString(), null, false));
    }

    /**
     * Searches one page.
     *
     * @throws RequestValidationException if the table or a column is not searchable
     */
    public SearchResult search(SearchRequest request) {
        SqlQueryConfig query = queryFor(request);
        ProcessedQuery processed = ProcessedQuery.of(request.searchTerm());
        long start = System.nanoTime();
        return pool.withConnection(connection -> {
            long total = adapter.count(connection, query, processed);
            List<RawResult> rows = adapter.search(
                    connection, query, processed, new PageRequest(request.limit(), request.offset()));
            List<JsonNode> data = new ArrayList<>(rows.size());
            rows.forEach(row -> data.add(row.data()));
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            LOG.debug("Searched {} for '{}': {} of {} rows in {}ms",
                    request.tableName(), abbreviate(request.searchTerm()), data.size(), total, elapsed);
            return new SearchResult(data, total, elapsed);
        });
    }

    /** Whether a pooled connection passes the adapter health check. */
    public boolean isHealthy() {
        try {
            return pool.withConnection(adapter::healthCheck);
        } catch (RuntimeException e) {
            LOG.debug("Readiness check failed: {}", e.getMessage());
            return false;
        }
    }

    public PoolStats poolStats() {
        return pool.getStats();
    }

    public List<ConnectionMetrics> metrics() {
        return adapter.getConnectionMetrics();
    }

    @Override
    public void close() {
        pool.destroy();
        adapter.destroy();
    }

    private SqlQueryConfig queryFor(SearchRequest request) {
        List<String> allowed = tables.get(request.tableName());
        if (allowed == null) {
            throw new RequestValidationException(List.of("Table is not searchable: " + request.tableName()));
        }
        List<String> errors = new ArrayList<>();
        for (String field : request.searchFields()) {
            if (!allowed.contains(field)) {
                errors.add("Field is not searchable: " + field);
            }
        }
        if (request.orderColumn() != null && !allowed.contains(request.orderColumn())
                && !"id".equals(request.orderColumn())) {
            errors.add("Field is not sortable: " + request.orderColumn());
        }
        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }
        SqlQueryConfig.Builder builder = SqlQueryConfig.builder(request.tableName())
                .searchColumns(request.searchFields().toArray(String[]::new))
                .selectColumns(allowed.toArray(String[]::new));
        if (request.orderColumn() != null) {
            builder.orderBy(request.orderColumn(), request.orderDirection());
        }
        return builder.build();
    }

    private static String abbreviate(String term) {
        return term.length() <= 50 ? term : term.substring(0, 50) + "...";
    }

    private final class AdapterConnections implements PooledResourceFactory<Connection> {

        @Override
        public Connection create() {
            return adapter.connect(dataSource);
        }

        @Override
        public boolean validate(Connection resource) {
            return adapter.healthCheck(resource);
        }

        @Override
        public void destroy(Connection resource) {
            adapter.disconnect(resource);
        }
    }
}
