package io.querybridge.core.adapter.sql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.querybridge.core.adapter.AbstractDataSourceAdapter;
import io.querybridge.core.adapter.JsonPaths;
import io.querybridge.core.config.DataSourceType;
import io.querybridge.core.config.SqlDataSourceConfig;
import io.querybridge.core.error.ConfigValidationException;
import io.querybridge.core.error.DataSourceFailureException;
import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.http.HttpTransport;
import io.querybridge.core.model.AdapterCapabilities;
import io.querybridge.core.model.Connection;
import io.querybridge.core.model.ConnectionStatus;
import io.querybridge.core.model.ProcessedQuery;
import io.querybridge.core.model.RawResult;
import io.querybridge.core.security.ConnectionStringValidation;
import io.querybridge.core.security.SecurityPolicy;
import io.querybridge.core.security.SecurityValidator;
import io.querybridge.core.security.SqlValidationResult;
import io.querybridge.core.sql.DatabaseDialect;
import io.querybridge.core.sql.DatabaseDialectFactory;
import io.querybridge.core.sql.PageRequest;
import io.querybridge.core.sql.ParameterizedQuery;
import io.querybridge.core.sql.QueryBuilder;
import io.querybridge.core.sql.SqlQueryConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches a relational table through generated, parameterized SQL.
 *
 * <p>
 * Every statement is compiled by {@link QueryBuilder} and screened by
 * {@link SecurityValidator} before it reaches the {@link SqlExecutor}. A query
 * that the front end marked invalid or insecure is rejected the same way as one
 * the validator rejects.
 */
public final class SqlAdapter extends AbstractDataSourceAdapter<SqlDataSourceConfig> {

    private static final Logger LOG = LoggerFactory.getLogger(SqlAdapter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final AdapterCapabilities CAPABILITIES = new AdapterCapabilities(
            false, false, true, true, true, true, 50, List.of("SELECT", "INSERT", "UPDATE", "DELETE"));

    private final SqlExecutorFactory executorFactory;
    private final DatabaseDialectFactory dialects;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public SqlAdapter() {
        this(defaultExecutorFactory(HttpTransport.defaults(), new ObjectMapper()), new DatabaseDialectFactory());
    }

    public SqlAdapter(SqlExecutorFactory executorFactory, DatabaseDialectFactory dialects) {
        super(DataSourceType.SQL, SqlDataSourceConfig.class);
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory must not be null");
        this.dialects = Objects.requireNonNull(dialects, "dialects must not be null");
    }

    /** JDBC when a connection string is set, otherwise the proxy endpoint. */
    public static SqlExecutorFactory defaultExecutorFactory(HttpTransport transport, ObjectMapper mapper) {
        return config -> {
            SqlDataSourceConfig.SqlConnection conn = config.connection();
            if (conn.usesProxy()) {
                return new ProxySqlExecutor(transport, mapper, conn.proxyEndpoint());
            }
            return new JdbcSqlExecutor(
                    conn.connectionString(), conn.databaseType(), conn.validationTimeoutMs(), conn.ssl());
        };
    }

    @Override
    protected void validate(SqlDataSourceConfig config) {
        SqlDataSourceConfig.SqlConnection conn = config.connection();
        boolean hasConnectionString = conn.connectionString() != null && !conn.connectionString().isBlank();
        boolean hasProxy = conn.proxyEndpoint() != null && !conn.proxyEndpoint().isBlank();
        if (!hasConnectionString && !hasProxy) {
            throw new ConfigValidationException(
                    "Either connectionString or proxyEndpoint is required", "connection.connectionString");
        }
        builderFor(config).validateConfig(config.query());
        SqlDataSourceConfig.Pagination pagination = config.pagination();
        if (pagination.type() == SqlDataSourceConfig.PaginationType.CURSOR
                && (pagination.cursorColumn() == null || pagination.cursorColumn().isBlank())) {
            throw new ConfigValidationException(
                    "cursorColumn is required for cursor pagination", "pagination.cursorColumn");
        }
    }

    @Override
    protected Connection open(SqlDataSourceConfig config) {
        SqlDataSourceConfig.SqlConnection conn = config.connection();
        DatabaseDialect dialect = dialects.dialect(conn.databaseType(), conn.databaseVersion());
        SecurityValidator validator = new SecurityValidator(SecurityPolicy.allowing(config.security().allowedOperations()));

        if (config.security().validateConnectionString() && !conn.usesProxy()) {
            ConnectionStringValidation check = validator.validateConnectionString(conn.connectionString(), dialect);
            if (!check.valid()) {
                LOG.warn("Rejected connection string {}: {}", check.sanitized(), check.errors());
                throw createError(
                        "Connection string validation failed: " + String.join(", ", check.errors()),
                        ErrorCategory.SECURITY,
                        "SQL_CONNECTION_STRING_REJECTED",
                        null);
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("databaseType", conn.databaseType().id());
        if (conn.usesProxy()) {
            metadata.put("proxyEndpoint", conn.proxyEndpoint());
        } else {
            metadata.put("connectionString", DatabaseDialect.redactConnectionString(conn.connectionString()));
        }
        Connection connection = newConnection(metadata);
        SqlExecutor executor = null;
        try {
            executor = executorFactory.create(config);
            executor.open();
            executor.ping();
        } catch (RuntimeException e) {
            discard(connection);
            closeQuietly(executor, connection.id());
            throw createError(
                    "Failed to connect to " + conn.databaseType().id() + " database: " + e.getMessage(),
                    ErrorCategory.CONNECTION,
                    "SQL_CONNECTION_FAILED",
                    e);
        }
        sessions.put(connection.id(), new Session(config, executor, dialect, new QueryBuilder(dialect), validator));
        connection.updateStatus(ConnectionStatus.CONNECTED);
        LOG.debug("Connected {} to {}", connection.id(), metadata);
        return connection;
    }

    @Override
    public List<RawResult> query(Connection connection, ProcessedQuery query) {
        SqlDataSourceConfig.Pagination pagination = session(connection).config().pagination();
        PageRequest page = pagination.enablePagination()
                ? PageRequest.first(Math.min(pagination.pageSize(), pagination.maxResults()))
                : null;
        return search(connection, session(connection).config().query(), query, page);
    }

    /**
     * Searches with an explicit query configuration and page window.
     *
     * @param queryConfig table, columns and ordering to search
     * @param page        window, or {@code null} for no LIMIT
     */
    public List<RawResult> search(Connection connection, SqlQueryConfig queryConfig, ProcessedQuery query, PageRequest page) {
        requireActive(connection);
        Session session = session(connection);
        return executeWithMetrics(connection, () -> {
            ParameterizedQuery sql = screen(session, session.builder().buildSearchQuery(queryConfig, query, page), query);
            SqlRows rows = session.executor().search(new SearchCommand(sql, query.normalized(), queryConfig, page));
            return toResults(rows.rows(), connection, session, rows.totalCount(), null);
        });
    }

    /** Counts all matches of {@code query} under {@code queryConfig}. */
    public long count(Connection connection, SqlQueryConfig queryConfig, ProcessedQuery query) {
        requireActive(connection);
        Session session = session(connection);
        if (!session.executor().supportsRawSql()) {
            ParameterizedQuery probe = session.builder().buildSearchQuery(queryConfig, query, PageRequest.first(1));
            Long total = session.executor()
                    .search(new SearchCommand(screen(session, probe, query), query.normalized(), queryConfig,
                            PageRequest.first(1)))
                    .totalCount();
            return total == null ? 0 : total;
        }
        ParameterizedQuery sql = screen(session, session.builder().buildCountQuery(queryConfig, query), query);
        List<ObjectNode> rows = session.executor().query(sql);
        if (rows.isEmpty()) {
            return 0;
        }
        JsonNode first = rows.get(0).elements().hasNext() ? rows.get(0).elements().next() : null;
        return first == null ? 0 : first.asLong();
    }

    /**
     * Returns one offset page plus the total count. Without a configured ORDER
     * BY the page is ordered by {@code id}.
     *
     * @param page one-based page number
     */
    public SqlPage paginatedResults(Connection connection, ProcessedQuery query, int page, int pageSize) {
        Session session = session(connection);
        SqlQueryConfig config = session.config().query();
        if (config.orderBy().isEmpty()) {
            config = new SqlQueryConfig(
                    config.tableName(), config.searchColumns(), config.selectColumns(), config.joins(),
                    config.whereClause(), List.of(new SqlQueryConfig.Order("id", "ASC")), config.groupBy(),
                    config.having());
        }
        long total = count(connection, config, query);
        List<RawResult> rows = search(connection, config, query, PageRequest.ofPage(page, pageSize));
        List<RawResult> results = new ArrayList<>(rows.size());
        for (RawResult r : rows) {
            Map<String, Object> metadata = new LinkedHashMap<>(r.metadata());
            metadata.put("page", page);
            metadata.put("totalCount", total);
            results.add(new RawResult(r.id(), r.data(), r.score(), r.matchedFields(), metadata));
        }
        return new SqlPage(results, total, page, pageSize);
    }

    /**
     * Returns the keyset page after ({@code forward}) or before
     * {@code cursorValue} on the configured cursor column.
     *
     * @param cursorValue last seen cursor value, or {@code null} to start from the beginning
     */
    public CursorPage cursorPage(Connection connection, ProcessedQuery query, Object cursorValue, boolean forward) {
        requireActive(connection);
        Session session = session(connection);
        SqlDataSourceConfig.Pagination pagination = session.config().pagination();
        String cursorColumn = pagination.cursorColumn();
        if (cursorColumn == null || cursorColumn.isBlank()) {
            throw new ConfigValidationException(
                    "cursorColumn is required for cursor pagination", "pagination.cursorColumn");
        }
        requireRawSql(session, "cursor paging");
        int size = pagination.pageSize();
        List<RawResult> results = executeWithMetrics(connection, () -> {
            ParameterizedQuery sql = cursorValue == null
                    ? session.builder().buildSearchQuery(orderedBy(session.config().query(), cursorColumn, forward),
                            query, PageRequest.first(size))
                    : session.builder().buildCursorQuery(
                            session.config().query(), query, cursorColumn, cursorValue, forward, size);
            List<ObjectNode> rows = session.executor().query(screen(session, sql, query));
            return toResults(rows, connection, session, null, null);
        });
        JsonNode next = results.isEmpty() ? null : JsonPaths.at(results.get(results.size() - 1).data(), cursorColumn);
        return new CursorPage(results, JsonPaths.isAbsent(next) ? null : next, results.size() == size);
    }

    /** Inserts one row; requires {@code INSERT} among the allowed operations. */
    public RawResult insert(Connection connection, String tableName, Map<String, ?> values) {
        Session session = session(connection);
        ParameterizedQuery sql = session.builder().buildInsertQuery(tableName, values);
        return write(connection, session, sql, "INSERT", values);
    }

    /** Updates matching rows; requires {@code UPDATE} among the allowed operations. */
    public RawResult update(Connection connection, String tableName, Map<String, ?> values, Map<String, ?> conditions) {
        Session session = session(connection);
        ParameterizedQuery sql = session.builder().buildUpdateQuery(tableName, values, conditions);
        return write(connection, session, sql, "UPDATE", values);
    }

    /** Deletes matching rows; requires {@code DELETE} among the allowed operations. */
    public RawResult delete(Connection connection, String tableName, Map<String, ?> conditions) {
        Session session = session(connection);
        ParameterizedQuery sql = session.builder().buildDeleteQuery(tableName, conditions);
        return write(connection, session, sql, "DELETE", conditions);
    }

    @Override
    public boolean healthCheck(Connection connection) {
        if (!super.healthCheck(connection)) {
            return false;
        }
        Session session = sessions.get(connection.id());
        if (session == null) {
            return false;
        }
        try {
            session.executor().ping();
            return true;
        } catch (RuntimeException e) {
            LOG.debug("Health check failed for {}: {}", connection.id(), e.getMessage());
            return false;
        }
    }

    @Override
    protected void close(Connection connection) {
        Session session = sessions.remove(connection.id());
        if (session != null) {
            try {
                session.executor().close();
            } catch (RuntimeException e) {
                throw createError(
                        "Failed to disconnect from database: " + e.getMessage(),
                        ErrorCategory.CONNECTION,
                        "SQL_DISCONNECT_FAILED",
                        e);
            }
        }
    }

    @Override
    public AdapterCapabilities getCapabilities() {
        return CAPABILITIES;
    }

    // --- internals ---

    private RawResult write(
            Connection connection, Session session, ParameterizedQuery sql, String operation, Map<String, ?> data) {
        requireActive(connection);
        if (!session.config().security().allowedOperations().contains(operation)) {
            LOG.warn("Rejected {} on {}: operation not allowed", operation, connection.id());
            throw createError(
                    operation + " operations are not allowed for this data source",
                    ErrorCategory.SECURITY,
                    "SQL_OPERATION_NOT_ALLOWED",
                    null);
        }
        requireRawSql(session, operation);
        List<RawResult> out = executeWithMetrics(connection, () -> {
            int affected = session.executor().update(screen(session, sql, null));
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("source", "sql");
            metadata.put("operation", operation);
            metadata.put("rowsAffected", affected);
            ObjectNode payload = MAPPER.valueToTree(data);
            return List.of(new RawResult(String.valueOf(affected), payload, 1.0, List.of(), metadata));
        });
        return out.get(0);
    }

    private ParameterizedQuery screen(Session session, ParameterizedQuery sql, ProcessedQuery query) {
        SqlDataSourceConfig.SqlSecurity security = session.config().security();
        if (security.logQueries()) {
            LOG.debug("Executing SQL: {}", sql.sql());
        }
        boolean queryAccepted = query == null || (query.valid() && query.isSecure());
        if (!security.preventSqlInjection()) {
            if (!queryAccepted) {
                throw rejected(List.of("Query was not marked valid and secure"));
            }
            return sql;
        }
        SqlValidationResult result = session.validator().validate(sql);
        if (!result.valid() || !queryAccepted) {
            List<String> errors = new ArrayList<>(result.errors());
            if (!queryAccepted) {
                errors.add("Query was not marked valid and secure");
            }
            throw rejected(errors);
        }
        if (!result.warnings().isEmpty()) {
            LOG.debug("SQL validation warnings: {}", result.warnings());
        }
        return new ParameterizedQuery(
                sql.sql(), result.sanitizedParameters(), sql.parameterTypes(), sql.queryType(), sql.estimatedRows());
    }

    private DataSourceFailureException rejected(List<String> errors) {
        LOG.warn("SQL security validation failed: {}", errors);
        return createError(
                "SQL security validation failed: " + String.join(", ", errors),
                ErrorCategory.SECURITY,
                "SQL_SECURITY_VALIDATION_FAILED",
                null);
    }

    private void requireRawSql(Session session, String operation) {
        if (!session.executor().supportsRawSql()) {
            throw createError(
                    operation + " is not available through the SQL proxy",
                    ErrorCategory.CONFIGURATION,
                    "SQL_OPERATION_UNSUPPORTED",
                    null);
        }
    }

    private List<RawResult> toResults(
            List<ObjectNode> rows, Connection connection, Session session, Long totalCount, Integer page) {
        List<RawResult> results = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            ObjectNode row = rows.get(i);
            JsonNode id = row.get("id");
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("source", "sql");
            metadata.put("database", session.config().connection().databaseType().id());
            metadata.put("connectionId", connection.id());
            if (page != null) {
                metadata.put("page", page);
            }
            if (totalCount != null) {
                metadata.put("totalCount", totalCount);
            }
            String resultId = JsonPaths.isAbsent(id) || id.asText().isEmpty() ? "sql-" + i : id.asText();
            results.add(new RawResult(resultId, row, 1.0, List.of(), metadata));
        }
        return results;
    }

    private static SqlQueryConfig orderedBy(SqlQueryConfig config, String column, boolean forward) {
        return new SqlQueryConfig(
                config.tableName(), config.searchColumns(), config.selectColumns(), config.joins(),
                config.whereClause(), List.of(new SqlQueryConfig.Order(column, forward ? "ASC" : "DESC")),
                config.groupBy(), config.having());
    }

    private QueryBuilder builderFor(SqlDataSourceConfig config) {
        return new QueryBuilder(dialects.dialect(
                config.connection().databaseType(), config.connection().databaseVersion()));
    }

    private Session session(Connection connection) {
        requireActive(connection);
        Session session = sessions.get(connection.id());
        if (session == null) {
            throw createError("No SQL session for connection " + connection.id(),
                    ErrorCategory.CONNECTION, "CONNECTION_NOT_ACTIVE", null);
        }
        return session;
    }

    private static void closeQuietly(SqlExecutor executor, String connectionId) {
        if (executor == null) {
            return;
        }
        try {
            executor.close();
        } catch (RuntimeException e) {
            LOG.warn("Failed to close executor after connect failure for {}: {}", connectionId, e.getMessage());
        }
    }

    private record Session(
            SqlDataSourceConfig config,
            SqlExecutor executor,
            DatabaseDialect dialect,
            QueryBuilder builder,
            SecurityValidator validator) {}
}
