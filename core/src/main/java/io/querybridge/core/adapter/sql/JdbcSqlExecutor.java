package io.querybridge.core.adapter.sql;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.querybridge.core.error.ConnectionFailedException;
import io.querybridge.core.error.QueryExecutionException;
import io.querybridge.core.sql.DatabaseDialect;
import io.querybridge.core.sql.DatabaseType;
import io.querybridge.core.sql.ParameterType;
import io.querybridge.core.sql.ParameterizedQuery;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SqlExecutor} over a single JDBC connection. The JDBC driver is
 * supplied by the application at runtime.
 *
 * <p>
 * Connection strings are translated to JDBC URLs: {@code postgresql://} and
 * {@code postgres://} become {@code jdbc:postgresql://}, {@code mysql://}
 * becomes {@code jdbc:mysql://}, {@code sqlite:path} and {@code *.db} paths
 * become {@code jdbc:sqlite:}, and {@code jdbc:} URLs are used as given.
 * Credentials in the URL are moved into driver properties.
 */
public final class JdbcSqlExecutor implements SqlExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcSqlExecutor.class);

    private final String connectionString;
    private final DatabaseType databaseType;
    private final long validationTimeoutMs;
    private final boolean ssl;
    private Connection connection;

    public JdbcSqlExecutor(String connectionString, DatabaseType databaseType, long validationTimeoutMs, boolean ssl) {
        this.connectionString = Objects.requireNonNull(connectionString, "connectionString must not be null");
        this.databaseType = Objects.requireNonNull(databaseType, "databaseType must not be null");
        this.validationTimeoutMs = validationTimeoutMs;
        this.ssl = ssl;
    }

    @Override
    public synchronized void open() {
        if (connection != null) {
            return;
        }
        JdbcTarget target = toJdbcTarget(connectionString, databaseType, ssl);
        try {
            connection = DriverManager.getConnection(target.url(), target.properties());
            LOG.debug("Opened JDBC connection to {}", DatabaseDialect.redactConnectionString(target.url()));
        } catch (SQLException e) {
            throw new ConnectionFailedException(
                    "Failed to open database connection: " + e.getMessage(),
                    "JDBC_CONNECT_FAILED",
                    e,
                    Map.of("url", DatabaseDialect.redactConnectionString(connectionString)));
        }
    }

    @Override
    public SqlRows search(SearchCommand command) {
        return SqlRows.of(query(command.query()));
    }

    @Override
    public synchronized List<ObjectNode> query(ParameterizedQuery query) {
        Connection conn = requireOpen();
        Rewritten rewritten = rewritePlaceholders(query.sql());
        try (PreparedStatement statement = conn.prepareStatement(rewritten.sql())) {
            bind(statement, query, rewritten.order());
            try (ResultSet rs = statement.executeQuery()) {
                return toRows(rs);
            }
        } catch (SQLException e) {
            throw new QueryExecutionException("SQL query failed: " + e.getMessage(), "SQL_QUERY_FAILED", e);
        }
    }

    @Override
    public synchronized int update(ParameterizedQuery query) {
        Connection conn = requireOpen();
        Rewritten rewritten = rewritePlaceholders(query.sql());
        try (PreparedStatement statement = conn.prepareStatement(rewritten.sql())) {
            bind(statement, query, rewritten.order());
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new QueryExecutionException("SQL update failed: " + e.getMessage(), "SQL_UPDATE_FAILED", e);
        }
    }

    @Override
    public synchronized void ping() {
        Connection conn = requireOpen();
        try (Statement statement = conn.createStatement()) {
            statement.setQueryTimeout((int) Math.max(1, (validationTimeoutMs + 999) / 1000));
            try (ResultSet rs = statement.executeQuery("SELECT 1")) {
                if (!rs.next()) {
                    throw new ConnectionFailedException("Database returned no row for SELECT 1", "JDBC_PING_FAILED", null);
                }
            }
        } catch (SQLException e) {
            throw new ConnectionFailedException("Database did not answer: " + e.getMessage(), "JDBC_PING_FAILED", e);
        }
    }

    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw new ConnectionFailedException("Failed to close database connection: " + e.getMessage(),
                    "JDBC_CLOSE_FAILED", e);
        } finally {
            connection = null;
        }
    }

    private Connection requireOpen() {
        if (connection == null) {
            throw new ConnectionFailedException("JDBC connection is not open", "JDBC_NOT_OPEN", null);
        }
        return connection;
    }

    // --- URL translation ---

    /** JDBC URL plus driver properties. */
    record JdbcTarget(String url, Properties properties) {}

    static JdbcTarget toJdbcTarget(String connectionString, DatabaseType type, boolean ssl) {
        String raw = connectionString.trim();
        String lower = raw.toLowerCase(Locale.ROOT);
        Properties props = new Properties();
        String url;
        if (lower.startsWith("jdbc:")) {
            url = raw;
        } else if (lower.startsWith("postgresql://") || lower.startsWith("postgres://")) {
            url = "jdbc:postgresql://" + extractCredentials(raw.substring(raw.indexOf("://") + 3), props);
        } else if (lower.startsWith("mysql://")) {
            url = "jdbc:mysql://" + extractCredentials(raw.substring("mysql://".length()), props);
        } else if (lower.startsWith("sqlite://")) {
            url = "jdbc:sqlite:" + raw.substring("sqlite://".length());
        } else if (lower.startsWith("sqlite:")) {
            url = "jdbc:sqlite:" + raw.substring("sqlite:".length());
        } else if (type == DatabaseType.SQLITE || lower.endsWith(".db") || lower.endsWith(".sqlite")) {
            url = "jdbc:sqlite:" + raw;
        } else {
            throw new ConnectionFailedException(
                    "Unsupported connection string format for " + type.id(),
                    "JDBC_URL_UNSUPPORTED",
                    null,
                    Map.of("url", DatabaseDialect.redactConnectionString(raw)));
        }
        if (ssl && !url.toLowerCase(Locale.ROOT).contains("ssl")) {
            if (type == DatabaseType.POSTGRESQL) {
                props.setProperty("sslmode", "require");
            } else if (type == DatabaseType.MYSQL) {
                props.setProperty("sslMode", "REQUIRED");
            }
        }
        return new JdbcTarget(url, props);
    }

    private static String extractCredentials(String afterScheme, Properties props) {
        int at = afterScheme.indexOf('@');
        int slash = afterScheme.indexOf('/');
        if (at < 0 || (slash >= 0 && slash < at)) {
            return afterScheme;
        }
        String userInfo = afterScheme.substring(0, at);
        int colon = userInfo.indexOf(':');
        String user = colon < 0 ? userInfo : userInfo.substring(0, colon);
        props.setProperty("user", URLDecoder.decode(user, StandardCharsets.UTF_8));
        if (colon >= 0) {
            props.setProperty("password", URLDecoder.decode(userInfo.substring(colon + 1), StandardCharsets.UTF_8));
        }
        return afterScheme.substring(at + 1);
    }

    // --- placeholders ---

    /**
     * SQL with JDBC {@code ?} markers.
     *
     * @param order zero-based parameter index bound to each marker, in marker order
     */
    record Rewritten(String sql, List<Integer> order) {}

    /**
     * Rewrites {@code $n} placeholders to {@code ?} outside quoted literals and
     * identifiers. Plain {@code ?} markers bind parameters in sequence.
     */
    static Rewritten rewritePlaceholders(String sql) {
        StringBuilder out = new StringBuilder(sql.length());
        List<Integer> order = new ArrayList<>();
        int sequential = 0;
        char quote = 0;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (c == quote) {
                    if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                        out.append(sql.charAt(++i));
                    } else {
                        quote = 0;
                    }
                }
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                quote = c;
                out.append(c);
            } else if (c == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
                int j = i + 1;
                while (j < sql.length() && Character.isDigit(sql.charAt(j))) {
                    j++;
                }
                order.add(Integer.parseInt(sql.substring(i + 1, j)) - 1);
                out.append('?');
                i = j - 1;
            } else if (c == '?') {
                order.add(sequential++);
                out.append(c);
            } else {
                out.append(c);
            }
        }
        return new Rewritten(out.toString(), order);
    }

    private static void bind(PreparedStatement statement, ParameterizedQuery query, List<Integer> order)
            throws SQLException {
        for (int marker = 0; marker < order.size(); marker++) {
            int index = order.get(marker);
            if (index < 0 || index >= query.parameters().size()) {
                throw new QueryExecutionException(
                        "Placeholder refers to missing parameter " + (index + 1), "SQL_PARAMETER_MISMATCH", null);
            }
            bindOne(statement, marker + 1, query.parameters().get(index), query.parameterTypes().get(index));
        }
    }

    private static void bindOne(PreparedStatement statement, int position, Object value, ParameterType type)
            throws SQLException {
        if (value == null) {
            statement.setNull(position, Types.NULL);
            return;
        }
        switch (type) {
            case VARCHAR, TEXT -> statement.setString(position, value.toString());
            case INTEGER -> {
                if (value instanceof BigInteger big) {
                    statement.setBigDecimal(position, new BigDecimal(big));
                } else if (value instanceof BigDecimal dec) {
                    statement.setBigDecimal(position, dec);
                } else {
                    statement.setLong(position, ((Number) value).longValue());
                }
            }
            case DECIMAL -> {
                if (value instanceof BigDecimal dec) {
                    statement.setBigDecimal(position, dec);
                } else {
                    statement.setDouble(position, ((Number) value).doubleValue());
                }
            }
            case BOOLEAN -> statement.setBoolean(position, (Boolean) value);
            case TIMESTAMP -> statement.setTimestamp(position, toTimestamp(value));
            default -> statement.setObject(position, value);
        }
    }

    private static Timestamp toTimestamp(Object value) {
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        if (value instanceof LocalDateTime ldt) {
            return Timestamp.valueOf(ldt);
        }
        if (value instanceof LocalDate date) {
            return Timestamp.valueOf(date.atStartOfDay());
        }
        if (value instanceof OffsetDateTime odt) {
            return Timestamp.from(odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Timestamp.from(zdt.toInstant());
        }
        if (value instanceof Date date) {
            return new Timestamp(date.getTime());
        }
        throw new QueryExecutionException(
                "Unsupported timestamp parameter type: " + value.getClass().getName(), "SQL_PARAMETER_TYPE", null);
    }

    // --- rows ---

    private static List<ObjectNode> toRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<ObjectNode> rows = new ArrayList<>();
        while (rs.next()) {
            ObjectNode row = JsonNodeFactory.instance.objectNode();
            for (int i = 1; i <= columns; i++) {
                putValue(row, meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private static void putValue(ObjectNode row, String name, Object value) {
        if (value == null) {
            row.putNull(name);
        } else if (value instanceof Integer v) {
            row.put(name, v);
        } else if (value instanceof Long v) {
            row.put(name, v);
        } else if (value instanceof Short v) {
            row.put(name, v);
        } else if (value instanceof BigInteger v) {
            row.put(name, v);
        } else if (value instanceof BigDecimal v) {
            row.put(name, v);
        } else if (value instanceof Double v) {
            row.put(name, v);
        } else if (value instanceof Float v) {
            row.put(name, v);
        } else if (value instanceof Boolean v) {
            row.put(name, v);
        } else if (value instanceof Timestamp v) {
            row.put(name, v.toInstant().toString());
        } else if (value instanceof java.sql.Date v) {
            row.put(name, v.toLocalDate().toString());
        } else {
            row.put(name, value.toString());
        }
    }
}
