package io.querybridge.core.adapter;

import io.querybridge.core.config.DataSourceConfig;
import io.querybridge.core.config.DataSourceType;
import io.querybridge.core.error.ConfigValidationException;
import io.querybridge.core.error.ConnectionFailedException;
import io.querybridge.core.error.DataSourceException;
import io.querybridge.core.error.DataSourceFailureException;
import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.error.ErrorSeverity;
import io.querybridge.core.error.TransformedError;
import io.querybridge.core.model.Connection;
import io.querybridge.core.model.ConnectionMetrics;
import io.querybridge.core.model.ConnectionStatus;
import io.querybridge.core.model.RawResult;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection and metrics bookkeeping shared by the built-in adapters.
 *
 * <p>
 * Subclasses implement {@link #validate}, {@link #open} and {@link #query};
 * this class checks the config variant, tracks the connections it handed out
 * and keeps the last {@value #METRICS_PER_CONNECTION} metrics per connection.
 *
 * @param <C> the config variant this adapter accepts
 */
public abstract class AbstractDataSourceAdapter<C extends DataSourceConfig> implements DataSourceAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractDataSourceAdapter.class);

    static final int METRICS_PER_CONNECTION = 100;

    private final DataSourceType type;
    private final Class<C> configType;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, Deque<ConnectionMetrics>> metrics = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    protected AbstractDataSourceAdapter(DataSourceType type, Class<C> configType) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.configType = Objects.requireNonNull(configType, "configType must not be null");
    }

    @Override
    public final String type() {
        return type.id();
    }

    @Override
    public final void validateConfig(DataSourceConfig config) {
        validate(typed(config));
    }

    @Override
    public final Connection connect(DataSourceConfig config) {
        C typedConfig = typed(config);
        validate(typedConfig);
        long start = System.nanoTime();
        try {
            Connection connection = open(typedConfig);
            record(connection.id(), ConnectionMetrics.forConnect(elapsedMs(start), true));
            return connection;
        } catch (RuntimeException e) {
            LOG.debug("{} connect failed after {}ms: {}", type(), (long) elapsedMs(start), e.getMessage());
            throw e;
        }
    }

    @Override
    public final void disconnect(Connection connection) {
        if (connection == null || connections.remove(connection.id()) == null) {
            return;
        }
        try {
            close(connection);
        } finally {
            connection.updateStatus(ConnectionStatus.DISCONNECTED);
            metrics.remove(connection.id());
            LOG.debug("Disconnected {}", connection.id());
        }
    }

    @Override
    public boolean healthCheck(Connection connection) {
        return connection != null && connections.containsKey(connection.id()) && connection.isConnected();
    }

    @Override
    public void destroy() {
        disconnectAll();
    }

    /** Connections opened by this adapter and not yet disconnected. */
    public List<Connection> getActiveConnections() {
        return connections.values().stream().filter(Connection::isConnected).toList();
    }

    public Connection getConnection(String connectionId) {
        return connections.get(connectionId);
    }

    /** Recent metrics of one connection, oldest first. */
    public List<ConnectionMetrics> getConnectionMetrics(String connectionId) {
        Deque<ConnectionMetrics> deque = metrics.get(connectionId);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            return List.copyOf(deque);
        }
    }

    /** Recent metrics of every open connection. */
    public List<ConnectionMetrics> getConnectionMetrics() {
        List<ConnectionMetrics> all = new ArrayList<>();
        for (Deque<ConnectionMetrics> deque : metrics.values()) {
            synchronized (deque) {
                all.addAll(deque);
            }
        }
        return all;
    }

    /** Disconnects every tracked connection; a failure on one does not stop the others. */
    public void disconnectAll() {
        for (Connection connection : List.copyOf(connections.values())) {
            try {
                disconnect(connection);
            } catch (RuntimeException e) {
                LOG.warn("Failed to disconnect {}: {}", connection.id(), e.getMessage());
            }
        }
    }

    // --- subclass hooks ---

    /** Structural checks; must not perform I/O. */
    protected abstract void validate(C config);

    /** Opens a connection for an already validated config. Use {@link #newConnection}. */
    protected abstract Connection open(C config);

    /** Releases resources held for {@code connection}. */
    protected void close(Connection connection) {}

    // --- helpers ---

    /** Creates and tracks a connection in the {@code CONNECTING} state. */
    protected final Connection newConnection(Map<String, Object> metadata) {
        String id = type() + "_" + System.currentTimeMillis() + "_" + sequence.incrementAndGet();
        Connection connection = new Connection(id, type(), metadata);
        connections.put(id, connection);
        return connection;
    }

    /** Stops tracking a connection that failed to open. */
    protected final void discard(Connection connection) {
        connections.remove(connection.id());
        metrics.remove(connection.id());
        connection.updateStatus(ConnectionStatus.ERROR);
    }

    /**
     * Fails unless {@code connection} was opened by this adapter and is
     * connected.
     *
     * @throws ConnectionFailedException with code {@code CONNECTION_NOT_ACTIVE}
     */
    protected final void requireActive(Connection connection) {
        if (connection == null || !connections.containsKey(connection.id()) || !connection.isConnected()) {
            throw new ConnectionFailedException(
                    "Connection is not active: " + (connection == null ? null : connection.id()),
                    "CONNECTION_NOT_ACTIVE",
                    null,
                    Map.of("adapter", type()));
        }
    }

    /** Times {@code operation} and records a query metric for {@code connection}, on failure too. */
    protected final List<RawResult> executeWithMetrics(Connection connection, Supplier<List<RawResult>> operation) {
        long start = System.nanoTime();
        try {
            List<RawResult> results = operation.get();
            record(connection.id(), ConnectionMetrics.forQuery(elapsedMs(start), true, results.size()));
            connection.touch();
            return results;
        } catch (RuntimeException e) {
            record(connection.id(), ConnectionMetrics.forQuery(elapsedMs(start), false, 0));
            throw e;
        }
    }

    /**
     * Builds a classified adapter failure with recovery suggestions for
     * {@code category}.
     *
     * @param cause underlying failure, may be {@code null}
     */
    protected final DataSourceFailureException createError(
            String message, ErrorCategory category, String code, Throwable cause) {
        TransformedError.Builder builder = TransformedError.builder(category, code)
                .message(message)
                .technical(cause != null && cause.getMessage() != null ? cause.getMessage() : message);
        switch (category) {
            case CONNECTION, NETWORK -> builder
                    .suggestions(
                            "Check network connectivity",
                            "Verify connection configuration",
                            "Ensure service is running")
                    .retry(3, 1_000);
            case TIMEOUT -> builder
                    .suggestions(
                            "Increase timeout configuration",
                            "Optimize query complexity",
                            "Check system performance")
                    .retry(2, 5_000);
            case VALIDATION -> builder
                    .severity(ErrorSeverity.WARNING)
                    .suggestions("Check configuration format", "Verify required fields", "Review data types");
            case SECURITY -> builder.suggestions("Review the query for unsupported characters or keywords");
            default -> builder.suggestions("Check logs for details", "Try again later")
                    .recoverable(!(cause instanceof DataSourceException dse) || dse.retryable());
        }
        return new DataSourceFailureException(builder.build(), cause);
    }

    private C typed(DataSourceConfig config) {
        if (config == null) {
            throw new ConfigValidationException("Configuration must not be null", "type");
        }
        if (!configType.isInstance(config)) {
            throw new ConfigValidationException(
                    "Invalid configuration type for " + type() + " adapter: " + config.type().id(), "type");
        }
        return configType.cast(config);
    }

    private void record(String connectionId, ConnectionMetrics entry) {
        Deque<ConnectionMetrics> deque = metrics.computeIfAbsent(connectionId, k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(entry);
            while (deque.size() > METRICS_PER_CONNECTION) {
                deque.removeFirst();
            }
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
