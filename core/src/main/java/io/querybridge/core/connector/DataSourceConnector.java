package io.querybridge.core.connector;

import io.querybridge.core.adapter.DataSourceAdapter;
import io.querybridge.core.config.ConnectionOptions;
import io.querybridge.core.config.DataSourceConfig;
import io.querybridge.core.config.DataSourceType;
import io.querybridge.core.error.DataSourceFailureException;
import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.error.ErrorContext;
import io.querybridge.core.error.ErrorMapper;
import io.querybridge.core.error.RateLimitExceededException;
import io.querybridge.core.error.SecurityViolationException;
import io.querybridge.core.error.TransformedError;
import io.querybridge.core.model.Connection;
import io.querybridge.core.model.ConnectionMetrics;
import io.querybridge.core.model.ProcessedQuery;
import io.querybridge.core.model.RawResult;
import io.querybridge.core.pool.ConnectionPool;
import io.querybridge.core.pool.PoolEntry;
import io.querybridge.core.pool.PoolStats;
import io.querybridge.core.pool.PooledResourceFactory;
import io.querybridge.core.spi.ConnectorListener;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for talking to data sources.
 *
 * <p>
 * The connector picks the adapter for a config's type, validates the config,
 * enforces the connector-level security policy (input validation for sql and
 * api sources, query screening and a fixed-window rate limit per adapter type)
 * and then delegates. Connections are pooled per config when
 * {@code options.pooling.enabled} is set. Every connect and query call is
 * recorded in the metrics, failures included, and every failure leaving the
 * connector is a {@link DataSourceFailureException}.
 *
 * <p>
 * Thread-safe.
 */
public final class DataSourceConnector implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DataSourceConnector.class);

    private final AdapterRegistry adapters;
    private final ErrorMapper errorMapper;
    private final ConnectorListener listener;
    private final Clock clock;
    private final ConnectorSettings settings;

    private final Map<DataSourceConfig, ConnectionPool<Connection>> pools = new ConcurrentHashMap<>();
    private final Map<String, PoolEntry<Connection>> leased = new ConcurrentHashMap<>();
    private final Map<String, DataSourceConfig> configs = new ConcurrentHashMap<>();
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Deque<ConnectionMetrics> metrics = new ArrayDeque<>();
    private final AtomicInteger poolSequence = new AtomicInteger();

    public DataSourceConnector() {
        this(new AdapterRegistry(), new ErrorMapper(), ConnectorListener.NOOP, Clock.systemUTC(), ConnectorSettings.DEFAULT);
    }

    public DataSourceConnector(
            AdapterRegistry adapters,
            ErrorMapper errorMapper,
            ConnectorListener listener,
            Clock clock,
            ConnectorSettings settings) {
        this.adapters = Objects.requireNonNull(adapters, "adapters must not be null");
        this.errorMapper = Objects.requireNonNull(errorMapper, "errorMapper must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public void registerAdapter(String type, Supplier<? extends DataSourceAdapter> factory) {
        adapters.register(type, factory);
    }

    public Set<String> registeredTypes() {
        return adapters.types();
    }

    public ErrorMapper errorMapper() {
        return errorMapper;
    }

    /**
     * Opens a connection for {@code config}, leased from its pool when pooling
     * is enabled.
     *
     * @throws DataSourceFailureException on any failure
     */
    public Connection connect(DataSourceConfig config) {
        String type = typeOf(config);
        long start = System.nanoTime();
        try {
            DataSourceAdapter adapter = adapters.adapter(type);
            adapter.validateConfig(config);
            checkSecurityConfig(config);
            Connection connection;
            boolean pooled = config.options().pooling().enabled();
            if (pooled) {
                PoolEntry<Connection> entry = poolFor(config, adapter).acquire();
                connection = entry.resource();
                leased.put(connection.id(), entry);
            } else {
                connection = adapter.connect(config);
            }
            configs.put(connection.id(), config);
            long elapsed = elapsedMs(start);
            record(ConnectionMetrics.forConnect(elapsed, true));
            notifyConnect(new ConnectorListener.ConnectCompleted(type, connection.id(), pooled, elapsed));
            return connection;
        } catch (RuntimeException e) {
            record(ConnectionMetrics.forConnect(elapsedMs(start), false));
            throw fail(e, type, "connect", start);
        }
    }

    /**
     * Runs {@code query} on an open connection.
     *
     * @throws DataSourceFailureException on any failure, including rate-limit and screening
     *     rejections
     */
    public List<RawResult> query(Connection connection, ProcessedQuery query) {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(query, "query must not be null");
        String type = connection.adapterType();
        long start = System.nanoTime();
        try {
            ConnectionOptions.Security security = securityFor(connection);
            checkRateLimit(type, security.rateLimitRpm());
            if (security.sanitizeQueries()) {
                screen(query);
            }
            List<RawResult> results = adapters.adapter(type).query(connection, query);
            long elapsed = elapsedMs(start);
            record(ConnectionMetrics.forQuery(elapsed, true, results.size()));
            notifyQuery(new ConnectorListener.QueryCompleted(type, connection.id(), results.size(), elapsed));
            return results;
        } catch (RuntimeException e) {
            record(ConnectionMetrics.forQuery(elapsedMs(start), false, 0));
            throw fail(e, type, "query", start);
        }
    }

    /** Convenience for {@link #query(Connection, ProcessedQuery)} with plain text. */
    public List<RawResult> query(Connection connection, String text) {
        return query(connection, ProcessedQuery.of(text));
    }

    /** Returns a pooled connection to its pool, or closes a direct one. */
    public void disconnect(Connection connection) {
        Objects.requireNonNull(connection, "connection must not be null");
        configs.remove(connection.id());
        PoolEntry<Connection> entry = leased.remove(connection.id());
        try {
            if (entry != null) {
                entry.close();
            } else {
                adapters.adapter(connection.adapterType()).disconnect(connection);
            }
        } catch (RuntimeException e) {
            throw errorMapper.toFailure(e, ErrorContext.of(connection.adapterType(), "disconnect"));
        }
    }

    /**
     * Connects, queries and disconnects. With pooling enabled the query runs
     * under the pool's retry policy on a leased connection.
     */
    public List<RawResult> executeQuery(DataSourceConfig config, ProcessedQuery query) {
        String type = typeOf(config);
        if (config.options().pooling().enabled()) {
            long start = System.nanoTime();
            ConnectionPool<Connection> pool;
            try {
                DataSourceAdapter adapter = adapters.adapter(type);
                adapter.validateConfig(config);
                checkSecurityConfig(config);
                pool = poolFor(config, adapter);
            } catch (RuntimeException e) {
                record(ConnectionMetrics.forConnect(elapsedMs(start), false));
                throw fail(e, type, "executeQuery", start);
            }
            try {
                return pool.executeWithRetry(connection -> {
                    record(ConnectionMetrics.forConnect(elapsedMs(start), true));
                    configs.put(connection.id(), config);
                    try {
                        return query(connection, query);
                    } finally {
                        configs.remove(connection.id());
                    }
                });
            } catch (DataSourceFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                // no lease was obtained
                record(ConnectionMetrics.forConnect(elapsedMs(start), false));
                throw fail(e, type, "executeQuery", start);
            }
        }
        Connection connection = connect(config);
        try {
            return query(connection, query);
        } finally {
            try {
                disconnect(connection);
            } catch (DataSourceFailureException e) {
                LOG.warn("Disconnect after executeQuery failed for {}: {}", connection.id(), e.getMessage());
            }
        }
    }

    /** Connects, runs the adapter health check and disconnects. Never throws for data-source failures. */
    public ConnectionTestResult testConnection(DataSourceConfig config) {
        long start = System.nanoTime();
        Connection connection;
        try {
            connection = connect(config);
        } catch (DataSourceFailureException e) {
            return new ConnectionTestResult(false, elapsedMs(start), null, e.error());
        }
        double latency = elapsedMs(start);
        DataSourceAdapter adapter = adapters.adapter(connection.adapterType());
        boolean healthy = adapter.healthCheck(connection);
        try {
            disconnect(connection);
        } catch (DataSourceFailureException e) {
            LOG.warn("Disconnect after connection test failed for {}: {}", connection.id(), e.getMessage());
        }
        return new ConnectionTestResult(healthy, latency, adapter.getCapabilities(), null);
    }

    /** Most recent connect and query metrics, oldest first. */
    public List<ConnectionMetrics> metrics() {
        synchronized (metrics) {
            return List.copyOf(metrics);
        }
    }

    public void clearMetrics() {
        synchronized (metrics) {
            metrics.clear();
        }
    }

    /** Statistics per pool, keyed by pool name. */
    public Map<String, PoolStats> poolStats() {
        Map<String, PoolStats> stats = new TreeMap<>();
        pools.values().forEach(pool -> stats.put(pool.name(), pool.getStats()));
        return stats;
    }

    /** Destroys every pool and adapter and forgets all state. Registrations are kept. */
    public void destroy() {
        List<ConnectionPool<Connection>> toDestroy = new ArrayList<>(pools.values());
        pools.clear();
        leased.clear();
        for (ConnectionPool<Connection> pool : toDestroy) {
            try {
                pool.destroy();
            } catch (RuntimeException e) {
                LOG.warn("Failed to destroy pool '{}': {}", pool.name(), e.getMessage());
            }
        }
        adapters.destroyAll();
        configs.clear();
        windows.clear();
        clearMetrics();
        LOG.info("Connector destroyed ({} pools)", toDestroy.size());
    }

    @Override
    public void close() {
        destroy();
    }

    // --- internals ---

    private static void checkSecurityConfig(DataSourceConfig config) {
        boolean sensitive = config.type() == DataSourceType.SQL || config.type() == DataSourceType.API;
        if (sensitive && !config.options().security().validateInput()) {
            throw new SecurityViolationException(
                    "Input validation is required for SQL and API adapters",
                    "INPUT_VALIDATION_REQUIRED",
                    List.of("security.validateInput=false"));
        }
    }

    private void checkRateLimit(String type, int limit) {
        long now = clock.millis();
        Window window = windows.computeIfAbsent(type, t -> new Window());
        int count;
        long resetAt;
        synchronized (window) {
            if (now >= window.resetAt) {
                window.count = 0;
                window.resetAt = now + settings.rateLimitWindowMs();
            }
            count = ++window.count;
            resetAt = window.resetAt;
        }
        if (count > limit) {
            LOG.warn("Rate limit exceeded for {}: {}/{} requests per window", type, count, limit);
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("adapterType", type);
            context.put("currentCount", count);
            context.put("limit", limit);
            context.put("resetTime", resetAt);
            throw new RateLimitExceededException(
                    "Rate limit exceeded for " + type + ": " + count + "/" + limit + " requests per minute",
                    resetAt - now,
                    context);
        }
    }

    private static void screen(ProcessedQuery query) {
        List<String> threats = QueryScreen.threats(query);
        if (!threats.isEmpty()) {
            LOG.warn("Security threat detected in query: {}", threats);
            throw new SecurityViolationException(
                    "Security threats detected: " + String.join(", ", threats), "QUERY_REJECTED", threats);
        }
    }

    private ConnectionOptions.Security securityFor(Connection connection) {
        DataSourceConfig config = configs.get(connection.id());
        return config == null ? ConnectionOptions.Security.DEFAULT : config.options().security();
    }

    private ConnectionPool<Connection> poolFor(DataSourceConfig config, DataSourceAdapter adapter) {
        return pools.computeIfAbsent(config, c -> new ConnectionPool<>(
                c.type().id() + "-" + poolSequence.incrementAndGet(),
                new AdapterConnectionFactory(adapter, c),
                c.options().toPoolSettings()));
    }

    private DataSourceFailureException fail(RuntimeException error, String type, String operation, long start) {
        DataSourceFailureException failure = errorMapper.toFailure(error, ErrorContext.of(type, operation));
        if (failure.error().category() == ErrorCategory.SECURITY) {
            LOG.warn("{} on {} rejected: {}", operation, type, failure.getMessage());
        } else {
            LOG.debug("{} on {} failed: {}", operation, type, failure.getMessage());
        }
        notifyFailure(new ConnectorListener.OperationFailed(
                type, operation, failure.error().category(), failure.error().code(), elapsedMs(start)));
        return failure;
    }

    private void record(ConnectionMetrics entry) {
        synchronized (metrics) {
            metrics.addLast(entry);
            while (metrics.size() > settings.metricsHistory()) {
                metrics.removeFirst();
            }
        }
    }

    private void notifyConnect(ConnectorListener.ConnectCompleted event) {
        try {
            listener.onConnectCompleted(event);
        } catch (RuntimeException e) {
            LOG.warn("ConnectorListener.onConnectCompleted failed: {}", e.getMessage());
        }
    }

    private void notifyQuery(ConnectorListener.QueryCompleted event) {
        try {
            listener.onQueryCompleted(event);
        } catch (RuntimeException e) {
            LOG.warn("ConnectorListener.onQueryCompleted failed: {}", e.getMessage());
        }
    }

    private void notifyFailure(ConnectorListener.OperationFailed event) {
        try {
            listener.onOperationFailed(event);
        } catch (RuntimeException e) {
            LOG.warn("ConnectorListener.onOperationFailed failed: {}", e.getMessage());
        }
    }

    private static String typeOf(DataSourceConfig config) {
        if (config == null) {
            throw new DataSourceFailureException(
                    TransformedError.builder(ErrorCategory.VALIDATION, "INVALID_CONFIG")
                            .message("Data source type is required")
                            .build(),
                    null);
        }
        return config.type().id();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static final class Window {
        private int count;
        private long resetAt;
    }

    /** Pool resources are adapter connections for one config. */
    private static final class AdapterConnectionFactory implements PooledResourceFactory<Connection> {

        private final DataSourceAdapter adapter;
        private final DataSourceConfig config;

        AdapterConnectionFactory(DataSourceAdapter adapter, DataSourceConfig config) {
            this.adapter = adapter;
            this.config = config;
        }

        @Override
        public Connection create() {
            return adapter.connect(config);
        }

        @Override
        public boolean validate(Connection resource) {
            try {
                return adapter.healthCheck(resource);
            } catch (RuntimeException e) {
                LOG.debug("Pooled connection {} failed validation: {}", resource.id(), e.getMessage());
                return false;
            }
        }

        @Override
        public void destroy(Connection resource) {
            adapter.disconnect(resource);
        }
    }
}
