package io.querybridge.core.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.querybridge.core.DataSources;
import io.querybridge.core.adapter.DataSourceAdapter;
import io.querybridge.core.adapter.memory.MemoryAdapter;
import io.querybridge.core.config.ApiDataSourceConfig;
import io.querybridge.core.config.ConnectionOptions;
import io.querybridge.core.config.DataSourceConfig;
import io.querybridge.core.config.MemoryDataSourceConfig;
import io.querybridge.core.error.ConnectionFailedException;
import io.querybridge.core.error.DataSourceFailureException;
import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.error.ErrorMapper;
import io.querybridge.core.model.Connection;
import io.querybridge.core.model.ConnectionMetrics;
import io.querybridge.core.model.ConnectionStatus;
import io.querybridge.core.model.ProcessedQuery;
import io.querybridge.core.model.RawResult;
import io.querybridge.core.pool.PoolStats;
import io.querybridge.core.spi.ConnectorListener;
import io.querybridge.core.testing.MutableClock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DataSourceConnector")
class DataSourceConnectorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final RecordingListener listener = new RecordingListener();
    private MutableClock clock;
    private DataSourceConnector connector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000_000L);
        connector = newConnector(ConnectorSettings.DEFAULT);
    }

    @AfterEach
    void tearDown() {
        connector.close();
    }

    private DataSourceConnector newConnector(ConnectorSettings settings) {
        DataSourceConnector created =
                new DataSourceConnector(new AdapterRegistry(), new ErrorMapper(), listener, clock, settings);
        created.registerAdapter("memory", MemoryAdapter::new);
        return created;
    }

    private static MemoryDataSourceConfig products() {
        return MemoryDataSourceConfig.of(
                List.of(
                        json("{\"id\":1,\"name\":\"Blue pen\"}"),
                        json("{\"id\":2,\"name\":\"Red pen\"}"),
                        json("{\"id\":3,\"name\":\"Notebook\"}")),
                "name");
    }

    private static MemoryDataSourceConfig products(ConnectionOptions.Security security) {
        return products().withOptions(ConnectionOptions.DEFAULT.withSecurity(security));
    }

    private static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    private static Connection connected(String id, String type) {
        Connection connection = new Connection(id, type, Map.of());
        connection.updateStatus(ConnectionStatus.CONNECTED);
        return connection;
    }

    @Nested
    @DisplayName("connect and query")
    class Basics {

        @Test
        void connectQueryDisconnect() {
            Connection connection = connector.connect(products());

            List<RawResult> results = connector.query(connection, "pen");
            connector.disconnect(connection);

            assertThat(results).hasSize(2);
            assertThat(connection.status()).isEqualTo(ConnectionStatus.DISCONNECTED);
            assertThat(connector.metrics()).hasSize(2).allSatisfy(m -> assertThat(m.success()).isTrue());
            assertThat(listener.connects).singleElement().satisfies(e -> {
                assertThat(e.adapterType()).isEqualTo("memory");
                assertThat(e.pooled()).isFalse();
            });
            assertThat(listener.queries).singleElement().satisfies(e -> assertThat(e.resultCount()).isEqualTo(2));
        }

        @Test
        void executeQueryClosesItsConnection() {
            List<RawResult> results = connector.executeQuery(products(), ProcessedQuery.of("notebook"));

            assertThat(results).extracting(r -> r.data().get("id").asInt()).containsExactly(3);
            assertThat(listener.connects).hasSize(1);
        }

        @Test
        void unknownTypeIsValidationFailure() {
            DataSourceConnector empty =
                    new DataSourceConnector(new AdapterRegistry(), new ErrorMapper(), listener, clock, ConnectorSettings.DEFAULT);

            assertThatThrownBy(() -> empty.connect(products()))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessageContaining("Unsupported data source type: memory")
                    .satisfies(e -> {
                        DataSourceFailureException failure = (DataSourceFailureException) e;
                        assertThat(failure.error().category()).isEqualTo(ErrorCategory.VALIDATION);
                        assertThat(failure.error().code()).isEqualTo("INVALID_CONFIG");
                    });
            assertThat(empty.metrics()).singleElement().satisfies(m -> assertThat(m.success()).isFalse());
            assertThat(listener.failures).singleElement().satisfies(e -> {
                assertThat(e.operation()).isEqualTo("connect");
                assertThat(e.code()).isEqualTo("INVALID_CONFIG");
            });
        }

        @Test
        void nullConfigIsRejected() {
            assertThatThrownBy(() -> connector.connect(null))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessage("Data source type is required");
        }

        @Test
        void builtInsAreRegistered() {
            try (DataSourceConnector defaults = DataSources.newConnector()) {
                assertThat(defaults.registeredTypes()).containsExactly("api", "memory", "sql");
            }
        }

        @Test
        void metricsHistoryIsBounded() {
            DataSourceConnector small = newConnector(new ConnectorSettings(2, 60_000));
            Connection connection = small.connect(products());
            small.query(connection, "pen");
            small.query(connection, "notebook");

            List<ConnectionMetrics> metrics = small.metrics();
            assertThat(metrics).hasSize(2);
            assertThat(metrics.get(1).resultCount()).isEqualTo(1);

            small.clearMetrics();
            assertThat(small.metrics()).isEmpty();
            small.close();
        }
    }

    @Nested
    @DisplayName("security policy")
    class SecurityPolicy {

        @Test
        void scriptInQueryIsRejected() {
            Connection connection = connector.connect(products());

            assertThatThrownBy(() -> connector.query(connection, "<script>alert(1)</script>"))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessage("Security threats detected: XSS")
                    .satisfies(e -> {
                        DataSourceFailureException failure = (DataSourceFailureException) e;
                        assertThat(failure.error().category()).isEqualTo(ErrorCategory.SECURITY);
                        assertThat(failure.error().code()).isEqualTo("QUERY_REJECTED");
                        assertThat(failure.error().recoverable()).isFalse();
                    });
        }

        @Test
        void sqlInjectionMarkersAreRejected() {
            Connection connection = connector.connect(products());

            assertThatThrownBy(() -> connector.query(connection, "pen' OR '1'='1"))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessage("Security threats detected: SQL Injection");
            assertThatThrownBy(() -> connector.query(connection, "pen; DROP TABLE products"))
                    .hasMessage("Security threats detected: SQL Injection");
        }

        @Test
        void screeningCanBeDisabledPerSource() {
            Connection connection = connector.connect(products(new ConnectionOptions.Security(true, false, 1_000)));

            assertThat(connector.query(connection, "pen -- comment")).isEmpty();
        }

        @Test
        void rateLimitIsPerAdapterTypeAndWindow() {
            MemoryDataSourceConfig config = products(new ConnectionOptions.Security(true, true, 2));
            Connection first = connector.connect(config);
            Connection second = connector.connect(config);
            connector.query(first, "pen");
            connector.query(second, "pen");

            assertThatThrownBy(() -> connector.query(first, "pen"))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessage("Rate limit exceeded for memory: 3/2 requests per minute")
                    .satisfies(e -> assertThat(((DataSourceFailureException) e).error().code()).isEqualTo("RATE_LIMITED"));

            clock.advanceMillis(60_000);
            assertThat(connector.query(first, "pen")).hasSize(2);
        }

        @Test
        void remoteSourcesRequireInputValidation() {
            DataSourceAdapter api = mock(DataSourceAdapter.class);
            connector.registerAdapter("api", () -> api);
            ApiDataSourceConfig config = ApiDataSourceConfig.builder("https://api.example.com/search")
                    .options(ConnectionOptions.DEFAULT.withSecurity(new ConnectionOptions.Security(false, true, 10)))
                    .build();

            assertThatThrownBy(() -> connector.connect(config))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessage("Input validation is required for SQL and API adapters")
                    .satisfies(e -> assertThat(((DataSourceFailureException) e).error().code())
                            .isEqualTo("INPUT_VALIDATION_REQUIRED"));
            verify(api, times(0)).connect(any(DataSourceConfig.class));
        }
    }

    @Nested
    @DisplayName("pooling")
    class PooledConnections {

        private final MemoryDataSourceConfig pooled = products()
                .withOptions(ConnectionOptions.DEFAULT.withPooling(ConnectionOptions.Pooling.enabled(2)));

        @Test
        void connectionsAreLeasedAndReturned() {
            Connection first = connector.connect(pooled);
            Connection second = connector.connect(pooled);

            Map<String, PoolStats> stats = connector.poolStats();
            assertThat(stats).containsOnlyKeys("memory-1");
            assertThat(stats.get("memory-1").active()).isEqualTo(2);
            assertThat(listener.connects).allSatisfy(e -> assertThat(e.pooled()).isTrue());

            connector.disconnect(first);
            connector.disconnect(second);

            PoolStats after = connector.poolStats().get("memory-1");
            assertThat(after.active()).isZero();
            assertThat(after.idle()).isEqualTo(2);
            assertThat(first.isConnected()).isTrue();
        }

        @Test
        void executeQueryRetriesConnectionFailures() {
            DataSourceAdapter api = mock(DataSourceAdapter.class);
            AtomicInteger created = new AtomicInteger();
            when(api.connect(any(DataSourceConfig.class)))
                    .thenAnswer(inv -> connected("api_" + created.incrementAndGet(), "api"));
            when(api.healthCheck(any(Connection.class))).thenReturn(true);
            RawResult hit = new RawResult("r1", json("{\"id\":\"r1\"}"), 1.0, List.of(), Map.of());
            when(api.query(any(Connection.class), any(ProcessedQuery.class)))
                    .thenThrow(new ConnectionFailedException("socket closed", "REQUEST_FAILED", null))
                    .thenReturn(List.of(hit));
            connector.registerAdapter("api", () -> api);
            ApiDataSourceConfig config = ApiDataSourceConfig.builder("https://api.example.com/search")
                    .options(ConnectionOptions.DEFAULT
                            .withPooling(ConnectionOptions.Pooling.enabled(2))
                            .withRetry(new ConnectionOptions.Retry(3, 1, 1)))
                    .build();

            List<RawResult> results = connector.executeQuery(config, ProcessedQuery.of("pen"));

            assertThat(results).containsExactly(hit);
            verify(api, times(2)).query(any(Connection.class), any(ProcessedQuery.class));
            assertThat(listener.failures).singleElement().satisfies(e -> {
                assertThat(e.operation()).isEqualTo("query");
                assertThat(e.category()).isEqualTo(ErrorCategory.CONNECTION);
            });
        }

        @Test
        void executeQueryRecordsFailedLeaseWhenPoolIsExhausted() {
            MemoryDataSourceConfig single = products().withOptions(ConnectionOptions.DEFAULT
                    .withPooling(ConnectionOptions.Pooling.enabled(1))
                    .withRetry(new ConnectionOptions.Retry(1, 1, 1)));
            connector.connect(single);

            assertThatThrownBy(() -> connector.executeQuery(single, ProcessedQuery.of("pen")))
                    .isInstanceOf(DataSourceFailureException.class);

            assertThat(connector.metrics()).hasSize(2);
            assertThat(connector.metrics().get(1)).satisfies(m -> {
                assertThat(m.success()).isFalse();
                assertThat(m.connectionTimeMs()).isPositive();
                assertThat(m.resultCount()).isZero();
            });
        }

        @Test
        void executeQueryRecordsTheLease() {
            List<RawResult> results = connector.executeQuery(pooled, ProcessedQuery.of("pen"));

            assertThat(results).hasSize(2);
            assertThat(connector.metrics()).hasSize(2).allSatisfy(m -> assertThat(m.success()).isTrue());
            assertThat(connector.metrics().get(0).queryTimeMs()).isZero();
        }

        @Test
        void destroyClosesPoolsAndAdapters() {
            DataSourceAdapter api = mock(DataSourceAdapter.class);
            when(api.connect(any(DataSourceConfig.class))).thenAnswer(inv -> connected("api_1", "api"));
            when(api.healthCheck(any(Connection.class))).thenReturn(true);
            connector.registerAdapter("api", () -> api);
            ApiDataSourceConfig config = ApiDataSourceConfig.builder("https://api.example.com/search")
                    .options(ConnectionOptions.DEFAULT.withPooling(ConnectionOptions.Pooling.enabled(1)))
                    .build();
            connector.connect(config);

            connector.destroy();

            assertThat(connector.poolStats()).isEmpty();
            verify(api).destroy();
            assertThat(connector.registeredTypes()).contains("api", "memory");
        }
    }

    @Nested
    @DisplayName("testConnection")
    class TestConnection {

        @Test
        void healthyMemorySource() {
            ConnectionTestResult result = connector.testConnection(products());

            assertThat(result.success()).isTrue();
            assertThat(result.error()).isNull();
            assertThat(result.capabilities()).isNotNull();
            assertThat(result.latencyMs()).isGreaterThanOrEqualTo(0);
        }

        @Test
        void failedConnectIsReportedNotThrown() {
            DataSourceAdapter api = mock(DataSourceAdapter.class);
            when(api.connect(any(DataSourceConfig.class)))
                    .thenThrow(new ConnectionFailedException("Connection refused", "API_CONNECT_FAILED", null));
            connector.registerAdapter("api", () -> api);

            ConnectionTestResult result =
                    connector.testConnection(ApiDataSourceConfig.builder("https://api.example.com").build());

            assertThat(result.success()).isFalse();
            assertThat(result.capabilities()).isNull();
            assertThat(result.error().code()).isEqualTo("API_CONNECT_FAILED");
            assertThat(result.error().isRetryable()).isTrue();
        }

        @Test
        void unhealthySourceIsNotSuccessful() {
            DataSourceAdapter api = mock(DataSourceAdapter.class);
            when(api.connect(any(DataSourceConfig.class))).thenAnswer(inv -> connected("api_9", "api"));
            when(api.healthCheck(any(Connection.class))).thenReturn(false);
            connector.registerAdapter("api", () -> api);

            ConnectionTestResult result =
                    connector.testConnection(ApiDataSourceConfig.builder("https://api.example.com").build());

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isNull();
            verify(api).disconnect(any(Connection.class));
        }
    }

    @Test
    void throwingListenerDoesNotAffectCalls() {
        DataSourceConnector noisy = new DataSourceConnector(
                new AdapterRegistry(),
                new ErrorMapper(),
                new ConnectorListener() {
                    @Override
                    public void onQueryCompleted(QueryCompleted event) {
                        throw new IllegalStateException("listener broke");
                    }
                },
                clock,
                ConnectorSettings.DEFAULT);
        noisy.registerAdapter("memory", MemoryAdapter::new);

        Connection connection = noisy.connect(products());

        assertThat(noisy.query(connection, "pen")).hasSize(2);
        noisy.close();
    }

    private static final class RecordingListener implements ConnectorListener {

        final List<ConnectCompleted> connects = new CopyOnWriteArrayList<>();
        final List<QueryCompleted> queries = new CopyOnWriteArrayList<>();
        final List<OperationFailed> failures = new CopyOnWriteArrayList<>();

        @Override
        public void onConnectCompleted(ConnectCompleted event) {
            connects.add(event);
        }

        @Override
        public void onQueryCompleted(QueryCompleted event) {
            queries.add(event);
        }

        @Override
        public void onOperationFailed(OperationFailed event) {
            failures.add(event);
        }
    }
}
