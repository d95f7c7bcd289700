package io.querybridge.core.adapter.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.querybridge.core.config.ApiAuth;
import io.querybridge.core.config.ApiDataSourceConfig;
import io.querybridge.core.config.RequestTransform;
import io.querybridge.core.config.ResponseConfig;
import io.querybridge.core.cors.CorsConfig;
import io.querybridge.core.cors.CorsHandler;
import io.querybridge.core.error.ConfigValidationException;
import io.querybridge.core.error.DataSourceFailureException;
import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.error.RemoteRequestException;
import io.querybridge.core.http.ApiRequest;
import io.querybridge.core.http.ApiResponse;
import io.querybridge.core.http.HttpTransport;
import io.querybridge.core.model.Connection;
import io.querybridge.core.model.ProcessedQuery;
import io.querybridge.core.model.RawResult;
import io.querybridge.core.ratelimit.RateLimitConfig;
import io.querybridge.core.ratelimit.RateLimiterRegistry;
import io.querybridge.core.testing.MutableClock;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ApiAdapter")
class ApiAdapterTest {

    private static final String URL = "https://api.example.com/search";
    private static final String TOKEN_URL = "https://auth.example.com/token";
    private static final ObjectMapper JSON = new ObjectMapper();

    private HttpTransport transport;
    private MutableClock clock;
    private RateLimiterRegistry limiters;
    private ApiAdapter adapter;
    private final List<ApiRequest> sent = new ArrayList<>();

    @BeforeEach
    void setUp() {
        transport = mock(HttpTransport.class);
        clock = MutableClock.startingAt(1_700_000_000_000L);
        limiters = new RateLimiterRegistry();
        adapter = new ApiAdapter(transport, JSON, clock, new CorsHandler(transport, JSON), limiters);
    }

    private void route(Function<ApiRequest, ApiResponse> handler) {
        doAnswer(inv -> {
                    ApiRequest request = inv.getArgument(0);
                    sent.add(request);
                    return handler.apply(request);
                })
                .when(transport)
                .send(any(ApiRequest.class));
    }

    private static ApiResponse ok(String body) {
        return new ApiResponse(200, Map.of("Content-Type", "application/json"), body);
    }

    private List<RawResult> search(ApiDataSourceConfig config, String text) {
        Connection connection = adapter.connect(config);
        return adapter.query(connection, ProcessedQuery.of(text));
    }

    private ApiRequest lastSent() {
        return sent.get(sent.size() - 1);
    }

    private static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    @Nested
    @DisplayName("request building")
    class Requests {

        @Test
        void getPutsQueryAndParamsInQueryString() {
            route(r -> ok("[]"));
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .header("Accept", "application/json")
                    .requestTransform(new RequestTransform(
                            new RequestTransform.QueryMapping("term", RequestTransform.QueryTextTransform.LOWERCASE),
                            Map.of("per_page", 25),
                            Map.of("X-Client", "querybridge"),
                            null))
                    .build();

            search(config, "Blue  Pen");

            ApiRequest request = lastSent();
            assertThat(request.method()).isEqualTo("GET");
            assertThat(request.url()).isEqualTo(URL + "?term=blue+pen&per_page=25");
            assertThat(request.body()).isNull();
            assertThat(request.header("accept")).isEqualTo("application/json");
            assertThat(request.header("X-Client")).isEqualTo("querybridge");
        }

        @Test
        void defaultQueryParamIsQ() {
            route(r -> ok("[]"));

            search(ApiDataSourceConfig.builder(URL + "?lang=en").build(), "pen");

            assertThat(lastSent().url()).isEqualTo(URL + "?lang=en&q=pen");
        }

        @Test
        void postSendsJsonBody() {
            route(r -> ok("[]"));
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .method("post")
                    .queryParam("search")
                    .requestTransform(new RequestTransform(null, Map.of("limit", 5), Map.of(), null))
                    .build();

            search(config, "pen");

            ApiRequest request = lastSent();
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.url()).isEqualTo(URL);
            assertThat(request.header("Content-Type")).isEqualTo("application/json");
            assertThat(json(request.body())).isEqualTo(json("{\"search\":\"pen\",\"limit\":5}"));
        }

        @Test
        void graphqlAlwaysPostsTemplate() {
            route(r -> ok("{\"data\":{\"products\":[]}}"));
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .requestTransform(new RequestTransform(
                            null,
                            Map.of(),
                            Map.of(),
                            new RequestTransform.GraphQl(
                                    "query Find($query: String!) { products(q: $query) { id } }",
                                    Map.of("first", 10),
                                    "Find")))
                    .response(ResponseConfig.atPath("data.products"))
                    .build();

            search(config, "pen");

            ApiRequest request = lastSent();
            assertThat(request.method()).isEqualTo("POST");
            JsonNode body = json(request.body());
            assertThat(body.get("operationName").asText()).isEqualTo("Find");
            assertThat(body.get("variables")).isEqualTo(json("{\"first\":10,\"query\":\"pen\"}"));
            assertThat(body.get("query").asText()).startsWith("query Find");
        }
    }

    @Nested
    @DisplayName("authentication")
    class Authentication {

        @Test
        void apiKeyHeaderDefaultsToXApiKey() {
            route(r -> ok("[]"));

            search(ApiDataSourceConfig.builder(URL).auth(new ApiAuth.ApiKey("k-123", null, null)).build(), "pen");

            assertThat(lastSent().header("X-API-Key")).isEqualTo("k-123");
        }

        @Test
        void apiKeyCanGoInQueryString() {
            route(r -> ok("[]"));

            search(ApiDataSourceConfig.builder(URL).auth(new ApiAuth.ApiKey("k 1", null, "api_key")).build(), "pen");

            assertThat(lastSent().url()).isEqualTo(URL + "?q=pen&api_key=k+1");
            assertThat(lastSent().header("X-API-Key")).isNull();
        }

        @Test
        void bearerAndBasic() {
            route(r -> ok("[]"));

            search(ApiDataSourceConfig.builder(URL).auth(new ApiAuth.Bearer("tok")).build(), "pen");
            assertThat(lastSent().header("Authorization")).isEqualTo("Bearer tok");

            search(ApiDataSourceConfig.builder(URL).auth(new ApiAuth.Basic("ann", "s3cret")).build(), "pen");
            String expected = Base64.getEncoder().encodeToString("ann:s3cret".getBytes(StandardCharsets.UTF_8));
            assertThat(lastSent().header("Authorization")).isEqualTo("Basic " + expected);
        }

        @Test
        void oauthTokenFetchedAtConnectAndReusedUntilExpiry() {
            route(r -> TOKEN_URL.equals(r.url())
                    ? ok("{\"access_token\":\"at-" + sent.size() + "\",\"expires_in\":120}")
                    : ok("[]"));
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .auth(new ApiAuth.OAuth2("client", "secret", null, TOKEN_URL, List.of("read", "write"), null))
                    .build();

            Connection connection = adapter.connect(config);
            ApiRequest tokenRequest = sent.get(0);
            assertThat(tokenRequest.method()).isEqualTo("POST");
            assertThat(tokenRequest.body())
                    .isEqualTo("grant_type=client_credentials&client_id=client&client_secret=secret&scope=read+write");

            adapter.query(connection, ProcessedQuery.of("pen"));
            assertThat(lastSent().header("Authorization")).isEqualTo("Bearer at-1");

            // 120s lifetime minus the 30s skew
            clock.advanceMillis(91_000);
            adapter.query(connection, ProcessedQuery.of("pen"));

            assertThat(sent.stream().filter(r -> TOKEN_URL.equals(r.url())).count()).isEqualTo(2);
            assertThat(lastSent().header("Authorization")).isEqualTo("Bearer at-3");
        }

        @Test
        void oauthFailureAtConnectIsAuthFailed() {
            route(r -> new ApiResponse(401, Map.of(), "{\"error\":\"invalid_client\"}"));
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .auth(new ApiAuth.OAuth2("client", "bad", null, TOKEN_URL, List.of(), null))
                    .build();

            assertThatThrownBy(() -> adapter.connect(config))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessage("Authentication failed: Token request failed with HTTP 401")
                    .satisfies(e -> {
                        DataSourceFailureException failure = (DataSourceFailureException) e;
                        assertThat(failure.code()).isEqualTo("AUTH_FAILED");
                        assertThat(failure.category()).isEqualTo(ErrorCategory.SECURITY);
                    });
            assertThat(adapter.getActiveConnections()).isEmpty();
        }
    }

    @Nested
    @DisplayName("response mapping")
    class Mapping {

        @Test
        void extractsItemsAtDataPathAndRenamesFields() {
            route(r -> ok("{\"data\":{\"items\":["
                    + "{\"id\":7,\"attributes\":{\"title\":\"Blue pen\"}},"
                    + "{\"_id\":\"x9\",\"attributes\":{\"title\":\"Red pen\"}},"
                    + "{\"attributes\":{\"title\":\"Pencil\"}}]}}"));
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .response(new ResponseConfig(
                            "data.items", Map.of("name", "attributes.title"), null, null, null))
                    .build();

            List<RawResult> results = search(config, "pen");

            assertThat(results).extracting(RawResult::id).containsExactly("7", "x9", "api-result-2");
            assertThat(results.get(0).data().get("name").asText()).isEqualTo("Blue pen");
            assertThat(results.get(0).data().has("attributes")).isTrue();
            assertThat(results.get(2).metadata())
                    .containsEntry("source", "api")
                    .containsEntry("originalIndex", 2);
            assertThat(results).allSatisfy(r -> assertThat(r.score()).isEqualTo(1.0));
        }

        @Test
        void singleObjectBecomesOneResult() {
            route(r -> ok("{\"result\":{\"uuid\":\"u-1\"}}"));

            List<RawResult> results =
                    search(ApiDataSourceConfig.builder(URL).response(ResponseConfig.atPath("result")).build(), "pen");

            assertThat(results).extracting(RawResult::id).containsExactly("u-1");
        }

        @Test
        void missingDataPathGivesNoResults() {
            route(r -> ok("{\"other\":[]}"));

            assertThat(search(ApiDataSourceConfig.builder(URL).response(ResponseConfig.atPath("items")).build(), "x"))
                    .isEmpty();
        }

        @Test
        void jsltTransformRunsBeforeExtraction() {
            route(r -> ok("{\"hits\":[{\"key\":\"a\",\"label\":\"Alpha\"},{\"key\":\"b\",\"label\":\"Beta\"}]}"));
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .response(new ResponseConfig(
                            "items",
                            Map.of(),
                            "{\"items\": [for (.hits) {\"id\": .key, \"title\": .label}]}",
                            null,
                            null))
                    .build();

            List<RawResult> results = search(config, "a");

            assertThat(results).extracting(RawResult::id).containsExactly("a", "b");
            assertThat(results.get(1).data()).isEqualTo(json("{\"id\":\"b\",\"title\":\"Beta\"}"));
        }

        @Test
        void schemaViolationIsValidationFailure() {
            route(r -> ok("{\"items\":\"not-a-list\"}"));
            JsonNode schema = json("{\"type\":\"object\",\"properties\":{\"items\":{\"type\":\"array\"}}}");
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .response(new ResponseConfig("items", Map.of(), null, schema, null))
                    .build();

            assertThatThrownBy(() -> search(config, "pen"))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessageStartingWith("Response does not match schema: ")
                    .satisfies(e -> {
                        DataSourceFailureException failure = (DataSourceFailureException) e;
                        assertThat(failure.code()).isEqualTo("RESPONSE_SCHEMA_VIOLATION");
                        assertThat(failure.category()).isEqualTo(ErrorCategory.VALIDATION);
                    });
        }

        @Test
        void invalidJsonBodyIsInvalidResponse() {
            route(r -> ok("<html>oops</html>"));

            assertThatThrownBy(() -> search(ApiDataSourceConfig.builder(URL).build(), "pen"))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessage("API response is not valid JSON")
                    .satisfies(e -> assertThat(((DataSourceFailureException) e).code()).isEqualTo("INVALID_RESPONSE"));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        private DataSourceFailureException failureFor(ApiResponse response) {
            route(r -> response);
            try {
                search(ApiDataSourceConfig.builder(URL).build(), "pen");
            } catch (DataSourceFailureException e) {
                return e;
            }
            throw new AssertionError("expected a failure for HTTP " + response.status());
        }

        @Test
        void httpStatusesMapToCategories() {
            assertThat(failureFor(new ApiResponse(401, Map.of(), "{\"error\":\"bad token\"}")))
                    .hasMessage("API error: bad token")
                    .satisfies(e -> assertThat(e.category()).isEqualTo(ErrorCategory.AUTHENTICATION));
            assertThat(failureFor(new ApiResponse(403, Map.of(), "")).category())
                    .isEqualTo(ErrorCategory.AUTHORIZATION);
            assertThat(failureFor(new ApiResponse(504, Map.of(), "gateway timeout")))
                    .hasMessage("API error: gateway timeout")
                    .satisfies(e -> assertThat(e.category()).isEqualTo(ErrorCategory.TIMEOUT));
            assertThat(failureFor(new ApiResponse(500, Map.of(), "")))
                    .hasMessage("API error: HTTP 500")
                    .satisfies(e -> {
                        assertThat(e.category()).isEqualTo(ErrorCategory.NETWORK);
                        assertThat(e.code()).isEqualTo("API_ERROR");
                    });
        }

        @Test
        void errorFieldInSuccessfulResponseFails() {
            assertThat(failureFor(ok("{\"error\":{\"message\":\"quota exceeded\"}}")))
                    .hasMessage("API error: quota exceeded");
        }

        @Test
        void transportFailureIsRequestFailed() {
            when(transport.send(any(ApiRequest.class)))
                    .thenThrow(new RemoteRequestException("Connection refused", "HTTP_TRANSPORT_FAILED", 0, null));

            assertThatThrownBy(() -> search(ApiDataSourceConfig.builder(URL).build(), "pen"))
                    .isInstanceOf(DataSourceFailureException.class)
                    .hasMessage("API request failed: Connection refused")
                    .satisfies(e -> {
                        DataSourceFailureException failure = (DataSourceFailureException) e;
                        assertThat(failure.code()).isEqualTo("REQUEST_FAILED");
                        assertThat(failure.category()).isEqualTo(ErrorCategory.NETWORK);
                        assertThat(failure.error().retryInfo()).isNotNull();
                    });
        }

        @Test
        void failedQueriesAreRecordedInMetrics() {
            route(r -> new ApiResponse(500, Map.of(), ""));
            Connection connection = adapter.connect(ApiDataSourceConfig.builder(URL).build());

            assertThatThrownBy(() -> adapter.query(connection, ProcessedQuery.of("pen")))
                    .isInstanceOf(DataSourceFailureException.class);

            assertThat(adapter.getConnectionMetrics(connection.id()))
                    .anySatisfy(m -> assertThat(m.success()).isFalse());
        }

        @Test
        void tooManyRequestsIsReportedToLimiter() {
            route(r -> new ApiResponse(429, Map.of(), ""));
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .rateLimit(RateLimitConfig.perMinute(60).withBurstLimit(5))
                    .build();

            assertThatThrownBy(() -> search(config, "pen")).isInstanceOf(DataSourceFailureException.class);

            assertThat(limiters.find(URL)).isPresent();
            assertThat(limiters.find(URL).get().getStatus().backoffMultiplier()).isGreaterThan(1);
        }
    }

    @Nested
    @DisplayName("response cache")
    class Caching {

        private ApiDataSourceConfig cached(long ttlMs) {
            return ApiDataSourceConfig.builder(URL)
                    .response(new ResponseConfig(null, Map.of(), null, null, new ResponseConfig.Cache(true, ttlMs, 10)))
                    .build();
        }

        @Test
        void repeatsAreServedFromCacheUntilTtl() {
            route(r -> ok("[{\"id\":1}]"));
            Connection connection = adapter.connect(cached(60_000));

            adapter.query(connection, ProcessedQuery.of("pen"));
            adapter.query(connection, ProcessedQuery.of("  pen "));
            verify(transport, times(1)).send(any(ApiRequest.class));
            assertThat(adapter.cacheSize(URL)).isEqualTo(1);

            clock.advanceMillis(60_001);
            adapter.query(connection, ProcessedQuery.of("pen"));
            verify(transport, times(2)).send(any(ApiRequest.class));
        }

        @Test
        void emptyResultsAreNotCached() {
            route(r -> ok("[]"));
            Connection connection = adapter.connect(cached(60_000));

            adapter.query(connection, ProcessedQuery.of("pen"));
            adapter.query(connection, ProcessedQuery.of("pen"));

            verify(transport, times(2)).send(any(ApiRequest.class));
            assertThat(adapter.cacheSize(URL)).isZero();
        }

        @Test
        void clearCacheForcesRefetch() {
            route(r -> ok("[{\"id\":1}]"));
            Connection connection = adapter.connect(cached(60_000));
            adapter.query(connection, ProcessedQuery.of("pen"));

            adapter.clearCache();
            adapter.query(connection, ProcessedQuery.of("pen"));

            verify(transport, times(2)).send(any(ApiRequest.class));
        }

        @Test
        void disabledCacheAlwaysSends() {
            route(r -> ok("[{\"id\":1}]"));

            search(ApiDataSourceConfig.builder(URL).build(), "pen");
            search(ApiDataSourceConfig.builder(URL).build(), "pen");

            verify(transport, times(2)).send(any(ApiRequest.class));
            assertThat(adapter.cacheSize(URL)).isZero();
        }
    }

    @Nested
    @DisplayName("CORS fallback")
    class Cors {

        @Test
        void proxyFallbackWhenPreflightDenied() {
            route(r -> {
                if ("OPTIONS".equals(r.method())) {
                    return new ApiResponse(204, Map.of(), "");
                }
                if (r.url().startsWith("https://relay.example.com")) {
                    return ok("{\"status\":200,\"headers\":{},\"body\":\"[{\\\"id\\\":\\\"p1\\\"}]\"}");
                }
                throw new AssertionError("unexpected direct call " + r.url());
            });
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .cors(CorsConfig.withFallbacks(null, "https://relay.example.com/proxy", true))
                    .build();

            List<RawResult> results = search(config, "pen");

            assertThat(results).extracting(RawResult::id).containsExactly("p1");
            assertThat(sent).extracting(ApiRequest::method).containsExactly("OPTIONS", "POST");
        }
    }

    @Nested
    @DisplayName("validation and health")
    class Validation {

        private void assertInvalid(ApiDataSourceConfig config, String message) {
            assertThatThrownBy(() -> adapter.validateConfig(config))
                    .isInstanceOf(ConfigValidationException.class)
                    .hasMessage(message);
        }

        @Test
        void rejectsBadUrlsAndMethods() {
            assertInvalid(ApiDataSourceConfig.builder(" ").build(), "API URL is required and must be a string");
            assertInvalid(ApiDataSourceConfig.builder("ftp://files.example.com").build(), "Invalid API URL format");
            assertInvalid(ApiDataSourceConfig.builder("not a url").build(), "Invalid API URL format");
            assertInvalid(ApiDataSourceConfig.builder(URL).method("PATCH").build(), "Invalid HTTP method: PATCH");
        }

        @Test
        void rejectsIncompleteCredentials() {
            assertInvalid(ApiDataSourceConfig.builder(URL).auth(new ApiAuth.Bearer("")).build(),
                    "Token is required for bearer authentication");
            assertInvalid(ApiDataSourceConfig.builder(URL).auth(new ApiAuth.ApiKey(null, null, null)).build(),
                    "API key is required for apikey authentication");
            assertInvalid(ApiDataSourceConfig.builder(URL).auth(new ApiAuth.Basic("ann", null)).build(),
                    "Username and password are required for basic authentication");
            assertInvalid(ApiDataSourceConfig.builder(URL)
                            .auth(new ApiAuth.OAuth2("client", null, null, null, List.of(), null))
                            .build(),
                    "clientId and tokenUrl are required for oauth2 authentication");
        }

        @Test
        void rejectsBrokenTransform() {
            ApiDataSourceConfig config = ApiDataSourceConfig.builder(URL)
                    .response(new ResponseConfig(null, Map.of(), "{\"a\": ", null, null))
                    .build();

            assertThatThrownBy(() -> adapter.validateConfig(config))
                    .isInstanceOf(ConfigValidationException.class)
                    .hasMessageStartingWith("Failed to compile response transform: ");
        }

        @Test
        void validationDoesNoIo() {
            adapter.validateConfig(ApiDataSourceConfig.builder(URL).build());

            verify(transport, never()).send(any(ApiRequest.class));
        }

        @Test
        void healthCheckSendsHeadAndAcceptsClientErrors() {
            route(r -> new ApiResponse(404, Map.of(), ""));
            Connection connection = adapter.connect(ApiDataSourceConfig.builder(URL).build());

            assertThat(adapter.healthCheck(connection)).isTrue();
            assertThat(lastSent().method()).isEqualTo("HEAD");
        }

        @Test
        void healthCheckFailsOnServerErrorOrClosedConnection() {
            route(r -> new ApiResponse(503, Map.of(), ""));
            Connection connection = adapter.connect(ApiDataSourceConfig.builder(URL).build());

            assertThat(adapter.healthCheck(connection)).isFalse();

            adapter.disconnect(connection);
            assertThat(adapter.healthCheck(connection)).isFalse();
        }

        @Test
        void disconnectDropsLimiterOfIdleEndpoint() {
            ApiDataSourceConfig config =
                    ApiDataSourceConfig.builder(URL).rateLimit(RateLimitConfig.perMinute(30)).build();
            Connection first = adapter.connect(config);
            Connection second = adapter.connect(config);

            adapter.disconnect(first);
            assertThat(limiters.find(URL)).isPresent();

            adapter.disconnect(second);
            assertThat(limiters.find(URL)).isEmpty();
        }
    }
}
