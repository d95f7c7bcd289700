package io.querybridge.core.adapter.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.querybridge.core.error.ConnectionFailedException;
import io.querybridge.core.error.QueryExecutionException;
import io.querybridge.core.error.RemoteRequestException;
import io.querybridge.core.http.ApiRequest;
import io.querybridge.core.http.ApiResponse;
import io.querybridge.core.http.HttpTransport;
import io.querybridge.core.sql.PageRequest;
import io.querybridge.core.sql.ParameterizedQuery;
import io.querybridge.core.sql.QueryType;
import io.querybridge.core.sql.SqlQueryConfig;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("ProxySqlExecutor")
class ProxySqlExecutorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpTransport transport = mock(HttpTransport.class);
    private final ProxySqlExecutor executor =
            new ProxySqlExecutor(transport, JSON, "http://proxy.local/search");

    private final SqlQueryConfig products = SqlQueryConfig.builder("products")
            .searchColumns("name", "sku")
            .orderBy("price", "desc")
            .build();

    private SearchCommand command(PageRequest page) {
        ParameterizedQuery sql = new ParameterizedQuery("SELECT 1", List.of(), List.of(), QueryType.SELECT, 1);
        return new SearchCommand(sql, "pen", products, page);
    }

    @Test
    @DisplayName("sends the structured search and reads rows and total")
    void search() throws Exception {
        when(transport.send(any(ApiRequest.class))).thenReturn(new ApiResponse(200, Map.of(),
                "{\"success\":true,\"data\":[{\"id\":1},{\"id\":2},\"skip\"],\"metadata\":{\"total\":12}}"));

        SqlRows rows = executor.search(command(new PageRequest(10, 20)));

        ArgumentCaptor<ApiRequest> sent = ArgumentCaptor.forClass(ApiRequest.class);
        verify(transport).send(sent.capture());
        assertThat(sent.getValue().method()).isEqualTo("POST");
        assertThat(sent.getValue().url()).isEqualTo("http://proxy.local/search");
        JsonNode body = JSON.readTree(sent.getValue().body());
        assertThat(body.path("searchTerm").asText()).isEqualTo("pen");
        assertThat(body.path("tableName").asText()).isEqualTo("products");
        assertThat(body.path("searchFields")).hasSize(2);
        assertThat(body.path("limit").asInt()).isEqualTo(10);
        assertThat(body.path("offset").asInt()).isEqualTo(20);
        assertThat(body.path("orderBy").asText()).isEqualTo("price DESC");
        assertThat(body.has("sql")).isFalse();
        assertThat(rows.rows()).hasSize(2);
        assertThat(rows.totalCount()).isEqualTo(12L);
    }

    @Test
    @DisplayName("a request without a page uses the default window")
    void defaultWindow() {
        JsonNode body = executor.requestBody(command(null));

        assertThat(body.path("limit").asInt()).isEqualTo(ProxySqlExecutor.DEFAULT_LIMIT);
        assertThat(body.path("offset").asInt()).isZero();
    }

    @Test
    @DisplayName("proxy problems are reported with their detail")
    void failure() {
        when(transport.send(any(ApiRequest.class))).thenReturn(new ApiResponse(400, Map.of(),
                "{\"title\":\"Bad Request\",\"detail\":\"Table is not searchable: users\"}"));

        assertThatThrownBy(() -> executor.search(command(null)))
                .isInstanceOf(RemoteRequestException.class)
                .hasMessage("Proxy search failed: Table is not searchable: users");
    }

    @Test
    @DisplayName("non-JSON replies are rejected")
    void notJson() {
        when(transport.send(any(ApiRequest.class))).thenReturn(new ApiResponse(502, Map.of(), "<html>"));

        assertThatThrownBy(() -> executor.search(command(null)))
                .isInstanceOf(RemoteRequestException.class)
                .hasMessage("SQL proxy returned a non-JSON response");
    }

    @Test
    @DisplayName("health is probed next to the search endpoint")
    void ping() {
        when(transport.send(ApiRequest.get("http://proxy.local/health")))
                .thenReturn(new ApiResponse(503, Map.of(), ""));

        assertThatThrownBy(executor::ping)
                .isInstanceOf(ConnectionFailedException.class)
                .hasMessage("SQL proxy health check failed with status 503");
        assertThat(ProxySqlExecutor.healthUrl("http://proxy/search/")).isEqualTo("http://proxy/health");
    }

    @Test
    @DisplayName("raw SQL never leaves the process")
    void rawSql() {
        ParameterizedQuery sql = new ParameterizedQuery("SELECT 1", List.of(), List.of(), QueryType.SELECT, 1);

        assertThat(executor.supportsRawSql()).isFalse();
        assertThatThrownBy(() -> executor.query(sql)).isInstanceOf(QueryExecutionException.class);
        assertThatThrownBy(() -> executor.update(sql)).isInstanceOf(QueryExecutionException.class);
    }
}
