package io.querybridge.core.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpServer;
import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.error.RemoteRequestException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HttpTransport")
class HttpTransportTest {

    private HttpServer server;
    private String base;
    private final AtomicReference<String> seenMethod = new AtomicReference<>();
    private final AtomicReference<String> seenBody = new AtomicReference<>();
    private final AtomicReference<String> seenHeader = new AtomicReference<>();

    private final HttpTransport transport = new HttpTransport(Duration.ofSeconds(2), Duration.ofSeconds(5));

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/echo", exchange -> {
            seenMethod.set(exchange.getRequestMethod());
            seenHeader.set(exchange.getRequestHeaders().getFirst("X-Trace"));
            seenBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] reply = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.getResponseHeaders().add("X-RateLimit-Remaining", "9");
            exchange.sendResponseHeaders(200, reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.createContext("/missing", exchange -> {
            byte[] reply = "nope".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(404, reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(1_500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void sendsMethodBodyAndHeaders() {
        ApiResponse response = transport.send(new ApiRequest(
                "POST", base + "/echo", Map.of("X-Trace", "t-1", "Content-Type", "application/json"), "{\"q\":\"pen\"}"));

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.body()).isEqualTo("{\"ok\":true}");
        assertThat(response.header("X-RateLimit-Remaining")).isEqualTo("9");
        assertThat(response.headers()).containsKey("x-ratelimit-remaining");
        assertThat(seenMethod.get()).isEqualTo("POST");
        assertThat(seenBody.get()).isEqualTo("{\"q\":\"pen\"}");
        assertThat(seenHeader.get()).isEqualTo("t-1");
    }

    @Test
    void dropsRestrictedAndHopByHopRequestHeaders() {
        ApiResponse response = transport.send(new ApiRequest(
                "GET", base + "/echo", Map.of("Host", "evil.example", "Connection", "close", "X-Trace", "t-2"), null));

        assertThat(response.status()).isEqualTo(200);
        assertThat(seenHeader.get()).isEqualTo("t-2");
    }

    @Test
    void errorStatusesAreReturnedNotThrown() {
        ApiResponse response = transport.send(ApiRequest.get(base + "/missing"));

        assertThat(response.status()).isEqualTo(404);
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.body()).isEqualTo("nope");
    }

    @Test
    void timeoutIsStatus408() {
        assertThatThrownBy(() -> transport.send(ApiRequest.get(base + "/slow"), Duration.ofMillis(200)))
                .isInstanceOf(RemoteRequestException.class)
                .hasMessageStartingWith("Request timeout from ")
                .satisfies(e -> {
                    RemoteRequestException failure = (RemoteRequestException) e;
                    assertThat(failure.status()).isEqualTo(408);
                    assertThat(failure.category()).isEqualTo(ErrorCategory.TIMEOUT);
                });
    }

    @Test
    void refusedConnectionIsStatusZero() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        String url = "http://127.0.0.1:" + port + "/";

        assertThatThrownBy(() -> transport.send(ApiRequest.get(url)))
                .isInstanceOf(RemoteRequestException.class)
                .hasMessageStartingWith("Network error")
                .satisfies(e -> {
                    RemoteRequestException failure = (RemoteRequestException) e;
                    assertThat(failure.status()).isZero();
                    assertThat(failure.retryable()).isTrue();
                    assertThat(failure.category()).isEqualTo(ErrorCategory.NETWORK);
                });
    }

    @Test
    void invalidUrlIsRejected() {
        assertThatThrownBy(() -> transport.send(ApiRequest.get("http://bad host/")))
                .isInstanceOf(RemoteRequestException.class)
                .hasMessage("Invalid URL: http://bad host/");
    }
}
