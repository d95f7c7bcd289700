package io.querybridge.core.http;

import io.querybridge.core.error.RemoteRequestException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based transport shared by the API adapter, the CORS
 * handler and the proxy SQL executor.
 *
 * <p>
 * Transport failures are mapped to {@link RemoteRequestException}: connect
 * failures carry status {@code 0}, timeouts carry {@code 408}. HTTP error
 * statuses are returned, not thrown. Thread-safe.
 */
public final class HttpTransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTransport.class);

    /** Hop-by-hop headers (RFC 7230 §6.1), stripped in both directions. */
    public static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection", "transfer-encoding", "keep-alive", "proxy-authenticate",
            "proxy-authorization", "te", "trailer", "upgrade");

    // Managed by HttpClient itself; setting them throws.
    private static final Set<String> RESTRICTED_HEADERS = Set.of("host", "content-length", "expect");

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpTransport(Duration connectTimeout, Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /** Transport with a 10 second connect and 30 second request timeout. */
    public static HttpTransport defaults() {
        return new HttpTransport(Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    /**
     * Sends the request and returns the response whatever its status.
     *
     * @throws RemoteRequestException on connect failure, timeout, I/O error or interruption
     */
    public ApiResponse send(ApiRequest request) {
        return send(request, requestTimeout);
    }

    /** As {@link #send(ApiRequest)} with an explicit request timeout. */
    public ApiResponse send(ApiRequest request, Duration timeout) {
        URI target;
        try {
            target = URI.create(request.url());
        } catch (IllegalArgumentException e) {
            throw new RemoteRequestException("Invalid URL: " + request.url(), "INVALID_URL", 0, e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(target)
                .timeout(timeout)
                .method(
                        request.method(),
                        request.body() != null && !request.body().isEmpty()
                                ? HttpRequest.BodyPublishers.ofString(request.body())
                                : HttpRequest.BodyPublishers.noBody());
        request.headers().forEach((name, value) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (value != null && !RESTRICTED_HEADERS.contains(lower) && !HOP_BY_HOP_HEADERS.contains(lower)) {
                builder.header(name, value);
            }
        });

        LOG.debug("Sending {} {}", request.method(), target);
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpConnectTimeoutException e) {
            throw new RemoteRequestException("Connect timeout to " + target.getHost(), "REQUEST_TIMEOUT", 408, e);
        } catch (HttpTimeoutException e) {
            throw new RemoteRequestException("Request timeout from " + target.getHost(), "REQUEST_TIMEOUT", 408, e);
        } catch (ConnectException e) {
            throw new RemoteRequestException(
                    "Network error: connection refused by " + target.getHost(), "REQUEST_FAILED", 0, e);
        } catch (IOException e) {
            throw new RemoteRequestException(
                    "Network error contacting " + target.getHost() + ": " + e.getMessage(), "REQUEST_FAILED", 0, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteRequestException("Request interrupted", "REQUEST_FAILED", 0, e);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (!values.isEmpty() && !HOP_BY_HOP_HEADERS.contains(lower) && !":status".equals(lower)) {
                headers.put(lower, values.get(0));
            }
        });
        LOG.debug("{} {} -> {}", request.method(), target, response.statusCode());
        return new ApiResponse(response.statusCode(), headers, response.body());
    }
}
