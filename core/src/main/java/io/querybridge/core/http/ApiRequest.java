package io.querybridge.core.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound HTTP request as seen by the API adapter and the CORS handler.
 *
 * @param method  upper-case HTTP method
 * @param url     absolute target URL including any query string
 * @param headers request headers, insertion ordered
 * @param body    request body, or {@code null} for bodyless requests
 */
public record ApiRequest(String method, String url, Map<String, String> headers, String body) {

    public ApiRequest {
        Objects.requireNonNull(url, "url must not be null");
        method = method == null ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static ApiRequest get(String url) {
        return new ApiRequest("GET", url, Map.of(), null);
    }

    public ApiRequest withUrl(String newUrl) {
        return new ApiRequest(method, newUrl, headers, body);
    }

    public ApiRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ApiRequest(method, url, copy, body);
    }

    /** Case-insensitive header lookup. */
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
