package io.querybridge.core.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP response with lower-cased header names and a text body.
 *
 * @param status  HTTP status code
 * @param headers response headers keyed by lower-case name, first value only
 * @param body    response body, never {@code null}
 */
public record ApiResponse(int status, Map<String, String> headers, String body) {

    public ApiResponse {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        }
        headers = Collections.unmodifiableMap(normalized);
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
