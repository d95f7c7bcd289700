package io.querybridge.core.cors;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cross-origin handling for one API data source.
 *
 * @param enabled        run preflight probes and fallbacks; when off every request goes direct
 * @param allowedMethods methods the remote is expected to accept
 * @param allowedHeaders headers announced in the preflight probe
 * @param jsonpCallback  name of the JSONP callback query parameter, or {@code null} to disable JSONP
 * @param proxyUrl       relay endpoint, or {@code null} to disable the proxy fallback
 * @param autoFallback   re-route automatically when a direct call fails with a CORS error
 * @param origin         origin presented in preflight probes
 */
public record CorsConfig(
        boolean enabled,
        Set<String> allowedMethods,
        List<String> allowedHeaders,
        String jsonpCallback,
        String proxyUrl,
        boolean autoFallback,
        String origin) {

    public static final String DEFAULT_ORIGIN = "http://localhost";

    public static final CorsConfig DISABLED =
            new CorsConfig(false, Set.of("GET", "POST"), List.of(), null, null, false, DEFAULT_ORIGIN);

    public CorsConfig {
        allowedMethods = allowedMethods == null || allowedMethods.isEmpty()
                ? Set.of("GET", "POST")
                : allowedMethods.stream().map(m -> m.toUpperCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        allowedHeaders = allowedHeaders == null ? List.of() : List.copyOf(allowedHeaders);
        origin = origin == null || origin.isBlank() ? DEFAULT_ORIGIN : origin;
    }

    /** Enabled configuration with the given fallbacks. */
    public static CorsConfig withFallbacks(String jsonpCallback, String proxyUrl, boolean autoFallback) {
        return new CorsConfig(true, Set.of("GET", "POST"), List.of(), jsonpCallback, proxyUrl, autoFallback, null);
    }

    public boolean hasJsonp() {
        return jsonpCallback != null;
    }

    public boolean hasProxy() {
        return proxyUrl != null && !proxyUrl.isBlank();
    }
}
