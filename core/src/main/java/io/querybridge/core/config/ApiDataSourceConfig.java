package io.querybridge.core.config;

import io.querybridge.core.cors.CorsConfig;
import io.querybridge.core.ratelimit.RateLimitConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Remote HTTP API data source.
 *
 * @param url              endpoint URL
 * @param method           GET, POST, PUT or DELETE
 * @param headers          static request headers
 * @param queryParam       query parameter (GET) or body field (POST/PUT) carrying the query; {@code q}
 *                         when {@code null}
 * @param auth             credentials
 * @param requestTransform request shaping
 * @param cors             cross-origin handling
 * @param rateLimit        client-side token bucket, or {@code null} for none
 * @param response         response extraction and caching
 * @param options          shared options
 */
public record ApiDataSourceConfig(
        String url,
        String method,
        Map<String, String> headers,
        String queryParam,
        ApiAuth auth,
        RequestTransform requestTransform,
        CorsConfig cors,
        RateLimitConfig rateLimit,
        ResponseConfig response,
        ConnectionOptions options) implements DataSourceConfig {

    public static final String DEFAULT_QUERY_PARAM = "q";

    public ApiDataSourceConfig {
        method = method == null ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        queryParam = queryParam == null || queryParam.isBlank() ? DEFAULT_QUERY_PARAM : queryParam;
        auth = Objects.requireNonNullElse(auth, ApiAuth.NONE);
        requestTransform = Objects.requireNonNullElse(requestTransform, RequestTransform.NONE);
        cors = Objects.requireNonNullElse(cors, CorsConfig.DISABLED);
        response = Objects.requireNonNullElse(response, ResponseConfig.DEFAULT);
        options = Objects.requireNonNullElse(options, ConnectionOptions.DEFAULT);
    }

    @Override
    public DataSourceType type() {
        return DataSourceType.API;
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public static final class Builder {

        private final String url;
        private String method = "GET";
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String queryParam;
        private ApiAuth auth;
        private RequestTransform requestTransform;
        private CorsConfig cors;
        private RateLimitConfig rateLimit;
        private ResponseConfig response;
        private ConnectionOptions options;

        private Builder(String url) {
            this.url = url;
        }

        public Builder method(String value) {
            this.method = value;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder queryParam(String value) {
            this.queryParam = value;
            return this;
        }

        public Builder auth(ApiAuth value) {
            this.auth = value;
            return this;
        }

        public Builder requestTransform(RequestTransform value) {
            this.requestTransform = value;
            return this;
        }

        public Builder cors(CorsConfig value) {
            this.cors = value;
            return this;
        }

        public Builder rateLimit(RateLimitConfig value) {
            this.rateLimit = value;
            return this;
        }

        public Builder response(ResponseConfig value) {
            this.response = value;
            return this;
        }

        public Builder options(ConnectionOptions value) {
            this.options = value;
            return this;
        }

        public ApiDataSourceConfig build() {
            return new ApiDataSourceConfig(
                    url, method, headers, queryParam, auth, requestTransform, cors, rateLimit, response, options);
        }
    }
}
