package io.querybridge.core.adapter.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.querybridge.core.config.ApiAuth;
import io.querybridge.core.error.RemoteRequestException;
import io.querybridge.core.http.ApiRequest;
import io.querybridge.core.http.ApiResponse;
import io.querybridge.core.http.HttpTransport;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches credentials to outgoing requests. OAuth 2.0 access tokens are
 * fetched with the client-credentials grant and reused until they expire.
 */
final class AuthHeaderProvider {

    private static final Logger LOG = LoggerFactory.getLogger(AuthHeaderProvider.class);

    static final long DEFAULT_TOKEN_LIFETIME_SECONDS = 3_600;
    private static final long EXPIRY_SKEW_MS = 30_000;

    private final HttpTransport transport;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Map<String, CachedToken> tokens = new ConcurrentHashMap<>();

    AuthHeaderProvider(HttpTransport transport, ObjectMapper mapper, Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Returns {@code request} with the credentials for {@code auth} applied. */
    ApiRequest apply(ApiRequest request, ApiAuth auth) {
        if (auth instanceof ApiAuth.ApiKey key) {
            if (key.queryParam() != null && !key.queryParam().isBlank()) {
                String separator = request.url().contains("?") ? "&" : "?";
                return request.withUrl(request.url() + separator + encode(key.queryParam()) + "=" + encode(key.key()));
            }
            return request.withHeader(key.header(), key.key());
        }
        if (auth instanceof ApiAuth.Bearer bearer) {
            return request.withHeader("Authorization", "Bearer " + bearer.token());
        }
        if (auth instanceof ApiAuth.Basic basic) {
            String raw = basic.username() + ":" + (basic.password() == null ? "" : basic.password());
            return request.withHeader(
                    "Authorization", "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8)));
        }
        if (auth instanceof ApiAuth.OAuth2 oauth) {
            return request.withHeader("Authorization", "Bearer " + accessToken(oauth));
        }
        return request;
    }

    /** Drops every cached OAuth token. */
    void clear() {
        tokens.clear();
    }

    private String accessToken(ApiAuth.OAuth2 oauth) {
        String cacheKey = oauth.tokenUrl() + "|" + oauth.clientId();
        CachedToken cached = tokens.get(cacheKey);
        long now = clock.millis();
        if (cached != null && now < cached.expiresAt()) {
            return cached.token();
        }
        CachedToken fresh = fetchToken(oauth, now);
        tokens.put(cacheKey, fresh);
        return fresh.token();
    }

    private CachedToken fetchToken(ApiAuth.OAuth2 oauth, long now) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", oauth.grantType());
        form.put("client_id", oauth.clientId());
        if (oauth.clientSecret() != null) {
            form.put("client_secret", oauth.clientSecret());
        }
        if (!oauth.scopes().isEmpty()) {
            form.put("scope", String.join(" ", oauth.scopes()));
        }
        String body = form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        ApiRequest request = new ApiRequest(
                "POST",
                oauth.tokenUrl(),
                Map.of("Content-Type", "application/x-www-form-urlencoded", "Accept", "application/json"),
                body);
        ApiResponse response = transport.send(request);
        if (!response.isSuccess()) {
            throw new RemoteRequestException(
                    "Token request failed with HTTP " + response.status(), "OAUTH_TOKEN_FAILED", response.status(), null);
        }
        JsonNode json;
        try {
            json = mapper.readTree(response.body());
        } catch (IOException e) {
            throw new RemoteRequestException("Token response is not JSON", "OAUTH_TOKEN_FAILED", response.status(), e);
        }
        String token = json.path("access_token").asText("");
        if (token.isEmpty()) {
            throw new RemoteRequestException(
                    "Token response has no access_token", "OAUTH_TOKEN_FAILED", response.status(), null);
        }
        long lifetime = json.path("expires_in").asLong(DEFAULT_TOKEN_LIFETIME_SECONDS);
        LOG.debug("Fetched OAuth token for client {} valid {}s", oauth.clientId(), lifetime);
        return new CachedToken(token, now + Math.max(0, lifetime * 1_000 - EXPIRY_SKEW_MS));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private record CachedToken(String token, long expiresAt) {}
}
