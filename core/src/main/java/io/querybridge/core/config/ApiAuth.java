package io.querybridge.core.config;

import java.util.List;

/** Credentials attached to outgoing API requests. Secrets are never logged. */
public sealed interface ApiAuth {

    ApiAuth NONE = new None();

    /** No authentication. */
    record None() implements ApiAuth {}

    /**
     * Static API key, sent as a header or as a query parameter.
     *
     * @param header     header name, {@code X-API-Key} when {@code null}
     * @param queryParam query parameter name; when set the key goes in the URL instead of a header
     */
    record ApiKey(String key, String header, String queryParam) implements ApiAuth {

        public static final String DEFAULT_HEADER = "X-API-Key";

        public ApiKey {
            header = header == null || header.isBlank() ? DEFAULT_HEADER : header;
        }
    }

    /** {@code Authorization: Bearer <token>}. */
    record Bearer(String token) implements ApiAuth {}

    /** {@code Authorization: Basic base64(username:password)}. */
    record Basic(String username, String password) implements ApiAuth {}

    /**
     * OAuth 2.0 client-credentials grant; the token is fetched from
     * {@code tokenUrl} and cached until it expires.
     */
    record OAuth2(
            String clientId,
            String clientSecret,
            String authUrl,
            String tokenUrl,
            List<String> scopes,
            String grantType) implements ApiAuth {

        public OAuth2 {
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
            grantType = grantType == null || grantType.isBlank() ? "client_credentials" : grantType;
        }
    }
}
