package io.querybridge.core.cors;

import io.querybridge.core.http.ApiRequest;

/**
 * Outcome of {@link CorsHandler#determineRequestMethod}.
 *
 * @param mode    chosen transport
 * @param request request to send, already rewritten for the mode
 * @param reason  short explanation, for logs
 */
public record CorsDecision(RequestMode mode, ApiRequest request, String reason) {}
