package io.querybridge.core.connector;

import io.querybridge.core.error.TransformedError;
import io.querybridge.core.model.AdapterCapabilities;

/**
 * Outcome of {@link DataSourceConnector#testConnection}.
 *
 * @param success      connected and the health check passed
 * @param latencyMs    time to connect
 * @param capabilities adapter capabilities, {@code null} when the connect failed
 * @param error        mapped failure, {@code null} on success
 */
public record ConnectionTestResult(
        boolean success, double latencyMs, AdapterCapabilities capabilities, TransformedError error) {}
