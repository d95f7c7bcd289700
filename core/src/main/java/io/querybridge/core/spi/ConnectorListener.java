package io.querybridge.core.spi;

import io.querybridge.core.error.ErrorCategory;

/**
 * Observability hook for connector activity.
 *
 * <p>
 * Implementations bridge to whatever metrics or tracing system the application
 * uses; the core has no telemetry dependency. Events are immutable.
 * Implementations must be thread-safe and should not block. Exceptions thrown
 * by a listener are logged by the connector and never affect the call being
 * observed.
 */
public interface ConnectorListener {

    /** A no-op listener. */
    ConnectorListener NOOP = new ConnectorListener() {};

    default void onConnectCompleted(ConnectCompleted event) {}

    default void onQueryCompleted(QueryCompleted event) {}

    default void onOperationFailed(OperationFailed event) {}

    /** A connection was opened, pooled or direct. */
    record ConnectCompleted(String adapterType, String connectionId, boolean pooled, long durationMs) {}

    /** A query returned results. */
    record QueryCompleted(String adapterType, String connectionId, int resultCount, long durationMs) {}

    /**
     * A connect or query call failed.
     *
     * @param operation {@code connect}, {@code query} or {@code executeQuery}
     */
    record OperationFailed(
            String adapterType, String operation, ErrorCategory category, String code, long durationMs) {}
}
