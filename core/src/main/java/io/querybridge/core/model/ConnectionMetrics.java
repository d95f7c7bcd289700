package io.querybridge.core.model;

import java.time.Instant;

/**
 * Timing record for one connect or query call, successful or not.
 *
 * @param connectionTimeMs time spent establishing the connection
 * @param queryTimeMs      time spent executing the query
 * @param totalTimeMs      end-to-end time
 * @param success          whether the call succeeded
 * @param resultCount      number of results returned (0 on failure)
 * @param recordedAt       when the call finished
 */
public record ConnectionMetrics(
        double connectionTimeMs,
        double queryTimeMs,
        double totalTimeMs,
        boolean success,
        int resultCount,
        Instant recordedAt) {

    public static ConnectionMetrics forConnect(double elapsedMs, boolean success) {
        return new ConnectionMetrics(elapsedMs, 0, elapsedMs, success, 0, Instant.now());
    }

    public static ConnectionMetrics forQuery(double elapsedMs, boolean success, int resultCount) {
        return new ConnectionMetrics(0, elapsedMs, elapsedMs, success, resultCount, Instant.now());
    }
}
