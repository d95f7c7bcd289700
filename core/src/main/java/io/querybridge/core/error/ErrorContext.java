package io.querybridge.core.error;

import io.querybridge.core.model.RawResult;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where an error happened, passed to classification rules and recovery
 * strategies.
 *
 * @param sourceType     adapter type tag, or {@code "transformation"} for result-mapping failures
 * @param operation      operation name such as {@code "query"} or {@code "connect"}
 * @param timestamp      when the error was observed
 * @param metadata       extra non-secret diagnostics
 * @param retryAttempt   zero-based attempt number of the failed operation
 * @param partialResults results produced before the failure, offered to recovery strategies
 */
public record ErrorContext(
        String sourceType,
        String operation,
        Instant timestamp,
        Map<String, Object> metadata,
        int retryAttempt,
        List<RawResult> partialResults) {

    public ErrorContext {
        sourceType = sourceType == null ? "unknown" : sourceType;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        partialResults = partialResults == null ? List.of() : List.copyOf(partialResults);
    }

    public static ErrorContext of(String sourceType, String operation) {
        return new ErrorContext(sourceType, operation, Instant.now(), Map.of(), 0, List.of());
    }

    public ErrorContext withRetryAttempt(int attempt) {
        return new ErrorContext(sourceType, operation, timestamp, metadata, attempt, partialResults);
    }

    public ErrorContext withPartialResults(List<RawResult> results) {
        return new ErrorContext(sourceType, operation, timestamp, metadata, retryAttempt, results);
    }

    public ErrorContext withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new ErrorContext(sourceType, operation, timestamp, merged, retryAttempt, partialResults);
    }
}
