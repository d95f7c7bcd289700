package io.querybridge.core.model;

import java.util.List;

/**
 * Static description of what an adapter supports.
 *
 * @param supportsAsync            non-blocking execution
 * @param supportsRealTime         live updates
 * @param supportsPagination       paged result retrieval
 * @param supportsSorting          server-side ordering
 * @param supportsFiltering        server-side filtering
 * @param supportsPooling          connections may be pooled
 * @param maxConcurrentConnections upper bound on open connections
 * @param supportedQueryTypes      e.g. {@code text}, {@code sql}, {@code graphql}
 */
public record AdapterCapabilities(
        boolean supportsAsync,
        boolean supportsRealTime,
        boolean supportsPagination,
        boolean supportsSorting,
        boolean supportsFiltering,
        boolean supportsPooling,
        int maxConcurrentConnections,
        List<String> supportedQueryTypes) {

    public AdapterCapabilities {
        if (maxConcurrentConnections <= 0) {
            throw new IllegalArgumentException(
                    "maxConcurrentConnections must be positive, got: " + maxConcurrentConnections);
        }
        supportedQueryTypes = supportedQueryTypes == null ? List.of() : List.copyOf(supportedQueryTypes);
    }
}
