package io.querybridge.core.sql;

/**
 * Offset pagination window.
 *
 * @param limit  maximum rows, must be positive
 * @param offset rows to skip, must not be negative
 */
public record PageRequest(int limit, int offset) {

    public PageRequest {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got: " + offset);
        }
    }

    public static PageRequest first(int limit) {
        return new PageRequest(limit, 0);
    }

    /** One-based page number to offset window. */
    public static PageRequest ofPage(int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1, got: " + page);
        }
        return new PageRequest(pageSize, (page - 1) * pageSize);
    }
}
