package io.querybridge.core.error;

import java.util.Map;

/** A query was accepted but failed while executing against the backend. */
public final class QueryExecutionException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public QueryExecutionException(String message, String code, Throwable cause) {
        this(message, code, cause, Map.of());
    }

    public QueryExecutionException(String message, String code, Throwable cause, Map<String, Object> context) {
        super(message, cause, ErrorCategory.DATA, code, context);
    }
}
