package io.querybridge.core.error;

import java.util.Map;
import java.util.Objects;

/**
 * Carries a classified {@link TransformedError} out of the connector. This is
 * the only exception type {@code DataSourceConnector} lets escape; the original
 * failure is kept as the cause.
 */
public final class DataSourceFailureException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    private final transient TransformedError error;

    public DataSourceFailureException(TransformedError error, Throwable cause) {
        super(
                Objects.requireNonNull(error, "error must not be null").message(),
                cause,
                error.category(),
                error.code(),
                Map.of());
        this.error = error;
    }

    /** The classified error to display. */
    public TransformedError error() {
        return error;
    }

    @Override
    public boolean retryable() {
        return error.isRetryable();
    }
}
