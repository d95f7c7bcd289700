package io.querybridge.core.error;

import java.util.Map;

/** No pooled connection became available within the acquire timeout. */
public final class PoolExhaustedException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "POOL_EXHAUSTED";

    public PoolExhaustedException(String message, Map<String, Object> context) {
        super(message, null, ErrorCategory.CONNECTION, CODE, context);
    }
}
