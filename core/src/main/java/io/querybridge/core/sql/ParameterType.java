package io.querybridge.core.sql;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.Date;

/** Binding type tag inferred for each query parameter. Drivers bind values according to this tag. */
public enum ParameterType {
    NULL,
    VARCHAR,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    TIMESTAMP,
    TEXT;

    /** Strings up to this length are {@link #VARCHAR}; longer ones are {@link #TEXT}. */
    static final int VARCHAR_MAX_LENGTH = 255;

    public static ParameterType infer(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof String s) {
            return s.length() <= VARCHAR_MAX_LENGTH ? VARCHAR : TEXT;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return INTEGER;
        }
        if (value instanceof Number) {
            if (value instanceof BigDecimal bd) {
                return bd.stripTrailingZeros().scale() <= 0 ? INTEGER : DECIMAL;
            }
            double d = ((Number) value).doubleValue();
            return d == Math.rint(d) && !Double.isInfinite(d) ? INTEGER : DECIMAL;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Temporal || value instanceof Date) {
            return TIMESTAMP;
        }
        return TEXT;
    }
}
