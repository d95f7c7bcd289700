package io.querybridge.core.error;

import java.util.Locale;

/** Severity of a {@link TransformedError}, declared from most to least severe. */
public enum ErrorSeverity {
    CRITICAL,
    ERROR,
    WARNING,
    INFO;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns {@code true} if this severity is strictly more severe than {@code other}. */
    public boolean isMoreSevereThan(ErrorSeverity other) {
        return ordinal() < other.ordinal();
    }
}
