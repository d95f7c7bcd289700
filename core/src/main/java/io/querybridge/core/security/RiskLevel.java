package io.querybridge.core.security;

import java.util.Locale;

/** Risk rating attached to a {@link SqlValidationResult}. Ordered from lowest to highest. */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the higher of this level and {@code other}. */
    public RiskLevel atLeast(RiskLevel other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
