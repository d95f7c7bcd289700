package io.querybridge.core.security;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tunable limits for {@link SecurityValidator}.
 *
 * @param allowedOperations   leading SQL keywords a query may start with (upper case)
 * @param maxParameterLength  longest accepted string parameter
 * @param maxQueryLength      SQL length above which a complexity warning is raised
 * @param maxJoins            JOIN count above which a complexity warning is raised
 * @param maxSubqueries       sub-SELECT count above which a complexity warning is raised
 */
public record SecurityPolicy(
        Set<String> allowedOperations, int maxParameterLength, int maxQueryLength, int maxJoins, int maxSubqueries) {

    public static final SecurityPolicy DEFAULT = new SecurityPolicy(Set.of("SELECT"), 10_000, 5_000, 5, 3);

    public SecurityPolicy {
        if (allowedOperations == null || allowedOperations.isEmpty()) {
            allowedOperations = Set.of("SELECT");
        } else {
            allowedOperations = allowedOperations.stream()
                    .map(op -> op.trim().toUpperCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
        }
        if (maxParameterLength <= 0) {
            throw new IllegalArgumentException("maxParameterLength must be positive, got: " + maxParameterLength);
        }
    }

    /** Default limits with a different set of allowed operations. */
    public static SecurityPolicy allowing(Set<String> operations) {
        return new SecurityPolicy(
                operations,
                DEFAULT.maxParameterLength,
                DEFAULT.maxQueryLength,
                DEFAULT.maxJoins,
                DEFAULT.maxSubqueries);
    }
}
