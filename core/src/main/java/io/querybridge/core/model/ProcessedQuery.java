package io.querybridge.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A user query after front-end normalization. This is the only query input
 * accepted at the adapter boundary.
 *
 * @param original     text as typed by the user
 * @param normalized   trimmed, whitespace-collapsed text used for matching
 * @param valid        whether the processor accepted the query
 * @param tokens       normalized words, never {@code null}
 * @param securityInfo processor security verdict, or {@code null} if not screened
 */
public record ProcessedQuery(
        String original, String normalized, boolean valid, List<String> tokens, SecurityInfo securityInfo) {

    public ProcessedQuery {
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(normalized, "normalized must not be null");
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    /** Builds a valid query by trimming and collapsing whitespace. */
    public static ProcessedQuery of(String text) {
        String normalized = text == null ? "" : text.trim().replaceAll("\\s+", " ");
        List<String> tokens = normalized.isEmpty() ? List.of() : Arrays.asList(normalized.split(" "));
        return new ProcessedQuery(text == null ? "" : text, normalized, true, tokens, SecurityInfo.SECURE);
    }

    /** Returns {@code true} when the processor marked the query secure (or did not screen it). */
    public boolean isSecure() {
        return securityInfo == null || securityInfo.secure();
    }
}
