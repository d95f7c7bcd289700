package io.querybridge.core.model;

import java.util.List;

/**
 * Security verdict attached to a {@link ProcessedQuery} by the upstream query
 * processor.
 *
 * @param secure    {@code true} if no threat was found
 * @param threats   names of detected threat classes (e.g. {@code "xss"})
 * @param sanitized whether the processor altered the input
 */
public record SecurityInfo(boolean secure, List<String> threats, boolean sanitized) {

    public static final SecurityInfo SECURE = new SecurityInfo(true, List.of(), false);

    public SecurityInfo {
        threats = threats == null ? List.of() : List.copyOf(threats);
    }
}
