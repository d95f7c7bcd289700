package io.querybridge.core.ratelimit;

import java.util.Comparator;

/** One counted request inside a client's sliding window. */
public record WindowEntry(long timestamp, String query) {

    static final Comparator<WindowEntry> CHRONOLOGICAL =
            Comparator.comparingLong(WindowEntry::timestamp).thenComparing(e -> e.query == null ? "" : e.query);
}
