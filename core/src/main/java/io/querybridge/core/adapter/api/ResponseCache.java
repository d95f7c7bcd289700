package io.querybridge.core.adapter.api;

import io.querybridge.core.config.ResponseConfig;
import io.querybridge.core.model.RawResult;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Bounded result cache for one API endpoint. Entries expire after the
 * configured TTL; when full, the oldest insertion is evicted first.
 * Thread-safe.
 */
final class ResponseCache {

    private final ResponseConfig.Cache settings;
    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    ResponseCache(ResponseConfig.Cache settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Builds the cache key {@code url|normalizedQuery|sorted headers}. */
    static String key(String url, String normalizedQuery, Map<String, String> headers) {
        StringBuilder sb = new StringBuilder(url).append('|').append(normalizedQuery).append('|');
        new TreeMap<>(headers).forEach((k, v) -> sb.append(k).append('=').append(v).append(';'));
        return sb.toString();
    }

    synchronized Optional<List<RawResult>> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.millis() - entry.storedAt() >= settings.ttlMs()) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.results());
    }

    /** Stores non-empty results; empty ones are never cached. */
    synchronized void put(String key, List<RawResult> results) {
        if (results.isEmpty()) {
            return;
        }
        entries.remove(key);
        while (entries.size() >= settings.maxSize()) {
            Iterator<String> oldest = entries.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        entries.put(key, new Entry(List.copyOf(results), clock.millis()));
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized void clear() {
        entries.clear();
    }

    private record Entry(List<RawResult> results, long storedAt) {}
}
