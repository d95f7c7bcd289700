package io.querybridge.core.ratelimit;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RateLimitSyncChannel} connecting limiter instances inside one JVM.
 * Delivery is synchronous on the publishing thread; a failing listener is
 * logged and skipped.
 */
public final class InMemoryRateLimitSyncChannel implements RateLimitSyncChannel {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRateLimitSyncChannel.class);

    private final Map<String, List<Listener>> topics = new ConcurrentHashMap<>();

    @Override
    public void publish(String topic, WindowUpdate update) {
        List<Listener> listeners = topics.get(topic);
        if (listeners == null) {
            return;
        }
        for (Listener listener : listeners) {
            try {
                listener.onUpdate(update);
            } catch (RuntimeException e) {
                LOG.warn("Rate-limit sync listener failed on topic '{}': {}", topic, e.getMessage(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(String topic, Listener listener) {
        List<Listener> listeners = topics.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>());
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Number of listeners currently subscribed to {@code topic}. */
    public int subscriberCount(String topic) {
        List<Listener> listeners = topics.get(topic);
        return listeners == null ? 0 : listeners.size();
    }
}
