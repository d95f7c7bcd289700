package io.querybridge.core.ratelimit;

import java.util.List;

/**
 * Publish/subscribe transport that lets several
 * {@link SlidingWindowRateLimiter} instances share per-client window state.
 * Delivery is best-effort; receivers merge whatever arrives.
 *
 * <p>
 * Implementations must be thread-safe.
 */
public interface RateLimitSyncChannel {

    /**
     * Sends a client's current window to every other subscriber of
     * {@code topic}.
     *
     * @param topic  shared sync key
     * @param update snapshot of one client window
     */
    void publish(String topic, WindowUpdate update);

    /**
     * Registers a listener for updates on {@code topic}.
     *
     * @return handle that removes the listener when closed
     */
    Subscription subscribe(String topic, Listener listener);

    /** Receives updates published by other instances. */
    @FunctionalInterface
    interface Listener {
        void onUpdate(WindowUpdate update);
    }

    /** Closing a subscription stops delivery to its listener. */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Snapshot of one client's window.
     *
     * @param instanceId identifier of the publishing limiter, used to skip self-delivery
     * @param clientId   rate-limited client
     * @param entries    counted requests, oldest first
     */
    record WindowUpdate(String instanceId, String clientId, List<WindowEntry> entries) {
        public WindowUpdate {
            entries = List.copyOf(entries);
        }
    }
}
