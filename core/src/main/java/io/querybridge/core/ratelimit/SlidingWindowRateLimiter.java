package io.querybridge.core.ratelimit;

import io.querybridge.core.error.RateLimitExceededException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-client sliding-window admission control.
 *
 * <p>
 * Each client owns an ordered list of counted requests. A check prunes entries
 * older than the window, admits the request while the count is below
 * {@code maxRequests} (or within the burst allowance), and otherwise denies it
 * with a retry-after hint. Clients are created on their first check and evicted
 * after two windows of inactivity by a background sweep.
 *
 * <p>
 * When cross-instance sync is enabled, every admitted request publishes the
 * client's window on the configured {@link RateLimitSyncChannel}; updates from
 * other instances are merged by timestamp. Thread-safe.
 */
public final class SlidingWindowRateLimiter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    static final String ANONYMOUS = "anonymous";
    private static final long BURST_WINDOW_MS = 1_000;
    private static final long MIN_RETRY_AFTER_MS = 1_000;

    private final SlidingWindowConfig config;
    private final Clock clock;
    private final String instanceId = UUID.randomUUID().toString();
    private final Map<String, ClientWindow> clients = new ConcurrentHashMap<>();
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong blockedRequests = new AtomicLong();
    private final RateLimitSyncChannel syncChannel;
    private final RateLimitSyncChannel.Subscription subscription;
    private final ScheduledExecutorService cleanup;

    public SlidingWindowRateLimiter(SlidingWindowConfig config) {
        this(config, null, Clock.systemUTC());
    }

    public SlidingWindowRateLimiter(SlidingWindowConfig config, RateLimitSyncChannel syncChannel) {
        this(config, syncChannel, Clock.systemUTC());
    }

    /**
     * @param config      window settings
     * @param syncChannel channel for cross-instance sync, or {@code null} to keep state local
     * @param clock       time source
     */
    public SlidingWindowRateLimiter(SlidingWindowConfig config, RateLimitSyncChannel syncChannel, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.syncChannel = config.crossInstanceSync() ? syncChannel : null;
        this.subscription =
                this.syncChannel != null ? this.syncChannel.subscribe(config.syncKey(), this::merge) : null;
        this.cleanup = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "querybridge-ratelimit-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanup.scheduleAtFixedRate(
                this::evictIdleClients, config.windowSizeMs(), config.windowSizeMs(), TimeUnit.MILLISECONDS);
    }

    public SlidingWindowConfig config() {
        return config;
    }

    /**
     * Checks and, when admitted, counts one request.
     *
     * @param clientId caller identity; {@code null} is treated as an anonymous client
     * @param query    query text recorded with the request, may be {@code null}
     */
    public RateLimitDecision checkLimit(String clientId, String query) {
        String id = clientId == null ? ANONYMOUS : clientId;
        long now = clock.millis();
        RateLimitDecision decision;
        List<WindowEntry> snapshot = null;
        while (true) {
            ClientWindow window = clients.computeIfAbsent(id, k -> new ClientWindow());
            synchronized (window) {
                if (window.retired) {
                    continue;
                }
                window.lastSeen = now;
                window.prune(now - config.windowSizeMs());
                boolean allowed = admits(window, now);
                if (allowed) {
                    window.entries.add(new WindowEntry(now, query));
                    totalRequests.incrementAndGet();
                    snapshot = List.copyOf(window.entries);
                } else {
                    blockedRequests.incrementAndGet();
                }
                long oldest = window.entries.isEmpty() ? now : window.entries.get(0).timestamp();
                long resetAt = oldest + config.windowSizeMs();
                int remaining = Math.max(0, config.maxRequests() - window.entries.size());
                long retryAfter = allowed ? 0 : Math.max(MIN_RETRY_AFTER_MS, resetAt - now);
                decision = new RateLimitDecision(
                        allowed,
                        remaining,
                        resetAt,
                        now - config.windowSizeMs(),
                        retryAfter,
                        config.maxRequests() + " requests per " + config.windowSizeMs() + "ms");
            }
            break;
        }
        if (snapshot != null && syncChannel != null) {
            syncChannel.publish(config.syncKey(), new RateLimitSyncChannel.WindowUpdate(instanceId, id, snapshot));
        }
        if (!decision.allowed()) {
            LOG.warn("Rate limit exceeded for client '{}', retry after {}ms", id, decision.retryAfterMs());
        }
        return decision;
    }

    /**
     * Like {@link #checkLimit} but throws when the request is denied.
     *
     * @throws RateLimitExceededException carrying the retry-after hint
     */
    public RateLimitDecision acquire(String clientId, String query) {
        RateLimitDecision decision = checkLimit(clientId, query);
        if (!decision.allowed()) {
            throw new RateLimitExceededException(
                    "Rate limit exceeded. Try again in " + (decision.retryAfterMs() + 999) / 1000 + " seconds",
                    decision.retryAfterMs(),
                    Map.of("clientId", clientId == null ? ANONYMOUS : clientId));
        }
        return decision;
    }

    /** Requests the client may still make in the current window; unknown clients get the full quota. */
    public int getRemainingQuota(String clientId) {
        ClientWindow window = clients.get(clientId == null ? ANONYMOUS : clientId);
        if (window == null) {
            return config.maxRequests();
        }
        synchronized (window) {
            window.prune(clock.millis() - config.windowSizeMs());
            return Math.max(0, config.maxRequests() - window.entries.size());
        }
    }

    /** Forgets all state for one client. */
    public void resetClient(String clientId) {
        ClientWindow removed = clients.remove(clientId == null ? ANONYMOUS : clientId);
        if (removed != null) {
            synchronized (removed) {
                removed.retired = true;
            }
        }
    }

    public RateLimiterStats getStats() {
        return new RateLimiterStats(clients.size(), totalRequests.get(), blockedRequests.get());
    }

    /** Removes clients idle for more than two windows. Runs periodically; callable directly. */
    public void evictIdleClients() {
        long cutoff = clock.millis() - 2 * config.windowSizeMs();
        Iterator<Map.Entry<String, ClientWindow>> it = clients.entrySet().iterator();
        int evicted = 0;
        while (it.hasNext()) {
            ClientWindow window = it.next().getValue();
            synchronized (window) {
                if (window.lastSeen < cutoff) {
                    window.retired = true;
                    it.remove();
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            LOG.debug("Evicted {} idle rate-limit clients", evicted);
        }
    }

    /** Stops the cleanup sweep, leaves the sync topic and drops all client state. */
    public void destroy() {
        cleanup.shutdownNow();
        if (subscription != null) {
            subscription.close();
        }
        clients.clear();
    }

    @Override
    public void close() {
        destroy();
    }

    private boolean admits(ClientWindow window, long now) {
        int count = window.entries.size();
        if (count < config.maxRequests()) {
            return true;
        }
        if (count >= config.maxRequests() + config.burstAllowance()) {
            return false;
        }
        long burstStart = now - BURST_WINDOW_MS;
        int recent = 0;
        for (WindowEntry entry : window.entries) {
            if (entry.timestamp() > burstStart) {
                recent++;
            }
        }
        return recent < config.burstAllowance();
    }

    private void merge(RateLimitSyncChannel.WindowUpdate update) {
        if (instanceId.equals(update.instanceId())) {
            return;
        }
        long now = clock.millis();
        while (true) {
            ClientWindow window = clients.computeIfAbsent(update.clientId(), k -> new ClientWindow());
            synchronized (window) {
                if (window.retired) {
                    continue;
                }
                Set<WindowEntry> known = new HashSet<>(window.entries);
                for (WindowEntry entry : update.entries()) {
                    if (known.add(entry)) {
                        window.entries.add(entry);
                    }
                }
                window.entries.sort(WindowEntry.CHRONOLOGICAL);
                window.prune(now - config.windowSizeMs());
                window.lastSeen = Math.max(window.lastSeen, now);
            }
            break;
        }
        LOG.debug("Merged rate-limit state for client '{}' from instance {}", update.clientId(), update.instanceId());
    }

    private static final class ClientWindow {
        final List<WindowEntry> entries = new ArrayList<>();
        long lastSeen;
        // set under the window's lock once it has left the map
        boolean retired;

        void prune(long windowStart) {
            entries.removeIf(e -> e.timestamp() <= windowStart);
        }
    }
}
