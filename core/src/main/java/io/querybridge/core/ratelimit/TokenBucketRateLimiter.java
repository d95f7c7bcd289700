package io.querybridge.core.ratelimit;

import io.querybridge.core.error.RateLimitExceededException;
import java.time.Clock;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token bucket guarding calls to one remote endpoint.
 *
 * <p>
 * The bucket holds up to {@code burstLimit} tokens and refills continuously at
 * {@code requestsPerSecond}. Callers that find it empty join a bounded priority
 * queue (higher priority first, FIFO among equals) and block until a token is
 * theirs. Violations reported by the remote side add a backoff delay that grows
 * with each violation and decays after a minute without one.
 *
 * <p>
 * All state is guarded by a single lock; waiting callers park on its condition.
 */
public final class TokenBucketRateLimiter {

    private static final Logger LOG = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private static final long BACKOFF_DECAY_MS = 60_000;
    private static final int MAX_MULTIPLIER = 10;

    private static final String[] LIMIT_HEADERS = {"x-ratelimit-limit", "x-rate-limit-limit"};
    private static final String[] REMAINING_HEADERS = {"x-ratelimit-remaining", "x-rate-limit-remaining"};
    private static final String[] RESET_HEADERS = {"x-ratelimit-reset", "x-rate-limit-reset"};

    private final RateLimitConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<Waiter> queue = new PriorityQueue<>(
            Comparator.comparingInt(Waiter::priority).reversed().thenComparingLong(Waiter::sequence));

    private double tokens;
    private int capacity;
    private double refillRate;
    private long lastRefill;
    private int backoffMultiplier = 1;
    private int violations;
    private long lastViolation;
    private long sequence;

    public TokenBucketRateLimiter(RateLimitConfig config) {
        this(config, Clock.systemUTC());
    }

    public TokenBucketRateLimiter(RateLimitConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.capacity = config.burstLimit();
        this.tokens = capacity;
        this.refillRate = config.requestsPerSecond();
        this.lastRefill = clock.millis();
    }

    public RateLimitConfig config() {
        return config;
    }

    /** Takes a token if one is free and nobody is queued ahead. Never blocks. */
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (queue.isEmpty() && tokens >= 1) {
                tokens -= 1;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** Equivalent to {@code waitForPermission(0)}. */
    public void waitForPermission() {
        waitForPermission(0);
    }

    /**
     * Blocks until the caller holds a token.
     *
     * @param priority queue priority; higher values are served first
     * @throws RateLimitExceededException if the queue is full, the queue is cleared while waiting,
     *     or the thread is interrupted
     */
    public void waitForPermission(int priority) {
        lock.lock();
        try {
            refill();
            if (queue.isEmpty() && tokens >= 1) {
                tokens -= 1;
                return;
            }
            long backoff = backoffDelay(clock.millis());
            if (backoff > 0) {
                LOG.debug("Backing off {}ms after rate-limit violation", backoff);
                awaitMillis(backoff);
                refill();
                if (queue.isEmpty() && tokens >= 1) {
                    tokens -= 1;
                    return;
                }
            }
            if (queue.size() >= config.queueSize()) {
                LOG.warn("Rate limit queue is full ({} waiting)", queue.size());
                throw new RateLimitExceededException(
                        "Rate limit queue is full", estimateQueueWait(), Map.of("queueSize", config.queueSize()));
            }
            awaitTurn(new Waiter(priority, sequence++));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateLimitExceededException("Interrupted while waiting for rate limit permission", 0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a 429-style violation reported by the remote side.
     *
     * @param resetTime server reset hint (epoch seconds, epoch millis or seconds from now), or
     *     {@code null}
     */
    public void reportViolation(Long resetTime) {
        lock.lock();
        try {
            long now = clock.millis();
            lastViolation = now;
            violations++;
            tokens = Math.max(0, tokens - 1);
            backoffMultiplier = Math.min(backoffMultiplier * 2, MAX_MULTIPLIER);
            if (resetTime != null) {
                lastRefill = Math.max(lastRefill, toEpochMillis(resetTime, now));
                tokens = 0;
            }
            LOG.warn("Rate limit violation reported, backoff multiplier now {}", backoffMultiplier);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Aligns the bucket with the server's {@code x-ratelimit-*} headers. The
     * local bucket never holds more tokens than the server reports remaining.
     *
     * @param headers response headers; names are matched case-insensitively
     */
    public void updateFromHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return;
        }
        Long limit = header(headers, LIMIT_HEADERS);
        Long remaining = header(headers, REMAINING_HEADERS);
        Long reset = header(headers, RESET_HEADERS);
        if (limit == null && remaining == null && reset == null) {
            return;
        }
        lock.lock();
        try {
            long now = clock.millis();
            refill();
            if (limit != null && limit > 0) {
                capacity = (int) Math.min(limit, Integer.MAX_VALUE);
                tokens = Math.min(tokens, capacity);
            }
            if (remaining != null) {
                tokens = Math.min(Math.max(0, remaining), tokens);
                if (remaining <= 0 && reset != null) {
                    lastRefill = Math.max(lastRefill, toEpochMillis(reset, now));
                }
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public RateLimitStatus getStatus() {
        lock.lock();
        try {
            refill();
            long now = clock.millis();
            long untilFull = (long) Math.ceil((capacity - tokens) / refillRate * 1000);
            return new RateLimitStatus(
                    (int) Math.floor(tokens),
                    capacity,
                    Math.max(now, lastRefill) + Math.max(0, untilFull),
                    lastRefill,
                    queue.size(),
                    estimateQueueWait(),
                    backoffMultiplier);
        } finally {
            lock.unlock();
        }
    }

    public int getQueueLength() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /** Fails every queued caller with "Request queue cleared". */
    public void clearQueue() {
        lock.lock();
        try {
            if (!queue.isEmpty()) {
                LOG.debug("Clearing {} queued rate-limit waiters", queue.size());
            }
            for (Waiter waiter : queue) {
                waiter.cancelled = true;
            }
            queue.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Refills the bucket, forgets violations and clears the queue. */
    public void reset() {
        lock.lock();
        try {
            capacity = config.burstLimit();
            tokens = capacity;
            refillRate = config.requestsPerSecond();
            lastRefill = clock.millis();
            backoffMultiplier = 1;
            violations = 0;
            lastViolation = 0;
            clearQueue();
        } finally {
            lock.unlock();
        }
    }

    private void awaitTurn(Waiter waiter) throws InterruptedException {
        queue.add(waiter);
        try {
            while (true) {
                if (waiter.cancelled) {
                    throw new RateLimitExceededException("Request queue cleared", 0);
                }
                refill();
                if (queue.peek() == waiter && tokens >= 1) {
                    queue.poll();
                    tokens -= 1;
                    changed.signalAll();
                    return;
                }
                changed.awaitNanos(TimeUnit.MILLISECONDS.toNanos(Math.max(1, millisUntilNextToken())));
            }
        } catch (InterruptedException e) {
            queue.remove(waiter);
            changed.signalAll();
            throw e;
        }
    }

    private void awaitMillis(long millis) throws InterruptedException {
        long remaining = TimeUnit.MILLISECONDS.toNanos(millis);
        while (remaining > 0) {
            remaining = changed.awaitNanos(remaining);
        }
    }

    private void refill() {
        long now = clock.millis();
        if (now > lastRefill) {
            double added = (now - lastRefill) / 1000.0 * refillRate;
            tokens = Math.min(capacity, tokens + added);
            lastRefill = now;
        }
    }

    private long millisUntilNextToken() {
        long now = clock.millis();
        long blocked = Math.max(0, lastRefill - now);
        double deficit = 1 - tokens;
        if (deficit <= 0) {
            return blocked;
        }
        return blocked + (long) Math.ceil(deficit / refillRate * 1000);
    }

    private long backoffDelay(long now) {
        if (lastViolation == 0) {
            return 0;
        }
        long since = now - lastViolation;
        if (since > BACKOFF_DECAY_MS) {
            backoffMultiplier = 1;
            violations = 0;
            lastViolation = 0;
            return 0;
        }
        long delay = config.backoffStrategy()
                .delay(config.initialBackoffMs(), backoffMultiplier, violations, config.maxBackoffMs());
        return Math.max(0, delay - since);
    }

    private long estimateQueueWait() {
        if (queue.isEmpty()) {
            return 0;
        }
        return (long) Math.ceil(queue.size() / refillRate * 1000);
    }

    private static long toEpochMillis(long reset, long now) {
        if (reset > 100_000_000_000L) {
            return reset;
        }
        if (reset > 1_000_000_000L) {
            return reset * 1000;
        }
        return now + reset * 1000;
    }

    private static Long header(Map<String, String> headers, String[] names) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            String key = entry.getKey() == null ? "" : entry.getKey().toLowerCase(Locale.ROOT);
            for (String name : names) {
                if (name.equals(key) && entry.getValue() != null) {
                    try {
                        return Long.parseLong(entry.getValue().trim());
                    } catch (NumberFormatException e) {
                        LOG.debug("Ignoring non-numeric {} header: {}", name, entry.getValue());
                        return null;
                    }
                }
            }
        }
        return null;
    }

    private static final class Waiter {
        private final int priority;
        private final long sequence;
        private boolean cancelled;

        Waiter(int priority, long sequence) {
            this.priority = priority;
            this.sequence = sequence;
        }

        int priority() {
            return priority;
        }

        long sequence() {
            return sequence;
        }
    }
}
