package io.querybridge.core.pool;

import io.querybridge.core.error.ConnectionFailedException;
import io.querybridge.core.error.DataSourceException;
import io.querybridge.core.error.ErrorCategory;
import io.querybridge.core.error.PoolExhaustedException;
import io.querybridge.core.error.QueryExecutionException;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of resources produced by a {@link PooledResourceFactory}.
 *
 * <p>
 * {@link #acquire()} reuses a valid idle resource, otherwise creates one while
 * fewer than {@code maxConnections} exist, otherwise waits up to
 * {@code acquireTimeoutMs}. Released resources go straight to the oldest waiter
 * when there is one. A background sweep destroys resources idle for longer than
 * {@code idleTimeoutMs}.
 *
 * <p>
 * Factory callbacks run outside the pool lock, so a slow create or validate
 * never blocks releases.
 *
 * @param <T> pooled resource type
 */
public final class ConnectionPool<T> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionPool.class);

    private final String name;
    private final PooledResourceFactory<T> factory;
    private final PoolSettings settings;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Deque<PoolEntry<T>> idle = new ArrayDeque<>();
    private final Set<PoolEntry<T>> all = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Deque<Waiter<T>> waiters = new ArrayDeque<>();
    private final ExecutorService creator;
    private final ScheduledExecutorService sweeper;

    private int pendingCreates;
    private boolean closed;
    private long created;
    private long destroyed;
    private long acquired;
    private long timedOut;

    public ConnectionPool(String name, PooledResourceFactory<T> factory, PoolSettings settings) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.creator = Executors.newCachedThreadPool(r -> daemon(r, "querybridge-pool-" + name + "-create"));
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "querybridge-pool-" + name + "-sweep"));
        long period = Math.max(100, settings.idleTimeoutMs() / 2);
        sweeper.scheduleAtFixedRate(this::evictIdle, period, period, TimeUnit.MILLISECONDS);
        LOG.info("Connection pool '{}' started: maxConnections={}, idleTimeoutMs={}",
                name, settings.maxConnections(), settings.idleTimeoutMs());
    }

    public String name() {
        return name;
    }

    public PoolSettings settings() {
        return settings;
    }

    /**
     * Leases a resource. The caller must {@link #release} it (or close the
     * entry).
     *
     * @throws PoolExhaustedException   if no resource became available within the acquire timeout
     * @throws ConnectionFailedException if creation failed or timed out, or the pool is destroyed
     */
    public PoolEntry<T> acquire() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.acquireTimeoutMs());
        while (true) {
            PoolEntry<T> candidate = null;
            boolean create = false;
            lock.lock();
            try {
                ensureOpen();
                candidate = idle.pollFirst();
                if (candidate != null) {
                    candidate.leased();
                } else if (all.size() + pendingCreates < settings.maxConnections()) {
                    pendingCreates++;
                    create = true;
                } else {
                    candidate = awaitHandoff(deadline);
                }
            } finally {
                lock.unlock();
            }

            if (create) {
                return createEntry();
            }
            if (candidate == null) {
                continue;
            }
            if (!settings.validateOnAcquire() || checkValid(candidate)) {
                markAcquired();
                LOG.debug("Pool '{}': leased existing resource (lease #{})", name, candidate.leaseCount());
                return candidate;
            }
            discard(candidate, "failed validation on acquire");
        }
    }

    /**
     * Returns a leased resource. Resources that fail release-time validation
     * are destroyed instead of recycled.
     */
    public void release(PoolEntry<T> entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (entry.owner() != this) {
            throw new IllegalArgumentException("Entry does not belong to pool '" + name + "'");
        }
        if (entry.state() != PoolEntryState.ACTIVE) {
            return;
        }
        if (settings.validateOnRelease() && !checkValid(entry)) {
            discard(entry, "failed validation on release");
            return;
        }
        boolean destroyNow = false;
        lock.lock();
        try {
            if (closed || !all.contains(entry)) {
                destroyNow = true;
                entry.state(PoolEntryState.INVALID);
            } else {
                Waiter<T> waiter = waiters.pollFirst();
                if (waiter != null) {
                    entry.leased();
                    waiter.handoff = entry;
                    available.signalAll();
                } else {
                    entry.returned(System.currentTimeMillis());
                    idle.addLast(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        if (destroyNow) {
            safeDestroy(entry.resource());
        }
    }

    /** Removes a leased resource from the pool and destroys it. */
    public void invalidate(PoolEntry<T> entry) {
        discard(entry, "invalidated by caller");
    }

    /** Runs {@code operation} with a leased resource and always returns it afterwards. */
    public <R> R withConnection(PoolOperation<T, R> operation) {
        PoolEntry<T> entry = acquire();
        boolean broken = false;
        try {
            return operation.apply(entry.resource());
        } catch (Exception e) {
            broken = isRetryable(e);
            if (broken) {
                invalidate(entry);
            }
            throw propagate(e);
        } finally {
            if (!broken) {
                release(entry);
            }
        }
    }

    /**
     * Runs {@code operation} under the pool's {@link RetryPolicy}, acquiring a
     * fresh resource for every attempt. Only retryable failures (see
     * {@link #isRetryable}) are retried.
     */
    public <R> R executeWithRetry(PoolOperation<T, R> operation) {
        RetryPolicy policy = settings.retry();
        RuntimeException last = null;
        for (int attempt = 1; attempt <= policy.attempts(); attempt++) {
            try {
                return withConnection(operation);
            } catch (RuntimeException e) {
                last = e;
                if (!isRetryable(e) || attempt == policy.attempts()) {
                    throw e;
                }
                long delay = policy.delayBeforeRetry(attempt);
                LOG.warn("Pool '{}': attempt {}/{} failed ({}), retrying in {}ms",
                        name, attempt, policy.attempts(), e.getMessage(), delay);
                sleep(delay);
            }
        }
        throw last;
    }

    /** Destroys idle resources unused for longer than the idle timeout. Runs periodically. */
    public void evictIdle() {
        long cutoff = System.currentTimeMillis() - settings.idleTimeoutMs();
        List<PoolEntry<T>> evicted = new ArrayList<>();
        lock.lock();
        try {
            Iterator<PoolEntry<T>> it = idle.iterator();
            while (it.hasNext()) {
                PoolEntry<T> entry = it.next();
                if (entry.lastUsedAt() < cutoff) {
                    it.remove();
                    all.remove(entry);
                    entry.state(PoolEntryState.INVALID);
                    destroyed++;
                    evicted.add(entry);
                }
            }
            if (!evicted.isEmpty()) {
                available.signalAll();
            }
        } finally {
            lock.unlock();
        }
        for (PoolEntry<T> entry : evicted) {
            safeDestroy(entry.resource());
        }
        if (!evicted.isEmpty()) {
            LOG.debug("Pool '{}': evicted {} idle resources", name, evicted.size());
        }
    }

    public PoolStats getStats() {
        lock.lock();
        try {
            return new PoolStats(
                    all.size(), idle.size(), all.size() - idle.size(), waiters.size(), created, destroyed, acquired, timedOut);
        } finally {
            lock.unlock();
        }
    }

    /** Fails all waiters, destroys every resource and stops background work. Idempotent. */
    public void destroy() {
        List<PoolEntry<T>> toDestroy;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toDestroy = new ArrayList<>(all);
            all.clear();
            idle.clear();
            waiters.clear();
            destroyed += toDestroy.size();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        for (PoolEntry<T> entry : toDestroy) {
            entry.state(PoolEntryState.INVALID);
            safeDestroy(entry.resource());
        }
        sweeper.shutdownNow();
        creator.shutdownNow();
        LOG.info("Connection pool '{}' destroyed ({} resources closed)", name, toDestroy.size());
    }

    @Override
    public void close() {
        destroy();
    }

    /**
     * Whether a failure is worth retrying with a fresh resource: pool
     * exhaustion, connection or timeout failures, I/O errors and timeouts.
     * Security and validation failures never are.
     */
    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof PoolExhaustedException) {
                return true;
            }
            if (current instanceof DataSourceException dse) {
                return dse.category() == ErrorCategory.CONNECTION || dse.category() == ErrorCategory.TIMEOUT;
            }
            if (current instanceof IOException || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    // Called with the lock held; returns a handed-off entry or throws on timeout.
    private PoolEntry<T> awaitHandoff(long deadline) {
        Waiter<T> waiter = new Waiter<>();
        waiters.addLast(waiter);
        try {
            while (waiter.handoff == null) {
                ensureOpen();
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    timedOut++;
                    LOG.warn("Pool '{}': acquire timed out after {}ms ({} active)",
                            name, settings.acquireTimeoutMs(), all.size());
                    throw new PoolExhaustedException(
                            "No connection available within " + settings.acquireTimeoutMs() + "ms",
                            Map.of("pool", name, "maxConnections", settings.maxConnections()));
                }
                if (all.size() + pendingCreates < settings.maxConnections() || !idle.isEmpty()) {
                    // capacity freed up; let the caller retry from the top
                    return null;
                }
                available.awaitNanos(remaining);
            }
            return waiter.handoff;
        } catch (InterruptedException e) {
            if (waiter.handoff != null) {
                waiter.handoff.returned(System.currentTimeMillis());
                idle.addFirst(waiter.handoff);
                waiter.handoff = null;
                available.signalAll();
            }
            Thread.currentThread().interrupt();
            throw new ConnectionFailedException("Interrupted while waiting for a connection", "POOL_INTERRUPTED", e);
        } finally {
            if (waiter.handoff == null) {
                waiters.remove(waiter);
            }
        }
    }

    private PoolEntry<T> createEntry() {
        // whichever side flips this first owns the resource: the caller, or the creating task
        // once the caller has given up on it
        AtomicBoolean settled = new AtomicBoolean();
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            T created;
            try {
                created = factory.create();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
            if (!settled.compareAndSet(false, true)) {
                LOG.debug("Pool '{}': destroying connection created after its caller gave up", name);
                safeDestroy(created);
            }
            return created;
        }, creator);
        T resource;
        try {
            resource = future.get(settings.connectionTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (settled.compareAndSet(false, true)) {
                creationFailed();
                throw new ConnectionFailedException(
                        "Connection creation timed out after " + settings.connectionTimeoutMs() + "ms",
                        "CONNECTION_TIMEOUT",
                        e,
                        Map.of("pool", name));
            }
            // the resource arrived between the timeout and the flag check
            resource = future.join();
        } catch (ExecutionException e) {
            creationFailed();
            Throwable cause = e.getCause() instanceof CompletionException ce && ce.getCause() != null
                    ? ce.getCause()
                    : e.getCause();
            if (cause instanceof DataSourceException dse) {
                throw dse;
            }
            throw new ConnectionFailedException(
                    "Failed to create connection: " + cause.getMessage(), "CONNECTION_CREATE_FAILED", cause,
                    Map.of("pool", name));
        } catch (InterruptedException e) {
            if (!settled.compareAndSet(false, true)) {
                safeDestroy(future.join());
            }
            creationFailed();
            Thread.currentThread().interrupt();
            throw new ConnectionFailedException("Interrupted while creating a connection", "POOL_INTERRUPTED", e);
        }

        PoolEntry<T> entry = new PoolEntry<>(this, resource, System.currentTimeMillis());
        boolean destroyNow = false;
        lock.lock();
        try {
            pendingCreates--;
            if (closed) {
                destroyNow = true;
            } else {
                all.add(entry);
                created++;
                acquired++;
                entry.leased();
            }
        } finally {
            lock.unlock();
        }
        if (destroyNow) {
            safeDestroy(resource);
            throw new ConnectionFailedException("Connection pool '" + name + "' is destroyed", "POOL_DESTROYED", null);
        }
        LOG.debug("Pool '{}': created resource ({} total)", name, getStats().total());
        return entry;
    }

    private void creationFailed() {
        lock.lock();
        try {
            pendingCreates--;
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private boolean checkValid(PoolEntry<T> entry) {
        boolean valid;
        try {
            valid = factory.validate(entry.resource());
        } catch (RuntimeException e) {
            LOG.warn("Pool '{}': validation threw {}", name, e.toString());
            valid = false;
        }
        if (valid) {
            entry.validated(System.currentTimeMillis());
        }
        return valid;
    }

    private void discard(PoolEntry<T> entry, String reason) {
        boolean removed;
        lock.lock();
        try {
            removed = all.remove(entry);
            idle.remove(entry);
            entry.state(PoolEntryState.INVALID);
            if (removed) {
                destroyed++;
            }
            available.signalAll();
        } finally {
            lock.unlock();
        }
        if (removed) {
            LOG.debug("Pool '{}': destroying resource, {}", name, reason);
            safeDestroy(entry.resource());
        }
    }

    private void markAcquired() {
        lock.lock();
        try {
            acquired++;
        } finally {
            lock.unlock();
        }
    }

    private void safeDestroy(T resource) {
        try {
            factory.destroy(resource);
        } catch (RuntimeException e) {
            LOG.warn("Pool '{}': failed to destroy resource: {}", name, e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new ConnectionFailedException("Connection pool '" + name + "' is destroyed", "POOL_DESTROYED", null);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionFailedException("Interrupted during retry backoff", "POOL_INTERRUPTED", e);
        }
    }

    private static RuntimeException propagate(Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        if (e instanceof IOException || e instanceof TimeoutException) {
            return new ConnectionFailedException(e.getMessage(), "CONNECTION_IO_ERROR", e);
        }
        return new QueryExecutionException(e.getMessage(), "OPERATION_FAILED", e);
    }

    private static Thread daemon(Runnable r, String threadName) {
        Thread t = new Thread(r, threadName);
        t.setDaemon(true);
        return t;
    }

    private static final class Waiter<T> {
        PoolEntry<T> handoff;
    }
}
