package io.querybridge.core.pool;

/**
 * A resource leased from a {@link ConnectionPool}. Closing the entry returns it
 * to the pool.
 *
 * @param <T> pooled resource type
 */
public final class PoolEntry<T> implements AutoCloseable {

    private final ConnectionPool<T> owner;
    private final T resource;
    private volatile PoolEntryState state = PoolEntryState.IDLE;
    private volatile long lastUsedAt;
    private volatile long lastValidatedAt;
    private volatile int leaseCount;

    PoolEntry(ConnectionPool<T> owner, T resource, long now) {
        this.owner = owner;
        this.resource = resource;
        this.lastUsedAt = now;
        this.lastValidatedAt = now;
    }

    public T resource() {
        return resource;
    }

    public PoolEntryState state() {
        return state;
    }

    /** Number of times this resource has been leased. */
    public int leaseCount() {
        return leaseCount;
    }

    public long lastValidatedAt() {
        return lastValidatedAt;
    }

    long lastUsedAt() {
        return lastUsedAt;
    }

    void state(PoolEntryState newState) {
        this.state = newState;
    }

    void leased() {
        leaseCount++;
        state = PoolEntryState.ACTIVE;
    }

    void returned(long now) {
        lastUsedAt = now;
        state = PoolEntryState.IDLE;
    }

    void validated(long now) {
        lastValidatedAt = now;
    }

    ConnectionPool<T> owner() {
        return owner;
    }

    @Override
    public void close() {
        owner.release(this);
    }
}
