package io.querybridge.core.pool;

/**
 * Lifecycle callbacks a {@link ConnectionPool} uses to manage its resources.
 *
 * @param <T> pooled resource type
 */
public interface PooledResourceFactory<T> {

    /** Opens a new resource. May block; the pool bounds the wait with its connection timeout. */
    T create() throws Exception;

    /** Returns {@code false} if the resource is no longer usable. Must not throw for a dead resource. */
    boolean validate(T resource);

    /** Releases the resource's underlying handles. Called at most once per resource. */
    void destroy(T resource);
}
