package io.querybridge.core.pool;

/** Work performed with a leased resource. */
@FunctionalInterface
public interface PoolOperation<T, R> {
    R apply(T resource) throws Exception;
}
