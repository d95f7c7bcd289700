package io.querybridge.core.pool;

/** Lifecycle of a pooled resource: {@code IDLE ⇄ ACTIVE}, and {@code INVALID} once it is discarded. */
public enum PoolEntryState {
    IDLE,
    ACTIVE,
    INVALID
}
