package io.querybridge.core.model;

/** Lifecycle state of a {@link Connection}. */
public enum ConnectionStatus {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    ERROR
}
