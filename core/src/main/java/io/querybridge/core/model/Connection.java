package io.querybridge.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Handle to an open data-source connection. The adapter that created a
 * connection owns its lifecycle until it is disconnected; a pool may lease it
 * but never changes its status.
 *
 * <p>
 * Identity, adapter type, creation time and metadata are immutable. Status and
 * last-use time are updated by the owning adapter and are safe to read from any
 * thread.
 */
public final class Connection {

    private final String id;
    private final String adapterType;
    private final Instant createdAt;
    private final Map<String, Object> metadata;
    private volatile ConnectionStatus status;
    private volatile Instant lastUsedAt;

    public Connection(String id, String adapterType, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.adapterType = Objects.requireNonNull(adapterType, "adapterType must not be null");
        this.createdAt = Instant.now();
        this.lastUsedAt = createdAt;
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.status = ConnectionStatus.CONNECTING;
    }

    public String id() {
        return id;
    }

    /** Type tag of the adapter that created this connection (e.g. {@code "sql"}). */
    public String adapterType() {
        return adapterType;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastUsedAt() {
        return lastUsedAt;
    }

    public ConnectionStatus status() {
        return status;
    }

    /** Adapter-specific, non-secret descriptive data (endpoint, database type, ...). */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /** Typed metadata lookup; returns {@code null} if absent or of another type. */
    public <T> T metadata(String key, Class<T> type) {
        Object value = metadata.get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }

    /** Sets the status and refreshes {@link #lastUsedAt()}. Called by the owning adapter only. */
    public void updateStatus(ConnectionStatus newStatus) {
        this.status = Objects.requireNonNull(newStatus, "status must not be null");
        this.lastUsedAt = Instant.now();
    }

    /** Records a use of this connection without changing its status. */
    public void touch() {
        this.lastUsedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "Connection[id=" + id + ", adapterType=" + adapterType + ", status=" + status + "]";
    }
}
