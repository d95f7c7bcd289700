package io.querybridge.core.connector;

import io.querybridge.core.adapter.DataSourceAdapter;
import io.querybridge.core.error.ConfigValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapter factories by type tag. One adapter instance per type is created on
 * first use and then shared. Thread-safe.
 */
public final class AdapterRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, Supplier<? extends DataSourceAdapter>> factories = new ConcurrentHashMap<>();
    private final Map<String, DataSourceAdapter> instances = new ConcurrentHashMap<>();

    /** Registers (or replaces) the factory for {@code type}. A replaced instance is destroyed. */
    public void register(String type, Supplier<? extends DataSourceAdapter> factory) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        factories.put(type, factory);
        DataSourceAdapter previous = instances.remove(type);
        if (previous != null) {
            previous.destroy();
        }
        LOG.debug("Registered adapter type '{}'", type);
    }

    /**
     * Returns the shared adapter for {@code type}, creating it on first use.
     *
     * @throws ConfigValidationException if no factory is registered for {@code type}
     */
    public DataSourceAdapter adapter(String type) {
        Supplier<? extends DataSourceAdapter> factory = factories.get(type);
        if (factory == null) {
            throw new ConfigValidationException(
                    "Unsupported data source type: " + type + " (registered: " + types() + ")", "type");
        }
        return instances.computeIfAbsent(type, t -> factory.get());
    }

    public boolean isRegistered(String type) {
        return factories.containsKey(type);
    }

    /** Registered type tags, sorted. */
    public Set<String> types() {
        return new TreeSet<>(factories.keySet());
    }

    /** Destroys every instantiated adapter. Factories stay registered. */
    public void destroyAll() {
        List<DataSourceAdapter> adapters = new ArrayList<>(instances.values());
        instances.clear();
        for (DataSourceAdapter adapter : adapters) {
            try {
                adapter.destroy();
            } catch (RuntimeException e) {
                LOG.warn("Failed to destroy {} adapter: {}", adapter.type(), e.getMessage());
            }
        }
    }
}
