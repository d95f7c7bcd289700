package io.querybridge.core;

import io.querybridge.core.adapter.api.ApiAdapter;
import io.querybridge.core.adapter.memory.MemoryAdapter;
import io.querybridge.core.adapter.sql.SqlAdapter;
import io.querybridge.core.config.DataSourceType;
import io.querybridge.core.connector.DataSourceConnector;

/** Factory for connectors with the built-in adapters registered. */
public final class DataSources {

    private DataSources() {
        // utility class
    }

    /** A new connector with the memory, sql and api adapters registered. */
    public static DataSourceConnector newConnector() {
        DataSourceConnector connector = new DataSourceConnector();
        registerBuiltIns(connector);
        return connector;
    }

    /** Registers the built-in adapters on {@code connector}. */
    public static void registerBuiltIns(DataSourceConnector connector) {
        connector.registerAdapter(DataSourceType.MEMORY.id(), MemoryAdapter::new);
        connector.registerAdapter(DataSourceType.SQL.id(), SqlAdapter::new);
        connector.registerAdapter(DataSourceType.API.id(), ApiAdapter::new);
    }
}
