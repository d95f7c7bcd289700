package io.querybridge.core.config;

/**
 * Definition of one data source. The variant decides which adapter handles it;
 * handing a config to the adapter of another type fails validation.
 */
public sealed interface DataSourceConfig permits MemoryDataSourceConfig, SqlDataSourceConfig, ApiDataSourceConfig {

    DataSourceType type();

    ConnectionOptions options();
}
