package io.querybridge.core.adapter.sql;

import io.querybridge.core.config.SqlDataSourceConfig;

/** Creates the executor for one SQL connection. */
@FunctionalInterface
public interface SqlExecutorFactory {

    SqlExecutor create(SqlDataSourceConfig config);
}
