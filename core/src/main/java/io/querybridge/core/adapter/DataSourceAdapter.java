package io.querybridge.core.adapter;

import io.querybridge.core.config.DataSourceConfig;
import io.querybridge.core.model.AdapterCapabilities;
import io.querybridge.core.model.Connection;
import io.querybridge.core.model.ProcessedQuery;
import io.querybridge.core.model.RawResult;
import java.util.List;

/**
 * Uniform contract over one kind of backend.
 *
 * <p>
 * An adapter owns the connections it opens until they are disconnected.
 * Operations block the calling thread; implementations must be safe to call
 * from several threads at once, with calls on one connection executing in issue
 * order.
 *
 * <p>
 * Failures surface as {@link io.querybridge.core.error.DataSourceException}
 * subclasses.
 */
public interface DataSourceAdapter {

    /** Type tag this adapter is registered under, e.g. {@code "sql"}. */
    String type();

    /**
     * Checks {@code config} without any I/O.
     *
     * @throws io.querybridge.core.error.ConfigValidationException if the config is invalid or of
     *     another adapter's type
     */
    void validateConfig(DataSourceConfig config);

    /** Validates {@code config} and opens a connection. */
    Connection connect(DataSourceConfig config);

    /** Runs {@code query} on an open connection. Results are ordered by descending score. */
    List<RawResult> query(Connection connection, ProcessedQuery query);

    /** Closes {@code connection}. Unknown or already closed connections are ignored. */
    void disconnect(Connection connection);

    /** {@code true} if {@code connection} is open and its backend answers. Never throws. */
    boolean healthCheck(Connection connection);

    AdapterCapabilities getCapabilities();

    /** Closes every connection and releases adapter resources. */
    void destroy();
}
