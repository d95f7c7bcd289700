package io.querybridge.core.adapter.sql;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.querybridge.core.sql.ParameterizedQuery;
import java.util.List;

/**
 * Driver seam between {@link SqlAdapter} and a database. One executor backs one
 * adapter connection; calls on it are serialized.
 */
public interface SqlExecutor extends AutoCloseable {

    /** Establishes the underlying connection. */
    void open();

    /**
     * Runs a search. Executors that speak SQL run {@code command.query()};
     * others may use the structured fields instead.
     */
    SqlRows search(SearchCommand command);

    /** Runs a SELECT and returns its rows. */
    List<ObjectNode> query(ParameterizedQuery query);

    /** Runs an INSERT, UPDATE or DELETE and returns the affected row count. */
    int update(ParameterizedQuery query);

    /** Round-trips a trivial statement; throws when the database does not answer. */
    void ping();

    /** Whether {@link #query} and {@link #update} are available. */
    default boolean supportsRawSql() {
        return true;
    }

    @Override
    void close();
}
