package com.koni.tracking.domain.store;

import org.springframework.jdbc.core.RowMapper;

import java.io.Reader;
import java.util.List;

/**
 * Minimal contract of one live session against the relational data store.
 * 
 * A session is owned by the connection pool and used by exactly one holder at a
 * time. Every user-controlled value travels as a statement parameter; literal
 * escaping is only needed for statements that cannot take parameters.
 * 
 * All methods raise {@link com.koni.tracking.domain.exception.StatementExecutionException}
 * when the store rejects the statement.
 */
public interface DataStoreSession extends AutoCloseable {

    /**
     * Executes a statement that returns no rows.
     *
     * @param sql the statement with {@code ?} placeholders
     * @param params the placeholder values in order
     * @return the number of affected rows
     */
    int execute(String sql, Object... params);

    /**
     * Executes a query and maps every returned row.
     *
     * @param sql the query with {@code ?} placeholders
     * @param mapper maps one row
     * @param params the placeholder values in order
     * @return the mapped rows, empty if none
     */
    <T> List<T> query(String sql, RowMapper<T> mapper, Object... params);

    /**
     * Bulk-loads comma-separated records into a table.
     *
     * @param table the target table
     * @param columns the target columns, in record field order
     * @param records one record per line
     * @return the number of loaded rows
     */
    long bulkLoad(String table, List<String> columns, Reader records);

    /**
     * Quotes a raw string as a safe SQL literal.
     */
    String escapeLiteral(String raw);

    /**
     * Checks that the underlying session is still usable.
     */
    boolean isValid();

    @Override
    void close();
}
