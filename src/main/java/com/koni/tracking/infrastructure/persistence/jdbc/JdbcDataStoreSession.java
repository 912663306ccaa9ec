package com.koni.tracking.infrastructure.persistence.jdbc;

import com.koni.tracking.domain.exception.DatabaseUnavailableException;
import com.koni.tracking.domain.exception.StatementExecutionException;
import com.koni.tracking.domain.store.DataStoreSession;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.core.BaseConnection;
import org.postgresql.core.Utils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.SQLExceptionSubclassTranslator;

import java.io.IOException;
import java.io.Reader;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * {@link DataStoreSession} over one PostgreSQL JDBC connection.
 * Statements run through a {@link JdbcTemplate} bound to that single connection;
 * {@link Instant} parameters are sent as UTC timestamps.
 */
@Slf4j
public class JdbcDataStoreSession implements DataStoreSession {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final int serialId;
    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;

    public JdbcDataStoreSession(int serialId, Connection connection) {
        this.serialId = serialId;
        this.connection = connection;
        // The pool owns the connection; the template must never close it
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true), true);
        this.jdbcTemplate.setExceptionTranslator(new SQLExceptionSubclassTranslator());
    }

    @Override
    public int execute(String sql, Object... params) {
        try {
            return jdbcTemplate.update(sql, toJdbcValues(params));
        } catch (DataAccessException e) {
            throw new StatementExecutionException("Statement failed on session " + serialId + ": " + sql, e);
        }
    }

    @Override
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        try {
            return jdbcTemplate.query(sql, mapper, toJdbcValues(params));
        } catch (DataAccessException e) {
            throw new StatementExecutionException("Query failed on session " + serialId + ": " + sql, e);
        }
    }

    @Override
    public long bulkLoad(String table, List<String> columns, Reader records) {
        String copy = "COPY " + table + " (" + String.join(", ", columns) + ") FROM STDIN WITH (FORMAT csv)";
        try {
            long loaded = connection.unwrap(PGConnection.class).getCopyAPI().copyIn(copy, records);
            log.debug("Bulk-loaded {} rows into {} on session {}", loaded, table, serialId);
            return loaded;
        } catch (SQLException | IOException e) {
            throw new StatementExecutionException("Bulk load into " + table + " failed on session " + serialId, e);
        }
    }

    @Override
    public String escapeLiteral(String raw) {
        try {
            boolean standardConformingStrings = connection.unwrap(BaseConnection.class).getStandardConformingStrings();
            return "'" + Utils.escapeLiteral(null, raw, standardConformingStrings) + "'";
        } catch (SQLException e) {
            throw new StatementExecutionException("Cannot escape literal on session " + serialId, e);
        }
    }

    @Override
    public boolean isValid() {
        try {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Validation of session {} failed: {}", serialId, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new DatabaseUnavailableException("Failed to close session " + serialId, e);
        }
    }

    private static Object[] toJdbcValues(Object... params) {
        Object[] values = new Object[params.length];
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            values[i] = value instanceof Instant
                    ? OffsetDateTime.ofInstant((Instant) value, ZoneOffset.UTC)
                    : value;
        }
        return values;
    }
}
