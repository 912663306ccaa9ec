package com.koni.tracking.infrastructure.persistence.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Null-aware column readers shared by the JDBC repository adapters.
 * Flags are stored as 0/1 integers.
 */
public final class ResultSetValues {

    public static final int TRUE = 1;
    public static final int FALSE = 0;

    private ResultSetValues() {
    }

    public static Instant instant(ResultSet row, String column) throws SQLException {
        OffsetDateTime value = row.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    public static Integer nullableInt(ResultSet row, String column) throws SQLException {
        int value = row.getInt(column);
        return row.wasNull() ? null : value;
    }

    public static boolean flag(ResultSet row, String column) throws SQLException {
        return row.getInt(column) == TRUE;
    }

    public static int flag(boolean value) {
        return value ? TRUE : FALSE;
    }
}
