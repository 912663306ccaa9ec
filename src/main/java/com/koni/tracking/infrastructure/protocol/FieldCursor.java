package com.koni.tracking.infrastructure.protocol;

import com.koni.tracking.domain.exception.ProtocolFormatException;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Arrays;

/**
 * Sequential reader over the {@code ;}-separated fields of one wire record.
 * Empty fields are skipped, so {@code "a;;b;"} reads as {@code a}, {@code b}.
 */
class FieldCursor {

    private static final String DELIMITER = ";";

    private final String[] fields;
    private int position;

    FieldCursor(String record) {
        if (record == null) {
            throw new ProtocolFormatException("Empty wire record");
        }
        this.fields = Arrays.stream(record.trim().split(DELIMITER))
                .map(String::trim)
                .filter(field -> !field.isEmpty())
                .toArray(String[]::new);
    }

    boolean hasNext() {
        return position < fields.length;
    }

    String next(String name) {
        if (!hasNext()) {
            throw new ProtocolFormatException("Missing field '" + name + "' at position " + position);
        }
        return fields[position++];
    }

    int nextInt(String name) {
        String field = next(name);
        try {
            return Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new ProtocolFormatException("Field '" + name + "' is not an integer: " + field, e);
        }
    }

    long nextLong(String name) {
        String field = next(name);
        try {
            return Long.parseLong(field);
        } catch (NumberFormatException e) {
            throw new ProtocolFormatException("Field '" + name + "' is not an integer: " + field, e);
        }
    }

    /**
     * Reads a timestamp in seconds since the epoch.
     */
    Instant nextEpochSecond(String name) {
        long seconds = nextLong(name);
        try {
            return Instant.ofEpochSecond(seconds);
        } catch (DateTimeException e) {
            throw new ProtocolFormatException("Field '" + name + "' is out of the timestamp range: " + seconds, e);
        }
    }

    BigDecimal nextDecimal(String name) {
        String field = next(name);
        try {
            return new BigDecimal(field);
        } catch (NumberFormatException e) {
            throw new ProtocolFormatException("Field '" + name + "' is not a number: " + field, e);
        }
    }

    /**
     * Reads a group count, which must not be negative.
     * The count is not checked against the remaining fields; a short record fails on the first missing field.
     */
    int nextCount(String name) {
        int count = nextInt(name);
        if (count < 0) {
            throw new ProtocolFormatException("Field '" + name + "' must not be negative: " + count);
        }
        return count;
    }
}
