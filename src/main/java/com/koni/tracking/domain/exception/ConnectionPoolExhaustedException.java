package com.koni.tracking.domain.exception;

/**
 * Exception thrown when no pooled connection became free within the bounded
 * number of acquisition attempts.
 */
public class ConnectionPoolExhaustedException extends DatabaseUnavailableException {

    public ConnectionPoolExhaustedException(String message) {
        super(message);
    }
}
