package com.koni.tracking.domain.exception;

/**
 * Exception thrown when a database session cannot be opened.
 * Raised while building the connection pool; no partial pool is ever kept.
 */
public class SessionOpenException extends DatabaseUnavailableException {

    public SessionOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
