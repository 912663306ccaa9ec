package com.koni.tracking.domain.exception;

/**
 * Exception thrown when the database cannot be reached through the connection pool.
 * This exception indicates that the persistence layer is temporarily unavailable,
 * and the current unit of work should be skipped or reported to the caller.
 */
public class DatabaseUnavailableException extends RuntimeException {
    
    public DatabaseUnavailableException(String message) {
        super(message);
    }
    
    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
