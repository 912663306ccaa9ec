package com.koni.tracking.domain.exception;

/**
 * Exception thrown when a statement fails on a pooled session.
 * Failed statements are never retried.
 */
public class StatementExecutionException extends RuntimeException {

    public StatementExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
