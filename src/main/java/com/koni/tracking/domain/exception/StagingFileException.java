package com.koni.tracking.domain.exception;

/**
 * Exception thrown when a bulk-load staging file or an export file cannot be written.
 */
public class StagingFileException extends RuntimeException {

    public StagingFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
