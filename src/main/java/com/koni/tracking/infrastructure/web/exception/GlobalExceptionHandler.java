package com.koni.tracking.infrastructure.web.exception;

import com.koni.tracking.domain.exception.DatabaseUnavailableException;
import com.koni.tracking.domain.exception.ProtocolFormatException;
import com.koni.tracking.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.RejectedExecutionException;

/**
 * Global exception handler for REST API endpoints.
 * Provides consistent error responses and appropriate HTTP status codes.
 * 
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    
    /**
     * Handle malformed or oversized gateway messages.
     * Returns 400 Bad Request.
     * 
     */
    @ExceptionHandler(ProtocolFormatException.class)
    public ResponseEntity<ErrorResponse> handleProtocolFormatException(ProtocolFormatException ex) {
        log.warn("Protocol format error: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }
    
    /**
     * Handle invalid request arguments such as an unknown message kind or a non-positive feed capacity.
     * Returns 400 Bad Request.
     * 
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }
    
    /**
     * Handle database unavailable exceptions, including an exhausted connection pool.
     * Returns 503 Service Unavailable.
     * 
     */
    @ExceptionHandler(DatabaseUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDatabaseUnavailableException(DatabaseUnavailableException ex) {
        log.error("Database unavailable: {}", ex.getMessage(), ex);
        return serviceUnavailable();
    }
    
    /**
     * Handle packets submitted while ingestion is shutting down.
     * Returns 503 Service Unavailable.
     * 
     */
    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<ErrorResponse> handleRejectedExecutionException(RejectedExecutionException ex) {
        log.warn("Ingestion rejected: {}", ex.getMessage());
        return serviceUnavailable();
    }
    
    /**
     * Handle all other unexpected exceptions.
     * Returns 500 Internal Server Error for unhandled exceptions.
     * 
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        ErrorResponse errorResponse = new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "Internal server error"
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
    
    private static ResponseEntity<ErrorResponse> badRequest(String message) {
        ErrorResponse errorResponse = new ErrorResponse(HttpStatus.BAD_REQUEST.value(), message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }
    
    private static ResponseEntity<ErrorResponse> serviceUnavailable() {
        ErrorResponse errorResponse = new ErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE.value(),
            "Service temporarily unavailable"
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorResponse);
    }
}
