package com.koni.tracking.domain.exception;

/**
 * Exception thrown when an inbound wire record does not follow the expected format.
 * A message that fails to parse is never partially applied to the data store.
 */
public class ProtocolFormatException extends RuntimeException {
    
    public ProtocolFormatException(String message) {
        super(message);
    }
    
    public ProtocolFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
