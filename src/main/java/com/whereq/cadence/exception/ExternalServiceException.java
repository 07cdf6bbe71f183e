package com.whereq.cadence.exception;

/**
 * Exception thrown when the generation service, publish target or webhook fails or times out
 */
public class ExternalServiceException extends RuntimeException {
    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
