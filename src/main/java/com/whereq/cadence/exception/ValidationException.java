package com.whereq.cadence.exception;

/**
 * Exception thrown when a submission is rejected before a job is created
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
