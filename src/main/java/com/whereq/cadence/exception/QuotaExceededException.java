package com.whereq.cadence.exception;

/**
 * Exception thrown when an owner already has the maximum number of active jobs
 */
public class QuotaExceededException extends RuntimeException {
    public QuotaExceededException(String message) {
        super(message);
    }

    public QuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
