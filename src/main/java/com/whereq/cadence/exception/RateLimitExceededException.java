package com.whereq.cadence.exception;

/**
 * Exception thrown when an owner exceeds the submissions-per-minute limit
 */
public class RateLimitExceededException extends RuntimeException {
    public RateLimitExceededException(String message) {
        super(message);
    }

    public RateLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
