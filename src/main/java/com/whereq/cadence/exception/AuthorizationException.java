package com.whereq.cadence.exception;

/**
 * Exception thrown for an unknown owner key or an owner mismatch on a job
 */
public class AuthorizationException extends RuntimeException {
    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
