package com.whereq.cadence.exception;

/**
 * Exception thrown when a durable store cannot be read or written
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
