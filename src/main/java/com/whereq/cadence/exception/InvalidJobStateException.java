package com.whereq.cadence.exception;

/**
 * Exception thrown when a transition out of a terminal job status is requested
 */
public class InvalidJobStateException extends RuntimeException {
    public InvalidJobStateException(String message) {
        super(message);
    }

    public InvalidJobStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
