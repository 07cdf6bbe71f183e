package com.whereq.cadence.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → PROCESSING → {COMPLETED, FAILED, CANCELLED}
 * QUEUED → CANCELLED (user request before the worker picks the job)
 */
public enum JobStatus {
    /**
     * Accepted and waiting for the worker
     */
    QUEUED,

    /**
     * Worker is driving the job through generation and upload
     */
    PROCESSING,

    /**
     * All stages finished
     */
    COMPLETED,

    /**
     * Terminated with error
     */
    FAILED,

    /**
     * User-initiated cancellation
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if job still counts against the owner's concurrency cap
     */
    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }
}
