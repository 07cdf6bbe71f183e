package com.whereq.cadence.exception;

/**
 * Exception thrown when a recognized owner accesses another owner's job
 */
public class JobAccessDeniedException extends AuthorizationException {
    public JobAccessDeniedException(String jobId) {
        super("Not authorized to access job " + jobId);
    }
}
