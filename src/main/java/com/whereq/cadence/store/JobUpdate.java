package com.whereq.cadence.store;

import com.whereq.cadence.exception.InvalidJobStateException;
import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Partial job update. Null fields are left unchanged.
 */
@Value
@Builder
public class JobUpdate {
    JobStatus status;
    Integer progress;
    String message;
    String error;
    Integer artifactsGenerated;
    Integer artifactsPublished;
    Instant completedAt;

    /**
     * Merge this update into {@code current}.
     *
     * @throws InvalidJobStateException if the job is already terminal
     */
    public Job applyTo(Job current, Instant now) {
        JobStatus currentStatus = current.getStatus();
        if (currentStatus.isTerminal()) {
            throw new InvalidJobStateException(
                "Job " + current.getJobId() + " is already in terminal status: " + currentStatus);
        }

        JobStatus target = status != null ? status : currentStatus;
        Job.JobBuilder next = current.toBuilder().status(target);

        if (progress != null) {
            int value = Math.max(0, Math.min(100, progress));
            // progress never moves backwards while processing
            if (currentStatus == JobStatus.PROCESSING && target == JobStatus.PROCESSING) {
                value = Math.max(value, current.getProgress());
            }
            next.progress(value);
        }
        if (message != null) {
            next.message(message);
        }
        if (error != null) {
            next.error(error);
        }
        if (artifactsGenerated != null) {
            next.artifactsGenerated(artifactsGenerated);
        }
        if (artifactsPublished != null) {
            next.artifactsPublished(artifactsPublished);
        }
        if (target.isTerminal()) {
            next.completedAt(completedAt != null ? completedAt : now);
        }
        return next.build();
    }

    public static JobUpdate progress(int progress, String message) {
        return JobUpdate.builder()
            .status(JobStatus.PROCESSING)
            .progress(progress)
            .message(message)
            .build();
    }
}
