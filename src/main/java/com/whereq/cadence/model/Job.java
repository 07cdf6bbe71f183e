package com.whereq.cadence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One content-to-publish pipeline instance
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * API key that submitted the job
     */
    private String ownerKey;

    private JobStatus status;

    /**
     * Progress percentage (0-100)
     */
    private int progress;

    /**
     * Human-readable status message
     */
    private String message;

    private JobParameters parameters;

    private int estimatedArtifacts;

    private int artifactsGenerated;

    private int artifactsPublished;

    /**
     * Last error message (if failed)
     */
    private String error;

    private Instant createdAt;

    private Instant completedAt;
}
