package com.whereq.cadence.dto;

import com.whereq.cadence.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    private JobStatus status;

    /**
     * Number of artifacts the job is expected to produce
     */
    private int estimatedArtifacts;

    /**
     * Where to poll for progress
     */
    private String statusUrl;

    private Instant submittedAt;

    private String message;
}
