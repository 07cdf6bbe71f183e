package com.whereq.cadence.dto;

import com.whereq.cadence.model.ArtifactKind;
import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    private String jobId;

    private JobStatus status;

    /**
     * Progress percentage (0-100)
     */
    private int progress;

    private String message;

    private ArtifactKind kind;

    private Instant requestedPublishTime;

    private int estimatedArtifacts;

    private int artifactsGenerated;

    private int artifactsPublished;

    /**
     * Error message (if failed)
     */
    private String error;

    private Instant createdAt;

    private Instant completedAt;

    public static JobStatusResponse from(Job job) {
        JobStatusResponseBuilder builder = JobStatusResponse.builder()
            .jobId(job.getJobId())
            .status(job.getStatus())
            .progress(job.getProgress())
            .message(job.getMessage())
            .estimatedArtifacts(job.getEstimatedArtifacts())
            .artifactsGenerated(job.getArtifactsGenerated())
            .artifactsPublished(job.getArtifactsPublished())
            .error(job.getError())
            .createdAt(job.getCreatedAt())
            .completedAt(job.getCompletedAt());
        if (job.getParameters() != null) {
            builder.kind(job.getParameters().getKind())
                .requestedPublishTime(job.getParameters().getRequestedPublishTime());
        }
        return builder.build();
    }
}
