package com.whereq.cadence.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One artifact destined for the publish target, tracked independently of its job.
 *
 * <p>{@code remoteId} is present exactly when {@link QueueItemStatus#hasRemoteCopy()} holds.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueueItem {

    private String itemId;

    /**
     * Job that produced the artifact (null for items enqueued outside a job)
     */
    private String jobId;

    /**
     * Local path or URL of the rendered artifact
     */
    private String artifactLocator;

    private String title;

    private String description;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private QueueItemStatus status;

    /**
     * Identifier assigned by the publish target after upload
     */
    private String remoteId;

    private Instant scheduledPublishTime;

    private Instant addedAt;

    private int uploadAttempts;

    private Instant lastAttemptTime;

    private ArtifactKind kind;

    /**
     * First characters of the content the artifact was generated from
     */
    private String contentSnippet;

    private String error;

    private Instant uploadedAt;

    private Instant publishedAt;

    /**
     * Check the remote id / status invariant
     */
    @JsonIgnore
    public boolean isConsistent() {
        boolean hasRemoteId = remoteId != null && !remoteId.isBlank();
        return status != null && hasRemoteId == status.hasRemoteCopy();
    }
}
