package com.whereq.cadence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Input parameters captured at submission time
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobParameters {
    /**
     * Source content, segments separated by the segment marker
     */
    private String content;

    /**
     * Voice/style used by the rendering engine
     */
    private String voice;

    /**
     * Speech speed multiplier
     */
    private double speed;

    /**
     * Artifact format
     */
    private ArtifactKind kind;

    /**
     * Requested publish time
     */
    private Instant requestedPublishTime;

    /**
     * Use the requested publish time as the first slot instead of the rolling timeline
     */
    private boolean pinToRequestedTime;
}
