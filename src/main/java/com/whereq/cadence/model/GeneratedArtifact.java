package com.whereq.cadence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Artifact returned by the content generation service
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedArtifact {
    /**
     * Local path or URL of the rendered file
     */
    private String locator;

    /**
     * Content segment the artifact was rendered from (may be null)
     */
    private String segment;
}
