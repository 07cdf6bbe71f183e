package com.whereq.cadence.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to generate and publish content.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitRequest {

    /**
     * Source content. For short artifacts each segment becomes one artifact.
     */
    @NotBlank(message = "content must not be empty")
    @Size(max = 50000, message = "content must not exceed 50000 characters")
    private String content;

    /**
     * Voice used by the rendering engine.
     * Options: alloy, echo, fable, onyx, nova, shimmer. Defaults to onyx.
     */
    private String voice;

    /**
     * Speech speed multiplier between 0.5 and 2.0. Defaults to 1.2.
     */
    @DecimalMin(value = "0.5", message = "speed must be at least 0.5")
    @DecimalMax(value = "2.0", message = "speed must be at most 2.0")
    private Double speed;

    /**
     * Artifact kind: short or long. Defaults to short.
     */
    private String kind;

    /**
     * Requested publish time, ISO-8601. Must be in the future.
     */
    @NotBlank(message = "publishAt is required")
    private String publishAt;

    /**
     * Optional caller-chosen job id.
     */
    private String jobId;

    /**
     * Use publishAt as the first slot instead of the rolling timeline.
     */
    private Boolean pinToRequestedTime;
}
