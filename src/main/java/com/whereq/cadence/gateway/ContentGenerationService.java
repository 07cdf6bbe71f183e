package com.whereq.cadence.gateway;

import com.whereq.cadence.model.ArtifactKind;
import com.whereq.cadence.model.GeneratedArtifact;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Renders content into artifacts (external rendering engine)
 */
public interface ContentGenerationService {

    /**
     * Generate artifacts and wait for the rendering to complete
     *
     * @param content source content
     * @param voice voice/style
     * @param speed speech speed
     * @param kind artifact format
     * @return Mono with the generated artifacts in segment order;
     *         errors with ExternalServiceException on failure or timeout
     */
    Mono<List<GeneratedArtifact>> generate(String content, String voice, double speed, ArtifactKind kind);
}
