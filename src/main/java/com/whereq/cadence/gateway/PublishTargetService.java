package com.whereq.cadence.gateway;

import com.whereq.cadence.model.Visibility;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Durable publish target the artifacts are uploaded to
 */
public interface PublishTargetService {

    /**
     * Upload an artifact
     *
     * @return Mono with the remote id assigned by the target
     */
    Mono<String> upload(String locator, String title, String description, List<String> tags, Visibility visibility);

    /**
     * Schedule remote release of an uploaded artifact
     *
     * @return Mono with true if the target accepted the schedule
     */
    Mono<Boolean> schedule(String remoteId, Instant publishAt);

    /**
     * Make an uploaded artifact public immediately
     *
     * @return Mono with true if the target accepted the change
     */
    Mono<Boolean> makePublic(String remoteId);

    /**
     * Public locator of a remote artifact
     */
    String publicLocator(String remoteId);
}
