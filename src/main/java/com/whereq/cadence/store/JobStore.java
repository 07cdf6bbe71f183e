package com.whereq.cadence.store;

import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobParameters;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Durable record of generation jobs and their lifecycle
 */
public interface JobStore {

    String INITIAL_MESSAGE = "Job queued for processing";

    /**
     * Create a job in QUEUED status with progress 0
     *
     * @param ownerKey owner (API key) of the job
     * @param parameters submission parameters
     * @param estimatedArtifacts expected number of artifacts
     * @param customJobId caller-supplied id, or null to generate one
     * @return Mono with the created job; errors with ValidationException if the custom id exists
     */
    Mono<Job> create(String ownerKey, JobParameters parameters, int estimatedArtifacts, String customJobId);

    /**
     * Merge a partial update into a job
     *
     * @return Mono with the updated job; errors with JobNotFoundException or InvalidJobStateException
     */
    Mono<Job> update(String jobId, JobUpdate update);

    /**
     * @return Mono with the job; errors with JobNotFoundException
     */
    Mono<Job> get(String jobId);

    Flux<Job> list(JobQuery query);

    /**
     * Count QUEUED and PROCESSING jobs of an owner
     */
    Mono<Long> countActive(String ownerKey);

    /**
     * Delete terminal jobs completed before the cutoff
     *
     * @return Mono with the number of deleted jobs
     */
    Mono<Long> purge(Instant olderThan);
}
