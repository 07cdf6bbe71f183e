package com.whereq.cadence.store;

import com.whereq.cadence.exception.JobNotFoundException;
import com.whereq.cadence.exception.ValidationException;
import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobParameters;
import com.whereq.cadence.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local job store. Jobs are lost on restart; meant for tests and local runs.
 */
@Slf4j
public class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Object lock = new Object();
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Job> create(String ownerKey, JobParameters parameters, int estimatedArtifacts, String customJobId) {
        return Mono.fromCallable(() -> {
            String jobId = customJobId != null ? customJobId : JobIds.generate();
            Job job = Job.builder()
                .jobId(jobId)
                .ownerKey(ownerKey)
                .status(JobStatus.QUEUED)
                .progress(0)
                .message(INITIAL_MESSAGE)
                .parameters(parameters)
                .estimatedArtifacts(estimatedArtifacts)
                .createdAt(clock.instant())
                .build();
            synchronized (lock) {
                if (jobs.containsKey(jobId)) {
                    throw new ValidationException("Job id already exists: " + jobId);
                }
                jobs.put(jobId, job);
            }
            log.info("Created job {}", jobId);
            return job;
        });
    }

    @Override
    public Mono<Job> update(String jobId, JobUpdate update) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                Job current = jobs.get(jobId);
                if (current == null) {
                    throw new JobNotFoundException(jobId);
                }
                Job updated = update.applyTo(current, clock.instant());
                jobs.put(jobId, updated);
                log.debug("Updated job {}: status={}, progress={}%", jobId, updated.getStatus(), updated.getProgress());
                return updated;
            }
        });
    }

    @Override
    public Mono<Job> get(String jobId) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                Job job = jobs.get(jobId);
                if (job == null) {
                    throw new JobNotFoundException(jobId);
                }
                return job;
            }
        });
    }

    @Override
    public Flux<Job> list(JobQuery query) {
        return Flux.defer(() -> {
            List<Job> snapshot;
            synchronized (lock) {
                snapshot = new ArrayList<>(jobs.values());
            }
            return Flux.fromIterable(snapshot)
                .filter(query::matches)
                .sort(query.order())
                .take(query.getLimit());
        });
    }

    @Override
    public Mono<Long> countActive(String ownerKey) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                return jobs.values().stream()
                    .filter(job -> ownerKey.equals(job.getOwnerKey()))
                    .filter(job -> job.getStatus().isActive())
                    .count();
            }
        });
    }

    @Override
    public Mono<Long> purge(Instant olderThan) {
        return Mono.fromCallable(() -> {
            long removed;
            synchronized (lock) {
                int before = jobs.size();
                jobs.values().removeIf(job -> job.getStatus().isTerminal()
                    && job.getCompletedAt() != null
                    && job.getCompletedAt().isBefore(olderThan));
                removed = before - jobs.size();
            }
            if (removed > 0) {
                log.info("Purged {} old jobs", removed);
            }
            return removed;
        });
    }
}
