package com.whereq.cadence.service;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.dto.JobCancellationResponse;
import com.whereq.cadence.dto.JobSubmitRequest;
import com.whereq.cadence.dto.JobSubmitResponse;
import com.whereq.cadence.exception.InvalidJobStateException;
import com.whereq.cadence.exception.JobAccessDeniedException;
import com.whereq.cadence.exception.ValidationException;
import com.whereq.cadence.model.ArtifactKind;
import com.whereq.cadence.model.ContentSegments;
import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobParameters;
import com.whereq.cadence.model.JobStatus;
import com.whereq.cadence.store.JobQuery;
import com.whereq.cadence.store.JobStore;
import com.whereq.cadence.store.JobUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Service for job submission and management
 */
@Slf4j
@Service
public class JobSubmissionService {

    static final Set<String> VOICES = Set.of("alloy", "echo", "fable", "onyx", "nova", "shimmer");
    static final String DEFAULT_VOICE = "onyx";
    static final double DEFAULT_SPEED = 1.2;
    static final double MIN_SPEED = 0.5;
    static final double MAX_SPEED = 2.0;
    private static final int MAX_LIST_LIMIT = 200;
    private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final JobStore jobStore;
    private final AdmissionController admissionController;
    private final CadenceProperties properties;
    private final Clock clock;

    public JobSubmissionService(JobStore jobStore,
                                AdmissionController admissionController,
                                CadenceProperties properties,
                                Clock clock) {
        this.jobStore = jobStore;
        this.admissionController = admissionController;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Submit a job for background processing
     *
     * @param request job request
     * @param ownerKey API key of the caller
     * @return Mono with submission response
     */
    public Mono<JobSubmitResponse> submitJob(JobSubmitRequest request, String ownerKey) {
        return admissionController.admit(ownerKey)
            .then(Mono.fromCallable(() -> toParameters(request)))
            .flatMap(params -> {
                int estimate = ContentSegments.estimate(params.getContent(),
                    properties.getScheduling().getSegmentMarker(), params.getKind());
                return jobStore.create(ownerKey, params, estimate, request.getJobId());
            })
            .map(job -> JobSubmitResponse.builder()
                .jobId(job.getJobId())
                .status(job.getStatus())
                .estimatedArtifacts(job.getEstimatedArtifacts())
                .statusUrl("/api/v1/jobs/" + job.getJobId())
                .submittedAt(job.getCreatedAt())
                .message(job.getMessage())
                .build())
            .doOnSuccess(response -> log.info("Job {} submitted ({} artifact(s) expected)",
                response.getJobId(), response.getEstimatedArtifacts()))
            .doOnError(e -> log.warn("Job submission rejected: {}", e.getMessage()));
    }

    /**
     * Get a job owned by the caller
     */
    public Mono<Job> getJob(String jobId, String ownerKey) {
        return Mono.fromRunnable(() -> admissionController.authenticate(ownerKey))
            .then(jobStore.get(jobId))
            .flatMap(job -> {
                if (!ownerKey.equals(job.getOwnerKey())) {
                    return Mono.error(new JobAccessDeniedException(jobId));
                }
                return Mono.just(job);
            });
    }

    /**
     * List the caller's jobs, newest first
     */
    public Flux<Job> listJobs(String ownerKey, JobStatus status, int limit) {
        return Mono.fromRunnable(() -> admissionController.authenticate(ownerKey))
            .thenMany(Flux.defer(() -> jobStore.list(JobQuery.builder()
                .ownerKey(ownerKey)
                .status(status)
                .limit(Math.max(1, Math.min(limit, MAX_LIST_LIMIT)))
                .build())));
    }

    /**
     * Cancel a queued or processing job
     *
     * @param jobId job identifier
     * @param ownerKey API key of the caller
     * @return Mono with cancellation response
     */
    public Mono<JobCancellationResponse> cancelJob(String jobId, String ownerKey) {
        return getJob(jobId, ownerKey)
            .flatMap(job -> {
                if (job.getStatus().isTerminal()) {
                    return Mono.error(new InvalidJobStateException(
                        "Cannot cancel job in terminal status: " + job.getStatus()));
                }
                return jobStore.update(jobId, JobUpdate.builder()
                    .status(JobStatus.CANCELLED)
                    .message("Job cancelled by user")
                    .build());
            })
            .map(job -> JobCancellationResponse.builder()
                .jobId(jobId)
                .status(job.getStatus())
                .cancelledAt(job.getCompletedAt())
                .message("Job cancelled successfully")
                .build())
            .doOnSuccess(response -> log.info("Job {} cancelled", jobId))
            .doOnError(e -> log.warn("Failed to cancel job {}: {}", jobId, e.getMessage()));
    }

    /**
     * Validate the request and apply defaults
     *
     * @throws ValidationException on any invalid field
     */
    JobParameters toParameters(JobSubmitRequest request) {
        String content = request.getContent();
        if (content == null || content.isBlank()) {
            throw new ValidationException("content must not be empty");
        }
        int maxLength = properties.getLimits().getMaxContentLength();
        if (content.length() > maxLength) {
            throw new ValidationException("content must not exceed " + maxLength + " characters");
        }

        ArtifactKind kind;
        try {
            kind = request.getKind() == null ? ArtifactKind.SHORT : ArtifactKind.fromWireName(request.getKind());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("kind must be one of: short, long", e);
        }

        String voice = request.getVoice() == null ? DEFAULT_VOICE : request.getVoice().trim().toLowerCase(Locale.ROOT);
        if (!VOICES.contains(voice)) {
            throw new ValidationException("voice must be one of: alloy, echo, fable, onyx, nova, shimmer");
        }

        double speed = request.getSpeed() == null ? DEFAULT_SPEED : request.getSpeed();
        if (speed < MIN_SPEED || speed > MAX_SPEED) {
            throw new ValidationException("speed must be between " + MIN_SPEED + " and " + MAX_SPEED);
        }

        if (request.getJobId() != null && !JOB_ID.matcher(request.getJobId()).matches()) {
            throw new ValidationException("jobId must be 1-64 letters, digits, '-' or '_'");
        }

        Instant publishAt = parsePublishTime(request.getPublishAt());
        if (!publishAt.isAfter(clock.instant())) {
            throw new ValidationException("publishAt must be in the future");
        }

        return JobParameters.builder()
            .content(content)
            .voice(voice)
            .speed(speed)
            .kind(kind)
            .requestedPublishTime(publishAt)
            .pinToRequestedTime(Boolean.TRUE.equals(request.getPinToRequestedTime()))
            .build();
    }

    private Instant parsePublishTime(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("publishAt is required");
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value.trim(),
                OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).atZone(ZoneId.of(properties.getScheduling().getZone())).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException("publishAt is not a valid ISO-8601 date-time: " + value, e);
        }
    }
}
