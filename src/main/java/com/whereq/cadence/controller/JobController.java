package com.whereq.cadence.controller;

import com.whereq.cadence.dto.ErrorResponse;
import com.whereq.cadence.dto.JobCancellationResponse;
import com.whereq.cadence.dto.JobListResponse;
import com.whereq.cadence.dto.JobStatusResponse;
import com.whereq.cadence.dto.JobSubmitRequest;
import com.whereq.cadence.dto.JobSubmitResponse;
import com.whereq.cadence.exception.AuthorizationException;
import com.whereq.cadence.exception.InvalidJobStateException;
import com.whereq.cadence.exception.JobAccessDeniedException;
import com.whereq.cadence.exception.JobNotFoundException;
import com.whereq.cadence.exception.QuotaExceededException;
import com.whereq.cadence.exception.RateLimitExceededException;
import com.whereq.cadence.exception.ValidationException;
import com.whereq.cadence.model.JobStatus;
import com.whereq.cadence.service.JobSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * REST controller for submitting, querying and cancelling publish jobs.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Submit content for generation and scheduled publishing")
public class JobController {

    static final String API_KEY_HEADER = "X-API-Key";

    private final JobSubmissionService jobSubmissionService;

    @PostMapping
    @Operation(summary = "Submit job", description = "Queue content for generation, upload and scheduled publishing")
    public Mono<ResponseEntity<JobSubmitResponse>> submitJob(
            @Valid @RequestBody JobSubmitRequest request,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {

        log.info("Received job submission: kind={}, publishAt={}, {} chars",
            request.getKind(), request.getPublishAt(), request.getContent().length());

        return jobSubmissionService.submitJob(request, apiKey)
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create(response.getStatusUrl()))
                .body(response));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job status", description = "Status, progress and counts of a job")
    public Mono<JobStatusResponse> getJobStatus(
            @PathVariable String jobId,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        return jobSubmissionService.getJob(jobId, apiKey)
            .map(JobStatusResponse::from);
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "The caller's jobs, newest first")
    public Mono<JobListResponse> listJobs(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "50") int limit,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        return Flux.defer(() -> jobSubmissionService.listJobs(apiKey, parseStatus(status), limit))
            .map(JobStatusResponse::from)
            .collectList()
            .map(jobs -> JobListResponse.builder()
                .jobs(jobs)
                .count(jobs.size())
                .build());
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel job", description = "Cancel a queued or processing job")
    public Mono<JobCancellationResponse> cancelJob(
            @PathVariable String jobId,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        log.info("Job cancellation request for {}", jobId);
        return jobSubmissionService.cancelJob(jobId, apiKey);
    }

    private static JobStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown status: " + status, e);
        }
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBindError(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
            .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : error.getField() + " is invalid")
            .collect(Collectors.joining("; "));
        log.warn("Validation error: {}", message);
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Validation error: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(JobAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(JobAccessDeniedException e) {
        log.warn("Access denied: {}", e.getMessage());
        return error(HttpStatus.FORBIDDEN, e.getMessage());
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(AuthorizationException e) {
        log.warn("Authorization error: {}", e.getMessage());
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidJobStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidJobStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler({RateLimitExceededException.class, QuotaExceededException.class})
    public ResponseEntity<ErrorResponse> handleLimits(RuntimeException e) {
        log.warn("Submission limited: {}", e.getMessage());
        return error(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        log.warn("Request rejected: {}", e.getMessage());
        String reason = e.getReason() != null ? e.getReason() : e.getStatusCode().toString();
        return ResponseEntity.status(e.getStatusCode()).body(new ErrorResponse(reason));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(message));
    }
}
