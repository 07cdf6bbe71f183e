package com.whereq.cadence.service;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.exception.ExternalServiceException;
import com.whereq.cadence.exception.InvalidJobStateException;
import com.whereq.cadence.exception.JobNotFoundException;
import com.whereq.cadence.gateway.ContentGenerationService;
import com.whereq.cadence.gateway.PublishTargetService;
import com.whereq.cadence.model.GeneratedArtifact;
import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobParameters;
import com.whereq.cadence.model.JobStatus;
import com.whereq.cadence.model.QueueItem;
import com.whereq.cadence.model.QueueItemStatus;
import com.whereq.cadence.model.Visibility;
import com.whereq.cadence.notification.NotificationClient;
import com.whereq.cadence.scheduling.RetryManager;
import com.whereq.cadence.scheduling.SlotAllocator;
import com.whereq.cadence.scheduling.TitleDeduplicator;
import com.whereq.cadence.store.ArtifactFileStore;
import com.whereq.cadence.store.JobQuery;
import com.whereq.cadence.store.JobStore;
import com.whereq.cadence.store.JobUpdate;
import com.whereq.cadence.store.UploadQueueStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Drives queued jobs through generate, dedup, enqueue, upload, schedule and notify.
 *
 * <p>One pass promotes retry-eligible items, retries failed scheduling calls, runs queued jobs
 * oldest first and finally drains pending items left over from earlier passes. Passes are
 * serialized by {@link WorkerLifecycle}; nothing here is safe to run concurrently.
 */
@Slf4j
@Service
public class PublishPipelineWorker {

    private static final int MAX_TITLE_LENGTH = 100;
    private static final int SNIPPET_LENGTH = 200;

    private final JobStore jobStore;
    private final UploadQueueStore queueStore;
    private final ArtifactFileStore artifactFiles;
    private final ContentGenerationService generationService;
    private final PublishTargetService publishTarget;
    private final NotificationClient notificationClient;
    private final TitleDeduplicator deduplicator;
    private final SlotAllocator slotAllocator;
    private final RetryManager retryManager;
    private final CadenceProperties properties;
    private final Clock clock;

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter uploadedCounter;
    private final Counter uploadFailureCounter;
    private final Counter duplicateCounter;

    public PublishPipelineWorker(JobStore jobStore,
                                 UploadQueueStore queueStore,
                                 ArtifactFileStore artifactFiles,
                                 ContentGenerationService generationService,
                                 PublishTargetService publishTarget,
                                 NotificationClient notificationClient,
                                 TitleDeduplicator deduplicator,
                                 SlotAllocator slotAllocator,
                                 RetryManager retryManager,
                                 CadenceProperties properties,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.queueStore = queueStore;
        this.artifactFiles = artifactFiles;
        this.generationService = generationService;
        this.publishTarget = publishTarget;
        this.notificationClient = notificationClient;
        this.deduplicator = deduplicator;
        this.slotAllocator = slotAllocator;
        this.retryManager = retryManager;
        this.properties = properties;
        this.clock = clock;

        completedCounter = Counter.builder("cadence.jobs.completed")
            .description("Number of jobs completed")
            .register(meterRegistry);
        failedCounter = Counter.builder("cadence.jobs.failed")
            .description("Number of jobs failed")
            .register(meterRegistry);
        uploadedCounter = Counter.builder("cadence.queue.uploaded")
            .description("Number of items uploaded to the publish target")
            .register(meterRegistry);
        uploadFailureCounter = Counter.builder("cadence.queue.upload.failures")
            .description("Number of failed upload attempts")
            .register(meterRegistry);
        duplicateCounter = Counter.builder("cadence.queue.duplicates")
            .description("Number of artifacts skipped as duplicates")
            .register(meterRegistry);
    }

    /**
     * Run one worker pass
     */
    public Mono<Void> runPass() {
        return Mono.fromRunnable(this::promoteRetries)
            .then(retryScheduling())
            .thenMany(jobStore.list(JobQuery.byStatus(JobStatus.QUEUED, properties.getWorker().getBatchSize())))
            .concatMap(this::processJob)
            .then(Mono.defer(this::drainPending));
    }

    /**
     * Move retry-eligible FAILED items back to PENDING
     */
    void promoteRetries() {
        Instant now = clock.instant();
        int[] promoted = new int[1];
        List<QueueItem> current = queueStore.load();
        if (current.stream().noneMatch(item -> item.getStatus() == QueueItemStatus.FAILED
            && retryManager.isEligible(item, now))) {
            return;
        }
        queueStore.update(items -> {
            promoted[0] = retryManager.promoteEligible(items, now);
            return items;
        });
        log.info("Promoted {} failed item(s) for retry", promoted[0]);
    }

    /**
     * Process a single queued job. Errors are recorded on the job, never propagated.
     */
    public Mono<Void> processJob(Job job) {
        String jobId = job.getJobId();
        JobParameters params = job.getParameters();
        log.info("Processing job {} ({} chars, kind={})", jobId,
            params.getContent() != null ? params.getContent().length() : 0, params.getKind());

        return jobStore.update(jobId, JobUpdate.progress(10, "Starting generation..."))
            .then(ensureActive(jobId))
            .then(jobStore.update(jobId, JobUpdate.progress(20, "Calling generation service...")))
            .then(Mono.defer(() -> generationService.generate(
                params.getContent(), params.getVoice(), params.getSpeed(), params.getKind())))
            .flatMap(artifacts -> {
                if (artifacts.isEmpty()) {
                    return Mono.error(new ExternalServiceException("Generation service returned no artifacts"));
                }
                return ensureActive(jobId).thenReturn(artifacts);
            })
            .flatMap(artifacts -> jobStore.update(jobId, JobUpdate.builder()
                    .status(JobStatus.PROCESSING)
                    .progress(50)
                    .message("Generated " + artifacts.size() + " artifact(s)")
                    .artifactsGenerated(artifacts.size())
                    .build())
                .thenReturn(artifacts))
            .flatMap(artifacts -> Mono.fromCallable(() -> enqueue(job, artifacts))
                .flatMap(items -> jobStore.update(jobId, JobUpdate.progress(60,
                        "Queued " + items.size() + " artifact(s) for upload"))
                    .thenReturn(items))
                .flatMap(items -> uploadBatch(job, items))
                .flatMap(uploaded -> jobStore.update(jobId, JobUpdate.builder()
                    .status(JobStatus.COMPLETED)
                    .progress(100)
                    .message("Completed: generated " + artifacts.size() + ", uploaded " + uploaded)
                    .artifactsPublished(uploaded)
                    .build())))
            .doOnNext(completed -> {
                completedCounter.increment();
                log.info("Job {} completed: {}", jobId, completed.getMessage());
            })
            .then()
            .onErrorResume(e -> handleJobError(jobId, e));
    }

    private Mono<Void> handleJobError(String jobId, Throwable error) {
        if (error instanceof InvalidJobStateException) {
            log.info("Job {} stopped: {}", jobId, error.getMessage());
            return Mono.empty();
        }
        log.error("Job {} failed: {}", jobId, error.getMessage(), error);
        failedCounter.increment();
        return jobStore.update(jobId, JobUpdate.builder()
                .status(JobStatus.FAILED)
                .message("Failed: " + error.getMessage())
                .error(error.getMessage())
                .build())
            .then()
            .onErrorResume(e -> {
                log.warn("Could not record failure of job {}: {}", jobId, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Errors with InvalidJobStateException once the job has left the active states
     */
    private Mono<Job> ensureActive(String jobId) {
        return jobStore.get(jobId)
            .flatMap(current -> {
                if (current.getStatus().isTerminal()) {
                    return Mono.error(new InvalidJobStateException(
                        "Job " + jobId + " is " + current.getStatus() + ", stopping"));
                }
                return Mono.just(current);
            });
    }

    /**
     * Deduplicate, allocate slots and append the batch to the queue in one locked update
     *
     * @return items accepted into the queue
     */
    List<QueueItem> enqueue(Job job, List<GeneratedArtifact> artifacts) {
        JobParameters params = job.getParameters();
        Instant anchor = params.isPinToRequestedTime() ? params.getRequestedPublishTime() : null;
        CadenceProperties.PublishTargetConfig target = properties.getPublishTarget();
        List<QueueItem> batch = new ArrayList<>();

        queueStore.update(current -> {
            Instant now = clock.instant();
            List<QueueItem> seen = new ArrayList<>(current);
            for (GeneratedArtifact artifact : artifacts) {
                String title = titleFor(artifact.getLocator());
                if (deduplicator.isDuplicate(title, seen, now)) {
                    duplicateCounter.increment();
                    log.warn("Job {}: skipping duplicate '{}'", job.getJobId(), title);
                    continue;
                }
                String source = artifact.getSegment() != null ? artifact.getSegment() : params.getContent();
                QueueItem item = QueueItem.builder()
                    .itemId(UUID.randomUUID().toString())
                    .jobId(job.getJobId())
                    .artifactLocator(artifact.getLocator())
                    .title(title)
                    .description(target.getDefaultDescription())
                    .tags(new ArrayList<>(target.getDefaultTags()))
                    .status(QueueItemStatus.PENDING)
                    .addedAt(now)
                    .kind(params.getKind())
                    .contentSnippet(snippet(source))
                    .build();
                seen.add(item);
                batch.add(item);
            }

            List<Instant> slots = slotAllocator.allocate(current, batch.size(),
                properties.getScheduling().getInterval(), anchor, now);
            for (int i = 0; i < batch.size(); i++) {
                batch.get(i).setScheduledPublishTime(slots.get(i));
                log.info("Job {}: queued '{}' for {}", job.getJobId(), batch.get(i).getTitle(), slots.get(i));
            }
            current.addAll(batch);
            return current;
        });
        return batch;
    }

    private Mono<Integer> uploadBatch(Job job, List<QueueItem> items) {
        if (items.isEmpty()) {
            return Mono.just(0);
        }
        String jobId = job.getJobId();
        String content = job.getParameters().getContent();
        AtomicInteger uploaded = new AtomicInteger();
        int total = items.size();
        notificationClient.resetSequence();

        return Flux.fromIterable(items)
            .concatMap(item -> ensureActive(jobId)
                .then(uploadItem(item, content))
                .flatMap(success -> {
                    if (!success) {
                        return Mono.just(false);
                    }
                    int count = uploaded.incrementAndGet();
                    int progress = Math.min(99, 60 + (40 * count) / total);
                    return jobStore.update(jobId, JobUpdate.builder()
                            .status(JobStatus.PROCESSING)
                            .progress(progress)
                            .message("Uploaded " + count + "/" + total + " artifact(s)")
                            .artifactsPublished(count)
                            .build())
                        .thenReturn(true);
                }))
            .then(Mono.fromSupplier(uploaded::get));
    }

    /**
     * Upload pending items not tied to an active job run, in queue order
     */
    Mono<Void> drainPending() {
        List<QueueItem> pending = queueStore.load().stream()
            .filter(item -> item.getStatus() == QueueItemStatus.PENDING)
            .collect(Collectors.toList());
        if (pending.isEmpty()) {
            return Mono.empty();
        }
        log.info("Draining {} pending item(s)", pending.size());
        notificationClient.resetSequence();

        return Flux.fromIterable(pending)
            .concatMap(item -> owningJob(item)
                .flatMap(job -> {
                    if (job.getStatus() == JobStatus.CANCELLED) {
                        retryManager.failPermanently(item, "Job cancelled", clock.instant());
                        persist(item);
                        return Mono.just(false);
                    }
                    return uploadItem(item, job.getParameters().getContent());
                })
                .switchIfEmpty(Mono.defer(() -> uploadItem(item, item.getContentSnippet()))))
            .then();
    }

    /**
     * Job that produced the item, empty once the job has been purged
     */
    private Mono<Job> owningJob(QueueItem item) {
        if (item.getJobId() == null) {
            return Mono.empty();
        }
        return jobStore.get(item.getJobId())
            .onErrorResume(JobNotFoundException.class, e -> {
                log.debug("Job {} of '{}' is gone, notifying with the stored snippet", item.getJobId(), item.getTitle());
                return Mono.empty();
            });
    }

    /**
     * Upload one item and schedule its release.
     *
     * @return true if the item reached the publish target
     */
    Mono<Boolean> uploadItem(QueueItem item, String content) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            String locator = item.getArtifactLocator();
            if (!artifactFiles.exists(locator)) {
                uploadFailureCounter.increment();
                retryManager.failPermanently(item, "Artifact not found: " + locator, now);
                persist(item);
                return Mono.just(false);
            }

            boolean future = item.getScheduledPublishTime() != null && item.getScheduledPublishTime().isAfter(now);
            Visibility visibility = future ? Visibility.PRIVATE : Visibility.PUBLIC;
            log.info("Uploading '{}' ({}, publish at {})", item.getTitle(), visibility, item.getScheduledPublishTime());

            return publishTarget.upload(locator, item.getTitle(), item.getDescription(), item.getTags(), visibility)
                .onErrorResume(e -> {
                    uploadFailureCounter.increment();
                    retryManager.recordFailure(item, QueueItemStatus.FAILED, e.getMessage(), clock.instant());
                    persist(item);
                    return notificationClient.send(content, "", item.getScheduledPublishTime())
                        .then(Mono.<String>empty());
                })
                .flatMap(remoteId -> {
                    uploadedCounter.increment();
                    Instant uploadedAt = clock.instant();
                    item.setRemoteId(remoteId);
                    item.setUploadedAt(uploadedAt);
                    item.setError(null);
                    item.setArtifactLocator(artifactFiles.moveToProcessed(locator));
                    if (!future) {
                        item.setStatus(QueueItemStatus.PUBLISHED);
                        item.setPublishedAt(uploadedAt);
                        persist(item);
                        log.info("'{}' published immediately, slot already passed", item.getTitle());
                        return Mono.just(item);
                    }
                    item.setStatus(QueueItemStatus.UPLOADED_PRIVATE);
                    persist(item);
                    return schedule(item);
                })
                .flatMap(committed -> notificationClient
                    .send(content, publicLocatorOf(committed), committed.getScheduledPublishTime())
                    .thenReturn(true))
                .defaultIfEmpty(false);
        });
    }

    /**
     * Public URL for the notification, empty while the item is not scheduled or published
     */
    private String publicLocatorOf(QueueItem item) {
        if (item.getStatus() == QueueItemStatus.SCHEDULE_FAILED) {
            return "";
        }
        return publishTarget.publicLocator(item.getRemoteId());
    }

    private Mono<QueueItem> schedule(QueueItem item) {
        return publishTarget.schedule(item.getRemoteId(), item.getScheduledPublishTime())
            .onErrorResume(e -> {
                log.warn("Scheduling '{}' failed: {}", item.getTitle(), e.getMessage());
                return Mono.just(false);
            })
            .map(scheduled -> {
                if (scheduled) {
                    item.setStatus(QueueItemStatus.SCHEDULED);
                    item.setError(null);
                    log.info("'{}' scheduled for {}", item.getTitle(), item.getScheduledPublishTime());
                } else {
                    retryManager.recordFailure(item, QueueItemStatus.SCHEDULE_FAILED,
                        "Scheduling failed, item uploaded as private", clock.instant());
                }
                persist(item);
                return item;
            });
    }

    /**
     * Re-attempt scheduling of uploaded items whose schedule call failed, without re-uploading
     */
    Mono<Void> retryScheduling() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            List<QueueItem> due = queueStore.load().stream()
                .filter(item -> item.getStatus() == QueueItemStatus.SCHEDULE_FAILED)
                .filter(item -> retryManager.isEligible(item, now))
                .collect(Collectors.toList());
            return Flux.fromIterable(due)
                .concatMap(this::retrySchedule)
                .then();
        });
    }

    private Mono<Void> retrySchedule(QueueItem item) {
        Instant now = clock.instant();
        boolean slotPassed = !item.getScheduledPublishTime().isAfter(now);
        Mono<Boolean> call = slotPassed
            ? publishTarget.makePublic(item.getRemoteId())
            : publishTarget.schedule(item.getRemoteId(), item.getScheduledPublishTime());

        return call
            .onErrorResume(e -> {
                log.warn("Retrying schedule of '{}' failed: {}", item.getTitle(), e.getMessage());
                return Mono.just(false);
            })
            .doOnNext(success -> {
                if (success && slotPassed) {
                    item.setStatus(QueueItemStatus.PUBLISHED);
                    item.setPublishedAt(clock.instant());
                    item.setError(null);
                    log.info("'{}' made public, slot passed while scheduling was failing", item.getTitle());
                } else if (success) {
                    item.setStatus(QueueItemStatus.SCHEDULED);
                    item.setError(null);
                    log.info("'{}' scheduled for {} on retry", item.getTitle(), item.getScheduledPublishTime());
                } else {
                    retryManager.recordFailure(item, QueueItemStatus.SCHEDULE_FAILED, "Scheduling retry failed", clock.instant());
                }
                persist(item);
            })
            .then();
    }

    /**
     * Replace the stored copy of the item (matched by item id)
     */
    void persist(QueueItem item) {
        queueStore.update(current -> {
            boolean replaced = false;
            for (int i = 0; i < current.size(); i++) {
                if (item.getItemId() != null && item.getItemId().equals(current.get(i).getItemId())) {
                    current.set(i, item);
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                log.warn("Item '{}' no longer in queue, re-adding", item.getTitle());
                current.add(item);
            }
            return current;
        });
    }

    /**
     * File name without extension, underscores as spaces, capped at 100 characters
     */
    static String titleFor(String locator) {
        String name = locator;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int query = name.indexOf('?');
        if (query >= 0) {
            name = name.substring(0, query);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        String title = name.replace('_', ' ').strip();
        return title.length() > MAX_TITLE_LENGTH ? title.substring(0, MAX_TITLE_LENGTH) : title;
    }

    static String snippet(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > SNIPPET_LENGTH ? content.substring(0, SNIPPET_LENGTH) : content;
    }
}
