package com.whereq.cadence.service;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.gateway.PublishTargetService;
import com.whereq.cadence.model.QueueItem;
import com.whereq.cadence.model.QueueItemStatus;
import com.whereq.cadence.scheduling.RetryManager;
import com.whereq.cadence.store.UploadQueueStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Promotes SCHEDULED items whose publish time has come to PUBLISHED.
 * A failed visibility change leaves the item in its status for the next sweep.
 *
 * <p>Uploaded items that ran out of scheduling attempts are treated the same way, so a private
 * upload is never stranded.
 */
@Slf4j
@Service
public class PublishSweeper {

    private final UploadQueueStore queueStore;
    private final PublishTargetService publishTarget;
    private final RetryManager retryManager;
    private final CadenceProperties properties;
    private final Clock clock;
    private final Counter publishedCounter;

    public PublishSweeper(UploadQueueStore queueStore,
                          PublishTargetService publishTarget,
                          RetryManager retryManager,
                          CadenceProperties properties,
                          Clock clock,
                          MeterRegistry meterRegistry) {
        this.queueStore = queueStore;
        this.publishTarget = publishTarget;
        this.retryManager = retryManager;
        this.properties = properties;
        this.clock = clock;
        this.publishedCounter = Counter.builder("cadence.queue.published")
            .description("Number of items made public by the publish sweep")
            .register(meterRegistry);
    }

    /**
     * Make every due SCHEDULED or schedule-exhausted item public
     *
     * @return Mono with the number of items published
     */
    public Mono<Long> sweep() {
        return Mono.defer(() -> {
            Instant dueBy = clock.instant().plus(properties.getWorker().getPublishTolerance());
            List<QueueItem> due = queueStore.load().stream()
                .filter(item -> item.getStatus() == QueueItemStatus.SCHEDULED || retryManager.isScheduleExhausted(item))
                .filter(item -> item.getScheduledPublishTime() != null && !item.getScheduledPublishTime().isAfter(dueBy))
                .collect(Collectors.toList());
            if (due.isEmpty()) {
                return Mono.just(0L);
            }
            log.info("Publish sweep: {} item(s) due", due.size());
            return Flux.fromIterable(due)
                .concatMap(this::publish)
                .filter(Boolean::booleanValue)
                .count();
        });
    }

    private Mono<Boolean> publish(QueueItem item) {
        return publishTarget.makePublic(item.getRemoteId())
            .onErrorResume(e -> {
                log.error("Failed to publish '{}': {}", item.getTitle(), e.getMessage());
                return Mono.just(false);
            })
            .doOnNext(published -> {
                if (!published) {
                    log.warn("'{}' stays {}, publish target refused the visibility change", item.getTitle(), item.getStatus());
                    return;
                }
                Instant now = clock.instant();
                queueStore.update(current -> {
                    current.stream()
                        .filter(stored -> item.getItemId() != null && item.getItemId().equals(stored.getItemId()))
                        .forEach(stored -> {
                            stored.setStatus(QueueItemStatus.PUBLISHED);
                            stored.setPublishedAt(now);
                            stored.setError(null);
                        });
                    return current;
                });
                publishedCounter.increment();
                log.info("Published '{}' ({})", item.getTitle(), publishTarget.publicLocator(item.getRemoteId()));
            });
    }
}
