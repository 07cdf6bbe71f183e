package com.whereq.cadence.service;

import com.whereq.cadence.dto.QueueStatusResponse;
import com.whereq.cadence.model.QueueItem;
import com.whereq.cadence.model.QueueItemStatus;
import com.whereq.cadence.store.UploadQueueStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only summary of the upload queue
 */
@Service
public class QueueStatusService {

    private final UploadQueueStore queueStore;
    private final WorkerLifecycle workerLifecycle;
    private final Clock clock;

    public QueueStatusService(UploadQueueStore queueStore, WorkerLifecycle workerLifecycle, Clock clock) {
        this.queueStore = queueStore;
        this.workerLifecycle = workerLifecycle;
        this.clock = clock;
    }

    public Mono<QueueStatusResponse> summary() {
        return Mono.fromCallable(() -> {
            List<QueueItem> items = queueStore.load();
            Map<QueueItemStatus, Long> counts = new EnumMap<>(QueueItemStatus.class);
            for (QueueItemStatus status : QueueItemStatus.values()) {
                counts.put(status, 0L);
            }
            items.stream()
                .map(QueueItem::getStatus)
                .filter(Objects::nonNull)
                .forEach(status -> counts.merge(status, 1L, Long::sum));

            Instant now = clock.instant();
            Instant nextPublish = items.stream()
                .filter(item -> item.getStatus() == QueueItemStatus.SCHEDULED)
                .map(QueueItem::getScheduledPublishTime)
                .filter(Objects::nonNull)
                .filter(time -> time.isAfter(now))
                .min(Instant::compareTo)
                .orElse(null);

            return QueueStatusResponse.builder()
                .total(items.size())
                .counts(counts)
                .nextPublishTime(nextPublish)
                .workerRunning(workerLifecycle.isRunning())
                .build();
        });
    }
}
