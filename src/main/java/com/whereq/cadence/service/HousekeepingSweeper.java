package com.whereq.cadence.service;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.model.QueueItemStatus;
import com.whereq.cadence.scheduling.RetryManager;
import com.whereq.cadence.store.ArtifactFileStore;
import com.whereq.cadence.store.JobStore;
import com.whereq.cadence.store.UploadQueueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Retention sweep for terminal jobs, finished queue items and old artifact files
 */
@Slf4j
@Service
public class HousekeepingSweeper {

    private final JobStore jobStore;
    private final UploadQueueStore queueStore;
    private final ArtifactFileStore artifactFiles;
    private final RetryManager retryManager;
    private final CadenceProperties properties;
    private final Clock clock;

    public HousekeepingSweeper(JobStore jobStore,
                               UploadQueueStore queueStore,
                               ArtifactFileStore artifactFiles,
                               RetryManager retryManager,
                               CadenceProperties properties,
                               Clock clock) {
        this.jobStore = jobStore;
        this.queueStore = queueStore;
        this.artifactFiles = artifactFiles;
        this.retryManager = retryManager;
        this.properties = properties;
        this.clock = clock;
    }

    public Mono<Void> sweep() {
        CadenceProperties.HousekeepingConfig config = properties.getHousekeeping();
        return Mono.defer(() -> {
            Instant now = clock.instant();
            Instant queueCutoff = now.minus(config.getQueueRetention());
            int pruned = queueStore.prune(item ->
                (item.getStatus() == QueueItemStatus.PUBLISHED || retryManager.isPermanentlyFailed(item))
                    && item.getAddedAt() != null
                    && item.getAddedAt().isBefore(queueCutoff));
            int deletedFiles = artifactFiles.deleteOlderThan(now.minus(config.getFileRetention()));

            return jobStore.purge(now.minus(config.getJobRetention()))
                .doOnNext(purged -> log.info("Housekeeping: purged {} job(s), pruned {} queue item(s), deleted {} file(s)",
                    purged, pruned, deletedFiles))
                .then();
        });
    }
}
