package com.whereq.cadence.scheduling;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.model.QueueItem;
import com.whereq.cadence.model.QueueItemStatus;
import com.whereq.cadence.model.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Tracks upload attempts of queue items and decides when a failed item may run again.
 *
 * <p>Delays come from a fixed escalating table indexed by the number of attempts made; once the
 * attempts reach the policy maximum a FAILED item is permanently failed and never scanned again,
 * while a SCHEDULE_FAILED item is left to the publish sweep.
 */
@Slf4j
@Component
public class RetryManager {

    private final RetryPolicy policy;

    @Autowired
    public RetryManager(CadenceProperties properties) {
        this(RetryPolicy.builder()
            .maxAttempts(properties.getRetry().getMaxAttempts())
            .delays(List.copyOf(properties.getRetry().getDelays()))
            .build());
    }

    public RetryManager(RetryPolicy policy) {
        if (policy.getDelays() == null || policy.getDelays().isEmpty()) {
            throw new IllegalArgumentException("Retry delay table must not be empty");
        }
        this.policy = policy;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * Delay required after the given number of attempts
     */
    public Duration delayFor(int attempts) {
        List<Duration> delays = policy.getDelays();
        return delays.get(Math.min(Math.max(attempts, 0), delays.size() - 1));
    }

    public boolean isPermanentlyFailed(QueueItem item) {
        return item.getStatus() == QueueItemStatus.FAILED && item.getUploadAttempts() >= policy.getMaxAttempts();
    }

    /**
     * An uploaded item whose scheduling attempts are used up. It keeps its remote copy and is
     * made public by the publish sweep once its slot is due.
     */
    public boolean isScheduleExhausted(QueueItem item) {
        return item.getStatus() == QueueItemStatus.SCHEDULE_FAILED && item.getUploadAttempts() >= policy.getMaxAttempts();
    }

    /**
     * Check if a FAILED or SCHEDULE_FAILED item may be attempted again
     */
    public boolean isEligible(QueueItem item, Instant now) {
        if (item.getStatus() != QueueItemStatus.FAILED && item.getStatus() != QueueItemStatus.SCHEDULE_FAILED) {
            return false;
        }
        if (item.getUploadAttempts() >= policy.getMaxAttempts()) {
            return false;
        }
        Instant last = item.getLastAttemptTime();
        if (last == null) {
            return true;
        }
        return !now.isBefore(last.plus(delayFor(item.getUploadAttempts())));
    }

    /**
     * Record a failed attempt on the item.
     *
     * @param failedStatus status the item lands in (FAILED for uploads, SCHEDULE_FAILED for scheduling)
     * @return true if the item is now permanently failed
     */
    public boolean recordFailure(QueueItem item, QueueItemStatus failedStatus, String error, Instant now) {
        item.setUploadAttempts(item.getUploadAttempts() + 1);
        item.setLastAttemptTime(now);
        item.setError(error);
        item.setStatus(failedStatus);
        if (failedStatus == QueueItemStatus.FAILED) {
            item.setRemoteId(null);
        }

        if (item.getUploadAttempts() >= policy.getMaxAttempts()) {
            if (failedStatus == QueueItemStatus.SCHEDULE_FAILED) {
                log.error("'{}' out of scheduling attempts after {}, the publish sweep will make it public at {}: {}",
                    item.getTitle(), item.getUploadAttempts(), item.getScheduledPublishTime(), error);
            } else {
                log.error("'{}' failed permanently after {} attempts: {}", item.getTitle(), item.getUploadAttempts(), error);
            }
            return true;
        }
        log.warn("Attempt {} for '{}' failed, next attempt in {}: {}",
            item.getUploadAttempts(), item.getTitle(), delayFor(item.getUploadAttempts()), error);
        return false;
    }

    /**
     * Mark an item permanently failed regardless of remaining attempts
     */
    public void failPermanently(QueueItem item, String error, Instant now) {
        item.setUploadAttempts(Math.max(item.getUploadAttempts(), policy.getMaxAttempts()));
        item.setLastAttemptTime(now);
        item.setError(error);
        item.setStatus(QueueItemStatus.FAILED);
        item.setRemoteId(null);
        log.error("'{}' failed permanently: {}", item.getTitle(), error);
    }

    /**
     * Move eligible FAILED items back to PENDING.
     *
     * @return number of promoted items
     */
    public int promoteEligible(List<QueueItem> items, Instant now) {
        int promoted = 0;
        for (QueueItem item : items) {
            if (item.getStatus() == QueueItemStatus.FAILED && isEligible(item, now)) {
                item.setStatus(QueueItemStatus.PENDING);
                item.setLastAttemptTime(now);
                promoted++;
                log.info("Retrying '{}' (attempt {}/{})", item.getTitle(), item.getUploadAttempts() + 1, policy.getMaxAttempts());
            }
        }
        return promoted;
    }
}
