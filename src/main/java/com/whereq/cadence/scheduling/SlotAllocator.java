package com.whereq.cadence.scheduling;

import com.whereq.cadence.model.QueueItem;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes non-overlapping publish timestamps for a batch.
 *
 * <p>Without an explicit anchor the batch starts one interval after the latest future commitment
 * in the queue (or after now), so consecutive batches never share a slot as long as the snapshot
 * is read right before allocating. With an explicit anchor the first slot is the anchor itself.
 */
@Component
public class SlotAllocator {

    public List<Instant> allocate(List<QueueItem> snapshot, int count, Duration interval,
                                  Instant explicitAnchor, Instant now) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }

        List<Instant> slots = new ArrayList<>(count);
        if (explicitAnchor != null) {
            for (int i = 0; i < count; i++) {
                slots.add(explicitAnchor.plus(interval.multipliedBy(i)));
            }
        } else {
            Instant anchor = latestCommitment(snapshot, now);
            for (int i = 1; i <= count; i++) {
                slots.add(anchor.plus(interval.multipliedBy(i)));
            }
        }
        return slots;
    }

    /**
     * Latest future publish time held by a PENDING or SCHEDULED item, or {@code now}
     */
    public Instant latestCommitment(List<QueueItem> snapshot, Instant now) {
        return snapshot.stream()
            .filter(item -> item.getStatus() != null && item.getStatus().holdsSlot())
            .map(QueueItem::getScheduledPublishTime)
            .filter(Objects::nonNull)
            .filter(time -> time.isAfter(now))
            .max(Instant::compareTo)
            .orElse(now);
    }
}
