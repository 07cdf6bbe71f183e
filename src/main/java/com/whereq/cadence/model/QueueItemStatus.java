package com.whereq.cadence.model;

/**
 * Upload queue item states
 *
 * PENDING → UPLOADED_PRIVATE → {SCHEDULED, SCHEDULE_FAILED} → PUBLISHED
 * FAILED → PENDING (retry manager, while attempts remain)
 */
public enum QueueItemStatus {
    PENDING,
    UPLOADED_PRIVATE,
    SCHEDULED,
    SCHEDULE_FAILED,
    PUBLISHED,
    FAILED;

    /**
     * States in which the item already exists on the publish target.
     */
    public boolean hasRemoteCopy() {
        return this == UPLOADED_PRIVATE || this == SCHEDULED || this == SCHEDULE_FAILED || this == PUBLISHED;
    }

    /**
     * States that hold a claim on a future publish slot.
     */
    public boolean holdsSlot() {
        return this == PENDING || this == SCHEDULED;
    }
}
