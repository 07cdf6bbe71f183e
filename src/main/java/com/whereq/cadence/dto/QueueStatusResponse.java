package com.whereq.cadence.dto;

import com.whereq.cadence.model.QueueItemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Summary of the upload queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusResponse {
    private int total;

    /**
     * Item count per status, every status present
     */
    private Map<QueueItemStatus, Long> counts;

    /**
     * Earliest upcoming publish time of a scheduled item (null if none)
     */
    private Instant nextPublishTime;

    private boolean workerRunning;
}
