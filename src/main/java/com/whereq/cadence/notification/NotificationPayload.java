package com.whereq.cadence.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body posted to the downstream webhook for each committed item
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPayload {
    /**
     * Two-digit sequence within the current upload pass
     */
    private String sequenceId;

    private String preview;

    private String fullContent;

    /**
     * Public locator, empty when upload or scheduling failed
     */
    private String publicUrl;

    /**
     * Downstream target time rendered in the configured zone
     */
    private String targetTime;
}
