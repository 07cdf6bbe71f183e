package com.whereq.cadence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Retry policy for failed queue items
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Attempts after which an item is permanently failed
     */
    @Builder.Default
    private int maxAttempts = 3;

    /**
     * Escalating wait before the next attempt, indexed by attempts made so far.
     * The last entry caps the delay.
     */
    @Builder.Default
    private List<Duration> delays = List.of(
        Duration.ofMinutes(5),
        Duration.ofMinutes(15),
        Duration.ofMinutes(30),
        Duration.ofMinutes(60),
        Duration.ofMinutes(120));

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }
}
