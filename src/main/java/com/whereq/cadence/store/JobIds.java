package com.whereq.cadence.store;

import java.util.UUID;

final class JobIds {

    private JobIds() {
    }

    /**
     * Generate unique job ID
     */
    static String generate() {
        return "job-" + UUID.randomUUID();
    }
}
