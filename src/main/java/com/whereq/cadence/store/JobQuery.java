package com.whereq.cadence.store;

import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * Filter for listing jobs. Null filters match everything.
 */
@Value
@Builder
public class JobQuery {
    JobStatus status;
    String ownerKey;
    @Builder.Default
    int limit = 50;
    /**
     * Oldest first (worker order) instead of newest first (listing order)
     */
    boolean oldestFirst;

    public boolean matches(Job job) {
        return (status == null || status == job.getStatus())
            && (ownerKey == null || ownerKey.equals(job.getOwnerKey()));
    }

    public Comparator<Job> order() {
        Comparator<Job> byCreated = Comparator.comparing(Job::getCreatedAt);
        return oldestFirst ? byCreated : byCreated.reversed();
    }

    public static JobQuery byStatus(JobStatus status, int limit) {
        return JobQuery.builder().status(status).limit(limit).oldestFirst(true).build();
    }
}
