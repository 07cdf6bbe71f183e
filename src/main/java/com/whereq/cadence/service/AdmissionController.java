package com.whereq.cadence.service;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.exception.AuthorizationException;
import com.whereq.cadence.exception.QuotaExceededException;
import com.whereq.cadence.exception.RateLimitExceededException;
import com.whereq.cadence.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Admission control for job submissions.
 * Checks the owner key, a per-owner sliding request window and the number of active jobs.
 */
@Slf4j
@Service
public class AdmissionController {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    private final JobStore jobStore;
    private final CadenceProperties properties;
    private final Clock clock;

    /**
     * Request timestamps per owner, guarded by itself. Owners without a request inside the
     * window are evicted.
     */
    private final Map<String, Deque<Instant>> windows = new HashMap<>();

    private final Counter admittedCounter;
    private final Counter rejectedCounter;

    public AdmissionController(JobStore jobStore, CadenceProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.properties = properties;
        this.clock = clock;

        admittedCounter = Counter.builder("cadence.admission.admitted")
            .description("Number of submissions admitted")
            .register(meterRegistry);
        rejectedCounter = Counter.builder("cadence.admission.rejected")
            .description("Number of submissions rejected by rate or concurrency limits")
            .register(meterRegistry);

        if (properties.getAuth().getApiKeys().isEmpty()) {
            log.warn("No API keys configured, any non-empty key is accepted");
        }
    }

    /**
     * Check that the owner key is recognized
     *
     * @throws AuthorizationException if the key is missing or unknown
     */
    public void authenticate(String ownerKey) {
        if (ownerKey == null || ownerKey.isBlank()) {
            throw new AuthorizationException("Missing API key");
        }
        List<String> keys = properties.getAuth().getApiKeys();
        if (!keys.isEmpty() && !keys.contains(ownerKey)) {
            throw new AuthorizationException("Invalid API key");
        }
    }

    /**
     * Admit a submission from the owner
     *
     * @param ownerKey owner (API key) of the submission
     * @return empty Mono if admitted; errors with AuthorizationException,
     *         RateLimitExceededException or QuotaExceededException
     */
    public Mono<Void> admit(String ownerKey) {
        return Mono.fromRunnable(() -> {
                authenticate(ownerKey);
                recordRequest(ownerKey);
            })
            .then(jobStore.countActive(ownerKey))
            .flatMap(active -> {
                int max = properties.getLimits().getMaxConcurrentJobs();
                if (active >= max) {
                    rejectedCounter.increment();
                    log.warn("Submission rejected: owner has {} active jobs (max {})", active, max);
                    return Mono.<Void>error(new QuotaExceededException(
                        "Too many active jobs: " + active + " (max " + max + ")"));
                }
                admittedCounter.increment();
                return Mono.<Void>empty();
            });
    }

    private void recordRequest(String ownerKey) {
        int limit = properties.getLimits().getMaxRequestsPerMinute();
        Instant now = clock.instant();
        Instant windowStart = now.minus(WINDOW);
        synchronized (windows) {
            windows.values().removeIf(deque -> deque.isEmpty() || !deque.peekLast().isAfter(windowStart));
            Deque<Instant> requests = windows.computeIfAbsent(ownerKey, key -> new ArrayDeque<>());
            while (!requests.isEmpty() && !requests.peekFirst().isAfter(windowStart)) {
                requests.pollFirst();
            }
            if (requests.size() >= limit) {
                rejectedCounter.increment();
                log.warn("Submission rejected: rate limit of {} per minute reached", limit);
                throw new RateLimitExceededException("Rate limit exceeded: max " + limit + " requests per minute");
            }
            requests.addLast(now);
        }
    }

    int trackedOwners() {
        synchronized (windows) {
            return windows.size();
        }
    }
}
