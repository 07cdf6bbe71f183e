package com.whereq.cadence.controller;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.service.WorkerLifecycle;
import com.whereq.cadence.store.JobQuery;
import com.whereq.cadence.store.JobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Health check controller to verify service, job store and worker status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final JobStore jobStore;
    private final WorkerLifecycle workerLifecycle;
    private final CadenceProperties properties;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service, job store and worker are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return jobStore.list(JobQuery.builder().limit(1).build())
            .then(Mono.fromCallable(() -> {
                Map<String, Object> health = base();
                health.put("jobStore", Map.of(
                    "type", properties.getJobStore().getType().name().toLowerCase(Locale.ROOT),
                    "status", "CONNECTED"));
                return ResponseEntity.ok(health);
            }))
            .onErrorResume(e -> {
                Map<String, Object> health = base();
                health.put("jobStore", Map.of(
                    "type", properties.getJobStore().getType().name().toLowerCase(Locale.ROOT),
                    "status", "ERROR",
                    "error", String.valueOf(e.getMessage())));
                return Mono.just(ResponseEntity.ok(health));
            });
    }

    private Map<String, Object> base() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "whereq-cadence");
        health.put("worker", workerLifecycle.isRunning() ? "RUNNING" : "STOPPED");
        return health;
    }
}
