package com.whereq.cadence.controller;

import com.whereq.cadence.dto.QueueStatusResponse;
import com.whereq.cadence.service.QueueStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Upload queue inspection.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/queue")
@RequiredArgsConstructor
@Tag(name = "Queue", description = "Upload queue status")
public class QueueController {

    private final QueueStatusService queueStatusService;

    @GetMapping("/status")
    @Operation(summary = "Queue status", description = "Item counts per status and the next scheduled publish time")
    public Mono<QueueStatusResponse> status() {
        return queueStatusService.summary();
    }
}
