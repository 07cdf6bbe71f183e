package com.whereq.cadence.service;

import com.whereq.cadence.config.CadenceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Binds the background loops to the Spring container lifecycle.
 *
 * <p>Each loop runs its passes one at a time; a tick arriving while the previous pass of the
 * same loop is still running is dropped. Loops only share state through the stores.
 */
@Slf4j
@Component
public class WorkerLifecycle implements SmartLifecycle {

    private final PublishPipelineWorker pipelineWorker;
    private final PublishSweeper publishSweeper;
    private final HousekeepingSweeper housekeepingSweeper;
    private final CadenceProperties properties;

    private Scheduler scheduler;
    private Disposable.Composite subscriptions;
    private volatile boolean running = false;

    public WorkerLifecycle(PublishPipelineWorker pipelineWorker,
                           PublishSweeper publishSweeper,
                           HousekeepingSweeper housekeepingSweeper,
                           CadenceProperties properties) {
        this.pipelineWorker = pipelineWorker;
        this.publishSweeper = publishSweeper;
        this.housekeepingSweeper = housekeepingSweeper;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        CadenceProperties.WorkerConfig worker = properties.getWorker();
        scheduler = Schedulers.newSingle("cadence-worker");
        subscriptions = Disposables.composite(
            loop("pipeline", worker.getPollInterval(), Mono.defer(pipelineWorker::runPass)),
            loop("publish-sweep", worker.getPublishInterval(), Mono.defer(publishSweeper::sweep).then()),
            loop("housekeeping", properties.getHousekeeping().getInterval(), Mono.defer(housekeepingSweeper::sweep)));
        running = true;
        log.info("Background worker started (poll={}, publish={}, housekeeping={})",
            worker.getPollInterval(), worker.getPublishInterval(), properties.getHousekeeping().getInterval());
    }

    private Disposable loop(String name, Duration period, Mono<Void> pass) {
        return Flux.interval(Duration.ZERO, period, scheduler)
            .onBackpressureDrop(tick -> log.debug("Skipping {} tick {}, previous pass still running", name, tick))
            .concatMap(tick -> pass
                .doOnError(e -> log.error("{} pass failed", name, e))
                .onErrorResume(e -> Mono.empty()), 1)
            .subscribe();
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        subscriptions.dispose();
        scheduler.dispose();
        running = false;
        log.info("Background worker stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getWorker().isEnabled();
    }
}
