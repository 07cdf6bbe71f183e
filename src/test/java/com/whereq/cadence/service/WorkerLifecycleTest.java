package com.whereq.cadence.service;

import com.whereq.cadence.config.CadenceProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkerLifecycleTest {

    private final PublishPipelineWorker pipelineWorker = mock(PublishPipelineWorker.class);
    private final PublishSweeper publishSweeper = mock(PublishSweeper.class);
    private final HousekeepingSweeper housekeepingSweeper = mock(HousekeepingSweeper.class);
    private final CadenceProperties properties = new CadenceProperties();
    private WorkerLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        properties.getWorker().setPollInterval(Duration.ofMillis(20));
        properties.getWorker().setPublishInterval(Duration.ofMillis(20));
        properties.getHousekeeping().setInterval(Duration.ofHours(1));
        when(publishSweeper.sweep()).thenReturn(Mono.just(0L));
        when(housekeepingSweeper.sweep()).thenReturn(Mono.empty());
        lifecycle = new WorkerLifecycle(pipelineWorker, publishSweeper, housekeepingSweeper, properties);
    }

    @AfterEach
    void tearDown() {
        lifecycle.stop();
    }

    @Test
    void shouldKeepTickingAfterFailedPass() throws InterruptedException {
        AtomicInteger passes = new AtomicInteger();
        CountDownLatch threePasses = new CountDownLatch(3);
        when(pipelineWorker.runPass()).thenAnswer(invocation -> Mono.defer(() -> {
            threePasses.countDown();
            return passes.incrementAndGet() == 1
                ? Mono.error(new IllegalStateException("generation service unreachable"))
                : Mono.empty();
        }));

        lifecycle.start();

        assertThat(threePasses.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(lifecycle.isRunning()).isTrue();
    }

    @Test
    void shouldKeepTickingWhenPassThrowsBeforeSubscription() throws InterruptedException {
        CountDownLatch recovered = new CountDownLatch(1);
        when(publishSweeper.sweep())
            .thenThrow(new IllegalStateException("queue file locked"))
            .thenAnswer(invocation -> {
                recovered.countDown();
                return Mono.just(1L);
            });
        when(pipelineWorker.runPass()).thenReturn(Mono.empty());

        lifecycle.start();

        assertThat(recovered.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void shouldStopAndRestart() {
        when(pipelineWorker.runPass()).thenReturn(Mono.empty());
        properties.getWorker().setEnabled(false);

        assertThat(lifecycle.isAutoStartup()).isFalse();
        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();
        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();
        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();
    }
}
