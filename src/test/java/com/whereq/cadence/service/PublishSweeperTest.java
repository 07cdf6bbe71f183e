package com.whereq.cadence.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.whereq.cadence.MutableClock;
import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.gateway.PublishTargetService;
import com.whereq.cadence.model.QueueItem;
import com.whereq.cadence.model.QueueItemStatus;
import com.whereq.cadence.model.RetryPolicy;
import com.whereq.cadence.scheduling.RetryManager;
import com.whereq.cadence.store.UploadQueueStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PublishSweeperTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(NOW);
    private final PublishTargetService publishTarget = mock(PublishTargetService.class);
    private UploadQueueStore queueStore;
    private PublishSweeper sweeper;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        queueStore = new UploadQueueStore(tempDir.resolve("queue.json"), objectMapper, new SimpleMeterRegistry());
        sweeper = new PublishSweeper(queueStore, publishTarget,
            new RetryManager(RetryPolicy.defaultPolicy()), new CadenceProperties(), clock, new SimpleMeterRegistry());
        when(publishTarget.publicLocator(anyString())).thenReturn("https://example.com/v/x");
    }

    @Test
    void shouldPublishDueItemsWithinTolerance() {
        queueStore.appendAll(List.of(
            scheduled("due", NOW.minus(Duration.ofMinutes(5))),
            scheduled("almost", NOW.plus(Duration.ofSeconds(30))),
            scheduled("later", NOW.plus(Duration.ofHours(2)))));
        when(publishTarget.makePublic(anyString())).thenReturn(Mono.just(true));

        StepVerifier.create(sweeper.sweep())
            .expectNext(2L)
            .verifyComplete();

        List<QueueItem> items = queueStore.load();
        assertThat(items).extracting(QueueItem::getStatus)
            .containsExactly(QueueItemStatus.PUBLISHED, QueueItemStatus.PUBLISHED, QueueItemStatus.SCHEDULED);
        assertThat(items.get(0).getPublishedAt()).isEqualTo(NOW);
        verify(publishTarget, never()).makePublic("remote-later");
    }

    @Test
    void shouldLeaveItemScheduledWhenPublishFails() {
        queueStore.append(scheduled("due", NOW.minus(Duration.ofMinutes(1))));
        when(publishTarget.makePublic(anyString())).thenReturn(Mono.just(false));

        StepVerifier.create(sweeper.sweep())
            .expectNext(0L)
            .verifyComplete();

        assertThat(queueStore.load().get(0).getStatus()).isEqualTo(QueueItemStatus.SCHEDULED);
    }

    @Test
    void shouldSurviveTransportErrors() {
        queueStore.append(scheduled("due", NOW.minus(Duration.ofMinutes(1))));
        when(publishTarget.makePublic(anyString())).thenReturn(Mono.error(new IllegalStateException("connection reset")));

        StepVerifier.create(sweeper.sweep())
            .expectNext(0L)
            .verifyComplete();

        assertThat(queueStore.load().get(0).getStatus()).isEqualTo(QueueItemStatus.SCHEDULED);
    }

    @Test
    void shouldPublishScheduleExhaustedItemsAtTheirSlot() {
        queueStore.appendAll(List.of(
            scheduleFailed("exhausted-due", 3, NOW.minus(Duration.ofMinutes(2))),
            scheduleFailed("exhausted-later", 3, NOW.plus(Duration.ofHours(1))),
            scheduleFailed("retryable-due", 1, NOW.minus(Duration.ofMinutes(2)))));
        when(publishTarget.makePublic(anyString())).thenReturn(Mono.just(true));

        StepVerifier.create(sweeper.sweep())
            .expectNext(1L)
            .verifyComplete();

        List<QueueItem> items = queueStore.load();
        assertThat(items).extracting(QueueItem::getStatus)
            .containsExactly(QueueItemStatus.PUBLISHED, QueueItemStatus.SCHEDULE_FAILED, QueueItemStatus.SCHEDULE_FAILED);
        assertThat(items.get(0).getError()).isNull();
        verify(publishTarget).makePublic("remote-exhausted-due");
        verify(publishTarget, never()).makePublic("remote-retryable-due");
    }

    private static QueueItem scheduleFailed(String name, int attempts, Instant slot) {
        QueueItem item = scheduled(name, slot);
        item.setStatus(QueueItemStatus.SCHEDULE_FAILED);
        item.setUploadAttempts(attempts);
        item.setError("Scheduling failed, item uploaded as private");
        return item;
    }

    private static QueueItem scheduled(String name, Instant slot) {
        return QueueItem.builder()
            .itemId(name)
            .title(name)
            .status(QueueItemStatus.SCHEDULED)
            .remoteId("remote-" + name)
            .scheduledPublishTime(slot)
            .addedAt(NOW.minus(Duration.ofHours(3)))
            .build();
    }
}
