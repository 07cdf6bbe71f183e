package com.whereq.cadence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.whereq.cadence.MutableClock;
import com.whereq.cadence.exception.InvalidJobStateException;
import com.whereq.cadence.exception.PersistenceException;
import com.whereq.cadence.exception.ValidationException;
import com.whereq.cadence.model.ArtifactKind;
import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobParameters;
import com.whereq.cadence.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ReactiveZSetOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class RedisJobStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String PREFIX = "cadence:";

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final MutableClock clock = new MutableClock(NOW);
    private final ReactiveRedisTemplate<String, String> redisTemplate = mock(ReactiveRedisTemplate.class);
    private final ReactiveValueOperations<String, String> values = mock(ReactiveValueOperations.class);
    private final ReactiveZSetOperations<String, String> zset = mock(ReactiveZSetOperations.class);

    private RedisJobStore store;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(values);
        when(redisTemplate.opsForZSet()).thenReturn(zset);
        when(zset.add(anyString(), anyString(), anyDouble())).thenReturn(Mono.just(true));
        when(zset.remove(anyString(), any())).thenReturn(Mono.just(1L));
        when(zset.range(anyString(), any())).thenReturn(Flux.empty());
        store = new RedisJobStore(redisTemplate, objectMapper, clock, PREFIX);
    }

    @Test
    void shouldIndexNewJobByCreationStatusAndOwner() {
        when(values.setIfAbsent(eq("cadence:job:daily-1"), anyString())).thenReturn(Mono.just(true));

        StepVerifier.create(store.create("key-a", params(), 2, "daily-1"))
            .assertNext(job -> {
                assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
                assertThat(job.getMessage()).isEqualTo(JobStore.INITIAL_MESSAGE);
            })
            .verifyComplete();

        double score = NOW.toEpochMilli();
        verify(zset).add("cadence:jobs:created", "daily-1", score);
        verify(zset).add("cadence:jobs:status:QUEUED", "daily-1", score);
        verify(zset).add("cadence:jobs:owner:key-a", "daily-1", score);
    }

    @Test
    void shouldRejectClashingCustomId() {
        when(values.setIfAbsent(eq("cadence:job:daily-1"), anyString())).thenReturn(Mono.just(false));

        StepVerifier.create(store.create("key-a", params(), 1, "daily-1"))
            .expectError(ValidationException.class)
            .verify();
        verify(zset, never()).add(anyString(), anyString(), anyDouble());
    }

    @Test
    void shouldMoveStatusIndexInTheSameScriptAsTheDocument() throws JsonProcessingException {
        String stored = json(job("job-1", JobStatus.QUEUED, null));
        when(values.get("cadence:job:job-1")).thenReturn(Mono.just(stored));
        when(redisTemplate.execute(eq(RedisJobStore.COMPARE_AND_SET), anyList(), anyList())).thenReturn(Flux.just(1L));

        StepVerifier.create(store.update("job-1", JobUpdate.progress(10, "Starting generation...")))
            .assertNext(job -> {
                assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
                assertThat(job.getProgress()).isEqualTo(10);
            })
            .verifyComplete();

        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<String>> args = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate).execute(eq(RedisJobStore.COMPARE_AND_SET), keys.capture(), args.capture());
        assertThat(keys.getValue()).containsExactly(
            "cadence:job:job-1", "cadence:jobs:status:QUEUED", "cadence:jobs:status:PROCESSING");
        assertThat(args.getValue().get(0)).isEqualTo(stored);
        assertThat(args.getValue().get(2)).isEqualTo("job-1");
    }

    @Test
    void shouldNotOverwriteCancellationThatLandsBetweenReadAndWrite() throws JsonProcessingException {
        when(values.get("cadence:job:job-1")).thenReturn(
            Mono.just(json(job("job-1", JobStatus.PROCESSING, null))),
            Mono.just(json(job("job-1", JobStatus.CANCELLED, NOW))));
        when(redisTemplate.execute(eq(RedisJobStore.COMPARE_AND_SET), anyList(), anyList())).thenReturn(Flux.just(0L));

        StepVerifier.create(store.update("job-1", JobUpdate.progress(60, "Queued 2 artifact(s) for upload")))
            .expectError(InvalidJobStateException.class)
            .verify();
        verify(redisTemplate, times(1)).execute(eq(RedisJobStore.COMPARE_AND_SET), anyList(), anyList());
    }

    @Test
    void shouldGiveUpWhenJobKeepsChanging() throws JsonProcessingException {
        when(values.get("cadence:job:job-1")).thenReturn(Mono.just(json(job("job-1", JobStatus.PROCESSING, null))));
        when(redisTemplate.execute(eq(RedisJobStore.COMPARE_AND_SET), anyList(), anyList())).thenReturn(Flux.just(0L));

        StepVerifier.create(store.update("job-1", JobUpdate.progress(70, "Uploaded 1/2 artifact(s)")))
            .expectError(PersistenceException.class)
            .verify();
        verify(redisTemplate, times(5)).execute(eq(RedisJobStore.COMPARE_AND_SET), anyList(), anyList());
    }

    @Test
    void shouldPurgeOnlyTerminalJobsOlderThanCutoff() throws JsonProcessingException {
        when(zset.range(eq("cadence:jobs:status:COMPLETED"), any())).thenReturn(Flux.just("old", "recent"));
        when(values.get("cadence:job:old"))
            .thenReturn(Mono.just(json(job("old", JobStatus.COMPLETED, NOW.minus(Duration.ofDays(10))))));
        when(values.get("cadence:job:recent"))
            .thenReturn(Mono.just(json(job("recent", JobStatus.COMPLETED, NOW.minus(Duration.ofDays(1))))));
        when(redisTemplate.delete("cadence:job:old")).thenReturn(Mono.just(1L));

        StepVerifier.create(store.purge(NOW.minus(Duration.ofDays(7))))
            .expectNext(1L)
            .verifyComplete();

        verify(redisTemplate).delete("cadence:job:old");
        verify(redisTemplate, never()).delete("cadence:job:recent");
        verify(zset).remove("cadence:jobs:owner:key-a", "old");
    }

    private String json(Job job) throws JsonProcessingException {
        return objectMapper.writeValueAsString(job);
    }

    private static Job job(String id, JobStatus status, Instant completedAt) {
        return Job.builder()
            .jobId(id)
            .ownerKey("key-a")
            .status(status)
            .message("test")
            .parameters(params())
            .createdAt(NOW.minus(Duration.ofDays(20)))
            .completedAt(completedAt)
            .build();
    }

    private static JobParameters params() {
        return JobParameters.builder()
            .content("Market update")
            .voice("onyx")
            .speed(1.2)
            .kind(ArtifactKind.SHORT)
            .requestedPublishTime(NOW.plus(Duration.ofHours(4)))
            .build();
    }
}
