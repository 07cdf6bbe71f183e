package com.whereq.cadence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.cadence.exception.JobNotFoundException;
import com.whereq.cadence.exception.PersistenceException;
import com.whereq.cadence.exception.ValidationException;
import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobParameters;
import com.whereq.cadence.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Redis-backed job store.
 *
 * <p>Layout (all keys under the configured prefix):
 * <ul>
 *   <li>{@code job:<id>} JSON document of the job</li>
 *   <li>{@code jobs:created} sorted set of ids scored by creation time</li>
 *   <li>{@code jobs:status:<STATUS>} sorted set of ids per status</li>
 *   <li>{@code jobs:owner:<key>} sorted set of ids per owner</li>
 * </ul>
 *
 * <p>Updates are compare-and-set: the new document and the status index move are written by one
 * Lua script, only if the stored document still equals the one the update was computed from.
 */
@Slf4j
public class RedisJobStore implements JobStore {

    private static final int MAX_UPDATE_ATTEMPTS = 5;

    /**
     * KEYS: job, old status index, new status index. ARGV: expected JSON, new JSON, id, score.
     */
    static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>(
        "if redis.call('GET', KEYS[1]) ~= ARGV[1] then return 0 end\n"
            + "redis.call('SET', KEYS[1], ARGV[2])\n"
            + "if KEYS[2] ~= KEYS[3] then\n"
            + "  redis.call('ZREM', KEYS[2], ARGV[3])\n"
            + "  redis.call('ZADD', KEYS[3], ARGV[4], ARGV[3])\n"
            + "end\n"
            + "return 1",
        Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String prefix;

    public RedisJobStore(ReactiveRedisTemplate<String, String> redisTemplate,
                         ObjectMapper objectMapper,
                         Clock clock,
                         String prefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.prefix = prefix;
    }

    @Override
    public Mono<Job> create(String ownerKey, JobParameters parameters, int estimatedArtifacts, String customJobId) {
        return Mono.defer(() -> createJob(ownerKey, parameters, estimatedArtifacts, customJobId));
    }

    private Mono<Job> createJob(String ownerKey, JobParameters parameters, int estimatedArtifacts, String customJobId) {
        String jobId = customJobId != null ? customJobId : JobIds.generate();
        Job job = Job.builder()
            .jobId(jobId)
            .ownerKey(ownerKey)
            .status(JobStatus.QUEUED)
            .progress(0)
            .message(INITIAL_MESSAGE)
            .parameters(parameters)
            .estimatedArtifacts(estimatedArtifacts)
            .createdAt(clock.instant())
            .build();
        double score = job.getCreatedAt().toEpochMilli();

        return redisTemplate.opsForValue()
            .setIfAbsent(jobKey(jobId), serialize(job))
            .flatMap(created -> {
                if (!Boolean.TRUE.equals(created)) {
                    return Mono.error(new ValidationException("Job id already exists: " + jobId));
                }
                return redisTemplate.opsForZSet().add(createdKey(), jobId, score)
                    .then(redisTemplate.opsForZSet().add(statusKey(JobStatus.QUEUED), jobId, score))
                    .then(redisTemplate.opsForZSet().add(ownerKey(ownerKey), jobId, score))
                    .thenReturn(job);
            })
            .doOnSuccess(j -> log.info("Created job {}", jobId));
    }

    @Override
    public Mono<Job> update(String jobId, JobUpdate update) {
        return Mono.defer(() -> compareAndSet(jobId, update))
            .retryWhen(Retry.max(MAX_UPDATE_ATTEMPTS - 1)
                .filter(StaleJobException.class::isInstance)
                .doBeforeRetry(signal -> log.debug("Job {} changed concurrently, retrying update", jobId))
                .onRetryExhaustedThrow((spec, signal) -> new PersistenceException(
                    "Job " + jobId + " kept changing during update", signal.failure())))
            .doOnSuccess(job -> log.debug("Updated job {}: status={}, progress={}%",
                jobId, job.getStatus(), job.getProgress()));
    }

    /**
     * Apply the update to the stored document and write it only if nobody changed it in between.
     * A terminal status read here makes {@link JobUpdate#applyTo} fail, so a cancel that lands
     * between read and write is never overwritten.
     */
    private Mono<Job> compareAndSet(String jobId, JobUpdate update) {
        return redisTemplate.opsForValue()
            .get(jobKey(jobId))
            .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)))
            .flatMap(raw -> {
                Job current = deserialize(raw);
                Job updated = update.applyTo(current, clock.instant());
                List<String> keys = List.of(
                    jobKey(jobId), statusKey(current.getStatus()), statusKey(updated.getStatus()));
                List<String> args = List.of(
                    raw, serialize(updated), jobId, String.valueOf(current.getCreatedAt().toEpochMilli()));
                return redisTemplate.execute(COMPARE_AND_SET, keys, args)
                    .next()
                    .flatMap(written -> written == 1L
                        ? Mono.just(updated)
                        : Mono.error(new StaleJobException(jobId)));
            });
    }

    @Override
    public Mono<Job> get(String jobId) {
        return redisTemplate.opsForValue()
            .get(jobKey(jobId))
            .map(this::deserialize)
            .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)));
    }

    @Override
    public Flux<Job> list(JobQuery query) {
        String indexKey;
        if (query.getOwnerKey() != null) {
            indexKey = ownerKey(query.getOwnerKey());
        } else if (query.getStatus() != null) {
            indexKey = statusKey(query.getStatus());
        } else {
            indexKey = createdKey();
        }

        Flux<String> ids = query.isOldestFirst()
            ? redisTemplate.opsForZSet().range(indexKey, Range.<Long>unbounded())
            : redisTemplate.opsForZSet().reverseRange(indexKey, Range.<Long>unbounded());

        return ids
            .concatMap(id -> redisTemplate.opsForValue().get(jobKey(id)).map(this::deserialize))
            .filter(query::matches)
            .take(query.getLimit());
    }

    @Override
    public Mono<Long> countActive(String ownerKey) {
        return redisTemplate.opsForZSet()
            .range(ownerKey(ownerKey), Range.<Long>unbounded())
            .concatMap(id -> redisTemplate.opsForValue().get(jobKey(id)).map(this::deserialize))
            .filter(job -> job.getStatus().isActive())
            .count();
    }

    @Override
    public Mono<Long> purge(Instant olderThan) {
        return Flux.fromIterable(Arrays.asList(JobStatus.values()))
            .filter(JobStatus::isTerminal)
            .concatMap(status -> redisTemplate.opsForZSet().range(statusKey(status), Range.<Long>unbounded()))
            .concatMap(id -> redisTemplate.opsForValue().get(jobKey(id)).map(this::deserialize))
            .filter(job -> job.getCompletedAt() != null && job.getCompletedAt().isBefore(olderThan))
            .concatMap(this::delete)
            .count()
            .doOnSuccess(count -> {
                if (count != null && count > 0) {
                    log.info("Purged {} old jobs", count);
                }
            });
    }

    private Mono<Job> delete(Job job) {
        String jobId = job.getJobId();
        return redisTemplate.delete(jobKey(jobId))
            .then(redisTemplate.opsForZSet().remove(createdKey(), jobId))
            .then(redisTemplate.opsForZSet().remove(statusKey(job.getStatus()), jobId))
            .then(redisTemplate.opsForZSet().remove(ownerKey(job.getOwnerKey()), jobId))
            .thenReturn(job);
    }

    private String serialize(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize job " + job.getJobId(), e);
        }
    }

    private Job deserialize(String json) {
        try {
            return objectMapper.readValue(json, Job.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize job", e);
        }
    }

    private String jobKey(String jobId) {
        return prefix + "job:" + jobId;
    }

    private String createdKey() {
        return prefix + "jobs:created";
    }

    private String statusKey(JobStatus status) {
        return prefix + "jobs:status:" + status.name();
    }

    private String ownerKey(String owner) {
        return prefix + "jobs:owner:" + owner;
    }

    private static final class StaleJobException extends RuntimeException {
        StaleJobException(String jobId) {
            super("Job " + jobId + " changed since it was read");
        }
    }
}
