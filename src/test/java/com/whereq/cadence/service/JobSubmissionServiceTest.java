package com.whereq.cadence.service;

import com.whereq.cadence.MutableClock;
import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.dto.JobSubmitRequest;
import com.whereq.cadence.exception.InvalidJobStateException;
import com.whereq.cadence.exception.JobAccessDeniedException;
import com.whereq.cadence.exception.JobNotFoundException;
import com.whereq.cadence.exception.ValidationException;
import com.whereq.cadence.model.ArtifactKind;
import com.whereq.cadence.model.Job;
import com.whereq.cadence.model.JobParameters;
import com.whereq.cadence.model.JobStatus;
import com.whereq.cadence.store.InMemoryJobStore;
import com.whereq.cadence.store.JobQuery;
import com.whereq.cadence.store.JobUpdate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobSubmissionServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final CadenceProperties properties = new CadenceProperties();
    private InMemoryJobStore jobStore;
    private JobSubmissionService service;

    @BeforeEach
    void setUp() {
        properties.getAuth().setApiKeys(List.of("key-a", "key-b"));
        properties.getLimits().setMaxRequestsPerMinute(100);
        properties.getLimits().setMaxConcurrentJobs(100);
        jobStore = new InMemoryJobStore(clock);
        AdmissionController admission = new AdmissionController(jobStore, properties, clock, new SimpleMeterRegistry());
        service = new JobSubmissionService(jobStore, admission, properties, clock);
    }

    @Test
    void shouldSubmitWithDefaults() {
        JobSubmitRequest request = request("One — pause — Two — pause — Three");

        StepVerifier.create(service.submitJob(request, "key-a"))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(JobStatus.QUEUED);
                assertThat(response.getEstimatedArtifacts()).isEqualTo(3);
                assertThat(response.getStatusUrl()).isEqualTo("/api/v1/jobs/" + response.getJobId());
                assertThat(response.getSubmittedAt()).isEqualTo(NOW);
            })
            .verifyComplete();

        Job stored = jobStore.list(JobQuery.builder().build()).blockFirst();
        assertThat(stored.getParameters().getVoice()).isEqualTo("onyx");
        assertThat(stored.getParameters().getSpeed()).isEqualTo(1.2);
        assertThat(stored.getParameters().getKind()).isEqualTo(ArtifactKind.SHORT);
        assertThat(stored.getParameters().isPinToRequestedTime()).isFalse();
    }

    @Test
    void shouldEstimateOneArtifactForLongKind() {
        JobSubmitRequest request = request("One — pause — Two");
        request.setKind("long");

        StepVerifier.create(service.submitJob(request, "key-a"))
            .assertNext(response -> assertThat(response.getEstimatedArtifacts()).isEqualTo(1))
            .verifyComplete();
    }

    @Test
    void shouldValidateFields() {
        assertInvalid(r -> r.setContent("   "));
        assertInvalid(r -> r.setContent("x".repeat(50001)));
        assertInvalid(r -> r.setKind("poster"));
        assertInvalid(r -> r.setVoice("robot"));
        assertInvalid(r -> r.setSpeed(2.5));
        assertInvalid(r -> r.setPublishAt("tomorrow"));
        assertInvalid(r -> r.setPublishAt(NOW.minus(Duration.ofMinutes(1)).toString()));
        assertInvalid(r -> r.setPublishAt(NOW.toString()));
        assertInvalid(r -> r.setJobId("bad id!"));
    }

    @Test
    void shouldParsePublishTimeWithAndWithoutOffset() {
        JobSubmitRequest request = request("content");
        request.setPublishAt("2025-03-01T20:00:00+05:30");
        assertThat(service.toParameters(request).getRequestedPublishTime()).isEqualTo(Instant.parse("2025-03-01T14:30:00Z"));

        request.setPublishAt("2025-03-01T20:00:00");
        assertThat(service.toParameters(request).getRequestedPublishTime()).isEqualTo(Instant.parse("2025-03-01T20:00:00Z"));
    }

    @Test
    void shouldRejectDuplicateCustomJobId() {
        JobSubmitRequest request = request("content");
        request.setJobId("my-job");
        service.submitJob(request, "key-a").block();

        StepVerifier.create(service.submitJob(request, "key-a"))
            .expectError(ValidationException.class)
            .verify();
    }

    @Test
    void shouldOnlyShowJobsToTheirOwner() {
        String jobId = service.submitJob(request("content"), "key-a").block().getJobId();

        StepVerifier.create(service.getJob(jobId, "key-a").map(Job::getJobId))
            .expectNext(jobId)
            .verifyComplete();
        StepVerifier.create(service.getJob(jobId, "key-b"))
            .expectError(JobAccessDeniedException.class)
            .verify();
        StepVerifier.create(service.getJob("job-missing", "key-a"))
            .expectError(JobNotFoundException.class)
            .verify();
        StepVerifier.create(service.listJobs("key-b", null, 50))
            .verifyComplete();
    }

    @Test
    void shouldCancelActiveJobOnly() {
        String jobId = service.submitJob(request("content"), "key-a").block().getJobId();

        StepVerifier.create(service.cancelJob(jobId, "key-a"))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(JobStatus.CANCELLED);
                assertThat(response.getCancelledAt()).isEqualTo(NOW);
            })
            .verifyComplete();

        StepVerifier.create(service.cancelJob(jobId, "key-a"))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(InvalidJobStateException.class)
                .hasMessage("Cannot cancel job in terminal status: CANCELLED"))
            .verify();
    }

    @Test
    void shouldKeepCancelledJobFromProgressing() {
        Job job = jobStore.create("key-a", JobParameters.builder().content("c").kind(ArtifactKind.SHORT).build(), 1, null).block();
        service.cancelJob(job.getJobId(), "key-a").block();

        StepVerifier.create(jobStore.update(job.getJobId(), JobUpdate.progress(10, "Starting generation...")))
            .expectError(InvalidJobStateException.class)
            .verify();
    }

    private void assertInvalid(Consumer<JobSubmitRequest> mutation) {
        JobSubmitRequest request = request("valid content");
        mutation.accept(request);
        assertThatThrownBy(() -> service.toParameters(request)).isInstanceOf(ValidationException.class);
    }

    private static JobSubmitRequest request(String content) {
        return JobSubmitRequest.builder()
            .content(content)
            .publishAt(NOW.plus(Duration.ofHours(4)).toString())
            .build();
    }
}
