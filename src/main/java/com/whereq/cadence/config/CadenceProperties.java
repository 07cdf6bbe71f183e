package com.whereq.cadence.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Cadence.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "cadence")
@Data
public class CadenceProperties {

    private JobStoreConfig jobStore = new JobStoreConfig();

    private QueueConfig queue = new QueueConfig();

    private SchedulingConfig scheduling = new SchedulingConfig();

    private RetryConfig retry = new RetryConfig();

    private DedupConfig dedup = new DedupConfig();

    private WorkerConfig worker = new WorkerConfig();

    private HousekeepingConfig housekeeping = new HousekeepingConfig();

    private LimitsConfig limits = new LimitsConfig();

    private AuthConfig auth = new AuthConfig();

    private GenerationConfig generation = new GenerationConfig();

    private PublishTargetConfig publishTarget = new PublishTargetConfig();

    private NotificationConfig notification = new NotificationConfig();

    @Data
    public static class JobStoreConfig {
        /**
         * Job store backend.
         * REDIS: durable store (default)
         * MEMORY: process-local map, lost on restart
         */
        private JobStoreType type = JobStoreType.REDIS;

        /**
         * Key prefix used by the Redis job store.
         */
        private String keyPrefix = "cadence:";
    }

    @Data
    public static class QueueConfig {
        /**
         * JSON file holding the upload queue.
         */
        private String file = "upload_queue.json";
    }

    @Data
    public static class SchedulingConfig {
        /**
         * Spacing between successive publish slots.
         */
        private Duration interval = Duration.ofMinutes(150);

        /**
         * Marker separating content segments; each segment becomes one short artifact.
         */
        private String segmentMarker = "— pause —";

        /**
         * Zone applied to requested publish times given without an offset.
         */
        private String zone = "UTC";
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;

        /**
         * Escalating delay table; the last entry caps the delay.
         */
        private List<Duration> delays = new ArrayList<>(List.of(
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            Duration.ofMinutes(60),
            Duration.ofMinutes(120)));
    }

    @Data
    public static class DedupConfig {
        /**
         * How far back queue history is checked for duplicate titles.
         */
        private Duration horizon = Duration.ofDays(30);
    }

    @Data
    public static class WorkerConfig {
        /**
         * Start the background worker with the application context.
         */
        private boolean enabled = true;

        /**
         * Interval between pipeline passes (queued jobs, retries, pending uploads).
         */
        private Duration pollInterval = Duration.ofSeconds(10);

        /**
         * Interval between publish sweeps.
         */
        private Duration publishInterval = Duration.ofSeconds(60);

        /**
         * Items scheduled up to this far in the future are treated as due.
         */
        private Duration publishTolerance = Duration.ofMinutes(1);

        /**
         * Maximum queued jobs taken per pass.
         */
        private int batchSize = 20;
    }

    @Data
    public static class HousekeepingConfig {
        private Duration interval = Duration.ofHours(24);

        /**
         * Terminal jobs completed longer ago than this are purged.
         */
        private Duration jobRetention = Duration.ofDays(7);

        /**
         * Published or permanently failed queue items added longer ago than this are pruned.
         */
        private Duration queueRetention = Duration.ofDays(30);

        /**
         * Files in the download and processed folders older than this are deleted.
         */
        private Duration fileRetention = Duration.ofDays(7);
    }

    @Data
    public static class LimitsConfig {
        private int maxRequestsPerMinute = 10;

        private int maxConcurrentJobs = 3;

        private int maxContentLength = 50000;
    }

    @Data
    public static class AuthConfig {
        /**
         * Recognized owner keys (sent in the X-API-Key header).
         */
        private List<String> apiKeys = new ArrayList<>();
    }

    @Data
    public static class GenerationConfig {
        private String baseUrl = "http://localhost:5000";

        private String shortEndpoint = "/api/v1/generate-shorts";

        private String longEndpoint = "/api/v1/generate-voiceover";

        private String statusEndpoint = "/api/v1/shorts/status/{sessionId}";

        private Duration requestTimeout = Duration.ofMinutes(15);

        private Duration statusTimeout = Duration.ofSeconds(30);

        private Duration pollInterval = Duration.ofSeconds(5);

        /**
         * Folder artifacts are downloaded to.
         */
        private String downloadFolder = "downloads";

        /**
         * Folder uploaded artifacts are moved to.
         */
        private String processedFolder = "processed";
    }

    @Data
    public static class PublishTargetConfig {
        private String baseUrl = "http://localhost:8090";

        private Duration timeout = Duration.ofMinutes(5);

        /**
         * Public locator of a published item; {id} is replaced by the remote id.
         */
        private String publicUrlTemplate = "https://www.youtube.com/watch?v={id}";

        private String defaultDescription = "Automated content generated from source scripts.";

        private List<String> defaultTags = new ArrayList<>(List.of("news", "shorts", "automation", "daily"));
    }

    @Data
    public static class NotificationConfig {
        /**
         * Webhook URL; notifications are disabled when empty.
         */
        private String webhookUrl;

        private String credentialHeader = "x-make-apikey";

        private String credential;

        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofSeconds(1);

        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Added to the scheduled publish time to get the downstream target time.
         */
        private Duration targetOffset = Duration.ofMinutes(15);

        private String targetZone = "Asia/Kolkata";

        private String targetPattern = "dd-MM-yyyy hh:mm a";

        private int previewLength = 200;
    }

    public enum JobStoreType {
        REDIS,
        MEMORY
    }
}
