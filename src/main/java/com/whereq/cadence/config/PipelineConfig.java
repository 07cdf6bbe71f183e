package com.whereq.cadence.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.cadence.gateway.ContentGenerationService;
import com.whereq.cadence.gateway.HttpContentGenerationService;
import com.whereq.cadence.gateway.HttpPublishTargetService;
import com.whereq.cadence.gateway.PublishTargetService;
import com.whereq.cadence.notification.NotificationClient;
import com.whereq.cadence.store.ArtifactFileStore;
import com.whereq.cadence.store.InMemoryJobStore;
import com.whereq.cadence.store.JobStore;
import com.whereq.cadence.store.RedisJobStore;
import com.whereq.cadence.store.UploadQueueStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Wires the stores and external clients of the publish pipeline.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobStore jobStore(CadenceProperties properties,
                             ObjectProvider<ReactiveRedisTemplate<String, String>> redisTemplate,
                             ObjectMapper objectMapper,
                             Clock clock) {
        CadenceProperties.JobStoreConfig config = properties.getJobStore();
        if (config.getType() == CadenceProperties.JobStoreType.MEMORY) {
            log.warn("Using in-memory job store: jobs will not survive a restart");
            return new InMemoryJobStore(clock);
        }
        log.info("Using Redis job store (prefix={})", config.getKeyPrefix());
        return new RedisJobStore(redisTemplate.getObject(), objectMapper, clock, config.getKeyPrefix());
    }

    @Bean
    public UploadQueueStore uploadQueueStore(CadenceProperties properties,
                                             ObjectMapper objectMapper,
                                             MeterRegistry meterRegistry) {
        return new UploadQueueStore(Paths.get(properties.getQueue().getFile()), objectMapper, meterRegistry);
    }

    @Bean
    public ArtifactFileStore artifactFileStore(CadenceProperties properties) {
        CadenceProperties.GenerationConfig generation = properties.getGeneration();
        return new ArtifactFileStore(Paths.get(generation.getDownloadFolder()), Paths.get(generation.getProcessedFolder()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentGenerationService contentGenerationService(WebClient.Builder webClientBuilder,
                                                             CadenceProperties properties) {
        return new HttpContentGenerationService(webClientBuilder, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public PublishTargetService publishTargetService(WebClient.Builder webClientBuilder,
                                                     CadenceProperties properties) {
        return new HttpPublishTargetService(webClientBuilder, properties);
    }

    @Bean
    public NotificationClient notificationClient(WebClient.Builder webClientBuilder,
                                                 CadenceProperties properties) {
        NotificationClient client = new NotificationClient(webClientBuilder, properties);
        if (!client.isEnabled()) {
            log.warn("Webhook URL not configured, downstream notifications disabled");
        }
        return client;
    }
}
