package com.whereq.cadence.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.cadence.gateway.ContentGenerationService;
import com.whereq.cadence.gateway.PublishTargetService;
import com.whereq.cadence.notification.NotificationClient;
import com.whereq.cadence.store.InMemoryJobStore;
import com.whereq.cadence.store.JobStore;
import com.whereq.cadence.store.RedisJobStore;
import com.whereq.cadence.store.UploadQueueStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class PipelineConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class, CadenceProperties.class, PipelineConfig.class)
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .withBean(WebClient.Builder.class, WebClient::builder);

    @Test
    void shouldUseInMemoryStoreWhenConfigured() {
        contextRunner
            .withPropertyValues(
                "cadence.job-store.type=memory",
                "cadence.queue.file=target/pipeline-config-test.json")
            .run(context -> {
                assertThat(context).hasSingleBean(JobStore.class);
                assertThat(context.getBean(JobStore.class)).isInstanceOf(InMemoryJobStore.class);
                assertThat(context.getBean(UploadQueueStore.class).getFile())
                    .isEqualTo(Paths.get("target/pipeline-config-test.json"));
                assertThat(context).hasSingleBean(ContentGenerationService.class);
                assertThat(context).hasSingleBean(PublishTargetService.class);
                assertThat(context.getBean(NotificationClient.class).isEnabled()).isFalse();
            });
    }

    @Test
    void shouldUseRedisStoreByDefault() {
        contextRunner
            .withBean("reactiveRedisTemplate", ReactiveRedisTemplate.class, () -> mock(ReactiveRedisTemplate.class))
            .run(context -> assertThat(context.getBean(JobStore.class)).isInstanceOf(RedisJobStore.class));
    }

    @Test
    void shouldEnableNotificationsWhenWebhookConfigured() {
        contextRunner
            .withPropertyValues(
                "cadence.job-store.type=memory",
                "cadence.notification.webhook-url=http://hooks.test/notify")
            .run(context -> assertThat(context.getBean(NotificationClient.class).isEnabled()).isTrue());
    }

    @Configuration
    @EnableConfigurationProperties
    static class PropertiesConfig {
    }
}
