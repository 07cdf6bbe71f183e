package com.whereq.cadence.notification;

import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.exception.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Best-effort delivery of one downstream event per committed queue item.
 *
 * <p>Failures are logged and reported as {@code false}; they never touch persisted pipeline state.
 */
@Slf4j
public class NotificationClient {

    private final WebClient webClient;
    private final CadenceProperties.NotificationConfig config;
    private final DateTimeFormatter targetFormatter;
    private final AtomicInteger sequence = new AtomicInteger();

    public NotificationClient(WebClient.Builder webClientBuilder, CadenceProperties properties) {
        this.config = properties.getNotification();
        this.webClient = webClientBuilder.clone().build();
        this.targetFormatter = DateTimeFormatter.ofPattern(config.getTargetPattern(), Locale.ENGLISH)
            .withZone(ZoneId.of(config.getTargetZone()));
    }

    public boolean isEnabled() {
        return config.getWebhookUrl() != null && !config.getWebhookUrl().isBlank();
    }

    /**
     * Reset the sequence counter at the start of an upload pass
     */
    public void resetSequence() {
        sequence.set(0);
        log.debug("Notification sequence reset");
    }

    /**
     * Send a notification for a committed item
     *
     * @param content full source content
     * @param publicLocator public URL of the item, empty string if upload/schedule failed
     * @param scheduledTime publish time of the item
     * @return Mono with true if the webhook accepted the event
     */
    public Mono<Boolean> send(String content, String publicLocator, Instant scheduledTime) {
        if (!isEnabled()) {
            log.debug("Webhook URL not configured, skipping notification");
            return Mono.just(false);
        }

        NotificationPayload payload = buildPayload(content, publicLocator, scheduledTime);
        log.info("Sending notification {} (url={}, target={})", payload.getSequenceId(),
            payload.getPublicUrl().isEmpty() ? "(empty - upload failed)" : payload.getPublicUrl(),
            payload.getTargetTime());

        return webClient.post()
            .uri(config.getWebhookUrl())
            .contentType(MediaType.APPLICATION_JSON)
            .headers(headers -> {
                if (config.getCredential() != null && !config.getCredential().isBlank()) {
                    headers.set(config.getCredentialHeader(), config.getCredential());
                }
            })
            .bodyValue(payload)
            .exchangeToMono(response -> {
                if (response.statusCode().value() == 200) {
                    return response.releaseBody().thenReturn(true);
                }
                return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> Mono.error(new ExternalServiceException(
                        "Webhook returned status " + response.statusCode().value() + ": " + body)));
            })
            .timeout(config.getTimeout())
            .retryWhen(Retry.backoff(Math.max(0, config.getMaxAttempts() - 1), config.getInitialBackoff())
                .jitter(0d)
                .doBeforeRetry(signal -> log.warn("Notification {} attempt {} failed: {}",
                    payload.getSequenceId(), signal.totalRetries() + 1, signal.failure().getMessage())))
            .doOnSuccess(ok -> log.info("Notification {} delivered", payload.getSequenceId()))
            .onErrorResume(e -> {
                log.error("Failed to deliver notification {} after {} attempts: {}",
                    payload.getSequenceId(), config.getMaxAttempts(), e.getMessage());
                return Mono.just(false);
            });
    }

    /**
     * Build the payload and advance the sequence counter
     */
    public NotificationPayload buildPayload(String content, String publicLocator, Instant scheduledTime) {
        String sequenceId = String.format("%02d", sequence.incrementAndGet());
        String fullContent = content != null ? content : "";
        return NotificationPayload.builder()
            .sequenceId(sequenceId)
            .preview(preview(fullContent, config.getPreviewLength()))
            .fullContent(fullContent)
            .publicUrl(publicLocator != null ? publicLocator : "")
            .targetTime(targetTime(scheduledTime))
            .build();
    }

    /**
     * Scheduled time plus the configured offset, rendered in the target zone
     */
    public String targetTime(Instant scheduledTime) {
        return targetFormatter.format(scheduledTime.plus(config.getTargetOffset()));
    }

    static String preview(String content, int length) {
        String cleaned = String.join(" ", content.trim().split("\\s+"));
        if (cleaned.length() <= length) {
            return cleaned;
        }
        return cleaned.substring(0, length).strip() + "...";
    }
}
