package com.whereq.cadence.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.exception.ExternalServiceException;
import com.whereq.cadence.model.Visibility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP adapter for the publish target.
 *
 * <p>Contract: {@code POST /api/v1/uploads} (multipart: {@code file} or {@code sourceUrl}, plus
 * {@code metadata}) returns {@code {"id": ...}}; {@code POST /api/v1/uploads/{id}/schedule} with
 * {@code publishAt}; {@code POST /api/v1/uploads/{id}/visibility} with {@code visibility}.
 */
@Slf4j
public class HttpPublishTargetService implements PublishTargetService {

    private final WebClient webClient;
    private final CadenceProperties.PublishTargetConfig config;

    public HttpPublishTargetService(WebClient.Builder webClientBuilder, CadenceProperties properties) {
        this.config = properties.getPublishTarget();
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getBaseUrl())
            .build();
    }

    @Override
    public Mono<String> upload(String locator, String title, String description, List<String> tags, Visibility visibility) {
        return Mono.defer(() -> {
            MultipartBodyBuilder body = new MultipartBodyBuilder();
            Path path = Paths.get(locator);
            if (Files.exists(path)) {
                body.part("file", new FileSystemResource(path));
            } else {
                body.part("sourceUrl", locator);
            }
            body.part("metadata", Map.of(
                "title", title,
                "description", description,
                "tags", tags,
                "visibility", visibility.name().toLowerCase(Locale.ROOT)), MediaType.APPLICATION_JSON);

            return webClient.post()
                .uri("/api/v1/uploads")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout());
        })
        .map(response -> {
            String id = response.path("id").asText(null);
            if (id == null || id.isBlank()) {
                throw new ExternalServiceException("Publish target returned no id for '" + title + "'");
            }
            return id;
        })
        .onErrorMap(e -> !(e instanceof ExternalServiceException),
            e -> new ExternalServiceException("Upload failed for '" + title + "': " + e.getMessage(), e));
    }

    @Override
    public Mono<Boolean> schedule(String remoteId, Instant publishAt) {
        return post("/api/v1/uploads/{id}/schedule", remoteId, Map.of("publishAt", publishAt.toString()));
    }

    @Override
    public Mono<Boolean> makePublic(String remoteId) {
        return post("/api/v1/uploads/{id}/visibility", remoteId, Map.of("visibility", "public"));
    }

    @Override
    public String publicLocator(String remoteId) {
        return config.getPublicUrlTemplate().replace("{id}", remoteId);
    }

    private Mono<Boolean> post(String path, String remoteId, Map<String, Object> body) {
        return webClient.post()
            .uri(path, remoteId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .toBodilessEntity()
            .timeout(config.getTimeout())
            .map(response -> response.getStatusCode().is2xxSuccessful())
            .onErrorResume(WebClientResponseException.class, e -> {
                log.warn("Publish target rejected {} for {}: {} {}", path, remoteId, e.getStatusCode(), e.getResponseBodyAsString());
                return Mono.just(false);
            });
    }
}
