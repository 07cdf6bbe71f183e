package com.whereq.cadence.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.cadence.config.CadenceProperties;
import com.whereq.cadence.exception.ExternalServiceException;
import com.whereq.cadence.model.ArtifactKind;
import com.whereq.cadence.model.ContentSegments;
import com.whereq.cadence.model.GeneratedArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP adapter for the rendering engine.
 *
 * <p>Protocol: POST the content to the kind-specific endpoint, receive a {@code session_id}, then
 * poll the status endpoint until {@code status} is {@code completed} (artifact URLs in
 * {@code artifacts}) or {@code failed}. Completed artifacts are downloaded to the local
 * download folder and returned as file locators.
 */
@Slf4j
public class HttpContentGenerationService implements ContentGenerationService {

    private static final String COMPLETED = "completed";
    private static final String FAILED = "failed";

    private final WebClient webClient;
    private final CadenceProperties.GenerationConfig config;
    private final String segmentMarker;

    public HttpContentGenerationService(WebClient.Builder webClientBuilder, CadenceProperties properties) {
        this.config = properties.getGeneration();
        this.segmentMarker = properties.getScheduling().getSegmentMarker();
        this.webClient = webClientBuilder.clone()
            .baseUrl(config.getBaseUrl())
            .build();
    }

    @Override
    public Mono<List<GeneratedArtifact>> generate(String content, String voice, double speed, ArtifactKind kind) {
        String endpoint = kind == ArtifactKind.SHORT ? config.getShortEndpoint() : config.getLongEndpoint();
        Map<String, Object> body = Map.of(
            "script", content,
            "voice", voice,
            "speed", speed);

        log.info("Requesting {} generation ({} chars, voice={}, speed={})", kind.wireName(), content.length(), voice, speed);

        return webClient.post()
            .uri(endpoint)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(config.getRequestTimeout())
            .map(response -> {
                String sessionId = response.path("session_id").asText(null);
                if (sessionId == null || sessionId.isBlank()) {
                    throw new ExternalServiceException("Generation service returned no session_id");
                }
                log.info("Generation session started: {}", sessionId);
                return sessionId;
            })
            .flatMap(this::awaitCompletion)
            .flatMap(completion -> downloadArtifacts(completion, content, kind))
            .onErrorMap(e -> !(e instanceof ExternalServiceException), this::toExternalError);
    }

    private Mono<JsonNode> awaitCompletion(String sessionId) {
        return Flux.interval(config.getPollInterval())
            .concatMap(tick -> checkStatus(sessionId))
            .filter(status -> {
                String state = status.path("status").asText("");
                if (!COMPLETED.equals(state) && !FAILED.equals(state)) {
                    log.debug("Session {}: {}% {}", sessionId,
                        status.path("progress").asInt(0), status.path("message").asText(""));
                    return false;
                }
                return true;
            })
            .next()
            .timeout(config.getRequestTimeout())
            .flatMap(status -> {
                if (FAILED.equals(status.path("status").asText())) {
                    return Mono.error(new ExternalServiceException(
                        "Generation failed: " + status.path("error").asText("Unknown error")));
                }
                return Mono.just(status);
            });
    }

    private Mono<JsonNode> checkStatus(String sessionId) {
        return webClient.get()
            .uri(config.getStatusEndpoint(), sessionId)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(config.getStatusTimeout());
    }

    private Mono<List<GeneratedArtifact>> downloadArtifacts(JsonNode completion, String content, ArtifactKind kind) {
        List<String> urls = new ArrayList<>();
        completion.path("artifacts").forEach(node -> urls.add(node.isTextual() ? node.asText() : node.path("url").asText()));
        if (urls.isEmpty()) {
            String single = completion.path("download_url").asText(null);
            if (single != null) {
                urls.add(single);
            }
        }
        if (urls.isEmpty()) {
            return Mono.error(new ExternalServiceException("No artifacts in completion status"));
        }

        List<String> segments = kind == ArtifactKind.SHORT
            ? ContentSegments.split(content, segmentMarker)
            : List.of(content);

        return Flux.range(0, urls.size())
            .concatMap(i -> download(urls.get(i))
                .map(path -> GeneratedArtifact.builder()
                    .locator(path.toString())
                    .segment(i < segments.size() ? segments.get(i) : null)
                    .build()))
            .collectList();
    }

    private Mono<Path> download(String url) {
        return Mono.defer(() -> {
            Path folder = Paths.get(config.getDownloadFolder());
            String fileName = Paths.get(URI.create(url).getPath()).getFileName().toString();
            Path target = folder.resolve(fileName);
            try {
                Files.createDirectories(folder);
            } catch (IOException e) {
                return Mono.error(new ExternalServiceException("Cannot create download folder " + folder, e));
            }
            Flux<DataBuffer> data = webClient.get()
                .uri(url)
                .retrieve()
                .bodyToFlux(DataBuffer.class);
            return DataBufferUtils.write(data, target)
                .timeout(config.getRequestTimeout())
                .doOnSuccess(v -> log.info("Downloaded artifact {}", target))
                .thenReturn(target);
        });
    }

    private Throwable toExternalError(Throwable error) {
        if (error instanceof TimeoutException) {
            return new ExternalServiceException("Generation service timed out", error);
        }
        return new ExternalServiceException("Generation service call failed: " + error.getMessage(), error);
    }
}
