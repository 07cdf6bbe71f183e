package com.whereq.cadence.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.whereq.cadence.exception.PersistenceException;
import com.whereq.cadence.model.ArtifactKind;
import com.whereq.cadence.model.QueueItem;
import com.whereq.cadence.model.QueueItemStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadQueueStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    @Test
    void shouldStartEmptyWhenFileIsMissing() {
        UploadQueueStore store = store(tempDir.resolve("queue.json"));

        assertThat(store.load()).isEmpty();
        assertThat(meterRegistry.counter("cadence.queue.load.failures").count()).isZero();
    }

    @Test
    void shouldPreserveItemsAndOrderAcrossRestart() {
        Path file = tempDir.resolve("queue.json");
        QueueItem first = item("first", QueueItemStatus.SCHEDULED, "remote-1");
        QueueItem second = item("second", QueueItemStatus.PENDING, null);
        store(file).appendAll(List.of(first, second));

        List<QueueItem> reloaded = store(file).load();

        assertThat(reloaded).containsExactly(first, second);
    }

    @Test
    void shouldFallBackToEmptyQueueOnCorruptFile() throws IOException {
        Path file = tempDir.resolve("queue.json");
        Files.writeString(file, "{ not json");

        assertThat(store(file).load()).isEmpty();
        assertThat(meterRegistry.counter("cadence.queue.load.failures").count()).isEqualTo(1.0);
    }

    @Test
    void shouldMoveCorruptFileAsideBeforeNextSave() throws IOException {
        Path file = tempDir.resolve("queue.json");
        String corrupt = "[{\"itemId\":\"old\",\"title\":\"Old\",\"status\":\"PUBLISHED\"},"
            + "{\"itemId\":\"bad\",\"status\":\"NOT_A_STATUS\"}]";
        Files.writeString(file, corrupt);
        UploadQueueStore store = store(file);

        store.update(current -> {
            current.add(item("Fresh", QueueItemStatus.PENDING, null));
            return current;
        });

        assertThat(store.load()).extracting(QueueItem::getTitle).containsExactly("Fresh");
        try (Stream<Path> files = Files.list(tempDir)) {
            List<Path> backups = files
                .filter(path -> path.getFileName().toString().startsWith("queue.json.corrupt-"))
                .collect(Collectors.toList());
            assertThat(backups).hasSize(1);
            assertThat(Files.readString(backups.get(0))).isEqualTo(corrupt);
        }
    }

    @Test
    void shouldKeepInconsistentItemsOnLoad() {
        Path file = tempDir.resolve("queue.json");
        QueueItem broken = item("broken", QueueItemStatus.SCHEDULED, null);
        store(file).append(broken);

        List<QueueItem> loaded = store(file).load();

        assertThat(loaded).hasSize(1);
        assertThat(loaded.get(0).isConsistent()).isFalse();
    }

    @Test
    void shouldUpdateAndPrune() throws IOException {
        UploadQueueStore store = store(tempDir.resolve("nested/dir/queue.json"));
        store.appendAll(List.of(
            item("keep", QueueItemStatus.PENDING, null),
            item("drop", QueueItemStatus.PUBLISHED, "remote-2")));

        int removed = store.prune(item -> item.getStatus() == QueueItemStatus.PUBLISHED);
        List<QueueItem> updated = store.update(items -> {
            items.get(0).setStatus(QueueItemStatus.FAILED);
            return items;
        });

        assertThat(removed).isEqualTo(1);
        assertThat(updated).extracting(QueueItem::getTitle).containsExactly("keep");
        assertThat(store.load()).extracting(QueueItem::getStatus).containsExactly(QueueItemStatus.FAILED);
        try (Stream<Path> files = Files.list(tempDir.resolve("nested/dir"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("queue.json");
        }
    }

    @Test
    void shouldRaisePersistenceExceptionWhenSaveFails() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file, not a directory");
        UploadQueueStore store = store(blocker.resolve("queue.json"));

        assertThatThrownBy(() -> store.save(List.of(item("x", QueueItemStatus.PENDING, null))))
            .isInstanceOf(PersistenceException.class);
    }

    private UploadQueueStore store(Path file) {
        return new UploadQueueStore(file, objectMapper, meterRegistry);
    }

    private static QueueItem item(String title, QueueItemStatus status, String remoteId) {
        return QueueItem.builder()
            .itemId(title + "-id")
            .jobId("job-1")
            .artifactLocator("/tmp/" + title + ".mp4")
            .title(title)
            .description("desc")
            .tags(new ArrayList<>(List.of("news", "daily")))
            .status(status)
            .remoteId(remoteId)
            .scheduledPublishTime(NOW.plusSeconds(9000))
            .addedAt(NOW)
            .kind(ArtifactKind.SHORT)
            .contentSnippet("snippet of " + title)
            .build();
    }
}
