package com.whereq.cadence.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.cadence.exception.PersistenceException;
import com.whereq.cadence.model.QueueItem;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Durable ordered list of publish items, persisted as one JSON array.
 *
 * <p>Every mutation rewrites the whole file through a temp file and a rename, so a reader never
 * sees a truncated queue. Not safe for several processes sharing one file.
 */
@Slf4j
public class UploadQueueStore {

    private static final TypeReference<List<QueueItem>> ITEM_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Counter loadFailures;
    private final ReentrantLock lock = new ReentrantLock();

    public UploadQueueStore(Path file, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.loadFailures = Counter.builder("cadence.queue.load.failures")
            .description("Upload queue loads that fell back to an empty queue")
            .register(meterRegistry);
    }

    /**
     * Load the queue. A missing or unreadable file yields an empty list; an unreadable file is
     * first renamed to {@code <name>.corrupt-<epoch millis>}.
     */
    public List<QueueItem> load() {
        lock.lock();
        try {
            return read();
        } finally {
            lock.unlock();
        }
    }

    public void append(QueueItem item) {
        appendAll(List.of(item));
    }

    public void appendAll(Collection<QueueItem> items) {
        update(current -> {
            current.addAll(items);
            return current;
        });
    }

    /**
     * Replace the whole queue.
     *
     * @throws PersistenceException if the file cannot be written
     */
    public void save(List<QueueItem> items) {
        lock.lock();
        try {
            write(items);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Load, transform and save the queue while holding the store lock.
     * The mutator must not perform network calls.
     *
     * @return the saved list
     */
    public List<QueueItem> update(UnaryOperator<List<QueueItem>> mutator) {
        lock.lock();
        try {
            List<QueueItem> updated = mutator.apply(read());
            write(updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove items matching the predicate.
     *
     * @return number of removed items
     */
    public int prune(Predicate<QueueItem> removable) {
        int[] removed = new int[1];
        update(current -> {
            int before = current.size();
            current.removeIf(removable);
            removed[0] = before - current.size();
            return current;
        });
        if (removed[0] > 0) {
            log.info("Pruned {} items from upload queue", removed[0]);
        }
        return removed[0];
    }

    public Path getFile() {
        return file;
    }

    private List<QueueItem> read() {
        try {
            byte[] content = Files.readAllBytes(file);
            if (content.length == 0) {
                return new ArrayList<>();
            }
            List<QueueItem> items = objectMapper.readValue(content, ITEM_LIST);
            List<QueueItem> result = new ArrayList<>(items.size());
            for (QueueItem item : items) {
                if (item == null) {
                    continue;
                }
                if (!item.isConsistent()) {
                    log.warn("Queue item '{}' has status {} but remoteId={}",
                        item.getTitle(), item.getStatus(), item.getRemoteId());
                }
                result.add(item);
            }
            return result;
        } catch (NoSuchFileException e) {
            log.info("Upload queue file {} does not exist yet, starting with an empty queue", file);
            return new ArrayList<>();
        } catch (IOException e) {
            loadFailures.increment();
            Path quarantined = quarantine();
            log.error("Failed to load upload queue from {}, moved it to {} and continuing with an empty queue",
                file, quarantined, e);
            return new ArrayList<>();
        }
    }

    /**
     * Move an unreadable queue file aside so the next save cannot overwrite its history.
     *
     * @throws PersistenceException if the file cannot be moved
     */
    private Path quarantine() {
        Path target = file.resolveSibling(file.getFileName() + ".corrupt-" + Instant.now().toEpochMilli());
        try {
            return Files.move(file, target);
        } catch (IOException e) {
            throw new PersistenceException("Upload queue " + file + " is unreadable and could not be moved aside", e);
        }
    }

    private void write(List<QueueItem> items) {
        Path target = file.toAbsolutePath();
        Path directory = target.getParent();
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), items);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Saved {} items to upload queue {}", items.size(), target);
        } catch (IOException e) {
            throw new PersistenceException("Failed to save upload queue to " + target, e);
        }
    }
}
