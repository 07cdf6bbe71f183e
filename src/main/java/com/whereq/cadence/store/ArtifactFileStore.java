package com.whereq.cadence.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Local artifact files. Uploaded artifacts move from the download folder to the processed
 * folder; housekeeping deletes files of both folders once they are past retention.
 */
@Slf4j
public class ArtifactFileStore {

    private static final Set<String> REMOTE_SCHEMES = Set.of("http", "https");

    private final Path downloadFolder;
    private final Path processedFolder;

    public ArtifactFileStore(Path downloadFolder, Path processedFolder) {
        this.downloadFolder = downloadFolder;
        this.processedFolder = processedFolder;
    }

    public static boolean isRemote(String locator) {
        int colon = locator.indexOf("://");
        return colon > 0 && REMOTE_SCHEMES.contains(locator.substring(0, colon).toLowerCase(Locale.ROOT));
    }

    /**
     * Check that a local artifact is still on disk. Remote locators always count as present.
     */
    public boolean exists(String locator) {
        if (locator == null || locator.isBlank()) {
            return false;
        }
        if (isRemote(locator)) {
            return true;
        }
        try {
            return Files.exists(Paths.get(locator));
        } catch (InvalidPathException e) {
            log.warn("Invalid artifact locator '{}': {}", locator, e.getMessage());
            return false;
        }
    }

    /**
     * Move an uploaded artifact into the processed folder.
     *
     * @return the new locator, or the given one if the artifact is remote or could not be moved
     */
    public String moveToProcessed(String locator) {
        if (!exists(locator) || isRemote(locator)) {
            return locator;
        }
        Path source = Paths.get(locator);
        Path target = processedFolder.resolve(source.getFileName());
        try {
            Files.createDirectories(processedFolder);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Moved processed file to {}", target);
            return target.toString();
        } catch (IOException e) {
            log.warn("Failed to move processed file {}: {}", source, e.getMessage());
            return locator;
        }
    }

    /**
     * Delete files in the download and processed folders last modified before the cutoff.
     *
     * @return number of deleted files
     */
    public int deleteOlderThan(Instant cutoff) {
        int deleted = 0;
        for (Path folder : List.of(downloadFolder, processedFolder)) {
            deleted += deleteOlderThan(folder, cutoff);
        }
        return deleted;
    }

    private int deleteOlderThan(Path folder, Instant cutoff) {
        if (!Files.isDirectory(folder)) {
            return 0;
        }
        List<Path> expired;
        try (Stream<Path> files = Files.walk(folder)) {
            expired = files
                .filter(Files::isRegularFile)
                .filter(file -> modifiedBefore(file, cutoff))
                .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Error during cleanup of {}", folder, e);
            return 0;
        }

        int deleted = 0;
        for (Path file : expired) {
            try {
                Files.deleteIfExists(file);
                deleted++;
                log.info("Cleaned up old file: {}", file);
            } catch (IOException e) {
                log.warn("Failed to delete old file {}: {}", file, e.getMessage());
            }
        }
        return deleted;
    }

    private static boolean modifiedBefore(Path file, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(file).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            log.warn("Cannot read modification time of {}: {}", file, e.getMessage());
            return false;
        }
    }
}
