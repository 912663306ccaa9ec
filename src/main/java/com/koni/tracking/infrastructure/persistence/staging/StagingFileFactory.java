package com.koni.tracking.infrastructure.persistence.staging;

import com.koni.tracking.domain.exception.StagingFileException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates staging files named after the calling worker thread, so concurrent workers never share one.
 */
@Slf4j
public class StagingFileFactory {

    private final Path directory;
    private final AtomicLong sequence = new AtomicLong();

    public StagingFileFactory(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StagingFileException("Cannot create staging directory " + directory, e);
        }
        log.info("Staging tracking samples under {}", directory.toAbsolutePath());
    }

    public StagingFile create() {
        String worker = Thread.currentThread().getName().replaceAll("[^A-Za-z0-9_-]", "_");
        Path path = directory.resolve("track_" + worker + "_" + sequence.incrementAndGet() + ".csv");
        return StagingFile.create(path);
    }

    public Path getDirectory() {
        return directory;
    }
}
