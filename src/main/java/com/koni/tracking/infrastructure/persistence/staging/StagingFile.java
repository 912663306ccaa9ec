package com.koni.tracking.infrastructure.persistence.staging;

import com.koni.tracking.domain.exception.StagingFileException;
import com.koni.tracking.domain.model.TrackingSample;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Temporary CSV file holding the samples of one tracking report until they are bulk-loaded.
 * 
 * Records are written as {@code mac,uuid,rssi,panic,battery,initial,final,server_time_offset}
 * with timestamps in UTC. Closing the file deletes it.
 */
@Slf4j
public class StagingFile implements AutoCloseable {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Path path;
    private final BufferedWriter writer;
    private boolean writerClosed;
    private int recordCount;

    private StagingFile(Path path, BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    static StagingFile create(Path path) {
        try {
            BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return new StagingFile(path, writer);
        } catch (IOException e) {
            throw new StagingFileException("Cannot create staging file " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    public int getRecordCount() {
        return recordCount;
    }

    public void append(TrackingSample sample) {
        if (writerClosed) {
            throw new IllegalStateException("Staging file " + path + " is no longer writable");
        }
        try {
            writer.write(toRecord(sample));
            writer.newLine();
            recordCount++;
        } catch (IOException e) {
            throw new StagingFileException("Cannot write to staging file " + path, e);
        }
    }

    /**
     * Finishes writing and opens the staged records for reading.
     */
    public Reader openReader() {
        try {
            closeWriter();
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StagingFileException("Cannot read staging file " + path, e);
        }
    }

    @Override
    public void close() {
        try {
            closeWriter();
        } catch (IOException e) {
            log.warn("Failed to close writer of staging file {}: {}", path, e.getMessage());
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StagingFileException("Cannot delete staging file " + path, e);
        }
    }

    static String toRecord(TrackingSample sample) {
        return String.join(",",
                csvField(sample.getTagMac()),
                csvField(sample.getBeaconUuid()),
                Integer.toString(sample.getRssi()),
                sample.isPanic() ? "1" : "0",
                sample.getBatteryVoltage().toPlainString(),
                timestamp(sample.getInitialTimestamp()),
                timestamp(sample.getFinalTimestamp()),
                Long.toString(sample.getBeaconReportLatency()));
    }

    private void closeWriter() throws IOException {
        if (!writerClosed) {
            writerClosed = true;
            writer.close();
        }
    }

    private static String timestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    private static String csvField(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
