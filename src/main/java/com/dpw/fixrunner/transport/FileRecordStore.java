package com.dpw.fixrunner.transport;

import com.dpw.fixrunner.config.FixRunnerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Reads counterparty records from the configured log file. A missing file holds no records.
 */
@Slf4j
@Component
public class FileRecordStore implements RecordStore {

    private final Path path;

    public FileRecordStore(FixRunnerProperties properties) {
        this.path = Paths.get(properties.getRecordStore().getPath());
    }

    @Override
    public List<String> readRecords() {
        if (!Files.exists(path)) {
            log.debug("Record store {} does not exist yet", path);
            return List.of();
        }
        try {
            return Files.readAllLines(path, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read record store " + path, e);
        }
    }
}
