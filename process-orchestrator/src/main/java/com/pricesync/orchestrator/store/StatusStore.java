package com.pricesync.orchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricesync.orchestrator.config.OrchestratorProperties;
import com.pricesync.orchestrator.model.StatusRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps the outcome of the most recent run of each process.
 *
 * Output path pattern: {dataDir}/last_status_{process}.json
 * e.g. data/last_status_Sale.json
 *
 * A failed write is logged and reported as {@code false}; it never interrupts the
 * run that produced the record.
 */
@Component
@Slf4j
public class StatusStore {

    private static final String FILE_PREFIX = "last_status_";
    private static final String FILE_SUFFIX = ".json";

    private final ObjectMapper objectMapper;
    private final Path dataDir;
    private final Clock clock;

    @Autowired
    public StatusStore(ObjectMapper objectMapper, OrchestratorProperties properties) {
        this(objectMapper, Paths.get(properties.getDataDir()), Clock.systemUTC());
    }

    StatusStore(ObjectMapper objectMapper, Path dataDir, Clock clock) {
        this.objectMapper = objectMapper;
        this.dataDir = dataDir;
        this.clock = clock;
    }

    /**
     * Overwrite the record for {@code processName} with a fresh UTC timestamp.
     *
     * @return false if the record could not be persisted
     */
    public synchronized boolean record(String processName, boolean succeeded, String message) {
        StatusRecord status = new StatusRecord(processName, Instant.now(clock).toString(), succeeded, message);
        Path target = fileFor(processName);
        try {
            Files.createDirectories(dataDir);
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(status);
            JsonFiles.replace(target, json);
            log.info("Last run status for {} saved to {} (success: {})", processName, target, succeeded);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write status file {}: {}", target, e.getMessage(), e);
            return false;
        }
    }

    /** Empty when the process has never run (or its file is unreadable). */
    public synchronized Optional<StatusRecord> read(String processName) {
        return readFile(fileFor(processName));
    }

    /** The most recent record across all processes. */
    public synchronized Optional<StatusRecord> latest() {
        if (!Files.isDirectory(dataDir)) {
            return Optional.empty();
        }
        List<StatusRecord> records = new ArrayList<>();
        try (Stream<Path> files = Files.list(dataDir)) {
            files.filter(this::isStatusFile)
                    .forEach(file -> readFile(file).ifPresent(records::add));
        } catch (IOException e) {
            log.error("Could not list status files in {}: {}", dataDir, e.getMessage(), e);
            return Optional.empty();
        }
        return records.stream()
                .filter(r -> timestampOf(r) != null)
                .max(Comparator.comparing(this::timestampOf));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<StatusRecord> readFile(Path file) {
        if (!Files.exists(file)) {
            log.debug("No status file at {}", file);
            return Optional.empty();
        }
        try {
            StatusRecord status = objectMapper.readValue(file.toFile(), StatusRecord.class);
            if (status == null || status.getProcessName() == null) {
                log.error("Malformed status file {}", file);
                return Optional.empty();
            }
            return Optional.of(status);
        } catch (IOException | RuntimeException e) {
            log.error("Could not read status file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Instant timestampOf(StatusRecord status) {
        try {
            return status.getTimestampUtc() == null ? null : Instant.parse(status.getTimestampUtc());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private boolean isStatusFile(Path file) {
        String name = file.getFileName().toString();
        return name.startsWith(FILE_PREFIX) && name.endsWith(FILE_SUFFIX);
    }

    private Path fileFor(String processName) {
        return dataDir.resolve(FILE_PREFIX + processName + FILE_SUFFIX);
    }
}
