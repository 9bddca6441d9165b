package com.pricesync.orchestrator.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pricesync.orchestrator.config.OrchestratorProperties;
import com.pricesync.orchestrator.service.ProcessRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalTime;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Durable process → daily time mapping.
 *
 * File format ({dataDir}/schedules.json):
 *   { "schedule_Sale": "08:00", "schedule_CurrencyInfo": "21:30" }
 *
 * Only enabled schedules are present; disabling removes the key. Every mutation is a
 * whole-file read-modify-write, and keys this store does not own are carried over untouched.
 */
@Component
@Slf4j
public class ScheduleStore {

    public static final String JOB_ID_PREFIX = "schedule_";
    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");
    private static final String FILE_NAME = "schedules.json";

    private final ObjectMapper objectMapper;
    private final ProcessRegistry registry;
    private final Path file;

    @Autowired
    public ScheduleStore(ObjectMapper objectMapper, ProcessRegistry registry, OrchestratorProperties properties) {
        this(objectMapper, registry, Paths.get(properties.getDataDir()).resolve(FILE_NAME));
    }

    ScheduleStore(ObjectMapper objectMapper, ProcessRegistry registry, Path file) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.file = file;
    }

    public static String jobId(String processName) {
        return JOB_ID_PREFIX + processName;
    }

    /**
     * Parse a strict 24h "HH:MM" string.
     *
     * @throws IllegalArgumentException if the string is not two-digit hour and minute
     */
    public static LocalTime parseTime(String time) {
        Matcher m = time == null ? null : TIME_PATTERN.matcher(time);
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("Invalid time '" + time + "'. Expected HH:MM, e.g. 08:00 or 21:30");
        }
        return LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    // ── Mutations ─────────────────────────────────────────────────────────────

    /**
     * @throws IllegalArgumentException for an unknown process or malformed time; nothing is written
     * @throws ScheduleStoreException   if the file could not be written
     */
    public synchronized void setSchedule(String processName, String time) {
        registry.require(processName);
        String normalised = format(parseTime(time));

        ObjectNode data = readDocument();
        data.put(jobId(processName), normalised);
        write(data);
        log.info("Schedule '{}' set to {}", jobId(processName), normalised);
    }

    /**
     * Removing a schedule that was never set is a successful no-op.
     */
    public synchronized void clearSchedule(String processName) {
        registry.require(processName);

        ObjectNode data = readDocument();
        if (data.remove(jobId(processName)) == null) {
            log.info("Schedule '{}' was already absent", jobId(processName));
            return;
        }
        write(data);
        log.info("Schedule '{}' removed", jobId(processName));
    }

    /**
     * Replace every schedule this store owns with {@code schedules} (process name → HH:MM).
     */
    public synchronized void writeAll(Map<String, String> schedules) {
        ObjectNode data = readDocument();
        Iterator<String> names = data.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (key.startsWith(JOB_ID_PREFIX) && registry.contains(key.substring(JOB_ID_PREFIX.length()))) {
                names.remove();
            }
        }
        schedules.forEach((processName, time) -> data.put(jobId(processName), format(parseTime(time))));
        write(data);
        log.info("Flushed {} schedules to {}", schedules.size(), file);
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    /**
     * All valid schedules, keyed by process name. Entries for unknown processes or with
     * a malformed time are skipped with a warning.
     */
    public synchronized Map<String, String> loadAll() {
        Map<String, String> schedules = new LinkedHashMap<>();
        ObjectNode data = readDocument();

        data.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            if (!key.startsWith(JOB_ID_PREFIX)) {
                log.warn("Skipping unrecognised key '{}' in {}", key, file);
                return;
            }
            String processName = key.substring(JOB_ID_PREFIX.length());
            if (!registry.contains(processName)) {
                log.warn("Skipping schedule for unknown process '{}' in {}", processName, file);
                return;
            }
            try {
                LocalTime time = parseTime(value.isTextual() ? value.asText() : null);
                schedules.put(processName, format(time));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping schedule '{}' with malformed time {}", key, value);
            }
        });

        log.info("Loaded {} schedules from {}", schedules.size(), file);
        return schedules;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ObjectNode readDocument() {
        if (!Files.exists(file)) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root instanceof ObjectNode object) {
                return object;
            }
            log.error("Unexpected content in {} (expected a JSON object), starting from an empty schedule set", file);
        } catch (IOException e) {
            log.error("Could not read {}, starting from an empty schedule set: {}", file, e.getMessage());
        }
        return objectMapper.createObjectNode();
    }

    private void write(ObjectNode data) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            JsonFiles.replace(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(data));
        } catch (IOException e) {
            log.error("Failed to save schedules to {}: {}", file, e.getMessage(), e);
            throw new ScheduleStoreException("Could not save schedules to " + file, e);
        }
    }

    private static String format(LocalTime time) {
        return String.format("%02d:%02d", time.getHour(), time.getMinute());
    }
}
