package com.pricesync.orchestrator.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricesync.orchestrator.service.ProcessRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleStoreTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private Path file;
    private ScheduleStore store;

    @BeforeEach
    void setUp() {
        file = dataDir.resolve("schedules.json");
        store = new ScheduleStore(mapper, new ProcessRegistry(), file);
    }

    @Test
    void setThenLoad() {
        store.setSchedule("Sale", "09:30");

        assertThat(store.loadAll()).containsExactly(Map.entry("Sale", "09:30"));
    }

    @Test
    void fileUsesJobIdKeys() throws Exception {
        store.setSchedule("Sale", "08:00");
        store.setSchedule("CurrencyInfo", "21:45");

        JsonNode json = mapper.readTree(file.toFile());
        assertThat(json.path("schedule_Sale").asText()).isEqualTo("08:00");
        assertThat(json.path("schedule_CurrencyInfo").asText()).isEqualTo("21:45");
        assertThat(json.size()).isEqualTo(2);
    }

    @Test
    void clearRemovesKey() throws Exception {
        store.setSchedule("Sale", "09:30");
        store.setSchedule("PackageIdPrice", "10:00");

        store.clearSchedule("Sale");

        assertThat(store.loadAll()).doesNotContainKey("Sale").containsKey("PackageIdPrice");
        assertThat(mapper.readTree(file.toFile()).has("schedule_Sale")).isFalse();
    }

    @Test
    void clearingAbsentScheduleIsNoOp() {
        store.clearSchedule("CurrencyInfo");

        assertThat(store.loadAll()).isEmpty();
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    void invalidTimesAreRejectedWithoutWriting() {
        for (String bad : new String[]{"25:00", "24:00", "9:30", "09:60", "0930", "", " 09:30", "09:30 ", "ab:cd"}) {
            assertThatThrownBy(() -> store.setSchedule("Sale", bad))
                    .as(bad)
                    .isInstanceOf(IllegalArgumentException.class);
        }
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    void unknownProcessIsRejected() {
        assertThatThrownBy(() -> store.setSchedule("Inventory", "09:30"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.clearSchedule("Inventory"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loadSkipsBadEntriesAndKeepsTheRest() throws Exception {
        Files.writeString(file, """
                {
                  "schedule_Sale": "08:00",
                  "schedule_Inventory": "09:00",
                  "schedule_CurrencyInfo": "7:5",
                  "schedule_PackageIdPrice": 1200,
                  "unrelated": "x"
                }
                """);

        assertThat(store.loadAll()).containsExactly(Map.entry("Sale", "08:00"));
    }

    @Test
    void corruptFileLoadsAsEmptyAndIsRewrittenOnNextSet() throws Exception {
        Files.writeString(file, "{not json");

        assertThat(store.loadAll()).isEmpty();

        store.setSchedule("Sale", "06:15");
        assertThat(mapper.readTree(file.toFile()).path("schedule_Sale").asText()).isEqualTo("06:15");
    }

    @Test
    void writeAllReplacesOwnedKeysOnly() throws Exception {
        Files.writeString(file, "{\"schedule_Sale\":\"08:00\",\"schedule_Legacy\":\"01:00\"}");

        store.writeAll(Map.of("CurrencyInfo", "12:00"));

        JsonNode json = mapper.readTree(file.toFile());
        assertThat(json.has("schedule_Sale")).isFalse();
        assertThat(json.path("schedule_CurrencyInfo").asText()).isEqualTo("12:00");
        assertThat(json.path("schedule_Legacy").asText()).isEqualTo("01:00");
    }

    @Test
    void writeFailureIsReported() throws Exception {
        Path blocker = dataDir.resolve("blocker");
        Files.writeString(blocker, "a file where a directory should be");
        ScheduleStore broken = new ScheduleStore(mapper, new ProcessRegistry(), blocker.resolve("schedules.json"));

        assertThatThrownBy(() -> broken.setSchedule("Sale", "08:00"))
                .isInstanceOf(ScheduleStoreException.class);
    }

    @Test
    void parseTime() {
        assertThat(ScheduleStore.parseTime("00:00")).isEqualTo(LocalTime.MIDNIGHT);
        assertThat(ScheduleStore.parseTime("23:59")).isEqualTo(LocalTime.of(23, 59));
        assertThat(ScheduleStore.jobId("Sale")).isEqualTo("schedule_Sale");
    }
}
