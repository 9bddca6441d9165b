package com.pricesync.orchestrator.service;

import com.pricesync.orchestrator.model.CallResult;
import com.pricesync.orchestrator.model.ChainResult;
import com.pricesync.orchestrator.model.ProcessDefinition;
import com.pricesync.orchestrator.model.ScheduleUpdate;
import com.pricesync.orchestrator.model.StatusRecord;
import com.pricesync.orchestrator.scheduler.ProcessScheduler;
import com.pricesync.orchestrator.store.ScheduleStore;
import com.pricesync.orchestrator.store.StatusStore;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Operations the chat transport calls on behalf of an operator.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProcessControlService {

    /** Sent as the schedule time to disable a schedule. */
    public static final String DISABLE = "-";

    private final ProcessRegistry registry;
    private final ChainExecutor chainExecutor;
    private final RunLock runLock;
    private final StatusStore statusStore;
    private final ProcessScheduler scheduler;
    private final ApiGateway apiGateway;

    @Value
    @Builder
    public static class ManualRun {
        String runId;
        /** True when another chain held the lock on arrival and this run had to wait. */
        boolean queued;
        ChainResult result;
        /** Set when the status record could not be saved. */
        String warning;
    }

    // ── Runs ──────────────────────────────────────────────────────────────────

    /**
     * Run a chain now, waiting for any chain already in progress.
     *
     * @throws IllegalArgumentException for an unknown process
     */
    public ManualRun runManual(String processName) {
        ProcessDefinition definition = registry.require(processName);
        String runId = "manual-" + processName + "-" + UUID.randomUUID().toString().substring(0, 8);

        boolean queued = false;
        ChainResult result;
        try {
            RunLock.Outcome<ChainResult> outcome = runLock.runTracked(runId, () -> chainExecutor.run(definition));
            result = outcome.value();
            queued = outcome.waited();
        } catch (Exception e) {
            log.error("[{}] Manual run failed: {}", runId, e.getMessage(), e);
            result = ChainResult.builder()
                    .processName(processName)
                    .succeeded(false)
                    .logEntry("[-] Process '" + processName + "': critical error during run, see server logs")
                    .build();
        }
        if (queued) {
            log.info("[{}] had to wait for another process before starting", runId);
        }

        boolean saved = statusStore.record(processName, result.isSucceeded(), result.summary());
        return ManualRun.builder()
                .runId(runId)
                .queued(queued)
                .result(result)
                .warning(saved ? null : "Run finished but its status could not be saved")
                .build();
    }

    public boolean isRunning() {
        return runLock.isHeld();
    }

    // ── Schedules ─────────────────────────────────────────────────────────────

    /**
     * @param time "HH:MM" to enable or move, {@value #DISABLE} to disable
     * @throws IllegalArgumentException for an unknown process or malformed time
     */
    public ScheduleUpdate setSchedule(String processName, String time) {
        registry.require(processName);
        if (DISABLE.equals(time)) {
            return scheduler.clearSchedule(processName);
        }
        ScheduleStore.parseTime(time);
        return scheduler.setSchedule(processName, time);
    }

    /** Live schedules, process name → HH:MM. Processes without a schedule are absent. */
    public Map<String, String> getSchedules() {
        return scheduler.activeSchedules();
    }

    // ── Status & logs ─────────────────────────────────────────────────────────

    public Optional<StatusRecord> getLastStatus(String processName) {
        registry.require(processName);
        return statusStore.read(processName);
    }

    public Optional<StatusRecord> getLatestStatus() {
        return statusStore.latest();
    }

    /**
     * Raw log text the external API keeps for a parser.
     */
    public CallResult getParserLogs(String parserName) {
        if (parserName == null || parserName.isBlank()) {
            throw new IllegalArgumentException("Parser name is required");
        }
        return apiGateway.getParserLogs(parserName);
    }

    public Collection<ProcessDefinition> processes() {
        return registry.all();
    }
}
