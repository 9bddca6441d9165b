package com.pricesync.orchestrator.scheduler;

import com.pricesync.orchestrator.config.OrchestratorProperties;
import com.pricesync.orchestrator.model.ChainResult;
import com.pricesync.orchestrator.model.ProcessDefinition;
import com.pricesync.orchestrator.model.ScheduleUpdate;
import com.pricesync.orchestrator.notify.AdminNotifier;
import com.pricesync.orchestrator.service.ChainExecutor;
import com.pricesync.orchestrator.service.ProcessRegistry;
import com.pricesync.orchestrator.service.RunLock;
import com.pricesync.orchestrator.store.ScheduleStore;
import com.pricesync.orchestrator.store.ScheduleStoreException;
import com.pricesync.orchestrator.store.StatusStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the live daily jobs and keeps them in step with the {@link ScheduleStore}.
 *
 * Startup replays the stored schedules before anything else can touch the table.
 * Every later change hits the live job first, then the file; a failed write is
 * reported back but the live job stays changed.
 *
 * A fired job waits for the {@link RunLock} like any manual run, so it may start
 * later than its nominal time. Fires missed while the service was down are not
 * caught up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProcessScheduler {

    private final TaskScheduler processTaskScheduler;
    private final ScheduleStore scheduleStore;
    private final StatusStore statusStore;
    private final ChainExecutor chainExecutor;
    private final RunLock runLock;
    private final ProcessRegistry registry;
    private final AdminNotifier adminNotifier;
    private final OrchestratorProperties properties;

    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    @PostConstruct
    public synchronized void onStartup() {
        Map<String, String> stored = scheduleStore.loadAll();
        for (Map.Entry<String, String> entry : stored.entrySet()) {
            try {
                register(entry.getKey(), ScheduleStore.parseTime(entry.getValue()));
            } catch (Exception e) {
                log.error("Could not restore schedule for '{}' ({}): {}", entry.getKey(), entry.getValue(), e.getMessage(), e);
            }
        }
        log.info("Scheduler ready with {} jobs (zone {})", jobs.size(), zone());
    }

    /**
     * Shutdown: stop firing, then write the live table back to disk. A chain that is
     * running right now is abandoned together with the task scheduler.
     */
    @PreDestroy
    public synchronized void onShutdown() {
        accepting = false;
        Map<String, String> snapshot = activeSchedules();
        jobs.values().forEach(job -> job.future().cancel(false));
        jobs.clear();
        try {
            scheduleStore.writeAll(snapshot);
        } catch (Exception e) {
            log.error("Could not flush schedules on shutdown: {}", e.getMessage(), e);
        }
        log.info("Scheduler stopped, {} schedules flushed", snapshot.size());
    }

    // ── Mutations ─────────────────────────────────────────────────────────────

    /**
     * Enable or move the daily schedule of a process.
     *
     * @throws IllegalArgumentException for an unknown process or malformed time; nothing changes
     */
    public synchronized ScheduleUpdate setSchedule(String processName, String time) {
        registry.require(processName);
        LocalTime parsed = ScheduleStore.parseTime(time);
        ScheduledJob job = register(processName, parsed);

        try {
            scheduleStore.setSchedule(processName, job.timeOfDay());
            return new ScheduleUpdate(processName, job.jobId(), job.timeOfDay(), true, null);
        } catch (ScheduleStoreException e) {
            log.error("Schedule '{}' is active but was not saved: {}", job.jobId(), e.getMessage());
            return new ScheduleUpdate(processName, job.jobId(), job.timeOfDay(), false,
                    "Schedule is active but could not be saved and will be lost on restart");
        }
    }

    /**
     * Disable the schedule of a process. A run that is already firing finishes normally.
     */
    public synchronized ScheduleUpdate clearSchedule(String processName) {
        registry.require(processName);
        String jobId = ScheduleStore.jobId(processName);
        ScheduledJob removed = jobs.remove(jobId);
        if (removed != null) {
            removed.future().cancel(false);
            log.info("Job '{}' removed", jobId);
        } else {
            log.info("Job '{}' was not scheduled", jobId);
        }

        try {
            scheduleStore.clearSchedule(processName);
            return new ScheduleUpdate(processName, jobId, null, true, null);
        } catch (ScheduleStoreException e) {
            log.error("Job '{}' is disabled but the schedule file still lists it: {}", jobId, e.getMessage());
            return new ScheduleUpdate(processName, jobId, null, false,
                    "Schedule is disabled but could not be saved and will come back on restart");
        }
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    public Optional<ScheduledJob> job(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /** Live schedules as process name → HH:MM, in registry order. */
    public Map<String, String> activeSchedules() {
        Map<String, String> active = new LinkedHashMap<>();
        for (String name : registry.names()) {
            ScheduledJob job = jobs.get(ScheduleStore.jobId(name));
            if (job != null) {
                active.put(name, job.timeOfDay());
            }
        }
        return active;
    }

    // ── Firing ────────────────────────────────────────────────────────────────

    /**
     * Body of every scheduled job: run the chain under the lock, record the status,
     * notify the admins. Never throws.
     */
    void fire(String processName) {
        String jobId = ScheduleStore.jobId(processName);
        if (!accepting) {
            log.warn("[Scheduler] Ignoring '{}': shutting down", jobId);
            return;
        }
        log.info("[Scheduler] Job '{}' triggered", jobId);

        ChainResult result;
        try {
            ProcessDefinition definition = registry.require(processName);
            result = runLock.runExclusive(jobId, () -> chainExecutor.run(definition));
        } catch (Exception e) {
            log.error("[Scheduler] Critical error while running '{}': {}", jobId, e.getMessage(), e);
            result = ChainResult.builder()
                    .processName(processName)
                    .succeeded(false)
                    .logEntry("[-] Process '" + processName + "': critical error during scheduled run, see server logs")
                    .build();
        }

        // a chain cut short by shutdown leaves the previous status and stays silent
        if (!accepting || Thread.currentThread().isInterrupted()) {
            log.warn("[Scheduler] Job '{}' abandoned by shutdown, status not recorded", jobId);
            return;
        }

        if (!statusStore.record(processName, result.isSucceeded(), result.summary())) {
            log.warn("[Scheduler] Status for '{}' was not saved", processName);
        }

        try {
            adminNotifier.notifyScheduledRun(result);
        } catch (Exception e) {
            log.error("[Scheduler] Notification for '{}' failed: {}", jobId, e.getMessage(), e);
        }
        log.info("[Scheduler] Job '{}' finished (success: {})", jobId, result.isSucceeded());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ScheduledJob register(String processName, LocalTime time) {
        String jobId = ScheduleStore.jobId(processName);
        String cron = String.format("0 %d %d * * *", time.getMinute(), time.getHour());

        ScheduledJob previous = jobs.remove(jobId);
        if (previous != null) {
            previous.future().cancel(false);
        }

        var future = processTaskScheduler.schedule(() -> fire(processName), new CronTrigger(cron, zone()));
        if (future == null) {
            throw new IllegalStateException("Task scheduler refused job " + jobId);
        }
        ScheduledJob job = new ScheduledJob(jobId, processName, time, cron, future);
        jobs.put(jobId, job);
        log.info("Job '{}' scheduled daily at {} ({})", jobId, job.timeOfDay(), zone());
        return job;
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getScheduling().getZone());
    }
}
