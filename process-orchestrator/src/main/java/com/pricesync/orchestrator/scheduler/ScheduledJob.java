package com.pricesync.orchestrator.scheduler;

import java.time.LocalTime;
import java.util.concurrent.ScheduledFuture;

/**
 * A live daily job. Replaced as a whole when its time changes.
 */
public record ScheduledJob(String jobId, String processName, LocalTime time, String cron,
                           ScheduledFuture<?> future) {

    public int hour() {
        return time.getHour();
    }

    public int minute() {
        return time.getMinute();
    }

    public String timeOfDay() {
        return String.format("%02d:%02d", time.getHour(), time.getMinute());
    }
}
