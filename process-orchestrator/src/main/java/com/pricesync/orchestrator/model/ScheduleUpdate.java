package com.pricesync.orchestrator.model;

/**
 * Result of enabling, moving or disabling a schedule.
 *
 * The live job is always changed. {@code persisted == false} means the schedule file
 * could not be written, so the change will not survive a restart until the next
 * successful write; {@code warning} then carries the text to show the operator.
 */
public record ScheduleUpdate(String processName, String jobId, String time, boolean persisted, String warning) {

    public boolean enabled() {
        return time != null;
    }
}
