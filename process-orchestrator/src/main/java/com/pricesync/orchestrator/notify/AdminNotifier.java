package com.pricesync.orchestrator.notify;

import com.pricesync.orchestrator.config.OrchestratorProperties;
import com.pricesync.orchestrator.model.ChainResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans a scheduled-run outcome out to every configured admin.
 *
 * Each recipient is attempted on its own; a failed delivery is logged and the loop
 * moves on to the next admin.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AdminNotifier {

    private final NotificationSink sink;
    private final OrchestratorProperties properties;

    /**
     * @return number of admins the message was delivered to
     */
    public int notifyScheduledRun(ChainResult result) {
        return broadcast(scheduledRunText(result));
    }

    public int broadcast(String text) {
        List<String> adminIds = properties.getNotify().getAdminIds().stream()
                .filter(id -> id != null && !id.isBlank())
                .map(String::trim)
                .toList();
        if (adminIds.isEmpty()) {
            log.error("No admin ids configured, notification not sent");
            return 0;
        }

        int delivered = 0;
        for (String adminId : adminIds) {
            try {
                sink.send(adminId, text);
                delivered++;
            } catch (Exception e) {
                log.error("Could not notify admin {}: {}", adminId, e.getMessage());
            }
        }
        log.info("Notification delivered to {}/{} admins", delivered, adminIds.size());
        return delivered;
    }

    /**
     * A completed chain is announced with a single line; a failure carries the summary,
     * truncated to {@code notify.failure-detail-max}.
     */
    String scheduledRunText(ChainResult result) {
        if (result.isSucceeded()) {
            return "[Schedule] Process '" + result.getProcessName() + "' completed.";
        }
        return "[Schedule] Process '" + result.getProcessName() + "' FAILED."
                + "\n\nResult:\n" + truncate(result.summary(), properties.getNotify().getFailureDetailMax());
    }

    static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }
}
