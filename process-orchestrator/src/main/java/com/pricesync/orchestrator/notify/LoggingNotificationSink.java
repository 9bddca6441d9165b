package com.pricesync.orchestrator.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * Fallback sink used when no chat transport is configured: notifications go to the log.
 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void send(String recipientId, String text) {
        log.info("Notification for {}:\n{}", recipientId, text);
    }
}
