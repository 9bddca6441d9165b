package com.pricesync.orchestrator.notify;

/**
 * Delivers a text message to one operator.
 */
public interface NotificationSink {

    /**
     * @param recipientId transport-level id of the operator (e.g. a chat id)
     * @throws RuntimeException if delivery failed
     */
    void send(String recipientId, String text);
}
