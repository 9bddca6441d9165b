package com.pricesync.orchestrator.notify;

import com.pricesync.orchestrator.config.OrchestratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * Sends notifications through the Telegram Bot API sendMessage method.
 */
@Slf4j
public class TelegramNotificationSink implements NotificationSink {

    private final RestTemplate restTemplate;
    private final String sendMessageUrl;

    public TelegramNotificationSink(RestTemplateBuilder restTemplateBuilder, OrchestratorProperties properties) {
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
        OrchestratorProperties.Notify.Telegram telegram = properties.getNotify().getTelegram();
        this.sendMessageUrl = telegram.getApiUrl() + "/bot" + telegram.getBotToken() + "/sendMessage";
    }

    @Override
    public void send(String recipientId, String text) {
        log.debug("Sending Telegram message to chat {}", recipientId);
        restTemplate.postForObject(sendMessageUrl, Map.of("chat_id", recipientId, "text", text), String.class);
    }
}
