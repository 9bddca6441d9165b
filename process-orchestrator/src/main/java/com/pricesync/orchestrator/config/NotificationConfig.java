package com.pricesync.orchestrator.config;

import com.pricesync.orchestrator.notify.LoggingNotificationSink;
import com.pricesync.orchestrator.notify.NotificationSink;
import com.pricesync.orchestrator.notify.TelegramNotificationSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class NotificationConfig {

    /**
     * Telegram when BOT_TOKEN is set, otherwise notifications are only logged.
     */
    @Bean
    public NotificationSink notificationSink(OrchestratorProperties properties, RestTemplateBuilder restTemplateBuilder) {
        String token = properties.getNotify().getTelegram().getBotToken();
        if (token == null || token.isBlank()) {
            log.warn("No Telegram bot token configured, admin notifications will only be logged");
            return new LoggingNotificationSink();
        }
        return new TelegramNotificationSink(restTemplateBuilder, properties);
    }
}
