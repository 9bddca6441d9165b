package com.pricesync.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    /** Directory holding schedules.json and the last_status_*.json files */
    private String dataDir = "data";

    private Api api = new Api();
    private Scheduling scheduling = new Scheduling();
    private Notify notify = new Notify();

    @Data
    public static class Api {
        private String baseUrl = "http://localhost:8081";
        private int timeoutSeconds = 120;
        private int connectTimeoutSeconds = 10;
    }

    @Data
    public static class Scheduling {
        /** Wall-clock zone the daily HH:MM triggers are evaluated in */
        private String zone = "Europe/Moscow";
        private int poolSize = 1;
    }

    @Data
    public static class Notify {
        private List<String> adminIds = new ArrayList<>();
        private int failureDetailMax = 1000;
        private Telegram telegram = new Telegram();

        @Data
        public static class Telegram {
            private String botToken = "";
            private String apiUrl = "https://api.telegram.org";
        }
    }
}
