package com.pricesync.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

    /**
     * Fires the daily process jobs. In-flight runs are abandoned on shutdown.
     */
    @Bean
    public ThreadPoolTaskScheduler processTaskScheduler(OrchestratorProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, properties.getScheduling().getPoolSize()));
        scheduler.setThreadNamePrefix("process-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
