package com.jobcache.janitor.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler for the in-process sweep trigger. Only active when
 * {@code cleanup.schedule.enabled=true}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "cleanup.schedule.enabled", havingValue = "true")
public class SchedulerConfig {

    @Bean
    public ThreadPoolTaskScheduler cleanupTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("cleanup-");
        scheduler.initialize();
        return scheduler;
    }
}
