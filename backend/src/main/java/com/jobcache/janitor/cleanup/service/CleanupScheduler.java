package com.jobcache.janitor.cleanup.service;

import com.jobcache.janitor.config.CleanupProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Registers the in-process fixed-delay sweep. Interval and initial delay come
 * from the clamped {@link CleanupProperties.Schedule} getters.
 */
@Component
@ConditionalOnProperty(name = "cleanup.schedule.enabled", havingValue = "true")
public class CleanupScheduler implements SchedulingConfigurer {
    private static final Logger log = LoggerFactory.getLogger(CleanupScheduler.class);

    private final CacheSweepService cacheSweepService;
    private final CleanupProperties properties;

    public CleanupScheduler(CacheSweepService cacheSweepService, CleanupProperties properties) {
        this.cacheSweepService = cacheSweepService;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        CleanupProperties.Schedule schedule = properties.getSchedule();
        if (!schedule.isEnabled()) {
            return;
        }
        Duration interval = Duration.ofMillis(schedule.getIntervalMs());
        Duration initialDelay = Duration.ofMillis(schedule.getInitialDelayMs());
        log.info("Scheduling cleanup sweep every {} (initialDelay={})", interval, initialDelay);
        registrar.addFixedDelayTask(new FixedDelayTask(this::runScheduled, interval, initialDelay));
    }

    public void runScheduled() {
        try {
            cacheSweepService.sweep();
        } catch (ActiveSweepException e) {
            log.info("Skipping scheduled cleanup: {}", e.getMessage());
        } catch (CacheSweepFailedException e) {
            log.error("Scheduled cleanup aborted at stage {}: {}", e.getStage(), e.getMessage());
        }
    }
}
