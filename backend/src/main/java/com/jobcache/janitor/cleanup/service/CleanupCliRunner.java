package com.jobcache.janitor.cleanup.service;

import com.jobcache.janitor.cleanup.model.CleanupSummary;
import com.jobcache.janitor.config.CleanupProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Runs a single sweep on startup when {@code cleanup.cli.run=true}, for use
 * from cron or a container job.
 */
@Component
public class CleanupCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CleanupCliRunner.class);

    private final CleanupProperties properties;
    private final CacheSweepService cacheSweepService;
    private final ConfigurableApplicationContext applicationContext;

    public CleanupCliRunner(
        CleanupProperties properties,
        CacheSweepService cacheSweepService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.cacheSweepService = cacheSweepService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int status = 0;
        try {
            CleanupSummary summary = cacheSweepService.sweep();
            log.info(
                "Cleanup summary: expiredJobs={}, staleTerms={}, orphanedTerms={}, legacyCache={}, stats={}",
                summary.deletedExpiredJobs(),
                summary.resetStaleSearchTerms(),
                summary.deletedOrphanedTerms(),
                summary.oldCacheDeleted(),
                summary.currentStats()
            );
        } catch (CacheSweepFailedException e) {
            log.error("Cleanup aborted at stage {}: {}", e.getStage(), e.getMessage());
            status = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitStatus = status;
            int exitCode = SpringApplication.exit(applicationContext, () -> exitStatus);
            System.exit(exitCode);
        }
    }
}
