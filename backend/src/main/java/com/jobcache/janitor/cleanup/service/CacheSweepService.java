package com.jobcache.janitor.cleanup.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobcache.janitor.cleanup.model.CleanupSummary;
import com.jobcache.janitor.cleanup.model.CurrentStats;
import com.jobcache.janitor.cleanup.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one cleanup sweep: expired jobs, stale search counts, orphaned search
 * terms, totals, then the legacy cache table. All stages share one {@code now}.
 * Only a failed expired-job delete aborts the sweep; other stages report 0 on
 * failure.
 */
@Service
public class CacheSweepService {
    private static final Logger log = LoggerFactory.getLogger(CacheSweepService.class);

    private final ExpiryReaper expiryReaper;
    private final StalenessDecay stalenessDecay;
    private final OrphanReclaimer orphanReclaimer;
    private final StatsAggregator statsAggregator;
    private final LegacySweeper legacySweeper;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CacheSweepService(
        ExpiryReaper expiryReaper,
        StalenessDecay stalenessDecay,
        OrphanReclaimer orphanReclaimer,
        StatsAggregator statsAggregator,
        LegacySweeper legacySweeper,
        Clock clock,
        ObjectMapper objectMapper
    ) {
        this.expiryReaper = expiryReaper;
        this.stalenessDecay = stalenessDecay;
        this.orphanReclaimer = orphanReclaimer;
        this.statsAggregator = statsAggregator;
        this.legacySweeper = legacySweeper;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    public CleanupSummary sweep() {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveSweepException("A cleanup sweep is already running");
        }
        try {
            return runStages(Instant.now(clock));
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private CleanupSummary runStages(Instant now) {
        log.info("Starting job cache cleanup at {}", now);

        StageResult expired = expiryReaper.run(now);
        if (expired.isFailed()) {
            log.error("Cleanup aborted at stage {}: {}", expired.stage(), expired.reason());
            throw new CacheSweepFailedException(expired.stage(), expired.reason());
        }

        StageResult decayed = report(stalenessDecay.run(now));
        StageResult orphaned = report(orphanReclaimer.run(now));
        CurrentStats stats = statsAggregator.collect();
        StageResult legacy = report(legacySweeper.run(now));

        CleanupSummary summary = new CleanupSummary(
            true,
            expired.count(),
            decayed.count(),
            orphaned.count(),
            legacy.count(),
            stats
        );
        log.info("Cleanup complete: {}", describe(summary));
        return summary;
    }

    private StageResult report(StageResult result) {
        if (result.isFailed()) {
            log.warn("Cleanup stage {} failed, reporting 0: {}", result.stage(), result.reason());
        }
        return result;
    }

    private String describe(CleanupSummary summary) {
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            log.debug("Unable to serialize cleanup summary", e);
            return summary.toString();
        }
    }
}
