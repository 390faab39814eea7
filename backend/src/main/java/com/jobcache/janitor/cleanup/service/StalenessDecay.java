package com.jobcache.janitor.cleanup.service;

import com.jobcache.janitor.cleanup.model.StageResult;
import com.jobcache.janitor.cleanup.persistence.CacheStoreSession;
import com.jobcache.janitor.config.CleanupProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Resets the popularity counter of search terms nobody searched recently.
 * Terms already at the floor are left alone so a repeat sweep updates nothing.
 */
@Component
public class StalenessDecay {
    static final String STAGE = "stale_search_terms";
    static final int SEARCH_COUNT_FLOOR = 1;
    private static final Logger log = LoggerFactory.getLogger(StalenessDecay.class);

    private final CacheStoreSession store;
    private final CleanupProperties properties;

    public StalenessDecay(CacheStoreSession store, CleanupProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public StageResult run(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(properties.getStaleSearchDays()));
        try {
            int reset = store.resetStaleSearchCounts(cutoff, SEARCH_COUNT_FLOOR);
            log.info("Reset search count for {} stale search terms (lastSearchedBefore={})", reset, cutoff);
            return StageResult.succeeded(STAGE, reset);
        } catch (DataAccessException e) {
            log.warn("Failed to reset stale search counts (lastSearchedBefore={})", cutoff, e);
            return StageResult.failed(STAGE, ExpiryReaper.rootMessage(e));
        }
    }
}
