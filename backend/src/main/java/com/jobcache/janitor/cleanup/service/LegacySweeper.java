package com.jobcache.janitor.cleanup.service;

import com.jobcache.janitor.cleanup.model.StageResult;
import com.jobcache.janitor.cleanup.persistence.CacheStoreSession;
import com.jobcache.janitor.cleanup.persistence.CacheTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Expires rows in the superseded {@code job_search_cache} table while consumers
 * migrate off it. Deployments without the table skip the stage.
 */
@Component
public class LegacySweeper {
    static final String STAGE = "legacy_search_cache";
    private static final Logger log = LoggerFactory.getLogger(LegacySweeper.class);

    private final CacheStoreSession store;

    public LegacySweeper(CacheStoreSession store) {
        this.store = store;
    }

    public StageResult run(Instant now) {
        try {
            if (!store.tableExists(CacheTable.JOB_SEARCH_CACHE)) {
                log.debug("Legacy table {} not present; skipping", CacheTable.JOB_SEARCH_CACHE.tableName());
                return StageResult.skipped(STAGE, "table_absent");
            }
            int deleted = store.deleteExpiredLegacyCacheEntries(now);
            if (deleted > 0) {
                log.info("Deleted {} expired entries from legacy {}", deleted, CacheTable.JOB_SEARCH_CACHE.tableName());
            }
            return StageResult.succeeded(STAGE, deleted);
        } catch (DataAccessException e) {
            log.warn("Failed to sweep legacy {}", CacheTable.JOB_SEARCH_CACHE.tableName(), e);
            return StageResult.failed(STAGE, ExpiryReaper.rootMessage(e));
        }
    }
}
