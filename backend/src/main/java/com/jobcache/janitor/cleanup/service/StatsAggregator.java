package com.jobcache.janitor.cleanup.service;

import com.jobcache.janitor.cleanup.model.CurrentStats;
import com.jobcache.janitor.cleanup.persistence.CacheStoreSession;
import com.jobcache.janitor.cleanup.persistence.CacheTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Read-only totals reported with each sweep. A failed count reads as 0.
 */
@Component
public class StatsAggregator {
    private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

    private final CacheStoreSession store;

    public StatsAggregator(CacheStoreSession store) {
        this.store = store;
    }

    public CurrentStats collect() {
        return new CurrentStats(
            countOrZero(CacheTable.JOBS),
            countOrZero(CacheTable.SEARCH_TERMS),
            countOrZero(CacheTable.JOB_SEARCH_LINKS)
        );
    }

    private long countOrZero(CacheTable table) {
        try {
            return store.countRows(table);
        } catch (DataAccessException e) {
            log.warn("Failed to count rows in {}", table.tableName(), e);
            return 0L;
        }
    }
}
