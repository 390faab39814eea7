package com.jobcache.janitor.cleanup.service;

import com.jobcache.janitor.cleanup.model.StageResult;
import com.jobcache.janitor.cleanup.persistence.CacheStoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Deletes jobs whose expiry is before the sweep time. The schema cascades the
 * delete to {@code job_search_links}, which {@link OrphanReclaimer} relies on.
 */
@Component
public class ExpiryReaper {
    static final String STAGE = "expired_jobs";
    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);

    private final CacheStoreSession store;

    public ExpiryReaper(CacheStoreSession store) {
        this.store = store;
    }

    public StageResult run(Instant now) {
        try {
            int deleted = store.deleteExpiredJobs(now);
            log.info("Deleted {} expired jobs (expiresBefore={})", deleted, now);
            return StageResult.succeeded(STAGE, deleted);
        } catch (DataAccessException e) {
            log.error("Failed to delete expired jobs", e);
            return StageResult.failed(STAGE, rootMessage(e));
        }
    }

    static String rootMessage(DataAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        String message = cause == null ? null : cause.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
