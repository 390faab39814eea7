package com.jobcache.janitor.cleanup.model;

public record CleanupSummary(
    boolean success,
    int deletedExpiredJobs,
    int resetStaleSearchTerms,
    int deletedOrphanedTerms,
    int oldCacheDeleted,
    CurrentStats currentStats
) {
}
