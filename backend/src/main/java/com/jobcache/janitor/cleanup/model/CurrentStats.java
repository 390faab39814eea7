package com.jobcache.janitor.cleanup.model;

public record CurrentStats(long totalJobs, long totalSearchTerms, long totalLinks) {
    public static CurrentStats empty() {
        return new CurrentStats(0L, 0L, 0L);
    }
}
