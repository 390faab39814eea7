package com.jobcache.janitor.cleanup.persistence;

public enum CacheTable {
    JOBS("jobs"),
    SEARCH_TERMS("search_terms"),
    JOB_SEARCH_LINKS("job_search_links"),
    JOB_SEARCH_CACHE("job_search_cache");

    private final String tableName;

    CacheTable(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
