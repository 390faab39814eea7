package com.jobcache.janitor.cleanup.persistence;

import com.jobcache.janitor.cleanup.model.SearchTermRef;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Store operations the cleanup sweep depends on. Every call is a single blocking
 * round-trip that either succeeds or throws a
 * {@link org.springframework.dao.DataAccessException}; there is no retry.
 * Deleting a job must cascade to its {@code job_search_links} rows, which the
 * schema enforces.
 */
public interface CacheStoreSession {

    /** Deletes jobs whose {@code expires_at} is strictly before {@code cutoff}. */
    int deleteExpiredJobs(Instant cutoff);

    /**
     * Sets {@code search_count} to {@code floor} for terms last searched before
     * {@code cutoff} whose count is above {@code floor}.
     */
    int resetStaleSearchCounts(Instant cutoff, int floor);

    List<SearchTermRef> findSearchTermsLastSearchedBefore(Instant cutoff);

    /**
     * Link counts grouped by search term. Terms without links are absent from
     * the returned map.
     */
    Map<UUID, Long> countLinksBySearchTerm(Collection<UUID> searchTermIds);

    int deleteSearchTermsByIds(Collection<UUID> searchTermIds);

    long countRows(CacheTable table);

    boolean tableExists(CacheTable table);

    int deleteExpiredLegacyCacheEntries(Instant cutoff);
}
