package com.jobcache.janitor.cleanup.service;

import com.jobcache.janitor.cleanup.model.SearchTermRef;
import com.jobcache.janitor.cleanup.model.StageResult;
import com.jobcache.janitor.cleanup.persistence.CacheStoreSession;
import com.jobcache.janitor.config.CleanupProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Deletes search terms that have not been searched within the orphan window and
 * no longer link to any job.
 *
 * <p>Candidates are checked in chunks: one grouped link count per chunk, then a
 * single delete for the terms missing from the count. A chunk whose count fails
 * is kept as-is, since its reference state is unknown. Must run after
 * {@link ExpiryReaper} in the same sweep so cascaded link deletions are visible.
 *
 * <p>The count and the delete are separate statements. A link added for a
 * candidate in between is not seen; overlapping sweeps and writers are expected
 * to be kept apart by the caller.
 */
@Component
public class OrphanReclaimer {
    static final String STAGE = "orphaned_search_terms";
    private static final Logger log = LoggerFactory.getLogger(OrphanReclaimer.class);

    private final CacheStoreSession store;
    private final CleanupProperties properties;

    public OrphanReclaimer(CacheStoreSession store, CleanupProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public StageResult run(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(properties.getOrphanSearchDays()));
        List<SearchTermRef> candidates;
        try {
            candidates = store.findSearchTermsLastSearchedBefore(cutoff);
        } catch (DataAccessException e) {
            log.warn("Failed to load orphan candidates (lastSearchedBefore={})", cutoff, e);
            return StageResult.failed(STAGE, ExpiryReaper.rootMessage(e));
        }

        int batchSize = properties.getOrphanBatchSize();
        int deleted = 0;
        int skippedChunks = 0;
        for (int i = 0; i < candidates.size(); i += batchSize) {
            List<SearchTermRef> chunk = candidates.subList(i, Math.min(candidates.size(), i + batchSize));
            List<UUID> orphanIds = findOrphans(chunk);
            if (orphanIds == null) {
                skippedChunks++;
                continue;
            }
            if (orphanIds.isEmpty()) {
                continue;
            }
            try {
                deleted += store.deleteSearchTermsByIds(orphanIds);
            } catch (DataAccessException e) {
                skippedChunks++;
                log.warn("Failed to delete {} orphaned search terms", orphanIds.size(), e);
            }
        }

        log.info(
            "Deleted {} orphaned search terms (candidates={}, skippedChunks={}, lastSearchedBefore={})",
            deleted,
            candidates.size(),
            skippedChunks,
            cutoff
        );
        return StageResult.succeeded(STAGE, deleted);
    }

    /**
     * Returns ids in {@code chunk} with no links, or null when the link count
     * could not be read.
     */
    private List<UUID> findOrphans(List<SearchTermRef> chunk) {
        List<UUID> ids = new ArrayList<>(chunk.size());
        for (SearchTermRef ref : chunk) {
            ids.add(ref.id());
        }
        Map<UUID, Long> linkCounts;
        try {
            linkCounts = store.countLinksBySearchTerm(ids);
        } catch (DataAccessException e) {
            log.warn("Failed to count links for {} candidate search terms; keeping them", ids.size(), e);
            return null;
        }

        List<UUID> orphans = new ArrayList<>();
        for (SearchTermRef ref : chunk) {
            Long count = linkCounts.get(ref.id());
            if (count == null || count == 0L) {
                log.debug("Search term '{}' has no linked jobs", ref.canonicalTerm());
                orphans.add(ref.id());
            }
        }
        return orphans;
    }
}
