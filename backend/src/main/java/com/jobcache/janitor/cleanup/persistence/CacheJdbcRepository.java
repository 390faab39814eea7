package com.jobcache.janitor.cleanup.persistence;

import com.jobcache.janitor.cleanup.model.SearchTermRef;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Repository
public class CacheJdbcRepository implements CacheStoreSession {
    private final NamedParameterJdbcTemplate jdbc;

    public CacheJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public int deleteExpiredJobs(Instant cutoff) {
        return jdbc.update(
            """
                DELETE FROM jobs
                WHERE expires_at < :cutoff
                """,
            new MapSqlParameterSource().addValue("cutoff", Timestamp.from(cutoff))
        );
    }

    @Override
    public int resetStaleSearchCounts(Instant cutoff, int floor) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", Timestamp.from(cutoff))
            .addValue("floor", floor);
        return jdbc.update(
            """
                UPDATE search_terms
                SET search_count = :floor
                WHERE last_searched_at < :cutoff
                  AND search_count > :floor
                """,
            params
        );
    }

    @Override
    public List<SearchTermRef> findSearchTermsLastSearchedBefore(Instant cutoff) {
        return jdbc.query(
            """
                SELECT id, canonical_term
                FROM search_terms
                WHERE last_searched_at < :cutoff
                ORDER BY last_searched_at ASC
                """,
            new MapSqlParameterSource().addValue("cutoff", Timestamp.from(cutoff)),
            (rs, rowNum) -> new SearchTermRef(
                rs.getObject("id", UUID.class),
                rs.getString("canonical_term")
            )
        );
    }

    @Override
    public Map<UUID, Long> countLinksBySearchTerm(Collection<UUID> searchTermIds) {
        Map<UUID, Long> counts = new LinkedHashMap<>();
        if (searchTermIds == null || searchTermIds.isEmpty()) {
            return counts;
        }
        jdbc.query(
            """
                SELECT search_term_id, COUNT(*) AS link_count
                FROM job_search_links
                WHERE search_term_id IN (:ids)
                GROUP BY search_term_id
                """,
            new MapSqlParameterSource().addValue("ids", searchTermIds),
            rs -> {
                counts.put(rs.getObject("search_term_id", UUID.class), rs.getLong("link_count"));
            }
        );
        return counts;
    }

    @Override
    public int deleteSearchTermsByIds(Collection<UUID> searchTermIds) {
        if (searchTermIds == null || searchTermIds.isEmpty()) {
            return 0;
        }
        return jdbc.update(
            """
                DELETE FROM search_terms
                WHERE id IN (:ids)
                """,
            new MapSqlParameterSource().addValue("ids", searchTermIds)
        );
    }

    @Override
    public long countRows(CacheTable table) {
        Long value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table.tableName(), Long.class);
        return value == null ? 0L : value;
    }

    @Override
    public boolean tableExists(CacheTable table) {
        Integer value = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM information_schema.tables
                WHERE LOWER(table_name) = :tableName
                  AND LOWER(table_schema) = LOWER(CURRENT_SCHEMA)
                """,
            new MapSqlParameterSource().addValue("tableName", table.tableName().toLowerCase(Locale.ROOT)),
            Integer.class
        );
        return value != null && value > 0;
    }

    @Override
    public int deleteExpiredLegacyCacheEntries(Instant cutoff) {
        return jdbc.update(
            """
                DELETE FROM job_search_cache
                WHERE expires_at < :cutoff
                """,
            new MapSqlParameterSource().addValue("cutoff", Timestamp.from(cutoff))
        );
    }
}
