package com.sarkari.jobfeed.scrape.persistence;

import com.sarkari.jobfeed.scrape.model.SourceRow;
import com.sarkari.jobfeed.scrape.model.SourceStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Source registry: government sites and their scrape bookkeeping.
 */
@Repository
public class SourceJdbcRepository {
    private static final String SELECT_SOURCE = """
        SELECT id, name, display_name, base_url, active, status, scrape_frequency_hours, config_json,
               last_scraped_at, last_error, total_jobs_found
        FROM government_sources
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public SourceJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<SourceRow> findById(long sourceId) {
        List<SourceRow> rows = jdbc.query(
            SELECT_SOURCE + " WHERE id = :id",
            new MapSqlParameterSource("id", sourceId),
            sourceRowMapper()
        );
        return rows.stream().findFirst();
    }

    public Optional<SourceRow> findByName(String name) {
        List<SourceRow> rows = jdbc.query(
            SELECT_SOURCE + " WHERE name = :name",
            new MapSqlParameterSource("name", name),
            sourceRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<SourceRow> findActive() {
        return jdbc.query(
            SELECT_SOURCE + " WHERE active = TRUE AND status = 'active' ORDER BY last_scraped_at NULLS FIRST, id",
            new MapSqlParameterSource(),
            sourceRowMapper()
        );
    }

    public long insertSource(
        String name,
        String displayName,
        String baseUrl,
        int frequencyHours,
        String configJson,
        boolean active
    ) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("displayName", displayName)
            .addValue("baseUrl", baseUrl)
            .addValue("frequencyHours", Math.max(1, frequencyHours))
            .addValue("configJson", configJson)
            .addValue("active", active)
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO government_sources (
                    name, display_name, base_url, active, status, scrape_frequency_hours, config_json,
                    total_jobs_found, created_at, updated_at
                )
                VALUES (
                    :name, :displayName, :baseUrl, :active, 'active', :frequencyHours, :configJson,
                    0, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            return findByName(name)
                .map(SourceRow::id)
                .orElseThrow(() -> new IllegalStateException("Failed to insert government source " + name));
        }
        return key.longValue();
    }

    public void updateSource(
        long sourceId,
        String displayName,
        String baseUrl,
        int frequencyHours,
        String configJson,
        boolean active
    ) {
        jdbc.update(
            """
                UPDATE government_sources
                SET display_name = :displayName,
                    base_url = :baseUrl,
                    scrape_frequency_hours = :frequencyHours,
                    config_json = :configJson,
                    active = :active,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", sourceId)
                .addValue("displayName", displayName)
                .addValue("baseUrl", baseUrl)
                .addValue("frequencyHours", Math.max(1, frequencyHours))
                .addValue("configJson", configJson)
                .addValue("active", active)
                .addValue("now", toTimestamp(Instant.now()))
        );
    }

    public void markScrapeStarted(long sourceId, Instant startedAt) {
        jdbc.update(
            "UPDATE government_sources SET updated_at = :at WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", sourceId)
                .addValue("at", toTimestamp(startedAt))
        );
    }

    public void markScrapeCompleted(long sourceId, Instant completedAt, int jobsFound) {
        jdbc.update(
            """
                UPDATE government_sources
                SET last_scraped_at = :at,
                    total_jobs_found = total_jobs_found + :jobsFound,
                    last_error = NULL,
                    status = CASE WHEN status = 'error' THEN 'active' ELSE status END,
                    updated_at = :at
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", sourceId)
                .addValue("at", toTimestamp(completedAt))
                .addValue("jobsFound", Math.max(0, jobsFound))
        );
    }

    public void markScrapeError(long sourceId, Instant failedAt, String message) {
        jdbc.update(
            """
                UPDATE government_sources
                SET status = 'error',
                    last_error = :message,
                    last_scraped_at = :at,
                    updated_at = :at
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", sourceId)
                .addValue("at", toTimestamp(failedAt))
                .addValue("message", message)
        );
    }

    public void updateStatus(long sourceId, SourceStatus status) {
        jdbc.update(
            "UPDATE government_sources SET status = :status, updated_at = :now WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", sourceId)
                .addValue("status", status.dbValue())
                .addValue("now", toTimestamp(Instant.now()))
        );
    }

    private RowMapper<SourceRow> sourceRowMapper() {
        return (rs, rowNum) -> new SourceRow(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("display_name"),
            rs.getString("base_url"),
            rs.getBoolean("active"),
            SourceStatus.fromDbValue(rs.getString("status")),
            rs.getInt("scrape_frequency_hours"),
            rs.getString("config_json"),
            toInstant(rs.getTimestamp("last_scraped_at")),
            rs.getString("last_error"),
            rs.getLong("total_jobs_found")
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
