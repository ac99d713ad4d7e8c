package com.sarkari.jobfeed.scrape.persistence;

import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.ProxyEndpoint;
import com.sarkari.jobfeed.scrape.model.ProxyType;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorRecord;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;
import com.sarkari.jobfeed.scrape.model.ScrapeRun;
import com.sarkari.jobfeed.scrape.model.ScrapeRunStatus;
import com.sarkari.jobfeed.scrape.model.ScrapeRunSummary;
import com.sarkari.jobfeed.scrape.model.SourceStatisticsRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Run bookkeeping: scrape runs, their errors, raw record audit rows, proxies and daily statistics.
 */
@Repository
public class ScrapeJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJdbcRepository.class);
    private static final int MAX_MESSAGE_LENGTH = 4000;

    private static final String SELECT_RUN = """
        SELECT id, source_id, status, strategy, started_at, completed_at, duration_ms, pages_scraped,
               requests_made, avg_response_ms, jobs_found, jobs_created, jobs_updated, jobs_skipped,
               error_count, notes
        FROM scrape_runs
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public ScrapeJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long insertScrapeRun(long sourceId, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceId", sourceId)
            .addValue("status", ScrapeRunStatus.RUNNING.name())
            .addValue("startedAt", toTimestamp(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_runs (source_id, status, started_at)
                VALUES (:sourceId, :status, :startedAt)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            Long fallback = jdbc.queryForObject(
                """
                    SELECT id
                    FROM scrape_runs
                    WHERE source_id = :sourceId AND started_at = :startedAt
                    ORDER BY id DESC
                    LIMIT 1
                    """,
                params,
                Long.class
            );
            if (fallback == null) {
                throw new IllegalStateException("Failed to create scrape run for source " + sourceId);
            }
            return fallback;
        }
        return key.longValue();
    }

    public void updateRunStrategy(long runId, FetchStrategyType strategy) {
        jdbc.update(
            "UPDATE scrape_runs SET strategy = :strategy WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", runId)
                .addValue("strategy", strategy == null ? null : strategy.name())
        );
    }

    /**
     * Writes the final counters of a terminal run. Only a row still marked RUNNING is updated, so a
     * run closes out at most once even if the lifecycle runner raced it.
     */
    public boolean completeScrapeRun(ScrapeRun run) {
        ScrapeRunSummary summary = run.toSummary();
        if (!summary.status().isTerminal()) {
            throw new IllegalArgumentException("Scrape run " + summary.scrapeRunId() + " is still running");
        }
        int updated = jdbc.update(
            """
                UPDATE scrape_runs
                SET status = :status,
                    strategy = :strategy,
                    completed_at = :completedAt,
                    duration_ms = :durationMs,
                    pages_scraped = :pagesScraped,
                    requests_made = :requestsMade,
                    avg_response_ms = :avgResponseMs,
                    jobs_found = :jobsFound,
                    jobs_created = :jobsCreated,
                    jobs_updated = :jobsUpdated,
                    jobs_skipped = :jobsSkipped,
                    error_count = :errorCount,
                    notes = :notes
                WHERE id = :id AND status = 'RUNNING'
                """,
            new MapSqlParameterSource()
                .addValue("id", summary.scrapeRunId())
                .addValue("status", summary.status().name())
                .addValue("strategy", summary.strategy() == null ? null : summary.strategy().name())
                .addValue("completedAt", toTimestamp(summary.completedAt()))
                .addValue("durationMs", summary.durationMs())
                .addValue("pagesScraped", summary.pagesScraped())
                .addValue("requestsMade", summary.requestsMade())
                .addValue("avgResponseMs", summary.averageResponseMs())
                .addValue("jobsFound", summary.jobsFound())
                .addValue("jobsCreated", summary.jobsCreated())
                .addValue("jobsUpdated", summary.jobsUpdated())
                .addValue("jobsSkipped", summary.jobsSkipped())
                .addValue("errorCount", summary.errorCount())
                .addValue("notes", truncate(summary.notes()))
        );
        if (updated == 0) {
            log.warn("Scrape run {} was not RUNNING when closing out as {}", summary.scrapeRunId(), summary.status());
        }
        return updated > 0;
    }

    public Optional<ScrapeRunSummary> findRunSummary(long runId) {
        List<ScrapeRunSummary> rows = jdbc.query(
            SELECT_RUN + " WHERE id = :id",
            new MapSqlParameterSource("id", runId),
            runSummaryRowMapper()
        );
        return rows.stream().findFirst();
    }

    public List<ScrapeRunSummary> findRunningRuns() {
        return jdbc.query(
            SELECT_RUN + " WHERE status = 'RUNNING' ORDER BY started_at",
            new MapSqlParameterSource(),
            runSummaryRowMapper()
        );
    }

    public List<ScrapeRunSummary> findRunsStartedBetween(long sourceId, Instant from, Instant to) {
        return jdbc.query(
            SELECT_RUN + " WHERE source_id = :sourceId AND started_at >= :from AND started_at < :to ORDER BY started_at",
            new MapSqlParameterSource()
                .addValue("sourceId", sourceId)
                .addValue("from", toTimestamp(from))
                .addValue("to", toTimestamp(to)),
            runSummaryRowMapper()
        );
    }

    public boolean failStaleRun(ScrapeRunSummary run, Instant completedAt, String note) {
        Instant finishedAt = completedAt.isBefore(run.startedAt()) ? run.startedAt() : completedAt;
        int updated = jdbc.update(
            """
                UPDATE scrape_runs
                SET status = 'FAILED',
                    completed_at = :completedAt,
                    duration_ms = :durationMs,
                    notes = :note
                WHERE id = :id AND status = 'RUNNING'
                """,
            new MapSqlParameterSource()
                .addValue("id", run.scrapeRunId())
                .addValue("completedAt", toTimestamp(finishedAt))
                .addValue("durationMs", finishedAt.toEpochMilli() - run.startedAt().toEpochMilli())
                .addValue("note", truncate(note))
        );
        return updated > 0;
    }

    public long insertScrapeError(ScrapeErrorRecord error) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_errors (
                    scrape_run_id, error_type, message, url, selector, retry_count, resolved, occurred_at
                )
                VALUES (
                    :runId, :errorType, :message, :url, :selector, :retryCount, :resolved, :occurredAt
                )
                """,
            new MapSqlParameterSource()
                .addValue("runId", error.scrapeRunId())
                .addValue("errorType", error.errorType().dbValue())
                .addValue("message", truncate(error.message() == null ? error.errorType().name() : error.message()))
                .addValue("url", error.url())
                .addValue("selector", error.selector())
                .addValue("retryCount", Math.max(0, error.retryCount()))
                .addValue("resolved", error.resolved())
                .addValue("occurredAt", toTimestamp(error.occurredAt() == null ? Instant.now() : error.occurredAt())),
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? -1L : key.longValue();
    }

    public List<ScrapeErrorRecord> findErrors(long runId) {
        return jdbc.query(
            """
                SELECT id, scrape_run_id, error_type, message, url, selector, retry_count, resolved, occurred_at
                FROM scrape_errors
                WHERE scrape_run_id = :runId
                ORDER BY occurred_at, id
                """,
            new MapSqlParameterSource("runId", runId),
            (rs, rowNum) -> new ScrapeErrorRecord(
                rs.getLong("id"),
                rs.getLong("scrape_run_id"),
                ScrapeErrorType.fromDbValue(rs.getString("error_type")),
                rs.getString("message"),
                rs.getString("url"),
                rs.getString("selector"),
                rs.getInt("retry_count"),
                rs.getBoolean("resolved"),
                toInstant(rs.getTimestamp("occurred_at"))
            )
        );
    }

    /**
     * Records the raw fields of an extracted record once per (source, content hash).
     *
     * @return false when the same content was already recorded for the source
     */
    public boolean insertRawRecordIfAbsent(
        long sourceId,
        long runId,
        String contentHash,
        String pageUrl,
        String sourceUrl,
        String fieldsJson,
        Integer qualityScore,
        String outcome,
        String validationError,
        Instant createdAt
    ) {
        try {
            int inserted = jdbc.update(
                """
                    INSERT INTO raw_job_records (
                        source_id, scrape_run_id, content_hash, page_url, source_url, fields_json,
                        quality_score, outcome, validation_error, created_at
                    )
                    VALUES (
                        :sourceId, :runId, :contentHash, :pageUrl, :sourceUrl, :fieldsJson,
                        :qualityScore, :outcome, :validationError, :createdAt
                    )
                    """,
                new MapSqlParameterSource()
                    .addValue("sourceId", sourceId)
                    .addValue("runId", runId)
                    .addValue("contentHash", contentHash)
                    .addValue("pageUrl", pageUrl)
                    .addValue("sourceUrl", sourceUrl)
                    .addValue("fieldsJson", fieldsJson)
                    .addValue("qualityScore", qualityScore)
                    .addValue("outcome", outcome)
                    .addValue("validationError", truncate(validationError))
                    .addValue("createdAt", toTimestamp(createdAt))
            );
            return inserted > 0;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    public Optional<ProxyEndpoint> findBestActiveProxy() {
        List<ProxyEndpoint> rows = jdbc.query(
            """
                SELECT id, host, port, proxy_type, username, password, success_rate, requests_made
                FROM scrape_proxies
                WHERE status = 'active'
                ORDER BY success_rate DESC, requests_made ASC, id ASC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new ProxyEndpoint(
                rs.getLong("id"),
                rs.getString("host"),
                rs.getInt("port"),
                ProxyType.fromDbValue(rs.getString("proxy_type")),
                rs.getString("username"),
                rs.getString("password"),
                rs.getDouble("success_rate"),
                rs.getLong("requests_made")
            )
        );
        return rows.stream().findFirst();
    }

    public long insertProxy(String host, int port, ProxyType type, String username, String password) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_proxies (host, port, proxy_type, username, password)
                VALUES (:host, :port, :type, :username, :password)
                """,
            new MapSqlParameterSource()
                .addValue("host", host)
                .addValue("port", port)
                .addValue("type", type.name().toLowerCase(Locale.ROOT))
                .addValue("username", username)
                .addValue("password", password),
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert proxy " + host + ":" + port);
        }
        return key.longValue();
    }

    public void recordProxyUsage(long proxyId, boolean success, long responseMs) {
        jdbc.update(
            """
                UPDATE scrape_proxies
                SET requests_made = requests_made + 1,
                    requests_successful = requests_successful + CASE WHEN :success THEN 1 ELSE 0 END,
                    requests_failed = requests_failed + CASE WHEN :success THEN 0 ELSE 1 END,
                    success_rate = 100.0 * (requests_successful + CASE WHEN :success THEN 1 ELSE 0 END)
                        / (requests_made + 1),
                    average_response_ms = (average_response_ms * requests_made + :responseMs) / (requests_made + 1),
                    last_used_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", proxyId)
                .addValue("success", success)
                .addValue("responseMs", Math.max(0L, responseMs))
                .addValue("now", toTimestamp(Instant.now()))
        );
    }

    public void upsertSourceStatistics(SourceStatisticsRow row) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceId", row.sourceId())
            .addValue("statDate", Date.valueOf(row.statDate()))
            .addValue("runs", row.runs())
            .addValue("successfulRuns", row.successfulRuns())
            .addValue("failedRuns", row.failedRuns())
            .addValue("jobsFound", row.jobsFound())
            .addValue("jobsCreated", row.jobsCreated())
            .addValue("jobsUpdated", row.jobsUpdated())
            .addValue("avgDurationMs", row.averageDurationMs());
        int updated = jdbc.update(
            """
                UPDATE source_statistics
                SET runs = :runs,
                    successful_runs = :successfulRuns,
                    failed_runs = :failedRuns,
                    jobs_found = :jobsFound,
                    jobs_created = :jobsCreated,
                    jobs_updated = :jobsUpdated,
                    avg_duration_ms = :avgDurationMs
                WHERE source_id = :sourceId AND stat_date = :statDate
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO source_statistics (
                        source_id, stat_date, runs, successful_runs, failed_runs, jobs_found, jobs_created,
                        jobs_updated, avg_duration_ms
                    )
                    VALUES (
                        :sourceId, :statDate, :runs, :successfulRuns, :failedRuns, :jobsFound, :jobsCreated,
                        :jobsUpdated, :avgDurationMs
                    )
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent statistics insert for source {} on {}, retrying as update", row.sourceId(), row.statDate());
            jdbc.update(
                """
                    UPDATE source_statistics
                    SET runs = :runs,
                        successful_runs = :successfulRuns,
                        failed_runs = :failedRuns,
                        jobs_found = :jobsFound,
                        jobs_created = :jobsCreated,
                        jobs_updated = :jobsUpdated,
                        avg_duration_ms = :avgDurationMs
                    WHERE source_id = :sourceId AND stat_date = :statDate
                    """,
                params
            );
        }
    }

    public Optional<SourceStatisticsRow> findSourceStatistics(long sourceId, LocalDate statDate) {
        List<SourceStatisticsRow> rows = jdbc.query(
            """
                SELECT source_id, stat_date, runs, successful_runs, failed_runs, jobs_found, jobs_created,
                       jobs_updated, avg_duration_ms
                FROM source_statistics
                WHERE source_id = :sourceId AND stat_date = :statDate
                """,
            new MapSqlParameterSource()
                .addValue("sourceId", sourceId)
                .addValue("statDate", Date.valueOf(statDate)),
            (rs, rowNum) -> new SourceStatisticsRow(
                rs.getLong("source_id"),
                rs.getDate("stat_date").toLocalDate(),
                rs.getInt("runs"),
                rs.getInt("successful_runs"),
                rs.getInt("failed_runs"),
                rs.getInt("jobs_found"),
                rs.getInt("jobs_created"),
                rs.getInt("jobs_updated"),
                getNullableLong(rs, "avg_duration_ms")
            )
        );
        return rows.stream().findFirst();
    }

    private RowMapper<ScrapeRunSummary> runSummaryRowMapper() {
        return (rs, rowNum) -> {
            String strategy = rs.getString("strategy");
            return new ScrapeRunSummary(
                rs.getLong("id"),
                rs.getLong("source_id"),
                ScrapeRunStatus.valueOf(rs.getString("status")),
                strategy == null ? null : FetchStrategyType.valueOf(strategy),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                getNullableLong(rs, "duration_ms"),
                rs.getInt("pages_scraped"),
                rs.getInt("requests_made"),
                getNullableLong(rs, "avg_response_ms"),
                rs.getInt("jobs_found"),
                rs.getInt("jobs_created"),
                rs.getInt("jobs_updated"),
                rs.getInt("jobs_skipped"),
                rs.getInt("error_count"),
                rs.getString("notes")
            );
        };
    }

    private Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private String truncate(String value) {
        if (value == null || value.length() <= MAX_MESSAGE_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_MESSAGE_LENGTH);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
