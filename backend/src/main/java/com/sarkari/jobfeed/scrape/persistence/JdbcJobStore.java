package com.sarkari.jobfeed.scrape.persistence;

import com.sarkari.jobfeed.scrape.ingest.JobStore;
import com.sarkari.jobfeed.scrape.model.NormalizedJobRecord;
import com.sarkari.jobfeed.scrape.model.StoredJob;
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
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class JdbcJobStore implements JobStore {
    static final Set<String> UPDATABLE_COLUMNS = Set.of(
        "description",
        "department",
        "total_posts",
        "qualification",
        "notification_date",
        "last_date",
        "exam_date",
        "application_fee",
        "salary_min",
        "salary_max",
        "age_min",
        "age_max",
        "location",
        "state",
        "application_link",
        "notification_pdf"
    );

    private static final String SELECT_JOB = """
        SELECT id, source_id, title, description, department, total_posts, qualification, notification_date,
               last_date, exam_date, application_fee, salary_min, salary_max, age_min, age_max, location, state,
               application_link, notification_pdf, source_url, content_hash, quality_score, version
        FROM job_postings
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcJobStore(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public Optional<StoredJob> findByContentHash(long sourceId, String contentHash) {
        List<StoredJob> rows = jdbc.query(
            SELECT_JOB + " WHERE source_id = :sourceId AND content_hash = :contentHash",
            new MapSqlParameterSource()
                .addValue("sourceId", sourceId)
                .addValue("contentHash", contentHash),
            storedJobRowMapper()
        );
        return rows.stream().findFirst();
    }

    @Override
    public Optional<StoredJob> findBySourceIdentity(long sourceId, String sourceUrl, String title) {
        List<StoredJob> rows = jdbc.query(
            SELECT_JOB + """
                 WHERE source_id = :sourceId AND source_url = :sourceUrl AND title = :title
                ORDER BY updated_at DESC, id DESC
                """,
            new MapSqlParameterSource()
                .addValue("sourceId", sourceId)
                .addValue("sourceUrl", sourceUrl)
                .addValue("title", title),
            storedJobRowMapper()
        );
        return rows.stream().findFirst();
    }

    @Override
    public long create(long sourceId, NormalizedJobRecord record) {
        Timestamp now = Timestamp.from(Instant.now(clock));
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceId", sourceId)
            .addValue("title", record.title())
            .addValue("description", record.description())
            .addValue("department", record.department())
            .addValue("totalPosts", record.totalPosts())
            .addValue("qualification", record.qualification())
            .addValue("notificationDate", toDate(record.notificationDate()))
            .addValue("lastDate", toDate(record.lastDate()))
            .addValue("examDate", toDate(record.examDate()))
            .addValue("applicationFee", record.applicationFee())
            .addValue("salaryMin", record.salaryMin())
            .addValue("salaryMax", record.salaryMax())
            .addValue("ageMin", record.ageMin())
            .addValue("ageMax", record.ageMax())
            .addValue("location", record.location())
            .addValue("state", record.state())
            .addValue("applicationLink", record.applicationLink())
            .addValue("notificationPdf", record.notificationPdf())
            .addValue("sourceUrl", record.sourceUrl())
            .addValue("contentHash", record.contentHash())
            .addValue("qualityScore", record.qualityScore())
            .addValue("now", now);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_postings (
                    source_id, title, description, department, total_posts, qualification, notification_date,
                    last_date, exam_date, application_fee, salary_min, salary_max, age_min, age_max, location,
                    state, application_link, notification_pdf, source_url, content_hash, quality_score, version,
                    first_seen_at, updated_at
                )
                VALUES (
                    :sourceId, :title, :description, :department, :totalPosts, :qualification, :notificationDate,
                    :lastDate, :examDate, :applicationFee, :salaryMin, :salaryMax, :ageMin, :ageMax, :location,
                    :state, :applicationLink, :notificationPdf, :sourceUrl, :contentHash, :qualityScore, 1,
                    :now, :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            return findByContentHash(sourceId, record.contentHash())
                .map(StoredJob::id)
                .orElseThrow(() -> new IllegalStateException("Failed to insert job posting " + record.contentHash()));
        }
        return key.longValue();
    }

    @Override
    public void update(long jobId, Map<String, Object> changedFields, String contentHash, int qualityScore) {
        StringBuilder set = new StringBuilder();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("contentHash", contentHash)
            .addValue("qualityScore", qualityScore)
            .addValue("now", Timestamp.from(Instant.now(clock)));
        for (Map.Entry<String, Object> change : changedFields.entrySet()) {
            String column = change.getKey();
            if (!UPDATABLE_COLUMNS.contains(column)) {
                throw new IllegalArgumentException("Column " + column + " cannot be updated");
            }
            set.append(column).append(" = :").append(column).append(", ");
            Object value = change.getValue();
            params.addValue(column, value instanceof LocalDate date ? Date.valueOf(date) : value);
        }
        jdbc.update(
            "UPDATE job_postings SET " + set
                + "content_hash = :contentHash, quality_score = :qualityScore, version = version + 1, updated_at = :now"
                + " WHERE id = :id",
            params
        );
    }

    private RowMapper<StoredJob> storedJobRowMapper() {
        return (rs, rowNum) -> new StoredJob(
            rs.getLong("id"),
            rs.getLong("source_id"),
            rs.getInt("version"),
            new NormalizedJobRecord(
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("department"),
                getNullableInt(rs, "total_posts"),
                rs.getString("qualification"),
                toLocalDate(rs.getDate("notification_date")),
                toLocalDate(rs.getDate("last_date")),
                toLocalDate(rs.getDate("exam_date")),
                rs.getBigDecimal("application_fee"),
                rs.getBigDecimal("salary_min"),
                rs.getBigDecimal("salary_max"),
                getNullableInt(rs, "age_min"),
                getNullableInt(rs, "age_max"),
                rs.getString("location"),
                rs.getString("state"),
                rs.getString("application_link"),
                rs.getString("notification_pdf"),
                rs.getString("source_url"),
                rs.getString("content_hash"),
                rs.getInt("quality_score")
            )
        );
    }

    private Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private Date toDate(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }

    private LocalDate toLocalDate(Date value) {
        return value == null ? null : value.toLocalDate();
    }
}
