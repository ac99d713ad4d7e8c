package com.sarkari.jobfeed.scrape.ingest;

import com.sarkari.jobfeed.scrape.model.NormalizedJobRecord;
import com.sarkari.jobfeed.scrape.model.StoredJob;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Job store backed by a list, enforcing the (source, content hash) uniqueness the table has.
 */
public class InMemoryJobStore implements JobStore {
    private final List<StoredJob> jobs = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();
    private NormalizedJobRecord concurrentInsert;

    @Override
    public synchronized Optional<StoredJob> findByContentHash(long sourceId, String contentHash) {
        return jobs.stream()
            .filter(job -> job.sourceId() == sourceId && Objects.equals(job.contentHash(), contentHash))
            .findFirst();
    }

    @Override
    public synchronized Optional<StoredJob> findBySourceIdentity(long sourceId, String sourceUrl, String title) {
        return jobs.stream()
            .filter(job -> job.sourceId() == sourceId)
            .filter(job -> Objects.equals(job.record().sourceUrl(), sourceUrl))
            .filter(job -> Objects.equals(job.record().title(), title))
            .reduce((first, second) -> second);
    }

    @Override
    public synchronized long create(long sourceId, NormalizedJobRecord record) {
        if (concurrentInsert != null) {
            NormalizedJobRecord winner = concurrentInsert;
            concurrentInsert = null;
            jobs.add(new StoredJob(ids.incrementAndGet(), sourceId, 1, winner));
        }
        if (findByContentHash(sourceId, record.contentHash()).isPresent()) {
            throw new DataIntegrityViolationException("duplicate content hash " + record.contentHash());
        }
        long id = ids.incrementAndGet();
        jobs.add(new StoredJob(id, sourceId, 1, record));
        return id;
    }

    @Override
    public synchronized void update(long jobId, Map<String, Object> changedFields, String contentHash, int qualityScore) {
        for (int i = 0; i < jobs.size(); i++) {
            StoredJob job = jobs.get(i);
            if (job.id() == jobId) {
                NormalizedJobRecord updated = apply(job.record(), changedFields, contentHash, qualityScore);
                jobs.set(i, new StoredJob(jobId, job.sourceId(), job.version() + 1, updated));
                return;
            }
        }
        throw new IllegalArgumentException("Unknown job " + jobId);
    }

    /**
     * Makes the next {@link #create} lose a race against another writer storing {@code record}.
     */
    public synchronized void simulateConcurrentInsert(NormalizedJobRecord record) {
        this.concurrentInsert = record;
    }

    public synchronized List<StoredJob> all() {
        return List.copyOf(jobs);
    }

    public synchronized StoredJob get(long jobId) {
        return jobs.stream().filter(job -> job.id() == jobId).findFirst().orElseThrow();
    }

    private static NormalizedJobRecord apply(
        NormalizedJobRecord r,
        Map<String, Object> changes,
        String contentHash,
        int qualityScore
    ) {
        return new NormalizedJobRecord(
            r.title(),
            (String) changes.getOrDefault("description", r.description()),
            (String) changes.getOrDefault("department", r.department()),
            (Integer) changes.getOrDefault("total_posts", r.totalPosts()),
            (String) changes.getOrDefault("qualification", r.qualification()),
            (LocalDate) changes.getOrDefault("notification_date", r.notificationDate()),
            (LocalDate) changes.getOrDefault("last_date", r.lastDate()),
            (LocalDate) changes.getOrDefault("exam_date", r.examDate()),
            (BigDecimal) changes.getOrDefault("application_fee", r.applicationFee()),
            (BigDecimal) changes.getOrDefault("salary_min", r.salaryMin()),
            (BigDecimal) changes.getOrDefault("salary_max", r.salaryMax()),
            (Integer) changes.getOrDefault("age_min", r.ageMin()),
            (Integer) changes.getOrDefault("age_max", r.ageMax()),
            (String) changes.getOrDefault("location", r.location()),
            (String) changes.getOrDefault("state", r.state()),
            (String) changes.getOrDefault("application_link", r.applicationLink()),
            (String) changes.getOrDefault("notification_pdf", r.notificationPdf()),
            r.sourceUrl(),
            contentHash,
            qualityScore
        );
    }
}
