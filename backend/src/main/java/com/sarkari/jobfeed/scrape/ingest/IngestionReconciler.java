package com.sarkari.jobfeed.scrape.ingest;

import com.sarkari.jobfeed.scrape.model.NormalizedJobRecord;
import com.sarkari.jobfeed.scrape.model.ReconcileOutcome;
import com.sarkari.jobfeed.scrape.model.ReconcileResult;
import com.sarkari.jobfeed.scrape.model.StoredJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a normalized record is new, a changed version of a stored posting, or a duplicate.
 * Deduplication is scoped to a single source.
 */
@Component
public class IngestionReconciler {
    private static final Logger log = LoggerFactory.getLogger(IngestionReconciler.class);
    private static final int LOCK_STRIPES = 64;

    private final JobStore jobStore;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public IngestionReconciler(JobStore jobStore) {
        this.jobStore = jobStore;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    public ReconcileResult reconcile(long sourceId, NormalizedJobRecord record) {
        return reconcile(sourceId, record, true, new ReconcileBatch());
    }

    /**
     * @param matchByLink whether {@code record.sourceUrl()} identifies this posting. Records that only
     *                    carry the listing page URL never take the update path.
     * @param batch       postings already matched in the same run; they are never matched again
     */
    public ReconcileResult reconcile(long sourceId, NormalizedJobRecord record, boolean matchByLink, ReconcileBatch batch) {
        if (record == null || record.contentHash() == null) {
            throw new IllegalArgumentException("A normalized record with a content hash is required");
        }
        synchronized (lockFor(sourceId, record.contentHash())) {
            Optional<StoredJob> duplicate = jobStore.findByContentHash(sourceId, record.contentHash());
            if (duplicate.isPresent()) {
                batch.claim(duplicate.get().id());
                return ReconcileResult.skipped(duplicate.get().id());
            }

            Optional<StoredJob> previous = matchByLink
                ? jobStore.findBySourceIdentity(sourceId, record.sourceUrl(), record.title())
                : Optional.empty();
            if (previous.isPresent() && batch.claim(previous.get().id())) {
                StoredJob stored = previous.get();
                Map<String, Object> changes = changedFields(stored.record(), record);
                jobStore.update(stored.id(), changes, record.contentHash(), record.qualityScore());
                log.debug("Updated job {} of source {} ({} fields changed)", stored.id(), sourceId, changes.size());
                return new ReconcileResult(ReconcileOutcome.UPDATED, stored.id(), new ArrayList<>(changes.keySet()));
            }

            try {
                long id = jobStore.create(sourceId, record);
                batch.claim(id);
                return new ReconcileResult(ReconcileOutcome.CREATED, id, List.of());
            } catch (DataIntegrityViolationException e) {
                log.debug("Job {} of source {} was inserted concurrently", record.contentHash(), sourceId);
                Long existingId = jobStore.findByContentHash(sourceId, record.contentHash())
                    .map(StoredJob::id)
                    .orElse(null);
                return ReconcileResult.skipped(existingId);
            }
        }
    }

    /**
     * Fields whose incoming value is present and differs from the stored one, keyed by column name.
     */
    static Map<String, Object> changedFields(NormalizedJobRecord stored, NormalizedJobRecord incoming) {
        Map<String, Object> changes = new LinkedHashMap<>();
        putIfChanged(changes, "description", stored.description(), incoming.description());
        putIfChanged(changes, "department", stored.department(), incoming.department());
        putIfChanged(changes, "total_posts", stored.totalPosts(), incoming.totalPosts());
        putIfChanged(changes, "qualification", stored.qualification(), incoming.qualification());
        putIfChanged(changes, "notification_date", stored.notificationDate(), incoming.notificationDate());
        putIfChanged(changes, "last_date", stored.lastDate(), incoming.lastDate());
        putIfChanged(changes, "exam_date", stored.examDate(), incoming.examDate());
        putIfChanged(changes, "application_fee", stored.applicationFee(), incoming.applicationFee());
        putIfChanged(changes, "salary_min", stored.salaryMin(), incoming.salaryMin());
        putIfChanged(changes, "salary_max", stored.salaryMax(), incoming.salaryMax());
        putIfChanged(changes, "age_min", stored.ageMin(), incoming.ageMin());
        putIfChanged(changes, "age_max", stored.ageMax(), incoming.ageMax());
        putIfChanged(changes, "location", stored.location(), incoming.location());
        putIfChanged(changes, "state", stored.state(), incoming.state());
        putIfChanged(changes, "application_link", stored.applicationLink(), incoming.applicationLink());
        putIfChanged(changes, "notification_pdf", stored.notificationPdf(), incoming.notificationPdf());
        return changes;
    }

    private static void putIfChanged(Map<String, Object> changes, String column, Object current, Object incoming) {
        if (incoming == null) {
            return;
        }
        if (current instanceof BigDecimal left && incoming instanceof BigDecimal right) {
            if (left.compareTo(right) != 0) {
                changes.put(column, incoming);
            }
            return;
        }
        if (!Objects.equals(current, incoming)) {
            changes.put(column, incoming);
        }
    }

    private Object lockFor(long sourceId, String contentHash) {
        int hash = 31 * Long.hashCode(sourceId) + contentHash.hashCode();
        return locks[Math.floorMod(hash, LOCK_STRIPES)];
    }
}
