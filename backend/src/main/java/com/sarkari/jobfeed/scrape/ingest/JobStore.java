package com.sarkari.jobfeed.scrape.ingest;

import com.sarkari.jobfeed.scrape.model.NormalizedJobRecord;
import com.sarkari.jobfeed.scrape.model.StoredJob;

import java.util.Map;
import java.util.Optional;

/**
 * Storage seam for normalized postings. Field names in {@link #update} are the column names of
 * the posting table.
 */
public interface JobStore {
    Optional<StoredJob> findByContentHash(long sourceId, String contentHash);

    Optional<StoredJob> findBySourceIdentity(long sourceId, String sourceUrl, String title);

    long create(long sourceId, NormalizedJobRecord record);

    /**
     * Applies the changed fields, stores the new content hash and quality score and bumps the version.
     */
    void update(long jobId, Map<String, Object> changedFields, String contentHash, int qualityScore);
}
