package com.sarkari.jobfeed.scrape.model;

public record StoredJob(
    long id,
    long sourceId,
    int version,
    NormalizedJobRecord record
) {
    public String contentHash() {
        return record.contentHash();
    }
}
