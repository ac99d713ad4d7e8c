package com.sarkari.jobfeed.scrape.model;

import java.time.Instant;

public record SourceRow(
    long id,
    String name,
    String displayName,
    String baseUrl,
    boolean active,
    SourceStatus status,
    int frequencyHours,
    String configJson,
    Instant lastScrapedAt,
    String lastError,
    long totalJobsFound
) {
}
