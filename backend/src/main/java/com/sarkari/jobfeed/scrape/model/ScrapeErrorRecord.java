package com.sarkari.jobfeed.scrape.model;

import java.time.Instant;

public record ScrapeErrorRecord(
    Long id,
    long scrapeRunId,
    ScrapeErrorType errorType,
    String message,
    String url,
    String selector,
    int retryCount,
    boolean resolved,
    Instant occurredAt
) {
}
