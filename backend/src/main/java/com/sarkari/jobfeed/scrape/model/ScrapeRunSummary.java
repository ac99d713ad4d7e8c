package com.sarkari.jobfeed.scrape.model;

import java.time.Instant;

public record ScrapeRunSummary(
    long scrapeRunId,
    long sourceId,
    ScrapeRunStatus status,
    FetchStrategyType strategy,
    Instant startedAt,
    Instant completedAt,
    Long durationMs,
    int pagesScraped,
    int requestsMade,
    Long averageResponseMs,
    int jobsFound,
    int jobsCreated,
    int jobsUpdated,
    int jobsSkipped,
    int errorCount,
    String notes
) {
}
