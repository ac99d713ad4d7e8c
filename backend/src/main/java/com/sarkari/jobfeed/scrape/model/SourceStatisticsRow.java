package com.sarkari.jobfeed.scrape.model;

import java.time.LocalDate;

public record SourceStatisticsRow(
    long sourceId,
    LocalDate statDate,
    int runs,
    int successfulRuns,
    int failedRuns,
    int jobsFound,
    int jobsCreated,
    int jobsUpdated,
    Long averageDurationMs
) {
}
