package com.sarkari.jobfeed.scrape.model;

import java.util.List;

public record SourceTestResult(
    long sourceId,
    FetchStrategyType strategy,
    String pageUrl,
    boolean fetchSucceeded,
    int containersFound,
    int recordsFound,
    int validRecords,
    String nextPageUrl,
    List<NormalizedJobRecord> samples,
    List<String> issues
) {
}
