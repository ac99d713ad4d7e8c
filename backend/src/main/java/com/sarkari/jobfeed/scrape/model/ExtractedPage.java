package com.sarkari.jobfeed.scrape.model;

import java.util.List;

public record ExtractedPage(
    String pageUrl,
    int containersFound,
    List<RawJobRecord> records,
    String nextPageUrl,
    List<ExtractionIssue> issues
) {
    public ExtractedPage {
        records = records == null ? List.of() : List.copyOf(records);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
