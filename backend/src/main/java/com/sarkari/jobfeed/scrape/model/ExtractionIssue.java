package com.sarkari.jobfeed.scrape.model;

public record ExtractionIssue(
    ScrapeErrorType errorType,
    String message,
    String selector
) {
}
