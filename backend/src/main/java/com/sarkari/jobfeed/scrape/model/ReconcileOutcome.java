package com.sarkari.jobfeed.scrape.model;

public enum ReconcileOutcome {
    CREATED,
    UPDATED,
    SKIPPED
}
