package com.sarkari.jobfeed.scrape.model;

public enum ScrapeRunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
