package com.sarkari.jobfeed.scrape.model;

public enum FetchFailure {
    NETWORK(ScrapeErrorType.NETWORK, false, true),
    TIMEOUT(ScrapeErrorType.TIMEOUT, false, true),
    RATE_LIMITED(ScrapeErrorType.RATE_LIMIT, false, true),
    HTTP_STATUS(ScrapeErrorType.NETWORK, false, false),
    RENDER(ScrapeErrorType.JAVASCRIPT, false, false),
    BLOCKED(ScrapeErrorType.NETWORK, true, false),
    INVALID_URL(ScrapeErrorType.OTHER, false, false),
    INTERRUPTED(ScrapeErrorType.OTHER, true, false);

    private final ScrapeErrorType errorType;
    private final boolean fatal;
    private final boolean transientFailure;

    FetchFailure(ScrapeErrorType errorType, boolean fatal, boolean transientFailure) {
        this.errorType = errorType;
        this.fatal = fatal;
        this.transientFailure = transientFailure;
    }

    public ScrapeErrorType errorType() {
        return errorType;
    }

    /**
     * A fatal failure means the strategy cannot make progress on this source at all, so the run fails.
     */
    public boolean fatal() {
        return fatal;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
