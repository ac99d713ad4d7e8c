package com.sarkari.jobfeed.scrape.error;

import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;

public class ScrapeException extends RuntimeException {
    private final ScrapeErrorType errorType;

    public ScrapeException(ScrapeErrorType errorType, String message) {
        super(message);
        this.errorType = errorType == null ? ScrapeErrorType.OTHER : errorType;
    }

    public ScrapeException(ScrapeErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType == null ? ScrapeErrorType.OTHER : errorType;
    }

    public ScrapeErrorType errorType() {
        return errorType;
    }
}
