package com.sarkari.jobfeed.scrape.error;

import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;

/**
 * Aborts the whole run, as opposed to per-page and per-record errors which are only logged.
 */
public class SystemicScrapeException extends ScrapeException {
    public SystemicScrapeException(ScrapeErrorType errorType, String message) {
        super(errorType, message);
    }

    public SystemicScrapeException(ScrapeErrorType errorType, String message, Throwable cause) {
        super(errorType, message, cause);
    }
}
