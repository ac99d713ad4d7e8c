package com.sarkari.jobfeed.scrape.error;

import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;

public class InvalidSourceConfigException extends ScrapeException {
    public InvalidSourceConfigException(String message) {
        super(ScrapeErrorType.PARSING, message);
    }

    public InvalidSourceConfigException(String message, Throwable cause) {
        super(ScrapeErrorType.PARSING, message, cause);
    }
}
