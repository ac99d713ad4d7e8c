package com.sarkari.jobfeed.scrape.error;

import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;

public class RecordValidationException extends ScrapeException {
    private final String field;

    public RecordValidationException(String field, String message) {
        super(ScrapeErrorType.VALIDATION, message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
