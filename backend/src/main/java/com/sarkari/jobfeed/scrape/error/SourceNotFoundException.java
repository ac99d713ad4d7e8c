package com.sarkari.jobfeed.scrape.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class SourceNotFoundException extends RuntimeException {
    public SourceNotFoundException(long sourceId) {
        super("Government source " + sourceId + " not found");
    }
}
