package com.sarkari.jobfeed.scrape.error;

import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;

public class StrategyUnavailableException extends ScrapeException {
    private final FetchStrategyType strategy;

    public StrategyUnavailableException(FetchStrategyType strategy, String message, Throwable cause) {
        super(ScrapeErrorType.OTHER, message, cause);
        this.strategy = strategy;
    }

    public FetchStrategyType strategy() {
        return strategy;
    }
}
