package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.scrape.model.FetchStrategyType;

/**
 * An initialized strategy plus what was asked for; {@code warning} is set when a fallback happened.
 */
public record OpenedStrategy(
    FetchStrategy strategy,
    FetchStrategyType requested,
    String warning
) {
    public boolean fellBack() {
        return strategy.type() != requested;
    }
}
