package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.scrape.error.StrategyUnavailableException;
import com.sarkari.jobfeed.scrape.model.FetchResult;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;

import java.util.List;

/**
 * Retrieves page markup for one run. Failures come back as a {@link FetchResult} carrying a
 * {@link com.sarkari.jobfeed.scrape.model.FetchFailure}, never as exceptions.
 */
public interface FetchStrategy extends AutoCloseable {

    FetchStrategyType type();

    /**
     * Acquires the runtime the strategy needs (HTTP client, browser session).
     *
     * @throws StrategyUnavailableException when that runtime is missing or disabled
     */
    void initialize();

    FetchResult fetch(String url, FetchContext context);

    /**
     * Hint that these URLs will be requested next. Strategies that cannot fetch ahead ignore it.
     */
    default void prefetch(List<String> urls, FetchContext context) {
    }

    /**
     * Drops look-ahead results nobody asked for.
     *
     * @return requests already spent on them
     */
    default int discardPrefetched() {
        return 0;
    }

    @Override
    void close();
}
