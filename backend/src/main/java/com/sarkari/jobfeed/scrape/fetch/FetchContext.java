package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.scrape.http.RetryPolicy;
import com.sarkari.jobfeed.scrape.http.TokenBucketRateLimiter;
import com.sarkari.jobfeed.scrape.model.SourceConfig;

import java.time.Duration;

public record FetchContext(
    SourceConfig source,
    TokenBucketRateLimiter rateLimiter,
    RetryPolicy retryPolicy,
    Duration timeout
) {
}
