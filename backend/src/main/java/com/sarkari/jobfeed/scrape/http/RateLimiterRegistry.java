package com.sarkari.jobfeed.scrape.http;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One limiter per source id, shared by every run of that source in this process. The bucket keeps the
 * rate it was created with until the source's own requests-per-minute setting changes; runs that fell
 * back to another strategy still draw from the same bucket.
 */
@Component
public class RateLimiterRegistry {
    private final ScraperProperties properties;
    private final Map<Long, Entry> limiters = new ConcurrentHashMap<>();

    public RateLimiterRegistry(ScraperProperties properties) {
        this.properties = properties;
    }

    public TokenBucketRateLimiter limiterFor(SourceConfig source, FetchStrategyType strategy) {
        int requestsPerMinute = requestsPerMinute(source, strategy);
        Integer override = source.requestsPerMinute();
        return limiters.compute(source.id(), (id, existing) -> {
            if (existing != null && Objects.equals(existing.override(), override)) {
                return existing;
            }
            return new Entry(new TokenBucketRateLimiter(requestsPerMinute, properties.getRateLimit().getBurst()), override);
        }).limiter();
    }

    int requestsPerMinute(SourceConfig source, FetchStrategyType strategy) {
        if (source.requestsPerMinute() != null && source.requestsPerMinute() > 0) {
            return source.requestsPerMinute();
        }
        ScraperProperties.RateLimit rateLimit = properties.getRateLimit();
        if (strategy == FetchStrategyType.BROWSER) {
            return rateLimit.getBrowserRequestsPerMinute();
        }
        if (strategy == FetchStrategyType.CRAWL) {
            return rateLimit.getCrawlRequestsPerMinute();
        }
        return rateLimit.getHttpRequestsPerMinute();
    }

    private record Entry(TokenBucketRateLimiter limiter, Integer override) {
    }
}
