package com.sarkari.jobfeed.scrape.http;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.SourceFixtures;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.PaginationConfig;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import com.sarkari.jobfeed.scrape.model.SourceStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterRegistryTest {
    private final RateLimiterRegistry registry = new RateLimiterRegistry(new ScraperProperties());

    @Test
    void strategyDefaultsApplyWithoutSourceOverride() {
        SourceConfig source = SourceFixtures.source(1L, "https://ssc.gov.in");

        assertThat(registry.requestsPerMinute(source, FetchStrategyType.HTTP)).isEqualTo(30);
        assertThat(registry.requestsPerMinute(source, FetchStrategyType.CRAWL)).isEqualTo(30);
        assertThat(registry.requestsPerMinute(source, FetchStrategyType.BROWSER)).isEqualTo(20);
    }

    @Test
    void sourceOverrideWins() {
        assertThat(registry.limiterFor(withOverride(2L, 12), FetchStrategyType.BROWSER).requestsPerMinute()).isEqualTo(12);
    }

    @Test
    void runsOfTheSameSourceShareOneLimiter() {
        SourceConfig source = SourceFixtures.source(3L, "https://upsc.gov.in");

        TokenBucketRateLimiter first = registry.limiterFor(source, FetchStrategyType.HTTP);
        TokenBucketRateLimiter second = registry.limiterFor(source, FetchStrategyType.HTTP);
        TokenBucketRateLimiter other = registry.limiterFor(SourceFixtures.source(4L, "https://ssc.gov.in"), FetchStrategyType.HTTP);

        assertThat(second).isSameAs(first);
        assertThat(other).isNotSameAs(first);
    }

    @Test
    void strategyFallbackKeepsTheSourceBucket() {
        SourceConfig source = SourceFixtures.source(5L, "https://rrbcdg.gov.in");

        TokenBucketRateLimiter browserRun = registry.limiterFor(source, FetchStrategyType.BROWSER);
        TokenBucketRateLimiter fallbackRun = registry.limiterFor(source, FetchStrategyType.HTTP);

        assertThat(fallbackRun).isSameAs(browserRun);
        assertThat(fallbackRun.requestsPerMinute()).isEqualTo(20);
    }

    @Test
    void changedSourceOverrideReplacesTheBucket() {
        TokenBucketRateLimiter before = registry.limiterFor(withOverride(6L, 12), FetchStrategyType.HTTP);
        TokenBucketRateLimiter same = registry.limiterFor(withOverride(6L, 12), FetchStrategyType.CRAWL);
        TokenBucketRateLimiter after = registry.limiterFor(withOverride(6L, 6), FetchStrategyType.HTTP);

        assertThat(same).isSameAs(before);
        assertThat(after).isNotSameAs(before);
        assertThat(after.requestsPerMinute()).isEqualTo(6);
    }

    private SourceConfig withOverride(long id, int requestsPerMinute) {
        return new SourceConfig(
            id, "src-" + id, "Source " + id, "https://upsc.gov.in", null, PaginationConfig.none(), false, false, null, 24,
            requestsPerMinute, null, null, false, List.of(), true, null, true, SourceStatus.ACTIVE, null
        );
    }
}
