package com.sarkari.jobfeed.scrape.http;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.model.FetchFailure;
import com.sarkari.jobfeed.scrape.model.FetchResult;
import com.sarkari.jobfeed.scrape.model.SourceConfig;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Bounded retry loop with exponential backoff. Each attempt takes one rate-limit slot before it is sent.
 */
public class RetryPolicy {
    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterRatio, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(0, maxDelayMs);
        this.jitterRatio = Math.max(0.0, jitterRatio);
        this.sleeper = sleeper;
    }

    public static RetryPolicy forSource(SourceConfig source, ScraperProperties properties) {
        ScraperProperties.Retry retry = properties.getRetry();
        int attempts = source.maxRetries() != null && source.maxRetries() > 0
            ? source.maxRetries()
            : retry.getMaxAttempts();
        return new RetryPolicy(attempts, retry.getBaseDelayMs(), retry.getMaxDelayMs(), 0.1, Sleeper.THREAD);
    }

    public FetchResult execute(String url, TokenBucketRateLimiter limiter, Function<String, FetchResult> attempt) {
        FetchResult last = null;
        for (int attemptNo = 1; attemptNo <= maxAttempts; attemptNo++) {
            try {
                limiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failed(url, Instant.now(), FetchFailure.INTERRUPTED, 0, "Interrupted waiting for rate limit")
                    .withAttempts(attemptNo - 1);
            }
            last = attempt.apply(url).withAttempts(attemptNo);
            if (last.isSuccessful() || !shouldRetry(last) || attemptNo >= maxAttempts) {
                return last;
            }
            if (!sleepBackoff(attemptNo)) {
                return last;
            }
        }
        return last;
    }

    public boolean shouldRetry(FetchResult result) {
        if (result == null || result.isSuccessful()) {
            return false;
        }
        FetchFailure failure = result.failure();
        if (failure == null || failure == FetchFailure.HTTP_STATUS) {
            return RETRYABLE_STATUSES.contains(result.statusCode());
        }
        return failure.isTransient();
    }

    long backoffMillis(int attempt) {
        long delay = baseDelayMs * (1L << Math.min(30, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return delay;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private boolean sleepBackoff(int attempt) {
        long delay = backoffMillis(attempt);
        if (delay <= 0) {
            return true;
        }
        long jitterBound = (long) (delay * jitterRatio);
        long jitter = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(jitterBound + 1) : 0L;
        try {
            sleeper.sleep(delay + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
