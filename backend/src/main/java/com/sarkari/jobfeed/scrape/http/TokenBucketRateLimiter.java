package com.sarkari.jobfeed.scrape.http;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Requests-per-minute bucket. Every {@link #acquire()} takes exactly one token, blocking until one refills.
 */
public class TokenBucketRateLimiter {
    private static final long NANOS_PER_MINUTE = TimeUnit.MINUTES.toNanos(1);

    private final int requestsPerMinute;
    private final double capacity;
    private final double tokensPerNano;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(int requestsPerMinute, int burst) {
        this(requestsPerMinute, burst, System::nanoTime, Sleeper.THREAD);
    }

    public TokenBucketRateLimiter(int requestsPerMinute, int burst, LongSupplier nanoClock, Sleeper sleeper) {
        this.requestsPerMinute = Math.max(1, requestsPerMinute);
        this.capacity = Math.max(1, burst);
        this.tokensPerNano = (double) this.requestsPerMinute / NANOS_PER_MINUTE;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos;
            synchronized (this) {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return;
                }
                waitNanos = (long) Math.ceil((1.0 - tokens) / tokensPerNano);
            }
            sleeper.sleep(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(waitNanos)));
        }
    }

    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    public int requestsPerMinute() {
        return requestsPerMinute;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
            lastRefillNanos = now;
        }
    }
}
