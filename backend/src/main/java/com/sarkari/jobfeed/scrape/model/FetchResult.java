package com.sarkari.jobfeed.scrape.model;

import java.time.Duration;
import java.time.Instant;

public record FetchResult(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    String body,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    FetchFailure failure,
    String errorMessage
) {
    public static FetchResult failed(String url, Instant startedAt, FetchFailure failure, int statusCode, String message) {
        return new FetchResult(
            url,
            null,
            statusCode,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            1,
            failure,
            message
        );
    }

    public boolean isSuccessful() {
        return failure == null && statusCode >= 200 && statusCode < 300;
    }

    public String finalUrlOrRequested() {
        return finalUrl != null ? finalUrl : requestedUrl;
    }

    public FetchResult withAttempts(int value) {
        return new FetchResult(requestedUrl, finalUrl, statusCode, body, fetchedAt, duration, value, failure, errorMessage);
    }
}
