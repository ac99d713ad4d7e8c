package com.sarkari.jobfeed.scrape.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one scrape run. Only {@code RUNNING} may move to a terminal status, and the
 * completion timestamp and duration are fixed by that single transition.
 */
public class ScrapeRun {
    private final long id;
    private final long sourceId;
    private final Instant startedAt;
    private final List<String> notes = new ArrayList<>();
    private ScrapeRunStatus status = ScrapeRunStatus.RUNNING;
    private FetchStrategyType strategy;
    private Instant completedAt;
    private Duration duration;
    private int pagesScraped;
    private int requestsMade;
    private long responseMillisTotal;
    private int responseSamples;
    private int jobsFound;
    private int jobsCreated;
    private int jobsUpdated;
    private int jobsSkipped;
    private int errorCount;

    private ScrapeRun(long id, long sourceId, Instant startedAt) {
        this.id = id;
        this.sourceId = sourceId;
        this.startedAt = startedAt;
    }

    public static ScrapeRun start(long id, long sourceId, Instant startedAt) {
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt is required");
        }
        return new ScrapeRun(id, sourceId, startedAt);
    }

    public synchronized void complete(Instant at) {
        transition(ScrapeRunStatus.COMPLETED, at);
    }

    public synchronized void fail(Instant at, String reason) {
        transition(ScrapeRunStatus.FAILED, at);
        if (reason != null && !reason.isBlank()) {
            notes.add(reason);
        }
    }

    public synchronized void cancel(Instant at) {
        transition(ScrapeRunStatus.CANCELLED, at);
    }

    private void transition(ScrapeRunStatus target, Instant at) {
        if (status != ScrapeRunStatus.RUNNING) {
            throw new IllegalStateException("Scrape run " + id + " is already " + status + ", cannot move to " + target);
        }
        Instant finishedAt = at == null ? Instant.now() : at;
        if (finishedAt.isBefore(startedAt)) {
            finishedAt = startedAt;
        }
        this.status = target;
        this.completedAt = finishedAt;
        this.duration = Duration.between(startedAt, finishedAt);
    }

    public synchronized void useStrategy(FetchStrategyType type) {
        this.strategy = type;
    }

    public synchronized void recordFetch(FetchResult result) {
        if (result == null) {
            return;
        }
        requestsMade += Math.max(0, result.attempts());
        if (result.duration() != null) {
            responseMillisTotal += result.duration().toMillis();
            responseSamples++;
        }
    }

    /**
     * Counts requests spent on look-ahead pages the run never used.
     */
    public synchronized void recordDiscardedRequests(int count) {
        requestsMade += Math.max(0, count);
    }

    public synchronized void recordPageScraped() {
        pagesScraped++;
    }

    public synchronized void addJobsFound(int count) {
        jobsFound += Math.max(0, count);
    }

    public synchronized void recordOutcome(ReconcileOutcome outcome) {
        switch (outcome) {
            case CREATED -> jobsCreated++;
            case UPDATED -> jobsUpdated++;
            case SKIPPED -> jobsSkipped++;
        }
    }

    public synchronized void recordError() {
        errorCount++;
    }

    public synchronized void addNote(String note) {
        if (note != null && !note.isBlank()) {
            notes.add(note);
        }
    }

    public long id() {
        return id;
    }

    public long sourceId() {
        return sourceId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized ScrapeRunStatus status() {
        return status;
    }

    public synchronized FetchStrategyType strategy() {
        return strategy;
    }

    public synchronized Instant completedAt() {
        return completedAt;
    }

    public synchronized Duration duration() {
        return duration;
    }

    public synchronized int pagesScraped() {
        return pagesScraped;
    }

    public synchronized int requestsMade() {
        return requestsMade;
    }

    public synchronized Long averageResponseMs() {
        return responseSamples == 0 ? null : responseMillisTotal / responseSamples;
    }

    public synchronized int jobsFound() {
        return jobsFound;
    }

    public synchronized int jobsCreated() {
        return jobsCreated;
    }

    public synchronized int jobsUpdated() {
        return jobsUpdated;
    }

    public synchronized int jobsSkipped() {
        return jobsSkipped;
    }

    public synchronized int errorCount() {
        return errorCount;
    }

    public synchronized String notes() {
        return notes.isEmpty() ? null : String.join("; ", notes);
    }

    public synchronized ScrapeRunSummary toSummary() {
        return new ScrapeRunSummary(
            id,
            sourceId,
            status,
            strategy,
            startedAt,
            completedAt,
            duration == null ? null : duration.toMillis(),
            pagesScraped,
            requestsMade,
            averageResponseMs(),
            jobsFound,
            jobsCreated,
            jobsUpdated,
            jobsSkipped,
            errorCount,
            notes()
        );
    }
}
