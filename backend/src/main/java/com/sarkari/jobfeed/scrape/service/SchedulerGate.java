package com.sarkari.jobfeed.scrape.service;

import com.sarkari.jobfeed.scrape.model.SourceConfig;
import com.sarkari.jobfeed.scrape.model.SourceStatus;

import java.time.Duration;
import java.time.Instant;

public final class SchedulerGate {
    private SchedulerGate() {
    }

    /**
     * A source is due when it is active, its registry status is {@code active}, and it has never been
     * scraped or its frequency window has fully elapsed.
     */
    public static boolean isDue(SourceConfig source, Instant now) {
        if (source == null || !source.active() || source.status() != SourceStatus.ACTIVE) {
            return false;
        }
        Instant last = source.lastScrapedAt();
        if (last == null) {
            return true;
        }
        Duration window = Duration.ofHours(Math.max(1, source.frequencyHours()));
        return !now.isBefore(last.plus(window));
    }
}
