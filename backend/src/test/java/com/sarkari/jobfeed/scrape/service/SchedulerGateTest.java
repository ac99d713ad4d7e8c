package com.sarkari.jobfeed.scrape.service;

import com.sarkari.jobfeed.scrape.SourceFixtures;
import com.sarkari.jobfeed.scrape.model.SourceStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerGateTest {
    private static final Instant NOW = Instant.parse("2024-07-10T12:00:00Z");

    @Test
    void neverScrapedSourceIsDue() {
        assertThat(SchedulerGate.isDue(SourceFixtures.schedulable(true, SourceStatus.ACTIVE, 24, null), NOW)).isTrue();
    }

    @Test
    void dueExactlyWhenWindowElapses() {
        Instant last = NOW.minus(Duration.ofHours(6));

        assertThat(SchedulerGate.isDue(SourceFixtures.schedulable(true, SourceStatus.ACTIVE, 6, last), NOW)).isTrue();
        assertThat(SchedulerGate.isDue(SourceFixtures.schedulable(true, SourceStatus.ACTIVE, 7, last), NOW)).isFalse();
    }

    @Test
    void inactiveOrNonActiveStatusIsNeverDue() {
        assertThat(SchedulerGate.isDue(SourceFixtures.schedulable(false, SourceStatus.ACTIVE, 1, null), NOW)).isFalse();
        assertThat(SchedulerGate.isDue(SourceFixtures.schedulable(true, SourceStatus.PAUSED, 1, null), NOW)).isFalse();
        assertThat(SchedulerGate.isDue(SourceFixtures.schedulable(true, SourceStatus.ERROR, 1, null), NOW)).isFalse();
        assertThat(SchedulerGate.isDue(SourceFixtures.schedulable(true, SourceStatus.MAINTENANCE, 1, null), NOW)).isFalse();
    }

    @Test
    void zeroFrequencyIsTreatedAsHourly() {
        Instant last = NOW.minus(Duration.ofMinutes(30));

        assertThat(SchedulerGate.isDue(SourceFixtures.schedulable(true, SourceStatus.ACTIVE, 0, last), NOW)).isFalse();
    }
}
