package com.sarkari.jobfeed.scrape.service;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.model.ScrapeRunSummary;
import com.sarkari.jobfeed.scrape.persistence.ScrapeJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs left RUNNING by a process that died can never finish; close them out as FAILED on startup.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ScrapeRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunLifecycleRunner.class);

    private final ScrapeJdbcRepository repository;
    private final ScraperProperties properties;
    private final Clock clock;

    public ScrapeRunLifecycleRunner(ScrapeJdbcRepository repository, ScraperProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        failStaleRuns();
    }

    public int failStaleRuns() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (DataAccessException e) {
            log.debug("Database reachability check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping scrape run cleanup because database is unreachable");
            return 0;
        }

        Instant now = Instant.now(clock);
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        List<ScrapeRunSummary> running = repository.findRunningRuns();
        int failed = 0;
        for (ScrapeRunSummary run : running) {
            if (run.startedAt().isAfter(cutoff)) {
                continue;
            }
            if (repository.failStaleRun(run, now, "abandoned_on_startup")) {
                failed++;
                log.info("Failed stale scrape run {} of source {} startedAt={}", run.scrapeRunId(), run.sourceId(), run.startedAt());
            }
        }
        return failed;
    }
}
