package com.sarkari.jobfeed.scrape.service;

import com.sarkari.jobfeed.scrape.error.InvalidSourceConfigException;
import com.sarkari.jobfeed.scrape.error.SourceNotFoundException;
import com.sarkari.jobfeed.scrape.model.DispatchSummary;
import com.sarkari.jobfeed.scrape.model.ScrapeRunSummary;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import com.sarkari.jobfeed.scrape.model.SourceRow;
import com.sarkari.jobfeed.scrape.persistence.SourceConfigParser;
import com.sarkari.jobfeed.scrape.persistence.SourceJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Submits every source whose scrape window has elapsed to the scrape worker pool.
 */
@Service
public class ScrapeDispatchService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeDispatchService.class);

    private final SourceJdbcRepository sourceRepository;
    private final SourceConfigParser configParser;
    private final ScrapeOrchestratorService orchestrator;
    private final Clock clock;

    public ScrapeDispatchService(
        SourceJdbcRepository sourceRepository,
        SourceConfigParser configParser,
        ScrapeOrchestratorService orchestrator,
        Clock clock
    ) {
        this.sourceRepository = sourceRepository;
        this.configParser = configParser;
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    public DispatchSummary scrapeAllDue() {
        List<SourceRow> candidates = sourceRepository.findActive();
        List<Long> dispatched = new ArrayList<>();
        List<Long> runIds = new ArrayList<>();
        for (SourceConfig source : dueSources(candidates, Instant.now(clock))) {
            runIds.add(orchestrator.startAsync(source));
            dispatched.add(source.id());
        }
        log.info("Dispatched {} of {} active sources", dispatched.size(), candidates.size());
        return new DispatchSummary(candidates.size(), dispatched, runIds);
    }

    public List<Long> findDueSourceIds() {
        return dueSources(sourceRepository.findActive(), Instant.now(clock)).stream()
            .map(SourceConfig::id)
            .toList();
    }

    private List<SourceConfig> dueSources(List<SourceRow> candidates, Instant now) {
        List<SourceConfig> due = new ArrayList<>();
        for (SourceRow row : candidates) {
            SourceConfig source;
            try {
                source = configParser.parse(row);
            } catch (InvalidSourceConfigException e) {
                log.warn("Source {} has an invalid configuration: {}", row.id(), e.getMessage());
                sourceRepository.markScrapeError(row.id(), now, e.getMessage());
                continue;
            }
            if (SchedulerGate.isDue(source, now)) {
                due.add(source);
            }
        }
        return due;
    }

    /**
     * Scrapes the given sources one after another on the calling thread.
     */
    public List<ScrapeRunSummary> scrapeNow(List<Long> sourceIds) {
        List<ScrapeRunSummary> summaries = new ArrayList<>();
        for (Long sourceId : sourceIds) {
            try {
                summaries.add(orchestrator.scrapeSource(sourceId));
            } catch (SourceNotFoundException | InvalidSourceConfigException e) {
                log.warn("Skipping source {}: {}", sourceId, e.getMessage());
            }
        }
        return summaries;
    }
}
