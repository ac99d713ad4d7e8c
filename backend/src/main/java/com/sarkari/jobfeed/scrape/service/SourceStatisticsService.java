package com.sarkari.jobfeed.scrape.service;

import com.sarkari.jobfeed.scrape.model.ScrapeRunStatus;
import com.sarkari.jobfeed.scrape.model.ScrapeRunSummary;
import com.sarkari.jobfeed.scrape.model.SourceRow;
import com.sarkari.jobfeed.scrape.model.SourceStatisticsRow;
import com.sarkari.jobfeed.scrape.persistence.ScrapeJdbcRepository;
import com.sarkari.jobfeed.scrape.persistence.SourceJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolls finished scrape runs up into one statistics row per source and UTC day.
 */
@Service
public class SourceStatisticsService {
    private static final Logger log = LoggerFactory.getLogger(SourceStatisticsService.class);

    private final SourceJdbcRepository sourceRepository;
    private final ScrapeJdbcRepository scrapeRepository;

    public SourceStatisticsService(SourceJdbcRepository sourceRepository, ScrapeJdbcRepository scrapeRepository) {
        this.sourceRepository = sourceRepository;
        this.scrapeRepository = scrapeRepository;
    }

    public List<SourceStatisticsRow> refresh(LocalDate day) {
        List<SourceStatisticsRow> rows = new ArrayList<>();
        for (SourceRow source : sourceRepository.findActive()) {
            rows.add(refresh(source.id(), day));
        }
        log.info("Refreshed statistics for {} sources on {}", rows.size(), day);
        return rows;
    }

    public SourceStatisticsRow refresh(long sourceId, LocalDate day) {
        List<ScrapeRunSummary> runs = scrapeRepository.findRunsStartedBetween(
            sourceId,
            day.atStartOfDay(ZoneOffset.UTC).toInstant(),
            day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant()
        );
        SourceStatisticsRow row = aggregate(sourceId, day, runs);
        scrapeRepository.upsertSourceStatistics(row);
        return row;
    }

    static SourceStatisticsRow aggregate(long sourceId, LocalDate day, List<ScrapeRunSummary> runs) {
        int finished = 0;
        int successful = 0;
        int failed = 0;
        int found = 0;
        int created = 0;
        int updated = 0;
        long durationTotal = 0;
        int durationSamples = 0;
        for (ScrapeRunSummary run : runs) {
            if (!run.status().isTerminal()) {
                continue;
            }
            finished++;
            if (run.status() == ScrapeRunStatus.COMPLETED) {
                successful++;
            } else if (run.status() == ScrapeRunStatus.FAILED) {
                failed++;
            }
            found += run.jobsFound();
            created += run.jobsCreated();
            updated += run.jobsUpdated();
            if (run.durationMs() != null) {
                durationTotal += run.durationMs();
                durationSamples++;
            }
        }
        Long averageDuration = durationSamples == 0 ? null : durationTotal / durationSamples;
        return new SourceStatisticsRow(sourceId, day, finished, successful, failed, found, created, updated, averageDuration);
    }
}
