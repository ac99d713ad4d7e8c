package com.sarkari.jobfeed.scrape.service;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.model.ScrapeRunSummary;
import com.sarkari.jobfeed.scrape.model.SourceCatalogImportSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final SourceCatalogImporter catalogImporter;
    private final ScrapeDispatchService dispatchService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        SourceCatalogImporter catalogImporter,
        ScrapeDispatchService dispatchService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.catalogImporter = catalogImporter;
        this.dispatchService = dispatchService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ScraperProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        if (cli.getCatalogCsv() != null && !cli.getCatalogCsv().isBlank()) {
            SourceCatalogImportSummary imported = catalogImporter.importCatalog(cli.getCatalogCsv());
            for (String error : imported.errors()) {
                log.warn("Catalog import: {}", error);
            }
        }

        List<Long> sourceIds = parseSourceIds(cli.getSourceIds());
        if (sourceIds.isEmpty()) {
            sourceIds = dispatchService.findDueSourceIds();
            log.info("Scraping {} due sources", sourceIds.size());
        }
        for (ScrapeRunSummary summary : dispatchService.scrapeNow(sourceIds)) {
            log.info(
                "Source {}: run={} status={} pages={} found={} created={} updated={} skipped={} errors={}",
                summary.sourceId(),
                summary.scrapeRunId(),
                summary.status(),
                summary.pagesScraped(),
                summary.jobsFound(),
                summary.jobsCreated(),
                summary.jobsUpdated(),
                summary.jobsSkipped(),
                summary.errorCount()
            );
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    static List<Long> parseSourceIds(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .map(Long::parseLong)
            .toList();
    }
}
