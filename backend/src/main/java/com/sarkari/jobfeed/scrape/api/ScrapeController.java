package com.sarkari.jobfeed.scrape.api;

import com.sarkari.jobfeed.scrape.model.DispatchSummary;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorRecord;
import com.sarkari.jobfeed.scrape.model.ScrapeRunSummary;
import com.sarkari.jobfeed.scrape.model.SourceCatalogImportSummary;
import com.sarkari.jobfeed.scrape.model.SourceStatisticsRow;
import com.sarkari.jobfeed.scrape.model.SourceTestResult;
import com.sarkari.jobfeed.scrape.persistence.ScrapeJdbcRepository;
import com.sarkari.jobfeed.scrape.service.ScrapeDispatchService;
import com.sarkari.jobfeed.scrape.service.ScrapeOrchestratorService;
import com.sarkari.jobfeed.scrape.service.SourceCatalogImporter;
import com.sarkari.jobfeed.scrape.service.SourceStatisticsService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class ScrapeController {
    private final ScrapeOrchestratorService orchestrator;
    private final ScrapeDispatchService dispatchService;
    private final ScrapeJdbcRepository scrapeRepository;
    private final SourceCatalogImporter catalogImporter;
    private final SourceStatisticsService statisticsService;
    private final Clock clock;

    public ScrapeController(
        ScrapeOrchestratorService orchestrator,
        ScrapeDispatchService dispatchService,
        ScrapeJdbcRepository scrapeRepository,
        SourceCatalogImporter catalogImporter,
        SourceStatisticsService statisticsService,
        Clock clock
    ) {
        this.orchestrator = orchestrator;
        this.dispatchService = dispatchService;
        this.scrapeRepository = scrapeRepository;
        this.catalogImporter = catalogImporter;
        this.statisticsService = statisticsService;
        this.clock = clock;
    }

    @PostMapping("/sources/{sourceId}/scrape")
    public ScrapeRunSummary scrapeSource(@PathVariable long sourceId) {
        return orchestrator.scrapeSource(sourceId);
    }

    @PostMapping("/sources/{sourceId}/scrape/async")
    public Map<String, Object> startScrape(@PathVariable long sourceId) {
        long runId = orchestrator.startAsync(sourceId);
        return Map.of("scrapeRunId", runId, "sourceId", sourceId, "status", "RUNNING");
    }

    @PostMapping("/sources/{sourceId}/test")
    public SourceTestResult testSource(@PathVariable long sourceId) {
        return orchestrator.testSourceConfiguration(sourceId);
    }

    @PostMapping("/sources/import")
    public SourceCatalogImportSummary importSources(@RequestParam(name = "path") String path) {
        if (path == null || path.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "path is required");
        }
        return catalogImporter.importCatalog(path);
    }

    @PostMapping("/scrape/due")
    public DispatchSummary scrapeDue() {
        return dispatchService.scrapeAllDue();
    }

    @GetMapping("/runs/{runId}")
    public ScrapeRunSummary getRun(@PathVariable long runId) {
        return scrapeRepository.findRunSummary(runId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Scrape run not found: " + runId));
    }

    @GetMapping("/runs/{runId}/errors")
    public List<ScrapeErrorRecord> getRunErrors(@PathVariable long runId) {
        getRun(runId);
        return scrapeRepository.findErrors(runId);
    }

    @PostMapping("/runs/{runId}/cancel")
    public Map<String, Object> cancelRun(@PathVariable long runId) {
        boolean accepted = orchestrator.cancel(runId);
        return Map.of("scrapeRunId", runId, "cancellationRequested", accepted);
    }

    @PostMapping("/statistics/refresh")
    public List<SourceStatisticsRow> refreshStatistics(
        @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return statisticsService.refresh(date == null ? LocalDate.now(clock) : date);
    }
}
