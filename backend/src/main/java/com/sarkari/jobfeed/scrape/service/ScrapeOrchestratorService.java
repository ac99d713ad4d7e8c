package com.sarkari.jobfeed.scrape.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.error.InvalidSourceConfigException;
import com.sarkari.jobfeed.scrape.error.RecordValidationException;
import com.sarkari.jobfeed.scrape.error.SourceNotFoundException;
import com.sarkari.jobfeed.scrape.error.SystemicScrapeException;
import com.sarkari.jobfeed.scrape.extract.FieldExtractor;
import com.sarkari.jobfeed.scrape.fetch.FetchContext;
import com.sarkari.jobfeed.scrape.fetch.FetchStrategy;
import com.sarkari.jobfeed.scrape.fetch.FetchStrategyFactory;
import com.sarkari.jobfeed.scrape.fetch.OpenedStrategy;
import com.sarkari.jobfeed.scrape.http.RateLimiterRegistry;
import com.sarkari.jobfeed.scrape.http.RetryPolicy;
import com.sarkari.jobfeed.scrape.ingest.IngestionReconciler;
import com.sarkari.jobfeed.scrape.ingest.ReconcileBatch;
import com.sarkari.jobfeed.scrape.model.ExtractedPage;
import com.sarkari.jobfeed.scrape.model.ExtractionIssue;
import com.sarkari.jobfeed.scrape.model.FetchFailure;
import com.sarkari.jobfeed.scrape.model.FetchResult;
import com.sarkari.jobfeed.scrape.model.NormalizedJobRecord;
import com.sarkari.jobfeed.scrape.model.PaginationConfig;
import com.sarkari.jobfeed.scrape.model.RawJobRecord;
import com.sarkari.jobfeed.scrape.model.ReconcileOutcome;
import com.sarkari.jobfeed.scrape.model.ReconcileResult;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorRecord;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;
import com.sarkari.jobfeed.scrape.model.ScrapeRun;
import com.sarkari.jobfeed.scrape.model.ScrapeRunStatus;
import com.sarkari.jobfeed.scrape.model.ScrapeRunSummary;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import com.sarkari.jobfeed.scrape.model.SourceRow;
import com.sarkari.jobfeed.scrape.model.SourceTestResult;
import com.sarkari.jobfeed.scrape.normalize.JobDataNormalizer;
import com.sarkari.jobfeed.scrape.persistence.ScrapeJdbcRepository;
import com.sarkari.jobfeed.scrape.persistence.SourceConfigParser;
import com.sarkari.jobfeed.scrape.persistence.SourceJdbcRepository;
import com.sarkari.jobfeed.scrape.quality.QualityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one source end to end: fetch each page, extract containers, normalize, score and reconcile.
 * Page and record failures land in the run's error trail; only a systemic failure fails the run.
 */
@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    private final SourceJdbcRepository sourceRepository;
    private final SourceConfigParser configParser;
    private final ScrapeJdbcRepository scrapeRepository;
    private final FetchStrategyFactory strategyFactory;
    private final RateLimiterRegistry rateLimiters;
    private final FieldExtractor extractor;
    private final JobDataNormalizer normalizer;
    private final QualityScorer qualityScorer;
    private final IngestionReconciler reconciler;
    private final ExecutorService scrapeExecutor;
    private final ExecutorService extractionExecutor;
    private final ScraperProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<Long, AtomicBoolean> cancellations = new ConcurrentHashMap<>();

    public ScrapeOrchestratorService(
        SourceJdbcRepository sourceRepository,
        SourceConfigParser configParser,
        ScrapeJdbcRepository scrapeRepository,
        FetchStrategyFactory strategyFactory,
        RateLimiterRegistry rateLimiters,
        FieldExtractor extractor,
        JobDataNormalizer normalizer,
        QualityScorer qualityScorer,
        IngestionReconciler reconciler,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor,
        ScraperProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.sourceRepository = sourceRepository;
        this.configParser = configParser;
        this.scrapeRepository = scrapeRepository;
        this.strategyFactory = strategyFactory;
        this.rateLimiters = rateLimiters;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.qualityScorer = qualityScorer;
        this.reconciler = reconciler;
        this.scrapeExecutor = scrapeExecutor;
        this.extractionExecutor = extractionExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ScrapeRunSummary scrapeSource(long sourceId) {
        SourceConfig source = loadSource(sourceId);
        Instant startedAt = Instant.now(clock);
        long runId = scrapeRepository.insertScrapeRun(source.id(), startedAt);
        return runWithId(runId, startedAt, source);
    }

    public long startAsync(long sourceId) {
        return startAsync(loadSource(sourceId));
    }

    public long startAsync(SourceConfig source) {
        Instant startedAt = Instant.now(clock);
        long runId = scrapeRepository.insertScrapeRun(source.id(), startedAt);
        cancellations.put(runId, new AtomicBoolean(false));
        scrapeExecutor.submit(() -> runWithId(runId, startedAt, source));
        return runId;
    }

    /**
     * Requests cooperative cancellation; the run stops before its next page.
     *
     * @return false when the run is not executing in this process
     */
    public boolean cancel(long runId) {
        AtomicBoolean flag = cancellations.get(runId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        log.info("Cancellation requested for scrape run {}", runId);
        return true;
    }

    /**
     * Fetches and extracts the first page of a source without persisting anything.
     */
    public SourceTestResult testSourceConfiguration(long sourceId) {
        SourceRow row = sourceRepository.findById(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
        SourceConfig source = configParser.parse(row);
        OpenedStrategy opened = strategyFactory.open(source);
        FetchStrategy strategy = opened.strategy();
        List<String> issues = new ArrayList<>();
        if (opened.warning() != null) {
            issues.add(opened.warning());
        }
        try {
            String pageUrl = firstPageUrl(source);
            FetchResult result = strategy.fetch(pageUrl, fetchContext(source, strategy));
            if (!result.isSuccessful()) {
                issues.add(describe(result));
                return new SourceTestResult(
                    sourceId, strategy.type(), pageUrl, false, 0, 0, 0, null, List.of(), issues
                );
            }
            ExtractedPage page = extractor.extract(
                result.body(),
                result.finalUrlOrRequested(),
                source.selectors(),
                source.pagination()
            );
            for (ExtractionIssue issue : page.issues()) {
                issues.add(issue.selector() == null ? issue.message() : issue.message() + ": " + issue.selector());
            }
            List<NormalizedJobRecord> samples = new ArrayList<>();
            int valid = 0;
            for (RawJobRecord raw : page.records()) {
                try {
                    NormalizedJobRecord record = normalizer.normalize(raw).withQualityScore(qualityScorer.score(raw));
                    valid++;
                    if (samples.size() < properties.getDryRun().getSampleSize()) {
                        samples.add(record);
                    }
                } catch (RecordValidationException e) {
                    issues.add(e.getMessage());
                }
            }
            return new SourceTestResult(
                sourceId,
                strategy.type(),
                pageUrl,
                true,
                page.containersFound(),
                page.records().size(),
                valid,
                page.nextPageUrl(),
                samples,
                issues
            );
        } finally {
            closeStrategy(strategy);
        }
    }

    private SourceConfig loadSource(long sourceId) {
        SourceRow row = sourceRepository.findById(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
        try {
            return configParser.parse(row);
        } catch (InvalidSourceConfigException e) {
            sourceRepository.markScrapeError(sourceId, Instant.now(clock), e.getMessage());
            throw e;
        }
    }

    private ScrapeRunSummary runWithId(long runId, Instant startedAt, SourceConfig source) {
        ScrapeRun run = ScrapeRun.start(runId, source.id(), startedAt);
        AtomicBoolean cancelled = cancellations.computeIfAbsent(runId, ignored -> new AtomicBoolean(false));
        FetchStrategy strategy = null;
        String failureReason = null;
        log.info("Scrape run {} started for source {} ({})", runId, source.id(), source.label());
        try {
            sourceRepository.markScrapeStarted(source.id(), startedAt);
            OpenedStrategy opened = strategyFactory.open(source);
            strategy = opened.strategy();
            run.useStrategy(strategy.type());
            scrapeRepository.updateRunStrategy(runId, strategy.type());
            if (opened.warning() != null) {
                run.addNote(opened.warning());
            }
            failureReason = scrapePages(run, source, strategy, cancelled);
        } catch (SystemicScrapeException e) {
            failureReason = e.getMessage();
            recordError(run, e.errorType(), e.getMessage(), source.baseUrl(), null, 0);
        } catch (RuntimeException e) {
            log.error("Scrape run {} for source {} failed unexpectedly", runId, source.id(), e);
            failureReason = "Unexpected error: " + e;
            recordError(run, ScrapeErrorType.OTHER, failureReason, source.baseUrl(), null, 0);
        } finally {
            if (strategy != null) {
                run.recordDiscardedRequests(strategy.discardPrefetched());
                closeStrategy(strategy);
            }
            cancellations.remove(runId);
            Instant finishedAt = Instant.now(clock);
            if (failureReason != null) {
                run.fail(finishedAt, failureReason);
            } else if (cancelled.get()) {
                run.cancel(finishedAt);
            } else {
                run.complete(finishedAt);
            }
            closeOut(run, failureReason);
        }
        ScrapeRunSummary summary = run.toSummary();
        log.info(
            "Scrape run {} for source {} finished {}: pages={} found={} created={} updated={} skipped={} errors={}",
            runId,
            source.id(),
            summary.status(),
            summary.pagesScraped(),
            summary.jobsFound(),
            summary.jobsCreated(),
            summary.jobsUpdated(),
            summary.jobsSkipped(),
            summary.errorCount()
        );
        return summary;
    }

    /**
     * @return the reason the run failed, or null when it may complete
     */
    private String scrapePages(ScrapeRun run, SourceConfig source, FetchStrategy strategy, AtomicBoolean cancelled) {
        PaginationConfig pagination = source.pagination();
        int maxPages = Math.max(1, pagination.maxPages());
        int maxEmpty = properties.getPagination().getMaxConsecutiveEmptyPages();
        FetchContext context = fetchContext(source, strategy);
        ReconcileBatch batch = new ReconcileBatch();
        Set<String> visited = new HashSet<>();
        String url = firstPageUrl(source);
        int consecutiveEmpty = 0;
        for (int pageIndex = 0; pageIndex < maxPages && url != null; pageIndex++) {
            if (cancelled.get()) {
                run.addNote("Cancelled before page " + (pageIndex + 1));
                return null;
            }
            visited.add(url);
            FetchResult result = strategy.fetch(url, context);
            run.recordFetch(result);

            int validOnPage = 0;
            String discoveredNext = null;
            if (!result.isSuccessful()) {
                FetchFailure failure = result.failure() == null ? FetchFailure.HTTP_STATUS : result.failure();
                String description = describe(result);
                recordError(run, failure.errorType(), description, url, null, Math.max(0, result.attempts() - 1));
                if (failure == FetchFailure.INTERRUPTED && cancelled.get()) {
                    run.addNote("Cancelled during page " + (pageIndex + 1));
                    return null;
                }
                if (pageIndex == 0) {
                    return "First page fetch failed: " + description;
                }
                if (failure.fatal()) {
                    return "Fetching stopped: " + description;
                }
                log.warn("Skipping page {} of source {}: {}", url, source.id(), description);
            } else {
                run.recordPageScraped();
                if (pageIndex == 0 && pagination.usesUrlPattern()) {
                    prefetchRemaining(strategy, pagination, maxPages, context);
                }
                ExtractedPage page = extractor.extract(
                    result.body(),
                    result.finalUrlOrRequested(),
                    source.selectors(),
                    pagination
                );
                for (ExtractionIssue issue : page.issues()) {
                    recordError(run, issue.errorType(), issue.message(), url, issue.selector(), 0);
                }
                run.addJobsFound(page.records().size());
                validOnPage = ingest(run, source, page.records(), batch);
                discoveredNext = page.nextPageUrl();
            }

            consecutiveEmpty = validOnPage == 0 ? consecutiveEmpty + 1 : 0;
            if (consecutiveEmpty >= maxEmpty) {
                run.addNote("Stopped after " + consecutiveEmpty + " consecutive pages without valid records");
                return null;
            }
            url = nextPageUrl(pagination, pageIndex, discoveredNext, visited);
        }
        return null;
    }

    private void prefetchRemaining(FetchStrategy strategy, PaginationConfig pagination, int maxPages, FetchContext context) {
        List<String> ahead = new ArrayList<>();
        for (int i = 1; i < maxPages; i++) {
            ahead.add(pagination.pageUrl(pagination.startPage() + i));
        }
        strategy.prefetch(ahead, context);
    }

    /**
     * @return how many records passed normalization
     */
    private int ingest(ScrapeRun run, SourceConfig source, List<RawJobRecord> records, ReconcileBatch batch) {
        if (records.isEmpty()) {
            return 0;
        }
        int valid = 0;
        List<CompletableFuture<NormalizationOutcome>> futures = new ArrayList<>(records.size());
        for (RawJobRecord raw : records) {
            futures.add(CompletableFuture.supplyAsync(() -> normalizeOne(raw), extractionExecutor));
        }
        for (CompletableFuture<NormalizationOutcome> future : futures) {
            NormalizationOutcome outcome = future.join();
            RawJobRecord raw = outcome.raw();
            if (outcome.error() != null) {
                recordError(
                    run,
                    ScrapeErrorType.VALIDATION,
                    outcome.error().getMessage(),
                    raw.pageUrl(),
                    outcome.error().field(),
                    0
                );
                run.recordOutcome(ReconcileOutcome.SKIPPED);
                recordRaw(run, source, raw, normalizer.contentHash(raw), null, "INVALID", outcome.error().getMessage());
                continue;
            }
            valid++;
            NormalizedJobRecord record = outcome.record();
            ReconcileResult result = reconciler.reconcile(source.id(), record, raw.hasOwnLink(), batch);
            run.recordOutcome(result.outcome());
            recordRaw(run, source, raw, record.contentHash(), record.qualityScore(), result.outcome().name(), null);
        }
        return valid;
    }

    private NormalizationOutcome normalizeOne(RawJobRecord raw) {
        try {
            NormalizedJobRecord record = normalizer.normalize(raw);
            return new NormalizationOutcome(raw, record.withQualityScore(qualityScorer.score(raw)), null);
        } catch (RecordValidationException e) {
            return new NormalizationOutcome(raw, null, e);
        }
    }

    private void recordRaw(
        ScrapeRun run,
        SourceConfig source,
        RawJobRecord raw,
        String contentHash,
        Integer qualityScore,
        String outcome,
        String validationError
    ) {
        String fieldsJson;
        try {
            fieldsJson = objectMapper.writeValueAsString(raw.fields());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize raw fields for run {}", run.id(), e);
            fieldsJson = "{}";
        }
        scrapeRepository.insertRawRecordIfAbsent(
            source.id(),
            run.id(),
            contentHash,
            raw.pageUrl(),
            raw.sourceUrl(),
            fieldsJson,
            qualityScore,
            outcome,
            validationError,
            Instant.now(clock)
        );
    }

    private String nextPageUrl(PaginationConfig pagination, int pageIndex, String discoveredNext, Set<String> visited) {
        if (pagination.usesUrlPattern()) {
            return pagination.pageUrl(pagination.startPage() + pageIndex + 1);
        }
        if (pagination.usesNextPageSelector() && discoveredNext != null && !visited.contains(discoveredNext)) {
            return discoveredNext;
        }
        return null;
    }

    private String firstPageUrl(SourceConfig source) {
        PaginationConfig pagination = source.pagination();
        return pagination.usesUrlPattern() ? pagination.pageUrl(pagination.startPage()) : source.baseUrl();
    }

    private FetchContext fetchContext(SourceConfig source, FetchStrategy strategy) {
        int timeoutSeconds = source.timeoutSeconds() != null && source.timeoutSeconds() > 0
            ? source.timeoutSeconds()
            : properties.getRequestTimeoutSeconds();
        return new FetchContext(
            source,
            rateLimiters.limiterFor(source, strategy.type()),
            RetryPolicy.forSource(source, properties),
            Duration.ofSeconds(timeoutSeconds)
        );
    }

    private void recordError(
        ScrapeRun run,
        ScrapeErrorType type,
        String message,
        String url,
        String selector,
        int retryCount
    ) {
        run.recordError();
        try {
            scrapeRepository.insertScrapeError(new ScrapeErrorRecord(
                null,
                run.id(),
                type,
                message,
                url,
                selector,
                retryCount,
                false,
                Instant.now(clock)
            ));
        } catch (DataAccessException e) {
            log.warn("Failed to store {} error for scrape run {}: {}", type, run.id(), message, e);
        }
    }

    private void closeOut(ScrapeRun run, String failureReason) {
        try {
            scrapeRepository.completeScrapeRun(run);
            if (run.status() == ScrapeRunStatus.FAILED) {
                sourceRepository.markScrapeError(run.sourceId(), run.completedAt(), failureReason);
            } else {
                sourceRepository.markScrapeCompleted(run.sourceId(), run.completedAt(), run.jobsFound());
            }
        } catch (DataAccessException e) {
            log.error("Failed to close out scrape run {} as {}", run.id(), run.status(), e);
        }
    }

    private void closeStrategy(FetchStrategy strategy) {
        try {
            strategy.close();
        } catch (RuntimeException e) {
            log.warn("Failed to release {} strategy", strategy.type(), e);
        }
    }

    private static String describe(FetchResult result) {
        String kind = result.failure() == null ? "HTTP_STATUS" : result.failure().name();
        StringBuilder text = new StringBuilder(kind);
        if (result.statusCode() > 0) {
            text.append(" (HTTP ").append(result.statusCode()).append(')');
        }
        if (result.errorMessage() != null && !result.errorMessage().isBlank()) {
            text.append(": ").append(result.errorMessage());
        }
        text.append(" after ").append(result.attempts()).append(" attempt(s)");
        return text.toString();
    }

    private record NormalizationOutcome(
        RawJobRecord raw,
        NormalizedJobRecord record,
        RecordValidationException error
    ) {
    }
}
