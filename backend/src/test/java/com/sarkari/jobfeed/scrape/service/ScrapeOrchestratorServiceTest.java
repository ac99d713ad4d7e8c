package com.sarkari.jobfeed.scrape.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.extract.FieldExtractor;
import com.sarkari.jobfeed.scrape.fetch.FetchStrategyFactory;
import com.sarkari.jobfeed.scrape.fetch.UserAgentRotator;
import com.sarkari.jobfeed.scrape.fetch.WebDriverFactory;
import com.sarkari.jobfeed.scrape.http.ProxyPool;
import com.sarkari.jobfeed.scrape.http.RateLimiterRegistry;
import com.sarkari.jobfeed.scrape.ingest.InMemoryJobStore;
import com.sarkari.jobfeed.scrape.ingest.IngestionReconciler;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorRecord;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;
import com.sarkari.jobfeed.scrape.model.ScrapeRunStatus;
import com.sarkari.jobfeed.scrape.model.ScrapeRunSummary;
import com.sarkari.jobfeed.scrape.model.SourceRow;
import com.sarkari.jobfeed.scrape.model.SourceStatus;
import com.sarkari.jobfeed.scrape.model.SourceTestResult;
import com.sarkari.jobfeed.scrape.normalize.JobDataNormalizer;
import com.sarkari.jobfeed.scrape.persistence.ScrapeJdbcRepository;
import com.sarkari.jobfeed.scrape.persistence.SourceConfigParser;
import com.sarkari.jobfeed.scrape.persistence.SourceJdbcRepository;
import com.sarkari.jobfeed.scrape.quality.QualityScorer;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScrapeOrchestratorServiceTest {
    private static final long SOURCE_ID = 21L;

    private MockWebServer server;
    private ExecutorService scrapeExecutor;
    private ExecutorService extractionExecutor;
    private SourceJdbcRepository sourceRepository;
    private ScrapeJdbcRepository scrapeRepository;
    private InMemoryJobStore jobStore;
    private ScrapeOrchestratorService service;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        scrapeExecutor = Executors.newFixedThreadPool(1);
        extractionExecutor = Executors.newFixedThreadPool(2);

        ScraperProperties properties = new ScraperProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.getRateLimit().setHttpRequestsPerMinute(6000);
        properties.getRateLimit().setBurst(50);
        properties.getRetry().setMaxAttempts(2);
        properties.getRetry().setBaseDelayMs(1);
        properties.getRetry().setMaxDelayMs(5);
        properties.getBrowser().setEnabled(false);
        properties.getCrawl().setAutothrottleStartDelayMs(0);
        properties.getCrawl().setAutothrottleMaxDelayMs(50);
        properties.getCrawl().setPrefetchPages(4);

        sourceRepository = Mockito.mock(SourceJdbcRepository.class);
        scrapeRepository = Mockito.mock(ScrapeJdbcRepository.class);
        when(scrapeRepository.insertScrapeRun(anyLong(), any(Instant.class))).thenReturn(101L, 102L, 103L);
        jobStore = new InMemoryJobStore();
        ObjectMapper objectMapper = new ObjectMapper();

        FetchStrategyFactory strategyFactory = new FetchStrategyFactory(
            properties,
            new UserAgentRotator(properties),
            new ProxyPool(properties, scrapeRepository),
            Mockito.mock(WebDriverFactory.class)
        );
        service = new ScrapeOrchestratorService(
            sourceRepository,
            new SourceConfigParser(objectMapper, properties),
            scrapeRepository,
            strategyFactory,
            new RateLimiterRegistry(properties),
            new FieldExtractor(),
            new JobDataNormalizer(),
            new QualityScorer(),
            new IngestionReconciler(jobStore),
            scrapeExecutor,
            extractionExecutor,
            properties,
            objectMapper,
            Clock.systemUTC()
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        scrapeExecutor.shutdownNow();
        extractionExecutor.shutdownNow();
    }

    @Test
    void urlPatternPagesAreIngestedAndRerunIsSkipped() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                if (path.startsWith("/jobs?page=")) {
                    return html(listing(path.substring("/jobs?page=".length()), 5, null));
                }
                return new MockResponse().setResponseCode(404);
            }
        });
        String pattern = server.url("/jobs").toString() + "?page={page}";
        stubSource(server.url("/jobs").toString(), """
            {"selectors": {"job_container": ".job"}, "pagination": {"url_pattern": "%s", "max_pages": 2}}
            """.formatted(pattern));

        ScrapeRunSummary first = service.scrapeSource(SOURCE_ID);

        assertThat(first.status()).isEqualTo(ScrapeRunStatus.COMPLETED);
        assertThat(first.strategy()).isEqualTo(FetchStrategyType.HTTP);
        assertThat(first.pagesScraped()).isEqualTo(2);
        assertThat(first.jobsFound()).isEqualTo(10);
        assertThat(first.jobsCreated()).isEqualTo(10);
        assertThat(first.errorCount()).isZero();
        assertThat(jobStore.all()).hasSize(10);
        verify(sourceRepository).markScrapeCompleted(eq(SOURCE_ID), any(Instant.class), eq(10));

        ScrapeRunSummary second = service.scrapeSource(SOURCE_ID);

        assertThat(second.scrapeRunId()).isEqualTo(102L);
        assertThat(second.jobsCreated()).isZero();
        assertThat(second.jobsSkipped()).isEqualTo(10);
        assertThat(jobStore.all()).hasSize(10);
        verify(scrapeRepository, atLeastOnce()).insertRawRecordIfAbsent(
            eq(SOURCE_ID), eq(101L), anyString(), anyString(), anyString(), anyString(), anyInt(), eq("CREATED"), any(), any()
        );
    }

    @Test
    void stopsAfterConsecutiveEmptyPages() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                int page = Integer.parseInt(path.substring("/p".length()));
                int count = page == 1 ? 3 : 0;
                return html(listing(String.valueOf(page), count, "/p" + (page + 1)));
            }
        });
        stubSource(server.url("/p1").toString(), """
            {"selectors": {"job_container": ".job"}, "pagination": {"next_page": ".pager", "max_pages": 10}}
            """);

        ScrapeRunSummary summary = service.scrapeSource(SOURCE_ID);

        assertThat(server.getRequestCount()).isEqualTo(4);
        assertThat(summary.status()).isEqualTo(ScrapeRunStatus.COMPLETED);
        assertThat(summary.pagesScraped()).isEqualTo(4);
        assertThat(summary.jobsCreated()).isEqualTo(3);
        assertThat(summary.notes()).contains("3 consecutive pages without valid records");
    }

    @Test
    void firstPageFailureFailsTheRun() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setResponseCode(404).setBody("not here");
            }
        });
        stubSource(server.url("/missing").toString(), "{\"selectors\": {\"job_container\": \".job\"}}");

        ScrapeRunSummary summary = service.scrapeSource(SOURCE_ID);

        assertThat(summary.status()).isEqualTo(ScrapeRunStatus.FAILED);
        assertThat(summary.notes()).startsWith("First page fetch failed");
        assertThat(summary.errorCount()).isEqualTo(1);
        verify(sourceRepository).markScrapeError(eq(SOURCE_ID), any(Instant.class), contains("HTTP 404"));
        verify(sourceRepository, never()).markScrapeCompleted(anyLong(), any(), anyInt());
        ArgumentCaptor<ScrapeErrorRecord> error = ArgumentCaptor.forClass(ScrapeErrorRecord.class);
        verify(scrapeRepository).insertScrapeError(error.capture());
        assertThat(error.getValue().errorType()).isEqualTo(ScrapeErrorType.NETWORK);
        assertThat(error.getValue().retryCount()).isZero();
    }

    @Test
    void invalidRecordsAreLoggedButDoNotFailTheRun() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return html("""
                    <html><body>
                      <div class="job"><a href="/n/1">Assistant Section Officer Examination 2024</a></div>
                      <div class="job"><a href="/n/2">Clerk</a></div>
                    </body></html>
                    """);
            }
        });
        stubSource(server.url("/list").toString(), "{\"selectors\": {\"job_container\": \".job\"}}");

        ScrapeRunSummary summary = service.scrapeSource(SOURCE_ID);

        assertThat(summary.status()).isEqualTo(ScrapeRunStatus.COMPLETED);
        assertThat(summary.jobsFound()).isEqualTo(2);
        assertThat(summary.jobsCreated()).isEqualTo(1);
        assertThat(summary.jobsSkipped()).isEqualTo(1);
        assertThat(summary.errorCount()).isEqualTo(1);
        verify(scrapeRepository).insertRawRecordIfAbsent(
            eq(SOURCE_ID), eq(101L), anyString(), anyString(), anyString(), anyString(), isNull(), eq("INVALID"),
            contains("Title too short"), any()
        );
    }

    @Test
    void pagesWhoseRecordsAllFailValidationCountAsEmpty() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return html("<html><body><div class=\"job\"><a href=\"/n/1\">Clerk</a></div></body></html>");
            }
        });
        String pattern = server.url("/jobs").toString() + "?page={page}";
        stubSource(server.url("/jobs").toString(), """
            {"selectors": {"job_container": ".job"}, "pagination": {"url_pattern": "%s", "max_pages": 10}}
            """.formatted(pattern));

        ScrapeRunSummary summary = service.scrapeSource(SOURCE_ID);

        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(summary.status()).isEqualTo(ScrapeRunStatus.COMPLETED);
        assertThat(summary.pagesScraped()).isEqualTo(3);
        assertThat(summary.jobsFound()).isEqualTo(3);
        assertThat(summary.jobsCreated()).isZero();
        assertThat(summary.jobsSkipped()).isEqualTo(3);
        assertThat(summary.notes()).contains("3 consecutive pages without valid records");
    }

    @Test
    void noticesWithoutTheirOwnLinkStayDistinctAcrossRuns() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return html("""
                    <html><body>
                      <div class="job"><h3>Junior Engineer Recruitment 2024</h3><span class="last-date">18/08/2024</span></div>
                      <div class="job"><h3>Junior Engineer Recruitment 2024</h3><span class="last-date">02/09/2024</span></div>
                    </body></html>
                    """);
            }
        });
        stubSource(server.url("/list").toString(), "{\"selectors\": {\"job_container\": \".job\"}}");

        ScrapeRunSummary first = service.scrapeSource(SOURCE_ID);
        ScrapeRunSummary second = service.scrapeSource(SOURCE_ID);

        assertThat(first.jobsCreated()).isEqualTo(2);
        assertThat(first.jobsUpdated()).isZero();
        assertThat(second.jobsCreated()).isZero();
        assertThat(second.jobsUpdated()).isZero();
        assertThat(second.jobsSkipped()).isEqualTo(2);
        assertThat(jobStore.all()).hasSize(2);
    }

    @Test
    void cancellationStopsBeforeTheNextPage() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getPath().substring("/jobs?page=".length());
                if (page.equals("2")) {
                    service.cancel(101L);
                }
                return html(listing(page, 2, null));
            }
        });
        String pattern = server.url("/jobs").toString() + "?page={page}";
        stubSource(server.url("/jobs").toString(), """
            {"selectors": {"job_container": ".job"}, "pagination": {"url_pattern": "%s", "max_pages": 5}}
            """.formatted(pattern));

        ScrapeRunSummary summary = service.scrapeSource(SOURCE_ID);

        assertThat(summary.status()).isEqualTo(ScrapeRunStatus.CANCELLED);
        assertThat(server.getRequestCount()).isEqualTo(2);
        assertThat(summary.pagesScraped()).isEqualTo(2);
        assertThat(summary.jobsCreated()).isEqualTo(4);
        assertThat(summary.notes()).contains("Cancelled before page 3");
        assertThat(service.cancel(101L)).isFalse();
    }

    @Test
    void laterPageFailureIsRecordedAndTheRunCompletes() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getPath().substring("/jobs?page=".length());
                if (page.equals("2")) {
                    return new MockResponse().setResponseCode(500).setBody("maintenance");
                }
                return html(listing(page, 2, null));
            }
        });
        String pattern = server.url("/jobs").toString() + "?page={page}";
        stubSource(server.url("/jobs").toString(), """
            {"selectors": {"job_container": ".job"}, "pagination": {"url_pattern": "%s", "max_pages": 3}}
            """.formatted(pattern));

        ScrapeRunSummary summary = service.scrapeSource(SOURCE_ID);

        assertThat(summary.status()).isEqualTo(ScrapeRunStatus.COMPLETED);
        assertThat(server.getRequestCount()).isEqualTo(4);
        assertThat(summary.pagesScraped()).isEqualTo(2);
        assertThat(summary.jobsCreated()).isEqualTo(4);
        assertThat(summary.errorCount()).isEqualTo(1);
        ArgumentCaptor<ScrapeErrorRecord> error = ArgumentCaptor.forClass(ScrapeErrorRecord.class);
        verify(scrapeRepository).insertScrapeError(error.capture());
        assertThat(error.getValue().url()).endsWith("page=2");
        assertThat(error.getValue().message()).contains("HTTP 500");
        assertThat(error.getValue().retryCount()).isEqualTo(1);
        verify(sourceRepository).markScrapeCompleted(eq(SOURCE_ID), any(Instant.class), eq(4));
    }

    @Test
    void crawlRunDoesNotFetchAheadWhenTheFirstPageFails() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setResponseCode(404);
            }
        });
        String pattern = server.url("/jobs").toString() + "?page={page}";
        stubSource(server.url("/jobs").toString(), """
            {"scraper_type": "crawl", "selectors": {"job_container": ".job"},
             "pagination": {"url_pattern": "%s", "max_pages": 5}}
            """.formatted(pattern));

        ScrapeRunSummary summary = service.scrapeSource(SOURCE_ID);

        assertThat(summary.status()).isEqualTo(ScrapeRunStatus.FAILED);
        assertThat(summary.strategy()).isEqualTo(FetchStrategyType.CRAWL);
        assertThat(summary.requestsMade()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void unusedLookAheadRequestsAreCounted() throws Exception {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getPath().substring("/jobs?page=".length());
                return html(listing(page, page.equals("1") ? 2 : 0, null));
            }
        });
        String pattern = server.url("/jobs").toString() + "?page={page}";
        stubSource(server.url("/jobs").toString(), """
            {"scraper_type": "crawl", "selectors": {"job_container": ".job"},
             "pagination": {"url_pattern": "%s", "max_pages": 5}}
            """.formatted(pattern));

        ScrapeRunSummary summary = service.scrapeSource(SOURCE_ID);

        assertThat(summary.status()).isEqualTo(ScrapeRunStatus.COMPLETED);
        assertThat(summary.pagesScraped()).isEqualTo(4);
        assertThat(summary.requestsMade()).isBetween(4, 5);
        for (int i = 0; i < summary.requestsMade(); i++) {
            assertThat(server.takeRequest(2, TimeUnit.SECONDS)).isNotNull();
        }
        assertThat(server.takeRequest(200, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void configurationTestPersistsNothing() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return html(listing("1", 5, null));
            }
        });
        stubSource(server.url("/jobs").toString(), "{\"selectors\": {\"job_container\": \".job\"}}");

        SourceTestResult result = service.testSourceConfiguration(SOURCE_ID);

        assertThat(result.fetchSucceeded()).isTrue();
        assertThat(result.containersFound()).isEqualTo(5);
        assertThat(result.validRecords()).isEqualTo(5);
        assertThat(result.samples()).hasSize(3);
        assertThat(jobStore.all()).isEmpty();
        verify(scrapeRepository, never()).insertScrapeRun(anyLong(), any());
    }

    private void stubSource(String baseUrl, String configJson) {
        when(sourceRepository.findById(SOURCE_ID)).thenReturn(Optional.of(new SourceRow(
            SOURCE_ID, "ssc", "Staff Selection Commission", baseUrl, true, SourceStatus.ACTIVE, 24, configJson, null, null, 0L
        )));
    }

    private static MockResponse html(String body) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody(body);
    }

    private static String listing(String page, int count, String nextHref) {
        StringBuilder html = new StringBuilder("<html><body>");
        for (int i = 1; i <= count; i++) {
            html.append("<div class=\"job\"><a href=\"/notice/")
                .append(page).append('-').append(i)
                .append("\">Junior Engineer Recruitment Notice ")
                .append(page).append('-').append(i)
                .append("</a><span class=\"last-date\">18/08/2024</span></div>");
        }
        if (nextHref != null) {
            html.append("<div class=\"pager\"><a href=\"").append(nextHref).append("\">Next</a></div>");
        }
        return html.append("</body></html>").toString();
    }
}
