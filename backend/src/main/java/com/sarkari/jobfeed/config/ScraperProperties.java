package com.sarkari.jobfeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    public static final List<String> DEFAULT_USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15"
    );

    private int globalConcurrency = 4;
    private int extractionConcurrency = 4;
    private int requestTimeoutSeconds = 30;
    private int staleRunMinutes = 120;
    private List<String> userAgents = new ArrayList<>(DEFAULT_USER_AGENTS);
    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private Pagination pagination = new Pagination();
    private Browser browser = new Browser();
    private Crawl crawl = new Crawl();
    private Proxy proxy = new Proxy();
    private DryRun dryRun = new DryRun();
    private Cli cli = new Cli();

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getExtractionConcurrency() {
        return Math.max(1, extractionConcurrency);
    }

    public void setExtractionConcurrency(int extractionConcurrency) {
        this.extractionConcurrency = Math.max(1, extractionConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = staleRunMinutes;
    }

    public List<String> getUserAgents() {
        return normalizeUserAgents(userAgents);
    }

    public void setUserAgents(List<String> userAgents) {
        this.userAgents = userAgents;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Crawl getCrawl() {
        return crawl;
    }

    public void setCrawl(Crawl crawl) {
        this.crawl = crawl;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public DryRun getDryRun() {
        return dryRun;
    }

    public void setDryRun(DryRun dryRun) {
        this.dryRun = dryRun;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static List<String> normalizeUserAgents(List<String> candidates) {
        if (candidates == null) {
            return DEFAULT_USER_AGENTS;
        }
        List<String> cleaned = candidates.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(String::trim)
            .toList();
        return cleaned.isEmpty() ? DEFAULT_USER_AGENTS : cleaned;
    }

    public static class RateLimit {
        private int httpRequestsPerMinute = 30;
        private int crawlRequestsPerMinute = 30;
        private int browserRequestsPerMinute = 20;
        private int burst = 1;

        public int getHttpRequestsPerMinute() {
            return Math.max(1, httpRequestsPerMinute);
        }

        public void setHttpRequestsPerMinute(int httpRequestsPerMinute) {
            this.httpRequestsPerMinute = httpRequestsPerMinute;
        }

        public int getCrawlRequestsPerMinute() {
            return Math.max(1, crawlRequestsPerMinute);
        }

        public void setCrawlRequestsPerMinute(int crawlRequestsPerMinute) {
            this.crawlRequestsPerMinute = crawlRequestsPerMinute;
        }

        public int getBrowserRequestsPerMinute() {
            return Math.max(1, browserRequestsPerMinute);
        }

        public void setBrowserRequestsPerMinute(int browserRequestsPerMinute) {
            this.browserRequestsPerMinute = browserRequestsPerMinute;
        }

        public int getBurst() {
            return Math.max(1, burst);
        }

        public void setBurst(int burst) {
            this.burst = burst;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int baseDelayMs = 1000;
        private int maxDelayMs = 30000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Pagination {
        private int defaultMaxPages = 5;
        private int maxConsecutiveEmptyPages = 3;

        public int getDefaultMaxPages() {
            return Math.max(1, defaultMaxPages);
        }

        public void setDefaultMaxPages(int defaultMaxPages) {
            this.defaultMaxPages = defaultMaxPages;
        }

        public int getMaxConsecutiveEmptyPages() {
            return Math.max(1, maxConsecutiveEmptyPages);
        }

        public void setMaxConsecutiveEmptyPages(int maxConsecutiveEmptyPages) {
            this.maxConsecutiveEmptyPages = maxConsecutiveEmptyPages;
        }
    }

    public static class Browser {
        private boolean enabled = true;
        private boolean headless = true;
        private String remoteUrl;
        private int pageLoadTimeoutSeconds = 30;
        private int waitTimeoutSeconds = 10;
        private int windowWidth = 1920;
        private int windowHeight = 1080;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getRemoteUrl() {
            return remoteUrl == null || remoteUrl.isBlank() ? null : remoteUrl.trim();
        }

        public void setRemoteUrl(String remoteUrl) {
            this.remoteUrl = remoteUrl;
        }

        public int getPageLoadTimeoutSeconds() {
            return Math.max(1, pageLoadTimeoutSeconds);
        }

        public void setPageLoadTimeoutSeconds(int pageLoadTimeoutSeconds) {
            this.pageLoadTimeoutSeconds = pageLoadTimeoutSeconds;
        }

        public int getWaitTimeoutSeconds() {
            return Math.max(1, waitTimeoutSeconds);
        }

        public void setWaitTimeoutSeconds(int waitTimeoutSeconds) {
            this.waitTimeoutSeconds = waitTimeoutSeconds;
        }

        public int getWindowWidth() {
            return windowWidth;
        }

        public void setWindowWidth(int windowWidth) {
            this.windowWidth = windowWidth;
        }

        public int getWindowHeight() {
            return windowHeight;
        }

        public void setWindowHeight(int windowHeight) {
            this.windowHeight = windowHeight;
        }
    }

    public static class Crawl {
        private int maxConcurrentRequests = 8;
        private int maxRequestsPerHost = 4;
        private int autothrottleStartDelayMs = 1000;
        private int autothrottleMaxDelayMs = 10000;
        private double targetConcurrency = 2.0;
        private int prefetchPages = 2;

        public int getMaxConcurrentRequests() {
            return Math.max(1, maxConcurrentRequests);
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
        }

        public int getMaxRequestsPerHost() {
            return Math.max(1, maxRequestsPerHost);
        }

        public void setMaxRequestsPerHost(int maxRequestsPerHost) {
            this.maxRequestsPerHost = maxRequestsPerHost;
        }

        public int getAutothrottleStartDelayMs() {
            return Math.max(0, autothrottleStartDelayMs);
        }

        public void setAutothrottleStartDelayMs(int autothrottleStartDelayMs) {
            this.autothrottleStartDelayMs = autothrottleStartDelayMs;
        }

        public int getAutothrottleMaxDelayMs() {
            return Math.max(getAutothrottleStartDelayMs(), autothrottleMaxDelayMs);
        }

        public void setAutothrottleMaxDelayMs(int autothrottleMaxDelayMs) {
            this.autothrottleMaxDelayMs = autothrottleMaxDelayMs;
        }

        public double getTargetConcurrency() {
            return targetConcurrency <= 0 ? 1.0 : targetConcurrency;
        }

        public void setTargetConcurrency(double targetConcurrency) {
            this.targetConcurrency = targetConcurrency;
        }

        public int getPrefetchPages() {
            return Math.max(0, prefetchPages);
        }

        public void setPrefetchPages(int prefetchPages) {
            this.prefetchPages = prefetchPages;
        }
    }

    public static class Proxy {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class DryRun {
        private int sampleSize = 3;

        public int getSampleSize() {
            return Math.max(1, sampleSize);
        }

        public void setSampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String sourceIds = "";
        private boolean exitAfterRun = true;
        private String catalogCsv = "";

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSourceIds() {
            return sourceIds;
        }

        public void setSourceIds(String sourceIds) {
            this.sourceIds = sourceIds;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public String getCatalogCsv() {
            return catalogCsv;
        }

        public void setCatalogCsv(String catalogCsv) {
            this.catalogCsv = catalogCsv;
        }
    }
}
