package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.error.StrategyUnavailableException;
import com.sarkari.jobfeed.scrape.error.SystemicScrapeException;
import com.sarkari.jobfeed.scrape.http.ProxyPool;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class FetchStrategyFactory {
    private static final Logger log = LoggerFactory.getLogger(FetchStrategyFactory.class);

    private final ScraperProperties properties;
    private final UserAgentRotator userAgentRotator;
    private final ProxyPool proxyPool;
    private final WebDriverFactory webDriverFactory;

    public FetchStrategyFactory(
        ScraperProperties properties,
        UserAgentRotator userAgentRotator,
        ProxyPool proxyPool,
        WebDriverFactory webDriverFactory
    ) {
        this.properties = properties;
        this.userAgentRotator = userAgentRotator;
        this.proxyPool = proxyPool;
        this.webDriverFactory = webDriverFactory;
    }

    /**
     * Explicit override first, then browser for JS-rendered sources, then crawl for complex ones, else HTTP.
     */
    public static FetchStrategyType select(SourceConfig source) {
        if (source.scraperType() != null) {
            return source.scraperType();
        }
        if (source.requiresJs()) {
            return FetchStrategyType.BROWSER;
        }
        if (source.complexStructure()) {
            return FetchStrategyType.CRAWL;
        }
        return FetchStrategyType.HTTP;
    }

    public OpenedStrategy open(SourceConfig source) {
        FetchStrategyType requested = select(source);
        FetchStrategy preferred = create(requested, source);
        try {
            preferred.initialize();
            return new OpenedStrategy(preferred, requested, null);
        } catch (StrategyUnavailableException e) {
            closeQuietly(preferred);
            if (requested == FetchStrategyType.HTTP) {
                throw new SystemicScrapeException(ScrapeErrorType.OTHER, "HTTP strategy unavailable: " + e.getMessage(), e);
            }
            String warning = requested + " strategy unavailable (" + e.getMessage() + "), falling back to HTTP";
            log.warn("Source {}: {}", source.id(), warning, e.getCause());
            FetchStrategy fallback = create(FetchStrategyType.HTTP, source);
            try {
                fallback.initialize();
            } catch (StrategyUnavailableException fallbackError) {
                closeQuietly(fallback);
                throw new SystemicScrapeException(
                    ScrapeErrorType.OTHER,
                    "No fetch strategy could be initialized for source " + source.id(),
                    fallbackError
                );
            }
            return new OpenedStrategy(fallback, requested, warning);
        }
    }

    FetchStrategy create(FetchStrategyType type, SourceConfig source) {
        return switch (type) {
            case BROWSER -> new BrowserFetchStrategy(properties, userAgentRotator, proxyPool, webDriverFactory, source);
            case CRAWL -> new CrawlFetchStrategy(properties, userAgentRotator, proxyPool);
            case HTTP -> new HttpFetchStrategy(properties, userAgentRotator, proxyPool);
        };
    }

    private void closeQuietly(FetchStrategy strategy) {
        try {
            strategy.close();
        } catch (RuntimeException e) {
            log.debug("Ignoring close failure for {} strategy", strategy.type(), e);
        }
    }
}
