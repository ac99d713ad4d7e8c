package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.error.StrategyUnavailableException;
import com.sarkari.jobfeed.scrape.http.ProxyPool;
import com.sarkari.jobfeed.scrape.model.FetchFailure;
import com.sarkari.jobfeed.scrape.model.FetchResult;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.ProxyEndpoint;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Renders pages in a real browser. The session, its user agent and its proxy are fixed for the run.
 */
public class BrowserFetchStrategy extends AbstractFetchStrategy {
    private static final Logger log = LoggerFactory.getLogger(BrowserFetchStrategy.class);

    private final ScraperProperties properties;
    private final WebDriverFactory webDriverFactory;
    private final SourceConfig source;
    private WebDriver driver;
    private ProxyEndpoint launchProxy;

    public BrowserFetchStrategy(
        ScraperProperties properties,
        UserAgentRotator userAgentRotator,
        ProxyPool proxyPool,
        WebDriverFactory webDriverFactory,
        SourceConfig source
    ) {
        super(userAgentRotator, proxyPool);
        this.properties = properties;
        this.webDriverFactory = webDriverFactory;
        this.source = source;
    }

    @Override
    public FetchStrategyType type() {
        return FetchStrategyType.BROWSER;
    }

    @Override
    public void initialize() {
        ScraperProperties.Browser browser = properties.getBrowser();
        if (!browser.isEnabled()) {
            throw new StrategyUnavailableException(FetchStrategyType.BROWSER, "Browser fetching is disabled", null);
        }
        launchProxy = source.useProxy() ? proxyPool.select().orElse(null) : null;
        BrowserLaunchOptions options = new BrowserLaunchOptions(
            userAgentRotator.next(source),
            launchProxy,
            source.blockResources(),
            browser.isHeadless(),
            browser.getWindowWidth(),
            browser.getWindowHeight(),
            Duration.ofSeconds(browser.getPageLoadTimeoutSeconds()),
            browser.getRemoteUrl()
        );
        try {
            driver = webDriverFactory.newInstance(options);
        } catch (WebDriverException | IllegalStateException | LinkageError e) {
            throw new StrategyUnavailableException(FetchStrategyType.BROWSER, "Browser session could not be started", e);
        }
    }

    @Override
    protected ProxyEndpoint proxyFor(FetchContext context) {
        return launchProxy;
    }

    @Override
    protected FetchResult fetchOnce(String url, FetchContext context, String userAgent, ProxyEndpoint proxy) {
        Instant startedAt = Instant.now();
        if (driver == null) {
            throw new IllegalStateException("Browser strategy used before initialize()");
        }
        try {
            driver.get(url);
        } catch (TimeoutException e) {
            return FetchResult.failed(url, startedAt, FetchFailure.TIMEOUT, 0, "Page load timed out");
        } catch (JavascriptException e) {
            return FetchResult.failed(url, startedAt, FetchFailure.RENDER, 0, e.getRawMessage());
        } catch (WebDriverException e) {
            return FetchResult.failed(url, startedAt, classify(e), 0, e.getRawMessage());
        }

        String waitSelector = waitSelector(context.source());
        if (waitSelector != null) {
            try {
                new WebDriverWait(driver, Duration.ofSeconds(properties.getBrowser().getWaitTimeoutSeconds()))
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(waitSelector)));
            } catch (TimeoutException e) {
                return FetchResult.failed(url, startedAt, FetchFailure.RENDER, 0, "Timed out waiting for " + waitSelector);
            } catch (WebDriverException e) {
                return FetchResult.failed(url, startedAt, FetchFailure.RENDER, 0, e.getRawMessage());
            }
        }

        try {
            String markup = driver.getPageSource();
            return new FetchResult(
                url,
                driver.getCurrentUrl(),
                200,
                markup,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                1,
                null,
                null
            );
        } catch (WebDriverException e) {
            return FetchResult.failed(url, startedAt, FetchFailure.RENDER, 0, e.getRawMessage());
        }
    }

    @Override
    public void close() {
        if (driver == null) {
            return;
        }
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to close browser session for source {}", source.id(), e);
        } finally {
            driver = null;
        }
    }

    private String waitSelector(SourceConfig config) {
        if (config.waitForSelector() != null && !config.waitForSelector().isBlank()) {
            return config.waitForSelector();
        }
        return config.selectors().containerChain().isEmpty() ? null : config.selectors().containerChain().get(0);
    }

    private FetchFailure classify(WebDriverException e) {
        String message = e.getRawMessage() == null ? "" : e.getRawMessage();
        if (message.contains("net::ERR_") || message.contains("unreachable")) {
            return FetchFailure.NETWORK;
        }
        return FetchFailure.RENDER;
    }
}
