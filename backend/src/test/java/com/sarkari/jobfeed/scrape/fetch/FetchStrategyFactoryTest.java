package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.SourceFixtures;
import com.sarkari.jobfeed.scrape.http.ProxyPool;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.persistence.ScrapeJdbcRepository;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.openqa.selenium.SessionNotCreatedException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FetchStrategyFactoryTest {
    private final ScraperProperties properties = new ScraperProperties();
    private final WebDriverFactory webDriverFactory = Mockito.mock(WebDriverFactory.class);

    @Test
    void explicitTypeOverridesFlags() {
        assertThat(FetchStrategyFactory.select(SourceFixtures.withFlags(true, true, FetchStrategyType.HTTP)))
            .isEqualTo(FetchStrategyType.HTTP);
        assertThat(FetchStrategyFactory.select(SourceFixtures.withFlags(true, true, null)))
            .isEqualTo(FetchStrategyType.BROWSER);
        assertThat(FetchStrategyFactory.select(SourceFixtures.withFlags(false, true, null)))
            .isEqualTo(FetchStrategyType.CRAWL);
        assertThat(FetchStrategyFactory.select(SourceFixtures.withFlags(false, false, null)))
            .isEqualTo(FetchStrategyType.HTTP);
    }

    @Test
    void disabledBrowserFallsBackToHttpWithWarning() {
        properties.getBrowser().setEnabled(false);

        OpenedStrategy opened = factory().open(SourceFixtures.withFlags(true, false, null));

        assertThat(opened.strategy().type()).isEqualTo(FetchStrategyType.HTTP);
        assertThat(opened.requested()).isEqualTo(FetchStrategyType.BROWSER);
        assertThat(opened.fellBack()).isTrue();
        assertThat(opened.warning()).contains("falling back to HTTP");
        verify(webDriverFactory, never()).newInstance(any());
        opened.strategy().close();
    }

    @Test
    void browserLaunchFailureFallsBackToHttp() {
        when(webDriverFactory.newInstance(any())).thenThrow(new SessionNotCreatedException("no chrome binary"));

        OpenedStrategy opened = factory().open(SourceFixtures.withFlags(true, false, null));

        assertThat(opened.strategy().type()).isEqualTo(FetchStrategyType.HTTP);
        assertThat(opened.warning()).contains("BROWSER");
        opened.strategy().close();
    }

    @Test
    void crawlStrategyOpensWithoutWarning() {
        OpenedStrategy opened = factory().open(SourceFixtures.withFlags(false, true, null));

        assertThat(opened.strategy().type()).isEqualTo(FetchStrategyType.CRAWL);
        assertThat(opened.warning()).isNull();
        assertThat(opened.fellBack()).isFalse();
        opened.strategy().close();
    }

    private FetchStrategyFactory factory() {
        ProxyPool proxyPool = new ProxyPool(properties, Mockito.mock(ScrapeJdbcRepository.class));
        return new FetchStrategyFactory(properties, new UserAgentRotator(properties), proxyPool, webDriverFactory);
    }
}
