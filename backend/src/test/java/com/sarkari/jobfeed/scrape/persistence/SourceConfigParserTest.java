package com.sarkari.jobfeed.scrape.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.error.InvalidSourceConfigException;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.SelectorMap;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import com.sarkari.jobfeed.scrape.model.SourceRow;
import com.sarkari.jobfeed.scrape.model.SourceStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceConfigParserTest {
    private final ScraperProperties properties = new ScraperProperties();
    private final SourceConfigParser parser = new SourceConfigParser(new ObjectMapper(), properties);

    @Test
    void readsSelectorsPaginationAndFetchSettings() {
        String json = """
            {
              "selectors": {
                "job_container": [".notice-row", "tr"],
                "job_title": "td.title a",
                "title": ".heading",
                "deadline": ".closing",
                "mystery_field": ".ignored"
              },
              "pagination": {"url_pattern": "https://ssc.gov.in/jobs?page={page}", "start_page": 0, "max_pages": 3},
              "requires_js": true,
              "scraper_type": "playwright",
              "requests_per_minute": 12,
              "max_retries": 5,
              "use_proxy": true,
              "user_agents": ["AgentA/1.0", ""],
              "block_resources": false,
              "wait_for_selector": ".notice-row"
            }
            """;

        SourceConfig config = parser.parse(row(json, "https://ssc.gov.in"));

        assertThat(config.selectors().containerChain()).containsExactly(".notice-row", "tr");
        assertThat(config.selectors().chain("title")).containsExactly("td.title a", ".heading");
        assertThat(config.selectors().chain("last_date")).containsExactly(".closing");
        assertThat(config.selectors().selectors()).doesNotContainKey("mystery_field");
        assertThat(config.pagination().usesUrlPattern()).isTrue();
        assertThat(config.pagination().startPage()).isEqualTo(1);
        assertThat(config.pagination().maxPages()).isEqualTo(3);
        assertThat(config.requiresJs()).isTrue();
        assertThat(config.scraperType()).isEqualTo(FetchStrategyType.BROWSER);
        assertThat(config.requestsPerMinute()).isEqualTo(12);
        assertThat(config.maxRetries()).isEqualTo(5);
        assertThat(config.timeoutSeconds()).isNull();
        assertThat(config.useProxy()).isTrue();
        assertThat(config.userAgents()).containsExactly("AgentA/1.0");
        assertThat(config.blockResources()).isFalse();
        assertThat(config.waitForSelector()).isEqualTo(".notice-row");
    }

    @Test
    void appliesDefaultsWhenOptionalKeysAreAbsent() {
        properties.getPagination().setDefaultMaxPages(7);

        SourceConfig config = parser.parse(row("{\"selectors\": {\"job_container\": \".job\"}}", "https://upsc.gov.in"));

        assertThat(config.pagination().maxPages()).isEqualTo(7);
        assertThat(config.pagination().usesNextPageSelector()).isFalse();
        assertThat(config.scraperType()).isNull();
        assertThat(config.requiresJs()).isFalse();
        assertThat(config.blockResources()).isTrue();
        assertThat(config.userAgents()).isEmpty();
    }

    @Test
    void fallsBackToBaseUrlInsideConfig() {
        String json = "{\"base_url\": \"https://rrb.gov.in\", \"selectors\": {\"job_container\": \".job\"}}";

        assertThat(parser.parse(row(json, null)).baseUrl()).isEqualTo("https://rrb.gov.in");
    }

    @Test
    void unknownScraperTypeMeansAutomaticSelection() {
        String json = "{\"scraper_type\": \"telnet\", \"selectors\": {\"job_container\": \".job\"}}";

        assertThat(parser.parse(row(json, "https://ssc.gov.in")).scraperType()).isNull();
    }

    @Test
    void rejectsBrokenConfigurations() {
        assertThatThrownBy(() -> parser.parse(row("", "https://ssc.gov.in")))
            .isInstanceOf(InvalidSourceConfigException.class)
            .hasMessageContaining("empty");
        assertThatThrownBy(() -> parser.parse(row("{not json", "https://ssc.gov.in")))
            .isInstanceOf(InvalidSourceConfigException.class)
            .hasMessageContaining("malformed");
        assertThatThrownBy(() -> parser.parse(row("[1, 2]", "https://ssc.gov.in")))
            .isInstanceOf(InvalidSourceConfigException.class);
        assertThatThrownBy(() -> parser.parse(row("{\"selectors\": {\"title\": \"a\"}}", "https://ssc.gov.in")))
            .isInstanceOf(InvalidSourceConfigException.class)
            .hasMessageContaining(SelectorMap.JOB_CONTAINER);
        assertThatThrownBy(() -> parser.parse(row("{\"selectors\": {\"job_container\": \".job\"}}", " ")))
            .isInstanceOf(InvalidSourceConfigException.class)
            .hasMessageContaining("base_url");
    }

    private SourceRow row(String json, String baseUrl) {
        return new SourceRow(3L, "ssc", "SSC", baseUrl, true, SourceStatus.ACTIVE, 24, json, null, null, 0L);
    }
}
