package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

@Component
public class UserAgentRotator {
    private final ScraperProperties properties;

    public UserAgentRotator(ScraperProperties properties) {
        this.properties = properties;
    }

    public String next(SourceConfig source) {
        List<String> pool = source == null || source.userAgents().isEmpty()
            ? properties.getUserAgents()
            : ScraperProperties.normalizeUserAgents(source.userAgents());
        return pool.get(ThreadLocalRandom.current().nextInt(pool.size()));
    }
}
