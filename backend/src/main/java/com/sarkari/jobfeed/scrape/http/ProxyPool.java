package com.sarkari.jobfeed.scrape.http;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.model.FetchResult;
import com.sarkari.jobfeed.scrape.model.ProxyEndpoint;
import com.sarkari.jobfeed.scrape.persistence.ScrapeJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ProxyPool {
    private static final Logger log = LoggerFactory.getLogger(ProxyPool.class);

    private final ScraperProperties properties;
    private final ScrapeJdbcRepository repository;

    public ProxyPool(ScraperProperties properties, ScrapeJdbcRepository repository) {
        this.properties = properties;
        this.repository = repository;
    }

    public Optional<ProxyEndpoint> select() {
        if (!properties.getProxy().isEnabled()) {
            return Optional.empty();
        }
        return repository.findBestActiveProxy();
    }

    public void recordResult(ProxyEndpoint proxy, FetchResult result) {
        if (proxy == null || result == null) {
            return;
        }
        long responseMs = result.duration() == null ? 0L : result.duration().toMillis();
        try {
            repository.recordProxyUsage(proxy.id(), result.isSuccessful(), responseMs);
        } catch (DataAccessException e) {
            log.warn("Failed to record usage for proxy {}", proxy.hostPort(), e);
        }
    }
}
