package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.scrape.model.ProxyEndpoint;

import java.time.Duration;

public record BrowserLaunchOptions(
    String userAgent,
    ProxyEndpoint proxy,
    boolean blockResources,
    boolean headless,
    int windowWidth,
    int windowHeight,
    Duration pageLoadTimeout,
    String remoteUrl
) {
}
