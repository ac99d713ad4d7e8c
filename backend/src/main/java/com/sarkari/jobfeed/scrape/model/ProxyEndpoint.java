package com.sarkari.jobfeed.scrape.model;

public record ProxyEndpoint(
    long id,
    String host,
    int port,
    ProxyType type,
    String username,
    String password,
    double successRate,
    long requestsMade
) {
    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    public String hostPort() {
        return host + ":" + port;
    }
}
