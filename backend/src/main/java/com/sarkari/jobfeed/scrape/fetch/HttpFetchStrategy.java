package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.error.StrategyUnavailableException;
import com.sarkari.jobfeed.scrape.http.ProxyPool;
import com.sarkari.jobfeed.scrape.model.FetchFailure;
import com.sarkari.jobfeed.scrape.model.FetchResult;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.ProxyEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Plain request/response fetching with the JDK client. One client per proxy, built on first use.
 */
public class HttpFetchStrategy extends AbstractFetchStrategy {
    private static final Logger log = LoggerFactory.getLogger(HttpFetchStrategy.class);

    private final ScraperProperties properties;
    private final Map<Long, HttpClient> proxiedClients = new ConcurrentHashMap<>();
    private HttpClient directClient;

    public HttpFetchStrategy(ScraperProperties properties, UserAgentRotator userAgentRotator, ProxyPool proxyPool) {
        super(userAgentRotator, proxyPool);
        this.properties = properties;
    }

    @Override
    public FetchStrategyType type() {
        return FetchStrategyType.HTTP;
    }

    @Override
    public void initialize() {
        try {
            directClient = newClientBuilder().build();
        } catch (RuntimeException e) {
            throw new StrategyUnavailableException(FetchStrategyType.HTTP, "HTTP client could not be created", e);
        }
    }

    @Override
    protected FetchResult fetchOnce(String url, FetchContext context, String userAgent, ProxyEndpoint proxy) {
        Instant startedAt = Instant.now();
        HttpClient client = clientFor(proxy);
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(context.timeout())
                .header("User-Agent", userAgent)
                .header("Accept", ACCEPT_HTML)
                .header("Accept-Language", ACCEPT_LANGUAGE)
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            byte[] bytes = response.body();
            String body = bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
            FetchFailure failure = failureForStatus(status);
            return new FetchResult(
                url,
                response.uri() == null ? null : response.uri().toString(),
                status,
                failure == null ? body : null,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                1,
                failure,
                failure == null ? null : "HTTP " + status
            );
        } catch (HttpTimeoutException e) {
            return FetchResult.failed(url, startedAt, FetchFailure.TIMEOUT, 0, e.getMessage());
        } catch (IOException e) {
            return FetchResult.failed(url, startedAt, FetchFailure.NETWORK, 0, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failed(url, startedAt, FetchFailure.INTERRUPTED, 0, e.getMessage());
        } catch (IllegalArgumentException e) {
            return FetchResult.failed(url, startedAt, FetchFailure.INVALID_URL, 0, e.getMessage());
        }
    }

    @Override
    public void close() {
        proxiedClients.clear();
        directClient = null;
    }

    private HttpClient clientFor(ProxyEndpoint proxy) {
        if (directClient == null) {
            throw new IllegalStateException("HTTP strategy used before initialize()");
        }
        if (proxy == null) {
            return directClient;
        }
        if (proxy.type().isSocks()) {
            log.debug("JDK HTTP client cannot tunnel through SOCKS proxy {}, sending directly", proxy.hostPort());
            return directClient;
        }
        return proxiedClients.computeIfAbsent(proxy.id(), ignored -> {
            HttpClient.Builder builder = newClientBuilder()
                .proxy(ProxySelector.of(new InetSocketAddress(proxy.host(), proxy.port())));
            if (proxy.hasCredentials()) {
                builder.authenticator(new Authenticator() {
                    @Override
                    protected PasswordAuthentication getPasswordAuthentication() {
                        String password = proxy.password() == null ? "" : proxy.password();
                        return new PasswordAuthentication(proxy.username(), password.toCharArray());
                    }
                });
            }
            return builder.build();
        });
    }

    private HttpClient.Builder newClientBuilder() {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1);
    }
}
