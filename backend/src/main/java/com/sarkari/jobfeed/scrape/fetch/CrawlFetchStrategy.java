package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.error.StrategyUnavailableException;
import com.sarkari.jobfeed.scrape.http.ProxyPool;
import com.sarkari.jobfeed.scrape.model.FetchFailure;
import com.sarkari.jobfeed.scrape.model.FetchResult;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.ProxyEndpoint;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Credentials;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Crawler-style fetching on OkHttp: a bounded dispatcher, an adaptive delay between requests and
 * look-ahead fetching of pages whose URLs are known in advance.
 */
public class CrawlFetchStrategy extends AbstractFetchStrategy {
    private static final Logger log = LoggerFactory.getLogger(CrawlFetchStrategy.class);

    private final ScraperProperties properties;
    private final Map<Long, OkHttpClient> proxiedClients = new ConcurrentHashMap<>();
    private final Map<String, Prefetch> prefetched = new ConcurrentHashMap<>();
    private final AutoThrottle throttle;
    private OkHttpClient client;
    private ExecutorService prefetchExecutor;

    public CrawlFetchStrategy(ScraperProperties properties, UserAgentRotator userAgentRotator, ProxyPool proxyPool) {
        super(userAgentRotator, proxyPool);
        this.properties = properties;
        ScraperProperties.Crawl crawl = properties.getCrawl();
        this.throttle = new AutoThrottle(
            crawl.getAutothrottleStartDelayMs(),
            crawl.getAutothrottleMaxDelayMs(),
            crawl.getTargetConcurrency()
        );
    }

    @Override
    public FetchStrategyType type() {
        return FetchStrategyType.CRAWL;
    }

    @Override
    public void initialize() {
        ScraperProperties.Crawl crawl = properties.getCrawl();
        try {
            Dispatcher dispatcher = new Dispatcher();
            dispatcher.setMaxRequests(crawl.getMaxConcurrentRequests());
            dispatcher.setMaxRequestsPerHost(crawl.getMaxRequestsPerHost());
            client = new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .followRedirects(true)
                .followSslRedirects(true)
                .retryOnConnectionFailure(false)
                .connectTimeout(properties.getRequestTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(properties.getRequestTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
            prefetchExecutor = Executors.newFixedThreadPool(Math.max(1, crawl.getMaxRequestsPerHost()));
        } catch (RuntimeException | LinkageError e) {
            throw new StrategyUnavailableException(FetchStrategyType.CRAWL, "OkHttp client could not be created", e);
        }
    }

    @Override
    public FetchResult fetch(String url, FetchContext context) {
        Prefetch ahead = prefetched.remove(url);
        if (ahead != null) {
            try {
                return ahead.future().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failed(url, Instant.now(), FetchFailure.INTERRUPTED, 0, e.getMessage());
            } catch (ExecutionException e) {
                log.debug("Prefetch of {} failed, fetching again", url, e.getCause());
            }
        }
        return super.fetch(url, context);
    }

    @Override
    public void prefetch(List<String> urls, FetchContext context) {
        if (prefetchExecutor == null || urls == null) {
            return;
        }
        int budget = properties.getCrawl().getPrefetchPages();
        for (String url : urls) {
            if (budget <= 0) {
                break;
            }
            if (url == null || prefetched.containsKey(url)) {
                continue;
            }
            AtomicBoolean started = new AtomicBoolean(false);
            CompletableFuture<FetchResult> future = CompletableFuture.supplyAsync(() -> {
                started.set(true);
                return super.fetch(url, context);
            }, prefetchExecutor);
            prefetched.put(url, new Prefetch(future, started));
            budget--;
        }
    }

    @Override
    protected FetchResult fetchOnce(String url, FetchContext context, String userAgent, ProxyEndpoint proxy) {
        Instant startedAt = Instant.now();
        try {
            throttle.awaitTurn();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failed(url, startedAt, FetchFailure.INTERRUPTED, 0, e.getMessage());
        }

        Request request;
        try {
            request = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent)
                .header("Accept", ACCEPT_HTML)
                .header("Accept-Language", ACCEPT_LANGUAGE)
                .get()
                .build();
        } catch (IllegalArgumentException e) {
            return FetchResult.failed(url, startedAt, FetchFailure.INVALID_URL, 0, e.getMessage());
        }

        OkHttpClient base = clientFor(proxy);
        OkHttpClient perCall = base.newBuilder()
            .callTimeout(context.timeout().toMillis(), TimeUnit.MILLISECONDS)
            .build();
        Call call = perCall.newCall(request);
        CompletableFuture<FetchResult> future = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                FetchFailure failure = e instanceof InterruptedIOException ? FetchFailure.TIMEOUT : FetchFailure.NETWORK;
                future.complete(FetchResult.failed(url, startedAt, failure, 0, e.getMessage()));
            }

            @Override
            public void onResponse(Call okCall, Response response) {
                try (ResponseBody body = response.body()) {
                    String text = body == null ? null : body.string();
                    int status = response.code();
                    FetchFailure failure = failureForStatus(status);
                    future.complete(new FetchResult(
                        url,
                        response.request().url().toString(),
                        status,
                        failure == null ? text : null,
                        Instant.now(),
                        Duration.between(startedAt, Instant.now()),
                        1,
                        failure,
                        failure == null ? null : "HTTP " + status
                    ));
                } catch (IOException e) {
                    future.complete(FetchResult.failed(url, startedAt, FetchFailure.NETWORK, response.code(), e.getMessage()));
                }
            }
        });

        FetchResult result;
        try {
            result = future.get(context.timeout().toMillis() + 5_000L, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            call.cancel();
            Thread.currentThread().interrupt();
            return FetchResult.failed(url, startedAt, FetchFailure.INTERRUPTED, 0, e.getMessage());
        } catch (TimeoutException e) {
            call.cancel();
            result = FetchResult.failed(url, startedAt, FetchFailure.TIMEOUT, 0, "Call did not finish within timeout");
        } catch (ExecutionException e) {
            result = FetchResult.failed(url, startedAt, FetchFailure.NETWORK, 0, String.valueOf(e.getCause()));
        }
        throttle.record(result);
        return result;
    }

    @Override
    public int discardPrefetched() {
        int spent = 0;
        for (Prefetch ahead : prefetched.values()) {
            CompletableFuture<FetchResult> future = ahead.future();
            if (future.isDone() && !future.isCompletedExceptionally()) {
                spent += Math.max(0, future.join().attempts());
            } else if (ahead.started().get()) {
                spent++;
            }
            future.cancel(true);
        }
        prefetched.clear();
        return spent;
    }

    @Override
    public void close() {
        prefetched.values().forEach(ahead -> ahead.future().cancel(true));
        prefetched.clear();
        if (prefetchExecutor != null) {
            prefetchExecutor.shutdownNow();
        }
        if (client != null) {
            client.dispatcher().cancelAll();
            client.dispatcher().executorService().shutdown();
            client.connectionPool().evictAll();
        }
        proxiedClients.clear();
    }

    long currentDelayMs() {
        return throttle.currentDelayMs();
    }

    private OkHttpClient clientFor(ProxyEndpoint proxy) {
        if (client == null) {
            throw new IllegalStateException("Crawl strategy used before initialize()");
        }
        if (proxy == null) {
            return client;
        }
        return proxiedClients.computeIfAbsent(proxy.id(), ignored -> {
            Proxy.Type type = proxy.type().isSocks() ? Proxy.Type.SOCKS : Proxy.Type.HTTP;
            OkHttpClient.Builder builder = client.newBuilder()
                .proxy(new Proxy(type, new InetSocketAddress(proxy.host(), proxy.port())));
            if (proxy.hasCredentials()) {
                String credential = Credentials.basic(proxy.username(), proxy.password() == null ? "" : proxy.password());
                builder.proxyAuthenticator((route, response) -> response.request().newBuilder()
                    .header("Proxy-Authorization", credential)
                    .build());
            }
            return builder.build();
        });
    }

    private record Prefetch(CompletableFuture<FetchResult> future, AtomicBoolean started) {
    }

    /**
     * Adjusts the gap between requests toward {@code latency / targetConcurrency}, never below the
     * start delay nor above the ceiling. Error responses can only raise the delay.
     */
    static final class AutoThrottle {
        private final long minDelayMs;
        private final long maxDelayMs;
        private final double targetConcurrency;
        private long delayMs;
        private long nextAllowedAtMs;

        AutoThrottle(long startDelayMs, long maxDelayMs, double targetConcurrency) {
            this.minDelayMs = Math.max(0, startDelayMs);
            this.maxDelayMs = Math.max(this.minDelayMs, maxDelayMs);
            this.targetConcurrency = targetConcurrency <= 0 ? 1.0 : targetConcurrency;
            this.delayMs = this.minDelayMs;
        }

        void awaitTurn() throws InterruptedException {
            long waitMs;
            synchronized (this) {
                long now = System.currentTimeMillis();
                long slot = Math.max(now, nextAllowedAtMs);
                nextAllowedAtMs = slot + delayMs;
                waitMs = slot - now;
            }
            if (waitMs > 0) {
                Thread.sleep(waitMs);
            }
        }

        synchronized void record(FetchResult result) {
            if (result == null || result.duration() == null) {
                return;
            }
            long latency = result.duration().toMillis();
            long target = (long) (latency / targetConcurrency);
            long next = (delayMs + target) / 2;
            if (!result.isSuccessful() && next < delayMs) {
                return;
            }
            delayMs = Math.min(maxDelayMs, Math.max(minDelayMs, next));
        }

        synchronized long currentDelayMs() {
            return delayMs;
        }
    }
}
