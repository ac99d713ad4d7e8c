package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.scrape.http.ProxyPool;
import com.sarkari.jobfeed.scrape.model.FetchFailure;
import com.sarkari.jobfeed.scrape.model.FetchResult;
import com.sarkari.jobfeed.scrape.model.ProxyEndpoint;
import com.sarkari.jobfeed.scrape.util.UrlUtils;

import java.time.Instant;

/**
 * Shared request pipeline: URL check, proxy pick, then the retry loop around a single attempt.
 */
public abstract class AbstractFetchStrategy implements FetchStrategy {
    protected static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    protected static final String ACCEPT_LANGUAGE = "en-US,en;q=0.5";

    protected final UserAgentRotator userAgentRotator;
    protected final ProxyPool proxyPool;

    protected AbstractFetchStrategy(UserAgentRotator userAgentRotator, ProxyPool proxyPool) {
        this.userAgentRotator = userAgentRotator;
        this.proxyPool = proxyPool;
    }

    @Override
    public FetchResult fetch(String url, FetchContext context) {
        String target = UrlUtils.normalizeHttpUrl(url);
        if (target == null) {
            return FetchResult.failed(url, Instant.now(), FetchFailure.INVALID_URL, 0, "URL missing host or malformed")
                .withAttempts(0);
        }
        ProxyEndpoint proxy = proxyFor(context);
        return context.retryPolicy().execute(target, context.rateLimiter(), attemptUrl -> {
            FetchResult result = fetchOnce(attemptUrl, context, userAgentRotator.next(context.source()), proxy);
            if (proxy != null) {
                proxyPool.recordResult(proxy, result);
            }
            return result;
        });
    }

    protected ProxyEndpoint proxyFor(FetchContext context) {
        if (context.source() == null || !context.source().useProxy()) {
            return null;
        }
        return proxyPool.select().orElse(null);
    }

    protected abstract FetchResult fetchOnce(String url, FetchContext context, String userAgent, ProxyEndpoint proxy);

    protected static FetchFailure failureForStatus(int status) {
        if (status >= 200 && status < 300) {
            return null;
        }
        if (status == 429) {
            return FetchFailure.RATE_LIMITED;
        }
        if (status == 401 || status == 407) {
            return FetchFailure.BLOCKED;
        }
        return FetchFailure.HTTP_STATUS;
    }
}
