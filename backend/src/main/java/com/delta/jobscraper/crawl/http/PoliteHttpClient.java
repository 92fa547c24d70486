package com.delta.jobscraper.crawl.http;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.model.HttpFetchResult;
import com.delta.jobscraper.crawl.retry.AdaptiveOriginThrottle;
import com.delta.jobscraper.crawl.util.ReasonCodeClassifier;
import com.delta.jobscraper.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);

    private final ScraperProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final AdaptiveOriginThrottle throttle;
    private final Sleeper sleeper;

    public PoliteHttpClient(
        ScraperProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        AdaptiveOriginThrottle throttle,
        Sleeper sleeper
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
        this.throttle = throttle;
        this.sleeper = sleeper;
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        int maxAttempts = 1 + properties.getRequestMaxRetries();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, acceptHeader);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying {} after {} (attempt {}/{})", url, lastResult.describeFailure(), attempt, maxAttempts);
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(String url, String acceptHeader) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            throttle.beforeRequest(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            HttpFetchResult result = new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
            recordThrottleOutcome(host, result);
            return result;
        } catch (HttpTimeoutException e) {
            return recordThrottleOutcome(host, errorResult(url, startedAt, "timeout", e.getMessage()));
        } catch (IOException e) {
            return recordThrottleOutcome(host, errorResult(url, startedAt, "io_error", e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return recordThrottleOutcome(host, errorResult(url, startedAt, "http_error", e.getMessage()));
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null || result.isSuccessful()) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        return ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.fromHttpStatus(result.statusCode()));
    }

    private HttpFetchResult recordThrottleOutcome(String host, HttpFetchResult result) {
        if (result.isSuccessful()) {
            throttle.recordOutcome(host, null);
        } else if (result.errorCode() != null) {
            throttle.recordOutcome(host, ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage()));
        } else {
            throttle.recordOutcome(host, ReasonCodeClassifier.fromHttpStatus(result.statusCode()));
        }
        return result;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            sleeper.sleep(Duration.ofMillis(sleepMs));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
