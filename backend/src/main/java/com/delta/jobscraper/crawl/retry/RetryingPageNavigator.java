package com.delta.jobscraper.crawl.retry;

import com.delta.jobscraper.crawl.error.CrawlInterruptedException;
import com.delta.jobscraper.crawl.error.NavigationException;
import com.delta.jobscraper.crawl.navigator.PageHandle;
import com.delta.jobscraper.crawl.navigator.PageNavigator;
import com.delta.jobscraper.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class RetryingPageNavigator implements PageNavigator {
    private static final Logger log = LoggerFactory.getLogger(RetryingPageNavigator.class);

    private final PageNavigator delegate;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final Sleeper sleeper;

    public RetryingPageNavigator(PageNavigator delegate, int maxAttempts, Duration retryDelay, Sleeper sleeper) {
        this.delegate = delegate;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelay = retryDelay;
        this.sleeper = sleeper;
    }

    @Override
    public PageHandle navigate(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be empty");
        }
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                log.debug("Navigation attempt {}/{} to {}", attempt, maxAttempts, url);
                return delegate.navigate(url);
            } catch (CrawlInterruptedException e) {
                throw e;
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Attempt {}/{}: error loading {}: {}", attempt, maxAttempts, url, e.getMessage());
                if (attempt < maxAttempts) {
                    sleeper.pause(retryDelay);
                }
            }
        }
        throw new NavigationException(url, "Failed to navigate to " + url + " after " + maxAttempts + " attempts", lastError);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
