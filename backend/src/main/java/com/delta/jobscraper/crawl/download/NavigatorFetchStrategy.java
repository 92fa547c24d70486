package com.delta.jobscraper.crawl.download;

import com.delta.jobscraper.crawl.error.CrawlInterruptedException;
import com.delta.jobscraper.crawl.navigator.PageHandle;
import com.delta.jobscraper.crawl.navigator.PageNavigator;
import com.delta.jobscraper.crawl.util.Sleeper;

import java.time.Duration;

public class NavigatorFetchStrategy implements FetchStrategy {
    private final PageNavigator navigator;
    private final Sleeper sleeper;
    private final Duration settle;

    public NavigatorFetchStrategy(PageNavigator navigator, Sleeper sleeper, Duration settle) {
        this.navigator = navigator;
        this.sleeper = sleeper;
        this.settle = settle;
    }

    @Override
    public String name() {
        return "navigator";
    }

    @Override
    public FetchOutcome fetch(String url) {
        try {
            PageHandle page = navigator.navigate(url);
            sleeper.pause(settle);
            return FetchOutcome.success(page.content(), name());
        } catch (CrawlInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            return FetchOutcome.failure(e.getMessage(), name());
        }
    }
}
