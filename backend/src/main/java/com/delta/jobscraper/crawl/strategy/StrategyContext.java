package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.cache.CacheStore;
import com.delta.jobscraper.crawl.extract.ContentExtractor;
import com.delta.jobscraper.crawl.navigator.PageNavigator;
import com.delta.jobscraper.crawl.util.Sleeper;

import java.time.Duration;

public record StrategyContext(
    PageNavigator navigator,
    Sleeper sleeper,
    Duration settle,
    CacheStore cacheStore,
    ContentExtractor extractor,
    int maxConsecutiveErrors,
    Duration maxBackoff
) {}
