package com.delta.jobscraper.crawl.download;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered fallbacks for fetching one item. The first successful outcome wins; when every strategy
 * fails the last failure is returned.
 */
public class FetchChain {
    private static final Logger log = LoggerFactory.getLogger(FetchChain.class);

    private final List<FetchStrategy> strategies;

    public FetchChain(List<FetchStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("Fetch chain needs at least one strategy");
        }
        this.strategies = List.copyOf(strategies);
    }

    public FetchOutcome fetch(String url) {
        FetchOutcome last = null;
        for (FetchStrategy strategy : strategies) {
            last = strategy.fetch(url);
            if (last.succeeded()) {
                return last;
            }
            log.debug("Fetch via {} failed for {}: {}", strategy.name(), url, last.error());
        }
        return last;
    }
}
