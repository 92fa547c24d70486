package com.delta.jobscraper.crawl.driver;

import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceKeys;
import com.delta.jobscraper.crawl.strategy.CrawlSession;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Predicate;

/**
 * Stops pagination once a page yields too few links that are neither collected already nor cached.
 * Only existence in the cache is checked, never content.
 */
public class EarlyStopPolicy {
    private final boolean enabled;
    private final int minNewPerPage;

    public EarlyStopPolicy(boolean enabled, int minNewPerPage) {
        this.enabled = enabled;
        this.minNewPerPage = Math.max(0, minNewPerPage);
    }

    public EarlyStopPolicy forSource(SourceDescriptor source) {
        return new EarlyStopPolicy(
            source.booleanSetting(SourceKeys.EARLY_STOP_ENABLED, enabled),
            source.intSetting(SourceKeys.MIN_NEW_JOBS_PER_PAGE, minNewPerPage)
        );
    }

    public BatchVerdict assess(CrawlSession session, List<String> batch, Predicate<String> isCached) {
        int fresh = 0;
        int cached = 0;
        int collected = 0;
        for (String link : new LinkedHashSet<>(batch)) {
            if (session.hasCollected(link)) {
                collected++;
            } else if (isCached.test(link)) {
                cached++;
            } else {
                fresh++;
            }
        }
        return new BatchVerdict(fresh, cached, collected, enabled && fresh <= minNewPerPage);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int minNewPerPage() {
        return minNewPerPage;
    }
}
