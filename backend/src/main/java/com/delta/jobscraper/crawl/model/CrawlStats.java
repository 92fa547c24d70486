package com.delta.jobscraper.crawl.model;

public record CrawlStats(
    int pagesScraped,
    int jobsFound,
    int newCount,
    int cachedCount,
    boolean earlyStopped,
    int errors,
    int warnings
) {
    public static CrawlStats empty() {
        return new CrawlStats(0, 0, 0, 0, false, 0, 0);
    }
}
