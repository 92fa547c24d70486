package com.delta.jobscraper.crawl.error;

import com.delta.jobscraper.crawl.model.FailureReason;

public class CrawlInterruptedException extends ScraperException {
    public CrawlInterruptedException(String message, InterruptedException cause) {
        super(FailureReason.INTERRUPTED, message, cause);
    }
}
