package com.delta.jobscraper.crawl.model;

public enum CacheResult {
    ALREADY_CACHED,
    DOWNLOADED,
    FAILED
}
