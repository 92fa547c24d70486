package com.delta.jobscraper.crawl.download;

public interface FetchStrategy {
    String name();

    FetchOutcome fetch(String url);
}
