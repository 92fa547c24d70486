package com.delta.jobscraper.crawl.driver;

public record BatchVerdict(int newCount, int cachedCount, int alreadyCollected, boolean stop) {}
