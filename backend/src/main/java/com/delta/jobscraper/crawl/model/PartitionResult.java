package com.delta.jobscraper.crawl.model;

import java.util.List;

public record PartitionResult(BackendType backendType, List<ScrapeResult> results, RunCounters counters) {}
