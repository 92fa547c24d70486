package com.delta.jobscraper.crawl.model;

import java.time.Instant;
import java.util.List;

public record RunSummary(
    String label,
    Instant startedAt,
    Instant finishedAt,
    double durationSeconds,
    String humanDuration,
    boolean interrupted,
    RunCounters counters,
    List<SourceFailure> failures,
    List<ScrapeResult> results
) {
    public boolean allSucceeded() {
        return !interrupted && failures.isEmpty();
    }
}
