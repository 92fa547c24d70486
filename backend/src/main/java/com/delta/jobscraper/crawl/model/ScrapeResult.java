package com.delta.jobscraper.crawl.model;

import java.time.Instant;

public record ScrapeResult(
    String sourceName,
    String group,
    BackendType backendType,
    boolean success,
    FailureReason failureReason,
    String message,
    CrawlStats stats,
    DownloadStats downloadStats,
    Instant startedAt,
    Instant finishedAt
) {
    public static ScrapeResult succeeded(
        SourceDescriptor source,
        CrawlStats stats,
        DownloadStats downloadStats,
        Instant startedAt
    ) {
        return new ScrapeResult(
            source.name(),
            source.group(),
            source.backendType(),
            true,
            null,
            null,
            stats,
            downloadStats,
            startedAt,
            Instant.now()
        );
    }

    public static ScrapeResult failed(
        SourceDescriptor source,
        FailureReason reason,
        String message,
        CrawlStats stats,
        DownloadStats downloadStats,
        Instant startedAt
    ) {
        return new ScrapeResult(
            source.name(),
            source.group(),
            source.backendType(),
            false,
            reason,
            message,
            stats == null ? CrawlStats.empty() : stats,
            downloadStats == null ? DownloadStats.empty() : downloadStats,
            startedAt,
            Instant.now()
        );
    }
}
