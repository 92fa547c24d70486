package com.delta.jobscraper.crawl.model;

public record RunCounters(
    int sitesProcessed,
    int sitesFailed,
    int jobsFound,
    int jobsDownloaded,
    int jobsSkipped,
    int errors,
    int warnings
) {
    public static RunCounters empty() {
        return new RunCounters(0, 0, 0, 0, 0, 0, 0);
    }

    public static RunCounters of(ScrapeResult result) {
        CrawlStats stats = result.stats();
        DownloadStats downloads = result.downloadStats();
        return new RunCounters(
            result.success() ? 1 : 0,
            result.success() ? 0 : 1,
            stats.jobsFound(),
            downloads.processed(),
            downloads.skipped(),
            stats.errors() + downloads.errors(),
            stats.warnings()
        );
    }

    public RunCounters plus(RunCounters other) {
        return new RunCounters(
            sitesProcessed + other.sitesProcessed,
            sitesFailed + other.sitesFailed,
            jobsFound + other.jobsFound,
            jobsDownloaded + other.jobsDownloaded,
            jobsSkipped + other.jobsSkipped,
            errors + other.errors,
            warnings + other.warnings
        );
    }
}
