package com.delta.jobscraper.crawl.model;

public record DownloadStats(
    int total,
    int processed,
    int skippedSession,
    int skippedExisting,
    int errors,
    boolean aborted
) {
    public static DownloadStats empty() {
        return new DownloadStats(0, 0, 0, 0, 0, false);
    }

    public int skipped() {
        return skippedSession + skippedExisting;
    }
}
