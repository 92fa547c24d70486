package com.delta.jobscraper.crawl.download;

public record FetchOutcome(boolean succeeded, String content, String error, String fetchedBy) {
    public static FetchOutcome success(String content, String fetchedBy) {
        return new FetchOutcome(true, content, null, fetchedBy);
    }

    public static FetchOutcome failure(String error, String fetchedBy) {
        return new FetchOutcome(false, null, error, fetchedBy);
    }
}
