package com.delta.jobscraper.crawl.model;

public record SourceFailure(String source, String group, FailureReason reason, String message) {}
