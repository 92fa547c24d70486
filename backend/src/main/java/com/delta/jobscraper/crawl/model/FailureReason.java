package com.delta.jobscraper.crawl.model;

public enum FailureReason {
    DISABLED,
    CONFIGURATION_ERROR,
    NAVIGATION_FAILED,
    SELECTOR_NOT_FOUND,
    NESTED_CONTEXT_UNAVAILABLE,
    DOWNLOAD_FAILED,
    CONSECUTIVE_ERRORS,
    TIMEOUT,
    INTERRUPTED,
    UNEXPECTED_ERROR
}
