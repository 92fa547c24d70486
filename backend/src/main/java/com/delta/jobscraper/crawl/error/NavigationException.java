package com.delta.jobscraper.crawl.error;

import com.delta.jobscraper.crawl.model.FailureReason;

public class NavigationException extends ScraperException {
    private final String url;

    public NavigationException(String url, String message) {
        super(FailureReason.NAVIGATION_FAILED, message);
        this.url = url;
    }

    public NavigationException(String url, String message, Throwable cause) {
        super(FailureReason.NAVIGATION_FAILED, message, cause);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
