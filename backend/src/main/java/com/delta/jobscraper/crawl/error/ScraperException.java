package com.delta.jobscraper.crawl.error;

import com.delta.jobscraper.crawl.model.FailureReason;

public class ScraperException extends RuntimeException {
    private final FailureReason reason;

    public ScraperException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ScraperException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason reason() {
        return reason;
    }
}
