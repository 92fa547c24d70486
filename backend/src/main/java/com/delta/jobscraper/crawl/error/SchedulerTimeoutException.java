package com.delta.jobscraper.crawl.error;

import com.delta.jobscraper.crawl.model.FailureReason;

public class SchedulerTimeoutException extends ScraperException {
    public SchedulerTimeoutException(String message, Throwable cause) {
        super(FailureReason.TIMEOUT, message, cause);
    }
}
