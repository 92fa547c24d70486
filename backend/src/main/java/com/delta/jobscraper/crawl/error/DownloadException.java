package com.delta.jobscraper.crawl.error;

import com.delta.jobscraper.crawl.model.FailureReason;

public class DownloadException extends ScraperException {
    public DownloadException(String message) {
        super(FailureReason.DOWNLOAD_FAILED, message);
    }

    public DownloadException(String message, Throwable cause) {
        super(FailureReason.DOWNLOAD_FAILED, message, cause);
    }
}
