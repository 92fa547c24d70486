package com.delta.jobscraper.crawl.error;

import com.delta.jobscraper.crawl.model.FailureReason;

public class ConfigurationException extends ScraperException {
    public ConfigurationException(String message) {
        super(FailureReason.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(FailureReason.CONFIGURATION_ERROR, message, cause);
    }
}
