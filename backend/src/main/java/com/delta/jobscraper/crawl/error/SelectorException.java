package com.delta.jobscraper.crawl.error;

import com.delta.jobscraper.crawl.model.FailureReason;

public class SelectorException extends ScraperException {
    private final String selector;

    public SelectorException(String selector, String message) {
        this(FailureReason.SELECTOR_NOT_FOUND, selector, message);
    }

    public SelectorException(FailureReason reason, String selector, String message) {
        super(reason, message);
        this.selector = selector;
    }

    public SelectorException(String selector, String message, Throwable cause) {
        super(FailureReason.SELECTOR_NOT_FOUND, message, cause);
        this.selector = selector;
    }

    public String selector() {
        return selector;
    }
}
