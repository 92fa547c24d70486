package com.delta.jobscraper.crawl.util;

import com.delta.jobscraper.crawl.error.CrawlInterruptedException;

import java.time.Duration;

public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeps and turns an interrupt into {@link CrawlInterruptedException}, restoring the interrupt flag.
     */
    default void pause(Duration duration) {
        try {
            sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlInterruptedException("Interrupted while waiting " + duration.toMillis() + "ms", e);
        }
    }
}
