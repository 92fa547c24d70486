package com.delta.jobscraper.crawl.navigator;

import com.delta.jobscraper.crawl.util.Sleeper;

import java.time.Duration;

public final class SelectorWaiter {
    private final Sleeper sleeper;
    private final Duration timeout;
    private final Duration pollInterval;

    public SelectorWaiter(Sleeper sleeper, Duration timeout, Duration pollInterval) {
        this.sleeper = sleeper;
        this.timeout = timeout;
        this.pollInterval = pollInterval.isZero() || pollInterval.isNegative() ? Duration.ofMillis(1) : pollInterval;
    }

    public boolean await(PageHandle page, String selector) {
        long waitedMs = 0;
        long timeoutMs = timeout.toMillis();
        while (true) {
            if (page.selectOne(selector).isPresent()) {
                return true;
            }
            if (waitedMs >= timeoutMs) {
                return false;
            }
            sleeper.pause(pollInterval);
            waitedMs += pollInterval.toMillis();
        }
    }
}
