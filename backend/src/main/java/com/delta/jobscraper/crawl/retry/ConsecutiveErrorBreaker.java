package com.delta.jobscraper.crawl.retry;

import java.time.Duration;

/**
 * Counts back-to-back failures across the items of one source. Opens once the ceiling is reached;
 * any success closes it again.
 */
public class ConsecutiveErrorBreaker {
    private final int ceiling;
    private final Duration maxBackoff;
    private int consecutiveErrors;

    public ConsecutiveErrorBreaker(int ceiling, Duration maxBackoff) {
        this.ceiling = Math.max(1, ceiling);
        this.maxBackoff = maxBackoff;
    }

    public int recordFailure() {
        consecutiveErrors++;
        return consecutiveErrors;
    }

    public void recordSuccess() {
        consecutiveErrors = 0;
    }

    public boolean isOpen() {
        return consecutiveErrors >= ceiling;
    }

    public int consecutiveErrors() {
        return consecutiveErrors;
    }

    public int ceiling() {
        return ceiling;
    }

    public Duration nextBackoff() {
        return backoffFor(consecutiveErrors, maxBackoff);
    }

    public static Duration backoffFor(int consecutiveErrors, Duration cap) {
        if (consecutiveErrors <= 0) {
            return Duration.ZERO;
        }
        if (consecutiveErrors >= 31) {
            return cap;
        }
        Duration raw = Duration.ofSeconds(1L << consecutiveErrors);
        return raw.compareTo(cap) > 0 ? cap : raw;
    }
}
