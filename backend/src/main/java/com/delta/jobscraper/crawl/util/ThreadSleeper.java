package com.delta.jobscraper.crawl.util;

import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ThreadSleeper implements Sleeper {
    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long ms = Math.max(0, duration.toMillis());
        if (ms > 0) {
            Thread.sleep(ms);
        }
    }
}
