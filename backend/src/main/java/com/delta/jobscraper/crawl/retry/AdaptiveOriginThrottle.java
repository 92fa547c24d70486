package com.delta.jobscraper.crawl.retry;

import com.delta.jobscraper.crawl.util.ReasonCodeClassifier;
import com.delta.jobscraper.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-origin spacing between requests. The delay starts at the floor, doubles on rate limiting,
 * missing pages and timeouts up to the ceiling, and drops back to the floor after one success.
 */
public class AdaptiveOriginThrottle {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveOriginThrottle.class);

    private final Duration floor;
    private final Duration ceiling;
    private final Sleeper sleeper;
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastRequestAt = new ConcurrentHashMap<>();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();

    public AdaptiveOriginThrottle(Duration floor, Duration ceiling, Sleeper sleeper) {
        this.floor = floor;
        this.ceiling = ceiling.compareTo(floor) < 0 ? floor : ceiling;
        this.sleeper = sleeper;
    }

    public void beforeRequest(String host) throws InterruptedException {
        String key = normalizeHost(host);
        Object lock = hostLocks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            Instant previous = lastRequestAt.get(key);
            if (previous != null) {
                Instant allowedAt = previous.plus(currentDelay(key));
                Duration wait = Duration.between(Instant.now(), allowedAt);
                if (!wait.isNegative() && !wait.isZero()) {
                    sleeper.sleep(wait);
                }
            }
            lastRequestAt.put(key, Instant.now());
        }
    }

    public void recordOutcome(String host, String reasonCode) {
        String key = normalizeHost(host);
        if (reasonCode == null) {
            delays.put(key, floor);
            return;
        }
        if (!ReasonCodeClassifier.triggersBackoff(reasonCode)) {
            return;
        }
        Duration next = delays.compute(key, (ignored, current) -> {
            Duration base = current == null || current.isZero() ? Duration.ofMillis(Math.max(1, floor.toMillis())) : current;
            Duration doubled = base.multipliedBy(2);
            return doubled.compareTo(ceiling) > 0 ? ceiling : doubled;
        });
        log.debug("Throttle for {} raised to {}ms after {}", key, next.toMillis(), reasonCode);
    }

    public Duration currentDelay(String host) {
        return delays.getOrDefault(normalizeHost(host), floor);
    }

    private String normalizeHost(String host) {
        return host == null ? "" : host.trim().toLowerCase(Locale.ROOT);
    }
}
