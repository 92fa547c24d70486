package com.delta.jobscraper.crawl.service;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.cache.DownloadCache;
import com.delta.jobscraper.crawl.model.CacheResult;
import com.delta.jobscraper.crawl.model.DownloadStats;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceKeys;
import com.delta.jobscraper.crawl.retry.ConsecutiveErrorBreaker;
import com.delta.jobscraper.crawl.strategy.CrawlSession;
import com.delta.jobscraper.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
public class DownloadService {
    private static final Logger log = LoggerFactory.getLogger(DownloadService.class);

    private final ScraperProperties properties;
    private final Sleeper sleeper;

    public DownloadService(ScraperProperties properties, Sleeper sleeper) {
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public DownloadStats downloadAll(
        SourceDescriptor source,
        List<String> links,
        CrawlSession session,
        DownloadCache cache
    ) {
        List<String> work = new ArrayList<>(links.size());
        for (String link : links) {
            if (link == null || link.isBlank()) {
                log.warn("Dropping blank job link for {}", source.name());
                session.incrementWarnings();
                continue;
            }
            work.add(link);
        }
        if (properties.getDownload().isShuffle()) {
            Collections.shuffle(work);
        }

        ConsecutiveErrorBreaker breaker = new ConsecutiveErrorBreaker(
            source.intSetting(SourceKeys.MAX_CONSECUTIVE_ERRORS, properties.getDownload().getMaxConsecutiveErrors()),
            Duration.ofSeconds(properties.getDownload().getMaxBackoffSeconds())
        );
        Duration betweenJobs = Duration.ofMillis((long) (source.doubleSetting(SourceKeys.SLEEP_BETWEEN_JOBS, 0) * 1000));

        int processed = 0;
        int skippedSession = 0;
        int skippedExisting = 0;
        int errors = 0;
        boolean aborted = false;

        log.info("Downloading {} jobs for {}", work.size(), source.name());
        for (String link : work) {
            if (!session.markProcessed(link)) {
                skippedSession++;
                breaker.recordSuccess();
                continue;
            }
            CacheResult result = cache.ensureDownloaded(source.name(), link);
            switch (result) {
                case ALREADY_CACHED -> {
                    skippedExisting++;
                    breaker.recordSuccess();
                }
                case DOWNLOADED -> {
                    processed++;
                    breaker.recordSuccess();
                    log.debug("Downloaded {} ({}/{})", link, processed, work.size());
                    if (!betweenJobs.isZero() && !betweenJobs.isNegative()) {
                        sleeper.pause(betweenJobs);
                    }
                }
                case FAILED -> {
                    errors++;
                    int consecutive = breaker.recordFailure();
                    log.warn("Download failed for {} ({} consecutive errors)", link, consecutive);
                    if (breaker.isOpen()) {
                        log.error("Aborting downloads for {} after {} consecutive errors", source.name(), consecutive);
                        aborted = true;
                    } else {
                        sleeper.pause(breaker.nextBackoff());
                    }
                }
            }
            if (aborted) {
                break;
            }
        }

        DownloadStats stats = new DownloadStats(work.size(), processed, skippedSession, skippedExisting, errors, aborted);
        log.info("Downloads for {}: processed={}, skipped={}, errors={}, aborted={}",
            source.name(), stats.processed(), stats.skipped(), stats.errors(), stats.aborted());
        return stats;
    }
}
