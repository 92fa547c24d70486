package com.delta.jobscraper.crawl.service;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.cache.CacheStore;
import com.delta.jobscraper.crawl.cache.DownloadCache;
import com.delta.jobscraper.crawl.download.FetchChain;
import com.delta.jobscraper.crawl.download.FetchStrategy;
import com.delta.jobscraper.crawl.download.HttpFetchStrategy;
import com.delta.jobscraper.crawl.download.NavigatorFetchStrategy;
import com.delta.jobscraper.crawl.driver.CrawlDriver;
import com.delta.jobscraper.crawl.error.CrawlInterruptedException;
import com.delta.jobscraper.crawl.error.ScraperException;
import com.delta.jobscraper.crawl.extract.ContentExtractor;
import com.delta.jobscraper.crawl.http.PoliteHttpClient;
import com.delta.jobscraper.crawl.model.CrawlStats;
import com.delta.jobscraper.crawl.model.DownloadStats;
import com.delta.jobscraper.crawl.model.FailureReason;
import com.delta.jobscraper.crawl.model.ScrapeResult;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceKeys;
import com.delta.jobscraper.crawl.navigator.PageNavigator;
import com.delta.jobscraper.crawl.navigator.PageNavigatorFactory;
import com.delta.jobscraper.crawl.strategy.CrawlSession;
import com.delta.jobscraper.crawl.strategy.CrawlStrategy;
import com.delta.jobscraper.crawl.strategy.CrawlStrategyFactory;
import com.delta.jobscraper.crawl.strategy.StrategyContext;
import com.delta.jobscraper.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Crawls one source end to end and turns every outcome into a {@link ScrapeResult}.
 */
@Service
public class SourceCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(SourceCrawlerService.class);

    private final ScraperProperties properties;
    private final PageNavigatorFactory navigatorFactory;
    private final PoliteHttpClient httpClient;
    private final CacheStore cacheStore;
    private final ContentExtractor extractor;
    private final CrawlDriver crawlDriver;
    private final DownloadService downloadService;
    private final Sleeper sleeper;

    public SourceCrawlerService(
        ScraperProperties properties,
        PageNavigatorFactory navigatorFactory,
        PoliteHttpClient httpClient,
        CacheStore cacheStore,
        ContentExtractor extractor,
        CrawlDriver crawlDriver,
        DownloadService downloadService,
        Sleeper sleeper
    ) {
        this.properties = properties;
        this.navigatorFactory = navigatorFactory;
        this.httpClient = httpClient;
        this.cacheStore = cacheStore;
        this.extractor = extractor;
        this.crawlDriver = crawlDriver;
        this.downloadService = downloadService;
        this.sleeper = sleeper;
    }

    public ScrapeResult crawl(SourceDescriptor source) {
        Instant startedAt = Instant.now();
        if (!source.enabled()) {
            log.info("Skipping disabled source {}", source.name());
            return ScrapeResult.failed(source, FailureReason.DISABLED, "Source is disabled", null, null, startedAt);
        }

        log.info("Starting crawl of {} ({}) at {}", source.name(), source.backendType().configKey(), source.url());
        CrawlSession session = null;
        try (PageNavigator navigator = navigatorFactory.open(source)) {
            Duration settle = Duration.ofMillis(Math.max(0,
                source.intSetting(SourceKeys.SETTLE_MS, properties.getNavigation().getSettleMs())));
            StrategyContext context = new StrategyContext(
                navigator,
                sleeper,
                settle,
                cacheStore,
                extractor,
                properties.getDownload().getMaxConsecutiveErrors(),
                Duration.ofSeconds(properties.getDownload().getMaxBackoffSeconds())
            );
            CrawlStrategy strategy = CrawlStrategyFactory.create(source, context);
            log.debug("Using {}", strategy);

            session = crawlDriver.crawl(source, strategy, navigator, url -> cacheStore.isCached(source.name(), url));

            DownloadStats downloads;
            if (strategy.downloadsInline()) {
                downloads = session.inlineDownloads();
            } else {
                DownloadCache cache = new DownloadCache(cacheStore, fetchChain(navigator, sleeper, settle), extractor);
                downloads = downloadService.downloadAll(source, session.collectedLinks(), session, cache);
            }

            if (downloads.aborted()) {
                String message = "Aborted after " + downloads.errors() + " download errors";
                log.warn("Source {} failed: {} ({})", source.name(), FailureReason.CONSECUTIVE_ERRORS, message);
                return ScrapeResult.failed(source, FailureReason.CONSECUTIVE_ERRORS, message, session.stats(), downloads, startedAt);
            }
            log.info("Finished {}: {} jobs found, {} downloaded, {} skipped, {} errors",
                source.name(), session.jobsFound(), downloads.processed(), downloads.skipped(), downloads.errors());
            return ScrapeResult.succeeded(source, session.stats(), downloads, startedAt);
        } catch (CrawlInterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Crawl of {} interrupted", source.name());
            return ScrapeResult.failed(source, FailureReason.INTERRUPTED, e.getMessage(), statsOf(session), null, startedAt);
        } catch (ScraperException e) {
            log.warn("Source {} failed: {} ({})", source.name(), e.reason(), e.getMessage());
            return ScrapeResult.failed(source, e.reason(), e.getMessage(), statsOf(session), null, startedAt);
        } catch (RuntimeException e) {
            log.error("Unexpected error crawling {}", source.name(), e);
            return ScrapeResult.failed(source, FailureReason.UNEXPECTED_ERROR, e.toString(), statsOf(session), null, startedAt);
        }
    }

    private FetchChain fetchChain(PageNavigator navigator, Sleeper sleeper, Duration settle) {
        List<FetchStrategy> strategies = new ArrayList<>();
        strategies.add(new NavigatorFetchStrategy(navigator, sleeper, settle));
        if (properties.getDownload().isHttpFallback()) {
            strategies.add(new HttpFetchStrategy(httpClient));
        }
        return new FetchChain(strategies);
    }

    private static CrawlStats statsOf(CrawlSession session) {
        return session == null ? null : session.stats();
    }
}
