package com.delta.jobscraper.crawl.driver;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.diagnostics.DiagnosticsCollector;
import com.delta.jobscraper.crawl.error.SelectorException;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceKeys;
import com.delta.jobscraper.crawl.navigator.PageNavigator;
import com.delta.jobscraper.crawl.navigator.SelectorWaiter;
import com.delta.jobscraper.crawl.strategy.CrawlSession;
import com.delta.jobscraper.crawl.strategy.CrawlStrategy;
import com.delta.jobscraper.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Runs the pagination loop of one source: seed navigation, readiness wait, session setup, then
 * extraction and advancing until a stop condition holds.
 */
@Component
public class CrawlDriver {
    private static final Logger log = LoggerFactory.getLogger(CrawlDriver.class);

    private final DiagnosticsCollector diagnostics;
    private final SelectorWaiter selectorWaiter;
    private final EarlyStopPolicy earlyStopDefaults;

    public CrawlDriver(ScraperProperties properties, Sleeper sleeper, DiagnosticsCollector diagnostics) {
        this.diagnostics = diagnostics;
        this.selectorWaiter = new SelectorWaiter(
            sleeper,
            Duration.ofMillis(properties.getNavigation().getSelectorWaitMs()),
            Duration.ofMillis(properties.getNavigation().getSelectorPollMs())
        );
        this.earlyStopDefaults = new EarlyStopPolicy(
            properties.getEarlyStop().isEnabled(),
            properties.getEarlyStop().getMinNewJobsPerPage()
        );
    }

    public CrawlSession crawl(
        SourceDescriptor source,
        CrawlStrategy strategy,
        PageNavigator navigator,
        Predicate<String> isCached
    ) {
        CrawlSession session = new CrawlSession(source, strategy.deduplicatesLinks());
        EarlyStopPolicy earlyStop = earlyStopDefaults.forSource(source);
        int maxPages = Math.max(0, source.intSetting(SourceKeys.MAX_PAGES, 0));

        log.info("Navigating to {} for {}", source.url(), source.name());
        session.setPage(navigator.navigate(source.url()));
        awaitReady(session, strategy);
        strategy.prepareSession(session);

        while (true) {
            log.info("Scraping page {} of {}...", session.pageNumber(), source.name());
            List<String> links;
            try {
                links = strategy.extractItemLinks(session);
            } catch (SelectorException e) {
                report(session, "SelectorError", e.getMessage(), e.selector());
                if (session.pageNumber() == 1) {
                    throw e;
                }
                log.warn("Extraction failed on page {} of {}; ending pagination: {}",
                    session.pageNumber(), source.name(), e.getMessage());
                session.incrementErrors();
                break;
            }

            if (strategy.downloadsInline()) {
                // inline strategies process their whole listing in one extraction
                session.recordBatch(links, 0, 0);
                break;
            }

            if (links.isEmpty()) {
                if (session.pageNumber() == 1 && strategy.reportsEmptyFirstPage()) {
                    String selector = source.selector(SourceKeys.JOB_LINK).orElse(null);
                    String message = "No job links found on first page of " + source.name();
                    report(session, "SelectorError", message, selector);
                    throw new SelectorException(selector, message);
                }
                log.info("No jobs found on page {} of {} - reached the end", session.pageNumber(), source.name());
                break;
            }

            BatchVerdict verdict = earlyStop.assess(session, links, isCached);
            session.recordBatch(links, verdict.newCount(), verdict.cachedCount());
            log.info("Page {}: found {} job links ({} new, {} cached) for {}",
                session.pageNumber(), links.size(), verdict.newCount(), verdict.cachedCount(), source.name());

            if (verdict.stop()) {
                log.info("Early stop for {}: page {} yielded {} new links (threshold {})",
                    source.name(), session.pageNumber(), verdict.newCount(), earlyStop.minNewPerPage());
                session.markEarlyStopped();
                break;
            }
            if (maxPages > 0 && session.pageNumber() >= maxPages) {
                log.info("Reached max_pages={} for {}", maxPages, source.name());
                break;
            }
            if (!strategy.advanceToNextPage(session)) {
                log.info("Reached last page for {}", source.name());
                break;
            }
            session.advancePage();
        }

        log.info("Summary for {}: {} pages scraped, {} job links found",
            source.name(), session.stats().pagesScraped(), session.jobsFound());
        return session;
    }

    private void awaitReady(CrawlSession session, CrawlStrategy strategy) {
        Optional<String> ready = strategy.readySelector();
        if (ready.isEmpty()) {
            return;
        }
        if (!selectorWaiter.await(session.page(), ready.get())) {
            log.warn("Timeout waiting for '{}' on {}", ready.get(), session.source().name());
            session.incrementWarnings();
            report(session, "SelectorTimeout", "Timed out waiting for selector '" + ready.get() + "'", ready.get());
        }
    }

    private void report(CrawlSession session, String errorType, String message, String selector) {
        String pageUrl = session.hasPage() ? session.page().currentUrl() : session.source().url();
        diagnostics.report(
            session.source(),
            errorType,
            message,
            pageUrl,
            Map.of("selector", selector == null ? "" : selector, "page", session.pageNumber())
        );
    }
}
