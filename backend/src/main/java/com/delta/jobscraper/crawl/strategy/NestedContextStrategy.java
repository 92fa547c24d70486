package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.error.NavigationException;
import com.delta.jobscraper.crawl.error.SelectorException;
import com.delta.jobscraper.crawl.model.FailureReason;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceKeys;
import com.delta.jobscraper.crawl.navigator.PageElement;
import com.delta.jobscraper.crawl.navigator.PageHandle;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Boards that render their listing inside an iframe (iCIMS). Extraction and pagination both run
 * against the nested document entered during session setup.
 */
public class NestedContextStrategy extends AbstractCrawlStrategy {
    private static final int DEFAULT_FRAME_SETTLE_MS = 5000;

    private final String iframeSelector;
    private final String jobLinkSelector;
    private final Optional<String> nextPageSelector;
    private final Optional<String> nextPageDisabledSelector;
    private final Duration frameSettle;
    private PageHandle frame;
    private boolean reachedEnd;

    public NestedContextStrategy(SourceDescriptor source, StrategyContext context) {
        super(source, context);
        this.iframeSelector = source.requireSelector(SourceKeys.IFRAME);
        this.jobLinkSelector = source.requireSelector(SourceKeys.JOB_LINK);
        this.nextPageSelector = source.selector(SourceKeys.NEXT_PAGE);
        this.nextPageDisabledSelector = source.selector(SourceKeys.NEXT_PAGE_DISABLED);
        this.frameSettle = Duration.ofMillis(Math.max(0, source.intSetting(SourceKeys.FRAME_SETTLE_MS, DEFAULT_FRAME_SETTLE_MS)));
    }

    @Override
    public Optional<String> readySelector() {
        return Optional.of(iframeSelector);
    }

    @Override
    public void prepareSession(CrawlSession session) {
        log.debug("Looking for iframe: {}", iframeSelector);
        Optional<PageHandle> entered;
        try {
            entered = session.page().enterFrame(iframeSelector);
        } catch (NavigationException e) {
            throw new SelectorException(
                FailureReason.NESTED_CONTEXT_UNAVAILABLE,
                iframeSelector,
                "Could not load iframe '" + iframeSelector + "': " + e.getMessage()
            );
        }
        if (entered.isEmpty()) {
            throw new SelectorException(
                FailureReason.NESTED_CONTEXT_UNAVAILABLE,
                iframeSelector,
                "Iframe '" + iframeSelector + "' not found on " + session.page().currentUrl()
            );
        }
        frame = entered.get();
        log.info("Successfully entered iframe for {}", source.name());
    }

    @Override
    public List<String> extractItemLinks(CrawlSession session) {
        settle(frameSettle);
        List<String> links = hrefsOf(frame().selectAll(jobLinkSelector));
        log.debug("Extracted {} job links from iframe", links.size());
        return links;
    }

    @Override
    public boolean advanceToNextPage(CrawlSession session) {
        if (reachedEnd) {
            return false;
        }
        if (nextPageSelector.isEmpty()) {
            log.debug("No pagination configured for {}", source.name());
            reachedEnd = true;
            return false;
        }
        PageHandle current = frame();
        if (nextPageDisabledSelector.isPresent() && current.selectOne(nextPageDisabledSelector.get()).isPresent()) {
            log.info("Reached last page - next button is disabled");
            reachedEnd = true;
            return false;
        }
        Optional<PageElement> nextButton = current.selectOne(nextPageSelector.get());
        if (nextButton.isEmpty()) {
            log.info("No more next button found in iframe");
            reachedEnd = true;
            return false;
        }
        try {
            frame = current.click(nextButton.get());
        } catch (SelectorException e) {
            log.error("Error clicking next button in iframe for {}: {}", source.name(), e.getMessage());
            reachedEnd = true;
            return false;
        }
        settle();
        log.debug("Successfully navigated to next page in iframe");
        return true;
    }

    private PageHandle frame() {
        if (frame == null) {
            throw new IllegalStateException("Iframe context not entered for " + source.name());
        }
        return frame;
    }
}
