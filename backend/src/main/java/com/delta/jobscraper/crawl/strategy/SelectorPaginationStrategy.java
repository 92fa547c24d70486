package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.error.SelectorException;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceKeys;
import com.delta.jobscraper.crawl.navigator.PageElement;
import com.delta.jobscraper.crawl.navigator.PageHandle;

import java.util.List;
import java.util.Optional;

/**
 * Boards with a clickable "next" control on the top-level document (Workday, ApplicantPro and alike).
 */
public class SelectorPaginationStrategy extends AbstractCrawlStrategy {
    private final String jobLinkSelector;
    private final Optional<String> nextPageSelector;
    private final Optional<String> nextPageDisabledSelector;
    private boolean reachedEnd;

    public SelectorPaginationStrategy(SourceDescriptor source, StrategyContext context) {
        super(source, context);
        this.jobLinkSelector = source.requireSelector(SourceKeys.JOB_LINK);
        this.nextPageSelector = source.selector(SourceKeys.NEXT_PAGE);
        this.nextPageDisabledSelector = source.selector(SourceKeys.NEXT_PAGE_DISABLED);
    }

    @Override
    public Optional<String> readySelector() {
        return Optional.of(jobLinkSelector);
    }

    @Override
    public List<String> extractItemLinks(CrawlSession session) {
        List<String> links = hrefsOf(session.page().selectAll(jobLinkSelector));
        log.debug("Extracted {} job links using selector: {}", links.size(), jobLinkSelector);
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

        PageHandle page = session.page();
        // a disabled control is checked before an absent one; a slow button is not the last page
        if (nextPageDisabledSelector.isPresent() && page.selectOne(nextPageDisabledSelector.get()).isPresent()) {
            log.info("Reached last page - next button is disabled");
            reachedEnd = true;
            return false;
        }

        Optional<PageElement> nextButton = page.selectOne(nextPageSelector.get());
        if (nextButton.isEmpty()) {
            log.info("No more next button found");
            reachedEnd = true;
            return false;
        }

        try {
            session.setPage(page.click(nextButton.get()));
        } catch (SelectorException e) {
            log.error("Error clicking next button for {}: {}", source.name(), e.getMessage());
            reachedEnd = true;
            return false;
        }
        settle();
        log.debug("Successfully navigated to next page");
        return true;
    }
}
