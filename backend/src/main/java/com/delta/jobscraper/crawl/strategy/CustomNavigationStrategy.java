package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.error.SelectorException;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceKeys;
import com.delta.jobscraper.crawl.navigator.PageElement;
import com.delta.jobscraper.crawl.navigator.PageHandle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Boards with their own link-based pagination and a cookie overlay (Virginia state jobs style).
 * Links are deduplicated across pages.
 */
public class CustomNavigationStrategy extends AbstractCrawlStrategy {
    static final List<String> DEFAULT_COOKIE_ACCEPT_SELECTORS = List.of(
        "button[data-action=\"init--explicit-consent-modal#accept\"]",
        "button[aria-label*=accept]",
        "button:containsOwn(Accept)",
        "button:containsOwn(I agree)",
        ".accept-cookies",
        "#accept-cookies"
    );
    private static final Duration COOKIE_SETTLE = Duration.ofSeconds(1);

    private final String jobLinkSelector;
    private final Optional<String> nextPageSelector;
    private final String baseUrl;
    private final Set<String> visitedPages = new HashSet<>();

    public CustomNavigationStrategy(SourceDescriptor source, StrategyContext context) {
        super(source, context);
        this.jobLinkSelector = source.requireSelector(SourceKeys.JOB_LINK);
        this.nextPageSelector = source.selector(SourceKeys.NEXT_PAGE);
        this.baseUrl = source.stringSetting(SourceKeys.BASE_URL).orElse("");
    }

    @Override
    public Optional<String> readySelector() {
        return Optional.of(jobLinkSelector);
    }

    @Override
    public boolean deduplicatesLinks() {
        return true;
    }

    @Override
    public void prepareSession(CrawlSession session) {
        visitedPages.add(session.page().currentUrl());
        if (!source.booleanSetting(SourceKeys.HANDLE_COOKIES, false)) {
            return;
        }
        Optional<String> modalClass = source.selector(SourceKeys.COOKIE_MODAL_CLASS);
        if (modalClass.isEmpty()) {
            return;
        }
        log.debug("Handling cookie consent for modal: {}", modalClass.get());
        if (dismissCookieOverlay(session, modalClass.get())) {
            settle(COOKIE_SETTLE);
        }
    }

    @Override
    public List<String> extractItemLinks(CrawlSession session) {
        List<String> links = hrefsOf(session.page().selectAll(jobLinkSelector));
        log.debug("Extracted {} job links on page {}", links.size(), session.pageNumber());
        return links;
    }

    @Override
    public boolean advanceToNextPage(CrawlSession session) {
        if (nextPageSelector.isEmpty()) {
            log.debug("No pagination configured for {}", source.name());
            return false;
        }
        Optional<PageElement> nextButton = session.page().selectOne(nextPageSelector.get());
        if (nextButton.isEmpty()) {
            log.info("No more next button found");
            return false;
        }
        String nextUrl = resolveNextUrl(nextButton.get());
        if (nextUrl.isBlank()) {
            log.info("Could not get next page URL");
            return false;
        }
        if (!visitedPages.add(nextUrl)) {
            log.warn("Next page {} was already visited for {}; stopping pagination", nextUrl, source.name());
            session.incrementWarnings();
            return false;
        }

        log.debug("Navigating to next page: {}", nextUrl);
        session.setPage(context.navigator().navigate(nextUrl));
        settle();
        return true;
    }

    String resolveNextUrl(PageElement nextButton) {
        String href = nextButton.attribute("href");
        if (href == null || href.isBlank()) {
            return "";
        }
        href = href.trim();
        if (href.startsWith("http")) {
            return href;
        }
        if (!baseUrl.isEmpty()) {
            return baseUrl + href;
        }
        return nextButton.absoluteUrl("href");
    }

    private boolean dismissCookieOverlay(CrawlSession session, String modalClass) {
        PageHandle page = session.page();
        Optional<PageElement> modal = page.selectOne("." + modalClass);
        if (modal.isEmpty()) {
            return false;
        }
        log.debug("Found cookie consent modal");

        for (String selector : acceptSelectors()) {
            try {
                List<PageElement> buttons = modal.get().selectAll(selector);
                if (buttons.isEmpty()) {
                    continue;
                }
                session.setPage(page.click(buttons.get(0)));
                log.info("Accepted cookie consent for {} via {}", source.name(), selector);
                return true;
            } catch (SelectorException e) {
                log.debug("Cookie accept control '{}' not usable: {}", selector, e.getMessage());
            }
        }

        String script = "(() => { const modal = document.querySelector('." + modalClass + "');"
            + " if (modal) { modal.remove(); document.body.style.overflow = 'auto'; return true; }"
            + " return false; })()";
        try {
            Object removed = page.evaluate(script);
            log.debug("Cookie modal removal script returned {}", removed);
            return Boolean.TRUE.equals(removed);
        } catch (UnsupportedOperationException e) {
            log.info("Cookie modal for {} left in place: {}", source.name(), e.getMessage());
            return false;
        }
    }

    private List<String> acceptSelectors() {
        List<String> selectors = new ArrayList<>();
        source.selector(SourceKeys.COOKIE_ACCEPT).ifPresent(selectors::add);
        selectors.addAll(DEFAULT_COOKIE_ACCEPT_SELECTORS);
        return selectors;
    }
}
