package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.error.CrawlInterruptedException;
import com.delta.jobscraper.crawl.error.DownloadException;
import com.delta.jobscraper.crawl.error.ScraperException;
import com.delta.jobscraper.crawl.error.SelectorException;
import com.delta.jobscraper.crawl.model.DownloadStats;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceKeys;
import com.delta.jobscraper.crawl.navigator.PageElement;
import com.delta.jobscraper.crawl.navigator.PageHandle;
import com.delta.jobscraper.crawl.retry.ConsecutiveErrorBreaker;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Boards whose postings open inline from a button (ADP style). Every posting is clicked, extracted
 * and cached during extraction, so no links are handed to the download phase.
 */
public class ClickThroughStrategy extends AbstractCrawlStrategy {
    static final String DEFAULT_ITEM_URL_PATTERN = "{page_url}#{item_id}";
    private static final Pattern PARAM_PLACEHOLDER = Pattern.compile("\\{param:([^}]+)}");

    private final String jobButtonSelector;
    private final Optional<String> viewAllSelector;
    private final Optional<String> backButtonSelector;
    private final String itemUrlPattern;
    private final boolean clickBackAfterJob;
    private final boolean clickViewAllAfterBack;
    private final ConsecutiveErrorBreaker breaker;
    private boolean processedListing;

    public ClickThroughStrategy(SourceDescriptor source, StrategyContext context) {
        super(source, context);
        this.jobButtonSelector = source.requireSelector(SourceKeys.JOB_BUTTON);
        this.viewAllSelector = source.selector(SourceKeys.VIEW_ALL_BUTTON);
        this.backButtonSelector = source.selector(SourceKeys.BACK_BUTTON);
        this.itemUrlPattern = source.stringSetting(SourceKeys.ITEM_URL_PATTERN).orElse(DEFAULT_ITEM_URL_PATTERN);
        this.clickBackAfterJob = source.booleanSetting(SourceKeys.CLICK_BACK_AFTER_JOB, true);
        this.clickViewAllAfterBack = source.booleanSetting(SourceKeys.CLICK_VIEW_ALL_AFTER_BACK, true);
        this.breaker = new ConsecutiveErrorBreaker(
            source.intSetting(SourceKeys.MAX_CONSECUTIVE_ERRORS, context.maxConsecutiveErrors()),
            context.maxBackoff()
        );
    }

    @Override
    public boolean reportsEmptyFirstPage() {
        return false;
    }

    @Override
    public boolean downloadsInline() {
        return true;
    }

    @Override
    public boolean advanceToNextPage(CrawlSession session) {
        return false;
    }

    @Override
    public List<String> extractItemLinks(CrawlSession session) {
        if (processedListing) {
            return List.of();
        }
        processedListing = true;

        PageHandle listing = clickViewAll(session.page());
        List<PageElement> buttons = listing.selectAll(jobButtonSelector);
        if (buttons.isEmpty()) {
            throw new SelectorException(jobButtonSelector, "No job buttons found with selector '" + jobButtonSelector + "'");
        }
        List<String> buttonIds = new ArrayList<>();
        for (PageElement button : buttons) {
            String id = button.attribute("id");
            if (id != null && !id.isBlank()) {
                buttonIds.add(id);
            }
        }
        log.info("Found {} job buttons for {}", buttonIds.size(), source.name());

        int processed = 0;
        int skippedSession = 0;
        int skippedExisting = 0;
        int errors = 0;
        boolean aborted = false;

        for (String buttonId : buttonIds) {
            Optional<PageElement> button = listing.selectOne("[id=\"" + buttonId + "\"]");
            if (button.isEmpty()) {
                log.warn("Could not find button with ID {}, skipping...", buttonId);
                continue;
            }
            String itemId = itemId(buttonId);
            if (session.isProcessed(itemId)) {
                log.debug("Already processed in this session: {}", itemId);
                skippedSession++;
                continue;
            }
            String itemUrl = itemUrl(listing.currentUrl(), itemId);
            if (context.cacheStore().isCached(source.name(), itemUrl)) {
                log.debug("Skipping already cached: {}", itemUrl);
                skippedExisting++;
                continue;
            }

            try {
                PageHandle detail = listing.click(button.get());
                settle();
                String text = context.extractor().extract(detail.content(), detail.currentUrl());
                if (text == null || text.isBlank()) {
                    throw new DownloadException("No content extracted for job " + itemId);
                }
                context.cacheStore().write(source.name(), itemUrl, text);
                session.markProcessed(itemId);
                processed++;
                breaker.recordSuccess();
                log.info("Processed {}: {}", processed, itemUrl);
                listing = returnToListing(detail, listing);
            } catch (CrawlInterruptedException e) {
                throw e;
            } catch (ScraperException | IOException e) {
                errors++;
                int consecutive = breaker.recordFailure();
                log.warn("Error processing job {} for {}: {} (consecutive errors: {})",
                    buttonId, source.name(), e.getMessage(), consecutive);
                if (breaker.isOpen()) {
                    log.error("Exiting after {} consecutive errors", consecutive);
                    aborted = true;
                    break;
                }
                Duration backoff = breaker.nextBackoff();
                log.info("Waiting {} seconds before next attempt...", backoff.toSeconds());
                settle(backoff);
            }
        }

        session.setPage(listing);
        session.recordInlineDownloads(new DownloadStats(
            buttonIds.size(), processed, skippedSession, skippedExisting, errors, aborted
        ));
        log.info("Processed {} jobs for {}", processed, source.name());
        return List.of();
    }

    static String itemId(String buttonId) {
        int separator = buttonId.indexOf('_');
        if (separator < 0 || separator == buttonId.length() - 1) {
            return buttonId;
        }
        String rest = buttonId.substring(separator + 1);
        int next = rest.indexOf('_');
        return next < 0 ? rest : rest.substring(0, next);
    }

    String itemUrl(String currentUrl, String itemId) {
        String pageUrl = stripQuery(currentUrl);
        String url = itemUrlPattern
            .replace("{page_url}", pageUrl)
            .replace("{item_id}", itemId);
        Matcher matcher = PARAM_PLACEHOLDER.matcher(url);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            String value = queryParameter(currentUrl, matcher.group(1)).orElse("");
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    private PageHandle clickViewAll(PageHandle page) {
        if (viewAllSelector.isEmpty()) {
            return page;
        }
        Optional<PageElement> viewAll = page.selectOne(viewAllSelector.get());
        if (viewAll.isEmpty()) {
            log.debug("No 'View all' button found for {}", source.name());
            return page;
        }
        try {
            PageHandle expanded = page.click(viewAll.get());
            settle();
            log.info("Clicked 'View all' button");
            return expanded;
        } catch (SelectorException e) {
            log.warn("Error clicking 'View all' button for {}: {}", source.name(), e.getMessage());
            return page;
        }
    }

    private PageHandle returnToListing(PageHandle detail, PageHandle listing) {
        if (!clickBackAfterJob || backButtonSelector.isEmpty()) {
            return listing;
        }
        Optional<PageElement> back = detail.selectOne(backButtonSelector.get());
        if (back.isEmpty()) {
            log.debug("Back button '{}' not found; reusing listing page", backButtonSelector.get());
            return listing;
        }
        PageHandle returned = detail.click(back.get());
        settle();
        return clickViewAllAfterBack ? clickViewAll(returned) : returned;
    }

    private static String stripQuery(String url) {
        int cut = url.length();
        int query = url.indexOf('?');
        if (query >= 0) {
            cut = query;
        }
        int fragment = url.indexOf('#');
        if (fragment >= 0 && fragment < cut) {
            cut = fragment;
        }
        return url.substring(0, cut);
    }

    private static Optional<String> queryParameter(String url, String name) {
        String query;
        try {
            query = new URI(url).getRawQuery();
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (query == null) {
            return Optional.empty();
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (URLDecoder.decode(key, StandardCharsets.UTF_8).equals(name)) {
                return Optional.of(eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return Optional.empty();
    }
}
