package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceKeys;
import com.delta.jobscraper.crawl.navigator.PageElement;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Boards paginated through a query parameter (CareerPlug style). The listing ends at the first page
 * whose table holds no links.
 */
public class UrlTemplateStrategy extends AbstractCrawlStrategy {
    static final String DEFAULT_URL_PATTERN = "{base_url}?page={page_num}";
    private static final String DEFAULT_JOB_LINK = "a";

    private final String jobTableSelector;
    private final String jobLinkSelector;
    private final String urlPattern;
    private final double waitMinSeconds;
    private final double waitMaxSeconds;
    private int currentPageNum;

    public UrlTemplateStrategy(SourceDescriptor source, StrategyContext context) {
        super(source, context);
        this.jobTableSelector = source.requireSelector(SourceKeys.JOB_TABLE);
        this.jobLinkSelector = source.selector(SourceKeys.JOB_LINK).orElse(DEFAULT_JOB_LINK);
        this.urlPattern = source.stringSetting(SourceKeys.URL_PATTERN).orElse(DEFAULT_URL_PATTERN);
        this.waitMinSeconds = source.doubleSetting(SourceKeys.WAIT_BETWEEN_PAGES_MIN, 0);
        this.waitMaxSeconds = source.doubleSetting(SourceKeys.WAIT_BETWEEN_PAGES_MAX, 0);
        this.currentPageNum = source.intSetting(SourceKeys.START_PAGE, 1);
    }

    @Override
    public Optional<String> readySelector() {
        return Optional.of(jobTableSelector);
    }

    @Override
    public boolean reportsEmptyFirstPage() {
        return false;
    }

    @Override
    public List<String> extractItemLinks(CrawlSession session) {
        Optional<PageElement> table = session.page().selectOne(jobTableSelector);
        if (table.isEmpty()) {
            log.debug("Job table '{}' not present on page {}", jobTableSelector, currentPageNum);
            return List.of();
        }
        List<String> links = hrefsOf(table.get().selectAll(jobLinkSelector));
        log.debug("Extracted {} job links from page {}", links.size(), currentPageNum);
        return links;
    }

    @Override
    public boolean advanceToNextPage(CrawlSession session) {
        currentPageNum++;
        String nextUrl = pageUrl(currentPageNum);
        log.debug("Navigating to page {}: {}", currentPageNum, nextUrl);
        session.setPage(context.navigator().navigate(nextUrl));
        politeWait();
        return true;
    }

    String pageUrl(int pageNum) {
        return urlPattern
            .replace("{base_url}", source.url())
            .replace("{page_num}", Integer.toString(pageNum));
    }

    int currentPageNum() {
        return currentPageNum;
    }

    private void politeWait() {
        if (waitMinSeconds <= 0 || waitMaxSeconds <= 0) {
            return;
        }
        double seconds = waitMaxSeconds > waitMinSeconds
            ? ThreadLocalRandom.current().nextDouble(waitMinSeconds, waitMaxSeconds)
            : waitMinSeconds;
        log.debug("Waiting {} seconds before next page...", String.format("%.1f", seconds));
        settle(Duration.ofMillis((long) (seconds * 1000)));
    }
}
