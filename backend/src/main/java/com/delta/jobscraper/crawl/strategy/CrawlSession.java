package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.model.CrawlStats;
import com.delta.jobscraper.crawl.model.DownloadStats;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.navigator.PageHandle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State of one crawl. Owned by the thread running that crawl and discarded when it returns.
 */
public class CrawlSession {
    private final SourceDescriptor source;
    private final Collection<String> collectedLinks;
    private final Set<String> processedUrls = new HashSet<>();
    private PageHandle page;
    private int pageNumber = 1;
    private int pagesScraped;
    private int newCount;
    private int cachedCount;
    private boolean earlyStopped;
    private int errors;
    private int warnings;
    private DownloadStats inlineDownloads;

    public CrawlSession(SourceDescriptor source, boolean deduplicateLinks) {
        this.source = source;
        this.collectedLinks = deduplicateLinks ? new LinkedHashSet<>() : new ArrayList<>();
    }

    public SourceDescriptor source() {
        return source;
    }

    public PageHandle page() {
        if (page == null) {
            throw new IllegalStateException("No page loaded for " + source.name());
        }
        return page;
    }

    public void setPage(PageHandle page) {
        this.page = page;
    }

    public boolean hasPage() {
        return page != null;
    }

    public int pageNumber() {
        return pageNumber;
    }

    public void advancePage() {
        pageNumber++;
    }

    public void recordBatch(List<String> links, int newInBatch, int cachedInBatch) {
        collectedLinks.addAll(links);
        pagesScraped = pageNumber;
        newCount += newInBatch;
        cachedCount += cachedInBatch;
    }

    public boolean hasCollected(String link) {
        return collectedLinks.contains(link);
    }

    public List<String> collectedLinks() {
        return List.copyOf(collectedLinks);
    }

    public boolean isProcessed(String key) {
        return processedUrls.contains(key);
    }

    public boolean markProcessed(String key) {
        return processedUrls.add(key);
    }

    public void markEarlyStopped() {
        earlyStopped = true;
    }

    public boolean earlyStopped() {
        return earlyStopped;
    }

    public void incrementErrors() {
        errors++;
    }

    public void incrementWarnings() {
        warnings++;
    }

    public void recordInlineDownloads(DownloadStats stats) {
        this.inlineDownloads = stats;
    }

    public DownloadStats inlineDownloads() {
        return inlineDownloads == null ? DownloadStats.empty() : inlineDownloads;
    }

    public int jobsFound() {
        return inlineDownloads == null ? collectedLinks.size() : inlineDownloads.total();
    }

    public CrawlStats stats() {
        return new CrawlStats(pagesScraped, jobsFound(), newCount, cachedCount, earlyStopped, errors, warnings);
    }
}
