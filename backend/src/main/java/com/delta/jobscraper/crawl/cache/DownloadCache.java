package com.delta.jobscraper.crawl.cache;

import com.delta.jobscraper.crawl.download.FetchChain;
import com.delta.jobscraper.crawl.download.FetchOutcome;
import com.delta.jobscraper.crawl.error.CrawlInterruptedException;
import com.delta.jobscraper.crawl.error.DownloadException;
import com.delta.jobscraper.crawl.extract.ContentExtractor;
import com.delta.jobscraper.crawl.model.CacheResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class DownloadCache {
    private static final Logger log = LoggerFactory.getLogger(DownloadCache.class);

    private final CacheStore store;
    private final FetchChain fetchChain;
    private final ContentExtractor extractor;

    public DownloadCache(CacheStore store, FetchChain fetchChain, ContentExtractor extractor) {
        this.store = store;
        this.fetchChain = fetchChain;
        this.extractor = extractor;
    }

    public CacheResult ensureDownloaded(String sourceName, String url) {
        if (store.isCached(sourceName, url)) {
            log.debug("Skipped (cached): {}", url);
            return CacheResult.ALREADY_CACHED;
        }
        try {
            String text = fetchAndExtract(url);
            store.write(sourceName, url, text);
            return CacheResult.DOWNLOADED;
        } catch (CrawlInterruptedException e) {
            throw e;
        } catch (DownloadException | IOException e) {
            log.warn("Error downloading {} for {}: {}", url, sourceName, e.getMessage());
            return CacheResult.FAILED;
        } catch (RuntimeException e) {
            log.warn("Unexpected error downloading {} for {}", url, sourceName, e);
            return CacheResult.FAILED;
        }
    }

    public boolean isCached(String sourceName, String url) {
        return store.isCached(sourceName, url);
    }

    public CacheStore store() {
        return store;
    }

    private String fetchAndExtract(String url) {
        FetchOutcome outcome = fetchChain.fetch(url);
        if (!outcome.succeeded()) {
            throw new DownloadException("Fetch failed for " + url + ": " + outcome.error());
        }
        String text = extractor.extract(outcome.content(), url);
        return text == null || text.isBlank() ? outcome.content() : text;
    }
}
