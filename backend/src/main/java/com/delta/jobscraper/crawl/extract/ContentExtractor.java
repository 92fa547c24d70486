package com.delta.jobscraper.crawl.extract;

public interface ContentExtractor {
    /**
     * Clean text of the page, or an empty string when nothing readable was found.
     */
    String extract(String html, String url);
}
