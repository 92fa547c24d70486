package com.delta.jobscraper.crawl.navigator;

public interface PageNavigator extends AutoCloseable {
    /**
     * Loads the URL. Implementations throw {@link com.delta.jobscraper.crawl.error.NavigationException}
     * when the page cannot be loaded.
     */
    PageHandle navigate(String url);

    @Override
    default void close() {
    }
}
