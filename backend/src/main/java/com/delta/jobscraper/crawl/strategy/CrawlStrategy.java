package com.delta.jobscraper.crawl.strategy;

import java.util.List;
import java.util.Optional;

/**
 * Pagination and extraction mechanics of one backend type.
 */
public interface CrawlStrategy {

    /**
     * Runs once after the seed page has loaded. A failure here ends the crawl.
     */
    default void prepareSession(CrawlSession session) {
    }

    /**
     * Links visible on the current page. An empty list is a valid answer.
     */
    List<String> extractItemLinks(CrawlSession session);

    /**
     * Moves to the next page; {@code false} when there is none.
     */
    boolean advanceToNextPage(CrawlSession session);

    /**
     * Selector whose presence signals that the seed page has rendered.
     */
    default Optional<String> readySelector() {
        return Optional.empty();
    }

    default boolean deduplicatesLinks() {
        return false;
    }

    /**
     * Whether an empty first page means the link selector never matched.
     */
    default boolean reportsEmptyFirstPage() {
        return true;
    }

    /**
     * Whether extraction stores items itself, replacing the separate download phase.
     */
    default boolean downloadsInline() {
        return false;
    }
}
