package com.delta.jobscraper.crawl.navigator;

import java.util.List;
import java.util.Optional;

/**
 * A loaded page. Query methods read the current document; {@link #click} returns the handle
 * of the page as it stands after the click, which browser-backed handles may implement as {@code this}.
 */
public interface PageHandle {
    String currentUrl();

    Optional<PageElement> selectOne(String selector);

    List<PageElement> selectAll(String selector);

    PageHandle click(PageElement element);

    Object evaluate(String script);

    String content();

    Optional<PageHandle> enterFrame(String selector);
}
