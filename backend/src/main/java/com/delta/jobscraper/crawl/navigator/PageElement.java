package com.delta.jobscraper.crawl.navigator;

import java.util.List;

public interface PageElement {
    /**
     * Raw attribute value, or {@code null} when the element has no such attribute.
     */
    String attribute(String name);

    /**
     * Attribute value resolved against the page URL, or an empty string when it cannot be resolved.
     */
    String absoluteUrl(String attribute);

    String text();

    List<PageElement> selectAll(String selector);
}
