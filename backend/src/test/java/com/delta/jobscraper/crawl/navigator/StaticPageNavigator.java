package com.delta.jobscraper.crawl.navigator;

import com.delta.jobscraper.crawl.error.NavigationException;
import org.jsoup.Jsoup;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves in-memory HTML through the jsoup page handle.
 */
public class StaticPageNavigator implements PageNavigator {
    private final Map<String, String> pages = new HashMap<>();
    private final Map<String, Integer> failuresBeforeSuccess = new HashMap<>();
    private final List<String> visited = new ArrayList<>();
    private boolean closed;

    public StaticPageNavigator page(String url, String html) {
        pages.put(url, html);
        return this;
    }

    public StaticPageNavigator failFirst(String url, int times) {
        failuresBeforeSuccess.put(url, times);
        return this;
    }

    @Override
    public PageHandle navigate(String url) {
        visited.add(url);
        int remaining = failuresBeforeSuccess.getOrDefault(url, 0);
        if (remaining > 0) {
            failuresBeforeSuccess.put(url, remaining - 1);
            throw new NavigationException(url, "Simulated failure loading " + url);
        }
        String html = pages.get(url);
        if (html == null) {
            throw new NavigationException(url, "No page for " + url);
        }
        return new JsoupPageHandle(this, Jsoup.parse(html, url));
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<String> visited() {
        return List.copyOf(visited);
    }

    public boolean isClosed() {
        return closed;
    }
}
