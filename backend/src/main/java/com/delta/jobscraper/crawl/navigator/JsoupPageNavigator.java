package com.delta.jobscraper.crawl.navigator;

import com.delta.jobscraper.crawl.error.NavigationException;
import com.delta.jobscraper.crawl.http.PoliteHttpClient;
import com.delta.jobscraper.crawl.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * Navigator for server-rendered boards: pages are fetched over HTTP and parsed with jsoup.
 * Scripts never run, so clicks only work on elements that carry a link.
 */
public class JsoupPageNavigator implements PageNavigator {
    static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;

    public JsoupPageNavigator(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public PageHandle navigate(String url) {
        HttpFetchResult result = httpClient.get(url, HTML_ACCEPT);
        if (!result.isSuccessful() || result.body() == null) {
            throw new NavigationException(url, "Failed to load " + url + ": " + result.describeFailure());
        }
        Document document = Jsoup.parse(result.body(), result.finalUrlOrRequested());
        return new JsoupPageHandle(this, document);
    }
}
