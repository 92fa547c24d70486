package com.delta.jobscraper.crawl.download;

import com.delta.jobscraper.crawl.http.PoliteHttpClient;
import com.delta.jobscraper.crawl.model.HttpFetchResult;

public class HttpFetchStrategy implements FetchStrategy {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;

    public HttpFetchStrategy(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public FetchOutcome fetch(String url) {
        HttpFetchResult result = httpClient.get(url, HTML_ACCEPT);
        if (result.isSuccessful() && result.body() != null) {
            return FetchOutcome.success(result.body(), name());
        }
        return FetchOutcome.failure(result.describeFailure(), name());
    }
}
