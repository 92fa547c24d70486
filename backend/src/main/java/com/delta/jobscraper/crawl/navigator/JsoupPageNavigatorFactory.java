package com.delta.jobscraper.crawl.navigator;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.http.PoliteHttpClient;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.retry.RetryingPageNavigator;
import com.delta.jobscraper.crawl.util.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class JsoupPageNavigatorFactory implements PageNavigatorFactory {
    private final PoliteHttpClient httpClient;
    private final ScraperProperties properties;
    private final Sleeper sleeper;

    public JsoupPageNavigatorFactory(PoliteHttpClient httpClient, ScraperProperties properties, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    @Override
    public PageNavigator open(SourceDescriptor source) {
        return new RetryingPageNavigator(
            new JsoupPageNavigator(httpClient),
            properties.getNavigation().getMaxRetries(),
            Duration.ofMillis(properties.getNavigation().getRetryDelayMs()),
            sleeper
        );
    }
}
