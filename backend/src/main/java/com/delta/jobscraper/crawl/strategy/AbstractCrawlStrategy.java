package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.navigator.PageElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

abstract class AbstractCrawlStrategy implements CrawlStrategy {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final SourceDescriptor source;
    protected final StrategyContext context;

    protected AbstractCrawlStrategy(SourceDescriptor source, StrategyContext context) {
        this.source = source;
        this.context = context;
    }

    protected List<String> hrefsOf(List<PageElement> elements) {
        return elements.stream()
            .map(element -> element.absoluteUrl("href"))
            .filter(href -> href != null && !href.isBlank())
            .toList();
    }

    protected void settle(Duration duration) {
        if (duration != null && !duration.isZero() && !duration.isNegative()) {
            context.sleeper().pause(duration);
        }
    }

    protected void settle() {
        settle(context.settle());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(name='" + source.name() + "', type='" + source.backendType().configKey() + "')";
    }
}
