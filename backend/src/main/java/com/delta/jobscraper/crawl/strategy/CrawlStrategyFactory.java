package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.model.SourceDescriptor;

public final class CrawlStrategyFactory {
    private CrawlStrategyFactory() {
    }

    public static CrawlStrategy create(SourceDescriptor source, StrategyContext context) {
        return switch (source.backendType()) {
            case SELECTOR_PAGINATION -> new SelectorPaginationStrategy(source, context);
            case NESTED_CONTEXT -> new NestedContextStrategy(source, context);
            case URL_TEMPLATE -> new UrlTemplateStrategy(source, context);
            case CLICK_THROUGH -> new ClickThroughStrategy(source, context);
            case CUSTOM_NAVIGATION -> new CustomNavigationStrategy(source, context);
        };
    }
}
