package com.delta.jobscraper.crawl.navigator;

import com.delta.jobscraper.crawl.model.SourceDescriptor;

public interface PageNavigatorFactory {
    PageNavigator open(SourceDescriptor source);
}
