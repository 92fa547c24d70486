package com.delta.jobscraper.crawl.model;

import java.util.Map;

public final class TestSources {
    private TestSources() {
    }

    public static SourceDescriptor source(String name, BackendType type, String url, Map<String, String> selectors) {
        return source(name, type, url, selectors, Map.of());
    }

    public static SourceDescriptor source(
        String name,
        BackendType type,
        String url,
        Map<String, String> selectors,
        Map<String, Object> settings
    ) {
        return new SourceDescriptor(name, url, "test-" + type.configKey(), type, selectors, settings, true);
    }
}
