package com.delta.jobscraper.crawl.diagnostics;

import com.delta.jobscraper.crawl.model.SourceDescriptor;

import java.util.Map;

public interface DiagnosticsCollector {
    void report(SourceDescriptor source, String errorType, String message, String pageUrl, Map<String, Object> context);
}
