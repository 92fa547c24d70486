package com.delta.jobscraper.crawl.catalog;

import com.delta.jobscraper.crawl.model.BackendType;
import com.delta.jobscraper.crawl.model.SourceDescriptor;

import java.util.List;

public record SourceGroup(String name, BackendType backendType, boolean enabled, List<SourceDescriptor> sites) {
    public SourceGroup {
        sites = sites == null ? List.of() : List.copyOf(sites);
    }

    public List<SourceDescriptor> enabledSites() {
        if (!enabled) {
            return List.of();
        }
        return sites.stream().filter(SourceDescriptor::enabled).toList();
    }
}
