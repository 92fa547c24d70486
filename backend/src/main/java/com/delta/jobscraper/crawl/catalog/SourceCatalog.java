package com.delta.jobscraper.crawl.catalog;

import com.delta.jobscraper.crawl.model.SourceDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Every configured group and site, disabled ones included. A site is runnable only when both it and
 * its group are enabled.
 */
public record SourceCatalog(List<SourceGroup> groups) {
    public SourceCatalog {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public List<SourceDescriptor> enabledSources() {
        return groups.stream()
            .flatMap(group -> group.enabledSites().stream())
            .toList();
    }

    public Optional<SourceGroup> group(String name) {
        return groups.stream().filter(group -> group.name().equals(name)).findFirst();
    }

    public Optional<SourceDescriptor> site(String name) {
        return groups.stream()
            .flatMap(group -> group.sites().stream())
            .filter(site -> site.name().equals(name))
            .findFirst();
    }

    public int totalSites() {
        return groups.stream().mapToInt(group -> group.sites().size()).sum();
    }
}
