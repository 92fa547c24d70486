package com.delta.jobscraper.crawl.catalog;

import com.delta.jobscraper.crawl.error.ConfigurationException;
import com.delta.jobscraper.crawl.model.BackendType;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the sources file: a list of job board groups, each with a backend type, shared selectors and
 * settings, and its sites. Site-level selectors and settings override the group's.
 */
@Component
public class SourceCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(SourceCatalogLoader.class);

    private final ObjectMapper yamlMapper;

    public SourceCatalogLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public SourceCatalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            SourceCatalog catalog = parse(in);
            log.info("Loaded {} groups and {} sites from {}", catalog.groups().size(), catalog.totalSites(), path);
            return catalog;
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("Sources file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read sources file " + path + ": " + e.getMessage(), e);
        }
    }

    public SourceCatalog parse(InputStream in) throws IOException {
        CatalogFile file = yamlMapper.readValue(in, CatalogFile.class);
        if (file == null || file.jobBoards() == null) {
            throw new ConfigurationException("Sources file has no 'job_boards' list");
        }

        List<SourceGroup> groups = new ArrayList<>();
        Set<String> siteNames = new HashSet<>();
        for (GroupEntry entry : file.jobBoards()) {
            groups.add(toGroup(entry, siteNames));
        }
        return new SourceCatalog(groups);
    }

    private SourceGroup toGroup(GroupEntry entry, Set<String> siteNames) {
        String groupName = requireText(entry.group(), "Job board group is missing 'group'");
        if (entry.type() == null || entry.type().isBlank()) {
            throw new ConfigurationException("Group '" + groupName + "' is missing 'type'");
        }
        BackendType backendType = BackendType.fromConfigKey(entry.type())
            .orElseThrow(() -> new ConfigurationException(
                "Unknown scraper type '" + entry.type() + "' for group '" + groupName + "'; known types: " + BackendType.knownKeys()
            ));
        boolean groupEnabled = entry.enabled() == null || entry.enabled();

        List<SourceDescriptor> sites = new ArrayList<>();
        for (SiteEntry site : entry.sites() == null ? List.<SiteEntry>of() : entry.sites()) {
            String name = requireText(site.name(), "Site in group '" + groupName + "' is missing 'name'");
            String url = requireText(site.url(), "Site '" + name + "' is missing 'url'");
            if (!siteNames.add(name)) {
                throw new ConfigurationException("Duplicate site name '" + name + "'");
            }
            sites.add(new SourceDescriptor(
                name,
                url,
                groupName,
                backendType,
                stringValues(merge(entry.selectors(), site.selectors())),
                merge(entry.settings(), site.settings()),
                site.enabled() == null || site.enabled()
            ));
        }
        return new SourceGroup(groupName, backendType, groupEnabled, sites);
    }

    private static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>();
        putNonNull(merged, base);
        putNonNull(merged, overrides);
        return merged;
    }

    private static void putNonNull(Map<String, Object> target, Map<String, Object> source) {
        if (source == null) {
            return;
        }
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                target.put(key, value);
            }
        });
    }

    private static Map<String, String> stringValues(Map<String, Object> values) {
        Map<String, String> result = new LinkedHashMap<>();
        values.forEach((key, value) -> result.put(key, value.toString()));
        return result;
    }

    private static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(message);
        }
        return value.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogFile(@JsonProperty("job_boards") List<GroupEntry> jobBoards) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GroupEntry(
        String group,
        String type,
        Boolean enabled,
        Map<String, Object> selectors,
        Map<String, Object> settings,
        List<SiteEntry> sites
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SiteEntry(
        String name,
        String url,
        Boolean enabled,
        Map<String, Object> selectors,
        Map<String, Object> settings
    ) {}
}
