package com.delta.jobscraper.crawl.service;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.catalog.SourceCatalog;
import com.delta.jobscraper.crawl.catalog.SourceCatalogLoader;
import com.delta.jobscraper.crawl.catalog.SourceGroup;
import com.delta.jobscraper.crawl.error.ConfigurationException;
import com.delta.jobscraper.crawl.model.RunSummary;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Command line entry point. Options: {@code --list}, {@code --group=NAME}, {@code --site=NAME},
 * {@code --config=PATH}, {@code --verbose}. With no selection every enabled site runs.
 */
@Component
public class ScraperCliRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(ScraperCliRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INTERRUPTED = 130;

    private final ScraperProperties properties;
    private final SourceCatalogLoader catalogLoader;
    private final BackendSchedulerService schedulerService;
    private final RunSummaryWriter summaryWriter;
    private int exitCode = EXIT_OK;

    public ScraperCliRunner(
        ScraperProperties properties,
        SourceCatalogLoader catalogLoader,
        BackendSchedulerService schedulerService,
        RunSummaryWriter summaryWriter
    ) {
        this.properties = properties;
        this.catalogLoader = catalogLoader;
        this.schedulerService = schedulerService;
        this.summaryWriter = summaryWriter;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isEnabled()) {
            return;
        }
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        if (args.containsOption("verbose")) {
            LoggingSystem.get(ScraperCliRunner.class.getClassLoader()).setLogLevel("com.delta.jobscraper", LogLevel.DEBUG);
        }
        String group = optionValue(args, "group");
        String site = optionValue(args, "site");
        if (group != null && site != null) {
            log.error("--group and --site cannot be combined");
            return EXIT_FAILURE;
        }

        Path sourcesFile = Path.of(Optional.ofNullable(optionValue(args, "config")).orElse(properties.getSourcesFile()));
        SourceCatalog catalog;
        try {
            catalog = catalogLoader.load(sourcesFile);
        } catch (ConfigurationException e) {
            log.error("Invalid sources file {}: {}", sourcesFile, e.getMessage());
            return EXIT_FAILURE;
        }

        if (args.containsOption("list")) {
            printCatalog(catalog);
            return EXIT_OK;
        }

        String label;
        List<SourceDescriptor> selected;
        if (site != null) {
            Optional<SourceDescriptor> descriptor = catalog.site(site);
            if (descriptor.isEmpty()) {
                log.error("Unknown site '{}'", site);
                return EXIT_FAILURE;
            }
            boolean groupEnabled = catalog.group(descriptor.get().group()).map(SourceGroup::enabled).orElse(false);
            if (!descriptor.get().enabled() || !groupEnabled) {
                log.error("Site '{}' is disabled", site);
                return EXIT_FAILURE;
            }
            label = site;
            selected = List.of(descriptor.get());
        } else if (group != null) {
            Optional<SourceGroup> sourceGroup = catalog.group(group);
            if (sourceGroup.isEmpty()) {
                log.error("Unknown group '{}'", group);
                return EXIT_FAILURE;
            }
            label = group;
            selected = sourceGroup.get().enabledSites();
        } else {
            label = "all";
            selected = catalog.enabledSources();
        }
        if (selected.isEmpty()) {
            log.error("No enabled sites selected for '{}'", label);
            return EXIT_FAILURE;
        }

        RunSummary summary = schedulerService.run(label, selected);
        try {
            summaryWriter.write(summary);
        } catch (IOException e) {
            log.warn("Could not write run summary for {}: {}", label, e.getMessage());
        }
        for (SourceFailure failure : summary.failures()) {
            log.warn("Failed: {} [{}] {} - {}", failure.source(), failure.group(), failure.reason(), failure.message());
        }

        if (summary.interrupted() || Thread.currentThread().isInterrupted()) {
            return EXIT_INTERRUPTED;
        }
        return summary.allSucceeded() ? EXIT_OK : EXIT_FAILURE;
    }

    private void printCatalog(SourceCatalog catalog) {
        int enabled = 0;
        for (SourceGroup group : catalog.groups()) {
            System.out.printf("%s %s (%s)%n", marker(group.enabled()), group.name(), group.backendType().configKey());
            for (SourceDescriptor site : group.sites()) {
                boolean runnable = group.enabled() && site.enabled();
                if (runnable) {
                    enabled++;
                }
                System.out.printf("    %s %s  %s%n", marker(runnable), site.name(), site.url());
            }
        }
        System.out.printf("%d groups, %d sites, %d enabled%n", catalog.groups().size(), catalog.totalSites(), enabled);
    }

    private static String marker(boolean enabled) {
        return enabled ? "[x]" : "[ ]";
    }

    private static String optionValue(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
