package com.delta.jobscraper.crawl.service;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.model.RunSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

@Component
public class RunSummaryWriter {
    private static final Logger log = LoggerFactory.getLogger(RunSummaryWriter.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss");

    private final ObjectMapper objectMapper;
    private final ScraperProperties properties;

    public RunSummaryWriter(ObjectMapper objectMapper, ScraperProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public Path write(RunSummary summary) throws IOException {
        Path dir = Path.of(properties.getSummaryDir());
        Files.createDirectories(dir);
        Path target = dir.resolve(fileName(summary));
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), summary);
        log.info("Run summary written to {}", target);
        return target;
    }

    static String fileName(RunSummary summary) {
        String label = summary.label() == null || summary.label().isBlank()
            ? "all"
            : summary.label().replaceAll("[^A-Za-z0-9._-]", "_");
        String timestamp = FILE_TIMESTAMP.format(summary.startedAt().atZone(ZoneId.systemDefault()));
        return "scraper_" + label + "_" + timestamp + ".json";
    }
}
