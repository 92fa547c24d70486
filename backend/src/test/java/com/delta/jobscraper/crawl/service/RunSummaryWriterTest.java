package com.delta.jobscraper.crawl.service;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.model.FailureReason;
import com.delta.jobscraper.crawl.model.RunCounters;
import com.delta.jobscraper.crawl.model.RunSummary;
import com.delta.jobscraper.crawl.model.SourceFailure;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunSummaryWriterTest {

    @TempDir
    Path summaryDir;

    @Test
    void writesReadableJsonIntoTheSummaryDirectory() throws Exception {
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        ScraperProperties properties = new ScraperProperties();
        properties.setSummaryDir(summaryDir.toString());
        RunSummary summary = summary("workday", List.of(
            new SourceFailure("beta", "workday", FailureReason.SELECTOR_NOT_FOUND, "No job links found")
        ));

        Path written = new RunSummaryWriter(mapper, properties).write(summary);

        assertThat(written.getParent()).isEqualTo(summaryDir);
        JsonNode json = mapper.readTree(written.toFile());
        assertThat(json.get("label").asText()).isEqualTo("workday");
        assertThat(json.get("humanDuration").asText()).isEqualTo("1m 5s");
        assertThat(json.get("startedAt").asText()).isEqualTo("2026-03-01T10:00:00Z");
        assertThat(json.at("/counters/sitesProcessed").asInt()).isEqualTo(2);
        assertThat(json.at("/failures/0/reason").asText()).isEqualTo("SELECTOR_NOT_FOUND");
    }

    @Test
    void fileNameCarriesASafeLabelAndTimestamp() {
        assertThat(RunSummaryWriter.fileName(summary("virginia jobs/east", List.of())))
            .matches("scraper_virginia_jobs_east_\\d{4}-\\d{2}-\\d{2}_\\d{6}\\.json");
        assertThat(RunSummaryWriter.fileName(summary(" ", List.of()))).startsWith("scraper_all_");
    }

    private static RunSummary summary(String label, List<SourceFailure> failures) {
        Instant startedAt = Instant.parse("2026-03-01T10:00:00Z");
        return new RunSummary(
            label,
            startedAt,
            startedAt.plusSeconds(65),
            65.0,
            "1m 5s",
            false,
            new RunCounters(2, failures.size(), 10, 8, 2, 0, 1),
            failures,
            List.of()
        );
    }
}
