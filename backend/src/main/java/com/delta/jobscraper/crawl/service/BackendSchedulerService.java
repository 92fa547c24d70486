package com.delta.jobscraper.crawl.service;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.error.CrawlInterruptedException;
import com.delta.jobscraper.crawl.error.SchedulerTimeoutException;
import com.delta.jobscraper.crawl.model.BackendType;
import com.delta.jobscraper.crawl.model.FailureReason;
import com.delta.jobscraper.crawl.model.PartitionResult;
import com.delta.jobscraper.crawl.model.RunCounters;
import com.delta.jobscraper.crawl.model.RunSummary;
import com.delta.jobscraper.crawl.model.ScrapeResult;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.model.SourceFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs sources grouped by backend type: one worker per backend, sources of one backend strictly in
 * sequence, each crawl bounded by the per-source timeout.
 */
@Service
public class BackendSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(BackendSchedulerService.class);

    private final SourceCrawlerService sourceCrawlerService;
    private final ExecutorService partitionExecutor;
    private final ExecutorService sourceExecutor;
    private final ScraperProperties properties;

    public BackendSchedulerService(
        SourceCrawlerService sourceCrawlerService,
        @Qualifier("partitionExecutor") ExecutorService partitionExecutor,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor,
        ScraperProperties properties
    ) {
        this.sourceCrawlerService = sourceCrawlerService;
        this.partitionExecutor = partitionExecutor;
        this.sourceExecutor = sourceExecutor;
        this.properties = properties;
    }

    public RunSummary run(String label, List<SourceDescriptor> sources) {
        Instant startedAt = Instant.now();
        Map<BackendType, List<SourceDescriptor>> partitions = partition(sources);
        log.info("Run {}: {} sources in {} backend partitions {}", label, sources.size(), partitions.size(), partitions.keySet());

        List<Future<PartitionResult>> futures = new ArrayList<>();
        for (Map.Entry<BackendType, List<SourceDescriptor>> entry : partitions.entrySet()) {
            futures.add(partitionExecutor.submit(() -> runPartition(entry.getKey(), entry.getValue())));
        }

        RunCounters counters = RunCounters.empty();
        List<ScrapeResult> results = new ArrayList<>();
        boolean interrupted = false;
        for (Future<PartitionResult> future : futures) {
            try {
                PartitionResult partition = future.get();
                counters = counters.plus(partition.counters());
                results.addAll(partition.results());
                log.info("Partition {} finished: {} sources, {} failed",
                    partition.backendType().configKey(), partition.results().size(), partition.counters().sitesFailed());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                log.warn("Run {} interrupted; cancelling outstanding partitions", label);
                futures.forEach(pending -> pending.cancel(true));
                break;
            } catch (ExecutionException e) {
                log.error("Partition worker failed in run {}", label, e.getCause());
            }
        }

        return summarize(label, startedAt, interrupted, counters, results);
    }

    PartitionResult runPartition(BackendType backendType, List<SourceDescriptor> sources) {
        log.info("Starting {} partition with {} sources", backendType.configKey(), sources.size());
        List<ScrapeResult> results = new ArrayList<>();
        RunCounters counters = RunCounters.empty();
        for (SourceDescriptor source : sources) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Partition {} interrupted before {}", backendType.configKey(), source.name());
                break;
            }
            Instant startedAt = Instant.now();
            ScrapeResult result;
            try {
                result = crawlWithTimeout(source);
            } catch (SchedulerTimeoutException e) {
                log.warn("Source {} failed: {} ({})", source.name(), e.reason(), e.getMessage());
                result = ScrapeResult.failed(source, e.reason(), e.getMessage(), null, null, startedAt);
            } catch (CrawlInterruptedException e) {
                result = ScrapeResult.failed(source, e.reason(), e.getMessage(), null, null, startedAt);
                results.add(result);
                counters = counters.plus(RunCounters.of(result));
                break;
            }
            results.add(result);
            counters = counters.plus(RunCounters.of(result));
        }
        return new PartitionResult(backendType, List.copyOf(results), counters);
    }

    private ScrapeResult crawlWithTimeout(SourceDescriptor source) {
        int timeoutSeconds = properties.getScheduler().getSourceTimeoutSeconds();
        Future<ScrapeResult> future = sourceExecutor.submit(() -> sourceCrawlerService.crawl(source));
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SchedulerTimeoutException("Crawl of " + source.name() + " exceeded " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CrawlInterruptedException("Interrupted while crawling " + source.name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Unexpected error crawling {}", source.name(), cause);
            return ScrapeResult.failed(source, FailureReason.UNEXPECTED_ERROR, cause.toString(), null, null, Instant.now());
        }
    }

    static Map<BackendType, List<SourceDescriptor>> partition(List<SourceDescriptor> sources) {
        Map<BackendType, List<SourceDescriptor>> partitions = new LinkedHashMap<>();
        for (SourceDescriptor source : sources) {
            partitions.computeIfAbsent(source.backendType(), ignored -> new ArrayList<>()).add(source);
        }
        return partitions;
    }

    private RunSummary summarize(
        String label,
        Instant startedAt,
        boolean interrupted,
        RunCounters counters,
        List<ScrapeResult> results
    ) {
        Instant finishedAt = Instant.now();
        Duration duration = Duration.between(startedAt, finishedAt);
        List<SourceFailure> failures = results.stream()
            .filter(result -> !result.success())
            .map(result -> new SourceFailure(result.sourceName(), result.group(), result.failureReason(), result.message()))
            .toList();
        RunSummary summary = new RunSummary(
            label,
            startedAt,
            finishedAt,
            duration.toMillis() / 1000.0,
            humanDuration(duration),
            interrupted,
            counters,
            failures,
            List.copyOf(results)
        );
        log.info("Run {} completed in {}: sites={}, failed={}, jobsFound={}, downloaded={}, skipped={}, errors={}, warnings={}",
            label,
            summary.humanDuration(),
            counters.sitesProcessed() + counters.sitesFailed(),
            counters.sitesFailed(),
            counters.jobsFound(),
            counters.jobsDownloaded(),
            counters.jobsSkipped(),
            counters.errors(),
            counters.warnings());
        return summary;
    }

    static String humanDuration(Duration duration) {
        long seconds = Math.max(0, duration.getSeconds());
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
