package com.delta.jobscraper.crawl.service;

import com.delta.jobscraper.config.ScraperProperties;
import com.delta.jobscraper.crawl.cache.CacheStore;
import com.delta.jobscraper.crawl.diagnostics.DiagnosticsCollector;
import com.delta.jobscraper.crawl.driver.CrawlDriver;
import com.delta.jobscraper.crawl.extract.JsoupContentExtractor;
import com.delta.jobscraper.crawl.http.PoliteHttpClient;
import com.delta.jobscraper.crawl.model.BackendType;
import com.delta.jobscraper.crawl.model.FailureReason;
import com.delta.jobscraper.crawl.model.ScrapeResult;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.navigator.StaticPageNavigator;
import com.delta.jobscraper.crawl.util.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class SourceCrawlerServiceTest {
    private static final String LISTING = "https://acme.example/jobs";

    @Mock
    private PoliteHttpClient httpClient;
    @Mock
    private DiagnosticsCollector diagnostics;

    @TempDir
    Path cacheDir;

    private ScraperProperties properties;
    private RecordingSleeper sleeper;
    private CacheStore cacheStore;
    private StaticPageNavigator navigator;
    private AtomicInteger opened;

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        properties.getDownload().setShuffle(false);
        properties.getDownload().setHttpFallback(false);
        properties.getDownload().setMaxConsecutiveErrors(2);
        sleeper = new RecordingSleeper();
        cacheStore = new CacheStore(cacheDir);
        navigator = new StaticPageNavigator();
        opened = new AtomicInteger();
    }

    @Test
    void downloadsEveryListedJobAndClosesTheNavigator() {
        navigator
            .page(LISTING, "<a class=\"job\" href=\"/jobs/1\">One</a><a class=\"job\" href=\"/jobs/2\">Two</a>")
            .page("https://acme.example/jobs/1", "<main><h1>Clerk</h1></main>")
            .page("https://acme.example/jobs/2", "<main><h1>Analyst</h1></main>");

        ScrapeResult result = service().crawl(standard(Map.of("job_link", "a.job")));

        assertThat(result.success()).isTrue();
        assertThat(result.stats().jobsFound()).isEqualTo(2);
        assertThat(result.stats().pagesScraped()).isEqualTo(1);
        assertThat(result.downloadStats().processed()).isEqualTo(2);
        assertThat(cacheStore.isCached("acme", "https://acme.example/jobs/1")).isTrue();
        assertThat(cacheStore.isCached("acme", "https://acme.example/jobs/2")).isTrue();
        assertThat(navigator.isClosed()).isTrue();
    }

    @Test
    void secondRunSkipsCachedJobs() throws Exception {
        navigator
            .page(LISTING, "<a class=\"job\" href=\"/jobs/1\">One</a>")
            .page("https://acme.example/jobs/1", "<main><h1>Clerk</h1></main>");
        cacheStore.write("acme", "https://acme.example/jobs/1", "Clerk");

        ScrapeResult result = service().crawl(standard(Map.of("job_link", "a.job")));

        assertThat(result.success()).isTrue();
        assertThat(result.stats().earlyStopped()).isTrue();
        assertThat(result.downloadStats().skippedExisting()).isEqualTo(1);
        assertThat(result.downloadStats().processed()).isZero();
        assertThat(navigator.visited()).containsExactly(LISTING);
    }

    @Test
    void disabledSourceIsNeverOpened() {
        SourceDescriptor disabled = new SourceDescriptor(
            "acme", LISTING, "workday", BackendType.SELECTOR_PAGINATION, Map.of("job_link", "a"), Map.of(), false);

        ScrapeResult result = service().crawl(disabled);

        assertThat(result.success()).isFalse();
        assertThat(result.failureReason()).isEqualTo(FailureReason.DISABLED);
        assertThat(opened.get()).isZero();
    }

    @Test
    void unreachableListingIsANavigationFailure() {
        ScrapeResult result = service().crawl(standard(Map.of("job_link", "a.job")));

        assertThat(result.failureReason()).isEqualTo(FailureReason.NAVIGATION_FAILED);
        assertThat(result.message()).contains(LISTING);
        assertThat(navigator.isClosed()).isTrue();
    }

    @Test
    void unreachableSecondPageFailsTheSource() {
        navigator
            .page(LISTING, "<table id=\"jobs\"><tr><td><a href=\"/jobs/1\">One</a></td></tr></table>")
            .page("https://acme.example/jobs/1", "<main><h1>Clerk</h1></main>");
        SourceDescriptor paged = new SourceDescriptor(
            "acme", LISTING, "careerplug", BackendType.URL_TEMPLATE, Map.of("job_table", "#jobs"), Map.of(), true);

        ScrapeResult result = service().crawl(paged);

        assertThat(result.success()).isFalse();
        assertThat(result.failureReason()).isEqualTo(FailureReason.NAVIGATION_FAILED);
        assertThat(result.message()).contains(LISTING + "?page=2");
        assertThat(navigator.isClosed()).isTrue();
    }

    @Test
    void missingRequiredSelectorIsAConfigurationError() {
        navigator.page(LISTING, "<p>nothing</p>");

        ScrapeResult result = service().crawl(standard(Map.of("next_page", "a.next")));

        assertThat(result.failureReason()).isEqualTo(FailureReason.CONFIGURATION_ERROR);
        assertThat(result.message()).contains("job_link");
    }

    @Test
    void emptyFirstPageIsASelectorFailure() {
        navigator.page(LISTING, "<p>no openings</p>");

        ScrapeResult result = service().crawl(standard(Map.of("job_link", "a.job")));

        assertThat(result.failureReason()).isEqualTo(FailureReason.SELECTOR_NOT_FOUND);
    }

    @Test
    void repeatedDownloadFailuresAbortTheSource() {
        navigator.page(LISTING,
            "<a class=\"job\" href=\"/jobs/1\">1</a><a class=\"job\" href=\"/jobs/2\">2</a><a class=\"job\" href=\"/jobs/3\">3</a>");

        ScrapeResult result = service().crawl(standard(Map.of("job_link", "a.job")));

        assertThat(result.success()).isFalse();
        assertThat(result.failureReason()).isEqualTo(FailureReason.CONSECUTIVE_ERRORS);
        assertThat(result.downloadStats().aborted()).isTrue();
        assertThat(result.downloadStats().errors()).isEqualTo(2);
        assertThat(navigator.visited()).doesNotContain("https://acme.example/jobs/3");
    }

    private SourceCrawlerService service() {
        CrawlDriver driver = new CrawlDriver(properties, sleeper, diagnostics);
        DownloadService downloadService = new DownloadService(properties, sleeper);
        return new SourceCrawlerService(
            properties,
            source -> {
                opened.incrementAndGet();
                return navigator;
            },
            httpClient,
            cacheStore,
            new JsoupContentExtractor(),
            driver,
            downloadService,
            sleeper
        );
    }

    private static SourceDescriptor standard(Map<String, String> selectors) {
        return new SourceDescriptor("acme", LISTING, "workday", BackendType.SELECTOR_PAGINATION, selectors, Map.of(), true);
    }
}
