package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.cache.CacheStore;
import com.delta.jobscraper.crawl.error.NavigationException;
import com.delta.jobscraper.crawl.extract.JsoupContentExtractor;
import com.delta.jobscraper.crawl.model.BackendType;
import com.delta.jobscraper.crawl.model.SourceDescriptor;
import com.delta.jobscraper.crawl.navigator.StaticPageNavigator;
import com.delta.jobscraper.crawl.util.RecordingSleeper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static com.delta.jobscraper.crawl.model.TestSources.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlTemplateStrategyTest {
    private static final String BASE = "https://plug.example/jobs";

    @TempDir
    Path cacheDir;

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final StaticPageNavigator navigator = new StaticPageNavigator()
        .page(BASE, """
            <a href="/about">About</a>
            <table id="job_table"><tr><td><a href="/jobs/1">1</a></td></tr><tr><td><a href="/jobs/2">2</a></td></tr></table>
            """)
        .page(BASE + "?page=2", "<table id=\"job_table\"><tr><td><a href=\"/jobs/3\">3</a></td></tr></table>")
        .page(BASE + "?page=3", "<table id=\"job_table\"></table>");

    @Test
    void linksAreScopedToTheJobTable() {
        UrlTemplateStrategy strategy = new UrlTemplateStrategy(plugSource(Map.of()), context());

        assertThat(strategy.extractItemLinks(sessionAt(BASE)))
            .containsExactly("https://plug.example/jobs/1", "https://plug.example/jobs/2");
    }

    @Test
    void advancesByFormattingThePageNumberUntilAnEmptyPage() {
        UrlTemplateStrategy strategy = new UrlTemplateStrategy(plugSource(Map.of()), context());
        CrawlSession session = sessionAt(BASE);

        assertThat(strategy.advanceToNextPage(session)).isTrue();
        assertThat(session.page().currentUrl()).isEqualTo(BASE + "?page=2");
        assertThat(strategy.extractItemLinks(session)).containsExactly("https://plug.example/jobs/3");
        assertThat(strategy.advanceToNextPage(session)).isTrue();
        assertThat(strategy.extractItemLinks(session)).isEmpty();
        assertThat(strategy.reportsEmptyFirstPage()).isFalse();
    }

    @Test
    void startPageAndPatternAreConfigurable() {
        UrlTemplateStrategy strategy = new UrlTemplateStrategy(
            plugSource(Map.of("start_page", 0, "url_pattern", "{base_url}/p/{page_num}")),
            context()
        );

        assertThat(strategy.currentPageNum()).isZero();
        assertThat(strategy.pageUrl(4)).isEqualTo(BASE + "/p/4");
    }

    @Test
    void unreachableNextPageFailsTheCrawl() {
        UrlTemplateStrategy strategy = new UrlTemplateStrategy(
            plugSource(Map.of("url_pattern", "https://plug.example/missing?page={page_num}")),
            context()
        );
        CrawlSession session = sessionAt(BASE);

        assertThatThrownBy(() -> strategy.advanceToNextPage(session))
            .isInstanceOf(NavigationException.class)
            .hasMessageContaining("https://plug.example/missing?page=2");
        assertThat(session.page().currentUrl()).isEqualTo(BASE);
    }

    @Test
    void waitsARandomIntervalBetweenPages() {
        UrlTemplateStrategy strategy = new UrlTemplateStrategy(
            plugSource(Map.of("wait_between_pages_min", 1, "wait_between_pages_max", 2)),
            context()
        );

        assertThat(strategy.advanceToNextPage(sessionAt(BASE))).isTrue();
        assertThat(sleeper.sleeps()).singleElement()
            .satisfies(wait -> assertThat(wait).isBetween(Duration.ofSeconds(1), Duration.ofSeconds(2)));
    }

    private SourceDescriptor plugSource(Map<String, Object> settings) {
        return source("dealer", BackendType.URL_TEMPLATE, BASE, Map.of("job_table", "#job_table"), settings);
    }

    private CrawlSession sessionAt(String url) {
        CrawlSession session = new CrawlSession(plugSource(Map.of()), false);
        session.setPage(navigator.navigate(url));
        return session;
    }

    private StrategyContext context() {
        return new StrategyContext(
            navigator,
            sleeper,
            Duration.ZERO,
            new CacheStore(cacheDir),
            new JsoupContentExtractor(),
            3,
            Duration.ofSeconds(4)
        );
    }
}
