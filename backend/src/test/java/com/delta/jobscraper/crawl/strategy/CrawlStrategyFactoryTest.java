package com.delta.jobscraper.crawl.strategy;

import com.delta.jobscraper.crawl.cache.CacheStore;
import com.delta.jobscraper.crawl.error.ConfigurationException;
import com.delta.jobscraper.crawl.extract.JsoupContentExtractor;
import com.delta.jobscraper.crawl.model.BackendType;
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

class CrawlStrategyFactoryTest {
    private static final String URL = "https://board.example/jobs";

    @TempDir
    Path cacheDir;

    @Test
    void createsOneVariantPerBackendType() {
        Map<String, String> selectors = Map.of(
            "job_link", "a",
            "iframe", "iframe",
            "job_table", "table",
            "job_button", "button"
        );

        assertThat(create(BackendType.SELECTOR_PAGINATION, selectors)).isInstanceOf(SelectorPaginationStrategy.class);
        assertThat(create(BackendType.NESTED_CONTEXT, selectors)).isInstanceOf(NestedContextStrategy.class);
        assertThat(create(BackendType.URL_TEMPLATE, selectors)).isInstanceOf(UrlTemplateStrategy.class);
        assertThat(create(BackendType.CLICK_THROUGH, selectors)).isInstanceOf(ClickThroughStrategy.class);
        assertThat(create(BackendType.CUSTOM_NAVIGATION, selectors)).isInstanceOf(CustomNavigationStrategy.class);
    }

    @Test
    void capabilityFlagsDescribeEachVariant() {
        Map<String, String> selectors = Map.of("job_link", "a", "job_table", "table", "job_button", "button");

        assertThat(create(BackendType.CUSTOM_NAVIGATION, selectors).deduplicatesLinks()).isTrue();
        assertThat(create(BackendType.SELECTOR_PAGINATION, selectors).deduplicatesLinks()).isFalse();
        assertThat(create(BackendType.URL_TEMPLATE, selectors).reportsEmptyFirstPage()).isFalse();
        assertThat(create(BackendType.CLICK_THROUGH, selectors).downloadsInline()).isTrue();
        assertThat(create(BackendType.SELECTOR_PAGINATION, selectors).downloadsInline()).isFalse();
    }

    @Test
    void missingRequiredSelectorFailsAtConstruction() {
        assertThatThrownBy(() -> create(BackendType.NESTED_CONTEXT, Map.of("job_link", "a")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("iframe");
        assertThatThrownBy(() -> create(BackendType.URL_TEMPLATE, Map.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("job_table");
        assertThatThrownBy(() -> create(BackendType.CLICK_THROUGH, Map.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("job_button");
    }

    private CrawlStrategy create(BackendType type, Map<String, String> selectors) {
        StrategyContext context = new StrategyContext(
            new StaticPageNavigator(),
            new RecordingSleeper(),
            Duration.ZERO,
            new CacheStore(cacheDir),
            new JsoupContentExtractor(),
            8,
            Duration.ofSeconds(60)
        );
        return CrawlStrategyFactory.create(source("board", type, URL, selectors), context);
    }
}
