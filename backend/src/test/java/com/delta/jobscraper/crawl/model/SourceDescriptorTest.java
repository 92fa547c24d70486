package com.delta.jobscraper.crawl.model;

import com.delta.jobscraper.crawl.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceDescriptorTest {

    @Test
    void settingsAcceptNumbersAndText() {
        SourceDescriptor source = TestSources.source("acme", BackendType.URL_TEMPLATE, "https://acme.example",
            Map.of("job_table", "table"),
            Map.of("max_pages", "7", "sleep_between_jobs", 1.5, "handle_cookies", "yes", "start_page", 0));

        assertThat(source.intSetting("max_pages", 0)).isEqualTo(7);
        assertThat(source.intSetting("start_page", 1)).isZero();
        assertThat(source.intSetting("missing", 3)).isEqualTo(3);
        assertThat(source.doubleSetting("sleep_between_jobs", 0)).isEqualTo(1.5);
        assertThat(source.booleanSetting("handle_cookies", false)).isTrue();
    }

    @Test
    void blankSelectorCountsAsAbsent() {
        SourceDescriptor source = TestSources.source("acme", BackendType.SELECTOR_PAGINATION, "https://acme.example",
            Map.of("job_link", "a.job", "next_page", " "));

        assertThat(source.selector("next_page")).isEmpty();
        assertThatThrownBy(() -> source.requireSelector("next_page"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("acme")
            .hasMessageContaining("next_page");
    }

    @Test
    void malformedSettingIsAConfigurationError() {
        SourceDescriptor source = TestSources.source("acme", BackendType.SELECTOR_PAGINATION, "https://acme.example",
            Map.of("job_link", "a"), Map.of("max_pages", "lots", "early_stop_enabled", "sometimes"));

        assertThatThrownBy(() -> source.intSetting("max_pages", 0))
            .isInstanceOf(ConfigurationException.class)
            .satisfies(e -> assertThat(((ConfigurationException) e).reason()).isEqualTo(FailureReason.CONFIGURATION_ERROR));
        assertThatThrownBy(() -> source.booleanSetting("early_stop_enabled", true))
            .isInstanceOf(ConfigurationException.class);
    }
}
