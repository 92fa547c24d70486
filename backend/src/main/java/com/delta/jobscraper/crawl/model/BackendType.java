package com.delta.jobscraper.crawl.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

public enum BackendType {
    SELECTOR_PAGINATION("standard"),
    NESTED_CONTEXT("iframe"),
    URL_TEMPLATE("url_pagination"),
    CLICK_THROUGH("custom_click"),
    CUSTOM_NAVIGATION("custom_navigation");

    private final String configKey;

    BackendType(String configKey) {
        this.configKey = configKey;
    }

    public String configKey() {
        return configKey;
    }

    public static Optional<BackendType> fromConfigKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.configKey.equals(normalized))
            .findFirst();
    }

    public static String knownKeys() {
        return Arrays.stream(values()).map(BackendType::configKey).collect(Collectors.joining(", "));
    }
}
