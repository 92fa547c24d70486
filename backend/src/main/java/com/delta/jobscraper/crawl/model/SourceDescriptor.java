package com.delta.jobscraper.crawl.model;

import com.delta.jobscraper.crawl.error.ConfigurationException;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public record SourceDescriptor(
    String name,
    String url,
    String group,
    BackendType backendType,
    Map<String, String> selectors,
    Map<String, Object> settings,
    boolean enabled
) {
    public SourceDescriptor {
        selectors = selectors == null ? Map.of() : Map.copyOf(selectors);
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public Optional<String> selector(String key) {
        String value = selectors.get(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public String requireSelector(String key) {
        return selector(key).orElseThrow(() -> new ConfigurationException(
            "Source '" + name + "' (" + backendType.configKey() + ") requires selector '" + key + "'"
        ));
    }

    public Optional<String> stringSetting(String key) {
        Object value = settings.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public int intSetting(String key, int defaultValue) {
        Object value = settings.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Source '" + name + "' setting '" + key + "' is not an integer: " + value, e);
        }
    }

    public double doubleSetting(String key, double defaultValue) {
        Object value = settings.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Source '" + name + "' setting '" + key + "' is not a number: " + value, e);
        }
    }

    public boolean booleanSetting(String key, boolean defaultValue) {
        Object value = settings.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> throw new ConfigurationException(
                "Source '" + name + "' setting '" + key + "' is not a boolean: " + value
            );
        };
    }
}
