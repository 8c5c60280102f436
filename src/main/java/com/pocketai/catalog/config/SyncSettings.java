package com.pocketai.catalog.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Hub sync settings read from environment variables. A JVM system property
 * named after the variable in lower-case dotted form
 * ({@code HF_SYNC_FILTER} becomes {@code hf.sync.filter}) takes precedence.
 */
@ApplicationScoped
public class SyncSettings {

    private static final Logger log = LoggerFactory.getLogger(SyncSettings.class);

    public static final String DEFAULT_BASE_URL = "https://huggingface.co";
    public static final String DEFAULT_FILTER = "tflite";
    public static final int DEFAULT_FETCH_LIMIT = 1000;
    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int DEFAULT_HOUR_UTC = 3;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private String hubBaseUrl;
    private String apiToken;
    private String filterLabel;
    private int fetchLimit;
    private int pageSize;
    private int dailyHourUtc;
    private Duration requestTimeout;
    private boolean schedulerEnabled;

    public SyncSettings() {
        this(SyncSettings::lookupEnv);
    }

    public SyncSettings(Map<String, String> values) {
        this(values::get);
    }

    public SyncSettings(Function<String, String> lookup) {
        this.hubBaseUrl = stripTrailingSlash(orDefault(lookup.apply("HF_API_BASE_URL"), DEFAULT_BASE_URL));
        String token = lookup.apply("HF_API_TOKEN");
        this.apiToken = token == null || token.isBlank() ? null : token.trim();
        this.filterLabel = orDefault(lookup.apply("HF_SYNC_FILTER"), DEFAULT_FILTER);
        this.fetchLimit = intSetting(lookup, "HF_SYNC_FETCH_LIMIT", DEFAULT_FETCH_LIMIT, 1);
        this.pageSize = intSetting(lookup, "HF_SYNC_PAGE_SIZE", DEFAULT_PAGE_SIZE, 1);
        this.dailyHourUtc = intSetting(lookup, "HF_SYNC_HOUR_UTC", DEFAULT_HOUR_UTC, 0);
        if (dailyHourUtc > 23) {
            throw new IllegalStateException("HF_SYNC_HOUR_UTC must be between 0 and 23, got " + dailyHourUtc);
        }
        this.requestTimeout = Duration.ofSeconds(
                intSetting(lookup, "HF_SYNC_TIMEOUT_SECONDS", DEFAULT_TIMEOUT_SECONDS, 1));
        String enabled = lookup.apply("HF_SYNC_ENABLED");
        this.schedulerEnabled = enabled == null || enabled.isBlank() || Boolean.parseBoolean(enabled.trim());
    }

    public String getHubBaseUrl() {
        return hubBaseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public String getFilterLabel() {
        return filterLabel;
    }

    public int getFetchLimit() {
        return fetchLimit;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getDailyHourUtc() {
        return dailyHourUtc;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    private static String lookupEnv(String name) {
        String property = System.getProperty(name.toLowerCase(Locale.ROOT).replace('_', '.'));
        return property != null ? property : System.getenv(name);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int intSetting(Function<String, String> lookup, String name, int fallback, int min) {
        String raw = lookup.apply(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min) {
                log.warn("{} must be at least {} (got {}); using default {}", name, min, raw, fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("{} is not a number ({}); using default {}", name, raw, fallback);
            return fallback;
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
