package com.pocketai.catalog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

class SyncSettingsTest {

    @Test
    void defaults_applyWhenNothingConfigured() {
        SyncSettings settings = new SyncSettings(Map.of());

        assertEquals("https://huggingface.co", settings.getHubBaseUrl());
        assertNull(settings.getApiToken());
        assertEquals("tflite", settings.getFilterLabel());
        assertEquals(1000, settings.getFetchLimit());
        assertEquals(100, settings.getPageSize());
        assertEquals(3, settings.getDailyHourUtc());
        assertEquals(Duration.ofSeconds(30), settings.getRequestTimeout());
        assertTrue(settings.isSchedulerEnabled());
    }

    @Test
    void values_areReadAndNormalised() {
        SyncSettings settings = new SyncSettings(Map.of(
                "HF_API_BASE_URL", "http://hub.internal:8080/",
                "HF_API_TOKEN", "  hf_secret ",
                "HF_SYNC_FILTER", "litert",
                "HF_SYNC_FETCH_LIMIT", "50",
                "HF_SYNC_PAGE_SIZE", "25",
                "HF_SYNC_HOUR_UTC", "0",
                "HF_SYNC_TIMEOUT_SECONDS", "5",
                "HF_SYNC_ENABLED", "false"));

        assertEquals("http://hub.internal:8080", settings.getHubBaseUrl());
        assertEquals("hf_secret", settings.getApiToken());
        assertEquals("litert", settings.getFilterLabel());
        assertEquals(50, settings.getFetchLimit());
        assertEquals(25, settings.getPageSize());
        assertEquals(0, settings.getDailyHourUtc());
        assertEquals(Duration.ofSeconds(5), settings.getRequestTimeout());
        assertFalse(settings.isSchedulerEnabled());
    }

    @Test
    void invalidNumbers_fallBackToDefaults() {
        SyncSettings settings = new SyncSettings(Map.of(
                "HF_SYNC_FETCH_LIMIT", "lots",
                "HF_SYNC_PAGE_SIZE", "0",
                "HF_SYNC_TIMEOUT_SECONDS", "-3"));

        assertEquals(SyncSettings.DEFAULT_FETCH_LIMIT, settings.getFetchLimit());
        assertEquals(SyncSettings.DEFAULT_PAGE_SIZE, settings.getPageSize());
        assertEquals(Duration.ofSeconds(SyncSettings.DEFAULT_TIMEOUT_SECONDS), settings.getRequestTimeout());
    }

    @Test
    void hourOutsideDay_isRejected() {
        assertThrows(IllegalStateException.class, () -> new SyncSettings(Map.of("HF_SYNC_HOUR_UTC", "24")));
    }
}
