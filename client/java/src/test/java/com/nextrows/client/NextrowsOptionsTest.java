package com.nextrows.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class NextrowsOptionsTest {

    @Test
    void appliesDefaults() {
        NextrowsOptions options = NextrowsOptions.of("sk-nr-key");

        assertEquals("https://api.nextrows.com", options.baseUrl());
        assertEquals(Duration.ofMillis(30_000), options.timeout());
    }

    @Test
    void stripsTrailingSlashesFromBaseUrl() {
        NextrowsOptions options = NextrowsOptions.builder()
                .apiKey("sk-nr-key")
                .baseUrl("https://custom.api.com//")
                .timeoutMillis(60_000)
                .build();

        assertEquals("https://custom.api.com", options.baseUrl());
        assertEquals(Duration.ofSeconds(60), options.timeout());
    }

    @Test
    void rejectsMissingKeyAndNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> NextrowsOptions.of(" "));
        assertThrows(IllegalArgumentException.class,
                () -> NextrowsOptions.builder().apiKey("sk-nr-key").timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> NextrowsOptions.builder().apiKey("sk-nr-key").baseUrl("  ").build());
    }

    @Test
    void toStringMasksApiKey() {
        String rendered = NextrowsOptions.of("sk-nr-secret-1234").toString();

        assertFalse(rendered.contains("secret"));
        assertTrue(rendered.contains("****1234"));
    }
}
