package com.nextrows.client;

import java.time.Duration;

/**
 * Connection settings for a NextRows client.
 *
 * @param apiKey  the API key sent as a Bearer token
 * @param baseUrl the API root, without trailing slash
 * @param timeout applied to connecting and to each request
 */
public record NextrowsOptions(String apiKey, String baseUrl, Duration timeout) {

    public static final String DEFAULT_BASE_URL = "https://api.nextrows.com";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(30_000);

    public NextrowsOptions {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be null or blank");
        }
        if (baseUrl == null) {
            baseUrl = DEFAULT_BASE_URL;
        }
        baseUrl = baseUrl.strip();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (baseUrl.isEmpty()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /**
     * Options with the default base URL and timeout.
     */
    public static NextrowsOptions of(String apiKey) {
        return new NextrowsOptions(apiKey, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "NextrowsOptions[apiKey=" + mask(apiKey) + ", baseUrl=" + baseUrl + ", timeout=" + timeout + "]";
    }

    private static String mask(String key) {
        return key.length() <= 4 ? "****" : "****" + key.substring(key.length() - 4);
    }

    /** Builder for {@link NextrowsOptions}; unset values take the defaults. */
    public static final class Builder {
        private String apiKey;
        private String baseUrl;
        private Duration timeout;

        private Builder() {
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutMillis(long timeoutMillis) {
            return timeout(Duration.ofMillis(timeoutMillis));
        }

        public NextrowsOptions build() {
            return new NextrowsOptions(apiKey, baseUrl, timeout);
        }
    }
}
