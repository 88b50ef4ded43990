package com.civics.ingest.connector;

import com.civics.ingest.core.model.Provider;
import com.civics.ingest.ratelimit.QuotaPolicy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Per-provider connection and throttle settings, supplied from configuration.
 */
public final class ProviderSettings {

    public static final int DEFAULT_REQUESTS_PER_WINDOW = 5000;
    public static final Duration DEFAULT_WINDOW = Duration.ofDays(1);
    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofMillis(250);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_PAGE_SIZE = 100;

    private final Provider provider;
    private final String apiKey;
    private final String baseUrl;
    private final int requestsPerWindow;
    private final Duration window;
    private final Duration minInterval;
    private final Duration acquireTimeout;
    private final Duration requestTimeout;
    private final int pageSize;
    private final List<String> jurisdictions;
    private final boolean enabled;

    private ProviderSettings(Builder builder) {
        this.provider = Objects.requireNonNull(builder.provider, "provider is required");
        this.apiKey = builder.apiKey;
        this.baseUrl = builder.baseUrl;
        this.requestsPerWindow = builder.requestsPerWindow;
        this.window = builder.window;
        this.minInterval = builder.minInterval;
        this.acquireTimeout = builder.acquireTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.pageSize = builder.pageSize;
        this.jurisdictions = List.copyOf(builder.jurisdictions);
        this.enabled = builder.enabled;
    }

    public Provider provider() {
        return provider;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Duration minInterval() {
        return minInterval;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public int pageSize() {
        return pageSize;
    }

    public List<String> jurisdictions() {
        return jurisdictions;
    }

    public boolean enabled() {
        return enabled;
    }

    public QuotaPolicy quotaPolicy() {
        return new QuotaPolicy(requestsPerWindow, window, minInterval, acquireTimeout,
                QuotaPolicy.DEFAULT_BASE_BACKOFF, QuotaPolicy.DEFAULT_MAX_BACKOFF);
    }

    @Override
    public String toString() {
        return "ProviderSettings{provider=" + provider.key() +
                ", baseUrl='" + baseUrl + '\'' +
                ", apiKey=" + (hasApiKey() ? "***" : "<missing>") +
                ", budget=" + requestsPerWindow + "/" + window +
                ", minInterval=" + minInterval +
                ", enabled=" + enabled +
                '}';
    }

    public static Builder builder(Provider provider) {
        return new Builder(provider);
    }

    public static class Builder {
        private final Provider provider;
        private String apiKey;
        private String baseUrl;
        private int requestsPerWindow = DEFAULT_REQUESTS_PER_WINDOW;
        private Duration window = DEFAULT_WINDOW;
        private Duration minInterval = DEFAULT_MIN_INTERVAL;
        private Duration acquireTimeout = QuotaPolicy.DEFAULT_ACQUIRE_TIMEOUT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private List<String> jurisdictions = List.of();
        private boolean enabled = true;

        private Builder(Provider provider) {
            this.provider = provider;
            this.baseUrl = provider != null ? defaultBaseUrl(provider) : null;
        }

        private static String defaultBaseUrl(Provider provider) {
            return switch (provider) {
                case FEDERAL_ROSTER -> FederalRosterConnector.DEFAULT_BASE_URL;
                case STATE_LEGISLATURE -> StateLegislatureConnector.DEFAULT_BASE_URL;
                case CIVIC_LOOKUP -> CivicLookupConnector.DEFAULT_BASE_URL;
                case CAMPAIGN_FINANCE -> CampaignFinanceConnector.DEFAULT_BASE_URL;
            };
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder requestsPerWindow(int requestsPerWindow) {
            this.requestsPerWindow = requestsPerWindow;
            return this;
        }

        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        public Builder minInterval(Duration minInterval) {
            this.minInterval = minInterval;
            return this;
        }

        public Builder acquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder jurisdictions(List<String> jurisdictions) {
            this.jurisdictions = jurisdictions != null ? jurisdictions : List.of();
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public ProviderSettings build() {
            if (requestsPerWindow <= 0) {
                throw new IllegalArgumentException("requestsPerWindow must be > 0");
            }
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be > 0");
            }
            return new ProviderSettings(this);
        }
    }
}
