package com.civics.ingest.config;

import com.civics.ingest.connector.ProviderSettings;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.lifecycle.LifecyclePolicy;
import com.civics.ingest.lock.LockConfig;
import com.civics.ingest.resolve.ResolverOptions;
import com.civics.ingest.retry.RetryPolicy;
import com.civics.ingest.store.CacheConfig;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed configuration of the ingest engine.
 *
 * <p>Every value has a default, so {@code IngestSettings.defaults()} is a working configuration
 * apart from provider API keys, which must come from the environment.</p>
 */
public class IngestSettings {

    public static final int DEFAULT_CHUNK_SIZE = 100;

    private final ResolverOptions resolverOptions;
    private final RetryPolicy retryPolicy;
    private final LifecyclePolicy lifecyclePolicy;
    private final CacheConfig cacheConfig;
    private final LockConfig lockConfig;
    private final int chunkSize;
    private final Duration runDeadline;
    private final Map<Provider, ProviderSettings> providers;

    private IngestSettings(Builder builder) {
        this.resolverOptions = builder.resolverOptions;
        this.retryPolicy = builder.retryPolicy;
        this.lifecyclePolicy = builder.lifecyclePolicy;
        this.cacheConfig = builder.cacheConfig;
        this.lockConfig = builder.lockConfig;
        this.chunkSize = builder.chunkSize;
        this.runDeadline = builder.runDeadline;
        this.providers = new EnumMap<>(builder.providers);
    }

    public ResolverOptions getResolverOptions() {
        return resolverOptions;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public LifecyclePolicy getLifecyclePolicy() {
        return lifecyclePolicy;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public LockConfig getLockConfig() {
        return lockConfig;
    }

    /**
     * Number of status-changing writes applied per chunk.
     */
    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Default run deadline, measured from run start. Empty means no deadline.
     */
    public Optional<Duration> getRunDeadline() {
        return Optional.ofNullable(runDeadline);
    }

    public Optional<ProviderSettings> getProvider(Provider provider) {
        return Optional.ofNullable(providers.get(provider));
    }

    public Collection<ProviderSettings> getProviders() {
        return providers.values();
    }

    public static IngestSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResolverOptions resolverOptions = ResolverOptions.defaults();
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private LifecyclePolicy lifecyclePolicy = LifecyclePolicy.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private LockConfig lockConfig = LockConfig.defaults();
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private Duration runDeadline;
        private final Map<Provider, ProviderSettings> providers = new EnumMap<>(Provider.class);

        public Builder resolverOptions(ResolverOptions resolverOptions) {
            this.resolverOptions = resolverOptions;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder lifecyclePolicy(LifecyclePolicy lifecyclePolicy) {
            this.lifecyclePolicy = lifecyclePolicy;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder runDeadline(Duration runDeadline) {
            this.runDeadline = runDeadline;
            return this;
        }

        public Builder provider(ProviderSettings settings) {
            this.providers.put(settings.provider(), settings);
            return this;
        }

        public IngestSettings build() {
            if (resolverOptions == null || retryPolicy == null || lifecyclePolicy == null
                    || cacheConfig == null || lockConfig == null) {
                throw new ConfigurationException("Resolver, retry, lifecycle, cache and lock settings are required");
            }
            if (chunkSize <= 0) {
                throw new ConfigurationException("chunkSize must be > 0, got: " + chunkSize);
            }
            if (runDeadline != null && (runDeadline.isNegative() || runDeadline.isZero())) {
                throw new ConfigurationException("runDeadline must be positive");
            }
            return new IngestSettings(this);
        }
    }
}
