package com.civics.ingest.cdi;

import com.civics.ingest.api.CivicsIngestEngine;
import com.civics.ingest.config.ConfigurationException;
import com.civics.ingest.config.IngestSettings;
import com.civics.ingest.connector.ProviderSettings;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.lifecycle.LifecyclePolicy;
import com.civics.ingest.lock.LockConfig;
import com.civics.ingest.resolve.ResolverOptions;
import com.civics.ingest.retry.RetryPolicy;
import com.civics.ingest.review.ReviewService;
import com.civics.ingest.store.CacheConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the ingest engine from MicroProfile Config properties.
 *
 * <p>Defaults ship in {@code META-INF/microprofile-config.properties}. API keys are never part of
 * them; supply them from the environment:</p>
 * <pre>
 * CIVICS_INGEST_PROVIDERS_FEDERAL_API_KEY=...
 * CIVICS_INGEST_PROVIDERS_STATE_API_KEY=...
 * </pre>
 *
 * <p>Every provider reads the same keys under {@code civics-ingest.providers.<key>.}:
 * {@code api-key}, {@code base-url}, {@code requests-per-window}, {@code window-seconds},
 * {@code min-interval-ms}, {@code acquire-timeout-ms}, {@code request-timeout-ms},
 * {@code page-size}, {@code jurisdictions} and {@code enabled}.</p>
 */
@ApplicationScoped
public class CivicsIngestProducer {

    private static final Logger log = LoggerFactory.getLogger(CivicsIngestProducer.class);
    private static final String PROVIDER_PREFIX = "civics-ingest.providers.";

    @Inject
    Config config;

    // ── Resolver ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "civics-ingest.resolver.fuzzy-enabled", defaultValue = "true")
    boolean fuzzyEnabled;

    @Inject
    @ConfigProperty(name = "civics-ingest.resolver.accept-threshold", defaultValue = "0.92")
    double acceptThreshold;

    @Inject
    @ConfigProperty(name = "civics-ingest.resolver.review-threshold", defaultValue = "0.80")
    double reviewThreshold;

    // ── Retry ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "civics-ingest.retry.base-delay-ms", defaultValue = "1000")
    long retryBaseDelayMillis;

    @Inject
    @ConfigProperty(name = "civics-ingest.retry.jitter", defaultValue = "0.2")
    double retryJitter;

    @Inject
    @ConfigProperty(name = "civics-ingest.retry.max-attempts", defaultValue = "5")
    int retryMaxAttempts;

    @Inject
    @ConfigProperty(name = "civics-ingest.retry.max-rate-limit-retries", defaultValue = "3")
    int retryMaxRateLimitRetries;

    // ── Lifecycle ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "civics-ingest.lifecycle.inactive-retention-days", defaultValue = "90")
    long inactiveRetentionDays;

    // ── Run ───────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "civics-ingest.run.chunk-size", defaultValue = "100")
    int chunkSize;

    @Inject
    @ConfigProperty(name = "civics-ingest.run.deadline-minutes")
    Optional<Long> runDeadlineMinutes;

    @Inject
    @ConfigProperty(name = "civics-ingest.run.lock-timeout-ms", defaultValue = "5000")
    long lockTimeoutMillis;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "civics-ingest.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "civics-ingest.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "civics-ingest.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public IngestSettings ingestSettings() {
        try {
            IngestSettings.Builder builder = IngestSettings.builder()
                    .resolverOptions(new ResolverOptions(fuzzyEnabled, acceptThreshold, reviewThreshold))
                    .retryPolicy(new RetryPolicy(Duration.ofMillis(retryBaseDelayMillis), retryJitter,
                            retryMaxAttempts, retryMaxRateLimitRetries))
                    .lifecyclePolicy(new LifecyclePolicy(Duration.ofDays(inactiveRetentionDays)))
                    .cacheConfig(new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled))
                    .lockConfig(new LockConfig(Duration.ofMillis(lockTimeoutMillis)))
                    .chunkSize(chunkSize);
            runDeadlineMinutes.ifPresent(m -> builder.runDeadline(Duration.ofMinutes(m)));
            for (Provider provider : Provider.values()) {
                builder.provider(providerSettings(provider));
            }
            IngestSettings settings = builder.build();
            log.info("Producing IngestSettings: providers={} chunkSize={} cache={}",
                    settings.getProviders().size(), settings.getChunkSize(), cacheEnabled);
            return settings;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid civics-ingest configuration: " + e.getMessage(), e);
        }
    }

    @Produces
    @ApplicationScoped
    public CivicsIngestEngine civicsIngestEngine(IngestSettings settings) {
        log.info("Producing CivicsIngestEngine");
        return CivicsIngestEngine.builder()
                .settings(settings)
                .build();
    }

    public void closeEngine(@Disposes CivicsIngestEngine engine) {
        log.info("Closing CivicsIngestEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public ReviewService reviewService(CivicsIngestEngine engine) {
        return engine.getReviewService();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    ProviderSettings providerSettings(Provider provider) {
        String prefix = PROVIDER_PREFIX + provider.key() + ".";
        ProviderSettings.Builder builder = ProviderSettings.builder(provider)
                .enabled(config.getOptionalValue(prefix + "enabled", Boolean.class).orElse(true));
        config.getOptionalValue(prefix + "api-key", String.class).ifPresent(builder::apiKey);
        config.getOptionalValue(prefix + "base-url", String.class).ifPresent(builder::baseUrl);
        config.getOptionalValue(prefix + "requests-per-window", Integer.class).ifPresent(builder::requestsPerWindow);
        config.getOptionalValue(prefix + "window-seconds", Long.class)
                .ifPresent(s -> builder.window(Duration.ofSeconds(s)));
        config.getOptionalValue(prefix + "min-interval-ms", Long.class)
                .ifPresent(ms -> builder.minInterval(Duration.ofMillis(ms)));
        config.getOptionalValue(prefix + "acquire-timeout-ms", Long.class)
                .ifPresent(ms -> builder.acquireTimeout(Duration.ofMillis(ms)));
        config.getOptionalValue(prefix + "request-timeout-ms", Long.class)
                .ifPresent(ms -> builder.requestTimeout(Duration.ofMillis(ms)));
        config.getOptionalValue(prefix + "page-size", Integer.class).ifPresent(builder::pageSize);
        config.getOptionalValue(prefix + "jurisdictions", String.class)
                .ifPresent(list -> builder.jurisdictions(splitList(list)));
        return builder.build();
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
