package com.civics.ingest.ratelimit;

import com.civics.ingest.core.model.Provider;
import com.civics.ingest.metrics.MetricsService;
import com.civics.ingest.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gates every connector call against its provider's request budget.
 *
 * <p>Each provider owns one {@link ProviderBucket}. {@link #acquire(Provider)} blocks the
 * caller until a token is free or the provider's acquire timeout would be exceeded, in which
 * case it returns a throttled result instead of waiting further.</p>
 */
public class RateGovernor {
    private static final Logger log = LoggerFactory.getLogger(RateGovernor.class);

    private final Map<Provider, ProviderBucket> buckets = new ConcurrentHashMap<>();
    private final RateClock clock;
    private final MetricsService metricsService;

    public RateGovernor() {
        this(RateClock.system(), new NoOpMetricsService());
    }

    public RateGovernor(RateClock clock, MetricsService metricsService) {
        this.clock = clock;
        this.metricsService = metricsService;
    }

    /**
     * Declares a provider's quota. Re-registering replaces the bucket with a full one.
     */
    public void register(Provider provider, QuotaPolicy policy) {
        buckets.put(provider, new ProviderBucket(provider, policy, clock));
        log.info("governor.registered provider={} capacity={} window={} minInterval={}",
                provider.key(), policy.capacity(), policy.window(), policy.minInterval());
    }

    public boolean isRegistered(Provider provider) {
        return buckets.containsKey(provider);
    }

    /**
     * Blocks until a token for {@code provider} is available or the acquire timeout elapses.
     *
     * @throws InterruptedException if the calling worker is cancelled while waiting
     */
    public AcquireResult acquire(Provider provider) throws InterruptedException {
        ProviderBucket bucket = bucket(provider);
        long timeoutNanos = bucket.policy().acquireTimeout().toNanos();
        long waited = 0;

        while (true) {
            long wait = bucket.tryTake();
            if (wait == 0) {
                return AcquireResult.granted(Duration.ofNanos(waited));
            }
            if (waited + wait > timeoutNanos) {
                bucket.recordThrottled();
                metricsService.incrementThrottled(provider);
                log.warn("governor.throttled provider={} waitedMs={} retryAfterMs={}",
                        provider.key(), waited / 1_000_000, wait / 1_000_000);
                return AcquireResult.throttled(Duration.ofNanos(waited), Duration.ofNanos(wait));
            }
            clock.sleep(Duration.ofNanos(wait));
            waited += wait;
        }
    }

    /**
     * Applies a provider's rate-limit signal: the bucket is emptied for a backoff window
     * that doubles on each consecutive signal.
     */
    public void reportRateLimited(Provider provider, Duration retryAfter) {
        Duration backoff = bucket(provider).onRateLimited(retryAfter);
        metricsService.incrementRateLimited(provider);
        log.warn("governor.rateLimited provider={} backoffMs={}", provider.key(), backoff.toMillis());
    }

    public void reportSuccess(Provider provider) {
        bucket(provider).onSuccess();
    }

    public BucketSnapshot snapshot(Provider provider) {
        return bucket(provider).snapshot();
    }

    private ProviderBucket bucket(Provider provider) {
        ProviderBucket bucket = buckets.get(provider);
        if (bucket == null) {
            throw new IllegalArgumentException("No quota registered for provider: " + provider.key());
        }
        return bucket;
    }
}
