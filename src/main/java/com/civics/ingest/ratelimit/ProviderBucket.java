package com.civics.ingest.ratelimit;

import com.civics.ingest.core.model.Provider;

import java.time.Duration;

/**
 * Token bucket of one provider, with a minimum inter-request delay and a backoff block.
 * Tokens are stored as fixed-point (tokens * 1000). All state is guarded by this bucket's
 * own monitor, so providers never contend with each other.
 */
final class ProviderBucket {

    private static final long SCALE = 1000;

    private final Provider provider;
    private final QuotaPolicy policy;
    private final RateClock clock;
    private final double refillPerNano;

    private long tokens;
    private long lastRefillNanos;
    private long nextAllowedNanos;
    private long blockedUntilNanos;
    private int consecutiveRateLimits;
    private long grantedCount;
    private long throttledCount;

    ProviderBucket(Provider provider, QuotaPolicy policy, RateClock clock) {
        this.provider = provider;
        this.policy = policy;
        this.clock = clock;
        this.refillPerNano = (double) policy.capacity() * SCALE / policy.window().toNanos();
        this.tokens = (long) policy.capacity() * SCALE;
        long now = clock.nanoTime();
        this.lastRefillNanos = now;
        this.nextAllowedNanos = now;
        this.blockedUntilNanos = now;
    }

    QuotaPolicy policy() {
        return policy;
    }

    /**
     * Takes a token if one is available and every delay has elapsed.
     *
     * @return zero when a token was taken, otherwise the nanos to wait before trying again
     */
    synchronized long tryTake() {
        long now = clock.nanoTime();
        refill(now);

        long wait = 0;
        if (now < blockedUntilNanos) {
            wait = blockedUntilNanos - now;
        }
        if (now < nextAllowedNanos) {
            wait = Math.max(wait, nextAllowedNanos - now);
        }
        if (tokens < SCALE) {
            long missing = SCALE - tokens;
            wait = Math.max(wait, (long) Math.ceil(missing / refillPerNano));
        }
        if (wait > 0) {
            return wait;
        }

        tokens -= SCALE;
        nextAllowedNanos = now + policy.minInterval().toNanos();
        grantedCount++;
        return 0;
    }

    synchronized void recordThrottled() {
        throttledCount++;
    }

    /**
     * Zeroes the bucket and blocks it for the current backoff window, doubling the window
     * on each consecutive signal up to the policy cap.
     */
    synchronized Duration onRateLimited(Duration retryAfter) {
        consecutiveRateLimits++;
        Duration backoff = policy.backoffFor(consecutiveRateLimits);
        if (retryAfter != null && retryAfter.compareTo(backoff) > 0) {
            backoff = retryAfter;
        }
        long now = clock.nanoTime();
        tokens = 0;
        blockedUntilNanos = now + backoff.toNanos();
        lastRefillNanos = blockedUntilNanos;
        return backoff;
    }

    synchronized void onSuccess() {
        consecutiveRateLimits = 0;
    }

    synchronized BucketSnapshot snapshot() {
        long now = clock.nanoTime();
        refill(now);
        return new BucketSnapshot(provider, (double) tokens / SCALE, consecutiveRateLimits,
                grantedCount, throttledCount, now < blockedUntilNanos);
    }

    private void refill(long now) {
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        long added = (long) (elapsed * refillPerNano);
        if (added <= 0) {
            return;
        }
        tokens = Math.min((long) policy.capacity() * SCALE, tokens + added);
        lastRefillNanos = now;
    }
}
