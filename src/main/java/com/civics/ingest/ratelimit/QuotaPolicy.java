package com.civics.ingest.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Request budget of one provider.
 *
 * @param capacity       bucket size, i.e. the request budget per window
 * @param window         time over which a full budget is refilled
 * @param minInterval    minimum delay between two consecutive requests
 * @param acquireTimeout longest time {@code acquire} may block before reporting throttled
 * @param baseBackoff    first backoff window after a rate-limit signal
 * @param maxBackoff     cap for the doubling backoff
 */
public record QuotaPolicy(
        int capacity,
        Duration window,
        Duration minInterval,
        Duration acquireTimeout,
        Duration baseBackoff,
        Duration maxBackoff
) {
    public static final Duration DEFAULT_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(5);

    public QuotaPolicy {
        Objects.requireNonNull(window, "window is required");
        Objects.requireNonNull(minInterval, "minInterval is required");
        Objects.requireNonNull(acquireTimeout, "acquireTimeout is required");
        Objects.requireNonNull(baseBackoff, "baseBackoff is required");
        Objects.requireNonNull(maxBackoff, "maxBackoff is required");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (minInterval.isNegative() || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("minInterval and acquireTimeout must not be negative");
        }
        if (maxBackoff.compareTo(baseBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= baseBackoff");
        }
    }

    /**
     * A budget of {@code capacity} requests per {@code window} with the given throttle floor
     * and default timeout and backoff settings.
     */
    public static QuotaPolicy of(int capacity, Duration window, Duration minInterval) {
        return new QuotaPolicy(capacity, window, minInterval,
                DEFAULT_ACQUIRE_TIMEOUT, DEFAULT_BASE_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    public static QuotaPolicy daily(int budget, Duration minInterval) {
        return of(budget, Duration.ofDays(1), minInterval);
    }

    /**
     * Backoff window for the {@code n}-th consecutive rate-limit signal (1-based).
     */
    public Duration backoffFor(int consecutiveSignals) {
        int shift = Math.min(Math.max(consecutiveSignals - 1, 0), 20);
        long nanos = baseBackoff.toNanos() << shift;
        if (nanos < 0 || nanos > maxBackoff.toNanos()) {
            return maxBackoff;
        }
        return Duration.ofNanos(nanos);
    }
}
