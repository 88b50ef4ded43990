package com.civics.ingest.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for connector calls.
 *
 * @param baseDelay           delay before the first retry
 * @param jitterFactor        relative jitter applied to every delay, e.g. 0.2 for ±20%
 * @param maxAttempts         total attempts for transient failures, including the first
 * @param maxRateLimitRetries retries allowed after rate-limit signals
 */
public record RetryPolicy(Duration baseDelay, double jitterFactor, int maxAttempts, int maxRateLimitRetries) {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(1000);
    public static final double DEFAULT_JITTER = 0.2;
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final int DEFAULT_MAX_RATE_LIMIT_RETRIES = 3;

    public RetryPolicy {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1), got: " + jitterFactor);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (maxRateLimitRetries < 0) {
            throw new IllegalArgumentException("maxRateLimitRetries must be >= 0");
        }
    }

    /**
     * Delay for the given zero-based retry: baseDelay * 2^retry, then jitter.
     */
    public Duration delay(int retry) {
        long base = baseDelay.toMillis();
        long exponential = retry <= 0 ? base : base * (1L << Math.min(retry, 20));
        return Duration.ofMillis(jitter(exponential));
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    /**
     * 1s base, ±20% jitter, 5 attempts, 3 rate-limit retries.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(DEFAULT_BASE_DELAY, DEFAULT_JITTER, DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_RATE_LIMIT_RETRIES);
    }
}
