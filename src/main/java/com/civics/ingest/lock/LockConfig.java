package com.civics.ingest.lock;

import java.time.Duration;

/**
 * Entity lock settings.
 *
 * @param timeout maximum wait for one entity's lock
 */
public record LockConfig(Duration timeout) {

    public LockConfig {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    /**
     * Five second timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofSeconds(5));
    }
}
