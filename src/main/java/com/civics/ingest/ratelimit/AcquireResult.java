package com.civics.ingest.ratelimit;

import java.time.Duration;

/**
 * Outcome of {@link RateGovernor#acquire}.
 *
 * @param granted    whether a token was taken
 * @param waited     time spent blocked in acquire
 * @param retryAfter when throttled, how long until a token would have become available
 */
public record AcquireResult(boolean granted, Duration waited, Duration retryAfter) {

    public static AcquireResult granted(Duration waited) {
        return new AcquireResult(true, waited, Duration.ZERO);
    }

    public static AcquireResult throttled(Duration waited, Duration retryAfter) {
        return new AcquireResult(false, waited, retryAfter);
    }

    public boolean isThrottled() {
        return !granted;
    }
}
