package com.civics.ingest.ratelimit;

import com.civics.ingest.core.model.Provider;

/**
 * Point-in-time view of one provider's bucket.
 */
public record BucketSnapshot(
        Provider provider,
        double availableTokens,
        int consecutiveRateLimits,
        long granted,
        long throttled,
        boolean backingOff
) {
}
