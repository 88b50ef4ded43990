package com.civics.ingest.metrics;

import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRecordsFetched(Provider provider, int count) {
    }

    @Override
    public void incrementInvalidRecord(Provider provider) {
    }

    @Override
    public void incrementRateLimited(Provider provider) {
    }

    @Override
    public void incrementThrottled(Provider provider) {
    }

    @Override
    public void incrementEntityCreated(GovernmentLevel level) {
    }

    @Override
    public void incrementEntityUpdated(GovernmentLevel level) {
    }

    @Override
    public void incrementStatusTransition(RepresentativeStatus target, StatusReason reason) {
    }

    @Override
    public void recordFuzzyScore(double score) {
    }

    @Override
    public void recordRunDuration(String mode, Duration duration) {
    }
}
