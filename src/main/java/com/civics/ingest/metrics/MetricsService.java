package com.civics.ingest.metrics;

import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;

import java.time.Duration;

/**
 * Interface for recording ingest metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without
 * any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordRecordsFetched(Provider provider, int count);

    void incrementInvalidRecord(Provider provider);

    void incrementRateLimited(Provider provider);

    void incrementThrottled(Provider provider);

    void incrementEntityCreated(GovernmentLevel level);

    void incrementEntityUpdated(GovernmentLevel level);

    void incrementStatusTransition(RepresentativeStatus target, StatusReason reason);

    void recordFuzzyScore(double score);

    void recordRunDuration(String mode, Duration duration);
}
