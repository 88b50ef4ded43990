package com.civics.ingest.metrics;

import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

    @Test
    @DisplayName("Should count fetched and invalid records per provider")
    void testRecordCounters() {
        metrics.recordRecordsFetched(Provider.FEDERAL_ROSTER, 250);
        metrics.recordRecordsFetched(Provider.FEDERAL_ROSTER, 50);
        metrics.recordRecordsFetched(Provider.STATE_LEGISLATURE, 10);
        metrics.incrementInvalidRecord(Provider.CAMPAIGN_FINANCE);

        Counter federal = registry.find("civics.ingest.records.fetched").tag("provider", "federal").counter();
        Counter state = registry.find("civics.ingest.records.fetched").tag("provider", "state").counter();
        Counter invalid = registry.find("civics.ingest.records.invalid").tag("provider", "finance").counter();

        assertEquals(300.0, federal.count());
        assertEquals(10.0, state.count());
        assertEquals(1.0, invalid.count());
    }

    @Test
    @DisplayName("Should tag rate-limit and throttle signals by provider")
    void testRateCounters() {
        metrics.incrementRateLimited(Provider.CIVIC_LOOKUP);
        metrics.incrementRateLimited(Provider.CIVIC_LOOKUP);
        metrics.incrementThrottled(Provider.CIVIC_LOOKUP);

        assertEquals(2.0, registry.find("civics.ingest.provider.rate_limited").tag("provider", "civic")
                .counter().count());
        assertEquals(1.0, registry.find("civics.ingest.provider.throttled").tag("provider", "civic")
                .counter().count());
    }

    @Test
    @DisplayName("Should count entity writes by level, with a fallback tag for unknown levels")
    void testEntityCounters() {
        metrics.incrementEntityCreated(GovernmentLevel.STATE);
        metrics.incrementEntityUpdated(null);

        assertEquals(1.0, registry.find("civics.ingest.entity.created").tag("level", "STATE").counter().count());
        assertEquals(1.0, registry.find("civics.ingest.entity.updated").tag("level", "UNKNOWN").counter().count());
    }

    @Test
    @DisplayName("Should tag status transitions with status and reason code")
    void testTransitions() {
        metrics.incrementStatusTransition(RepresentativeStatus.HISTORICAL, StatusReason.REPLACED);
        metrics.incrementStatusTransition(RepresentativeStatus.INACTIVE, null);

        assertEquals(1.0, registry.find("civics.ingest.status.transition")
                .tag("status", "HISTORICAL").tag("reason", "replaced").counter().count());
        assertEquals(1.0, registry.find("civics.ingest.status.transition")
                .tag("status", "INACTIVE").tag("reason", "none").counter().count());
    }

    @Test
    @DisplayName("Should summarize fuzzy scores and time runs by mode")
    void testSummaryAndTimer() {
        metrics.recordFuzzyScore(0.85);
        metrics.recordFuzzyScore(0.95);
        metrics.recordRunDuration("enrichment", Duration.ofSeconds(3));

        DistributionSummary scores = registry.find("civics.ingest.fuzzy.score").summary();
        Timer runs = registry.find("civics.ingest.run.duration").tag("mode", "enrichment").timer();

        assertEquals(2, scores.count());
        assertEquals(0.90, scores.mean(), 1e-9);
        assertEquals(1, runs.count());
        assertEquals(3000.0, runs.totalTime(TimeUnit.MILLISECONDS), 1e-6);
    }

    @Test
    @DisplayName("Should accept every call on the no-op implementation")
    void testNoOp() {
        NoOpMetricsService noOp = new NoOpMetricsService();

        assertDoesNotThrow(() -> {
            noOp.recordRecordsFetched(Provider.FEDERAL_ROSTER, 1);
            noOp.incrementStatusTransition(RepresentativeStatus.INACTIVE, StatusReason.RETIRED);
            noOp.recordRunDuration("first_time", Duration.ZERO);
        });
    }
}
