package com.civics.ingest.metrics;

import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code civics.ingest.records.fetched} Counter (tag: provider)</li>
 *   <li>{@code civics.ingest.records.invalid} Counter (tag: provider)</li>
 *   <li>{@code civics.ingest.provider.rate_limited} Counter (tag: provider)</li>
 *   <li>{@code civics.ingest.provider.throttled} Counter (tag: provider)</li>
 *   <li>{@code civics.ingest.entity.created} Counter (tag: level)</li>
 *   <li>{@code civics.ingest.entity.updated} Counter (tag: level)</li>
 *   <li>{@code civics.ingest.status.transition} Counter (tags: status, reason)</li>
 *   <li>{@code civics.ingest.fuzzy.score} DistributionSummary</li>
 *   <li>{@code civics.ingest.run.duration} Timer (tag: mode)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final DistributionSummary fuzzyScoreSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.fuzzyScoreSummary = DistributionSummary.builder("civics.ingest.fuzzy.score")
                .description("Similarity scores of fuzzy resolution candidates")
                .register(registry);
    }

    @Override
    public void recordRecordsFetched(Provider provider, int count) {
        counter("civics.ingest.records.fetched", "Source records fetched", "provider", provider.key())
                .increment(count);
    }

    @Override
    public void incrementInvalidRecord(Provider provider) {
        counter("civics.ingest.records.invalid", "Source records dropped as invalid", "provider", provider.key())
                .increment();
    }

    @Override
    public void incrementRateLimited(Provider provider) {
        counter("civics.ingest.provider.rate_limited", "Rate-limit signals received", "provider", provider.key())
                .increment();
    }

    @Override
    public void incrementThrottled(Provider provider) {
        counter("civics.ingest.provider.throttled", "Token acquisitions that timed out", "provider", provider.key())
                .increment();
    }

    @Override
    public void incrementEntityCreated(GovernmentLevel level) {
        counter("civics.ingest.entity.created", "Canonical representatives created", "level", tagValue(level))
                .increment();
    }

    @Override
    public void incrementEntityUpdated(GovernmentLevel level) {
        counter("civics.ingest.entity.updated", "Canonical representatives updated", "level", tagValue(level))
                .increment();
    }

    @Override
    public void incrementStatusTransition(RepresentativeStatus target, StatusReason reason) {
        String key = "transition:" + target + ":" + reason;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("civics.ingest.status.transition")
                        .description("Lifecycle status transitions applied")
                        .tag("status", target.name())
                        .tag("reason", reason != null ? reason.code() : "none")
                        .register(registry))
                .increment();
    }

    @Override
    public void recordFuzzyScore(double score) {
        fuzzyScoreSummary.record(score);
    }

    @Override
    public void recordRunDuration(String mode, Duration duration) {
        timerCache.computeIfAbsent(mode, k ->
                Timer.builder("civics.ingest.run.duration")
                        .description("Duration of ingest runs")
                        .tag("mode", mode)
                        .register(registry))
                .record(duration);
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }

    private static String tagValue(GovernmentLevel level) {
        return level != null ? level.name() : "UNKNOWN";
    }
}
