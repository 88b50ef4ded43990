package com.civics.ingest.orchestrator;

import com.civics.ingest.core.model.Provider;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bookkeeping and summary of one run.
 */
public class IngestRun {

    private final String runId;
    private final IngestMode mode;
    private final RunOptions options;
    private final Instant startedAt;
    private final Map<Provider, ProviderRunStats> providerStats = new EnumMap<>(Provider.class);
    private final List<FlaggedEntity> flagged = new CopyOnWriteArrayList<>();
    private volatile Instant completedAt;
    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile String failureMessage;
    private final AtomicInteger skippedChunks = new AtomicInteger();
    private volatile int stagedWrites;

    IngestRun(String runId, IngestMode mode, RunOptions options, List<Provider> providers, Instant startedAt) {
        this.runId = runId;
        this.mode = mode;
        this.options = options;
        this.startedAt = startedAt;
        providers.forEach(p -> providerStats.put(p, new ProviderRunStats(p)));
    }

    public String getRunId() {
        return runId;
    }

    public IngestMode getMode() {
        return mode;
    }

    public RunOptions getOptions() {
        return options;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<Duration> getDuration() {
        return getCompletedAt().map(end -> Duration.between(startedAt, end));
    }

    public RunStatus getStatus() {
        return status;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public Map<Provider, ProviderRunStats> getProviderStats() {
        return Collections.unmodifiableMap(providerStats);
    }

    public ProviderRunStats stats(Provider provider) {
        ProviderRunStats stats = providerStats.get(provider);
        if (stats == null) {
            throw new IllegalArgumentException("Provider not part of run " + runId + ": " + provider.key());
        }
        return stats;
    }

    /**
     * Ambiguous replacements, fuzzy matches and other cases held for a human.
     */
    public List<FlaggedEntity> getFlagged() {
        return List.copyOf(flagged);
    }

    /**
     * Write chunks that failed twice and were skipped.
     */
    public int getSkippedChunks() {
        return skippedChunks.get();
    }

    /**
     * For dry runs, the writes that would have been made.
     */
    public int getStagedWrites() {
        return stagedWrites;
    }

    /**
     * Record and connector errors, summed over providers. Quota exhaustion is not an error.
     */
    public int getErrorCount() {
        int errors = providerStats.values().stream()
                .mapToInt(s -> s.getErrors() + s.getInvalid() + s.getConflicts()
                        + (s.getOutcome() != null && s.getOutcome().isError() ? 1 : 0))
                .sum();
        return errors + skippedChunks.get();
    }

    public int getTotalFetched() {
        return providerStats.values().stream().mapToInt(ProviderRunStats::getFetched).sum();
    }

    public int getTotalCreated() {
        return providerStats.values().stream().mapToInt(ProviderRunStats::getCreated).sum();
    }

    public int getTotalDeactivated() {
        return providerStats.values().stream().mapToInt(ProviderRunStats::getDeactivated).sum();
    }

    public int getTotalReplaced() {
        return providerStats.values().stream().mapToInt(ProviderRunStats::getReplaced).sum();
    }

    void flag(FlaggedEntity entity) {
        flagged.add(entity);
    }

    void chunkSkipped() {
        skippedChunks.incrementAndGet();
    }

    void stagedWrites(int writes) {
        this.stagedWrites = writes;
    }

    void complete(RunStatus status, Instant at) {
        this.status = status;
        this.completedAt = at;
    }

    void fail(String message, Instant at) {
        this.failureMessage = message;
        complete(RunStatus.FAILED, at);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder()
                .append("run ").append(runId)
                .append(" mode=").append(mode.code())
                .append(" status=").append(status)
                .append(" errors=").append(getErrorCount())
                .append(" flagged=").append(flagged.size());
        providerStats.values().forEach(s -> sb.append("\n  ").append(s));
        return sb.toString();
    }

    @Override
    public String toString() {
        return "IngestRun{runId='" + runId + "', mode=" + mode + ", status=" + status + '}';
    }
}
