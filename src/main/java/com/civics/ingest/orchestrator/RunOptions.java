package com.civics.ingest.orchestrator;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Per-run switches supplied by the operator or scheduler.
 */
public class RunOptions {

    private final boolean skipAdd;
    private final boolean dryRun;
    private final List<String> jurisdictionFilter;
    private final Duration deadline;
    private final Integer chunkSize;
    private final Duration staleAfter;
    private final Integer recordLimit;

    private RunOptions(Builder builder) {
        this.skipAdd = builder.skipAdd;
        this.dryRun = builder.dryRun;
        this.jurisdictionFilter = List.copyOf(builder.jurisdictionFilter);
        this.deadline = builder.deadline;
        this.chunkSize = builder.chunkSize;
        this.staleAfter = builder.staleAfter;
        this.recordLimit = builder.recordLimit;
    }

    /**
     * Enrichment runs only: update already known entities and create nothing. No lifecycle step.
     */
    public boolean isSkipAdd() {
        return skipAdd;
    }

    /**
     * Resolve and reconcile against a staged copy of the store; nothing is written.
     */
    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * Jurisdictions to fetch instead of each connector's defaults. Empty means no filter.
     */
    public List<String> getJurisdictionFilter() {
        return jurisdictionFilter;
    }

    public Optional<Duration> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public Optional<Integer> getChunkSize() {
        return Optional.ofNullable(chunkSize);
    }

    /**
     * Enrich only existing entities whose freshest provenance is older than this.
     */
    public Optional<Duration> getStaleAfter() {
        return Optional.ofNullable(staleAfter);
    }

    /**
     * Maximum records fetched per provider.
     */
    public Optional<Integer> getRecordLimit() {
        return Optional.ofNullable(recordLimit);
    }

    @Override
    public String toString() {
        return "RunOptions{skipAdd=" + skipAdd + ", dryRun=" + dryRun + ", jurisdictions=" + jurisdictionFilter
                + ", deadline=" + deadline + ", staleAfter=" + staleAfter + ", recordLimit=" + recordLimit + '}';
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean skipAdd;
        private boolean dryRun;
        private List<String> jurisdictionFilter = List.of();
        private Duration deadline;
        private Integer chunkSize;
        private Duration staleAfter;
        private Integer recordLimit;

        public Builder skipAdd(boolean skipAdd) {
            this.skipAdd = skipAdd;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder jurisdictionFilter(List<String> jurisdictions) {
            this.jurisdictionFilter = jurisdictions != null ? jurisdictions : List.of();
            return this;
        }

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder staleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
            return this;
        }

        public Builder recordLimit(int recordLimit) {
            this.recordLimit = recordLimit;
            return this;
        }

        public RunOptions build() {
            if (chunkSize != null && chunkSize <= 0) {
                throw new IllegalArgumentException("chunkSize must be > 0");
            }
            if (recordLimit != null && recordLimit <= 0) {
                throw new IllegalArgumentException("recordLimit must be > 0");
            }
            if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
                throw new IllegalArgumentException("deadline must be positive");
            }
            if (staleAfter != null && staleAfter.isNegative()) {
                throw new IllegalArgumentException("staleAfter must not be negative");
            }
            return new RunOptions(this);
        }
    }
}
