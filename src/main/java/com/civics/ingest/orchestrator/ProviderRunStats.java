package com.civics.ingest.orchestrator;

import com.civics.ingest.core.model.Provider;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-provider counters of one run. Updated by the provider worker and the writer threads.
 */
public class ProviderRunStats {

    private final Provider provider;
    private final AtomicInteger fetched = new AtomicInteger();
    private final AtomicInteger pages = new AtomicInteger();
    private final AtomicInteger invalid = new AtomicInteger();
    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger merged = new AtomicInteger();
    private final AtomicInteger unchanged = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger conflicts = new AtomicInteger();
    private final AtomicInteger deactivated = new AtomicInteger();
    private final AtomicInteger replaced = new AtomicInteger();
    private final AtomicInteger rateLimitedSignals = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();
    private volatile ProviderOutcome outcome;
    private volatile String message;

    public ProviderRunStats(Provider provider) {
        this.provider = provider;
    }

    public Provider getProvider() {
        return provider;
    }

    public int getFetched() {
        return fetched.get();
    }

    public int getPages() {
        return pages.get();
    }

    /** Records dropped because their payload did not map. */
    public int getInvalid() {
        return invalid.get();
    }

    public int getCreated() {
        return created.get();
    }

    /** Records merged into an existing entity that changed. */
    public int getMerged() {
        return merged.get();
    }

    public int getUnchanged() {
        return unchanged.get();
    }

    /** Records not applied: unmatched enrichment data, skip-add or stale filters, skipped chunks. */
    public int getSkipped() {
        return skipped.get();
    }

    public int getConflicts() {
        return conflicts.get();
    }

    public int getDeactivated() {
        return deactivated.get();
    }

    public int getReplaced() {
        return replaced.get();
    }

    public int getRateLimitedSignals() {
        return rateLimitedSignals.get();
    }

    public int getErrors() {
        return errors.get();
    }

    public ProviderOutcome getOutcome() {
        return outcome;
    }

    public String getMessage() {
        return message;
    }

    void addFetched(int n) {
        fetched.addAndGet(n);
    }

    void incrementPages() {
        pages.incrementAndGet();
    }

    void incrementInvalid() {
        invalid.incrementAndGet();
    }

    void incrementCreated() {
        created.incrementAndGet();
    }

    void incrementMerged() {
        merged.incrementAndGet();
    }

    void incrementUnchanged() {
        unchanged.incrementAndGet();
    }

    void addSkipped(int n) {
        skipped.addAndGet(n);
    }

    void incrementConflicts() {
        conflicts.incrementAndGet();
    }

    void incrementDeactivated() {
        deactivated.incrementAndGet();
    }

    void incrementReplaced() {
        replaced.incrementAndGet();
    }

    void addRateLimitedSignals(int n) {
        rateLimitedSignals.addAndGet(n);
    }

    void incrementErrors() {
        errors.incrementAndGet();
    }

    void outcome(ProviderOutcome outcome, String message) {
        this.outcome = outcome;
        this.message = message;
    }

    @Override
    public String toString() {
        return provider.key() + "{outcome=" + outcome +
                ", fetched=" + fetched +
                ", invalid=" + invalid +
                ", created=" + created +
                ", merged=" + merged +
                ", unchanged=" + unchanged +
                ", skipped=" + skipped +
                ", conflicts=" + conflicts +
                ", deactivated=" + deactivated +
                ", replaced=" + replaced +
                ", errors=" + errors +
                '}';
    }
}
