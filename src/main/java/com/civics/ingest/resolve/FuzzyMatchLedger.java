package com.civics.ingest.resolve;

import com.civics.ingest.core.model.CrosswalkKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Every accepted fuzzy match, kept for manual audit. A reverted match stays in the ledger
 * and stops the resolver from proposing the same pairing again.
 */
public class FuzzyMatchLedger {
    private static final Logger log = LoggerFactory.getLogger(FuzzyMatchLedger.class);

    private final ConcurrentMap<String, FuzzyMatchRecord> records = new ConcurrentHashMap<>();

    public FuzzyMatchRecord record(FuzzyMatchRecord match) {
        records.put(match.id(), match);
        log.info("fuzzy.recorded id={} keys={} canonicalId={} {}",
                match.id(), match.keys(), match.canonicalId(), match.breakdown());
        return match;
    }

    public Optional<FuzzyMatchRecord> find(String id) {
        return Optional.ofNullable(records.get(id));
    }

    /**
     * @throws IllegalArgumentException if the match is unknown
     * @throws IllegalStateException    if it was already reverted
     */
    public FuzzyMatchRecord markReverted(String id, String reviewerId, Instant at) {
        FuzzyMatchRecord updated = records.computeIfPresent(id, (k, existing) -> {
            if (existing.isReverted()) {
                throw new IllegalStateException("Fuzzy match already reverted: " + id);
            }
            return existing.reverted(reviewerId, at);
        });
        if (updated == null) {
            throw new IllegalArgumentException("Fuzzy match not found: " + id);
        }
        return updated;
    }

    /**
     * Whether a reviewer has rejected pairing {@code key} with {@code canonicalId}.
     */
    public boolean isRejected(CrosswalkKey key, String canonicalId) {
        return records.values().stream()
                .anyMatch(r -> r.isReverted() && r.keys().contains(key) && r.canonicalId().equals(canonicalId));
    }

    public List<FuzzyMatchRecord> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(FuzzyMatchRecord::decidedAt).thenComparing(FuzzyMatchRecord::id))
                .toList();
    }

    public List<FuzzyMatchRecord> findActive() {
        return findAll().stream().filter(r -> !r.isReverted()).toList();
    }
}
