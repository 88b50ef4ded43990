package com.civics.ingest.audit;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * In-memory {@link AuditRepository}. Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public List<AuditEntry> findByCanonicalId(String canonicalId) {
        return filter(e -> canonicalId.equals(e.canonicalId()));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return filter(e -> e.action() == action);
    }

    @Override
    public List<AuditEntry> findByRunId(String runId) {
        return filter(e -> runId.equals(e.runId()));
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end));
    }

    @Override
    public int count() {
        return entries.size();
    }

    private List<AuditEntry> filter(Predicate<AuditEntry> predicate) {
        return entries.stream().filter(predicate).toList();
    }
}
