package com.civics.ingest.audit;

import java.time.Instant;
import java.util.List;

/**
 * Append-only storage for audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByCanonicalId(String canonicalId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByRunId(String runId);

    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();
}
