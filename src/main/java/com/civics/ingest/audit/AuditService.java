package com.civics.ingest.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Records and queries the audit trail.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository(), Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public AuditEntry record(AuditEntry entry) {
        AuditEntry saved = repository.save(entry);
        log.debug("audit.recorded action={} canonicalId={} runId={} actor={}",
                entry.action(), entry.canonicalId(), entry.runId(), entry.actorId());
        return saved;
    }

    /**
     * Records an automated action taken during {@code runId}.
     */
    public AuditEntry record(AuditAction action, String canonicalId, String runId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .canonicalId(canonicalId)
                .runId(runId)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Records an operator action outside of any run.
     */
    public AuditEntry recordByActor(AuditAction action, String canonicalId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .canonicalId(canonicalId)
                .actorId(actorId)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForEntity(String canonicalId) {
        return repository.findByCanonicalId(canonicalId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return repository.findByRunId(runId);
    }

    public int size() {
        return repository.count();
    }
}
