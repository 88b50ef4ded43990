package com.civics.ingest.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation.
 *
 * @param canonicalId the affected canonical entity, null for run-level entries
 * @param runId       the ingest run that caused it, null for operator actions
 * @param actorId     "SYSTEM" for automated changes, otherwise the reviewer
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String canonicalId,
        String runId,
        String actorId,
        Map<String, Object> details,
        Instant timestamp
) {
    public static final String SYSTEM_ACTOR = "SYSTEM";

    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
        actorId = actorId != null ? actorId : SYSTEM_ACTOR;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String canonicalId;
        private String runId;
        private String actorId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder canonicalId(String canonicalId) {
            this.canonicalId = canonicalId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, canonicalId, runId, actorId, details, timestamp);
        }
    }
}
