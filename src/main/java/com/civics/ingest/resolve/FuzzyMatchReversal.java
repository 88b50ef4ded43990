package com.civics.ingest.resolve;

import com.civics.ingest.audit.AuditAction;
import com.civics.ingest.audit.AuditService;
import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.CrosswalkKey;
import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.FieldProvenance;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.lock.EntityLock;
import com.civics.ingest.review.FuzzyMatchReverter;
import com.civics.ingest.store.CanonicalStore;
import com.civics.ingest.store.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reverts a rejected fuzzy match: the matched keys are released from the entity together with
 * the fields those providers won, and the ledger remembers the rejection so the next run mints
 * a separate entity instead of matching again.
 */
public class FuzzyMatchReversal implements FuzzyMatchReverter {
    private static final Logger log = LoggerFactory.getLogger(FuzzyMatchReversal.class);

    private final FuzzyMatchLedger ledger;
    private final CanonicalStore store;
    private final EntityLock entityLock;
    private final AuditService auditService;
    private final Clock clock;

    public FuzzyMatchReversal(FuzzyMatchLedger ledger, CanonicalStore store, EntityLock entityLock,
                              AuditService auditService, Clock clock) {
        this.ledger = ledger;
        this.store = store;
        this.entityLock = entityLock;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Override
    public void revert(String fuzzyMatchId, String reviewerId) {
        FuzzyMatchRecord match = ledger.find(fuzzyMatchId)
                .orElseThrow(() -> new IllegalArgumentException("Fuzzy match not found: " + fuzzyMatchId));
        Instant now = clock.instant();

        List<CrosswalkKey> released = entityLock.withLock(match.canonicalId(), () -> {
            CanonicalRepresentative current = store.findById(match.canonicalId())
                    .orElseThrow(() -> new EntityNotFoundException(match.canonicalId()));
            List<CrosswalkKey> held = match.keys().stream()
                    .filter(k -> k.externalId().equals(current.getCrosswalk().get(k.provider())))
                    .toList();
            Set<Provider> providers = held.stream()
                    .map(CrosswalkKey::provider)
                    .collect(Collectors.toSet());

            CanonicalRepresentative.Builder builder = current.toBuilder();
            held.forEach(k -> builder.removeCrosswalk(k.provider()));
            for (Map.Entry<FieldKey, FieldProvenance> e : current.getFieldProvenance().entrySet()) {
                if (providers.contains(e.getValue().source())) {
                    builder.field(e.getKey(), null).provenance(e.getKey(), null);
                }
            }
            store.upsert(builder.build());
            return held;
        });

        ledger.markReverted(fuzzyMatchId, reviewerId, now);
        auditService.recordByActor(AuditAction.FUZZY_MATCH_REVERTED, match.canonicalId(), reviewerId, Map.of(
                "fuzzyMatchId", fuzzyMatchId,
                "releasedKeys", released.stream().map(CrosswalkKey::toString).toList()));
        log.info("fuzzy.reverted id={} canonicalId={} releasedKeys={} reviewer={}",
                fuzzyMatchId, match.canonicalId(), released, reviewerId);
    }
}
