package com.civics.ingest.store;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.OfficeSlot;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dry-run store: reads see the backing store plus every staged write, while the backing
 * store itself is never written. Built from a snapshot taken when the run starts.
 */
public class StagingCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(StagingCanonicalStore.class);

    private final InMemoryCanonicalStore staged;
    private final AtomicInteger stagedWrites = new AtomicInteger();

    public StagingCanonicalStore(CanonicalStore backing) {
        this.staged = InMemoryCanonicalStore.copyOf(backing);
        log.debug("store.stagingOpened entities={}", staged.count());
    }

    /**
     * Writes that would have reached the backing store.
     */
    public int stagedWrites() {
        return stagedWrites.get();
    }

    @Override
    public Optional<CanonicalRepresentative> findById(String canonicalId) {
        return staged.findById(canonicalId);
    }

    @Override
    public Optional<CanonicalRepresentative> lookupByCrosswalk(Provider source, String externalId) {
        return staged.lookupByCrosswalk(source, externalId);
    }

    @Override
    public List<CanonicalRepresentative> lookupByOfficeSlot(OfficeSlot slot) {
        return staged.lookupByOfficeSlot(slot);
    }

    @Override
    public List<CanonicalRepresentative> findByJurisdiction(GovernmentLevel level, String jurisdiction) {
        return staged.findByJurisdiction(level, jurisdiction);
    }

    @Override
    public List<CanonicalRepresentative> findReplacedBy(String canonicalId) {
        return staged.findReplacedBy(canonicalId);
    }

    @Override
    public List<CanonicalRepresentative> findByStatus(RepresentativeStatus status) {
        return staged.findByStatus(status);
    }

    @Override
    public List<CanonicalRepresentative> findAll() {
        return staged.findAll();
    }

    @Override
    public long count() {
        return staged.count();
    }

    @Override
    public UpsertOutcome upsert(CanonicalRepresentative representative) {
        UpsertOutcome outcome = staged.upsert(representative);
        if (outcome != UpsertOutcome.UNCHANGED) {
            stagedWrites.incrementAndGet();
        }
        return outcome;
    }

    @Override
    public CanonicalRepresentative applyStatusTransition(String canonicalId, RepresentativeStatus newStatus,
                                                         StatusReason reason, String replacedById, Instant at) {
        CanonicalRepresentative before = staged.findById(canonicalId).orElse(null);
        CanonicalRepresentative after = staged.applyStatusTransition(canonicalId, newStatus, reason, replacedById, at);
        if (after != before) {
            stagedWrites.incrementAndGet();
        }
        return after;
    }
}
