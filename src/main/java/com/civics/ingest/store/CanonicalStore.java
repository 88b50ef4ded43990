package com.civics.ingest.store;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.OfficeSlot;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for canonical representatives.
 *
 * <p>Every write is an idempotent upsert keyed by canonical id, so replaying a run is safe.
 * Crosswalk keys are unique per provider across the whole store. Implementations throw
 * {@link StoreUnavailableException} when they cannot write at all.</p>
 */
public interface CanonicalStore {

    Optional<CanonicalRepresentative> findById(String canonicalId);

    Optional<CanonicalRepresentative> lookupByCrosswalk(Provider source, String externalId);

    /**
     * All entities of any status that hold or have held the given office slot.
     */
    List<CanonicalRepresentative> lookupByOfficeSlot(OfficeSlot slot);

    default List<CanonicalRepresentative> lookupByOfficeSlot(String office, String jurisdiction, String district) {
        return lookupByOfficeSlot(new OfficeSlot(office, jurisdiction, district));
    }

    /**
     * Entities of the given level whose jurisdiction equals {@code jurisdiction}, ignoring case.
     */
    List<CanonicalRepresentative> findByJurisdiction(GovernmentLevel level, String jurisdiction);

    /**
     * Historical entities whose {@code replacedById} points at {@code canonicalId}.
     */
    List<CanonicalRepresentative> findReplacedBy(String canonicalId);

    List<CanonicalRepresentative> findByStatus(RepresentativeStatus status);

    List<CanonicalRepresentative> findAll();

    long count();

    /**
     * Inserts or replaces the entity. Crosswalk keys the entity no longer lists are released.
     *
     * @throws CrosswalkConflictException if another entity owns one of its crosswalk keys
     */
    UpsertOutcome upsert(CanonicalRepresentative representative);

    /**
     * Moves an entity to {@code newStatus}. Re-applying the current status with the same
     * reason and successor is a no-op. A historical entity may only have its successor
     * re-pointed forward. {@code statusChangedAt} never decreases.
     *
     * @return the stored entity after the transition
     * @throws EntityNotFoundException if the entity or the successor does not exist
     * @throws com.civics.ingest.lifecycle.InvalidTransitionException for illegal moves
     */
    CanonicalRepresentative applyStatusTransition(String canonicalId, RepresentativeStatus newStatus,
                                                  StatusReason reason, String replacedById, Instant at);
}
