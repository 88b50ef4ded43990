package com.civics.ingest.store;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.CrosswalkKey;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.OfficeSlot;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;
import com.civics.ingest.lifecycle.InvalidTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * In-memory {@link CanonicalStore}.
 *
 * <p>Writes to one entity are serialized on a per-id monitor. Crosswalk keys are claimed
 * with {@code putIfAbsent} on a shared index, so two entities racing for one key cannot
 * both win; a failed claim rolls back the keys taken earlier in the same write.</p>
 */
public class InMemoryCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCanonicalStore.class);

    private static final Comparator<CanonicalRepresentative> STABLE_ORDER =
            Comparator.comparing(CanonicalRepresentative::getCreatedAt)
                    .thenComparing(CanonicalRepresentative::getCanonicalId);

    private final ConcurrentMap<String, CanonicalRepresentative> entities = new ConcurrentHashMap<>();
    private final ConcurrentMap<CrosswalkKey, String> crosswalkIndex = new ConcurrentHashMap<>();
    private final ConcurrentMap<OfficeSlot, Set<String>> slotIndex = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> monitors = new ConcurrentHashMap<>();

    /**
     * A store holding a copy of every entity in {@code source}.
     */
    public static InMemoryCanonicalStore copyOf(CanonicalStore source) {
        InMemoryCanonicalStore copy = new InMemoryCanonicalStore();
        source.findAll().forEach(copy::upsert);
        return copy;
    }

    @Override
    public Optional<CanonicalRepresentative> findById(String canonicalId) {
        return Optional.ofNullable(entities.get(canonicalId));
    }

    @Override
    public Optional<CanonicalRepresentative> lookupByCrosswalk(Provider source, String externalId) {
        String id = crosswalkIndex.get(new CrosswalkKey(source, externalId));
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public List<CanonicalRepresentative> lookupByOfficeSlot(OfficeSlot slot) {
        Set<String> ids = slotIndex.getOrDefault(slot, Set.of());
        return ids.stream()
                .map(entities::get)
                .filter(Objects::nonNull)
                .sorted(STABLE_ORDER)
                .toList();
    }

    @Override
    public List<CanonicalRepresentative> findByJurisdiction(GovernmentLevel level, String jurisdiction) {
        return filter(r -> r.getLevel() == level
                && r.getJurisdiction() != null
                && r.getJurisdiction().equalsIgnoreCase(jurisdiction));
    }

    @Override
    public List<CanonicalRepresentative> findReplacedBy(String canonicalId) {
        return filter(r -> canonicalId.equals(r.getReplacedById()));
    }

    @Override
    public List<CanonicalRepresentative> findByStatus(RepresentativeStatus status) {
        return filter(r -> r.getStatus() == status);
    }

    @Override
    public List<CanonicalRepresentative> findAll() {
        return filter(r -> true);
    }

    @Override
    public long count() {
        return entities.size();
    }

    @Override
    public UpsertOutcome upsert(CanonicalRepresentative representative) {
        String id = representative.getCanonicalId();
        synchronized (monitor(id)) {
            CanonicalRepresentative existing = entities.get(id);
            if (representative.sameContentAs(existing)) {
                return UpsertOutcome.UNCHANGED;
            }

            List<CrosswalkKey> claimed = new ArrayList<>();
            for (Map.Entry<Provider, String> entry : representative.getCrosswalk().entrySet()) {
                CrosswalkKey key = new CrosswalkKey(entry.getKey(), entry.getValue());
                String owner = crosswalkIndex.putIfAbsent(key, id);
                if (owner == null) {
                    claimed.add(key);
                } else if (!owner.equals(id)) {
                    claimed.forEach(k -> crosswalkIndex.remove(k, id));
                    log.warn("store.crosswalkConflict key={} owner={} claimant={}", key, owner, id);
                    throw new CrosswalkConflictException(key, owner, id);
                }
            }
            if (existing != null) {
                existing.getCrosswalk().forEach((provider, externalId) -> {
                    if (!externalId.equals(representative.getCrosswalk().get(provider))) {
                        crosswalkIndex.remove(new CrosswalkKey(provider, externalId), id);
                    }
                });
            }

            entities.put(id, representative);
            representative.getOfficeSlot().ifPresent(slot ->
                    slotIndex.computeIfAbsent(slot, s -> ConcurrentHashMap.newKeySet()).add(id));
            return existing == null ? UpsertOutcome.CREATED : UpsertOutcome.UPDATED;
        }
    }

    @Override
    public CanonicalRepresentative applyStatusTransition(String canonicalId, RepresentativeStatus newStatus,
                                                         StatusReason reason, String replacedById, Instant at) {
        synchronized (monitor(canonicalId)) {
            CanonicalRepresentative current = entities.get(canonicalId);
            if (current == null) {
                throw new EntityNotFoundException(canonicalId);
            }
            if (replacedById != null) {
                CanonicalRepresentative successor = entities.get(replacedById);
                if (successor == null) {
                    throw new EntityNotFoundException(replacedById);
                }
                if (successor.getStatus() == RepresentativeStatus.HISTORICAL) {
                    throw new IllegalStateException("Successor " + replacedById + " of " + canonicalId
                            + " is historical; replacement chains must resolve forward");
                }
            }

            CanonicalRepresentative updated;
            if (current.getStatus() == newStatus) {
                if (current.getStatusReason() == reason && Objects.equals(current.getReplacedById(), replacedById)) {
                    return current;
                }
                if (newStatus != RepresentativeStatus.HISTORICAL) {
                    return current;
                }
                updated = current.toBuilder()
                        .statusReason(reason)
                        .replacedById(replacedById)
                        .build();
            } else {
                if (!current.getStatus().canTransitionTo(newStatus)) {
                    throw new InvalidTransitionException(canonicalId, current.getStatus(), newStatus);
                }
                Instant changedAt = at.isBefore(current.getStatusChangedAt()) ? current.getStatusChangedAt() : at;
                updated = current.toBuilder()
                        .status(newStatus)
                        .statusReason(reason)
                        .replacedById(newStatus == RepresentativeStatus.HISTORICAL ? replacedById : null)
                        .statusChangedAt(changedAt)
                        .build();
            }
            entities.put(canonicalId, updated);
            log.debug("store.statusApplied canonicalId={} status={} reason={} replacedBy={}",
                    canonicalId, newStatus, reason, replacedById);
            return updated;
        }
    }

    private Object monitor(String canonicalId) {
        return monitors.computeIfAbsent(canonicalId, k -> new Object());
    }

    private List<CanonicalRepresentative> filter(Predicate<CanonicalRepresentative> predicate) {
        return entities.values().stream().filter(predicate).sorted(STABLE_ORDER).toList();
    }
}
