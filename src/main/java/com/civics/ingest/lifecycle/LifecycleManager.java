package com.civics.ingest.lifecycle;

import com.civics.ingest.audit.AuditAction;
import com.civics.ingest.audit.AuditService;
import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.OfficeSlot;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;
import com.civics.ingest.lock.EntityLock;
import com.civics.ingest.metrics.MetricsService;
import com.civics.ingest.metrics.NoOpMetricsService;
import com.civics.ingest.store.CanonicalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * State machine over representative status.
 *
 * <pre>
 * ACTIVE --not in current roster, slot vacant--&gt; INACTIVE (not_current_in_source)
 * ACTIVE --slot taken by another current entity--&gt; HISTORICAL (replaced, replacedById)
 * INACTIVE --retention elapsed--&gt; HISTORICAL (term_ended | retired | deceased)
 * </pre>
 *
 * Nothing ever moves back to ACTIVE; a returning official gets a new entity. Whenever an entity
 * becomes historical, entities that named it as their successor are re-pointed to its own
 * successor, so {@code replacedById} never resolves to a historical entity.
 */
public class LifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private static final Comparator<OfficeSlot> SLOT_ORDER = Comparator.comparing(OfficeSlot::toString);

    private final CanonicalStore store;
    private final LifecyclePolicy policy;
    private final EntityLock entityLock;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public LifecycleManager(CanonicalStore store, LifecyclePolicy policy, EntityLock entityLock,
                            AuditService auditService) {
        this(store, policy, entityLock, auditService, new NoOpMetricsService());
    }

    public LifecycleManager(CanonicalStore store, LifecyclePolicy policy, EntityLock entityLock,
                            AuditService auditService, MetricsService metricsService) {
        this.store = store;
        this.policy = policy;
        this.entityLock = entityLock;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    public LifecyclePolicy policy() {
        return policy;
    }

    /**
     * Plans deactivations and replacements for one roster provider.
     *
     * <p>Per office slot with {@code k} seats, where C are the provider's current claimants and
     * O the active entities it reported before but not now:</p>
     * <ul>
     *     <li>|C| &gt; k: ambiguous, nothing moves;</li>
     *     <li>one seat and one claimant: every O is replaced by the claimant;</li>
     *     <li>one seat and no claimant: every O goes inactive;</li>
     *     <li>several seats: without newcomers O goes inactive, one newcomer and one departing
     *     occupant pair up as a replacement, anything else is ambiguous.</li>
     * </ul>
     */
    public TransitionPlan plan(RosterSnapshot snapshot) {
        Provider provider = snapshot.provider();
        Map<OfficeSlot, List<String>> claimants = new TreeMap<>(SLOT_ORDER);
        for (String id : snapshot.currentIds().stream().sorted().toList()) {
            store.findById(id)
                    .filter(CanonicalRepresentative::isActive)
                    .flatMap(CanonicalRepresentative::getOfficeSlot)
                    .ifPresent(slot -> claimants.computeIfAbsent(slot, s -> new ArrayList<>()).add(id));
        }

        Map<OfficeSlot, List<String>> departing = new TreeMap<>(SLOT_ORDER);
        List<StatusTransition> transitions = new ArrayList<>();
        for (CanonicalRepresentative rep : store.findByStatus(RepresentativeStatus.ACTIVE)) {
            if (!rep.hasCrosswalk(provider) || snapshot.currentIds().contains(rep.getCanonicalId())
                    || !snapshot.completeScope().test(rep)) {
                continue;
            }
            Optional<OfficeSlot> slot = rep.getOfficeSlot();
            if (slot.isPresent()) {
                departing.computeIfAbsent(slot.get(), s -> new ArrayList<>()).add(rep.getCanonicalId());
            } else {
                transitions.add(StatusTransition.deactivate(rep.getCanonicalId()));
            }
        }

        Set<OfficeSlot> slots = new TreeSet<>(SLOT_ORDER);
        slots.addAll(claimants.keySet());
        slots.addAll(departing.keySet());

        List<AmbiguousReplacement> ambiguous = new ArrayList<>();
        for (OfficeSlot slot : slots) {
            List<String> current = claimants.getOrDefault(slot, List.of());
            List<String> leaving = departing.getOrDefault(slot, List.of());
            int seats = policy.seatCapacity(slot);

            if (current.size() > seats) {
                ambiguous.add(new AmbiguousReplacement(slot, seats, current, leaving));
                continue;
            }
            if (leaving.isEmpty()) {
                continue;
            }
            if (seats == 1) {
                if (current.size() == 1) {
                    leaving.forEach(id -> transitions.add(StatusTransition.replace(id, current.get(0))));
                } else {
                    leaving.forEach(id -> transitions.add(StatusTransition.deactivate(id)));
                }
                continue;
            }
            List<String> newcomers = current.stream().filter(snapshot.newcomerIds()::contains).toList();
            if (newcomers.isEmpty()) {
                leaving.forEach(id -> transitions.add(StatusTransition.deactivate(id)));
            } else if (newcomers.size() == 1 && leaving.size() == 1) {
                transitions.add(StatusTransition.replace(leaving.get(0), newcomers.get(0)));
            } else {
                ambiguous.add(new AmbiguousReplacement(slot, seats, current, leaving));
            }
        }

        TransitionPlan plan = new TransitionPlan(transitions, ambiguous);
        log.info("lifecycle.planned provider={} current={} deactivations={} replacements={} ambiguous={}",
                provider.key(), snapshot.currentIds().size(), plan.deactivations(), plan.replacements(),
                ambiguous.size());
        return plan;
    }

    /**
     * Applies one planned move under the entity lock, then re-points predecessors forward.
     *
     * @return the entity after the move
     */
    public CanonicalRepresentative apply(StatusTransition transition, String runId, Instant at) {
        String forwardTo = transition.replacedById();
        if (forwardTo == null && transition.to() == RepresentativeStatus.HISTORICAL) {
            forwardTo = soleActiveOccupant(transition.canonicalId()).orElse(null);
        }
        return apply(transition, forwardTo, runId, at);
    }

    /**
     * Retires the entity whose crosswalk key moved to {@code successorId} because its official
     * returned. An inactive predecessor becomes historical with reason term_ended; its own
     * predecessors then point at the successor.
     */
    public Optional<CanonicalRepresentative> retireForReactivation(String predecessorId, String successorId,
                                                                   String runId, Instant at) {
        Optional<CanonicalRepresentative> predecessor = store.findById(predecessorId);
        if (predecessor.isEmpty() || predecessor.get().getStatus() != RepresentativeStatus.INACTIVE) {
            return predecessor;
        }
        StatusTransition transition = new StatusTransition(predecessorId, RepresentativeStatus.INACTIVE,
                RepresentativeStatus.HISTORICAL, StatusReason.TERM_ENDED, null);
        return Optional.of(apply(transition, successorId, runId, at));
    }

    /**
     * Inactive entities whose retention period has elapsed at {@code now}. An entity that still
     * has predecessors is deferred until its slot has exactly one active occupant to take them.
     */
    public List<StatusTransition> planPromotions(Instant now) {
        Instant cutoff = now.minus(policy.inactiveRetention());
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        List<StatusTransition> promotions = new ArrayList<>();
        int deferred = 0;
        for (CanonicalRepresentative rep : store.findByStatus(RepresentativeStatus.INACTIVE)) {
            if (rep.getStatusChangedAt().isAfter(cutoff)) {
                continue;
            }
            if (!store.findReplacedBy(rep.getCanonicalId()).isEmpty()
                    && soleActiveOccupant(rep.getCanonicalId()).isEmpty()) {
                log.debug("lifecycle.promotionDeferred canonicalId={}", rep.getCanonicalId());
                deferred++;
                continue;
            }
            promotions.add(new StatusTransition(rep.getCanonicalId(), RepresentativeStatus.INACTIVE,
                    RepresentativeStatus.HISTORICAL, promotionReason(rep, today), null));
        }
        log.info("lifecycle.promotionsPlanned eligible={} deferred={}", promotions.size(), deferred);
        return promotions;
    }

    static StatusReason promotionReason(CanonicalRepresentative rep, LocalDate today) {
        StatusReason hint = rep.getStatusHint();
        if (hint != null && hint.isPromotionReason()) {
            return hint;
        }
        if (rep.getTermEnd() != null && rep.getTermEnd().isBefore(today)) {
            return StatusReason.TERM_ENDED;
        }
        return StatusReason.RETIRED;
    }

    private CanonicalRepresentative apply(StatusTransition transition, String forwardTo, String runId, Instant at) {
        String id = transition.canonicalId();
        boolean hasPredecessors = transition.to() == RepresentativeStatus.HISTORICAL
                && !store.findReplacedBy(id).isEmpty();
        if (hasPredecessors && forwardTo == null) {
            log.info("lifecycle.transitionDeferred canonicalId={} reason=no_single_successor", id);
            return store.findById(id).orElseThrow();
        }

        CanonicalRepresentative[] states = new CanonicalRepresentative[2];
        entityLock.withLock(id, () -> {
            states[0] = store.findById(id).orElse(null);
            states[1] = store.applyStatusTransition(id, transition.to(), transition.reason(),
                    transition.replacedById(), at);
            return null;
        });
        CanonicalRepresentative before = states[0];
        CanonicalRepresentative after = states[1];

        if (before != null && !before.sameContentAs(after)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from", before.getStatus().name());
            details.put("to", after.getStatus().name());
            details.put("reason", after.getStatusReason().code());
            if (after.getReplacedById() != null) {
                details.put("replacedById", after.getReplacedById());
            }
            auditService.record(AuditAction.STATUS_TRANSITIONED, id, runId, details);
            if (transition.isReplacement()) {
                auditService.record(AuditAction.REPLACEMENT_LINKED, id, runId,
                        Map.of("successorId", transition.replacedById(), "slot",
                                after.getOfficeSlot().map(OfficeSlot::toString).orElse("-")));
            }
            if (before.getStatus() != after.getStatus()) {
                metricsService.incrementStatusTransition(after.getStatus(), after.getStatusReason());
            }
            log.info("lifecycle.transitioned canonicalId={} from={} to={} reason={} replacedBy={}",
                    id, before.getStatus(), after.getStatus(), after.getStatusReason().code(),
                    after.getReplacedById());
        }

        if (after.getStatus() == RepresentativeStatus.HISTORICAL && forwardTo != null) {
            repointPredecessors(id, forwardTo, runId, at);
        }
        return after;
    }

    private void repointPredecessors(String formerSuccessorId, String successorId, String runId, Instant at) {
        for (CanonicalRepresentative predecessor : store.findReplacedBy(formerSuccessorId)) {
            String predecessorId = predecessor.getCanonicalId();
            entityLock.withLock(predecessorId, () -> store.applyStatusTransition(predecessorId,
                    RepresentativeStatus.HISTORICAL, predecessor.getStatusReason(), successorId, at));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("previousSuccessorId", formerSuccessorId);
            details.put("successorId", successorId);
            auditService.record(AuditAction.REPLACEMENT_LINKED, predecessorId, runId, details);
            log.debug("lifecycle.repointed canonicalId={} from={} to={}", predecessorId, formerSuccessorId, successorId);
        }
    }

    private Optional<String> soleActiveOccupant(String canonicalId) {
        Optional<OfficeSlot> slot = store.findById(canonicalId).flatMap(CanonicalRepresentative::getOfficeSlot);
        if (slot.isEmpty()) {
            return Optional.empty();
        }
        // The slot index still lists former holders; only entities seated there now count.
        List<String> occupants = store.lookupByOfficeSlot(slot.get()).stream()
                .filter(CanonicalRepresentative::isActive)
                .filter(c -> c.getOfficeSlot().filter(slot.get()::equals).isPresent())
                .map(CanonicalRepresentative::getCanonicalId)
                .filter(id -> !id.equals(canonicalId))
                .toList();
        return occupants.size() == 1 ? Optional.of(occupants.get(0)) : Optional.empty();
    }
}
