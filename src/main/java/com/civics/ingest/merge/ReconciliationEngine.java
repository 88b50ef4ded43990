package com.civics.ingest.merge;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.CrosswalkKey;
import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.FieldProvenance;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.core.model.VerificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Merges the source records of one canonical entity, plus its persisted state, into a single
 * {@link CanonicalRepresentative}.
 *
 * <p>For every field the candidates are ranked by provider precedence for the field's category,
 * then by the time the candidate's value was first fetched, then by provider declaration order,
 * external id and value. The ranking is a total order over the candidates, so the merge result
 * does not depend on the order in which records arrive. A provider that reports the same value
 * again keeps the time it first reported it, so refetching unchanged data never reorders them.
 * The persisted value takes part as a candidate carrying its provenance, which keeps a lower-precedence provider from overwriting a government-sourced value.</p>
 *
 * <p>The engine is pure: it reads nothing but its arguments and writes nothing.</p>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private static final Comparator<SourceRecord> FRESHEST_FIRST = Comparator
            .comparing(SourceRecord::fetchedAt, Comparator.reverseOrder())
            .thenComparing(SourceRecord::confidence, Comparator.reverseOrder())
            .thenComparing(r -> Objects.toString(r.payloadRef(), ""));

    private final SourcePrecedence precedence;
    private final DataQualityScorer qualityScorer;

    public ReconciliationEngine() {
        this(SourcePrecedence.defaults(), new DataQualityScorer());
    }

    public ReconciliationEngine(SourcePrecedence precedence, DataQualityScorer qualityScorer) {
        this.precedence = precedence;
        this.qualityScorer = qualityScorer;
    }

    /**
     * Reconciles {@code records} into the entity {@code canonicalId}.
     *
     * @param existing    persisted state, empty when the entity is being created
     * @param canonicalId id of the entity
     * @param records     this run's records resolved to the entity
     * @param now         creation time for new entities
     * @param claimable   whether a cross-referenced key may be added to this entity's crosswalk,
     *                    i.e. no other entity owns it
     */
    public ReconciliationResult reconcile(Optional<CanonicalRepresentative> existing, String canonicalId,
                                          List<SourceRecord> records, Instant now,
                                          Predicate<CrosswalkKey> claimable) {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        existing.ifPresent(e -> {
            if (!e.getCanonicalId().equals(canonicalId)) {
                throw new IllegalArgumentException("Persisted entity " + e.getCanonicalId()
                        + " does not match " + canonicalId);
            }
        });

        List<SourceRecord> distinct = freshestPerKey(records);
        CanonicalRepresentative.Builder builder = existing
                .map(CanonicalRepresentative::toBuilder)
                .orElseGet(() -> CanonicalRepresentative.builder()
                        .canonicalId(canonicalId)
                        .status(RepresentativeStatus.ACTIVE)
                        .createdAt(now)
                        .statusChangedAt(now));

        for (FieldKey field : FieldKey.values()) {
            mergeField(field, existing.orElse(null), distinct, builder);
        }
        List<CrosswalkKey> skipped = mergeCrosswalk(existing.orElse(null), distinct, builder, claimable);

        CanonicalRepresentative draft = builder.build();
        double score = qualityScorer.score(draft.getLevel(), draft.getFieldProvenance());
        VerificationStatus verification = qualityScorer.verification(score, draft.getDataSources());
        CanonicalRepresentative merged = draft.toBuilder()
                .dataQualityScore(score)
                .verificationStatus(verification)
                .build();

        Set<FieldKey> changed = changedFields(existing.orElse(null), merged);
        log.debug("reconcile.merged canonicalId={} records={} changedFields={} score={}",
                canonicalId, distinct.size(), changed, score);
        return new ReconciliationResult(merged, existing.isEmpty(), changed, skipped);
    }

    private void mergeField(FieldKey field, CanonicalRepresentative existing,
                            List<SourceRecord> records, CanonicalRepresentative.Builder builder) {
        FieldProvenance currentProvenance = existing != null ? existing.getFieldProvenance().get(field) : null;
        List<Candidate> reporters = new ArrayList<>();
        for (SourceRecord record : records) {
            Object value = record.fields().get(field);
            if (value != null) {
                // A value the provider already reported ranks by when it was first seen.
                Instant seen = currentProvenance != null ? currentProvenance.firstSeen(record.source(), value) : null;
                reporters.add(new Candidate(value, record.source(), record.externalId(),
                        seen != null ? seen : record.fetchedAt(), precedence.rank(field, record.source()), false));
            }
        }
        if (reporters.isEmpty()) {
            return;
        }

        Object currentValue = existing != null ? existing.getField(field) : null;
        List<Candidate> candidates = new ArrayList<>(reporters);
        if (currentValue != null) {
            candidates.add(currentProvenance != null
                    ? new Candidate(currentValue, currentProvenance.source(),
                            existing.getCrosswalkId(currentProvenance.source()).orElse(""),
                            currentProvenance.fetchedAt(), precedence.rank(field, currentProvenance.source()), true)
                    : new Candidate(currentValue, null, "", Instant.EPOCH, Integer.MIN_VALUE, true));
        }
        candidates.sort(Candidate.ORDER);
        Candidate winner = candidates.get(0);
        Map<Provider, FieldProvenance.Report> reports = reports(currentProvenance, candidates);

        int reporting = reporters.size();
        int agreeing = (int) reporters.stream().filter(c -> c.value().equals(winner.value())).count();
        FieldProvenance provenance;
        if (winner.persisted()) {
            if (currentProvenance == null) {
                return;
            }
            provenance = new FieldProvenance(currentProvenance.source(), currentProvenance.fetchedAt(),
                    reporting + 1, agreeing + 1, reports);
        } else {
            boolean unchanged = currentProvenance != null
                    && winner.value().equals(currentValue)
                    && winner.provider() == currentProvenance.source();
            Instant fetchedAt = unchanged ? currentProvenance.fetchedAt() : winner.fetchedAt();
            provenance = new FieldProvenance(winner.provider(), fetchedAt, reporting, agreeing, reports);
        }
        builder.field(field, winner.value()).provenance(field, provenance);
    }

    /**
     * Carries every provider's last report forward and records this pass's reports, taking the
     * best-ranked one when a provider reported through more than one record.
     */
    private static Map<Provider, FieldProvenance.Report> reports(FieldProvenance current, List<Candidate> ranked) {
        Map<Provider, FieldProvenance.Report> reports = new EnumMap<>(Provider.class);
        if (current != null) {
            reports.putAll(current.reports());
        }
        Set<Provider> reported = EnumSet.noneOf(Provider.class);
        for (Candidate candidate : ranked) {
            if (!candidate.persisted() && reported.add(candidate.provider())) {
                reports.put(candidate.provider(), new FieldProvenance.Report(candidate.value(), candidate.fetchedAt()));
            }
        }
        return reports;
    }

    private List<CrosswalkKey> mergeCrosswalk(CanonicalRepresentative existing, List<SourceRecord> records,
                                              CanonicalRepresentative.Builder builder,
                                              Predicate<CrosswalkKey> claimable) {
        Map<Provider, String> crosswalk = new EnumMap<>(Provider.class);
        if (existing != null) {
            crosswalk.putAll(existing.getCrosswalk());
        }

        // One own key per provider: the freshest record wins, older ids of that provider retire.
        Map<Provider, SourceRecord> ownKeys = new EnumMap<>(Provider.class);
        for (SourceRecord record : records) {
            ownKeys.merge(record.source(), record, (a, b) -> FRESHEST_FIRST.compare(a, b) <= 0 ? a : b);
        }
        for (SourceRecord record : records) {
            SourceRecord kept = ownKeys.get(record.source());
            if (kept != record && !kept.externalId().equals(record.externalId())) {
                builder.retiredCrosswalk(record.source(), record.externalId());
            }
        }
        ownKeys.forEach((provider, record) -> {
            String previous = crosswalk.put(provider, record.externalId());
            if (previous != null && !previous.equals(record.externalId())) {
                builder.retiredCrosswalk(provider, previous);
            }
        });

        List<CrosswalkKey> skipped = new ArrayList<>();
        for (SourceRecord record : records) {
            record.fields().crossReferences().forEach((provider, externalId) -> {
                CrosswalkKey key = new CrosswalkKey(provider, externalId);
                String held = crosswalk.get(provider);
                if (held == null && claimable.test(key)) {
                    crosswalk.put(provider, externalId);
                } else if (!externalId.equals(held) && !skipped.contains(key)) {
                    skipped.add(key);
                }
            });
        }
        if (!skipped.isEmpty()) {
            log.debug("reconcile.crossReferencesSkipped keys={}", skipped);
        }
        crosswalk.forEach(builder::crosswalk);
        return skipped;
    }

    /**
     * Collapses repeated records of the same crosswalk key to the freshest one, and returns
     * the survivors in a canonical order.
     */
    static List<SourceRecord> freshestPerKey(List<SourceRecord> records) {
        Map<CrosswalkKey, SourceRecord> byKey = new LinkedHashMap<>();
        for (SourceRecord record : records) {
            byKey.merge(record.crosswalkKey(), record, (a, b) -> FRESHEST_FIRST.compare(a, b) <= 0 ? a : b);
        }
        List<SourceRecord> distinct = new ArrayList<>(byKey.values());
        distinct.sort(Comparator.comparing(SourceRecord::source).thenComparing(SourceRecord::externalId));
        return distinct;
    }

    private static Set<FieldKey> changedFields(CanonicalRepresentative before, CanonicalRepresentative after) {
        Set<FieldKey> changed = EnumSet.noneOf(FieldKey.class);
        for (FieldKey field : FieldKey.values()) {
            Object old = before != null ? before.getField(field) : null;
            if (!Objects.equals(old, after.getField(field))) {
                changed.add(field);
            }
        }
        return changed;
    }

    private record Candidate(Object value, Provider provider, String externalId, Instant fetchedAt,
                             int rank, boolean persisted) {

        static final Comparator<Candidate> ORDER = Comparator
                .comparingInt(Candidate::rank).reversed()
                .thenComparing(Candidate::fetchedAt, Comparator.reverseOrder())
                .thenComparing(Candidate::provider, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Candidate::externalId)
                .thenComparing(Candidate::persisted)
                .thenComparing(c -> String.valueOf(c.value()));
    }
}
