package com.civics.ingest.resolve;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.CrosswalkKey;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.NameParts;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.metrics.MetricsService;
import com.civics.ingest.metrics.NoOpMetricsService;
import com.civics.ingest.review.ReviewItem;
import com.civics.ingest.review.ReviewReason;
import com.civics.ingest.similarity.RepresentativeSimilarityScorer;
import com.civics.ingest.similarity.SimilarityBreakdown;
import com.civics.ingest.store.CanonicalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Assigns every incoming source record to an existing canonical id or to a newly minted one.
 *
 * <ol>
 *   <li>Records of the batch that share any crosswalk key, their own or a cross reference,
 *       form one group and resolve together.</li>
 *   <li>A group whose keys are held by exactly one active entity resolves to it. Keys held by
 *       more than one active entity are a conflict and go to review.</li>
 *   <li>Keys held only by a non-active entity resolve to it, except when the group contains a
 *       current roster record: a returning official always gets a new entity.</li>
 *   <li>With no key match, the fuzzy fallback compares the group against entities of the same
 *       level and jurisdiction that have no key for the group's providers yet.</li>
 * </ol>
 *
 * <p>The resolver never writes. Fuzzy decisions and review items are returned so the caller
 * can apply them, or only report them during a dry run.</p>
 */
public class CanonicalResolver {
    private static final Logger log = LoggerFactory.getLogger(CanonicalResolver.class);

    private final CanonicalStore store;
    private final RepresentativeSimilarityScorer scorer;
    private final FuzzyMatchLedger ledger;
    private final ResolverOptions options;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public CanonicalResolver(CanonicalStore store, FuzzyMatchLedger ledger) {
        this(store, new RepresentativeSimilarityScorer(), ledger, ResolverOptions.defaults(),
                new NoOpMetricsService(), Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public CanonicalResolver(CanonicalStore store, RepresentativeSimilarityScorer scorer, FuzzyMatchLedger ledger,
                             ResolverOptions options, MetricsService metricsService, Clock clock,
                             Supplier<String> idGenerator) {
        this.store = store;
        this.scorer = scorer;
        this.ledger = ledger;
        this.options = options;
        this.metricsService = metricsService;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public ResolutionResult resolveBatch(List<SourceRecord> records, String runId) {
        List<ResolvedRecord> resolved = new ArrayList<>();
        List<SourceRecord> unmatched = new ArrayList<>();
        List<SourceRecord> conflicted = new ArrayList<>();
        List<ReviewItem> reviewItems = new ArrayList<>();

        for (List<SourceRecord> group : groupBySharedKeys(records)) {
            resolveGroup(group, runId, resolved, unmatched, conflicted, reviewItems);
        }

        log.debug("resolver.batch runId={} records={} resolved={} unmatched={} conflicted={} reviews={}",
                runId, records.size(), resolved.size(), unmatched.size(), conflicted.size(), reviewItems.size());
        return new ResolutionResult(resolved, unmatched, conflicted, reviewItems);
    }

    private void resolveGroup(List<SourceRecord> group, String runId, List<ResolvedRecord> resolved,
                              List<SourceRecord> unmatched, List<SourceRecord> conflicted,
                              List<ReviewItem> reviewItems) {
        Map<CrosswalkKey, CanonicalRepresentative> owners = lookupOwners(group);
        Map<String, CanonicalRepresentative> matched = new LinkedHashMap<>();
        owners.values().forEach(e -> matched.putIfAbsent(e.getCanonicalId(), e));

        List<CanonicalRepresentative> active = matched.values().stream()
                .filter(CanonicalRepresentative::isActive)
                .toList();
        SourceRecord lead = lead(group);

        if (active.size() > 1) {
            conflicted.addAll(group);
            List<String> ids = active.stream().map(CanonicalRepresentative::getCanonicalId).sorted().toList();
            log.warn("resolver.crosswalkConflict key={} entities={} payloadRef={}",
                    lead.crosswalkKey(), ids, lead.payloadRef());
            reviewItems.add(ReviewItem.builder()
                    .reason(ReviewReason.CROSSWALK_CONFLICT)
                    .subject(lead.crosswalkKey().toString())
                    .candidateIds(ids)
                    .description("Keys of one batch group are held by " + ids.size() + " active entities")
                    .runId(runId)
                    .submittedAt(clock.instant())
                    .build());
            return;
        }

        if (active.size() == 1) {
            assignExisting(group, active.get(0), owners, resolved);
            return;
        }

        if (!matched.isEmpty()) {
            CanonicalRepresentative latest = matched.values().stream()
                    .max(Comparator.comparing(CanonicalRepresentative::getStatusChangedAt)
                            .thenComparing(CanonicalRepresentative::getCreatedAt))
                    .orElseThrow();
            if (hasCurrentRosterRecord(group)) {
                String newId = idGenerator.get();
                log.info("resolver.reactivation predecessor={} newId={} key={}",
                        latest.getCanonicalId(), newId, lead.crosswalkKey());
                group.forEach(r -> resolved.add(new ResolvedRecord(r, newId, ResolutionDecision.REACTIVATION,
                        1.0, latest.getCanonicalId(), null)));
            } else {
                assignExisting(group, latest, owners, resolved);
            }
            return;
        }

        FuzzyOutcome fuzzy = options.fuzzyEnabled() ? fuzzyMatch(group, lead) : FuzzyOutcome.NONE;
        if (fuzzy.accepted() != null) {
            acceptFuzzy(group, lead, fuzzy, runId, resolved, reviewItems);
            return;
        }

        if (!mayMint(group)) {
            unmatched.addAll(group);
            log.debug("resolver.unmatched key={} records={}", lead.crosswalkKey(), group.size());
            return;
        }

        String newId = idGenerator.get();
        group.forEach(r -> resolved.add(new ResolvedRecord(r, newId, ResolutionDecision.NEW,
                fuzzy.topScore(), null, null)));
        if (!fuzzy.nearMisses().isEmpty()) {
            List<String> candidates = new ArrayList<>(fuzzy.nearMisses());
            candidates.add(0, newId);
            reviewItems.add(ReviewItem.builder()
                    .reason(ReviewReason.POSSIBLE_DUPLICATE)
                    .subject(lead.crosswalkKey().toString())
                    .candidateIds(candidates)
                    .score(fuzzy.topScore())
                    .description("New entity for " + displayName(lead) + " resembles " + fuzzy.nearMisses())
                    .runId(runId)
                    .submittedAt(clock.instant())
                    .build());
            log.info("resolver.possibleDuplicate key={} newId={} candidates={} score={}",
                    lead.crosswalkKey(), newId, fuzzy.nearMisses(), fuzzy.topScore());
        }
    }

    private void assignExisting(List<SourceRecord> group, CanonicalRepresentative target,
                                Map<CrosswalkKey, CanonicalRepresentative> owners, List<ResolvedRecord> resolved) {
        for (SourceRecord r : group) {
            CanonicalRepresentative owner = owners.get(r.crosswalkKey());
            ResolutionDecision decision = owner != null && owner.getCanonicalId().equals(target.getCanonicalId())
                    ? ResolutionDecision.EXACT
                    : ResolutionDecision.EXACT_CROSS_REFERENCE;
            resolved.add(new ResolvedRecord(r, target.getCanonicalId(), decision, 1.0, null, null));
        }
    }

    private void acceptFuzzy(List<SourceRecord> group, SourceRecord lead, FuzzyOutcome fuzzy, String runId,
                             List<ResolvedRecord> resolved, List<ReviewItem> reviewItems) {
        CanonicalRepresentative target = fuzzy.accepted();
        FuzzyMatchRecord match = new FuzzyMatchRecord(
                UUID.randomUUID().toString(),
                group.stream().map(SourceRecord::crosswalkKey).distinct().toList(),
                displayName(lead),
                target.getCanonicalId(),
                fuzzy.breakdown(),
                runId,
                clock.instant(),
                null,
                null);
        group.forEach(r -> resolved.add(new ResolvedRecord(r, target.getCanonicalId(),
                ResolutionDecision.FUZZY_MATCH, fuzzy.topScore(), null, match)));
        reviewItems.add(ReviewItem.builder()
                .reason(ReviewReason.FUZZY_MATCH)
                .subject(lead.crosswalkKey().toString())
                .candidateIds(List.of(target.getCanonicalId()))
                .score(fuzzy.topScore())
                .referenceId(match.id())
                .description("Matched " + displayName(lead) + " to " + target.getDisplayName() + " (" + fuzzy.breakdown() + ")")
                .runId(runId)
                .submittedAt(clock.instant())
                .build());
        log.info("resolver.fuzzyAccepted key={} canonicalId={} {}",
                lead.crosswalkKey(), target.getCanonicalId(), fuzzy.breakdown());
    }

    private FuzzyOutcome fuzzyMatch(List<SourceRecord> group, SourceRecord lead) {
        Optional<GovernmentLevel> level = lead.fields().level();
        Optional<String> jurisdiction = lead.fields().jurisdiction();
        if (level.isEmpty() || jurisdiction.isEmpty() || lead.fields().name().isEmpty()) {
            return FuzzyOutcome.NONE;
        }
        Set<Provider> providers = EnumSet.noneOf(Provider.class);
        group.forEach(r -> providers.add(r.source()));

        List<Scored> scored = store.findByJurisdiction(level.get(), jurisdiction.get()).stream()
                .filter(c -> c.getStatus() != RepresentativeStatus.HISTORICAL)
                .filter(c -> providers.stream().noneMatch(c::hasCrosswalk))
                .filter(c -> group.stream().noneMatch(r -> ledger.isRejected(r.crosswalkKey(), c.getCanonicalId())))
                .map(c -> new Scored(c, scorer.score(lead.fields(), c)))
                .sorted(Comparator.comparingDouble((Scored s) -> s.breakdown().score()).reversed()
                        .thenComparing(s -> s.candidate().getCanonicalId()))
                .toList();
        if (scored.isEmpty()) {
            return FuzzyOutcome.NONE;
        }

        Scored top = scored.get(0);
        double topScore = top.breakdown().score();
        metricsService.recordFuzzyScore(topScore);
        boolean unique = scored.size() == 1 || scored.get(1).breakdown().score() < options.acceptThreshold();
        if (topScore >= options.acceptThreshold() && unique) {
            return new FuzzyOutcome(top.candidate(), top.breakdown(), topScore, List.of());
        }
        List<String> nearMisses = scored.stream()
                .filter(s -> s.breakdown().score() >= options.reviewThreshold())
                .map(s -> s.candidate().getCanonicalId())
                .toList();
        return new FuzzyOutcome(null, top.breakdown(), topScore, nearMisses);
    }

    private Map<CrosswalkKey, CanonicalRepresentative> lookupOwners(List<SourceRecord> group) {
        Map<CrosswalkKey, CanonicalRepresentative> owners = new LinkedHashMap<>();
        for (CrosswalkKey key : keysOf(group)) {
            store.lookupByCrosswalk(key.provider(), key.externalId()).ifPresent(e -> owners.put(key, e));
        }
        return owners;
    }

    /**
     * Union-find over records that share a crosswalk key.
     */
    static List<List<SourceRecord>> groupBySharedKeys(List<SourceRecord> records) {
        int[] parent = new int[records.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        Map<CrosswalkKey, Integer> firstHolder = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            for (CrosswalkKey key : keysOf(List.of(records.get(i)))) {
                Integer other = firstHolder.putIfAbsent(key, i);
                if (other != null) {
                    union(parent, other, i);
                }
            }
        }
        Map<Integer, List<SourceRecord>> groups = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(records.get(i));
        }
        return new ArrayList<>(groups.values());
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) {
            parent[Math.max(ra, rb)] = Math.min(ra, rb);
        }
    }

    private static Set<CrosswalkKey> keysOf(List<SourceRecord> group) {
        Set<CrosswalkKey> keys = new LinkedHashSet<>();
        for (SourceRecord r : group) {
            keys.add(r.crosswalkKey());
            r.fields().crossReferences().forEach((provider, id) -> keys.add(new CrosswalkKey(provider, id)));
        }
        return keys;
    }

    /**
     * The record that speaks for the group: a current roster record when there is one.
     */
    private static SourceRecord lead(List<SourceRecord> group) {
        return group.stream()
                .min(Comparator.comparing((SourceRecord r) -> r.source().isEnrichmentOnly())
                        .thenComparing(r -> !r.isCurrent())
                        .thenComparing(r -> r.source().ordinal())
                        .thenComparing(SourceRecord::externalId))
                .orElseThrow();
    }

    private static boolean hasCurrentRosterRecord(List<SourceRecord> group) {
        return group.stream().anyMatch(r -> r.source().isCurrentRoster() && r.isCurrent());
    }

    /**
     * Only a currently serving official reported by a non-enrichment provider creates an entity.
     */
    private static boolean mayMint(List<SourceRecord> group) {
        return group.stream().anyMatch(r -> !r.source().isEnrichmentOnly() && r.isCurrent());
    }

    private static String displayName(SourceRecord r) {
        return r.fields().name().map(NameParts::display).orElse(r.crosswalkKey().toString());
    }

    private record Scored(CanonicalRepresentative candidate, SimilarityBreakdown breakdown) {
    }

    private record FuzzyOutcome(CanonicalRepresentative accepted, SimilarityBreakdown breakdown,
                                double topScore, List<String> nearMisses) {
        static final FuzzyOutcome NONE = new FuzzyOutcome(null, null, 0.0, List.of());
    }
}
