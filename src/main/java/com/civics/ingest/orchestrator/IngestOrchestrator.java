package com.civics.ingest.orchestrator;

import com.civics.ingest.audit.AuditAction;
import com.civics.ingest.audit.AuditService;
import com.civics.ingest.config.IngestSettings;
import com.civics.ingest.connector.ConnectorRegistry;
import com.civics.ingest.connector.InvalidRecord;
import com.civics.ingest.connector.SourceConnector;
import com.civics.ingest.core.model.CanonicalJson;
import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.CrosswalkKey;
import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.FieldProvenance;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.lifecycle.AmbiguousReplacement;
import com.civics.ingest.lifecycle.InvalidTransitionException;
import com.civics.ingest.lifecycle.LifecycleManager;
import com.civics.ingest.lifecycle.RosterSnapshot;
import com.civics.ingest.lifecycle.StatusTransition;
import com.civics.ingest.lifecycle.TransitionPlan;
import com.civics.ingest.lock.EntityLock;
import com.civics.ingest.lock.LockAcquisitionException;
import com.civics.ingest.logging.LogContext;
import com.civics.ingest.merge.ReconciliationEngine;
import com.civics.ingest.merge.ReconciliationResult;
import com.civics.ingest.metrics.MetricsService;
import com.civics.ingest.ratelimit.RateGovernor;
import com.civics.ingest.resolve.CanonicalResolver;
import com.civics.ingest.resolve.FuzzyMatchLedger;
import com.civics.ingest.resolve.ResolutionDecision;
import com.civics.ingest.resolve.ResolutionResult;
import com.civics.ingest.resolve.ResolvedRecord;
import com.civics.ingest.retry.RetryExecutor;
import com.civics.ingest.review.ReviewItem;
import com.civics.ingest.review.ReviewReason;
import com.civics.ingest.review.ReviewService;
import com.civics.ingest.similarity.RepresentativeSimilarityScorer;
import com.civics.ingest.store.CanonicalStore;
import com.civics.ingest.store.CrosswalkConflictException;
import com.civics.ingest.store.EntityNotFoundException;
import com.civics.ingest.store.StagingCanonicalStore;
import com.civics.ingest.store.StoreUnavailableException;
import com.civics.ingest.store.UpsertOutcome;
import com.civics.ingest.tracing.Span;
import com.civics.ingest.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs ingest end to end.
 *
 * <ol>
 *   <li>FETCH: one worker per provider, in parallel, each governed by its own quota.</li>
 *   <li>ADD: roster records are resolved, reconciled and written per canonical entity.</li>
 *   <li>LIFECYCLE (enrichment runs): entities a roster stopped reporting are deactivated or
 *       replaced, limited to jurisdictions whose fetch completed.</li>
 *   <li>ENRICH: enrichment-only records are merged into entities that already exist.</li>
 * </ol>
 *
 * <p>A run deadline stops fetching only. Whatever was fetched is still written, and the run
 * ends PARTIAL. A dry run resolves and reconciles against a staged copy of the store and
 * reports what it would have changed.</p>
 */
public class IngestOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestOrchestrator.class);

    private final ConnectorRegistry registry;
    private final CanonicalStore store;
    private final IngestSettings settings;
    private final RetryExecutor retryExecutor;
    private final FuzzyMatchLedger ledger;
    private final ReviewService reviewService;
    private final AuditService auditService;
    private final CheckpointRepository checkpoints;
    private final EntityLock entityLock;
    private final ReconciliationEngine reconciliationEngine;
    private final RepresentativeSimilarityScorer scorer;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final ExecutorService fetchExecutor;

    public IngestOrchestrator(ConnectorRegistry registry, CanonicalStore store, IngestSettings settings,
                              RateGovernor governor, RetryExecutor retryExecutor, FuzzyMatchLedger ledger,
                              ReviewService reviewService, AuditService auditService,
                              CheckpointRepository checkpoints, EntityLock entityLock,
                              ReconciliationEngine reconciliationEngine, RepresentativeSimilarityScorer scorer,
                              MetricsService metricsService, TracingService tracingService, Clock clock,
                              Supplier<String> idGenerator) {
        this.registry = registry;
        this.store = store;
        this.settings = settings;
        this.retryExecutor = retryExecutor;
        this.ledger = ledger;
        this.reviewService = reviewService;
        this.auditService = auditService;
        this.checkpoints = checkpoints;
        this.entityLock = entityLock;
        this.reconciliationEngine = reconciliationEngine;
        this.scorer = scorer;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.clock = clock;
        this.idGenerator = idGenerator;

        registry.all().forEach((provider, connector) -> {
            if (!governor.isRegistered(provider)) {
                governor.register(provider, connector.quotaPolicy());
            }
        });
        AtomicInteger threadCount = new AtomicInteger();
        this.fetchExecutor = Executors.newFixedThreadPool(Provider.values().length, r -> {
            Thread t = new Thread(r, "civics-ingest-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs one ingest over {@code providers} and returns its summary.
     *
     * @throws com.civics.ingest.config.ConfigurationException if a provider has no connector
     */
    public IngestRun startRun(IngestMode mode, List<Provider> providers, RunOptions options) {
        Objects.requireNonNull(mode, "mode is required");
        RunOptions runOptions = options != null ? options : RunOptions.defaults();
        List<Provider> ordered = providers.stream().distinct().sorted().toList();
        if (ordered.isEmpty()) {
            throw new IllegalArgumentException("At least one provider is required");
        }
        Map<Provider, SourceConnector> connectors = new EnumMap<>(Provider.class);
        ordered.forEach(p -> connectors.put(p, registry.require(p)));

        String runId = LogContext.generateRunId();
        IngestRun run = new IngestRun(runId, mode, runOptions, ordered, clock.instant());
        RunDeadline deadline = runOptions.getDeadline()
                .or(settings::getRunDeadline)
                .map(d -> RunDeadline.after(d, clock))
                .orElseGet(() -> RunDeadline.none(clock));
        RunContext ctx = newContext(run, runOptions);
        String providerKeys = ordered.stream().map(Provider::key).collect(Collectors.joining(","));

        try (LogContext logCtx = LogContext.forRun(runId, mode.code());
             Span span = tracingService.run(runId, mode.code(), providerKeys)) {
            log.info("run.started runId={} mode={} providers={} options={}", runId, mode.code(), providerKeys,
                    runOptions);
            ctx.audit.record(AuditAction.RUN_STARTED, null, runId, Map.of(
                    "mode", mode.code(),
                    "providers", providerKeys,
                    "dryRun", runOptions.isDryRun()));

            try {
                Map<Provider, ProviderFetchResult> fetched = fetch(ctx, connectors, deadline);
                process(ctx, fetched, connectors);
                if (!runOptions.isDryRun()) {
                    saveCheckpoints(ctx, fetched);
                }
                run.complete(runStatus(ctx, fetched), clock.instant());
            } catch (StoreUnavailableException e) {
                log.error("run.failed runId={} error={}", runId, e.getMessage(), e);
                span.failed(e);
                run.fail(e.getMessage(), clock.instant());
            }

            if (ctx.staging != null) {
                run.stagedWrites(ctx.staging.stagedWrites());
            }
            Duration duration = run.getDuration().orElse(Duration.ZERO);
            metricsService.recordRunDuration(mode.code(), duration);
            ctx.audit.record(AuditAction.RUN_COMPLETED, null, runId, Map.of(
                    "status", run.getStatus().name(),
                    "fetched", run.getTotalFetched(),
                    "created", run.getTotalCreated(),
                    "errors", run.getErrorCount(),
                    "flagged", run.getFlagged().size(),
                    "durationMs", duration.toMillis()));
            span.tag("ingest.status", run.getStatus().name()).tag("ingest.errors", run.getErrorCount());
            if (run.getStatus() != RunStatus.FAILED) {
                span.succeeded();
            }
            log.info("run.completed {}", run.summary());
        }
        return run;
    }

    /**
     * Moves inactive entities whose retention period has elapsed to historical.
     *
     * @return number of entities promoted
     */
    public int promoteExpiredInactive() {
        String runId = LogContext.generateRunId();
        try (LogContext logCtx = LogContext.forRun(runId, "promotion");
             Span span = tracingService.promotion(runId)) {
            LifecycleManager lifecycle = new LifecycleManager(store, settings.getLifecyclePolicy(), entityLock,
                    auditService, metricsService);
            Instant now = clock.instant();
            List<StatusTransition> promotions = lifecycle.planPromotions(now);

            int[] promoted = {0};
            ChunkedWriter.ChunkResult<StatusTransition> result = new ChunkedWriter(settings.getChunkSize())
                    .writeAll("promote", promotions, t -> {
                        try {
                            if (lifecycle.apply(t, runId, now).getStatus() == RepresentativeStatus.HISTORICAL) {
                                promoted[0]++;
                            }
                        } catch (LockAcquisitionException | InvalidTransitionException e) {
                            log.warn("lifecycle.promotionFailed canonicalId={} error={}", t.canonicalId(),
                                    e.getMessage());
                        }
                    });
            span.tag("ingest.promoted", promoted[0]).succeeded();
            log.info("lifecycle.promotionCompleted eligible={} promoted={} skippedChunks={}",
                    promotions.size(), promoted[0], result.skippedChunks());
            return promoted[0];
        }
    }

    private RunContext newContext(IngestRun run, RunOptions options) {
        StagingCanonicalStore staging = options.isDryRun() ? new StagingCanonicalStore(store) : null;
        CanonicalStore runStore = staging != null ? staging : store;
        AuditService runAudit = options.isDryRun() ? new AuditService() : auditService;
        CanonicalResolver resolver = new CanonicalResolver(runStore, scorer, ledger, settings.getResolverOptions(),
                metricsService, clock, idGenerator);
        LifecycleManager lifecycle = new LifecycleManager(runStore, settings.getLifecyclePolicy(), entityLock,
                runAudit, metricsService);
        int chunkSize = options.getChunkSize().orElse(settings.getChunkSize());
        return new RunContext(run, options, runStore, staging, runAudit, resolver, lifecycle,
                new ChunkedWriter(chunkSize));
    }

    // ── Fetch ──

    private Map<Provider, ProviderFetchResult> fetch(RunContext ctx, Map<Provider, SourceConnector> connectors,
                                                     RunDeadline deadline) {
        IngestRun run = ctx.run;
        Map<Provider, ProviderFetchResult> results = new EnumMap<>(Provider.class);
        Map<Provider, ProviderWorker> workers = new EnumMap<>(Provider.class);
        Map<Provider, Future<ProviderFetchResult>> futures = new EnumMap<>(Provider.class);

        for (Map.Entry<Provider, SourceConnector> entry : connectors.entrySet()) {
            Provider provider = entry.getKey();
            SourceConnector connector = entry.getValue();
            if (run.getMode() == IngestMode.FIRST_TIME && provider.isEnrichmentOnly()) {
                log.info("provider.skipped provider={} reason=enrichment_only_on_first_time", provider.key());
                results.put(provider, ProviderFetchResult.skipped(provider, "enrichment-only provider"));
                continue;
            }
            ProviderCheckpoint checkpoint = checkpoints.find(provider)
                    .orElseGet(() -> ProviderCheckpoint.initial(provider));
            List<String> jurisdictions = ctx.options.getJurisdictionFilter().isEmpty()
                    ? connector.defaultJurisdictions()
                    : ctx.options.getJurisdictionFilter();
            ProviderWorker worker = new ProviderWorker(connector, retryExecutor, run.getMode(), jurisdictions,
                    checkpoint, deadline, ctx.options.getRecordLimit().orElse(null), run.getRunId(),
                    run.stats(provider), metricsService, tracingService);
            workers.put(provider, worker);
            futures.put(provider, fetchExecutor.submit(worker));
        }

        for (Map.Entry<Provider, Future<ProviderFetchResult>> entry : futures.entrySet()) {
            Provider provider = entry.getKey();
            Future<ProviderFetchResult> future = entry.getValue();
            ProviderWorker worker = workers.get(provider);
            try {
                results.put(provider, deadline.isSet()
                        ? future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS)
                        : future.get());
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("provider.deadlineReached provider={}", provider.key());
                results.put(provider, worker.snapshot());
            } catch (ExecutionException e) {
                log.error("provider.failed provider={} error={}", provider.key(), e.getCause().getMessage(),
                        e.getCause());
                run.stats(provider).incrementErrors();
                results.put(provider, worker.snapshot().failed(e.getCause().getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                results.put(provider, worker.snapshot());
            }
        }
        // A worker cancelled before it started has no result yet.
        workers.forEach((provider, worker) -> results.computeIfAbsent(provider, p -> worker.snapshot()));

        results.values().forEach(r -> run.stats(r.provider()).outcome(r.outcome(), r.message()));
        return results;
    }

    // ── Write phases ──

    private void process(RunContext ctx, Map<Provider, ProviderFetchResult> fetched,
                         Map<Provider, SourceConnector> connectors) {
        fetched.values().forEach(r -> r.invalid().forEach(invalid -> dropInvalid(ctx, r.provider(), invalid)));

        List<SourceRecord> rosterRecords = new ArrayList<>();
        List<SourceRecord> enrichmentRecords = new ArrayList<>();
        fetched.values().forEach(r -> (r.provider().isEnrichmentOnly() ? enrichmentRecords : rosterRecords)
                .addAll(r.records()));

        boolean skipAdd = ctx.run.getMode() == IngestMode.ENRICHMENT && ctx.options.isSkipAdd();
        if (skipAdd) {
            applyRecords(ctx, "enrich", rosterRecords, false);
        } else {
            applyRecords(ctx, "add", rosterRecords, true);
            if (ctx.run.getMode() == IngestMode.ENRICHMENT) {
                fetched.values().stream()
                        .filter(r -> r.provider().isCurrentRoster())
                        .forEach(r -> runLifecycle(ctx, r, connectors.get(r.provider())));
            }
        }
        applyRecords(ctx, "enrich", enrichmentRecords, false);
    }

    private void dropInvalid(RunContext ctx, Provider provider, InvalidRecord invalid) {
        ctx.run.stats(provider).incrementInvalid();
        metricsService.incrementInvalidRecord(provider);
        log.warn("record.invalid provider={} payloadRef={} reason={}", provider.key(), invalid.payloadRef(),
                invalid.reason());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider", provider.key());
        details.put("payloadRef", String.valueOf(invalid.payloadRef()));
        details.put("reason", String.valueOf(invalid.reason()));
        ctx.audit.record(AuditAction.INVALID_RECORD_DROPPED, null, ctx.run.getRunId(), details);
    }

    /**
     * Resolves {@code records} and writes one merge per canonical entity.
     *
     * @param createAllowed whether new entities may be minted; enrichment only updates
     */
    private void applyRecords(RunContext ctx, String phase, List<SourceRecord> records, boolean createAllowed) {
        if (records.isEmpty()) {
            return;
        }
        String runId = ctx.run.getRunId();
        try (Span span = tracingService.reconcile(runId, phase)) {
            ResolutionResult resolution = ctx.resolver.resolveBatch(records, runId);
            resolution.unmatched().forEach(r -> ctx.run.stats(r.source()).addSkipped(1));
            for (SourceRecord r : resolution.conflicted()) {
                ctx.run.stats(r.source()).incrementConflicts();
                markCurrentOwner(ctx, r);
            }

            Instant now = clock.instant();
            Set<String> skippedIds = new HashSet<>();
            List<EntityWrite> writes = new ArrayList<>();
            resolution.byCanonicalId().forEach((id, group) -> {
                String skipReason = skipReason(ctx, id, group, createAllowed, now);
                if (skipReason != null) {
                    skippedIds.add(id);
                    group.forEach(r -> ctx.run.stats(r.record().source()).addSkipped(1));
                    log.debug("entity.skipped canonicalId={} records={} reason={}", id, group.size(), skipReason);
                } else {
                    writes.add(new EntityWrite(id, group));
                }
            });

            for (ReviewItem item : resolution.reviewItems()) {
                boolean concernsSkipped = item.getReason() != ReviewReason.CROSSWALK_CONFLICT
                        && item.getCandidateIds().stream().anyMatch(skippedIds::contains);
                if (!concernsSkipped) {
                    flagForReview(ctx, item);
                }
            }

            ChunkedWriter.ChunkResult<EntityWrite> result = ctx.writer.writeAll(phase, writes,
                    write -> writeEntity(ctx, write));
            for (int i = 0; i < result.skippedChunks(); i++) {
                ctx.run.chunkSkipped();
            }
            result.skippedItems().forEach(w -> w.records()
                    .forEach(r -> ctx.run.stats(r.record().source()).addSkipped(1)));

            span.tag("ingest.records", records.size()).tag("ingest.entities", writes.size()).succeeded();
            log.info("phase.completed phase={} records={} entities={} skipped={} reviews={}",
                    phase, records.size(), writes.size(), skippedIds.size(), resolution.reviewItems().size());
        }
    }

    private String skipReason(RunContext ctx, String canonicalId, List<ResolvedRecord> group,
                              boolean createAllowed, Instant now) {
        if (!createAllowed && group.get(0).isNew()) {
            return "create_not_allowed";
        }
        Optional<Duration> staleAfter = ctx.options.getStaleAfter();
        boolean enrichmentOnly = group.stream().allMatch(r -> r.record().source().isEnrichmentOnly());
        if (staleAfter.isEmpty() || !enrichmentOnly) {
            return null;
        }
        Instant cutoff = now.minus(staleAfter.get());
        boolean fresh = ctx.store.findById(canonicalId)
                .flatMap(e -> e.getFieldProvenance().values().stream()
                        .map(FieldProvenance::fetchedAt)
                        .max(Instant::compareTo))
                .map(freshest -> freshest.isAfter(cutoff))
                .orElse(false);
        return fresh ? "fresh" : null;
    }

    private void writeEntity(RunContext ctx, EntityWrite write) {
        String id = write.canonicalId();
        String runId = ctx.run.getRunId();
        ResolvedRecord lead = write.records().get(0);
        List<SourceRecord> records = write.records().stream().map(ResolvedRecord::record).toList();
        records.stream()
                .filter(r -> r.source().isCurrentRoster() && r.isCurrent())
                .forEach(r -> ctx.currentIds(r.source()).add(id));

        try (LogContext logCtx = LogContext.forEntity(runId, id)) {
            try {
                Instant now = clock.instant();
                if (lead.decision() == ResolutionDecision.REACTIVATION) {
                    releasePredecessorKeys(ctx, lead.predecessorId(), id, records);
                }

                UpsertOutcome[] outcome = new UpsertOutcome[1];
                ReconciliationResult merged = entityLock.withLock(id, () -> {
                    Optional<CanonicalRepresentative> existing = ctx.store.findById(id);
                    ReconciliationResult result = reconciliationEngine.reconcile(existing, id, records, now,
                            key -> claimable(ctx.store, id, key));
                    outcome[0] = ctx.store.upsert(result.representative());
                    return result;
                });

                if (lead.fuzzyMatch() != null && !ctx.options.isDryRun()) {
                    ledger.record(lead.fuzzyMatch());
                    ctx.audit.record(AuditAction.FUZZY_MATCH_ACCEPTED, id, runId, Map.of(
                            "matchId", lead.fuzzyMatch().id(),
                            "score", lead.score(),
                            "subject", String.valueOf(lead.fuzzyMatch().subject())));
                }
                account(ctx, write, merged, outcome[0]);

                if (lead.decision() == ResolutionDecision.REACTIVATION) {
                    ctx.lifecycle.retireForReactivation(lead.predecessorId(), id, runId, now);
                }
            } catch (CrosswalkConflictException e) {
                records.forEach(r -> ctx.run.stats(r.source()).incrementConflicts());
                log.warn("entity.crosswalkConflict canonicalId={} key={} ownerId={}", id, e.getKey(),
                        e.getOwnerId());
                ctx.audit.record(AuditAction.CROSSWALK_CONFLICT, id, runId, Map.of(
                        "key", e.getKey().toString(),
                        "ownerId", e.getOwnerId()));
                flagForReview(ctx, ReviewItem.builder()
                        .reason(ReviewReason.CROSSWALK_CONFLICT)
                        .subject(e.getKey().toString())
                        .candidateIds(List.of(e.getOwnerId(), id))
                        .description("Key " + e.getKey() + " is already held by " + e.getOwnerId())
                        .runId(runId)
                        .submittedAt(clock.instant())
                        .build());
            } catch (LockAcquisitionException | InvalidTransitionException | EntityNotFoundException e) {
                ctx.run.stats(lead.record().source()).incrementErrors();
                log.warn("entity.writeFailed canonicalId={} decision={} error={}", id, lead.decision(),
                        e.getMessage());
            }
        }
    }

    /**
     * Moves the keys of a returning official from their former entity to its retired crosswalk,
     * so the new entity can take them.
     */
    private void releasePredecessorKeys(RunContext ctx, String predecessorId, String successorId,
                                        List<SourceRecord> records) {
        Set<CrosswalkKey> keys = new HashSet<>();
        for (SourceRecord r : records) {
            keys.add(r.crosswalkKey());
            r.fields().crossReferences().forEach((p, externalId) -> keys.add(new CrosswalkKey(p, externalId)));
        }
        entityLock.withLock(predecessorId, () -> {
            ctx.store.findById(predecessorId).ifPresent(predecessor -> {
                CanonicalRepresentative.Builder builder = predecessor.toBuilder();
                boolean released = false;
                for (Map.Entry<Provider, String> held : predecessor.getCrosswalk().entrySet()) {
                    if (keys.contains(new CrosswalkKey(held.getKey(), held.getValue()))) {
                        builder.removeCrosswalk(held.getKey()).retiredCrosswalk(held.getKey(), held.getValue());
                        released = true;
                    }
                }
                if (released) {
                    ctx.store.upsert(builder.build());
                    log.info("entity.keysReleased predecessorId={} successorId={}", predecessorId, successorId);
                }
            });
            return null;
        });
    }

    private static boolean claimable(CanonicalStore store, String canonicalId, CrosswalkKey key) {
        return store.lookupByCrosswalk(key.provider(), key.externalId())
                .map(owner -> owner.getCanonicalId().equals(canonicalId))
                .orElse(true);
    }

    private void account(RunContext ctx, EntityWrite write, ReconciliationResult merged, UpsertOutcome outcome) {
        String id = write.canonicalId();
        String runId = ctx.run.getRunId();
        CanonicalRepresentative rep = merged.representative();
        List<ResolvedRecord> group = write.records();
        boolean slotChanged = merged.changedFields().contains(FieldKey.OFFICE)
                || merged.changedFields().contains(FieldKey.JURISDICTION)
                || merged.changedFields().contains(FieldKey.DISTRICT);

        switch (outcome) {
            case CREATED -> {
                ctx.run.stats(group.get(0).record().source()).incrementCreated();
                group.stream().skip(1).forEach(r -> ctx.run.stats(r.record().source()).incrementMerged());
                metricsService.incrementEntityCreated(rep.getLevel());
                ctx.audit.record(AuditAction.REPRESENTATIVE_CREATED, id, runId, Map.of(
                        "decision", group.get(0).decision().name(),
                        "sources", sourcesOf(group),
                        "name", String.valueOf(rep.getDisplayName()),
                        "snapshot", CanonicalJson.write(rep)));
                log.info("entity.created canonicalId={} decision={} sources={}", id, group.get(0).decision(),
                        sourcesOf(group));
            }
            case UPDATED -> {
                group.forEach(r -> ctx.run.stats(r.record().source()).incrementMerged());
                metricsService.incrementEntityUpdated(rep.getLevel());
                ctx.audit.record(AuditAction.REPRESENTATIVE_UPDATED, id, runId, Map.of(
                        "sources", sourcesOf(group),
                        "changedFields", merged.changedFields().stream().map(FieldKey::name).sorted()
                                .collect(Collectors.joining(",")),
                        "snapshot", CanonicalJson.write(rep)));
                log.debug("entity.updated canonicalId={} changedFields={}", id, merged.changedFields());
            }
            case UNCHANGED -> group.forEach(r -> ctx.run.stats(r.record().source()).incrementUnchanged());
        }

        if (outcome == UpsertOutcome.CREATED || slotChanged) {
            group.stream()
                    .map(r -> r.record().source())
                    .filter(Provider::isCurrentRoster)
                    .forEach(p -> ctx.newcomerIds(p).add(id));
        }
        if (!merged.skippedCrossReferences().isEmpty()) {
            log.debug("entity.crossReferencesSkipped canonicalId={} keys={}", id, merged.skippedCrossReferences());
        }
    }

    private static String sourcesOf(List<ResolvedRecord> group) {
        return group.stream().map(r -> r.record().source().key()).distinct().collect(Collectors.joining(","));
    }

    /**
     * An entity whose roster record could not be resolved still counts as currently reported.
     */
    private void markCurrentOwner(RunContext ctx, SourceRecord record) {
        if (record.source().isCurrentRoster() && record.isCurrent()) {
            ctx.store.lookupByCrosswalk(record.source(), record.externalId())
                    .ifPresent(owner -> ctx.currentIds(record.source()).add(owner.getCanonicalId()));
        }
    }

    private void flagForReview(RunContext ctx, ReviewItem item) {
        ctx.run.flag(new FlaggedEntity(item.getReason(), item.getSubject(), item.getCandidateIds(),
                item.getScore(), item.getDescription()));
        if (!ctx.options.isDryRun()) {
            reviewService.submitForReview(item);
        }
    }

    // ── Lifecycle ──

    private void runLifecycle(RunContext ctx, ProviderFetchResult fetch, SourceConnector connector) {
        Provider provider = fetch.provider();
        String runId = ctx.run.getRunId();
        if (fetch.completedJurisdictions().isEmpty()) {
            log.info("lifecycle.skipped provider={} reason=no_complete_jurisdiction", provider.key());
            return;
        }
        Predicate<CanonicalRepresentative> completeScope = entity -> fetch.completedJurisdictions().stream()
                .anyMatch(j -> connector.coversJurisdiction(ProviderFetchResult.queryJurisdiction(j),
                        entity.getJurisdiction()));
        TransitionPlan plan = ctx.lifecycle.plan(new RosterSnapshot(provider, ctx.currentIds(provider),
                ctx.newcomerIds(provider), completeScope));

        for (AmbiguousReplacement ambiguous : plan.ambiguous()) {
            List<String> candidates = new ArrayList<>(ambiguous.claimantIds());
            candidates.addAll(ambiguous.occupantIds());
            ctx.audit.record(AuditAction.AMBIGUOUS_REPLACEMENT_FLAGGED, candidates.isEmpty() ? null : candidates.get(0),
                    runId, Map.of("slot", ambiguous.slot().toString(), "seats", ambiguous.seats(),
                            "claimants", String.join(",", ambiguous.claimantIds()),
                            "occupants", String.join(",", ambiguous.occupantIds())));
            flagForReview(ctx, ReviewItem.builder()
                    .reason(ReviewReason.AMBIGUOUS_REPLACEMENT)
                    .subject(ambiguous.slot().toString())
                    .candidateIds(candidates)
                    .description(ambiguous.describe())
                    .runId(runId)
                    .submittedAt(clock.instant())
                    .build());
        }

        ProviderRunStats stats = ctx.run.stats(provider);
        Instant now = clock.instant();
        ChunkedWriter.ChunkResult<StatusTransition> result = ctx.writer.writeAll("lifecycle", plan.transitions(),
                t -> {
                    try {
                        CanonicalRepresentative after = ctx.lifecycle.apply(t, runId, now);
                        if (after.getStatus() == t.to()) {
                            if (t.isReplacement()) {
                                stats.incrementReplaced();
                            } else {
                                stats.incrementDeactivated();
                            }
                        }
                    } catch (LockAcquisitionException | InvalidTransitionException | EntityNotFoundException e) {
                        stats.incrementErrors();
                        log.warn("lifecycle.transitionFailed canonicalId={} to={} error={}", t.canonicalId(),
                                t.to(), e.getMessage());
                    }
                });
        for (int i = 0; i < result.skippedChunks(); i++) {
            ctx.run.chunkSkipped();
        }
    }

    // ── Completion ──

    private void saveCheckpoints(RunContext ctx, Map<Provider, ProviderFetchResult> fetched) {
        if (ctx.run.getSkippedChunks() > 0) {
            log.warn("checkpoint.held runId={} skippedChunks={}", ctx.run.getRunId(), ctx.run.getSkippedChunks());
            return;
        }
        Instant now = clock.instant();
        for (ProviderFetchResult result : fetched.values()) {
            if (result.outcome() == ProviderOutcome.SKIPPED) {
                continue;
            }
            ProviderCheckpoint checkpoint = checkpoints.find(result.provider())
                    .orElseGet(() -> ProviderCheckpoint.initial(result.provider()));
            if (result.complete()) {
                checkpoints.save(checkpoint.finished(result.cursor(), now));
            } else if (!result.completedJurisdictions().isEmpty()) {
                checkpoints.save(checkpoint.withCompleted(result.completedJurisdictions(), now));
                log.info("checkpoint.saved provider={} completedJurisdictions={}", result.provider().key(),
                        result.completedJurisdictions().size());
            }
        }
    }

    private static RunStatus runStatus(RunContext ctx, Map<Provider, ProviderFetchResult> fetched) {
        boolean allComplete = fetched.values().stream()
                .allMatch(r -> r.outcome() == ProviderOutcome.COMPLETED || r.outcome() == ProviderOutcome.SKIPPED);
        return allComplete && ctx.run.getSkippedChunks() == 0 ? RunStatus.COMPLETED : RunStatus.PARTIAL;
    }

    @Override
    public void close() {
        fetchExecutor.shutdownNow();
    }

    private record EntityWrite(String canonicalId, List<ResolvedRecord> records) {
    }

    /**
     * Per-run state: the store writes go to, and the ids each roster reported.
     */
    private static final class RunContext {
        final IngestRun run;
        final RunOptions options;
        final CanonicalStore store;
        final StagingCanonicalStore staging;
        final AuditService audit;
        final CanonicalResolver resolver;
        final LifecycleManager lifecycle;
        final ChunkedWriter writer;
        private final Map<Provider, Set<String>> currentIds = new ConcurrentHashMap<>();
        private final Map<Provider, Set<String>> newcomerIds = new ConcurrentHashMap<>();

        RunContext(IngestRun run, RunOptions options, CanonicalStore store, StagingCanonicalStore staging,
                   AuditService audit, CanonicalResolver resolver, LifecycleManager lifecycle, ChunkedWriter writer) {
            this.run = run;
            this.options = options;
            this.store = store;
            this.staging = staging;
            this.audit = audit;
            this.resolver = resolver;
            this.lifecycle = lifecycle;
            this.writer = writer;
        }

        Set<String> currentIds(Provider provider) {
            return currentIds.computeIfAbsent(provider, p -> ConcurrentHashMap.newKeySet());
        }

        Set<String> newcomerIds(Provider provider) {
            return newcomerIds.computeIfAbsent(provider, p -> ConcurrentHashMap.newKeySet());
        }
    }
}
