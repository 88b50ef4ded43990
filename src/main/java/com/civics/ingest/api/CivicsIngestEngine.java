package com.civics.ingest.api;

import com.civics.ingest.audit.AuditRepository;
import com.civics.ingest.audit.AuditService;
import com.civics.ingest.audit.InMemoryAuditRepository;
import com.civics.ingest.config.IngestSettings;
import com.civics.ingest.connector.ConnectorRegistry;
import com.civics.ingest.connector.SourceConnector;
import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.lock.EntityLock;
import com.civics.ingest.lock.LocalEntityLock;
import com.civics.ingest.merge.ReconciliationEngine;
import com.civics.ingest.metrics.MetricsService;
import com.civics.ingest.metrics.NoOpMetricsService;
import com.civics.ingest.orchestrator.CheckpointRepository;
import com.civics.ingest.orchestrator.InMemoryCheckpointRepository;
import com.civics.ingest.orchestrator.IngestMode;
import com.civics.ingest.orchestrator.IngestOrchestrator;
import com.civics.ingest.orchestrator.IngestRun;
import com.civics.ingest.orchestrator.RunOptions;
import com.civics.ingest.ratelimit.RateClock;
import com.civics.ingest.ratelimit.RateGovernor;
import com.civics.ingest.resolve.FuzzyMatchLedger;
import com.civics.ingest.resolve.FuzzyMatchReversal;
import com.civics.ingest.retry.RetryExecutor;
import com.civics.ingest.review.InMemoryReviewQueue;
import com.civics.ingest.review.ReviewQueue;
import com.civics.ingest.review.ReviewService;
import com.civics.ingest.similarity.RepresentativeSimilarityScorer;
import com.civics.ingest.store.CachingCanonicalStore;
import com.civics.ingest.store.CanonicalStore;
import com.civics.ingest.store.InMemoryCanonicalStore;
import com.civics.ingest.tracing.NoOpTracingService;
import com.civics.ingest.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Main entry point of the ingest engine.
 *
 * <pre>
 * try (CivicsIngestEngine engine = CivicsIngestEngine.builder()
 *         .settings(settings)
 *         .build()) {
 *     IngestRun run = engine.startRun(IngestMode.FIRST_TIME,
 *             List.of(Provider.FEDERAL_ROSTER, Provider.STATE_LEGISLATURE), RunOptions.defaults());
 *     log.info(run.summary());
 * }
 * </pre>
 *
 * <p>Anything not supplied to the builder falls back to an in-memory or no-op default.</p>
 */
public class CivicsIngestEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CivicsIngestEngine.class);

    private final IngestSettings settings;
    private final CanonicalStore store;
    private final AuditService auditService;
    private final ReviewService reviewService;
    private final FuzzyMatchLedger ledger;
    private final RateGovernor governor;
    private final ConnectorRegistry registry;
    private final IngestOrchestrator orchestrator;

    private CivicsIngestEngine(Builder builder) {
        this.settings = builder.settings != null ? builder.settings : IngestSettings.defaults();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        RateClock rateClock = builder.rateClock != null ? builder.rateClock : RateClock.system();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        Supplier<String> idGenerator = builder.idGenerator != null
                ? builder.idGenerator : () -> UUID.randomUUID().toString();

        CanonicalStore baseStore = builder.store != null ? builder.store : new InMemoryCanonicalStore();
        this.store = settings.getCacheConfig().enabled()
                ? new CachingCanonicalStore(baseStore, settings.getCacheConfig())
                : baseStore;

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else {
            AuditRepository repository = builder.auditRepository != null
                    ? builder.auditRepository : new InMemoryAuditRepository();
            this.auditService = new AuditService(repository, clock);
        }

        EntityLock entityLock = builder.entityLock != null
                ? builder.entityLock : new LocalEntityLock(settings.getLockConfig());
        this.ledger = new FuzzyMatchLedger();
        ReviewQueue reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.reviewService = new ReviewService(reviewQueue, auditService,
                new FuzzyMatchReversal(ledger, store, entityLock, auditService, clock), clock);

        this.registry = builder.registry != null
                ? builder.registry : ConnectorRegistry.fromSettings(settings.getProviders());
        builder.connectors.forEach(c -> settings.getProvider(c.provider())
                .ifPresentOrElse(s -> registry.register(c, s), () -> registry.register(c)));

        this.governor = new RateGovernor(rateClock, metricsService);
        RetryExecutor retryExecutor = new RetryExecutor(settings.getRetryPolicy(), governor, rateClock);
        CheckpointRepository checkpoints = builder.checkpointRepository != null
                ? builder.checkpointRepository : new InMemoryCheckpointRepository();

        this.orchestrator = new IngestOrchestrator(registry, store, settings, governor, retryExecutor, ledger,
                reviewService, auditService, checkpoints, entityLock, new ReconciliationEngine(),
                new RepresentativeSimilarityScorer(), metricsService, tracingService, clock, idGenerator);

        log.info("engine.initialized providers={} cache={} chunkSize={}",
                registry.all().keySet(), settings.getCacheConfig().enabled(), settings.getChunkSize());
    }

    // ========== Runs ==========

    /**
     * Runs one ingest and returns its summary once every phase has finished.
     *
     * @throws com.civics.ingest.config.ConfigurationException if a provider is not configured
     */
    public IngestRun startRun(IngestMode mode, List<Provider> providers, RunOptions options) {
        return orchestrator.startRun(mode, providers, options);
    }

    public IngestRun startRun(IngestMode mode, List<Provider> providers) {
        return startRun(mode, providers, RunOptions.defaults());
    }

    /**
     * Promotes inactive representatives whose retention period has elapsed to historical.
     */
    public int promoteExpiredInactive() {
        return orchestrator.promoteExpiredInactive();
    }

    // ========== Queries ==========

    public Optional<CanonicalRepresentative> findRepresentative(String canonicalId) {
        return store.findById(canonicalId);
    }

    public Optional<CanonicalRepresentative> findByCrosswalk(Provider provider, String externalId) {
        return store.lookupByCrosswalk(provider, externalId);
    }

    // ========== Accessors ==========

    public IngestSettings getSettings() {
        return settings;
    }

    public CanonicalStore getStore() {
        return store;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public FuzzyMatchLedger getFuzzyMatchLedger() {
        return ledger;
    }

    public RateGovernor getRateGovernor() {
        return governor;
    }

    public ConnectorRegistry getConnectorRegistry() {
        return registry;
    }

    @Override
    public void close() {
        orchestrator.close();
        log.info("engine.closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IngestSettings settings;
        private ConnectorRegistry registry;
        private final List<SourceConnector> connectors = new ArrayList<>();
        private CanonicalStore store;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private ReviewQueue reviewQueue;
        private CheckpointRepository checkpointRepository;
        private EntityLock entityLock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;
        private RateClock rateClock;
        private Supplier<String> idGenerator;

        private Builder() {
        }

        public Builder settings(IngestSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * Replaces the connectors built from the provider settings.
         */
        public Builder connectorRegistry(ConnectorRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Adds or overrides one connector.
         */
        public Builder connector(SourceConnector connector) {
            this.connectors.add(connector);
            return this;
        }

        public Builder store(CanonicalStore store) {
            this.store = store;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder checkpointRepository(CheckpointRepository checkpointRepository) {
            this.checkpointRepository = checkpointRepository;
            return this;
        }

        public Builder entityLock(EntityLock entityLock) {
            this.entityLock = entityLock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Time source for quota waits and retry backoff.
         */
        public Builder rateClock(RateClock rateClock) {
            this.rateClock = rateClock;
            return this;
        }

        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public CivicsIngestEngine build() {
            return new CivicsIngestEngine(this);
        }
    }
}
