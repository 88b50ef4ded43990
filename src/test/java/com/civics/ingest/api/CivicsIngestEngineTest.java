package com.civics.ingest.api;

import com.civics.ingest.audit.AuditAction;
import com.civics.ingest.audit.AuditEntry;
import com.civics.ingest.config.ConfigurationException;
import com.civics.ingest.config.IngestSettings;
import com.civics.ingest.connector.ConnectorResult;
import com.civics.ingest.core.model.CanonicalJson;
import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.core.model.StatusReason;
import com.civics.ingest.orchestrator.InMemoryCheckpointRepository;
import com.civics.ingest.orchestrator.IngestMode;
import com.civics.ingest.orchestrator.IngestRun;
import com.civics.ingest.orchestrator.ProviderOutcome;
import com.civics.ingest.orchestrator.RunOptions;
import com.civics.ingest.orchestrator.RunStatus;
import com.civics.ingest.retry.RetryPolicy;
import com.civics.ingest.store.CacheConfig;
import com.civics.ingest.store.InMemoryCanonicalStore;
import com.civics.ingest.support.ManualRateClock;
import com.civics.ingest.support.MutableClock;
import com.civics.ingest.support.ScriptedConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.civics.ingest.support.Fixtures.T0;
import static com.civics.ingest.support.Fixtures.federalFields;
import static com.civics.ingest.support.Fixtures.federalMember;
import static com.civics.ingest.support.Fixtures.financeCandidate;
import static com.civics.ingest.support.Fixtures.record;
import static com.civics.ingest.support.Fixtures.sequentialIds;
import static org.junit.jupiter.api.Assertions.*;

class CivicsIngestEngineTest {

    private static final List<Provider> FEDERAL = List.of(Provider.FEDERAL_ROSTER);

    private static final SourceRecord ALICE = federalMember("A000001", "Alice Adams", "CA", "12", T0);
    private static final SourceRecord BOB = federalMember("B000002", "Bob Brown", "CA", "13", T0);

    private MutableClock clock;
    private InMemoryCanonicalStore store;
    private InMemoryCheckpointRepository checkpoints;
    private ScriptedConnector federal;
    private ScriptedConnector finance;
    private ScriptedConnector civic;
    private CivicsIngestEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryCanonicalStore();
        checkpoints = new InMemoryCheckpointRepository();
        federal = new ScriptedConnector(Provider.FEDERAL_ROSTER);
        finance = new ScriptedConnector(Provider.CAMPAIGN_FINANCE);
        civic = new ScriptedConnector(Provider.CIVIC_LOOKUP);
        engine = CivicsIngestEngine.builder()
                .settings(IngestSettings.builder()
                        .cacheConfig(CacheConfig.disabled())
                        .retryPolicy(new RetryPolicy(Duration.ofMillis(10), 0.0, 2, 1))
                        .build())
                .connector(federal)
                .connector(finance)
                .connector(civic)
                .store(store)
                .checkpointRepository(checkpoints)
                .clock(clock)
                .rateClock(new ManualRateClock())
                .idGenerator(sequentialIds("rep"))
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private CanonicalRepresentative byBioguide(String bioguideId) {
        return engine.findByCrosswalk(Provider.FEDERAL_ROSTER, bioguideId).orElseThrow();
    }

    private void seed(SourceRecord... records) {
        federal.page(records);
        IngestRun run = engine.startRun(IngestMode.FIRST_TIME, FEDERAL);
        assertEquals(RunStatus.COMPLETED, run.getStatus());
    }

    private static SourceRecord federalAlice(Instant fetchedAt) {
        return record(Provider.FEDERAL_ROSTER, "A000001", fetchedAt,
                federalFields("Alice Adams", "CA", "12").website("https://adams.house.gov"));
    }

    private static SourceRecord civicAlice(Instant fetchedAt) {
        return record(Provider.CIVIC_LOOKUP, "ocd-division/country:us/state:ca/cd:12#rep#alice-adams", fetchedAt,
                federalFields("Alice Adams", "CA", "12")
                        .website("https://alice-for-congress.example")
                        .crossReference(Provider.FEDERAL_ROSTER, "A000001"));
    }

    @Nested
    @DisplayName("First-time runs")
    class FirstTime {

        @Test
        @DisplayName("Should create current officials and skip enrichment-only providers")
        void testSeed() {
            federal.page(ALICE, BOB);
            finance.page(financeCandidate("H0CA12001", "Alice Adams", "CA", "12", "A000001", T0));

            IngestRun run = engine.startRun(IngestMode.FIRST_TIME,
                    List.of(Provider.FEDERAL_ROSTER, Provider.CAMPAIGN_FINANCE));

            assertEquals(RunStatus.COMPLETED, run.getStatus());
            assertEquals(2, run.getTotalCreated());
            assertEquals(ProviderOutcome.SKIPPED, run.stats(Provider.CAMPAIGN_FINANCE).getOutcome());
            assertTrue(finance.queries().isEmpty());
            assertEquals(2, store.count());
            assertTrue(federal.queries().get(0).currentOnly());
            assertEquals(2, engine.getAuditService().getEntriesByAction(AuditAction.REPRESENTATIVE_CREATED).size());
            assertEquals(1, engine.getAuditService().getEntriesByAction(AuditAction.RUN_STARTED).size());
            assertEquals(1, engine.getAuditService().getEntriesByAction(AuditAction.RUN_COMPLETED).size());
        }

        @Test
        @DisplayName("Should keep contact fields stable when two roster providers disagree across reruns")
        void testRerunWithDisagreeingRosters() {
            List<Provider> rosters = List.of(Provider.FEDERAL_ROSTER, Provider.CIVIC_LOOKUP);
            federal.page(federalAlice(T0));
            civic.page(civicAlice(T0.plusSeconds(60)));
            assertEquals(RunStatus.COMPLETED, engine.startRun(IngestMode.FIRST_TIME, rosters).getStatus());
            String before = CanonicalJson.write(byBioguide("A000001"));

            Instant rerun = T0.plus(Duration.ofHours(1));
            civic.page(civicAlice(rerun));
            federal.page(federalAlice(rerun.plusSeconds(60)));
            IngestRun second = engine.startRun(IngestMode.FIRST_TIME, rosters);

            assertEquals(RunStatus.COMPLETED, second.getStatus());
            assertEquals(0, second.getTotalCreated());
            assertEquals(before, CanonicalJson.write(byBioguide("A000001")));
            assertEquals("https://alice-for-congress.example", byBioguide("A000001").getField(FieldKey.WEBSITE));
        }

        @Test
        @DisplayName("Should snapshot created and updated representatives in the audit trail")
        void testAuditSnapshots() {
            seed(ALICE);
            federal.page(record(Provider.FEDERAL_ROSTER, "A000001", T0.plusSeconds(60),
                    federalFields("Alice Adams", "CA", "12").email("alice@house.gov")));
            engine.startRun(IngestMode.FIRST_TIME, FEDERAL);

            String id = byBioguide("A000001").getCanonicalId();
            AuditEntry created = engine.getAuditService().getEntriesByAction(AuditAction.REPRESENTATIVE_CREATED).get(0);
            AuditEntry updated = engine.getAuditService().getEntriesByAction(AuditAction.REPRESENTATIVE_UPDATED).get(0);
            assertEquals(id, created.canonicalId());
            assertFalse(String.valueOf(created.details().get("snapshot")).contains("alice@house.gov"));
            assertEquals(CanonicalJson.write(byBioguide("A000001")), updated.details().get("snapshot"));
        }

        @Test
        @DisplayName("Should leave the store unchanged when the same data is ingested again")
        void testRerunIsIdempotent() {
            seed(ALICE, BOB);
            CanonicalRepresentative before = byBioguide("A000001");

            federal.page(ALICE, BOB);
            IngestRun rerun = engine.startRun(IngestMode.FIRST_TIME, FEDERAL);

            assertEquals(0, rerun.getTotalCreated());
            assertEquals(2, rerun.stats(Provider.FEDERAL_ROSTER).getUnchanged());
            assertEquals(2, store.count());
            assertTrue(before.sameContentAs(byBioguide("A000001")));
        }

        @Test
        @DisplayName("Should stage writes without touching the store or the audit trail on a dry run")
        void testDryRun() {
            federal.page(ALICE, BOB);

            IngestRun run = engine.startRun(IngestMode.FIRST_TIME, FEDERAL,
                    RunOptions.builder().dryRun(true).build());

            assertEquals(RunStatus.COMPLETED, run.getStatus());
            assertEquals(2, run.getTotalCreated());
            assertTrue(run.getStagedWrites() > 0);
            assertEquals(0, store.count());
            assertEquals(0, engine.getAuditService().size());
            assertTrue(checkpoints.find(Provider.FEDERAL_ROSTER).isEmpty());
        }

        @Test
        @DisplayName("Should stop at the record limit and report a partial run")
        void testRecordLimit() {
            federal.page(ALICE, BOB, federalMember("C000003", "Carol Chen", "CA", "14", T0));

            IngestRun run = engine.startRun(IngestMode.FIRST_TIME, FEDERAL,
                    RunOptions.builder().recordLimit(2).build());

            assertEquals(RunStatus.PARTIAL, run.getStatus());
            assertEquals(ProviderOutcome.PARTIAL, run.stats(Provider.FEDERAL_ROSTER).getOutcome());
            assertEquals(2, run.getTotalCreated());
        }

        @Test
        @DisplayName("Should refuse a provider without a connector before fetching anything")
        void testMissingConnector() {
            assertThrows(ConfigurationException.class,
                    () -> engine.startRun(IngestMode.FIRST_TIME, List.of(Provider.CIVIC_LOOKUP)));
            assertEquals(0, engine.getAuditService().size());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should replace a departed member with the newcomer holding the same seat")
        void testReplacement() {
            seed(ALICE, BOB);
            clock.advance(Duration.ofDays(30));
            SourceRecord carol = federalMember("C000003", "Carol Chen", "CA", "12", clock.instant());
            federal.page(carol, BOB);

            IngestRun run = engine.startRun(IngestMode.ENRICHMENT, FEDERAL);

            CanonicalRepresentative alice = byBioguide("A000001");
            CanonicalRepresentative successor = byBioguide("C000003");
            assertEquals(RunStatus.COMPLETED, run.getStatus());
            assertEquals(1, run.getTotalReplaced());
            assertEquals(RepresentativeStatus.HISTORICAL, alice.getStatus());
            assertEquals(StatusReason.REPLACED, alice.getStatusReason());
            assertEquals(successor.getCanonicalId(), alice.getReplacedById());
            assertTrue(successor.isActive());
            assertTrue(byBioguide("B000002").isActive());
        }

        @Test
        @DisplayName("Should deactivate an unreported member and promote them after retention")
        void testVacancyThenPromotion() {
            seed(ALICE, BOB);
            federal.page(BOB);

            IngestRun run = engine.startRun(IngestMode.ENRICHMENT, FEDERAL);

            assertEquals(1, run.getTotalDeactivated());
            assertEquals(RepresentativeStatus.INACTIVE, byBioguide("A000001").getStatus());
            assertEquals(0, engine.promoteExpiredInactive());

            clock.advance(Duration.ofDays(91));

            assertEquals(1, engine.promoteExpiredInactive());
            assertEquals(RepresentativeStatus.HISTORICAL, byBioguide("A000001").getStatus());
        }

        @Test
        @DisplayName("Should not deactivate anyone when the roster quota runs out mid-fetch")
        void testExhaustedLeavesEntitiesAlone() {
            seed(ALICE, BOB);
            federal.page(ALICE).result(null, ConnectorResult.exhausted("daily quota used"));

            IngestRun run = engine.startRun(IngestMode.ENRICHMENT, FEDERAL);

            assertEquals(RunStatus.PARTIAL, run.getStatus());
            assertEquals(ProviderOutcome.EXHAUSTED, run.stats(Provider.FEDERAL_ROSTER).getOutcome());
            assertEquals(0, run.getTotalDeactivated());
            assertEquals(0, run.getErrorCount());
            assertTrue(byBioguide("B000002").isActive());
        }

        @Test
        @DisplayName("Should only update known officials when adding is skipped")
        void testSkipAdd() {
            seed(ALICE);
            clock.advance(Duration.ofHours(1));
            SourceRecord greenAlice = record(Provider.FEDERAL_ROSTER, "A000001", clock.instant(),
                    federalFields("Alice Adams", "CA", "12").party("Green"));
            federal.page(greenAlice, federalMember("D000004", "Dan Diaz", "CA", "20", clock.instant()));

            IngestRun run = engine.startRun(IngestMode.ENRICHMENT, FEDERAL,
                    RunOptions.builder().skipAdd(true).build());

            assertEquals(0, run.getTotalCreated());
            assertEquals(1, run.stats(Provider.FEDERAL_ROSTER).getSkipped());
            assertEquals(1, store.count());
            assertEquals("Green", byBioguide("A000001").getParty());
        }
    }

    @Nested
    @DisplayName("Enrichment")
    class Enrichment {

        @Test
        @DisplayName("Should add finance data without overriding roster fields")
        void testFinancePrecedence() {
            seed(ALICE);
            federal.page(ALICE);
            finance.page(financeCandidate("H0CA12001", "Alice Adams", "CA", "12", "A000001", T0));

            IngestRun run = engine.startRun(IngestMode.ENRICHMENT,
                    List.of(Provider.FEDERAL_ROSTER, Provider.CAMPAIGN_FINANCE));

            CanonicalRepresentative alice = byBioguide("A000001");
            assertEquals(RunStatus.COMPLETED, run.getStatus());
            assertEquals("Independent", alice.getParty());
            assertEquals("H0CA12001", alice.getFinance().candidateId());
            assertEquals("H0CA12001", alice.getCrosswalkId(Provider.CAMPAIGN_FINANCE).orElseThrow());
            assertEquals(Set.of(Provider.FEDERAL_ROSTER, Provider.CAMPAIGN_FINANCE), alice.getDataSources());
            assertEquals(1, store.count());
        }

        @Test
        @DisplayName("Should skip enrichment of recently refreshed officials")
        void testStaleAfter() {
            seed(ALICE);
            finance.page(financeCandidate("H0CA12001", "Alice Adams", "CA", "12", "A000001", T0));

            IngestRun run = engine.startRun(IngestMode.ENRICHMENT, List.of(Provider.CAMPAIGN_FINANCE),
                    RunOptions.builder().staleAfter(Duration.ofDays(1)).build());

            assertEquals(1, run.stats(Provider.CAMPAIGN_FINANCE).getSkipped());
            assertNull(byBioguide("A000001").getFinance());
        }

        @Test
        @DisplayName("Should drop finance records that match no known official")
        void testUnmatchedFinance() {
            seed(ALICE);
            finance.page(financeCandidate("H0TX01009", "Zed Young", "TX", "1", null, T0));

            IngestRun run = engine.startRun(IngestMode.ENRICHMENT, List.of(Provider.CAMPAIGN_FINANCE));

            assertEquals(1, run.stats(Provider.CAMPAIGN_FINANCE).getSkipped());
            assertEquals(1, store.count());
        }
    }

    @Nested
    @DisplayName("Interruption")
    class Interruption {

        @Test
        @DisplayName("Should stop fetching at the run deadline and end partial")
        void testDeadline() {
            federal.defaultJurisdictions("CA", "TX")
                    .page("CA", ALICE)
                    .page("TX", federalMember("T000005", "Tina Torres", "TX", "7", T0))
                    .onFetch(query -> {
                        if ("CA".equals(query.jurisdiction())) {
                            clock.advance(Duration.ofHours(2));
                        }
                    });

            IngestRun run = engine.startRun(IngestMode.FIRST_TIME, FEDERAL,
                    RunOptions.builder().deadline(Duration.ofHours(1)).build());

            assertEquals(RunStatus.PARTIAL, run.getStatus());
            assertEquals(ProviderOutcome.PARTIAL, run.stats(Provider.FEDERAL_ROSTER).getOutcome());
            assertEquals(0, federal.callsFor("TX"));
        }

        @Test
        @DisplayName("Should resume after the jurisdictions a partial run completed")
        void testCheckpointResume() {
            federal.defaultJurisdictions("CA", "TX")
                    .page("CA", ALICE)
                    .result("TX", ConnectorResult.exhausted("daily quota used"));

            IngestRun first = engine.startRun(IngestMode.FIRST_TIME, FEDERAL);

            assertEquals(RunStatus.PARTIAL, first.getStatus());
            assertEquals(Set.of("CA"), checkpoints.find(Provider.FEDERAL_ROSTER).orElseThrow().completedJurisdictions());

            federal.page("TX", federalMember("T000005", "Tina Torres", "TX", "7", T0));
            IngestRun resumed = engine.startRun(IngestMode.FIRST_TIME, FEDERAL);

            assertEquals(RunStatus.COMPLETED, resumed.getStatus());
            assertEquals(1, federal.callsFor("CA"));
            assertEquals(2, federal.callsFor("TX"));
            assertEquals(2, store.count());
            assertTrue(checkpoints.find(Provider.FEDERAL_ROSTER).orElseThrow().completedJurisdictions().isEmpty());
        }
    }
}
