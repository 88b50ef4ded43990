package com.civics.ingest.connector;

import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.FinanceSummary;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.ratelimit.QuotaPolicy;
import com.civics.ingest.support.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static com.civics.ingest.support.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class CampaignFinanceConnectorTest {

    private static final String TOTALS = """
            {
              "results": [
                {"candidate_id": "H0CA05001", "name": "DOE, JANE Q.", "office": "H", "state": "CA",
                 "district": "05", "party_full": "DEMOCRATIC PARTY", "cycle": 2026,
                 "receipts": 1250000.50, "disbursements": 800000, "cash_on_hand_end_period": 450000.50,
                 "coverage_end_date": "2024-12-31T00:00:00", "bioguide_id": "D000001"},
                {"candidate_id": "S8TX00002", "name": "SMITH, JOHN", "office": "S", "state": "TX", "cycle": 2026},
                {"candidate_id": "P0US00003", "name": "ODD, CYCLE", "office": "P", "cycle": 2025},
                {"candidate_id": "X0XX00004", "name": "NO, OFFICE", "office": "Z", "cycle": 2026}
              ],
              "pagination": {"page": 1, "pages": 2}
            }
            """;

    private StubHttpServer server;
    private ProviderSettings settings;
    private CampaignFinanceConnector connector;

    @BeforeEach
    void setUp() throws IOException {
        server = StubHttpServer.start();
        settings = ProviderSettings.builder(Provider.CAMPAIGN_FINANCE)
                .baseUrl(server.baseUrl())
                .apiKey("fec-key")
                .minInterval(Duration.ofMillis(100))
                .build();
        connector = new CampaignFinanceConnector(settings, null, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Should request totals for the election cycle of the current year")
    void testRequest() {
        server.enqueue(200, TOTALS);

        connector.fetchPage(FetchQuery.all("CA", null), null);

        StubHttpServer.Request request = server.lastRequest();
        assertEquals("/candidates/totals/", request.path());
        assertTrue(request.query().contains("cycle=2026"));
        assertTrue(request.query().contains("state=CA"));
        assertTrue(request.query().contains("page=1"));
        assertTrue(request.query().contains("api_key=fec-key"));
    }

    @Test
    @DisplayName("Should map finance totals with the bioguide cross reference")
    void testMapping() {
        server.enqueue(200, TOTALS);

        ConnectorPage page = connector.fetchPage(FetchQuery.all(null, null), null).value();
        SourceRecord house = page.records().get(0);

        assertEquals(Provider.CAMPAIGN_FINANCE, house.source());
        assertEquals("H0CA05001", house.externalId());
        assertEquals(0.9, house.confidence());
        assertEquals("Jane", house.fields().name().orElseThrow().given());
        assertEquals("Doe", house.fields().name().orElseThrow().family());
        assertEquals("U.S. Representative", house.fields().office().orElseThrow());
        assertEquals("5", house.fields().district().orElseThrow());
        assertEquals("D000001", house.fields().crossReferences().get(Provider.FEDERAL_ROSTER));

        FinanceSummary finance = (FinanceSummary) house.fields().get(FieldKey.FINANCE);
        assertEquals(2026, finance.cycle());
        assertEquals(0, new BigDecimal("1250000.50").compareTo(finance.totalRaised()));
        assertEquals(0, new BigDecimal("800000").compareTo(finance.totalSpent()));
        assertEquals(LocalDate.of(2024, 12, 31), finance.lastFilingDate());

        SourceRecord senate = page.records().get(1);
        assertEquals("U.S. Senator", senate.fields().office().orElseThrow());
        assertTrue(senate.fields().district().isEmpty());
        assertNull(((FinanceSummary) senate.fields().get(FieldKey.FINANCE)).totalRaised());
        assertNull(senate.fields().current());
    }

    @Test
    @DisplayName("Should drop odd cycles and unknown office codes as invalid records")
    void testInvalidRecords() {
        server.enqueue(200, TOTALS);

        ConnectorPage page = connector.fetchPage(FetchQuery.all(null, null), null).value();

        assertEquals(2, page.records().size());
        assertEquals(2, page.invalid().size());
        assertTrue(page.invalid().get(0).reason().contains("Invalid cycle"));
        assertTrue(page.invalid().get(1).reason().contains("Unknown office code"));
        assertEquals("2", page.nextPageToken());
    }

    @Test
    @DisplayName("Should keep the provider minimum request spacing when settings ask for less")
    void testQuotaFloor() {
        QuotaPolicy policy = connector.quotaPolicy();

        assertEquals(CampaignFinanceConnector.MIN_REQUEST_INTERVAL, policy.minInterval());
        assertEquals(settings.quotaPolicy().capacity(), policy.capacity());
    }

    @Test
    @DisplayName("Should keep a configured spacing above the minimum")
    void testQuotaAboveFloor() {
        ProviderSettings slower = ProviderSettings.builder(Provider.CAMPAIGN_FINANCE)
                .minInterval(Duration.ofSeconds(2))
                .build();

        assertEquals(Duration.ofSeconds(2), new CampaignFinanceConnector(slower).quotaPolicy().minInterval());
    }
}
