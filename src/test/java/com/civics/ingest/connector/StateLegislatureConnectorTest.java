package com.civics.ingest.connector;

import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.support.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

import static com.civics.ingest.support.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class StateLegislatureConnectorTest {

    private static final String PEOPLE = """
            {
              "results": [
                {
                  "id": "ocd-person/1",
                  "name": "Ana Ruiz",
                  "given_name": "Ana",
                  "family_name": "Ruiz",
                  "party": "Democratic",
                  "email": "ana.ruiz@senate.ca.gov",
                  "updated_at": "2025-01-02T08:00:00Z",
                  "jurisdiction": {"id": "ocd-jurisdiction/country:us/state:ca/government"},
                  "current_role": {"org_classification": "upper", "district": "11", "start_date": "2022-12-05"},
                  "offices": [{"voice": "916-555-0100", "address": "1021 O Street, Sacramento"}],
                  "links": [{"url": "https://sd11.senate.ca.gov"}],
                  "other_identifiers": [{"scheme": "fec", "identifier": "S2CA00011"}]
                },
                {
                  "id": "ocd-person/2",
                  "name": "Ben Ortiz",
                  "updated_at": "2025-01-04T08:00:00Z",
                  "jurisdiction": {"id": "ocd-jurisdiction/country:us/state:ca/government"},
                  "current_role": {"org_classification": "lower", "district": "7",
                                   "start_date": "2020-12-07", "end_date": "2024-11-30"}
                },
                {
                  "id": "ocd-person/3",
                  "name": "Cara Diaz",
                  "jurisdiction": {"id": "ocd-jurisdiction/country:us/state:ca/government"}
                }
              ],
              "pagination": {"page": 1, "max_page": 3}
            }
            """;

    private StubHttpServer server;
    private StateLegislatureConnector connector;

    @BeforeEach
    void setUp() throws IOException {
        server = StubHttpServer.start();
        ProviderSettings settings = ProviderSettings.builder(Provider.STATE_LEGISLATURE)
                .baseUrl(server.baseUrl())
                .apiKey("state-key")
                .build();
        connector = new StateLegislatureConnector(settings, null, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Should authenticate by header and cap the page size")
    void testRequest() {
        server.enqueue(200, PEOPLE);

        connector.fetchPage(FetchQuery.all("CA", "2025-01-01"), "2");

        StubHttpServer.Request request = server.lastRequest();
        assertEquals("/people", request.path());
        assertEquals("state-key", request.header("X-API-KEY"));
        assertTrue(request.query().contains("jurisdiction=ca"));
        assertTrue(request.query().contains("page=2"));
        assertTrue(request.query().contains("per_page=50"));
        assertTrue(request.query().contains("updated_since=2025-01-01"));
        assertTrue(request.query().contains("include=offices"));
        assertFalse(request.query().contains("state-key"));
    }

    @Test
    @DisplayName("Should filter former legislators client-side on current-only queries")
    void testCurrentOnlyFilter() {
        server.enqueue(200, PEOPLE);

        ConnectorPage page = connector.fetchPage(FetchQuery.current("CA"), null).value();

        assertFalse(connector.supportsCurrentOnly());
        assertEquals(1, page.records().size());
        assertEquals("ocd-person/1", page.records().get(0).externalId());
        assertEquals("2", page.nextPageToken());
        assertEquals("2025-01-04T08:00:00Z", page.cursor());
    }

    @Test
    @DisplayName("Should keep former legislators on full fetches")
    void testFullFetch() {
        server.enqueue(200, PEOPLE);

        ConnectorPage page = connector.fetchPage(FetchQuery.all("CA", null), null).value();

        assertEquals(3, page.records().size());
        assertFalse(page.records().get(1).isCurrent());
        assertFalse(page.records().get(2).isCurrent());
        assertTrue(page.records().get(2).fields().office().isEmpty());
    }

    @Test
    @DisplayName("Should map role, contact and campaign-finance identifier")
    void testMapping() {
        server.enqueue(200, PEOPLE);

        SourceRecord record = connector.fetchPage(FetchQuery.current("CA"), null).value().records().get(0);

        assertEquals(Provider.STATE_LEGISLATURE, record.source());
        assertEquals(GovernmentLevel.STATE, record.fields().level().orElseThrow());
        assertEquals("State Senator", record.fields().office().orElseThrow());
        assertEquals("CA", record.fields().jurisdiction().orElseThrow());
        assertEquals("11", record.fields().district().orElseThrow());
        assertEquals(LocalDate.of(2022, 12, 5), record.fields().termStart().orElseThrow());
        assertEquals("Ana Ruiz", record.fields().name().orElseThrow().display());
        assertEquals("ana.ruiz@senate.ca.gov", record.fields().get(FieldKey.EMAIL));
        assertEquals("916-555-0100", record.fields().get(FieldKey.PHONE));
        assertEquals("1021 O Street, Sacramento", record.fields().get(FieldKey.OFFICE_ADDRESS));
        assertEquals("https://sd11.senate.ca.gov", record.fields().get(FieldKey.WEBSITE));
        assertEquals("S2CA00011", record.fields().crossReferences().get(Provider.CAMPAIGN_FINANCE));
    }

    @Test
    @DisplayName("Should stop paging on the last page")
    void testLastPage() {
        server.enqueue(200, """
                {"results": [], "pagination": {"page": 3, "max_page": 3}}
                """);

        assertTrue(connector.fetchPage(FetchQuery.current("CA"), "3").value().isLast());
    }

    @Test
    @DisplayName("Should reject people outside a state jurisdiction")
    void testMissingJurisdiction() {
        server.enqueue(200, """
                {"results": [{"id": "ocd-person/9", "name": "No State"}]}
                """);

        ConnectorPage page = connector.fetchPage(FetchQuery.all(null, null), null).value();

        assertTrue(page.records().isEmpty());
        assertEquals(1, page.invalid().size());
        assertTrue(page.invalid().get(0).reason().contains("ocd-person/9"));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "upper, State Senator",
            "legislature, State Senator",
            "lower, State Representative"
    })
    @DisplayName("Should map chamber classifications to offices")
    void testOfficeFor(String classification, String office) throws InvalidPayloadException {
        assertEquals(office, StateLegislatureConnector.officeFor(classification));
    }

    @Test
    @DisplayName("Should map upper-case chambers regardless of the default locale")
    void testOfficeForUnderTurkishLocale() throws InvalidPayloadException {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("State Senator", StateLegislatureConnector.officeFor("LEGISLATURE"));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("Should reject unknown chambers")
    void testUnknownChamber() {
        assertThrows(InvalidPayloadException.class, () -> StateLegislatureConnector.officeFor("executive"));
        assertThrows(InvalidPayloadException.class, () -> StateLegislatureConnector.officeFor(null));
    }
}
