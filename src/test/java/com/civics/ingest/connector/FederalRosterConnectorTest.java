package com.civics.ingest.connector;

import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.core.model.StatusReason;
import com.civics.ingest.support.StubHttpServer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static com.civics.ingest.support.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class FederalRosterConnectorTest {

    private static final String TWO_MEMBERS = """
            {
              "members": [
                {
                  "bioguideId": "D000001",
                  "state": "California",
                  "district": "05",
                  "partyName": "Democratic",
                  "directOrderName": "Jane Q. Doe",
                  "updateDate": "2025-01-05T10:00:00Z",
                  "depiction": {"imageUrl": "https://img.example/d000001.jpg"},
                  "officialWebsiteUrl": "https://doe.house.gov",
                  "terms": {"item": [
                    {"chamber": "House of Representatives", "startYear": 2021, "endYear": 2023},
                    {"chamber": "House of Representatives", "startYear": 2023}
                  ]},
                  "identifiers": {"fecIds": ["H0CA05001"], "govtrackId": "412001"}
                },
                {
                  "bioguideId": "S000002",
                  "state": "TX",
                  "partyName": "Republican",
                  "name": "Smith, John",
                  "updateDate": "2025-01-07T10:00:00Z",
                  "terms": [{"chamber": "Senate", "startYear": 2019}]
                }
              ],
              "pagination": {"count": 4, "next": "https://api.example/member?offset=2"}
            }
            """;

    private StubHttpServer server;
    private FederalRosterConnector connector;

    @BeforeEach
    void setUp() throws IOException {
        server = StubHttpServer.start();
        ProviderSettings settings = ProviderSettings.builder(Provider.FEDERAL_ROSTER)
                .baseUrl(server.baseUrl())
                .apiKey("test-key")
                .pageSize(2)
                .build();
        connector = new FederalRosterConnector(settings, null, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Nested
    @DisplayName("Requests")
    class Requests {

        @Test
        @DisplayName("Should ask for current members of one state with the API key")
        void testCurrentQuery() {
            server.enqueue(200, TWO_MEMBERS);

            connector.fetchPage(FetchQuery.current("California"), null);

            StubHttpServer.Request request = server.lastRequest();
            assertEquals("/member/CA", request.path());
            assertTrue(request.query().contains("currentMember=true"));
            assertTrue(request.query().contains("offset=0"));
            assertTrue(request.query().contains("limit=2"));
            assertTrue(request.query().contains("api_key=test-key"));
            assertFalse(request.query().contains("fromDateTime"));
        }

        @Test
        @DisplayName("Should pass the incremental cursor and page offset on a full fetch")
        void testIncrementalQuery() {
            server.enqueue(200, TWO_MEMBERS);

            connector.fetchPage(FetchQuery.all(null, "2025-01-01T00:00:00Z"), "200");

            StubHttpServer.Request request = server.lastRequest();
            assertEquals("/member", request.path());
            assertTrue(request.query().contains("fromDateTime=2025-01-01T00:00:00Z"));
            assertTrue(request.query().contains("offset=200"));
            assertFalse(request.query().contains("currentMember"));
        }

        @Test
        @DisplayName("Should report an unknown state as invalid without calling the provider")
        void testUnknownState() {
            ConnectorResult<ConnectorPage> result = connector.fetchPage(FetchQuery.current("Atlantis"), null);

            assertEquals(ConnectorErrorKind.INVALID, result.errorKind());
            assertTrue(server.requests().isEmpty());
        }
    }

    @Nested
    @DisplayName("Pages")
    class Pages {

        @Test
        @DisplayName("Should map members, continue by offset and report the latest update as cursor")
        void testPage() {
            server.enqueue(200, TWO_MEMBERS);

            ConnectorResult<ConnectorPage> result = connector.fetchPage(FetchQuery.current(null), null);

            assertTrue(result.isSuccess());
            ConnectorPage page = result.value();
            assertEquals(2, page.records().size());
            assertTrue(page.invalid().isEmpty());
            assertEquals("2", page.nextPageToken());
            assertEquals("2025-01-07T10:00:00Z", page.cursor());
        }

        @Test
        @DisplayName("Should end paging when the provider reports no next page")
        void testLastPage() {
            server.enqueue(200, """
                    {"members": [], "pagination": {"count": 0}}
                    """);

            ConnectorPage page = connector.fetchPage(FetchQuery.current(null), "4").value();

            assertTrue(page.isLast());
            assertNull(page.cursor());
        }

        @Test
        @DisplayName("Should collect unmappable members without failing the page")
        void testInvalidMember() {
            server.enqueue(200, """
                    {"members": [
                      {"bioguideId": "X000001", "state": "Ohio", "name": "No Terms"},
                      {"bioguideId": "X000002", "state": "Ohio", "name": "Ok Member",
                       "terms": [{"chamber": "Senate", "startYear": 2021}]}
                    ]}
                    """);

            ConnectorPage page = connector.fetchPage(FetchQuery.current("OH"), null).value();

            assertEquals(1, page.records().size());
            assertEquals(1, page.invalid().size());
            InvalidRecord invalid = page.invalid().get(0);
            assertEquals("federal:OH/current#first/0", invalid.payloadRef());
            assertTrue(invalid.reason().contains("No terms"));
        }
    }

    @Nested
    @DisplayName("Mapping")
    class Mapping {

        @Test
        @DisplayName("Should map a House member from the latest term")
        void testHouseMember() {
            server.enqueue(200, TWO_MEMBERS);

            SourceRecord record = connector.fetchPage(FetchQuery.current(null), null).value().records().get(0);

            assertEquals(Provider.FEDERAL_ROSTER, record.source());
            assertEquals("D000001", record.externalId());
            assertEquals(T0, record.fetchedAt());
            assertEquals("Doe", record.fields().name().orElseThrow().family());
            assertEquals(GovernmentLevel.FEDERAL, record.fields().level().orElseThrow());
            assertEquals("U.S. Representative", record.fields().office().orElseThrow());
            assertEquals("CA", record.fields().jurisdiction().orElseThrow());
            assertEquals("5", record.fields().district().orElseThrow());
            assertEquals(LocalDate.of(2023, 1, 3), record.fields().termStart().orElseThrow());
            assertTrue(record.fields().termEnd().isEmpty());
            assertTrue(record.isCurrent());
            assertEquals("https://doe.house.gov", record.fields().get(FieldKey.WEBSITE));
            assertEquals("https://img.example/d000001.jpg", record.fields().get(FieldKey.PHOTO_URL));
            assertEquals("412001", record.fields().get(FieldKey.GOVTRACK_ID));
            assertEquals("H0CA05001", record.fields().crossReferences().get(Provider.CAMPAIGN_FINANCE));
            assertEquals("federal:*/current#first/0", record.payloadRef());
        }

        @Test
        @DisplayName("Should map a senator without a district from an inverted name")
        void testSenator() {
            server.enqueue(200, TWO_MEMBERS);

            SourceRecord record = connector.fetchPage(FetchQuery.current(null), null).value().records().get(1);

            assertEquals("U.S. Senator", record.fields().office().orElseThrow());
            assertEquals("TX", record.fields().jurisdiction().orElseThrow());
            assertTrue(record.fields().district().isEmpty());
            assertEquals("John", record.fields().name().orElseThrow().given());
            assertEquals("Smith", record.fields().name().orElseThrow().family());
            assertTrue(record.fields().crossReferences().isEmpty());
        }

        @Test
        @DisplayName("Should mark ended terms as not current and deceased members with a hint")
        void testFormerMember() throws Exception {
            String json = """
                    {"bioguideId": "F000001", "state": "Maine", "name": "Former, Fred",
                     "deathDate": "2024-06-01",
                     "terms": [{"chamber": "Senate", "startYear": 2013, "endYear": 2019}]}
                    """;

            SourceRecord record = connector.mapToIntermediate(
                    new ObjectMapper().readTree(json), T0, "ref");

            assertFalse(record.isCurrent());
            assertEquals(LocalDate.of(2019, 1, 3), record.fields().termEnd().orElseThrow());
            assertEquals(StatusReason.DECEASED, record.fields().get(FieldKey.STATUS_HINT));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should report 429 with Retry-After as rate limited with the hint")
        void testRateLimited() {
            server.enqueue(429, "{}", "Retry-After", "30");

            ConnectorResult<ConnectorPage> result = connector.fetchPage(FetchQuery.current(null), null);

            assertEquals(ConnectorErrorKind.RATE_LIMITED, result.errorKind());
            assertEquals(Duration.ofSeconds(30), result.retryAfter());
        }

        @Test
        @DisplayName("Should report 429 with zero remaining quota and no hint as exhausted")
        void testExhausted() {
            server.enqueue(429, "{}", "X-RateLimit-Remaining", "0");

            ConnectorResult<ConnectorPage> result = connector.fetchPage(FetchQuery.current(null), null);

            assertEquals(ConnectorErrorKind.EXHAUSTED, result.errorKind());
        }

        @Test
        @DisplayName("Should report server errors as transient")
        void testServerError() {
            server.enqueue(503, "{}");

            assertEquals(ConnectorErrorKind.TRANSIENT,
                    connector.fetchPage(FetchQuery.current(null), null).errorKind());
        }

        @Test
        @DisplayName("Should report client errors and malformed bodies as invalid")
        void testInvalid() {
            server.enqueue(404, "{}");
            server.enqueue(200, "{not json");

            assertEquals(ConnectorErrorKind.INVALID,
                    connector.fetchPage(FetchQuery.current(null), null).errorKind());
            ConnectorResult<ConnectorPage> malformed = connector.fetchPage(FetchQuery.current(null), null);
            assertEquals(ConnectorErrorKind.INVALID, malformed.errorKind());
            assertTrue(malformed.message().startsWith("Malformed JSON"));
        }
    }

    @Test
    @DisplayName("Should match entity state codes against state names in queries")
    void testCoversJurisdiction() {
        assertTrue(connector.coversJurisdiction(null, "CA"));
        assertTrue(connector.coversJurisdiction("California", "CA"));
        assertTrue(connector.coversJurisdiction("ca", "CA"));
        assertFalse(connector.coversJurisdiction("Texas", "CA"));
    }
}
