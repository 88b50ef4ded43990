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

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;

import static com.civics.ingest.support.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class CivicLookupConnectorTest {

    private static final String OAKLAND = "ocd-division/country:us/state:ca/place:oakland";

    private static final String RESPONSE = """
            {
              "offices": [
                {"name": "U.S. Senator", "divisionId": "ocd-division/country:us/state:ca",
                 "levels": ["country"], "officialIndices": [0]},
                {"name": "Governor of California", "divisionId": "ocd-division/country:us/state:ca",
                 "levels": ["administrativeArea1"], "officialIndices": [1]},
                {"name": "Mayor of Oakland", "divisionId": "ocd-division/country:us/state:ca/place:oakland",
                 "levels": ["locality"], "officialIndices": [2]},
                {"name": "Oakland City Council Member", "divisionId": "ocd-division/country:us/state:ca/place:oakland",
                 "officialIndices": [3, 9]}
              ],
              "officials": [
                {"name": "Federal Person"},
                {"name": "State Person"},
                {"name": "Lee Park", "party": "Nonpartisan", "phones": ["510-555-0101"],
                 "urls": ["https://oaklandca.gov/mayor"], "emails": ["mayor@oaklandca.gov"],
                 "channels": [{"type": "Twitter", "id": "mayorpark"}, {"type": "Myspace", "id": "ignored"}]},
                {"name": "Sam O'Neil"}
              ]
            }
            """;

    private StubHttpServer server;
    private CivicLookupConnector connector;

    @BeforeEach
    void setUp() throws IOException {
        server = StubHttpServer.start();
        ProviderSettings settings = ProviderSettings.builder(Provider.CIVIC_LOOKUP)
                .baseUrl(server.baseUrl())
                .apiKey("civic-key")
                .build();
        connector = new CivicLookupConnector(settings, null, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Should look up one division and return a single page")
    void testRequest() {
        server.enqueue(200, RESPONSE);

        ConnectorPage page = connector.fetchPage(FetchQuery.current(OAKLAND), null).value();

        StubHttpServer.Request request = server.lastRequest();
        assertTrue(request.path().startsWith("/representatives/"));
        assertTrue(request.path().endsWith("place:oakland"));
        assertTrue(request.query().contains("key=civic-key"));
        assertTrue(page.isLast());
    }

    @Test
    @DisplayName("Should skip federal and state offices and keep local officials")
    void testLocalOnly() {
        server.enqueue(200, RESPONSE);

        ConnectorPage page = connector.fetchPage(FetchQuery.current(OAKLAND), null).value();

        assertEquals(2, page.records().size());
        assertEquals(1, page.invalid().size());
        assertTrue(page.invalid().get(0).reason().contains("resolvable official"));
        assertTrue(page.records().stream()
                .allMatch(r -> r.fields().level().orElseThrow() == GovernmentLevel.LOCAL));
    }

    @Test
    @DisplayName("Should compose the external id from division, office and name")
    void testMapping() {
        server.enqueue(200, RESPONSE);

        ConnectorPage page = connector.fetchPage(FetchQuery.current(OAKLAND), null).value();
        SourceRecord mayor = page.records().get(0);
        SourceRecord member = page.records().get(1);

        assertEquals(OAKLAND + "#mayor-of-oakland#lee-park", mayor.externalId());
        assertEquals(OAKLAND + "#oakland-city-council-member#sam-o-neil", member.externalId());
        assertEquals(0.8, mayor.confidence());
        assertEquals(OAKLAND, mayor.fields().jurisdiction().orElseThrow());
        assertEquals("510-555-0101", mayor.fields().get(FieldKey.PHONE));
        assertEquals("https://oaklandca.gov/mayor", mayor.fields().get(FieldKey.WEBSITE));
        assertEquals("mayor@oaklandca.gov", mayor.fields().get(FieldKey.EMAIL));
        assertEquals("mayorpark", mayor.fields().get(FieldKey.TWITTER));
        assertTrue(mayor.isCurrent());
    }

    @Test
    @DisplayName("Should refuse a lookup without a division")
    void testMissingDivision() {
        ConnectorResult<ConnectorPage> result = connector.fetchPage(FetchQuery.current(null), null);

        assertEquals(ConnectorErrorKind.INVALID, result.errorKind());
        assertTrue(server.requests().isEmpty());
    }

    @Test
    @DisplayName("Should slug names for identifiers")
    void testSlug() {
        assertEquals("city-council-district-3", CivicLookupConnector.slug("City Council, District 3"));
        assertEquals("jose-garcia-jr", CivicLookupConnector.slug("  Jose Garcia Jr. "));
    }
}
