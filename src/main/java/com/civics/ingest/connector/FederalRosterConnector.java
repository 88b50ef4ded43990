package com.civics.ingest.connector;

import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.NameParts;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceFields;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.core.model.StatusReason;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Connector for the federal legislature member roster (Congress.gov v3 {@code /member}).
 *
 * <p>Members are keyed by bioguide id. Pagination is offset based; the page token is the
 * next offset. The latest {@code updateDate} seen is reported as the incremental cursor.
 * An optional {@code identifiers} object on a member carries campaign-finance, GovTrack,
 * Wikipedia and Ballotpedia references.</p>
 */
public class FederalRosterConnector extends AbstractHttpConnector {

    public static final String DEFAULT_BASE_URL = "https://api.congress.gov/v3";
    static final String HOUSE_OFFICE = "U.S. Representative";
    static final String SENATE_OFFICE = "U.S. Senator";

    public FederalRosterConnector(ProviderSettings settings) {
        this(settings, null, null);
    }

    public FederalRosterConnector(ProviderSettings settings, HttpClient httpClient, Clock clock) {
        super(settings, httpClient, clock);
    }

    @Override
    protected URI buildUri(FetchQuery query, String pageToken) {
        String path = "/member";
        if (query.jurisdiction() != null) {
            path += "/" + StateCodes.toCode(query.jurisdiction())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown state: " + query.jurisdiction()));
        }
        return uri(path,
                "format", "json",
                "limit", String.valueOf(Math.min(settings.pageSize(), 250)),
                "offset", pageToken != null ? pageToken : "0",
                "currentMember", query.currentOnly() ? "true" : null,
                "fromDateTime", query.sinceCursor(),
                "api_key", settings.apiKey());
    }

    @Override
    public boolean coversJurisdiction(String queryJurisdiction, String entityJurisdiction) {
        return queryJurisdiction == null
                || StateCodes.toCode(queryJurisdiction).map(code -> code.equalsIgnoreCase(entityJurisdiction)).orElse(false);
    }

    @Override
    protected List<JsonNode> extractItems(JsonNode root) {
        return elements(root.path("members"));
    }

    @Override
    protected String nextPageToken(JsonNode root, String pageToken, int itemCount) {
        String next = text(root.path("pagination"), "next");
        if (next == null || itemCount == 0) {
            return null;
        }
        int offset = pageToken != null ? Integer.parseInt(pageToken) : 0;
        return String.valueOf(offset + itemCount);
    }

    @Override
    protected String extractCursor(JsonNode root) {
        return extractItems(root).stream()
                .map(m -> text(m, "updateDate"))
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    @Override
    public SourceRecord mapToIntermediate(JsonNode raw, Instant fetchedAt, String payloadRef)
            throws InvalidPayloadException {
        String bioguideId = requireText(raw, "bioguideId");
        String state = requireText(raw, "state");
        String stateCode = StateCodes.toCode(state)
                .orElseThrow(() -> new InvalidPayloadException("Unknown state '" + state + "' for " + bioguideId));

        JsonNode latestTerm = latestTerm(raw)
                .orElseThrow(() -> new InvalidPayloadException("No terms for " + bioguideId));
        String chamber = requireText(latestTerm, "chamber");
        boolean senate = chamber.toLowerCase(Locale.ROOT).contains("senate");

        String displayName = text(raw, "directOrderName");
        NameParts name = displayName != null ? NameParts.parse(displayName) : NameParts.parse(requireText(raw, "name"));

        int startYear = latestTerm.path("startYear").asInt(0);
        JsonNode endYearNode = latestTerm.path("endYear");
        boolean current = endYearNode.isMissingNode() || endYearNode.isNull();

        SourceFields.Builder fields = SourceFields.builder()
                .name(name)
                .level(GovernmentLevel.FEDERAL)
                .office(senate ? SENATE_OFFICE : HOUSE_OFFICE)
                .jurisdiction(stateCode)
                .district(senate ? null : houseDistrict(text(raw, "district")))
                .party(text(raw, "partyName"))
                .termStart(startYear > 0 ? LocalDate.of(startYear, 1, 3) : null)
                .termEnd(current ? null : LocalDate.of(endYearNode.asInt(), 1, 3))
                .photoUrl(text(raw.path("depiction"), "imageUrl"))
                .website(text(raw, "officialWebsiteUrl"))
                .current(current);

        if (text(raw, "deathDate") != null) {
            fields.statusHint(StatusReason.DECEASED);
        }

        JsonNode ids = raw.path("identifiers");
        fields.crossReference(Provider.CAMPAIGN_FINANCE, firstText(ids.path("fecIds")))
                .set(FieldKey.GOVTRACK_ID, text(ids, "govtrackId"))
                .set(FieldKey.WIKIPEDIA_URL, text(ids, "wikipedia"))
                .set(FieldKey.BALLOTPEDIA_URL, text(ids, "ballotpedia"));

        return new SourceRecord(Provider.FEDERAL_ROSTER, bioguideId, fetchedAt, fields.build(), 1.0, payloadRef);
    }

    private static Optional<JsonNode> latestTerm(JsonNode raw) {
        JsonNode terms = raw.path("terms");
        List<JsonNode> items = elements(terms.isArray() ? terms : terms.path("item"));
        return items.stream().max(Comparator.comparingInt(t -> t.path("startYear").asInt(0)));
    }
}
