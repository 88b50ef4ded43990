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
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Connector for state legislators (Open States v3 {@code /people}).
 *
 * <p>The API returns people with and without a current role, so current-only queries are
 * filtered client-side: a person is current while their role has no end date or one that
 * has not passed at fetch time.</p>
 */
public class StateLegislatureConnector extends AbstractHttpConnector {

    public static final String DEFAULT_BASE_URL = "https://v3.openstates.org";
    static final String UPPER_OFFICE = "State Senator";
    static final String LOWER_OFFICE = "State Representative";
    private static final int MAX_PER_PAGE = 50;

    public StateLegislatureConnector(ProviderSettings settings) {
        this(settings, null, null);
    }

    public StateLegislatureConnector(ProviderSettings settings, HttpClient httpClient, Clock clock) {
        super(settings, httpClient, clock);
    }

    @Override
    protected URI buildUri(FetchQuery query, String pageToken) {
        return uri("/people",
                "jurisdiction", query.jurisdiction() != null ? query.jurisdiction().toLowerCase(Locale.ROOT) : null,
                "page", pageToken != null ? pageToken : "1",
                "per_page", String.valueOf(Math.min(settings.pageSize(), MAX_PER_PAGE)),
                "updated_since", query.sinceCursor(),
                "include", "other_identifiers",
                "include", "offices",
                "include", "links");
    }

    @Override
    protected void decorate(HttpRequest.Builder request) {
        if (settings.hasApiKey()) {
            request.header("X-API-KEY", settings.apiKey());
        }
    }

    @Override
    protected List<JsonNode> extractItems(JsonNode root) {
        return elements(root.path("results"));
    }

    @Override
    protected String nextPageToken(JsonNode root, String pageToken, int itemCount) {
        JsonNode pagination = root.path("pagination");
        int page = pagination.path("page").asInt(1);
        int maxPage = pagination.path("max_page").asInt(1);
        return page < maxPage ? String.valueOf(page + 1) : null;
    }

    @Override
    protected String extractCursor(JsonNode root) {
        return extractItems(root).stream()
                .map(p -> text(p, "updated_at"))
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    @Override
    public SourceRecord mapToIntermediate(JsonNode raw, Instant fetchedAt, String payloadRef)
            throws InvalidPayloadException {
        String personId = requireText(raw, "id");
        String jurisdictionId = text(raw.path("jurisdiction"), "id");
        String stateCode = StateCodes.fromOcd(jurisdictionId)
                .orElseThrow(() -> new InvalidPayloadException("No state jurisdiction for " + personId));

        String given = text(raw, "given_name");
        String family = text(raw, "family_name");
        NameParts name = given != null && family != null
                ? NameParts.of(given, null, family, null)
                : NameParts.parse(requireText(raw, "name"));

        SourceFields.Builder fields = SourceFields.builder()
                .name(name)
                .level(GovernmentLevel.STATE)
                .jurisdiction(stateCode)
                .party(text(raw, "party"))
                .email(text(raw, "email"))
                .photoUrl(text(raw, "image"));

        JsonNode role = raw.path("current_role");
        boolean current = false;
        if (role.isObject()) {
            LocalDate endDate = date(role, "end_date");
            LocalDate fetchedOn = fetchedAt.atZone(ZoneOffset.UTC).toLocalDate();
            current = endDate == null || !endDate.isBefore(fetchedOn);
            fields.office(officeFor(text(role, "org_classification")))
                    .district(text(role, "district"))
                    .termStart(date(role, "start_date"))
                    .termEnd(endDate);
        }
        fields.current(current);

        List<JsonNode> offices = elements(raw.path("offices"));
        if (!offices.isEmpty()) {
            fields.phone(text(offices.get(0), "voice"))
                    .set(FieldKey.OFFICE_ADDRESS, text(offices.get(0), "address"));
        }
        List<JsonNode> links = elements(raw.path("links"));
        if (!links.isEmpty()) {
            fields.website(text(links.get(0), "url"));
        }
        for (JsonNode id : elements(raw.path("other_identifiers"))) {
            if ("fec".equalsIgnoreCase(text(id, "scheme"))) {
                fields.crossReference(Provider.CAMPAIGN_FINANCE, text(id, "identifier"));
            }
        }
        if (text(raw, "death_date") != null) {
            fields.statusHint(StatusReason.DECEASED);
        }

        return new SourceRecord(Provider.STATE_LEGISLATURE, personId, fetchedAt, fields.build(), 1.0, payloadRef);
    }

    static String officeFor(String orgClassification) throws InvalidPayloadException {
        if (orgClassification == null) {
            throw new InvalidPayloadException("Role has no chamber classification");
        }
        return switch (orgClassification.toLowerCase(Locale.ROOT)) {
            case "upper", "legislature" -> UPPER_OFFICE;
            case "lower" -> LOWER_OFFICE;
            default -> throw new InvalidPayloadException("Unsupported chamber: " + orgClassification);
        };
    }
}
