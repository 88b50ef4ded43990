package com.civics.ingest.connector;

import com.civics.ingest.core.model.FinanceSummary;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.NameParts;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceFields;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.ratelimit.QuotaPolicy;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * Connector for candidate finance totals (OpenFEC {@code /candidates/totals/}).
 *
 * <p>Enrichment only: records carry a {@link FinanceSummary} for the current two-year
 * cycle and, when present, the member's bioguide id as a cross reference.</p>
 */
public class CampaignFinanceConnector extends AbstractHttpConnector {

    public static final String DEFAULT_BASE_URL = "https://api.open.fec.gov/v1";
    public static final Duration MIN_REQUEST_INTERVAL = Duration.ofMillis(1200);

    public CampaignFinanceConnector(ProviderSettings settings) {
        this(settings, null, null);
    }

    public CampaignFinanceConnector(ProviderSettings settings, HttpClient httpClient, Clock clock) {
        super(settings, httpClient, clock);
    }

    /**
     * The provider's minimum spacing of {@link #MIN_REQUEST_INTERVAL} holds whatever the settings say.
     */
    @Override
    public QuotaPolicy quotaPolicy() {
        QuotaPolicy configured = super.quotaPolicy();
        if (configured.minInterval().compareTo(MIN_REQUEST_INTERVAL) >= 0) {
            return configured;
        }
        return new QuotaPolicy(configured.capacity(), configured.window(), MIN_REQUEST_INTERVAL,
                configured.acquireTimeout(), configured.baseBackoff(), configured.maxBackoff());
    }

    @Override
    protected URI buildUri(FetchQuery query, String pageToken) {
        int cycle = FinanceSummary.cycleFor(clock.instant().atZone(ZoneOffset.UTC).getYear());
        return uri("/candidates/totals/",
                "cycle", String.valueOf(cycle),
                "election_full", "true",
                "state", query.jurisdiction(),
                "page", pageToken != null ? pageToken : "1",
                "per_page", String.valueOf(Math.min(settings.pageSize(), 100)),
                "sort", "candidate_id",
                "api_key", settings.apiKey());
    }

    @Override
    protected List<JsonNode> extractItems(JsonNode root) {
        return elements(root.path("results"));
    }

    @Override
    protected String nextPageToken(JsonNode root, String pageToken, int itemCount) {
        JsonNode pagination = root.path("pagination");
        int page = pagination.path("page").asInt(1);
        int pages = pagination.path("pages").asInt(1);
        return page < pages ? String.valueOf(page + 1) : null;
    }

    @Override
    public SourceRecord mapToIntermediate(JsonNode raw, Instant fetchedAt, String payloadRef)
            throws InvalidPayloadException {
        String candidateId = requireText(raw, "candidate_id");
        String officeCode = requireText(raw, "office");
        int cycle = raw.path("cycle").asInt(0);
        if (cycle == 0 || cycle % 2 != 0) {
            throw new InvalidPayloadException("Invalid cycle for " + candidateId + ": " + raw.path("cycle"));
        }

        SourceFields.Builder fields = SourceFields.builder()
                .name(NameParts.parse(titleCase(requireText(raw, "name"))))
                .level(GovernmentLevel.FEDERAL)
                .party(text(raw, "party_full"))
                .finance(new FinanceSummary(candidateId, cycle,
                        decimal(raw, "receipts"),
                        decimal(raw, "disbursements"),
                        decimal(raw, "cash_on_hand_end_period"),
                        date(raw, "coverage_end_date")))
                .crossReference(Provider.FEDERAL_ROSTER, text(raw, "bioguide_id"));

        switch (officeCode.toUpperCase(Locale.ROOT)) {
            case "H" -> fields.office(FederalRosterConnector.HOUSE_OFFICE)
                    .jurisdiction(requireState(raw, candidateId))
                    .district(houseDistrict(text(raw, "district")));
            case "S" -> fields.office(FederalRosterConnector.SENATE_OFFICE)
                    .jurisdiction(requireState(raw, candidateId));
            case "P" -> fields.office("President").jurisdiction("US");
            default -> throw new InvalidPayloadException("Unknown office code '" + officeCode + "' for " + candidateId);
        }

        return new SourceRecord(Provider.CAMPAIGN_FINANCE, candidateId, fetchedAt, fields.build(), 0.9, payloadRef);
    }

    private static String requireState(JsonNode raw, String candidateId) throws InvalidPayloadException {
        String state = requireText(raw, "state");
        return StateCodes.toCode(state)
                .orElseThrow(() -> new InvalidPayloadException("Unknown state '" + state + "' for " + candidateId));
    }
}
