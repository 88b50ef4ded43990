package com.civics.ingest.connector;

import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.NameParts;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceFields;
import com.civics.ingest.core.model.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Connector for local officials from a civic-information lookup keyed by OCD division
 * ({@code /representatives/{ocdId}}).
 *
 * <p>The provider has no stable person identifier, so the external id is composed from
 * division, office and official name. Federal and state offices in the response are skipped;
 * those come from the legislature rosters.</p>
 */
public class CivicLookupConnector extends AbstractHttpConnector {

    public static final String DEFAULT_BASE_URL = "https://www.googleapis.com/civicinfo/v2";
    private static final Set<String> NON_LOCAL_LEVELS = Set.of("country", "administrativeArea1");

    public CivicLookupConnector(ProviderSettings settings) {
        this(settings, null, null);
    }

    public CivicLookupConnector(ProviderSettings settings, HttpClient httpClient, Clock clock) {
        super(settings, httpClient, clock);
    }

    @Override
    protected URI buildUri(FetchQuery query, String pageToken) {
        if (query.jurisdiction() == null) {
            throw new IllegalArgumentException("civic lookup requires an OCD division");
        }
        return uri("/representatives/" + URLEncoder.encode(query.jurisdiction(), StandardCharsets.UTF_8),
                "recursive", "false",
                "key", settings.apiKey());
    }

    /**
     * Flattens offices and officials into one item per (office, official) pair.
     */
    @Override
    protected List<JsonNode> extractItems(JsonNode root) {
        List<JsonNode> officials = elements(root.path("officials"));
        List<JsonNode> items = new ArrayList<>();
        for (JsonNode office : elements(root.path("offices"))) {
            boolean nonLocal = elements(office.path("levels")).stream()
                    .anyMatch(level -> NON_LOCAL_LEVELS.contains(level.asText()));
            if (nonLocal) {
                continue;
            }
            for (JsonNode index : elements(office.path("officialIndices"))) {
                int i = index.asInt(-1);
                ObjectNode item = objectMapper.createObjectNode();
                item.set("office", office);
                item.set("official", i >= 0 && i < officials.size() ? officials.get(i) : objectMapper.nullNode());
                items.add(item);
            }
        }
        return items;
    }

    @Override
    protected String nextPageToken(JsonNode root, String pageToken, int itemCount) {
        return null;
    }

    @Override
    public SourceRecord mapToIntermediate(JsonNode raw, Instant fetchedAt, String payloadRef)
            throws InvalidPayloadException {
        JsonNode office = raw.path("office");
        JsonNode official = raw.path("official");
        if (!official.isObject()) {
            throw new InvalidPayloadException("Office without a resolvable official");
        }
        String officeName = requireText(office, "name");
        String divisionId = requireText(office, "divisionId");
        String officialName = requireText(official, "name");

        SourceFields.Builder fields = SourceFields.builder()
                .name(NameParts.parse(officialName))
                .level(GovernmentLevel.LOCAL)
                .office(officeName)
                .jurisdiction(divisionId)
                .party(text(official, "party"))
                .phone(firstText(official.path("phones")))
                .website(firstText(official.path("urls")))
                .email(firstText(official.path("emails")))
                .photoUrl(text(official, "photoUrl"))
                .current(true);

        for (JsonNode channel : elements(official.path("channels"))) {
            String type = text(channel, "type");
            String id = text(channel, "id");
            if (type == null || id == null) {
                continue;
            }
            switch (type.toLowerCase(Locale.ROOT)) {
                case "twitter" -> fields.set(FieldKey.TWITTER, id);
                case "facebook" -> fields.set(FieldKey.FACEBOOK, id);
                case "youtube" -> fields.set(FieldKey.YOUTUBE, id);
                case "instagram" -> fields.set(FieldKey.INSTAGRAM, id);
                default -> {
                }
            }
        }

        String externalId = divisionId + "#" + slug(officeName) + "#" + slug(officialName);
        return new SourceRecord(Provider.CIVIC_LOOKUP, externalId, fetchedAt, fields.build(), 0.8, payloadRef);
    }

    static String slug(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
    }
}
