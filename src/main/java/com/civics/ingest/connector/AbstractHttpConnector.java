package com.civics.ingest.connector;

import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.ratelimit.QuotaPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Base class for JSON-over-HTTP connectors. Subclasses describe the URL scheme, where items
 * live in a response, how pagination continues and how one item maps to a source record.
 *
 * <p>Status mapping: 429 is {@code RATE_LIMITED} unless the provider reports zero remaining
 * quota without a retry hint, which is {@code EXHAUSTED}; 5xx and I/O failures are
 * {@code TRANSIENT}; other 4xx and unparseable bodies are {@code INVALID}.</p>
 */
public abstract class AbstractHttpConnector implements SourceConnector {
    private static final Logger log = LoggerFactory.getLogger(AbstractHttpConnector.class);

    protected final ProviderSettings settings;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected AbstractHttpConnector(ProviderSettings settings, HttpClient httpClient, Clock clock) {
        this.settings = settings;
        this.httpClient = httpClient != null ? httpClient : HttpClient.newBuilder()
                .connectTimeout(settings.requestTimeout())
                .build();
        this.objectMapper = new ObjectMapper();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public Provider provider() {
        return settings.provider();
    }

    @Override
    public QuotaPolicy quotaPolicy() {
        return settings.quotaPolicy();
    }

    @Override
    public List<String> defaultJurisdictions() {
        return settings.jurisdictions();
    }

    @Override
    public ConnectorResult<ConnectorPage> fetchPage(FetchQuery query, String pageToken) {
        URI uri;
        try {
            uri = buildUri(query, pageToken);
        } catch (IllegalArgumentException e) {
            return ConnectorResult.invalid("Cannot build request for " + query.describe() + ": " + e.getMessage());
        }

        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(settings.requestTimeout())
                .header("Accept", "application/json")
                .GET();
        decorate(request);

        Instant fetchedAt = clock.instant();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.debug("connector.io.failed provider={} query={} error={}", provider().key(), query.describe(), e.toString());
            return ConnectorResult.transientFailure("I/O failure: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ConnectorResult.transientFailure("Interrupted while fetching " + query.describe());
        }

        int status = response.statusCode();
        if (status == 429) {
            return classifyRateLimit(response);
        }
        if (status >= 500) {
            return ConnectorResult.transientFailure("HTTP " + status + " from " + provider().key());
        }
        if (status >= 400) {
            return ConnectorResult.invalid("HTTP " + status + " for " + query.describe());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            return ConnectorResult.invalid("Malformed JSON page for " + query.describe() + ": " + e.getOriginalMessage());
        }
        return ConnectorResult.success(toPage(root, query, pageToken, fetchedAt));
    }

    ConnectorPage toPage(JsonNode root, FetchQuery query, String pageToken, Instant fetchedAt) {
        List<JsonNode> items = extractItems(root);
        List<SourceRecord> records = new ArrayList<>(items.size());
        List<InvalidRecord> invalid = new ArrayList<>();
        String pageRef = provider().key() + ":" + query.describe() + "#" + (pageToken != null ? pageToken : "first");

        for (int i = 0; i < items.size(); i++) {
            String ref = pageRef + "/" + i;
            try {
                SourceRecord record = mapToIntermediate(items.get(i), fetchedAt, ref);
                if (query.currentOnly() && !supportsCurrentOnly() && !record.isCurrent()) {
                    continue;
                }
                records.add(record);
            } catch (InvalidPayloadException e) {
                invalid.add(new InvalidRecord(ref, e.getMessage()));
            }
        }
        return new ConnectorPage(records, invalid, nextPageToken(root, pageToken, items.size()), extractCursor(root));
    }

    private <T> ConnectorResult<T> classifyRateLimit(HttpResponse<String> response) {
        Optional<String> retryAfter = response.headers().firstValue("Retry-After");
        Optional<String> remaining = response.headers().firstValue("X-RateLimit-Remaining");
        if (retryAfter.isEmpty() && remaining.map("0"::equals).orElse(false)) {
            return ConnectorResult.exhausted("Quota exhausted for " + provider().key());
        }
        Duration hint = retryAfter.flatMap(AbstractHttpConnector::parseSeconds).orElse(null);
        return ConnectorResult.rateLimited("HTTP 429 from " + provider().key(), hint);
    }

    private static Optional<Duration> parseSeconds(String value) {
        try {
            return Optional.of(Duration.ofSeconds(Long.parseLong(value.trim())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    protected abstract URI buildUri(FetchQuery query, String pageToken);

    protected abstract List<JsonNode> extractItems(JsonNode root);

    /**
     * @return the token for the following page, or null when this was the last page
     */
    protected abstract String nextPageToken(JsonNode root, String pageToken, int itemCount);

    /**
     * Incremental cursor to persist for the next run. Defaults to none.
     */
    protected String extractCursor(JsonNode root) {
        return null;
    }

    /**
     * Hook for header-based authentication.
     */
    protected void decorate(HttpRequest.Builder request) {
    }

    // ── helpers shared by connectors ─────────────────────────

    /**
     * Builds {@code baseUrl + path} with URL-encoded query parameters given as key/value pairs.
     * Pairs with a null value are skipped, and a key may repeat.
     */
    protected URI uri(String path, String... keyValues) {
        if (settings.baseUrl() == null || settings.baseUrl().isBlank()) {
            throw new IllegalArgumentException("baseUrl is not configured for " + provider().key());
        }
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Query parameters must be key/value pairs");
        }
        StringBuilder sb = new StringBuilder(stripTrailingSlash(settings.baseUrl())).append(path);
        char separator = '?';
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] == null) {
                continue;
            }
            sb.append(separator)
                    .append(URLEncoder.encode(keyValues[i], StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(keyValues[i + 1], StandardCharsets.UTF_8));
            separator = '&';
        }
        return URI.create(sb.toString());
    }

    protected static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> out = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(out::add);
        }
        return out;
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    protected static String requireText(JsonNode node, String field) throws InvalidPayloadException {
        String value = text(node, field);
        if (value == null) {
            throw new InvalidPayloadException("Missing required field '" + field + "'");
        }
        return value;
    }

    protected static LocalDate date(JsonNode node, String field) throws InvalidPayloadException {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            throw new InvalidPayloadException("Unparseable date in '" + field + "': " + value, e);
        }
    }

    protected static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.decimalValue() : null;
    }

    protected static String firstText(JsonNode array) {
        for (JsonNode element : elements(array)) {
            if (element.isTextual() && !element.asText().isBlank()) {
                return element.asText().trim();
            }
        }
        return null;
    }

    /**
     * Normalizes a U.S. House district: leading zeros removed, at-large seats unified.
     */
    protected static String houseDistrict(String raw) {
        if (raw == null || raw.isBlank()) {
            return "at-large";
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.equals("al") || trimmed.equals("at-large")) {
            return "at-large";
        }
        String digits = trimmed.replaceFirst("^0+", "");
        return digits.isEmpty() ? "at-large" : digits;
    }

    protected static String titleCase(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        boolean upperNext = true;
        for (char c : raw.toLowerCase(Locale.ROOT).toCharArray()) {
            sb.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = c == ' ' || c == '-' || c == '\'' || c == ',';
        }
        return sb.toString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
