package com.civics.ingest.connector;

import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.ratelimit.QuotaPolicy;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Contract every provider connector implements.
 *
 * <p>A connector performs at most one network call per {@link #fetchPage} and never retries
 * on its own; retries and quota gating are applied around it by the orchestrator.</p>
 */
public interface SourceConnector {

    Provider provider();

    /**
     * The request budget this connector declares to the rate governor.
     */
    QuotaPolicy quotaPolicy();

    /**
     * Whether the upstream API can filter to current officials. When false, current-only
     * queries are answered by filtering the full set client-side.
     */
    default boolean supportsCurrentOnly() {
        return provider().supportsCurrentOnlyQueries();
    }

    /**
     * Jurisdictions fetched when a run names none. An empty list means one unrestricted query.
     */
    default List<String> defaultJurisdictions() {
        return List.of();
    }

    /**
     * Whether an entity in {@code entityJurisdiction} falls inside a query for
     * {@code queryJurisdiction}. A null query jurisdiction covers everything.
     */
    default boolean coversJurisdiction(String queryJurisdiction, String entityJurisdiction) {
        return queryJurisdiction == null || queryJurisdiction.equalsIgnoreCase(entityJurisdiction);
    }

    /**
     * Fetches one page. Transport and HTTP failures come back as typed results.
     */
    ConnectorResult<ConnectorPage> fetchPage(FetchQuery query, String pageToken);

    /**
     * Maps one raw provider item to a source record. Pure: never touches the network or clock.
     *
     * @param raw        the raw item
     * @param fetchedAt  fetch time of the page the item belongs to
     * @param payloadRef reference to the raw item for audit
     * @throws InvalidPayloadException if the item violates the provider schema
     */
    SourceRecord mapToIntermediate(JsonNode raw, Instant fetchedAt, String payloadRef) throws InvalidPayloadException;

    default PagedRecordStream fetchCurrent(String jurisdiction) {
        return new PagedRecordStream(FetchQuery.current(jurisdiction), this::fetchPage);
    }

    default PagedRecordStream fetchAll(String jurisdiction, String sinceCursor) {
        return new PagedRecordStream(FetchQuery.all(jurisdiction, sinceCursor), this::fetchPage);
    }
}
