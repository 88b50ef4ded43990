package com.civics.ingest.connector;

/**
 * Fetches one page. Decorated by the orchestrator with rate governing and retries.
 */
@FunctionalInterface
public interface PageFetcher {

    ConnectorResult<ConnectorPage> fetch(FetchQuery query, String pageToken) throws InterruptedException;
}
