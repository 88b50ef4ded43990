package com.civics.ingest.retry;

import com.civics.ingest.connector.ConnectorResult;

/**
 * Final result of a retried call plus what it took to get there.
 */
public record RetryOutcome<T>(ConnectorResult<T> result, int attempts, int rateLimitedSignals, int transientFailures) {
}
