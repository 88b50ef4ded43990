package com.civics.ingest.tracing;

/**
 * One traced step of an ingest. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracingService.provider(runId, Provider.FEDERAL_ROSTER, "enrichment")) {
 *     span.tag("ingest.records", records.size());
 *     span.succeeded();
 * }
 * </pre>
 *
 * <p>A span closed without {@link #succeeded()} or a {@code failed} call ends with no status.</p>
 */
public interface Span extends AutoCloseable {

    /**
     * Numbers are recorded as long attributes, anything else as its string form. Null values are dropped.
     */
    Span tag(String key, Object value);

    void succeeded();

    void failed(String description);

    /**
     * Records {@code error} on the span and marks it failed.
     */
    void failed(Throwable error);

    @Override
    void close();
}
