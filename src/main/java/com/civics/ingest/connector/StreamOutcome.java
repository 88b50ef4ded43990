package com.civics.ingest.connector;

/**
 * How a paged stream ended.
 *
 * @param pages          pages delivered to the visitor
 * @param completed      whether the last page was reached
 * @param terminalSignal failure that ended the stream, null when completed or stopped by the visitor
 * @param message        failure detail
 * @param cursor         last cursor reported by the provider
 */
public record StreamOutcome(int pages, boolean completed, ConnectorErrorKind terminalSignal,
                            String message, String cursor) {

    static StreamOutcome completed(int pages, String cursor) {
        return new StreamOutcome(pages, true, null, null, cursor);
    }

    static StreamOutcome stopped(int pages, String cursor) {
        return new StreamOutcome(pages, false, null, null, cursor);
    }

    static StreamOutcome failed(int pages, ConnectorErrorKind signal, String message, String cursor) {
        return new StreamOutcome(pages, false, signal, message, cursor);
    }
}
