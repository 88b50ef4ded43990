package com.civics.ingest.connector;

import com.civics.ingest.core.model.SourceRecord;

import java.util.List;

/**
 * One page of mapped records.
 *
 * @param records       records that mapped cleanly
 * @param invalid       items dropped during mapping
 * @param nextPageToken continuation token, null on the last page
 * @param cursor        incremental cursor reported by the provider, may be null
 */
public record ConnectorPage(
        List<SourceRecord> records,
        List<InvalidRecord> invalid,
        String nextPageToken,
        String cursor
) {
    public ConnectorPage {
        records = records != null ? List.copyOf(records) : List.of();
        invalid = invalid != null ? List.copyOf(invalid) : List.of();
    }

    public static ConnectorPage last(List<SourceRecord> records) {
        return new ConnectorPage(records, List.of(), null, null);
    }

    public boolean isLast() {
        return nextPageToken == null;
    }
}
