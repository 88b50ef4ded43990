package com.civics.ingest.connector;

/**
 * Parameters of one paged fetch.
 *
 * @param jurisdiction jurisdiction to restrict to, null for all the provider serves
 * @param currentOnly  whether only currently serving officials are wanted
 * @param sinceCursor  incremental cursor from an earlier run, null for a full fetch
 */
public record FetchQuery(String jurisdiction, boolean currentOnly, String sinceCursor) {

    public static FetchQuery current(String jurisdiction) {
        return new FetchQuery(jurisdiction, true, null);
    }

    public static FetchQuery all(String jurisdiction, String sinceCursor) {
        return new FetchQuery(jurisdiction, false, sinceCursor);
    }

    public String describe() {
        return (jurisdiction != null ? jurisdiction : "*") + (currentOnly ? "/current" : "/all")
                + (sinceCursor != null ? "@" + sinceCursor : "");
    }
}
