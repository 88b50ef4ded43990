package com.civics.ingest.connector;

import com.civics.ingest.core.model.SourceRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Lazy, finite paged sequence for one query. Nothing is fetched until a page is visited,
 * and every traversal starts again from the first page.
 */
public final class PagedRecordStream {

    /**
     * Receives pages in order. Returning false stops the traversal early.
     */
    @FunctionalInterface
    public interface PageVisitor {
        boolean visit(ConnectorPage page) throws InterruptedException;
    }

    private final FetchQuery query;
    private final PageFetcher fetcher;

    public PagedRecordStream(FetchQuery query, PageFetcher fetcher) {
        this.query = query;
        this.fetcher = fetcher;
    }

    public FetchQuery query() {
        return query;
    }

    public StreamOutcome forEachPage(PageVisitor visitor) throws InterruptedException {
        String token = null;
        String cursor = null;
        int pages = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Fetch cancelled for " + query.describe());
            }
            ConnectorResult<ConnectorPage> result = fetcher.fetch(query, token);
            if (!result.isSuccess()) {
                return StreamOutcome.failed(pages, result.errorKind(), result.message(), cursor);
            }
            ConnectorPage page = result.value();
            pages++;
            if (page.cursor() != null) {
                cursor = page.cursor();
            }
            if (!visitor.visit(page)) {
                return StreamOutcome.stopped(pages, cursor);
            }
            if (page.isLast()) {
                return StreamOutcome.completed(pages, cursor);
            }
            token = page.nextPageToken();
        }
    }

    /**
     * Drains every page into a list. Stops silently at the first failure.
     */
    public List<SourceRecord> toList() throws InterruptedException {
        List<SourceRecord> records = new ArrayList<>();
        forEachPage(page -> {
            records.addAll(page.records());
            return true;
        });
        return records;
    }
}
