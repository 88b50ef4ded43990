package com.civics.ingest.orchestrator;

import com.civics.ingest.connector.ConnectorPage;
import com.civics.ingest.connector.ConnectorResult;
import com.civics.ingest.connector.FetchQuery;
import com.civics.ingest.connector.InvalidRecord;
import com.civics.ingest.connector.PagedRecordStream;
import com.civics.ingest.connector.SourceConnector;
import com.civics.ingest.connector.StreamOutcome;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.logging.LogContext;
import com.civics.ingest.metrics.MetricsService;
import com.civics.ingest.retry.RetryExecutor;
import com.civics.ingest.retry.RetryOutcome;
import com.civics.ingest.tracing.Span;
import com.civics.ingest.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Fetches everything one provider is asked for in a run. Jurisdictions are fetched one after
 * another, pages of a jurisdiction sequentially; every page goes through the rate governor and
 * the bounded retry helper.
 *
 * <p>Pages are collected as they arrive, so {@link #snapshot()} still returns what was fetched
 * when the orchestrator cancels the worker at the run deadline.</p>
 */
class ProviderWorker implements Callable<ProviderFetchResult> {
    private static final Logger log = LoggerFactory.getLogger(ProviderWorker.class);

    private final SourceConnector connector;
    private final Provider provider;
    private final RetryExecutor retryExecutor;
    private final IngestMode mode;
    private final List<String> jurisdictions;
    private final ProviderCheckpoint checkpoint;
    private final RunDeadline deadline;
    private final Integer recordLimit;
    private final String runId;
    private final ProviderRunStats stats;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private final List<SourceRecord> records = new ArrayList<>();
    private final List<InvalidRecord> invalid = new ArrayList<>();
    private final Set<String> completed = new LinkedHashSet<>();
    private ProviderOutcome outcome;
    private String message;
    private String cursor;
    private boolean limited;
    private boolean closed;

    ProviderWorker(SourceConnector connector, RetryExecutor retryExecutor, IngestMode mode, List<String> jurisdictions,
                   ProviderCheckpoint checkpoint, RunDeadline deadline, Integer recordLimit, String runId,
                   ProviderRunStats stats, MetricsService metricsService, TracingService tracingService) {
        this.connector = connector;
        this.provider = connector.provider();
        this.retryExecutor = retryExecutor;
        this.mode = mode;
        this.jurisdictions = jurisdictions.isEmpty() ? nullList() : jurisdictions;
        this.checkpoint = checkpoint;
        this.deadline = deadline;
        this.recordLimit = recordLimit;
        this.runId = runId;
        this.stats = stats;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    @Override
    public ProviderFetchResult call() {
        try (LogContext ctx = LogContext.forProvider(runId, provider.key());
             Span span = tracingService.provider(runId, provider, mode.code())) {
            log.info("provider.fetch.started provider={} jurisdictions={} resumeFrom={}",
                    provider.key(), jurisdictions.size(), checkpoint.completedJurisdictions().size());
            try {
                fetchAll();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finish(ProviderOutcome.PARTIAL, "cancelled at run deadline");
            }
            ProviderFetchResult result = snapshot();
            span.tag("ingest.records", result.records().size()).tag("ingest.outcome", result.outcome().name());
            if (result.outcome().isError()) {
                span.failed(result.outcome().name());
            } else {
                span.succeeded();
            }
            log.info("provider.fetch.completed provider={} outcome={} records={} invalid={} completedJurisdictions={}",
                    provider.key(), result.outcome(), result.records().size(), result.invalid().size(),
                    result.completedJurisdictions().size());
            return result;
        }
    }

    private void fetchAll() throws InterruptedException {
        for (String jurisdiction : jurisdictions) {
            String label = ProviderFetchResult.label(jurisdiction);
            if (checkpoint.isCompleted(label)) {
                log.debug("provider.jurisdiction.resumedPast provider={} jurisdiction={}", provider.key(), label);
                continue;
            }
            if (deadline.isExpired()) {
                finish(ProviderOutcome.PARTIAL, "run deadline reached");
                return;
            }

            PagedRecordStream stream = new PagedRecordStream(query(jurisdiction), this::governedFetch);
            StreamOutcome streamOutcome = stream.forEachPage(this::accept);
            if (streamOutcome.cursor() != null && (cursor == null || streamOutcome.cursor().compareTo(cursor) > 0)) {
                synchronized (this) {
                    cursor = streamOutcome.cursor();
                }
            }

            if (streamOutcome.completed()) {
                synchronized (this) {
                    completed.add(label);
                }
            } else if (streamOutcome.terminalSignal() != null) {
                ProviderOutcome failed = ProviderOutcome.fromSignal(streamOutcome.terminalSignal());
                log.warn("provider.jurisdiction.failed provider={} jurisdiction={} signal={} message={}",
                        provider.key(), label, streamOutcome.terminalSignal(), streamOutcome.message());
                if (failed != ProviderOutcome.FAILED) {
                    finish(failed, streamOutcome.message());
                    return;
                }
                stats.incrementErrors();
                synchronized (this) {
                    outcome = failed;
                    message = streamOutcome.message();
                }
            } else {
                finish(ProviderOutcome.PARTIAL, limited ? "record limit reached" : "run deadline reached");
                return;
            }
        }
    }

    private FetchQuery query(String jurisdiction) {
        if (mode == IngestMode.FIRST_TIME || provider.isCurrentRoster()) {
            return connector.supportsCurrentOnly()
                    ? FetchQuery.current(jurisdiction)
                    : FetchQuery.all(jurisdiction, null);
        }
        return FetchQuery.all(jurisdiction, checkpoint.sinceCursor());
    }

    private ConnectorResult<ConnectorPage> governedFetch(FetchQuery query, String pageToken)
            throws InterruptedException {
        RetryOutcome<ConnectorPage> outcome = retryExecutor.execute(provider,
                () -> connector.fetchPage(query, pageToken));
        stats.addRateLimitedSignals(outcome.rateLimitedSignals());
        return outcome.result();
    }

    private synchronized boolean accept(ConnectorPage page) {
        if (closed) {
            return false;
        }
        stats.incrementPages();
        List<SourceRecord> pageRecords = page.records();
        if (mode == IngestMode.FIRST_TIME && !connector.supportsCurrentOnly()) {
            pageRecords = pageRecords.stream().filter(SourceRecord::isCurrent).toList();
        }
        if (recordLimit != null && records.size() + pageRecords.size() >= recordLimit) {
            pageRecords = pageRecords.subList(0, recordLimit - records.size());
            limited = true;
        }
        records.addAll(pageRecords);
        invalid.addAll(page.invalid());
        stats.addFetched(pageRecords.size());
        metricsService.recordRecordsFetched(provider, pageRecords.size());
        return !limited && !deadline.isExpired();
    }

    private synchronized void finish(ProviderOutcome outcome, String message) {
        if (this.outcome == null || this.outcome == ProviderOutcome.FAILED) {
            this.outcome = outcome;
            this.message = message;
        }
    }

    /**
     * What has been fetched so far. Once taken, later pages are ignored.
     */
    synchronized ProviderFetchResult snapshot() {
        closed = true;
        boolean complete = !limited && jurisdictions.stream()
                .map(ProviderFetchResult::label)
                .allMatch(l -> completed.contains(l) || checkpoint.isCompleted(l));
        ProviderOutcome finalOutcome = outcome != null ? outcome
                : complete ? ProviderOutcome.COMPLETED : ProviderOutcome.PARTIAL;
        return new ProviderFetchResult(provider, records, invalid, completed, complete && outcome == null,
                finalOutcome, message, cursor);
    }

    private static List<String> nullList() {
        List<String> all = new ArrayList<>();
        all.add(null);
        return all;
    }
}
