package com.civics.ingest.orchestrator;

import com.civics.ingest.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies writes in fixed-size chunks. A chunk that fails is retried once and then skipped, so
 * one bad chunk never takes down the run. Store unavailability is not retried here and ends
 * the run.
 *
 * <p>Item writers handle their own record-level errors; anything that escapes an item is
 * treated as a failure of the whole chunk. Writes are idempotent upserts, which makes
 * replaying the items of a half-applied chunk safe.</p>
 */
class ChunkedWriter {
    private static final Logger log = LoggerFactory.getLogger(ChunkedWriter.class);

    @FunctionalInterface
    interface ItemWriter<T> {
        void write(T item);
    }

    /**
     * @param skippedItems items of chunks that failed twice
     */
    record ChunkResult<T>(int chunks, int skippedChunks, List<T> skippedItems) {
    }

    private final int chunkSize;

    ChunkedWriter(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        this.chunkSize = chunkSize;
    }

    <T> ChunkResult<T> writeAll(String phase, List<T> items, ItemWriter<T> writer) {
        int chunks = 0;
        int skippedChunks = 0;
        List<T> skipped = new ArrayList<>();

        for (int from = 0; from < items.size(); from += chunkSize) {
            List<T> chunk = items.subList(from, Math.min(from + chunkSize, items.size()));
            chunks++;
            if (applyWithRetry(phase, chunks, chunk, writer)) {
                continue;
            }
            skippedChunks++;
            skipped.addAll(chunk);
        }

        if (chunks > 0) {
            log.debug("write.phaseCompleted phase={} items={} chunks={} skippedChunks={}",
                    phase, items.size(), chunks, skippedChunks);
        }
        return new ChunkResult<>(chunks, skippedChunks, skipped);
    }

    private <T> boolean applyWithRetry(String phase, int chunkNumber, List<T> chunk, ItemWriter<T> writer) {
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                chunk.forEach(writer::write);
                return true;
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                if (attempt == 1) {
                    log.warn("write.chunkRetry phase={} chunk={} size={} error={}",
                            phase, chunkNumber, chunk.size(), e.getMessage());
                } else {
                    log.error("write.chunkSkipped phase={} chunk={} size={} error={}",
                            phase, chunkNumber, chunk.size(), e.getMessage(), e);
                }
            }
        }
        return false;
    }
}
