package com.civics.ingest.orchestrator;

import com.civics.ingest.store.StoreUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ChunkedWriterTest {

    private final ChunkedWriter writer = new ChunkedWriter(3);

    private static List<Integer> items(int count) {
        return IntStream.rangeClosed(1, count).boxed().toList();
    }

    @Test
    @DisplayName("Should write every item in chunks")
    void testWriteAll() {
        List<Integer> written = new ArrayList<>();

        ChunkedWriter.ChunkResult<Integer> result = writer.writeAll("add", items(7), written::add);

        assertEquals(items(7), written);
        assertEquals(3, result.chunks());
        assertEquals(0, result.skippedChunks());
        assertTrue(result.skippedItems().isEmpty());
    }

    @Test
    @DisplayName("Should replay a failed chunk once and succeed")
    void testRetryOnce() {
        Map<Integer, Integer> attempts = new HashMap<>();

        ChunkedWriter.ChunkResult<Integer> result = writer.writeAll("add", items(6), item -> {
            int attempt = attempts.merge(item, 1, Integer::sum);
            if (item == 5 && attempt == 1) {
                throw new IllegalStateException("transient write failure");
            }
        });

        assertEquals(0, result.skippedChunks());
        assertEquals(2, attempts.get(4));
        assertEquals(1, attempts.get(1));
    }

    @Test
    @DisplayName("Should skip a chunk that fails twice and continue with the next")
    void testSkipChunk() {
        List<Integer> written = new ArrayList<>();

        ChunkedWriter.ChunkResult<Integer> result = writer.writeAll("enrich", items(9), item -> {
            if (item == 4) {
                throw new IllegalStateException("poison");
            }
            written.add(item);
        });

        assertEquals(3, result.chunks());
        assertEquals(1, result.skippedChunks());
        assertEquals(List.of(4, 5, 6), result.skippedItems());
        assertTrue(written.containsAll(List.of(1, 2, 3, 7, 8, 9)));
    }

    @Test
    @DisplayName("Should not retry when the store is unavailable")
    void testStoreUnavailable() {
        int[] calls = {0};

        assertThrows(StoreUnavailableException.class, () -> writer.writeAll("add", items(3), item -> {
            calls[0]++;
            throw new StoreUnavailableException("store down");
        }));
        assertEquals(1, calls[0]);
    }

    @Test
    @DisplayName("Should reject a non-positive chunk size")
    void testChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkedWriter(0));
    }
}
