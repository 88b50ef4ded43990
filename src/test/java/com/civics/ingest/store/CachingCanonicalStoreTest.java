package com.civics.ingest.store;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.Provider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.civics.ingest.support.Fixtures.representative;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingCanonicalStoreTest {

    @Spy
    private InMemoryCanonicalStore delegate = new InMemoryCanonicalStore();

    private CachingCanonicalStore store;

    @BeforeEach
    void setUp() {
        store = new CachingCanonicalStore(delegate, new CacheConfig(100, 300, true));
    }

    @Test
    @DisplayName("Should serve repeated crosswalk lookups from the cache")
    void testCacheHit() {
        store.upsert(representative("c-1", "Jane Doe", "CA", "12", "D000001").build());

        store.lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001");
        Optional<CanonicalRepresentative> second = store.lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001");

        assertEquals("c-1", second.orElseThrow().getCanonicalId());
        verify(delegate, times(1)).lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001");
        assertEquals(1, store.getStats().hitCount());
        assertEquals(0.5, store.getStats().hitRate(), 0.001);
    }

    @Test
    @DisplayName("Should not cache misses")
    void testMissNotCached() {
        assertTrue(store.lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001").isEmpty());
        store.upsert(representative("c-1", "Jane Doe", "CA", "12", "D000001").build());

        assertTrue(store.lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001").isPresent());
    }

    @Test
    @DisplayName("Should drop a cached key when its entity releases it")
    void testInvalidateOnUpsert() {
        CanonicalRepresentative rep = representative("c-1", "Jane Doe", "CA", "12", "D000001").build();
        store.upsert(rep);
        store.lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001");

        store.upsert(rep.toBuilder().removeCrosswalk(Provider.FEDERAL_ROSTER).build());

        assertTrue(store.lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001").isEmpty());
    }

    @Test
    @DisplayName("Should clear the cache on demand")
    void testInvalidateAll() {
        store.upsert(representative("c-1", "Jane Doe", "CA", "12", "D000001").build());
        store.lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001");

        store.invalidateAll();
        store.lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001");

        verify(delegate, times(2)).lookupByCrosswalk(Provider.FEDERAL_ROSTER, "D000001");
    }
}
