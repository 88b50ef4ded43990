package com.civics.ingest.store;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.CrosswalkKey;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.OfficeSlot;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Caches crosswalk lookups of any {@link CanonicalStore} in Caffeine.
 *
 * <p>Only positive lookups are cached, as crosswalk key to canonical id. Upserts invalidate
 * every key the entity held before and after the write.</p>
 */
public class CachingCanonicalStore implements CanonicalStore {
    private static final Logger log = LoggerFactory.getLogger(CachingCanonicalStore.class);

    private final CanonicalStore delegate;
    private final Cache<CrosswalkKey, String> crosswalkCache;

    public CachingCanonicalStore(CanonicalStore delegate, CacheConfig config) {
        this.delegate = delegate;
        this.crosswalkCache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("store.cacheInitialized maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<CanonicalRepresentative> lookupByCrosswalk(Provider source, String externalId) {
        CrosswalkKey key = new CrosswalkKey(source, externalId);
        String cachedId = crosswalkCache.getIfPresent(key);
        if (cachedId != null) {
            Optional<CanonicalRepresentative> hit = delegate.findById(cachedId)
                    .filter(r -> externalId.equals(r.getCrosswalk().get(source)));
            if (hit.isPresent()) {
                return hit;
            }
            crosswalkCache.invalidate(key);
        }
        Optional<CanonicalRepresentative> found = delegate.lookupByCrosswalk(source, externalId);
        found.ifPresent(r -> crosswalkCache.put(key, r.getCanonicalId()));
        return found;
    }

    @Override
    public UpsertOutcome upsert(CanonicalRepresentative representative) {
        delegate.findById(representative.getCanonicalId()).ifPresent(previous -> invalidate(previous.getCrosswalk()));
        UpsertOutcome outcome = delegate.upsert(representative);
        invalidate(representative.getCrosswalk());
        return outcome;
    }

    @Override
    public CanonicalRepresentative applyStatusTransition(String canonicalId, RepresentativeStatus newStatus,
                                                         StatusReason reason, String replacedById, Instant at) {
        return delegate.applyStatusTransition(canonicalId, newStatus, reason, replacedById, at);
    }

    @Override
    public Optional<CanonicalRepresentative> findById(String canonicalId) {
        return delegate.findById(canonicalId);
    }

    @Override
    public List<CanonicalRepresentative> lookupByOfficeSlot(OfficeSlot slot) {
        return delegate.lookupByOfficeSlot(slot);
    }

    @Override
    public List<CanonicalRepresentative> findByJurisdiction(GovernmentLevel level, String jurisdiction) {
        return delegate.findByJurisdiction(level, jurisdiction);
    }

    @Override
    public List<CanonicalRepresentative> findReplacedBy(String canonicalId) {
        return delegate.findReplacedBy(canonicalId);
    }

    @Override
    public List<CanonicalRepresentative> findByStatus(RepresentativeStatus status) {
        return delegate.findByStatus(status);
    }

    @Override
    public List<CanonicalRepresentative> findAll() {
        return delegate.findAll();
    }

    @Override
    public long count() {
        return delegate.count();
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = crosswalkCache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(),
                crosswalkCache.estimatedSize());
    }

    public void invalidateAll() {
        crosswalkCache.invalidateAll();
    }

    private void invalidate(Map<Provider, String> crosswalk) {
        crosswalk.forEach((provider, externalId) -> crosswalkCache.invalidate(new CrosswalkKey(provider, externalId)));
    }
}
