package com.entity.ancestry.cache;

import com.entity.ancestry.catalog.CatalogListener;
import com.entity.ancestry.core.model.AncestorChain;
import com.entity.ancestry.core.model.EntityDescriptor;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed resolution cache with a per-catalog key index.
 * Implements {@link CatalogListener} so that chains resolved against an older
 * version of a catalog are evicted as soon as it grows.
 */
public class CaffeineResolutionCache implements ResolutionCache, CatalogListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<ResolutionKey, AncestorChain> cache;
    // Secondary index: catalog name -> keys resolved against that catalog
    private final ConcurrentMap<String, Set<ResolutionKey>> catalogIndex = new ConcurrentHashMap<>();

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((key, value, cause) -> {
                    if (key instanceof ResolutionKey rk && cause.wasEvicted()) {
                        removeFromIndex(rk);
                    }
                })
                .build();
        log.info("CaffeineResolutionCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<AncestorChain> get(ResolutionKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(ResolutionKey key, AncestorChain chain) {
        cache.put(key, chain);
        catalogIndex.computeIfAbsent(key.catalogName(), k -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void invalidate(String catalogName) {
        Set<ResolutionKey> keys = catalogIndex.remove(catalogName);
        if (keys != null) {
            cache.invalidateAll(keys);
            log.debug("Invalidated {} cached chains for catalog {}", keys.size(), catalogName);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        catalogIndex.clear();
        log.debug("Invalidated all cached chains");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onRegistered(String catalogName, EntityDescriptor entity, long sequenceNumber) {
        invalidate(catalogName);
    }

    private void removeFromIndex(ResolutionKey key) {
        Set<ResolutionKey> keys = catalogIndex.get(key.catalogName());
        if (keys != null) {
            keys.remove(key);
        }
    }
}
