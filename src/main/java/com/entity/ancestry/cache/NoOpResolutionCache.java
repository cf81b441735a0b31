package com.entity.ancestry.cache;

import com.entity.ancestry.core.model.AncestorChain;

import java.util.Optional;

/**
 * No-op cache. Used as the default when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<AncestorChain> get(ResolutionKey key) {
        return Optional.empty();
    }

    @Override
    public void put(ResolutionKey key, AncestorChain chain) {
        // no-op
    }

    @Override
    public void invalidate(String catalogName) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
