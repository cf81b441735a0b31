package com.entity.ancestry.cache;

import com.entity.ancestry.core.model.AncestorChain;

import java.util.Optional;

/**
 * Cache of resolved ancestor chains.
 *
 * <p>Entries are keyed by {@link ResolutionKey}. Catalog history never changes once
 * written, so an entry for a given key stays correct; invalidation only reclaims memory.</p>
 */
public interface ResolutionCache {

    /**
     * @return the cached chain, or empty if not cached
     */
    Optional<AncestorChain> get(ResolutionKey key);

    void put(ResolutionKey key, AncestorChain chain);

    /**
     * Drops every entry of the given catalog, across all namespaces.
     */
    void invalidate(String catalogName);

    void invalidateAll();

    CacheStats getStats();
}
