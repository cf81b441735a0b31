package com.entity.ancestry.api;

import com.entity.ancestry.cache.CacheStats;
import com.entity.ancestry.cache.CaffeineResolutionCache;
import com.entity.ancestry.cache.CacheConfig;
import com.entity.ancestry.cache.NoOpResolutionCache;
import com.entity.ancestry.cache.ResolutionCache;
import com.entity.ancestry.cache.ResolutionKey;
import com.entity.ancestry.catalog.Catalog;
import com.entity.ancestry.catalog.CatalogListener;
import com.entity.ancestry.catalog.CatalogRegistry;
import com.entity.ancestry.catalog.SequenceGenerator;
import com.entity.ancestry.core.model.AncestorChain;
import com.entity.ancestry.core.model.EntityDescriptor;
import com.entity.ancestry.core.model.TypeSet;
import com.entity.ancestry.dispatch.AncestorCallback;
import com.entity.ancestry.dispatch.DispatchIterator;
import com.entity.ancestry.dispatch.HandlerTable;
import com.entity.ancestry.logging.LogContext;
import com.entity.ancestry.metrics.MetricsService;
import com.entity.ancestry.metrics.NoOpMetricsService;
import com.entity.ancestry.relation.SubtypeRelation;
import com.entity.ancestry.resolve.AncestorResolver;
import com.entity.ancestry.resolve.ResolutionOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Main entry point of the library: catalogs, ancestor resolution and per-ancestor dispatch.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * HierarchyInspector inspector = HierarchyInspector.builder()
 *     .subtypeRelation(relation)
 *     .build();
 *
 * inspector.declareCatalog("shapes");
 * inspector.register("shapes", shape);
 * inspector.register("shapes", circle);
 *
 * AncestorChain chain = inspector.resolveAncestors(circle, "shapes");   // [shape]
 * inspector.forEachAncestor(instance, chain, (ancestor, value) -&gt; render(ancestor, value));
 * </pre>
 *
 * <p>The subtype relation is supplied by the embedding code; see
 * {@link com.entity.ancestry.relation.EdgeSetSubtypeRelation} and
 * {@link com.entity.ancestry.relation.JavaTypeSubtypeRelation}.</p>
 *
 * <p>Cached chains are keyed by this inspector's own namespace and by the relation's
 * {@link SubtypeRelation#revision()}, so a cache shared between inspectors never hands
 * out a chain computed under another resolution order or an older relation.
 * {@link #close()} detaches the cache from the registry.</p>
 */
public class HierarchyInspector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HierarchyInspector.class);

    private final CatalogRegistry registry;
    private final SubtypeRelation relation;
    private final AncestorResolver resolver;
    private final ResolutionCache cache;
    private final String cacheNamespace;
    private final boolean ownsCache;
    private final MetricsService metricsService;

    private HierarchyInspector(Builder builder) {
        this.registry = builder.registry != null
                ? builder.registry
                : new CatalogRegistry(builder.sequence != null ? builder.sequence : SequenceGenerator.global());
        this.relation = builder.relation;
        this.resolver = new AncestorResolver(builder.relation, builder.order);
        this.cacheNamespace = builder.order.name() + "/" + UUID.randomUUID();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        this.ownsCache = builder.cache == null;
        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            this.cache = new CaffeineResolutionCache(builder.cacheConfig);
        } else {
            this.cache = new NoOpResolutionCache();
        }

        // Evict stale chains as catalogs grow
        if (cache instanceof CatalogListener listener) {
            registry.addListener(listener);
        }

        log.info("HierarchyInspector initialized: order={}, cache={}",
                builder.order, cache.getClass().getSimpleName());
    }

    // ========== Catalog API ==========

    /**
     * Declares an empty catalog at the current sequence position.
     *
     * @return the declaration point
     */
    public long declareCatalog(String name) {
        return registry.declare(name);
    }

    /**
     * Appends an entity to a declared catalog.
     *
     * @return the global sequence number of the registration
     */
    public long register(String name, EntityDescriptor entity) {
        long sequenceNumber = registry.register(name, entity);
        metricsService.incrementRegistration(name);
        return sequenceNumber;
    }

    /**
     * Registers entities in order.
     *
     * @return the sequence number of the last registration, or the catalog's
     * current version when nothing was given
     */
    public long registerAll(String name, EntityDescriptor... entities) {
        return registerAll(name, Arrays.asList(entities));
    }

    public long registerAll(String name, List<EntityDescriptor> entities) {
        long last = registry.require(name).getVersion();
        for (EntityDescriptor entity : entities) {
            last = register(name, entity);
        }
        return last;
    }

    public TypeSet snapshot(String name, long version) {
        return registry.snapshot(name, version);
    }

    public TypeSet snapshotLatest(String name) {
        return registry.snapshotLatest(name);
    }

    public boolean containsLatest(EntityDescriptor entity, String name) {
        return registry.containsLatest(entity, name);
    }

    public long currentVersion() {
        return registry.currentVersion();
    }

    // ========== Resolution API ==========

    /**
     * Resolves the strict ancestors of {@code entity} among the latest members of a catalog.
     */
    public AncestorChain resolveAncestors(EntityDescriptor entity, String name) {
        Objects.requireNonNull(entity, "entity is required");
        Catalog catalog = registry.require(name);
        long version = catalog.getVersion();

        ResolutionKey key = new ResolutionKey(cacheNamespace, name, entity, version, relation.revision());
        Optional<AncestorChain> cached = cache.get(key);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();

        AncestorChain chain = resolve(entity, name, version, catalog.snapshot(version));
        cache.put(key, chain);
        return chain;
    }

    /**
     * Resolves against the catalog as it was at {@code version}.
     */
    public AncestorChain resolveAncestorsAt(EntityDescriptor entity, String name, long version) {
        Objects.requireNonNull(entity, "entity is required");
        return resolve(entity, name, version, registry.snapshot(name, version));
    }

    /**
     * Ancestors followed by the entity itself.
     */
    public TypeSet resolveLineage(EntityDescriptor entity, String name) {
        return resolveAncestors(entity, name).withQueried();
    }

    private AncestorChain resolve(EntityDescriptor entity, String name, long version, TypeSet snapshot) {
        try (LogContext ctx = LogContext.forResolution(
                LogContext.generateCorrelationId(), name, entity.getName())
                .with("version", String.valueOf(version))) {
            long start = System.nanoTime();
            AncestorChain chain = resolver.resolve(entity, snapshot);
            metricsService.recordResolutionDuration(name, Duration.ofNanos(System.nanoTime() - start));
            metricsService.recordChainLength(chain.size());
            log.debug("entity.resolved catalog={} entity={} ancestors={}", name, entity, chain.size());
            return chain;
        }
    }

    // ========== Dispatch API ==========

    /**
     * Invokes {@code callback} for each ancestor of the chain, in order.
     * Exceptions from the callback propagate.
     *
     * @return the number of invocations
     */
    public <T> int forEachAncestor(T instance, AncestorChain chain, AncestorCallback<? super T> callback) {
        int invoked = DispatchIterator.forEach(chain, instance, callback);
        metricsService.recordDispatchInvocations(invoked);
        return invoked;
    }

    /**
     * Resolves {@code entity} in a catalog and runs the table's handlers for the instance.
     *
     * @return the number of handlers invoked
     */
    public <T> int dispatch(EntityDescriptor entity, String name, T instance, HandlerTable<T> handlers) {
        Objects.requireNonNull(handlers, "handlers is required");
        AncestorChain chain = resolveAncestors(entity, name);
        int invoked = handlers.dispatch(chain, instance);
        metricsService.recordDispatchInvocations(invoked);
        return invoked;
    }

    /**
     * Detaches the cache from the registry and, when the cache was built by this
     * inspector, drops its chains. The registry and a cache supplied through the
     * builder stay usable by other inspectors.
     */
    @Override
    public void close() {
        if (cache instanceof CatalogListener listener) {
            registry.removeListener(listener);
        }
        if (ownsCache) {
            cache.invalidateAll();
        }
        log.debug("HierarchyInspector closed: namespace={}", cacheNamespace);
    }

    // ========== Accessors ==========

    public CatalogRegistry getRegistry() {
        return registry;
    }

    public AncestorResolver getResolver() {
        return resolver;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SubtypeRelation relation;
        private ResolutionOrder order = ResolutionOrder.FOLD;
        private CatalogRegistry registry;
        private SequenceGenerator sequence;
        private ResolutionCache cache;
        private CacheConfig cacheConfig;
        private MetricsService metricsService;

        /**
         * The "is ancestor of" relation of the embedding environment. Required.
         */
        public Builder subtypeRelation(SubtypeRelation relation) {
            this.relation = relation;
            return this;
        }

        public Builder resolutionOrder(ResolutionOrder order) {
            this.order = order;
            return this;
        }

        /**
         * Shares an existing registry. Takes precedence over {@link #sequenceGenerator}.
         */
        public Builder catalogRegistry(CatalogRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Numbers a new registry with a private generator instead of the global one.
         */
        public Builder sequenceGenerator(SequenceGenerator sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder resolutionCache(ResolutionCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Builds a Caffeine cache from the config unless a cache instance was given.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public HierarchyInspector build() {
            Objects.requireNonNull(relation, "subtypeRelation is required");
            Objects.requireNonNull(order, "resolutionOrder is required");
            return new HierarchyInspector(this);
        }
    }
}
