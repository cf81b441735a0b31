package com.entity.ancestry.catalog;

import com.entity.ancestry.core.model.EntityDescriptor;
import com.entity.ancestry.core.model.TypeSet;
import com.entity.ancestry.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Named catalogs sharing one monotonic {@link SequenceGenerator}.
 *
 * <p>{@link #declare} and {@link #register} run under a single lock so that drawing a
 * sequence number and appending the history entry happen as one step, giving all
 * catalogs one total order of entries. Snapshots do not take the lock.</p>
 *
 * <pre>
 * CatalogRegistry registry = new CatalogRegistry();
 * registry.declare("shapes");
 * long v1 = registry.register("shapes", EntityDescriptor.of("Circle"));
 * registry.register("shapes", EntityDescriptor.of("Shape"));
 *
 * registry.snapshot("shapes", v1);    // [Circle]
 * registry.snapshotLatest("shapes");  // [Circle, Shape]
 * </pre>
 */
public class CatalogRegistry {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistry.class);

    private final SequenceGenerator sequence;
    private final Map<String, Catalog> catalogs = new ConcurrentHashMap<>();
    private final List<CatalogListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * Creates a registry numbering its entries with {@link SequenceGenerator#global()}.
     */
    public CatalogRegistry() {
        this(SequenceGenerator.global());
    }

    public CatalogRegistry(SequenceGenerator sequence) {
        this.sequence = Objects.requireNonNull(sequence, "sequence is required");
    }

    public void addListener(CatalogListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public void removeListener(CatalogListener listener) {
        listeners.remove(listener);
    }

    // ========== Writes ==========

    /**
     * Declares a catalog at the next sequence position with an empty type set.
     *
     * @return the declaration point
     * @throws DuplicateDeclarationException if the name is already declared
     */
    public long declare(String name) {
        requireName(name);
        writeLock.lock();
        try {
            if (catalogs.containsKey(name)) {
                throw new DuplicateDeclarationException(name);
            }
            long declarationPoint = sequence.next();
            catalogs.put(name, new Catalog(name, declarationPoint));
            log.info("catalog.declared catalog={} declarationPoint={}", name, declarationPoint);
            return declarationPoint;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Appends an entity to a catalog.
     *
     * @return the global sequence number of the new history entry
     * @throws UnknownCatalogException if the name was never declared
     */
    public long register(String name, EntityDescriptor entity) {
        Objects.requireNonNull(entity, "entity is required");
        Catalog catalog = require(name);

        long sequenceNumber;
        try (LogContext ctx = LogContext.forRegistration(name)) {
            writeLock.lock();
            try {
                sequenceNumber = sequence.next();
                catalog.append(sequenceNumber, entity);
            } finally {
                writeLock.unlock();
            }
            log.debug("catalog.registered catalog={} entity={} sequence={}", name, entity, sequenceNumber);
        }

        for (CatalogListener listener : listeners) {
            listener.onRegistered(name, entity, sequenceNumber);
        }
        return sequenceNumber;
    }

    // ========== Reads ==========

    /**
     * Reconstructs the catalog's type set as of {@code version}.
     */
    public TypeSet snapshot(String name, long version) {
        return require(name).snapshot(version);
    }

    public TypeSet snapshotLatest(String name) {
        return snapshot(name, sequence.current());
    }

    public boolean containsLatest(EntityDescriptor entity, String name) {
        return snapshotLatest(name).contains(entity);
    }

    public boolean isDeclared(String name) {
        return name != null && catalogs.containsKey(name);
    }

    public Optional<Catalog> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(catalogs.get(name));
    }

    /**
     * Returns the declared catalog.
     *
     * @throws UnknownCatalogException if the name was never declared
     */
    public Catalog require(String name) {
        requireName(name);
        Catalog catalog = catalogs.get(name);
        if (catalog == null) {
            throw new UnknownCatalogException(name);
        }
        return catalog;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(catalogs.keySet());
    }

    /**
     * The most recent global sequence number.
     */
    public long currentVersion() {
        return sequence.current();
    }

    private static void requireName(String name) {
        Objects.requireNonNull(name, "catalog name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("catalog name must not be blank");
        }
    }
}
