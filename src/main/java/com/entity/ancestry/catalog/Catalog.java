package com.entity.ancestry.catalog;

import com.entity.ancestry.core.model.EntityDescriptor;
import com.entity.ancestry.core.model.TypeSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Append-only, versioned history of one named type set.
 *
 * <p>The history is sparse: it holds the empty set at the declaration point and one
 * entry per registration, keyed by the global sequence number drawn for it. Numbers
 * drawn by other catalogs leave gaps that {@link #snapshot(long)} steps over.</p>
 *
 * <p>Writes go through {@link CatalogRegistry}, which serializes them. Reads are
 * lock-free: each entry is an immutable {@link TypeSet} published atomically.</p>
 */
public final class Catalog {

    private final String name;
    private final long declarationPoint;
    private final ConcurrentSkipListMap<Long, TypeSet> history = new ConcurrentSkipListMap<>();
    private final List<CatalogEntry> entries = Collections.synchronizedList(new ArrayList<>());

    Catalog(String name, long declarationPoint) {
        this.name = name;
        this.declarationPoint = declarationPoint;
        history.put(declarationPoint, TypeSet.empty());
    }

    public String getName() {
        return name;
    }

    public long getDeclarationPoint() {
        return declarationPoint;
    }

    /**
     * Sequence number of the newest history entry.
     */
    public long getVersion() {
        return history.lastKey();
    }

    /**
     * Number of registrations recorded so far.
     */
    public int size() {
        return entries.size();
    }

    /**
     * The type set visible at {@code version}: the nearest history entry at or before it,
     * or the empty set for versions before the declaration point.
     */
    public TypeSet snapshot(long version) {
        if (version < declarationPoint) {
            return TypeSet.empty();
        }
        Map.Entry<Long, TypeSet> entry = history.floorEntry(version);
        return entry != null ? entry.getValue() : TypeSet.empty();
    }

    public TypeSet latest() {
        return history.lastEntry().getValue();
    }

    /**
     * Registrations in sequence order (immutable copy).
     */
    public List<CatalogEntry> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    // caller holds the registry's write lock
    void append(long sequenceNumber, EntityDescriptor entity) {
        if (sequenceNumber <= history.lastKey()) {
            throw new IllegalStateException("Sequence " + sequenceNumber
                    + " does not advance catalog '" + name + "' past " + history.lastKey());
        }
        TypeSet next = latest().pushBack(entity);
        history.put(sequenceNumber, next);
        entries.add(new CatalogEntry(sequenceNumber, entity));
    }

    @Override
    public String toString() {
        return "Catalog{name='" + name + "', declaredAt=" + declarationPoint
                + ", version=" + getVersion() + ", size=" + size() + '}';
    }
}
