package com.entity.ancestry.core.model;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered strict ancestors of a queried entity, most ancient first.
 *
 * The queried entity itself is never part of the chain; {@link #withQueried()}
 * returns the inclusive lineage for callers that want it appended.
 */
public final class AncestorChain implements Iterable<EntityDescriptor> {

    private final EntityDescriptor queried;
    private final TypeSet ancestors;

    private AncestorChain(EntityDescriptor queried, TypeSet ancestors) {
        this.queried = Objects.requireNonNull(queried, "queried is required");
        this.ancestors = TypeSet.requireValid(ancestors, "ancestors");
        if (ancestors.contains(queried)) {
            throw new IllegalArgumentException("Ancestor chain of " + queried + " must not contain it");
        }
    }

    public static AncestorChain of(EntityDescriptor queried, TypeSet ancestors) {
        return new AncestorChain(queried, ancestors);
    }

    public static AncestorChain empty(EntityDescriptor queried) {
        return new AncestorChain(queried, TypeSet.empty());
    }

    public EntityDescriptor getQueried() {
        return queried;
    }

    public TypeSet getAncestors() {
        return ancestors;
    }

    /**
     * Ancestors followed by the queried entity.
     */
    public TypeSet withQueried() {
        return ancestors.pushBack(queried);
    }

    public int size() {
        return ancestors.size();
    }

    public boolean isEmpty() {
        return ancestors.isEmpty();
    }

    public boolean contains(EntityDescriptor descriptor) {
        return ancestors.contains(descriptor);
    }

    public List<EntityDescriptor> asList() {
        return ancestors.asList();
    }

    @Override
    public Iterator<EntityDescriptor> iterator() {
        return ancestors.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AncestorChain that = (AncestorChain) o;
        return queried.equals(that.queried) && ancestors.equals(that.ancestors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queried, ancestors);
    }

    @Override
    public String toString() {
        return "AncestorChain{" + queried + " <- " + ancestors + '}';
    }
}
