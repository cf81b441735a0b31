package com.entity.ancestry.relation;

import com.entity.ancestry.core.model.EntityDescriptor;

/**
 * The "is ancestor of" predicate supplied by the embedding environment.
 *
 * <p>Implementations must be reflexive ({@code isAncestorOf(a, a)} holds) and transitive.
 * They need not be total: two siblings may be mutually incomparable.</p>
 */
@FunctionalInterface
public interface SubtypeRelation {

    /**
     * Returns true if {@code ancestor} is {@code descendant} or one of its (transitive) bases.
     */
    boolean isAncestorOf(EntityDescriptor ancestor, EntityDescriptor descendant);

    /**
     * True when {@code ancestor} is above {@code descendant} and the two are distinct.
     */
    default boolean isStrictAncestorOf(EntityDescriptor ancestor, EntityDescriptor descendant) {
        return !ancestor.equals(descendant) && isAncestorOf(ancestor, descendant);
    }

    /**
     * Counter that changes whenever answers of {@link #isAncestorOf} may have changed.
     * Immutable relations keep the default of 0.
     */
    default long revision() {
        return 0L;
    }
}
