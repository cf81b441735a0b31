package com.entity.ancestry.resolve;

/**
 * How the resolver orders ancestors that the subtype relation leaves incomparable.
 */
public enum ResolutionOrder {

    /**
     * Extract with {@code TypeSet.selectBest}. Siblings come out in fold order, which
     * matches the chains produced by earlier releases.
     */
    FOLD,

    /**
     * Extract the earliest candidate (in snapshot order) that has no remaining strict
     * ancestor. Siblings come out in the order they were registered.
     */
    DECLARATION_STABLE
}
