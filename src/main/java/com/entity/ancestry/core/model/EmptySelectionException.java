package com.entity.ancestry.core.model;

/**
 * Thrown when {@link TypeSet#selectBest} is asked to choose from an empty set.
 */
public class EmptySelectionException extends AncestryContractException {

    public EmptySelectionException() {
        super("Cannot select the best element of an empty type set");
    }
}
