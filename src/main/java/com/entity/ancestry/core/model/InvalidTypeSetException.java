package com.entity.ancestry.core.model;

/**
 * Thrown when an operation requires a well-formed {@link TypeSet} and receives
 * something else: a {@code null} set, or a {@code null} element.
 */
public class InvalidTypeSetException extends AncestryContractException {

    public InvalidTypeSetException(String message) {
        super(message);
    }
}
