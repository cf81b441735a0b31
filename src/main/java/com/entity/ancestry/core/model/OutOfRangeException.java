package com.entity.ancestry.core.model;

/**
 * Thrown on positional access ({@code at}, {@code front}, {@code back}) outside a
 * {@link TypeSet}'s bounds, including any access on an empty set.
 */
public class OutOfRangeException extends AncestryContractException {

    private final int index;
    private final int size;

    public OutOfRangeException(int index, int size) {
        super(size == 0
                ? "Empty type set access at index " + index
                : "Index " + index + " out of bounds for type set of size " + size);
        this.index = index;
        this.size = size;
    }

    public int getIndex() {
        return index;
    }

    public int getSize() {
        return size;
    }
}
