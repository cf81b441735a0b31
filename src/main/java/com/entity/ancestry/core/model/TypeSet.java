package com.entity.ancestry.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Immutable, ordered sequence of {@link EntityDescriptor}s.
 *
 * <p>Order is meaningful (it drives tie-breaking in {@link #selectBest}) and duplicates
 * are permitted. Every operation returns a new set and leaves the receiver untouched,
 * so instances can be shared freely across threads.</p>
 *
 * <pre>
 * TypeSet set = TypeSet.of(a, b, a, c);
 * set.dedup();            // [a, b, c]
 * set.removeAll(a);       // [b, c]
 * set.findFirst(c);       // 3
 * </pre>
 */
public final class TypeSet implements Iterable<EntityDescriptor> {

    /**
     * Returned by {@link #findFirst} when the element is absent.
     */
    public static final int NOT_FOUND = -1;

    private static final TypeSet EMPTY = new TypeSet(List.of());

    private final List<EntityDescriptor> elements;

    private TypeSet(List<EntityDescriptor> elements) {
        this.elements = elements;
    }

    // ========== Creation ==========

    public static TypeSet empty() {
        return EMPTY;
    }

    public static TypeSet of(EntityDescriptor... elements) {
        if (elements == null) {
            throw new InvalidTypeSetException("Type set elements must not be null");
        }
        return copyOf(Arrays.asList(elements));
    }

    public static TypeSet copyOf(Collection<EntityDescriptor> elements) {
        if (elements == null) {
            throw new InvalidTypeSetException("Type set elements must not be null");
        }
        List<EntityDescriptor> copy = new ArrayList<>(elements.size());
        int index = 0;
        for (EntityDescriptor element : elements) {
            if (element == null) {
                throw new InvalidTypeSetException("Type set element at index " + index + " is null");
            }
            copy.add(element);
            index++;
        }
        return wrap(copy);
    }

    private static TypeSet wrap(List<EntityDescriptor> owned) {
        return owned.isEmpty() ? EMPTY : new TypeSet(Collections.unmodifiableList(owned));
    }

    /**
     * Rejects a {@code null} type set with {@link InvalidTypeSetException}.
     */
    public static TypeSet requireValid(TypeSet set, String what) {
        if (set == null) {
            throw new InvalidTypeSetException(what + " must be a type set, got null");
        }
        return set;
    }

    private static EntityDescriptor requireElement(EntityDescriptor element) {
        if (element == null) {
            throw new InvalidTypeSetException("Type set elements must not be null");
        }
        return element;
    }

    // ========== Size and positional access ==========

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public EntityDescriptor at(int index) {
        if (index < 0 || index >= elements.size()) {
            throw new OutOfRangeException(index, elements.size());
        }
        return elements.get(index);
    }

    public EntityDescriptor front() {
        return at(0);
    }

    public EntityDescriptor back() {
        return at(elements.size() - 1);
    }

    // ========== Membership ==========

    public boolean contains(EntityDescriptor element) {
        return findFirst(element) != NOT_FOUND;
    }

    /**
     * Returns the zero-based index of the first occurrence, or {@link #NOT_FOUND}.
     */
    public int findFirst(EntityDescriptor element) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i).equals(element)) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    // ========== Structural operations ==========

    public static TypeSet concat(TypeSet first, TypeSet second) {
        requireValid(first, "first");
        requireValid(second, "second");
        if (first.isEmpty()) return second;
        if (second.isEmpty()) return first;
        List<EntityDescriptor> joined = new ArrayList<>(first.size() + second.size());
        joined.addAll(first.elements);
        joined.addAll(second.elements);
        return wrap(joined);
    }

    public TypeSet concat(TypeSet other) {
        return concat(this, other);
    }

    public TypeSet invert() {
        List<EntityDescriptor> reversed = new ArrayList<>(elements);
        Collections.reverse(reversed);
        return wrap(reversed);
    }

    public TypeSet pushFront(EntityDescriptor element) {
        List<EntityDescriptor> copy = new ArrayList<>(elements.size() + 1);
        copy.add(requireElement(element));
        copy.addAll(elements);
        return wrap(copy);
    }

    public TypeSet pushBack(EntityDescriptor element) {
        List<EntityDescriptor> copy = new ArrayList<>(elements.size() + 1);
        copy.addAll(elements);
        copy.add(requireElement(element));
        return wrap(copy);
    }

    /**
     * Drops the first element. Popping an empty set yields the empty set.
     */
    public TypeSet popFront() {
        if (elements.size() <= 1) {
            return EMPTY;
        }
        return wrap(new ArrayList<>(elements.subList(1, elements.size())));
    }

    // ========== Filtering ==========

    /**
     * Deletes every occurrence of {@code element}, keeping the rest in order.
     */
    public TypeSet removeAll(EntityDescriptor element) {
        return filter(e -> !e.equals(element));
    }

    /**
     * Keeps each distinct element at the position of its first appearance.
     */
    public TypeSet dedup() {
        LinkedHashSet<EntityDescriptor> seen = new LinkedHashSet<>(elements);
        if (seen.size() == elements.size()) {
            return this;
        }
        return wrap(new ArrayList<>(seen));
    }

    public TypeSet filter(Predicate<? super EntityDescriptor> predicate) {
        Objects.requireNonNull(predicate, "predicate is required");
        List<EntityDescriptor> kept = new ArrayList<>(elements.size());
        for (EntityDescriptor element : elements) {
            if (predicate.test(element)) {
                kept.add(element);
            }
        }
        if (kept.size() == elements.size()) {
            return this;
        }
        return wrap(kept);
    }

    // ========== Selection ==========

    /**
     * Picks a single "best" element under a pairwise predicate that need not be a total order.
     *
     * <p>The fold runs from the back: the last element is the initial incumbent, and walking
     * toward the front, a candidate {@code e} replaces the incumbent whenever
     * {@code better.test(e, incumbent)} holds. For pairwise incomparable elements the last one
     * therefore wins. This reproduces {@code best([x, ...rest]) = better(x, best(rest)) ? x :
     * best(rest)}.</p>
     *
     * @param better {@code better.test(candidate, incumbent)} is true when candidate should win
     * @throws EmptySelectionException if the set is empty
     */
    public EntityDescriptor selectBest(BiPredicate<? super EntityDescriptor, ? super EntityDescriptor> better) {
        Objects.requireNonNull(better, "comparator is required");
        if (elements.isEmpty()) {
            throw new EmptySelectionException();
        }
        EntityDescriptor best = elements.get(elements.size() - 1);
        for (int i = elements.size() - 2; i >= 0; i--) {
            EntityDescriptor candidate = elements.get(i);
            if (better.test(candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    // ========== Views ==========

    public List<EntityDescriptor> asList() {
        return elements;
    }

    public Stream<EntityDescriptor> stream() {
        return elements.stream();
    }

    @Override
    public Iterator<EntityDescriptor> iterator() {
        return elements.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return elements.equals(((TypeSet) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
