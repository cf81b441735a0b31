package com.entity.ancestry.relation;

import com.entity.ancestry.core.model.EntityDescriptor;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Subtype relation backed by an explicit set of direct parent edges.
 *
 * <p>Ancestor closures are computed on first use per entity and memoized. An entity
 * with no declared edges relates only to itself.</p>
 *
 * <pre>
 * SubtypeRelation relation = EdgeSetSubtypeRelation.builder()
 *     .entity("K", "I", "J")
 *     .entity("W", "K")
 *     .build();
 * </pre>
 */
public final class EdgeSetSubtypeRelation implements SubtypeRelation {

    private final Map<EntityDescriptor, Set<EntityDescriptor>> parents;
    private final Map<EntityDescriptor, Set<EntityDescriptor>> closures = new ConcurrentHashMap<>();

    private EdgeSetSubtypeRelation(Map<EntityDescriptor, Set<EntityDescriptor>> parents) {
        this.parents = parents;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean isAncestorOf(EntityDescriptor ancestor, EntityDescriptor descendant) {
        if (ancestor.equals(descendant)) {
            return true;
        }
        return ancestorsOf(descendant).contains(ancestor);
    }

    /**
     * Direct parents of the entity, in declaration order.
     */
    public Set<EntityDescriptor> parentsOf(EntityDescriptor entity) {
        return parents.getOrDefault(entity, Set.of());
    }

    /**
     * All strict ancestors of the entity, closest-first in breadth-first order.
     */
    public Set<EntityDescriptor> ancestorsOf(EntityDescriptor entity) {
        Objects.requireNonNull(entity, "entity is required");
        return closures.computeIfAbsent(entity, this::computeClosure);
    }

    /**
     * Every entity that appears in at least one edge.
     */
    public Set<EntityDescriptor> entities() {
        Set<EntityDescriptor> all = new LinkedHashSet<>(parents.keySet());
        parents.values().forEach(all::addAll);
        return Collections.unmodifiableSet(all);
    }

    private Set<EntityDescriptor> computeClosure(EntityDescriptor entity) {
        Set<EntityDescriptor> visited = new LinkedHashSet<>();
        Deque<EntityDescriptor> pending = new ArrayDeque<>(parentsOf(entity));
        while (!pending.isEmpty()) {
            EntityDescriptor next = pending.removeFirst();
            // cycles collapse onto the visited set
            if (!next.equals(entity) && visited.add(next)) {
                pending.addAll(parentsOf(next));
            }
        }
        return Collections.unmodifiableSet(visited);
    }

    public static class Builder {
        private final Map<EntityDescriptor, Set<EntityDescriptor>> parents = new LinkedHashMap<>();

        /**
         * Declares {@code entity} with the given direct parents. Repeated declarations add edges.
         */
        public Builder entity(EntityDescriptor entity, Collection<EntityDescriptor> directParents) {
            Objects.requireNonNull(entity, "entity is required");
            Objects.requireNonNull(directParents, "directParents is required");
            Set<EntityDescriptor> edges = parents.computeIfAbsent(entity, k -> new LinkedHashSet<>());
            for (EntityDescriptor parent : directParents) {
                edges.add(Objects.requireNonNull(parent, "parent is required"));
            }
            return this;
        }

        public Builder entity(EntityDescriptor entity, EntityDescriptor... directParents) {
            return entity(entity, Arrays.asList(directParents));
        }

        public Builder entity(String entity, String... directParents) {
            return entity(EntityDescriptor.of(entity),
                    Arrays.stream(directParents).map(EntityDescriptor::of).collect(Collectors.toList()));
        }

        public EdgeSetSubtypeRelation build() {
            Map<EntityDescriptor, Set<EntityDescriptor>> frozen = new LinkedHashMap<>();
            parents.forEach((entity, edges) ->
                    frozen.put(entity, Collections.unmodifiableSet(new LinkedHashSet<>(edges))));
            return new EdgeSetSubtypeRelation(Collections.unmodifiableMap(frozen));
        }
    }
}
