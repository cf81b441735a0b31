package com.entity.ancestry.core.model;

import java.util.Objects;

/**
 * Opaque, immutable identifier of a node in one or more subtype hierarchies.
 *
 * Descriptors are compared, hashed and ordered by name only. Whatever the name
 * denotes (a class, a schema type, a taxonomy term) is up to the embedding code.
 */
public final class EntityDescriptor implements Comparable<EntityDescriptor> {

    private final String name;

    private EntityDescriptor(String name) {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
    }

    /**
     * Creates a descriptor for the given name.
     */
    public static EntityDescriptor of(String name) {
        return new EntityDescriptor(name);
    }

    /**
     * Creates a descriptor named after a Java type's binary name.
     */
    public static EntityDescriptor forType(Class<?> type) {
        Objects.requireNonNull(type, "type is required");
        return new EntityDescriptor(type.getName());
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(EntityDescriptor other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityDescriptor that = (EntityDescriptor) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
