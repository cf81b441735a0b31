package com.entity.ancestry.relation;

import com.entity.ancestry.core.model.EntityDescriptor;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Subtype relation over Java types known to the embedding code.
 *
 * <p>Types are registered explicitly; nothing is discovered through reflection. A
 * descriptor is an ancestor of another when its type is assignable from the other's
 * type, so interfaces model multiple inheritance. Unregistered descriptors relate
 * only to themselves. Each registration that changes the mapping advances
 * {@link #revision()}.</p>
 */
public class JavaTypeSubtypeRelation implements SubtypeRelation {

    private final Map<EntityDescriptor, Class<?>> types = new ConcurrentHashMap<>();
    private final AtomicLong revision = new AtomicLong();

    /**
     * Registers a type and returns its descriptor.
     */
    public EntityDescriptor register(Class<?> type) {
        EntityDescriptor descriptor = EntityDescriptor.forType(type);
        Class<?> previous = types.put(descriptor, type);
        if (previous != type) {
            revision.incrementAndGet();
        }
        return descriptor;
    }

    @Override
    public long revision() {
        return revision.get();
    }

    public Optional<Class<?>> typeOf(EntityDescriptor descriptor) {
        return Optional.ofNullable(types.get(descriptor));
    }

    @Override
    public boolean isAncestorOf(EntityDescriptor ancestor, EntityDescriptor descendant) {
        if (Objects.equals(ancestor, descendant)) {
            return true;
        }
        Class<?> ancestorType = types.get(ancestor);
        Class<?> descendantType = types.get(descendant);
        return ancestorType != null && descendantType != null
                && ancestorType.isAssignableFrom(descendantType);
    }
}
