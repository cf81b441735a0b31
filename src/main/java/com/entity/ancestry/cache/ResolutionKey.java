package com.entity.ancestry.cache;

import com.entity.ancestry.core.model.EntityDescriptor;

import java.util.Objects;

/**
 * Identifies one resolved chain: which resolver produced it, from which catalog version,
 * and under which revision of the subtype relation.
 *
 * @param namespace        the resolver the chain belongs to; caches shared between
 *                         inspectors never mix chains across namespaces
 * @param catalogName      the catalog the chain was resolved against
 * @param entity           the queried entity
 * @param version          the catalog version (sequence number of its newest entry)
 * @param relationRevision {@link com.entity.ancestry.relation.SubtypeRelation#revision()} at resolution time
 */
public record ResolutionKey(
        String namespace,
        String catalogName,
        EntityDescriptor entity,
        long version,
        long relationRevision
) {
    public ResolutionKey {
        Objects.requireNonNull(namespace, "namespace is required");
        Objects.requireNonNull(catalogName, "catalogName is required");
        Objects.requireNonNull(entity, "entity is required");
    }
}
