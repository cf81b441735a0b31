package com.entity.ancestry.resolve;

import com.entity.ancestry.core.model.AncestorChain;
import com.entity.ancestry.core.model.EntityDescriptor;
import com.entity.ancestry.core.model.TypeSet;
import com.entity.ancestry.relation.SubtypeRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computes the strict ancestors of an entity among the members of a snapshot.
 *
 * <p>Candidates are the snapshot members (other than the queried entity) that the
 * relation places above it. They are then extracted one at a time, most ancestral
 * first, and every occurrence of an extracted element is dropped, so the resulting
 * chain holds no duplicates.</p>
 *
 * <p>Stateless and thread-safe as long as the supplied relation is.</p>
 */
public class AncestorResolver {
    private static final Logger log = LoggerFactory.getLogger(AncestorResolver.class);

    private final SubtypeRelation relation;
    private final ResolutionOrder order;

    public AncestorResolver(SubtypeRelation relation) {
        this(relation, ResolutionOrder.FOLD);
    }

    public AncestorResolver(SubtypeRelation relation, ResolutionOrder order) {
        this.relation = Objects.requireNonNull(relation, "relation is required");
        this.order = Objects.requireNonNull(order, "order is required");
    }

    public ResolutionOrder getOrder() {
        return order;
    }

    /**
     * Resolves the ancestor chain of {@code queried} restricted to {@code snapshot}.
     * The queried entity need not be a member of the snapshot.
     */
    public AncestorChain resolve(EntityDescriptor queried, TypeSet snapshot) {
        Objects.requireNonNull(queried, "queried is required");
        TypeSet.requireValid(snapshot, "snapshot");

        TypeSet candidates = snapshot.removeAll(queried)
                .filter(d -> relation.isAncestorOf(d, queried));

        TypeSet chain = TypeSet.empty();
        while (!candidates.isEmpty()) {
            EntityDescriptor next = order == ResolutionOrder.FOLD
                    ? candidates.selectBest(relation::isAncestorOf)
                    : firstUndominated(candidates);
            chain = chain.pushBack(next);
            candidates = candidates.removeAll(next);
        }

        log.debug("ancestors.resolved entity={} snapshotSize={} chain={}", queried, snapshot.size(), chain);
        return AncestorChain.of(queried, chain);
    }

    private EntityDescriptor firstUndominated(TypeSet candidates) {
        for (EntityDescriptor candidate : candidates) {
            boolean dominated = candidates.stream()
                    .anyMatch(other -> relation.isStrictAncestorOf(other, candidate)
                            && !relation.isAncestorOf(candidate, other));
            if (!dominated) {
                return candidate;
            }
        }
        // only reachable when the relation is cyclic
        return candidates.front();
    }
}
