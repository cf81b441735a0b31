package com.entity.ancestry.definition;

import com.entity.ancestry.api.HierarchyInspector;
import com.entity.ancestry.core.model.EntityDescriptor;
import com.entity.ancestry.relation.EdgeSetSubtypeRelation;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Declarative description of a hierarchy and the catalogs registered over it.
 *
 * <pre>
 * {
 *   "entities": [ {"name": "K", "parents": ["I", "J"]} ],
 *   "catalogs": { "CAT": ["I", "J", "K"] }
 * }
 * </pre>
 *
 * @param entities entity edges
 * @param catalogs catalog name to registration order; document order is kept
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HierarchyDefinition(
        @JsonProperty("entities") List<EntityDefinition> entities,
        @JsonProperty("catalogs") Map<String, List<String>> catalogs
) {
    private static final Logger log = LoggerFactory.getLogger(HierarchyDefinition.class);

    public HierarchyDefinition {
        entities = entities != null ? List.copyOf(entities) : List.of();
        Map<String, List<String>> ordered = new LinkedHashMap<>();
        if (catalogs != null) {
            catalogs.forEach((name, members) ->
                    ordered.put(name, members != null ? List.copyOf(members) : List.of()));
        }
        catalogs = Collections.unmodifiableMap(ordered);
    }

    /**
     * Builds the subtype relation described by the entity edges.
     */
    public EdgeSetSubtypeRelation toRelation() {
        EdgeSetSubtypeRelation.Builder builder = EdgeSetSubtypeRelation.builder();
        for (EntityDefinition entity : entities) {
            builder.entity(EntityDescriptor.of(entity.name()),
                    entity.parents().stream().map(EntityDescriptor::of).collect(Collectors.toList()));
        }
        return builder.build();
    }

    /**
     * Declares every catalog on the inspector and registers its members in order.
     */
    public void applyTo(HierarchyInspector inspector) {
        catalogs.forEach((name, members) -> {
            inspector.declareCatalog(name);
            for (String member : members) {
                inspector.register(name, EntityDescriptor.of(member));
            }
            log.info("definition.applied catalog={} registrations={}", name, members.size());
        });
    }
}
