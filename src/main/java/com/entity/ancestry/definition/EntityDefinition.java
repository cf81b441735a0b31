package com.entity.ancestry.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entity of a hierarchy definition and its direct parents.
 *
 * @param name    entity name
 * @param parents names of the direct parents, possibly empty
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("parents") List<String> parents
) {
    public EntityDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("entity name is required");
        }
        parents = parents != null ? List.copyOf(parents) : List.of();
    }
}
