package com.entity.ancestry.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Reads {@link HierarchyDefinition}s from JSON with Jackson.
 */
public class HierarchyDefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(HierarchyDefinitionLoader.class);

    private final ObjectMapper objectMapper;

    public HierarchyDefinitionLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public HierarchyDefinitionLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public HierarchyDefinition load(InputStream input) {
        if (input == null) {
            throw new HierarchyDefinitionException("Hierarchy definition input is missing");
        }
        return load(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    public HierarchyDefinition load(Reader reader) {
        try (Reader r = reader) {
            HierarchyDefinition definition = objectMapper.readValue(r, HierarchyDefinition.class);
            if (definition == null) {
                throw new HierarchyDefinitionException("Hierarchy definition is empty");
            }
            log.debug("definition.loaded entities={} catalogs={}",
                    definition.entities().size(), definition.catalogs().keySet());
            return definition;
        } catch (JsonProcessingException e) {
            throw new HierarchyDefinitionException("Malformed hierarchy definition: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new HierarchyDefinitionException("Failed to read hierarchy definition", e);
        }
    }

    /**
     * Loads a definition from a classpath resource.
     */
    public HierarchyDefinition loadResource(String resourcePath) {
        InputStream input = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath);
        if (input == null) {
            throw new HierarchyDefinitionException("Hierarchy definition resource not found: " + resourcePath);
        }
        return load(input);
    }
}
