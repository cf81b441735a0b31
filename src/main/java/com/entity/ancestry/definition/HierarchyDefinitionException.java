package com.entity.ancestry.definition;

/**
 * Runtime exception thrown when a hierarchy definition cannot be read or is malformed.
 */
public class HierarchyDefinitionException extends RuntimeException {

    public HierarchyDefinitionException(String message) {
        super(message);
    }

    public HierarchyDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
