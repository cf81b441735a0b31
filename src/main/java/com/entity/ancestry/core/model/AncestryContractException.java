package com.entity.ancestry.core.model;

/**
 * Base class for programmer-contract violations detected by the library.
 * These are deterministic and raised synchronously; nothing is retried.
 */
public abstract class AncestryContractException extends RuntimeException {

    protected AncestryContractException(String message) {
        super(message);
    }

    protected AncestryContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
