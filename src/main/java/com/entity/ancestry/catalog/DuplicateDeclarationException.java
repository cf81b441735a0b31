package com.entity.ancestry.catalog;

import com.entity.ancestry.core.model.AncestryContractException;

/**
 * Thrown when a catalog name is declared a second time.
 */
public class DuplicateDeclarationException extends AncestryContractException {

    private final String catalogName;

    public DuplicateDeclarationException(String catalogName) {
        super("Catalog '" + catalogName + "' is already declared");
        this.catalogName = catalogName;
    }

    public String getCatalogName() {
        return catalogName;
    }
}
