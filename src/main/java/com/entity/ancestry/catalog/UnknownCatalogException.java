package com.entity.ancestry.catalog;

import com.entity.ancestry.core.model.AncestryContractException;

/**
 * Thrown when a catalog name is used before it was declared.
 */
public class UnknownCatalogException extends AncestryContractException {

    private final String catalogName;

    public UnknownCatalogException(String catalogName) {
        super("Catalog '" + catalogName + "' has not been declared");
        this.catalogName = catalogName;
    }

    public String getCatalogName() {
        return catalogName;
    }
}
