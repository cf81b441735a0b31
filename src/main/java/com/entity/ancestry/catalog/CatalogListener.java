package com.entity.ancestry.catalog;

import com.entity.ancestry.core.model.EntityDescriptor;

/**
 * Callback notified after an entity is appended to a catalog.
 * Listeners run on the registering thread, after the registration is visible.
 */
@FunctionalInterface
public interface CatalogListener {

    void onRegistered(String catalogName, EntityDescriptor entity, long sequenceNumber);
}
