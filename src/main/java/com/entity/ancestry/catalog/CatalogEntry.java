package com.entity.ancestry.catalog;

import com.entity.ancestry.core.model.EntityDescriptor;

/**
 * One registration in a catalog's history.
 *
 * @param sequenceNumber global sequence number drawn for the registration
 * @param entity         the registered entity
 */
public record CatalogEntry(long sequenceNumber, EntityDescriptor entity) {}
