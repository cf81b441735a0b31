package com.entity.ancestry.dispatch;

import com.entity.ancestry.core.model.EntityDescriptor;

/**
 * Per-ancestor handler invoked with the ancestor being visited and the instance.
 *
 * @param <T> the instance type
 */
@FunctionalInterface
public interface AncestorCallback<T> {

    void accept(EntityDescriptor ancestor, T instance);
}
