package com.entity.ancestry.dispatch;

import com.entity.ancestry.core.model.AncestorChain;
import com.entity.ancestry.core.model.EntityDescriptor;

import java.util.Objects;

/**
 * Walks an {@link AncestorChain} in order and invokes a callback for each ancestor.
 * Exceptions thrown by the callback propagate to the caller and stop the walk.
 */
public final class DispatchIterator {

    private DispatchIterator() {
    }

    /**
     * @return the number of callback invocations
     */
    public static <T> int forEach(AncestorChain chain, T instance, AncestorCallback<? super T> callback) {
        Objects.requireNonNull(chain, "chain is required");
        Objects.requireNonNull(callback, "callback is required");
        int invoked = 0;
        for (EntityDescriptor ancestor : chain) {
            callback.accept(ancestor, instance);
            invoked++;
        }
        return invoked;
    }
}
