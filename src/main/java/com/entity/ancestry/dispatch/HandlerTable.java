package com.entity.ancestry.dispatch;

import com.entity.ancestry.core.model.AncestorChain;
import com.entity.ancestry.core.model.EntityDescriptor;
import com.entity.ancestry.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Visitor table mapping ancestor descriptors to handlers.
 *
 * <p>{@link #dispatch} visits every ancestor of a chain in order and runs the handler
 * registered for it. Ancestors without a handler go to the fallback when one is set
 * and are skipped otherwise.</p>
 *
 * <pre>
 * HandlerTable&lt;Object&gt; table = new HandlerTable&lt;&gt;();
 * table.registerShaped(shapeDescriptor, Shape.class, (d, shape) -&gt; shape.area());
 * table.dispatch(chain, circle);
 * </pre>
 *
 * @param <T> the instance type handed to handlers
 */
public class HandlerTable<T> {
    private static final Logger log = LoggerFactory.getLogger(HandlerTable.class);

    private final Map<EntityDescriptor, AncestorCallback<? super T>> handlers = new ConcurrentHashMap<>();
    private volatile AncestorCallback<? super T> fallback;

    public HandlerTable<T> register(EntityDescriptor ancestor, AncestorCallback<? super T> handler) {
        Objects.requireNonNull(ancestor, "ancestor is required");
        Objects.requireNonNull(handler, "handler is required");
        handlers.put(ancestor, handler);
        return this;
    }

    /**
     * Registers a handler that receives the instance cast to the ancestor's Java shape.
     * A failed cast surfaces as {@link ClassCastException} during dispatch.
     */
    public <S> HandlerTable<T> registerShaped(EntityDescriptor ancestor, Class<S> shape,
                                              BiConsumer<EntityDescriptor, ? super S> handler) {
        Objects.requireNonNull(shape, "shape is required");
        Objects.requireNonNull(handler, "handler is required");
        return register(ancestor, (descriptor, instance) -> handler.accept(descriptor, shape.cast(instance)));
    }

    public HandlerTable<T> fallback(AncestorCallback<? super T> fallback) {
        this.fallback = fallback;
        return this;
    }

    public Optional<AncestorCallback<? super T>> handlerFor(EntityDescriptor ancestor) {
        return Optional.ofNullable(handlers.get(ancestor));
    }

    /**
     * Runs the handlers for every ancestor in the chain.
     *
     * @return the number of handlers invoked
     */
    public int dispatch(AncestorChain chain, T instance) {
        Objects.requireNonNull(chain, "chain is required");
        try (LogContext ctx = LogContext.forDispatch(chain.getQueried().getName())) {
            int[] invoked = {0};
            DispatchIterator.forEach(chain, instance, (ancestor, value) -> {
                AncestorCallback<? super T> handler = handlers.getOrDefault(ancestor, fallback);
                if (handler != null) {
                    handler.accept(ancestor, value);
                    invoked[0]++;
                } else {
                    log.trace("dispatch.skipped ancestor={}", ancestor);
                }
            });
            log.debug("dispatch.completed entity={} ancestors={} invoked={}",
                    chain.getQueried(), chain.size(), invoked[0]);
            return invoked[0];
        }
    }

    public int size() {
        return handlers.size();
    }
}
