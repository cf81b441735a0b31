package com.entity.ancestry.catalog;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic sequence shared by every catalog of a registry.
 *
 * <p>{@link #global()} is the process-wide instance used by default, so registrations
 * to unrelated catalogs interleave in one numbering. Tests and isolated embeddings can
 * create their own generator.</p>
 */
public final class SequenceGenerator {

    private static final SequenceGenerator GLOBAL = new SequenceGenerator();

    private final AtomicLong counter = new AtomicLong();

    public static SequenceGenerator global() {
        return GLOBAL;
    }

    /**
     * Draws the next sequence number.
     */
    public long next() {
        return counter.incrementAndGet();
    }

    /**
     * The most recently drawn number, or 0 if none was drawn yet.
     */
    public long current() {
        return counter.get();
    }
}
