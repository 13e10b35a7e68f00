package com.variantforge.document;

/**
 * Variant status of one Entry, recomputed from its text on every read.
 */
public enum VariantState {
    /** No variant markers. */
    NONE,
    /** SubEntries carry only the A suffix. */
    INLINE_PARTIAL,
    /** SubEntries carry both the A and B suffixes. */
    INLINE_PAIR,
    /** The Entry is a dispatcher referencing detached A/B siblings. */
    DISPATCHER;

    public boolean hasVariantB() {
        return this == INLINE_PAIR || this == DISPATCHER;
    }
}
