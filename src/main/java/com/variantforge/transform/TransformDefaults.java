package com.variantforge.transform;

/**
 * Configured baselines for every request kind. Request overrides are laid on top of these.
 */
public class TransformDefaults {

    public static final String DEFAULT_DETACHED_SUFFIX_A = "_child_variant1";
    public static final String DEFAULT_DETACHED_SUFFIX_B = "_child_variant2";
    public static final String DEFAULT_LINKED_PATH_A = "DATA/variant1.bin";
    public static final String DEFAULT_LINKED_PATH_B = "DATA/variant2.bin";

    private final TransformParams inline;
    private final TransformParams detached;
    private final String linkedPathA;
    private final String linkedPathB;

    public TransformDefaults(TransformParams inline, TransformParams detached, String linkedPathA,
                             String linkedPathB) {
        this.inline = inline;
        this.detached = detached;
        this.linkedPathA = linkedPathA;
        this.linkedPathB = linkedPathB;
    }

    public static TransformDefaults defaults() {
        TransformParams inline = TransformParams.defaults();
        TransformParams detached = inline.toBuilder()
            .suffixes(DEFAULT_DETACHED_SUFFIX_A, DEFAULT_DETACHED_SUFFIX_B)
            .build();
        return new TransformDefaults(inline, detached, DEFAULT_LINKED_PATH_A, DEFAULT_LINKED_PATH_B);
    }

    public TransformParams getInline() {
        return inline;
    }

    public TransformParams getDetached() {
        return detached;
    }

    public String getLinkedPathA() {
        return linkedPathA;
    }

    public String getLinkedPathB() {
        return linkedPathB;
    }
}
