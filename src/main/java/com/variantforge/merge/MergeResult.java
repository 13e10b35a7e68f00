package com.variantforge.merge;

import java.util.List;

public class MergeResult {

    private final String text;
    private final List<String> identifiers;
    private final List<String> added;
    private final List<String> dropped;
    private final boolean created;

    public MergeResult(String text, List<String> identifiers, List<String> added, List<String> dropped,
                       boolean created) {
        this.text = text;
        this.identifiers = List.copyOf(identifiers);
        this.added = List.copyOf(added);
        this.dropped = List.copyOf(dropped);
        this.created = created;
    }

    public String getText() {
        return text;
    }

    /** Every Entry identifier in the merged document, in order. */
    public List<String> getIdentifiers() {
        return identifiers;
    }

    public List<String> getAdded() {
        return added;
    }

    /** Incoming identifiers that collided with an existing Entry or an earlier incoming one. */
    public List<String> getDropped() {
        return dropped;
    }

    /** True when there was no existing document and a new one was synthesized. */
    public boolean isCreated() {
        return created;
    }
}
